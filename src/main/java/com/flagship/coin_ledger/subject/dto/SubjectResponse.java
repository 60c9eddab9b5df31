package com.flagship.coin_ledger.subject.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.coin_ledger.subject.ModeratedSubject;
import com.flagship.coin_ledger.subject.SubjectKind;
import com.flagship.coin_ledger.subject.SubjectStatus;
import com.flagship.coin_ledger.subject.TargetResponse;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * JSON view of any moderated subject. Variant fields that do not apply are omitted.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SubjectResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("kind")
    SubjectKind kind;

    @JsonProperty("owner_account_id")
    UUID ownerAccountId;

    @JsonProperty("status")
    SubjectStatus status;

    @JsonProperty("coin_cost")
    long coinCost;

    @JsonProperty("refund_applied")
    boolean refundApplied;

    @JsonProperty("title")
    String title;

    @JsonProperty("body")
    String body;

    @JsonProperty("target_account_id")
    UUID targetAccountId;

    @JsonProperty("related_post_id")
    UUID relatedPostId;

    @JsonProperty("target_response")
    TargetResponse targetResponse;

    @JsonProperty("amount_mvr")
    BigDecimal amountMvr;

    @JsonProperty("price_per_coin")
    BigDecimal pricePerCoin;

    @JsonProperty("slip_path")
    String slipPath;

    @JsonProperty("computed_coins")
    Long computedCoins;

    @JsonProperty("admin_note")
    String adminNote;

    @JsonProperty("decided_at")
    Instant decidedAt;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static SubjectResponse from(ModeratedSubject subject) {
        return SubjectResponse.builder()
            .id(subject.getId())
            .kind(subject.getKind())
            .ownerAccountId(subject.getOwnerAccountId())
            .status(subject.getStatus())
            .coinCost(subject.getCoinCost())
            .refundApplied(subject.isRefundApplied())
            .title(subject.getTitle())
            .body(subject.getBody())
            .targetAccountId(subject.getTargetAccountId())
            .relatedPostId(subject.getRelatedPostId())
            .targetResponse(subject.getTargetResponse())
            .amountMvr(subject.getAmountMvr())
            .pricePerCoin(subject.getPricePerCoin())
            .slipPath(subject.getSlipPath())
            .computedCoins(subject.getComputedCoins())
            .adminNote(subject.getAdminNote())
            .decidedAt(subject.getDecidedAt())
            .createdAt(subject.getCreatedAt())
            .updatedAt(subject.getUpdatedAt())
            .build();
    }
}
