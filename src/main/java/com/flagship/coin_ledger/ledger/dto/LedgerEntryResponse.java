package com.flagship.coin_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.coin_ledger.ledger.LedgerEntry;
import com.flagship.coin_ledger.ledger.LedgerReason;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class LedgerEntryResponse {

    @JsonProperty("id")
    Long id;

    @JsonProperty("delta")
    long delta;

    @JsonProperty("reason")
    LedgerReason reason;

    @JsonProperty("reference_kind")
    String referenceKind;

    @JsonProperty("reference_id")
    UUID referenceId;

    @JsonProperty("description")
    String description;

    @JsonProperty("created_at")
    Instant createdAt;

    public static LedgerEntryResponse from(LedgerEntry entry) {
        return LedgerEntryResponse.builder()
            .id(entry.getId())
            .delta(entry.getDelta())
            .reason(entry.getReason())
            .referenceKind(entry.getReferenceKind())
            .referenceId(entry.getReferenceId())
            .description(entry.getDescription())
            .createdAt(entry.getCreatedAt())
            .build();
    }
}
