package com.flagship.coin_ledger.subject;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for all moderated subjects, discriminated by {@code kind}.
 *
 * Key design principles:
 * - No setters: state changes go through updateFromDomain() or markRefundApplied()
 * - Identity, kind, owner, cost and the idempotency key are updatable = false
 * - refundApplied can flip false -> true exactly once
 * - Timestamps are maintained by lifecycle hooks
 */
@Entity
@Table(name = "moderated_subjects")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ModeratedSubjectEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 32)
    private SubjectKind kind;

    @Column(name = "owner_account_id", nullable = false, updatable = false)
    private UUID ownerAccountId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private SubjectStatus status;

    @Column(name = "coin_cost", nullable = false, updatable = false)
    private long coinCost;

    @Column(name = "refund_applied", nullable = false)
    private boolean refundApplied;

    @Column(length = 120)
    private String title;

    @Column(length = 4000)
    private String body;

    @Column(name = "target_account_id", updatable = false)
    private UUID targetAccountId;

    @Column(name = "related_post_id", updatable = false)
    private UUID relatedPostId;

    @Enumerated(EnumType.STRING)
    @Column(name = "target_response", length = 16)
    private TargetResponse targetResponse;

    @Column(name = "amount_mvr", precision = 10, scale = 2, updatable = false)
    private BigDecimal amountMvr;

    @Column(name = "price_per_coin", precision = 10, scale = 2, updatable = false)
    private BigDecimal pricePerCoin;

    @Column(name = "slip_path", updatable = false)
    private String slipPath;

    @Column(name = "computed_coins")
    private Long computedCoins;

    @Column(name = "idempotency_key", unique = true, updatable = false, length = 128)
    private String idempotencyKey;

    @Column(name = "admin_note", length = ModeratedSubject.MAX_NOTE_LENGTH)
    private String adminNote;

    @Column(name = "decided_by")
    private UUID decidedBy;

    @Column(name = "decided_at")
    private Instant decidedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    /**
     * Only way to create an entity. The idempotency key is a persistence concern
     * and is not part of the domain object.
     */
    static ModeratedSubjectEntity fromDomain(ModeratedSubject subject, String idempotencyKey) {
        return new ModeratedSubjectEntity(
            subject.getId(),
            subject.getKind(),
            subject.getOwnerAccountId(),
            subject.getStatus(),
            subject.getCoinCost(),
            false,
            subject.getTitle(),
            subject.getBody(),
            subject.getTargetAccountId(),
            subject.getRelatedPostId(),
            subject.getTargetResponse(),
            subject.getAmountMvr(),
            subject.getPricePerCoin(),
            subject.getSlipPath(),
            subject.getComputedCoins(),
            idempotencyKey,
            subject.getAdminNote(),
            subject.getDecidedBy(),
            subject.getDecidedAt(),
            null, // createdAt - set by @PrePersist
            null  // updatedAt - set by @PrePersist
        );
    }

    public ModeratedSubject toDomain() {
        return ModeratedSubject.builder()
            .id(id)
            .kind(kind)
            .ownerAccountId(ownerAccountId)
            .status(status)
            .coinCost(coinCost)
            .refundApplied(refundApplied)
            .title(title)
            .body(body)
            .targetAccountId(targetAccountId)
            .relatedPostId(relatedPostId)
            .targetResponse(targetResponse)
            .amountMvr(amountMvr)
            .pricePerCoin(pricePerCoin)
            .slipPath(slipPath)
            .computedCoins(computedCoins)
            .adminNote(adminNote)
            .decidedBy(decidedBy)
            .decidedAt(decidedAt)
            .createdAt(createdAt)
            .updatedAt(updatedAt)
            .build();
    }

    /**
     * Copies the mutable part of a transitioned domain object.
     * refundApplied is deliberately not copied; it only changes through markRefundApplied().
     */
    void updateFromDomain(ModeratedSubject subject) {
        if (!id.equals(subject.getId())) {
            throw new IllegalArgumentException("Cannot update subject " + id + " from " + subject.getId());
        }
        this.status = subject.getStatus();
        this.title = subject.getTitle();
        this.body = subject.getBody();
        this.targetResponse = subject.getTargetResponse();
        this.computedCoins = subject.getComputedCoins();
        this.adminNote = subject.getAdminNote();
        this.decidedBy = subject.getDecidedBy();
        this.decidedAt = subject.getDecidedAt();
    }

    /**
     * Flips the refund guard. Can only happen once per subject.
     */
    void markRefundApplied() {
        if (this.refundApplied) {
            throw new IllegalStateException("Refund already applied for subject " + id);
        }
        if (this.coinCost == 0) {
            throw new IllegalStateException("Subject " + id + " carries no coins to refund");
        }
        this.refundApplied = true;
    }
}
