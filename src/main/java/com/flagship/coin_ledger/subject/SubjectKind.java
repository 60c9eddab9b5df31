package com.flagship.coin_ledger.subject;

import com.flagship.coin_ledger.ledger.LedgerReason;

/**
 * The four moderated subject variants.
 *
 * Each kind carries its own transition table, so the approval workflow is a single
 * state machine parameterized by kind instead of one implementation per variant:
 *
 * <pre>
 * kind                 decide                                   cancel   coins
 * USER_PROFILE         PENDING -> APPROVED|REJECTED,            no       none
 *                      APPROVED -> REJECTED
 * POST                 PENDING -> APPROVED|REJECTED             no       debit costPost
 * CONNECTION_REQUEST   PENDING -> APPROVED|REJECTED             yes      debit costConnect
 * TOPUP_REQUEST        PENDING -> APPROVED|REJECTED             no       credit on approval
 * </pre>
 */
public enum SubjectKind {

    USER_PROFILE("users", null, false, true),
    POST("posts", LedgerReason.POST, false, false),
    CONNECTION_REQUEST("connection_requests", LedgerReason.CONNECT, true, false),
    TOPUP_REQUEST("coin_topups", null, false, false);

    private final String auditEntity;
    private final LedgerReason debitReason;
    private final boolean cancellable;
    private final boolean resubmittable;

    SubjectKind(String auditEntity, LedgerReason debitReason, boolean cancellable, boolean resubmittable) {
        this.auditEntity = auditEntity;
        this.debitReason = debitReason;
        this.cancellable = cancellable;
        this.resubmittable = resubmittable;
    }

    /**
     * Entity name written into audit records for this kind.
     */
    public String auditEntity() {
        return auditEntity;
    }

    /**
     * Reason of the debit taken when the subject is created, or null for free kinds.
     */
    public LedgerReason debitReason() {
        return debitReason;
    }

    /**
     * Whether creating a subject of this kind costs coins (and so may be refunded).
     */
    public boolean isCoinBearing() {
        return debitReason != null;
    }

    public boolean allowsCancel() {
        return cancellable;
    }

    public boolean allowsResubmit() {
        return resubmittable;
    }

    /**
     * Whether an admin decision may move a subject of this kind from {@code from} to {@code to}.
     */
    public boolean allowsDecision(SubjectStatus from, SubjectStatus to) {
        if (to != SubjectStatus.APPROVED && to != SubjectStatus.REJECTED) {
            return false;
        }
        if (from == SubjectStatus.PENDING) {
            return true;
        }
        // An approved profile can still be taken down.
        return this == USER_PROFILE && from == SubjectStatus.APPROVED && to == SubjectStatus.REJECTED;
    }

    /**
     * Value stored in ledger_entries.reference_kind for entries that point at this kind.
     */
    public String referenceKind() {
        return name();
    }
}
