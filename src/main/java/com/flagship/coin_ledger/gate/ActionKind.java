package com.flagship.coin_ledger.gate;

import com.flagship.coin_ledger.ledger.LedgerReason;
import com.flagship.coin_ledger.subject.SubjectKind;

/**
 * Coin-relevant actions a user can attempt.
 */
public enum ActionKind {

    POST(SubjectKind.POST, true),
    CONNECT(SubjectKind.CONNECTION_REQUEST, true),
    TOPUP(SubjectKind.TOPUP_REQUEST, false);

    private final SubjectKind subjectKind;
    private final boolean requiresApprovedProfile;

    ActionKind(SubjectKind subjectKind, boolean requiresApprovedProfile) {
        this.subjectKind = subjectKind;
        this.requiresApprovedProfile = requiresApprovedProfile;
    }

    public SubjectKind subjectKind() {
        return subjectKind;
    }

    /**
     * Reason written on the debit; null for free actions.
     */
    public LedgerReason debitReason() {
        return subjectKind.debitReason();
    }

    public boolean requiresApprovedProfile() {
        return requiresApprovedProfile;
    }
}
