package com.flagship.coin_ledger.audit;

import com.flagship.coin_ledger.subject.SubjectKind;
import com.flagship.coin_ledger.subject.SubjectStatus;

public enum AuditAction {
    USER_APPROVED,
    USER_REJECTED,
    POST_APPROVED,
    POST_REJECTED,
    CONNECTION_APPROVED,
    CONNECTION_REJECTED,
    CONNECTION_CANCELLED,
    TOPUP_APPROVED,
    TOPUP_REJECTED,
    COINS_ADJUSTED;

    public static AuditAction forDecision(SubjectKind kind, SubjectStatus outcome) {
        boolean approved = outcome == SubjectStatus.APPROVED;
        return switch (kind) {
            case USER_PROFILE -> approved ? USER_APPROVED : USER_REJECTED;
            case POST -> approved ? POST_APPROVED : POST_REJECTED;
            case CONNECTION_REQUEST -> approved ? CONNECTION_APPROVED : CONNECTION_REJECTED;
            case TOPUP_REQUEST -> approved ? TOPUP_APPROVED : TOPUP_REJECTED;
        };
    }

    public static AuditAction forCancel(SubjectKind kind) {
        if (kind != SubjectKind.CONNECTION_REQUEST) {
            throw new IllegalArgumentException(kind + " has no cancel action");
        }
        return CONNECTION_CANCELLED;
    }
}
