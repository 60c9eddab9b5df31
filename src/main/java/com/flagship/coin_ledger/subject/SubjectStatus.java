package com.flagship.coin_ledger.subject;

/**
 * Moderation status shared by every subject kind.
 * Which transitions are legal depends on the kind, see {@link SubjectKind}.
 */
public enum SubjectStatus {
    PENDING,
    APPROVED,
    REJECTED,
    CANCELLED
}
