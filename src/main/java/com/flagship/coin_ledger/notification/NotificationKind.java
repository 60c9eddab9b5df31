package com.flagship.coin_ledger.notification;

import com.flagship.coin_ledger.subject.SubjectKind;
import com.flagship.coin_ledger.subject.SubjectStatus;

public enum NotificationKind {
    PROFILE_SUBMITTED,
    PROFILE_APPROVED,
    PROFILE_REJECTED,
    POST_SUBMITTED,
    POST_APPROVED,
    POST_REJECTED,
    CONNECTION_SUBMITTED,
    CONNECTION_REQUEST_RECEIVED,
    CONNECTION_APPROVED,
    CONNECTION_REJECTED,
    CONNECTION_ACCEPTED,
    CONNECTION_DECLINED,
    CONNECTION_CANCELLED,
    TOPUP_SUBMITTED,
    TOPUP_APPROVED,
    TOPUP_REJECTED,
    COINS_ADDED,
    COINS_REMOVED;

    public static NotificationKind forSubmission(SubjectKind kind) {
        return switch (kind) {
            case USER_PROFILE -> PROFILE_SUBMITTED;
            case POST -> POST_SUBMITTED;
            case CONNECTION_REQUEST -> CONNECTION_SUBMITTED;
            case TOPUP_REQUEST -> TOPUP_SUBMITTED;
        };
    }

    public static NotificationKind forDecision(SubjectKind kind, SubjectStatus outcome) {
        boolean approved = outcome == SubjectStatus.APPROVED;
        return switch (kind) {
            case USER_PROFILE -> approved ? PROFILE_APPROVED : PROFILE_REJECTED;
            case POST -> approved ? POST_APPROVED : POST_REJECTED;
            case CONNECTION_REQUEST -> approved ? CONNECTION_APPROVED : CONNECTION_REJECTED;
            case TOPUP_REQUEST -> approved ? TOPUP_APPROVED : TOPUP_REJECTED;
        };
    }
}
