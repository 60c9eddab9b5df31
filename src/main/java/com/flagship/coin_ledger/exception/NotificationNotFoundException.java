package com.flagship.coin_ledger.exception;

import java.util.UUID;

public class NotificationNotFoundException extends ActionRejectedException {

    public NotificationNotFoundException(UUID notificationId) {
        super(RejectionReason.NOT_FOUND, "Notification not found: " + notificationId);
    }
}
