package com.flagship.coin_ledger.notification;

import lombok.Value;

import java.util.Map;
import java.util.UUID;

/**
 * Application event carrying a notification until its transaction commits.
 */
@Value
public class NotificationRequested {
    UUID accountId;
    NotificationKind kind;
    Map<String, Object> payload;
}
