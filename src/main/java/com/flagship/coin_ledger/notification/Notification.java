package com.flagship.coin_ledger.notification;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class Notification {
    UUID id;
    UUID accountId;
    NotificationKind kind;
    String payload;
    boolean seen;
    Instant createdAt;
}
