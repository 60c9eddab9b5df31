package com.flagship.coin_ledger.outbox;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A fact waiting in the outbox to be published.
 *
 * Written in the same transaction as the state change it describes, so a committed
 * decision always has its event and a rolled-back one never does.
 */
@Value
public class OutboxEvent {
    UUID id;
    String aggregateType;      // "ModeratedSubject" or "Audit"
    UUID aggregateId;
    String eventType;          // e.g. "SubjectDecided"
    String payload;            // JSON
    Instant createdAt;
    Instant publishedAt;       // null until Kafka acknowledged
    int retryCount;
    String lastError;
    Long sequenceNumber;

    public static OutboxEvent create(String aggregateType, UUID aggregateId,
                                     String eventType, String payload) {
        return new OutboxEvent(
            UUID.randomUUID(),
            aggregateType,
            aggregateId,
            eventType,
            payload,
            Instant.now(),
            null,
            0,
            null,
            null   // assigned by the database
        );
    }

    public boolean isPublished() {
        return publishedAt != null;
    }

    public boolean isDeadLettered(int maxRetries) {
        return !isPublished() && retryCount >= maxRetries;
    }
}
