package com.flagship.coin_ledger.subject.event;

import com.flagship.coin_ledger.observability.CorrelationContext;
import com.flagship.coin_ledger.subject.ModeratedSubject;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class SubjectCancelledEvent implements SubjectEvent {
    UUID eventId;
    UUID subjectId;
    String kind;
    UUID ownerAccountId;
    long refundedCoins;
    String correlationId;
    Instant occurredAt;

    public static final String EVENT_TYPE = "SubjectCancelled";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static SubjectCancelledEvent from(ModeratedSubject subject, long refundedCoins) {
        return new SubjectCancelledEvent(
            UUID.randomUUID(),
            subject.getId(),
            subject.getKind().name(),
            subject.getOwnerAccountId(),
            refundedCoins,
            CorrelationContext.getCorrelationId(),
            Instant.now()
        );
    }
}
