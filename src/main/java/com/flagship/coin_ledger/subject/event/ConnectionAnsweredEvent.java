package com.flagship.coin_ledger.subject.event;

import com.flagship.coin_ledger.observability.CorrelationContext;
import com.flagship.coin_ledger.subject.ModeratedSubject;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * The target of an approved connection request accepted or declined it.
 */
@Value
public class ConnectionAnsweredEvent implements SubjectEvent {
    UUID eventId;
    UUID subjectId;
    UUID ownerAccountId;
    UUID targetAccountId;
    String response;
    String correlationId;
    Instant occurredAt;

    public static final String EVENT_TYPE = "ConnectionAnswered";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static ConnectionAnsweredEvent from(ModeratedSubject subject) {
        return new ConnectionAnsweredEvent(
            UUID.randomUUID(),
            subject.getId(),
            subject.getOwnerAccountId(),
            subject.getTargetAccountId(),
            subject.getTargetResponse().name(),
            CorrelationContext.getCorrelationId(),
            Instant.now()
        );
    }
}
