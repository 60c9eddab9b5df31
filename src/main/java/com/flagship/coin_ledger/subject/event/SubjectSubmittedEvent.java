package com.flagship.coin_ledger.subject.event;

import com.flagship.coin_ledger.observability.CorrelationContext;
import com.flagship.coin_ledger.subject.ModeratedSubject;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A subject entered the moderation queue: created through the action gate,
 * or a profile resubmitted after an edit.
 */
@Value
public class SubjectSubmittedEvent implements SubjectEvent {
    UUID eventId;
    UUID subjectId;
    String kind;
    UUID ownerAccountId;
    long coinCost;
    String correlationId;
    Instant occurredAt;

    public static final String EVENT_TYPE = "SubjectSubmitted";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static SubjectSubmittedEvent from(ModeratedSubject subject) {
        return new SubjectSubmittedEvent(
            UUID.randomUUID(),
            subject.getId(),
            subject.getKind().name(),
            subject.getOwnerAccountId(),
            subject.getCoinCost(),
            CorrelationContext.getCorrelationId(),
            Instant.now()
        );
    }
}
