package com.flagship.coin_ledger.subject.event;

import com.flagship.coin_ledger.observability.CorrelationContext;
import com.flagship.coin_ledger.subject.ModeratedSubject;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * An admin approved or rejected a subject.
 * refundedCoins and creditedCoins are the ledger effects committed with the decision.
 */
@Value
public class SubjectDecidedEvent implements SubjectEvent {
    UUID eventId;
    UUID subjectId;
    String kind;
    UUID ownerAccountId;
    String outcome;
    UUID adminId;
    long refundedCoins;
    long creditedCoins;
    String correlationId;
    Instant occurredAt;

    public static final String EVENT_TYPE = "SubjectDecided";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static SubjectDecidedEvent from(ModeratedSubject subject, long refundedCoins, long creditedCoins) {
        return new SubjectDecidedEvent(
            UUID.randomUUID(),
            subject.getId(),
            subject.getKind().name(),
            subject.getOwnerAccountId(),
            subject.getStatus().name(),
            subject.getDecidedBy(),
            refundedCoins,
            creditedCoins,
            CorrelationContext.getCorrelationId(),
            Instant.now()
        );
    }
}
