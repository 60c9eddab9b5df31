package com.flagship.coin_ledger.subject.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Base type for events published about moderated subjects.
 * Consumers deduplicate on the event id; the subject id is the Kafka key.
 */
public interface SubjectEvent {

    UUID getEventId();

    UUID getSubjectId();

    Instant getOccurredAt();

    String getEventType();
}
