package com.flagship.coin_ledger.ledger;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Immutable signed balance adjustment.
 *
 * Entries are only created by {@link LedgerStore#append} and are never updated or deleted.
 * The id is a database identity, so it is unique and grows with insertion order.
 */
@Value
public class LedgerEntry {
    Long id;
    UUID accountId;
    long delta;
    LedgerReason reason;
    String referenceKind;
    UUID referenceId;
    String description;
    Instant createdAt;

    public boolean isDebit() {
        return delta < 0;
    }

    public boolean references(String kind, UUID subjectId) {
        return kind != null && kind.equals(referenceKind) && subjectId != null && subjectId.equals(referenceId);
    }
}
