package com.flagship.coin_ledger.exception;

import lombok.Getter;

import java.util.UUID;

/**
 * A broken ledger invariant: double refund, negative derived balance, or a cached
 * balance that drifted from the entry log.
 *
 * Not an {@link ActionRejectedException}. It is never retried and is reported
 * on the integrity logger by whoever detects it.
 */
@Getter
public class LedgerIntegrityException extends RuntimeException {

    private final UUID accountId;
    private final UUID subjectId;

    public LedgerIntegrityException(String message, UUID accountId, UUID subjectId) {
        super(message);
        this.accountId = accountId;
        this.subjectId = subjectId;
    }

    public LedgerIntegrityException(String message, UUID accountId, UUID subjectId, Throwable cause) {
        super(message, cause);
        this.accountId = accountId;
        this.subjectId = subjectId;
    }
}
