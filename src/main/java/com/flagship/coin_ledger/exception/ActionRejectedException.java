package com.flagship.coin_ledger.exception;

import lombok.Getter;

/**
 * Base type for every recoverable rejection.
 *
 * Thrown before any mutation, or from inside an atomic unit so that the
 * surrounding transaction rolls back. Callers may retry after fixing the cause.
 */
@Getter
public abstract class ActionRejectedException extends RuntimeException {

    private final RejectionReason reason;

    protected ActionRejectedException(RejectionReason reason, String message) {
        super(message);
        this.reason = reason;
    }

    protected ActionRejectedException(RejectionReason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }
}
