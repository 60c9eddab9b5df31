package com.flagship.coin_ledger.exception;

public class InvalidDeltaException extends ActionRejectedException {

    public InvalidDeltaException() {
        this("Ledger delta must be non-zero");
    }

    public InvalidDeltaException(String message) {
        super(RejectionReason.INVALID_DELTA, message);
    }
}
