package com.flagship.coin_ledger.exception;

public class InvalidTargetException extends ActionRejectedException {

    public InvalidTargetException(String message) {
        super(RejectionReason.INVALID_TARGET, message);
    }
}
