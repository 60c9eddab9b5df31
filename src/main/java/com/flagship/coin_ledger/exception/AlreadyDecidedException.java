package com.flagship.coin_ledger.exception;

public class AlreadyDecidedException extends ActionRejectedException {

    public AlreadyDecidedException(String message) {
        super(RejectionReason.ALREADY_DECIDED, message);
    }
}
