package com.flagship.coin_ledger.exception;

public class NotEligibleException extends ActionRejectedException {

    public NotEligibleException(String message) {
        super(RejectionReason.NOT_ELIGIBLE, message);
    }
}
