package com.flagship.coin_ledger.exception;

import java.util.UUID;

public class AccountNotFoundException extends ActionRejectedException {

    public AccountNotFoundException(UUID accountId) {
        super(RejectionReason.NOT_FOUND, "Account not found: " + accountId);
    }
}
