package com.flagship.coin_ledger.exception;

import java.util.UUID;

public class NotAdminException extends ActionRejectedException {

    public NotAdminException(UUID accountId) {
        super(RejectionReason.NOT_ADMIN, "Account " + accountId + " is not an administrator");
    }
}
