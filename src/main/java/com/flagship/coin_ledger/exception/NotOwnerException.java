package com.flagship.coin_ledger.exception;

import java.util.UUID;

public class NotOwnerException extends ActionRejectedException {

    public NotOwnerException(UUID subjectId, UUID callerId) {
        super(RejectionReason.NOT_OWNER,
            String.format("Account %s is not allowed to act on subject %s", callerId, subjectId));
    }
}
