package com.flagship.coin_ledger.exception;

import java.util.UUID;

public class SubjectNotFoundException extends ActionRejectedException {

    public SubjectNotFoundException(UUID subjectId) {
        super(RejectionReason.NOT_FOUND, "Subject not found: " + subjectId);
    }
}
