package com.flagship.coin_ledger.gate;

import com.flagship.coin_ledger.subject.ModeratedSubject;

import java.util.UUID;

/**
 * The domain write guarded by the gate: inserts the PENDING subject with the given id.
 * Runs inside the gate's transaction, after the debit.
 */
@FunctionalInterface
public interface DomainEffect {

    ModeratedSubject apply(UUID subjectId);
}
