package com.flagship.coin_ledger.exception;

/**
 * The domain write of an atomic unit failed. The debit written in the same
 * unit is rolled back with it.
 */
public class DomainEffectFailedException extends ActionRejectedException {

    public DomainEffectFailedException(String message) {
        super(RejectionReason.DOMAIN_EFFECT_FAILED, message);
    }

    public DomainEffectFailedException(String message, Throwable cause) {
        super(RejectionReason.DOMAIN_EFFECT_FAILED, message, cause);
    }
}
