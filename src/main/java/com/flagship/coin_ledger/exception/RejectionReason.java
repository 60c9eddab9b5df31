package com.flagship.coin_ledger.exception;

/**
 * Reason codes surfaced to the initiating user or admin when an operation is rejected.
 *
 * Every recoverable failure of the gate, the workflow or the ledger maps to exactly
 * one of these codes. The code string is what clients match on; the message is for humans.
 */
public enum RejectionReason {
    INSUFFICIENT_BALANCE,
    NOT_ELIGIBLE,
    NOT_ADMIN,
    INVALID_TARGET,
    INVALID_DELTA,
    NOT_FOUND,
    ALREADY_DECIDED,
    NOT_OWNER,
    DOMAIN_EFFECT_FAILED
}
