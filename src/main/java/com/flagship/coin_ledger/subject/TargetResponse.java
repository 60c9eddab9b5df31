package com.flagship.coin_ledger.subject;

/**
 * The recipient's answer to an approved connection request.
 */
public enum TargetResponse {
    ACCEPTED,
    DECLINED
}
