package com.flagship.coin_ledger.ledger;

/**
 * Why a ledger entry exists.
 *
 * POST and CONNECT are debits tied to a moderated subject; REFUND is the
 * compensating credit for one of those; TOPUP is an approved purchase; ADJUST is a
 * manual correction by an administrator.
 */
public enum LedgerReason {
    TOPUP,
    POST,
    CONNECT,
    ADJUST,
    REFUND
}
