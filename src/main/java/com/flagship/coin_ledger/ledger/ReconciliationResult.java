package com.flagship.coin_ledger.ledger;

import lombok.Value;

import java.util.UUID;

/**
 * Cached running total versus the sum of the entry log for one account.
 */
@Value
public class ReconciliationResult {
    UUID accountId;
    long cachedBalance;
    long derivedBalance;

    public boolean isConsistent() {
        return cachedBalance == derivedBalance && derivedBalance >= 0;
    }
}
