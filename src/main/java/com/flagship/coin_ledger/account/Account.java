package com.flagship.coin_ledger.account;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A participant holding a coin balance.
 *
 * cachedBalance is a projection of the ledger kept for fast reads; the balance
 * that counts is always LedgerStore.balanceOf().
 */
@Value
public class Account {
    UUID id;
    String username;
    AccountRole role;
    long cachedBalance;
    Instant createdAt;

    public boolean isAdmin() {
        return role == AccountRole.ADMIN;
    }
}
