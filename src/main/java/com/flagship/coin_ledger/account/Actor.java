package com.flagship.coin_ledger.account;

/**
 * Request header naming the acting account. Authentication happens upstream;
 * this service trusts the header and resolves the account's role itself.
 */
public final class Actor {

    public static final String HEADER = "X-Account-Id";

    private Actor() {
    }
}
