package com.flagship.coin_ledger.account;

public enum AccountRole {
    USER,
    ADMIN
}
