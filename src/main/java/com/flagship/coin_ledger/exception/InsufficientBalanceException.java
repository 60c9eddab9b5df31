package com.flagship.coin_ledger.exception;

import lombok.Getter;

import java.util.UUID;

@Getter
public class InsufficientBalanceException extends ActionRejectedException {

    private final UUID accountId;
    private final long balance;
    private final long required;

    public InsufficientBalanceException(UUID accountId, long balance, long required) {
        super(RejectionReason.INSUFFICIENT_BALANCE,
            String.format("Insufficient coins. You need %d coins, balance is %d.", required, balance));
        this.accountId = accountId;
        this.balance = balance;
        this.required = required;
    }
}
