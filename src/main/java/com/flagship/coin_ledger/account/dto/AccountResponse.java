package com.flagship.coin_ledger.account.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.coin_ledger.account.Account;
import com.flagship.coin_ledger.account.AccountRole;
import com.flagship.coin_ledger.subject.SubjectStatus;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class AccountResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("username")
    String username;

    @JsonProperty("role")
    AccountRole role;

    @JsonProperty("balance")
    long balance;

    @JsonProperty("profile_status")
    SubjectStatus profileStatus;

    @JsonProperty("created_at")
    Instant createdAt;

    public static AccountResponse from(Account account, long balance, SubjectStatus profileStatus) {
        return AccountResponse.builder()
            .id(account.getId())
            .username(account.getUsername())
            .role(account.getRole())
            .balance(balance)
            .profileStatus(profileStatus)
            .createdAt(account.getCreatedAt())
            .build();
    }
}
