package com.flagship.coin_ledger.workflow.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.coin_ledger.ledger.ReconciliationResult;
import lombok.Value;

import java.util.List;
import java.util.UUID;

@Value
public class ReconciliationResponse {

    @JsonProperty("consistent")
    boolean consistent;

    @JsonProperty("mismatches")
    List<Mismatch> mismatches;

    public static ReconciliationResponse from(List<ReconciliationResult> mismatches) {
        return new ReconciliationResponse(mismatches.isEmpty(),
            mismatches.stream()
                .map(m -> new Mismatch(m.getAccountId(), m.getCachedBalance(), m.getDerivedBalance()))
                .toList());
    }

    @Value
    public static class Mismatch {
        @JsonProperty("account_id")
        UUID accountId;

        @JsonProperty("cached_balance")
        long cachedBalance;

        @JsonProperty("derived_balance")
        long derivedBalance;
    }
}
