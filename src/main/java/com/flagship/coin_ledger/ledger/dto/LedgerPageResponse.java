package com.flagship.coin_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.coin_ledger.ledger.LedgerPage;
import lombok.Value;

import java.util.List;

@Value
public class LedgerPageResponse {

    @JsonProperty("entries")
    List<LedgerEntryResponse> entries;

    /**
     * Pass as {@code before} to fetch the next (older) page; null on the last page.
     */
    @JsonProperty("next_cursor")
    Long nextCursor;

    public static LedgerPageResponse from(LedgerPage page) {
        return new LedgerPageResponse(
            page.getEntries().stream().map(LedgerEntryResponse::from).toList(),
            page.getNextCursor());
    }
}
