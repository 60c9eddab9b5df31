package com.flagship.coin_ledger.ledger;

import lombok.Value;

import java.util.List;

/**
 * One page of an account's history, newest first.
 *
 * {@code nextCursor} is the id to pass as {@code beforeId} for the following page,
 * or null when the history is exhausted. Cursors stay valid forever because entries
 * are never removed, so a reader can stop and resume at any point.
 */
@Value
public class LedgerPage {
    List<LedgerEntry> entries;
    Long nextCursor;

    public boolean hasMore() {
        return nextCursor != null;
    }
}
