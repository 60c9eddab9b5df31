package com.flagship.coin_ledger.ledger;

import com.flagship.coin_ledger.account.Actor;
import com.flagship.coin_ledger.ledger.dto.LedgerPageResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;
import java.util.UUID;

/**
 * Read-only views of the caller's own coins.
 */
@RestController
@RequestMapping("/api/coins")
@RequiredArgsConstructor
public class CoinController {

    private final LedgerStore ledgerStore;

    @GetMapping("/balance")
    public ResponseEntity<Map<String, Object>> balance(@RequestHeader(Actor.HEADER) UUID actorId) {
        return ResponseEntity.ok(Map.of(
            "account_id", actorId,
            "balance", ledgerStore.balanceOf(actorId)));
    }

    @GetMapping("/ledger")
    public ResponseEntity<LedgerPageResponse> history(@RequestHeader(Actor.HEADER) UUID actorId,
                                                      @RequestParam(value = "before", required = false) Long before,
                                                      @RequestParam(value = "limit", defaultValue = "50") int limit) {
        return ResponseEntity.ok(LedgerPageResponse.from(ledgerStore.history(actorId, before, limit)));
    }
}
