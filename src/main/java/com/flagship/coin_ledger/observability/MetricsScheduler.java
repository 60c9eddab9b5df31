package com.flagship.coin_ledger.observability;

import com.flagship.coin_ledger.ledger.LedgerStore;
import com.flagship.coin_ledger.ledger.ReconciliationResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Periodic background work: refreshes database-backed gauges and reconciles
 * every account's cached balance against its entry log.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MetricsScheduler {

    private final OutboxMetrics outboxMetrics;
    private final LedgerStore ledgerStore;

    @Scheduled(fixedRateString = "${metrics.refresh.interval:15000}")
    public void refreshOutboxMetrics() {
        outboxMetrics.refreshMetrics();
    }

    /**
     * Mismatches are reported by LedgerStore on the integrity logger; this only
     * keeps the job alive across database hiccups.
     */
    @Scheduled(fixedDelayString = "${ledger.reconciliation.interval-ms:60000}",
               initialDelayString = "${ledger.reconciliation.interval-ms:60000}")
    public void reconcileLedger() {
        long start = System.currentTimeMillis();
        try {
            List<ReconciliationResult> mismatches = ledgerStore.reconcileAll();
            log.info("Ledger reconciliation finished: mismatches={}, duration={}ms",
                    mismatches.size(), System.currentTimeMillis() - start);
        } catch (DataAccessException e) {
            log.warn("Ledger reconciliation failed: {}", e.getMessage());
        }
    }
}
