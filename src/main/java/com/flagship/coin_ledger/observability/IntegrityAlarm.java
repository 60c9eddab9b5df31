package com.flagship.coin_ledger.observability;

import com.flagship.coin_ledger.exception.LedgerIntegrityException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Single reporting point for ledger integrity faults.
 *
 * Faults go to a dedicated logger (routed to its own appender in logback-spring.xml),
 * increment {@code ledger.integrity.faults} and flip the ledger health indicator.
 * Reporting never throws; the caller decides whether to abort its transaction.
 */
@Component
@RequiredArgsConstructor
public class IntegrityAlarm {

    private static final Logger INTEGRITY_LOG = LoggerFactory.getLogger("com.flagship.coin_ledger.INTEGRITY");

    private final LedgerMetrics metrics;

    private final AtomicLong faultCount = new AtomicLong();
    private final AtomicReference<String> lastFault = new AtomicReference<>();
    private final AtomicReference<Instant> lastFaultAt = new AtomicReference<>();

    public void raise(String type, LedgerIntegrityException fault) {
        raise(type, fault.getMessage(), fault.getAccountId(), fault.getSubjectId());
    }

    public void raise(String type, String message, UUID accountId, UUID subjectId) {
        faultCount.incrementAndGet();
        lastFault.set(type + ": " + message);
        lastFaultAt.set(Instant.now());
        metrics.recordIntegrityFault(type);
        INTEGRITY_LOG.error("type={}, accountId={}, subjectId={}, message={}", type, accountId, subjectId, message);
    }

    public long getFaultCount() {
        return faultCount.get();
    }

    public String getLastFault() {
        return lastFault.get();
    }

    public Instant getLastFaultAt() {
        return lastFaultAt.get();
    }
}
