package com.flagship.coin_ledger.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Centralized metrics for the coin ledger.
 *
 * Metrics exposed:
 * - ledger.appends: ledger appends by reason and result
 * - gate.attempts: coin-consuming actions by action kind and result
 * - workflow.decisions: moderation transitions by subject kind and outcome
 * - refunds: refund policy outcomes (applied, skipped_*)
 * - ledger.integrity.faults: broken invariants, by type
 * - notifications: notification writes by result
 * - ledger.operation.latency: timer per operation
 */
@Component
public class LedgerMetrics {

    private final MeterRegistry registry;

    private final Counter integrityFaults;
    private final Timer appendTimer;

    public LedgerMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.integrityFaults = Counter.builder("ledger.integrity.faults.total")
                .description("Ledger invariant violations detected (all types)")
                .register(registry);

        this.appendTimer = Timer.builder("ledger.append.duration")
                .description("Time taken to append a ledger entry, including the account lock wait")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);
    }

    // ==================== Ledger ====================

    public void recordAppend(String reason, String result) {
        registry.counter("ledger.appends",
                "reason", sanitizeTag(reason),
                "result", sanitizeTag(result)
        ).increment();
    }

    public void recordAppendDuration(Duration duration) {
        appendTimer.record(duration);
    }

    public void recordIntegrityFault(String type) {
        integrityFaults.increment();
        registry.counter("ledger.integrity.faults", "type", sanitizeTag(type)).increment();
    }

    // ==================== Gate & workflow ====================

    public void recordGateAttempt(String action, String result) {
        registry.counter("gate.attempts",
                "action", sanitizeTag(action),
                "result", sanitizeTag(result)
        ).increment();
    }

    public void recordDecision(String kind, String outcome) {
        registry.counter("workflow.decisions",
                "kind", sanitizeTag(kind),
                "outcome", sanitizeTag(outcome)
        ).increment();
    }

    public void recordRefund(String result) {
        registry.counter("refunds", "result", sanitizeTag(result)).increment();
    }

    public void recordLatency(String operation, long durationMs) {
        registry.timer("ledger.operation.latency",
                "operation", sanitizeTag(operation)
        ).record(Duration.ofMillis(durationMs));
    }

    // ==================== Idempotency & notifications ====================

    public void recordIdempotencyHit() {
        registry.counter("idempotency.cache", "result", "hit").increment();
    }

    public void recordIdempotencyMiss() {
        registry.counter("idempotency.cache", "result", "miss").increment();
    }

    public void recordNotification(String result) {
        registry.counter("notifications", "result", sanitizeTag(result)).increment();
    }

    /**
     * Keeps tag cardinality bounded: lower-case, short, no free text.
     */
    private String sanitizeTag(String value) {
        if (value == null || value.isBlank()) {
            return "unknown";
        }
        String sanitized = value.toLowerCase().replaceAll("[^a-z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
