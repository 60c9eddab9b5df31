package com.flagship.coin_ledger.observability;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * Thread-local correlation id plus the MDC keys used across the service.
 *
 * The correlation id comes from the X-Correlation-ID header (or is generated),
 * is written to every log line and is copied into outbox payloads so audit
 * consumers can join a decision back to the request that caused it.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String ACCOUNT_ID_MDC_KEY = "accountId";
    public static final String SUBJECT_ID_MDC_KEY = "subjectId";

    private static final ThreadLocal<String> correlationId = new ThreadLocal<>();

    private CorrelationContext() {
    }

    /**
     * Gets the current correlation id, generating one for threads outside a request
     * (schedulers, test threads).
     */
    public static String getCorrelationId() {
        String id = correlationId.get();
        if (id == null) {
            id = generateCorrelationId();
            correlationId.set(id);
        }
        return id;
    }

    public static void setCorrelationId(String id) {
        if (id != null && !id.isBlank()) {
            correlationId.set(id);
        } else {
            correlationId.set(generateCorrelationId());
        }
    }

    public static void clear() {
        correlationId.remove();
    }

    public static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }

    public static void putAccount(UUID accountId) {
        if (accountId != null) {
            MDC.put(ACCOUNT_ID_MDC_KEY, accountId.toString());
        }
    }

    public static void putSubject(UUID subjectId) {
        if (subjectId != null) {
            MDC.put(SUBJECT_ID_MDC_KEY, subjectId.toString());
        }
    }

    public static void clearEntityKeys() {
        MDC.remove(ACCOUNT_ID_MDC_KEY);
        MDC.remove(SUBJECT_ID_MDC_KEY);
    }
}
