package com.flagship.coin_ledger.audit;

import com.flagship.coin_ledger.observability.CorrelationContext;
import com.flagship.coin_ledger.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Writes audit records through the outbox, so a record exists exactly when the
 * decision it describes committed.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AuditEmitter {

    public static final String EVENT_TYPE = "AuditRecorded";

    private final OutboxService outboxService;

    @Transactional(propagation = Propagation.MANDATORY)
    public AuditRecord record(UUID actorId, AuditAction action, String entity, UUID entityId,
                              Map<String, Object> meta) {
        AuditRecord record = new AuditRecord(
            UUID.randomUUID(),
            actorId,
            action,
            entity,
            entityId,
            meta != null ? new LinkedHashMap<>(meta) : Map.of(),
            CorrelationContext.getCorrelationId(),
            Instant.now()
        );
        outboxService.saveEvent(OutboxService.AGGREGATE_AUDIT, entityId, EVENT_TYPE, record);
        log.info("Audit: action={}, entity={}, entityId={}, actor={}", action, entity, entityId, actorId);
        return record;
    }

    /**
     * Builds a meta map from alternating keys and values, skipping null values.
     */
    public static Map<String, Object> meta(Object... keyValues) {
        if (keyValues.length % 2 != 0) {
            throw new IllegalArgumentException("meta() takes key/value pairs");
        }
        Map<String, Object> meta = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            if (keyValues[i + 1] != null) {
                meta.put(String.valueOf(keyValues[i]), keyValues[i + 1]);
            }
        }
        return meta;
    }
}
