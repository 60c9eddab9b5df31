package com.flagship.coin_ledger.health;

import com.flagship.coin_ledger.observability.IntegrityAlarm;
import com.flagship.coin_ledger.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Unauthenticated status endpoint for the coin service.
 *
 * DOWN (503) only when the database is unreachable, since every coin action needs it.
 * A recorded ledger fault turns the status to DEGRADED: writes keep working and the
 * fault waits for an operator.
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class HealthController {

    private final DataSource dataSource;
    private final IntegrityAlarm integrityAlarm;
    private final OutboxService outboxService;

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("timestamp", Instant.now().toString());

        if (!databaseReachable()) {
            response.put("status", "DOWN");
            response.put("database", "DOWN");
            return ResponseEntity.status(503).body(response);
        }

        long faults = integrityAlarm.getFaultCount();
        response.put("status", faults > 0 ? "DEGRADED" : "UP");
        response.put("database", "UP");

        Map<String, Object> ledger = new LinkedHashMap<>();
        ledger.put("integrityFaults", faults);
        if (integrityAlarm.getLastFaultAt() != null) {
            ledger.put("lastFaultAt", integrityAlarm.getLastFaultAt().toString());
        }
        response.put("ledger", ledger);
        response.put("outboxBacklog", outboxService.countUnpublished());

        return ResponseEntity.ok(response);
    }

    private boolean databaseReachable() {
        try (Connection connection = dataSource.getConnection()) {
            return connection.isValid(2);
        } catch (SQLException e) {
            log.warn("Database unreachable: {}", e.getMessage());
            return false;
        }
    }
}
