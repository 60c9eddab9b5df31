package com.flagship.coin_ledger.observability;

import com.flagship.coin_ledger.outbox.OutboxEventRepository;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

/**
 * Custom health indicators, used by readiness probes.
 */
public class HealthIndicators {

    /**
     * Unhealthy if too many events are waiting to be published.
     */
    @Component("outboxHealth")
    public static class OutboxHealthIndicator implements HealthIndicator {

        private static final long BACKLOG_WARNING_THRESHOLD = 1000;
        private static final long BACKLOG_CRITICAL_THRESHOLD = 10000;

        private final OutboxEventRepository outboxRepository;

        public OutboxHealthIndicator(OutboxEventRepository outboxRepository) {
            this.outboxRepository = outboxRepository;
        }

        @Override
        public Health health() {
            try {
                long backlogSize = outboxRepository.countUnpublished();

                Health.Builder builder = backlogSize < BACKLOG_WARNING_THRESHOLD
                        ? Health.up()
                        : backlogSize < BACKLOG_CRITICAL_THRESHOLD
                        ? Health.status("WARNING")
                        : Health.down();

                return builder
                        .withDetail("backlogSize", backlogSize)
                        .withDetail("warningThreshold", BACKLOG_WARNING_THRESHOLD)
                        .withDetail("criticalThreshold", BACKLOG_CRITICAL_THRESHOLD)
                        .build();

            } catch (DataAccessException e) {
                return Health.down()
                        .withDetail("error", e.getMessage())
                        .build();
            }
        }
    }

    /**
     * DOWN as soon as any integrity fault has been raised since startup.
     * A fault means a ledger invariant broke and needs a human.
     */
    @Component("ledgerIntegrity")
    public static class LedgerIntegrityHealthIndicator implements HealthIndicator {

        private final IntegrityAlarm integrityAlarm;

        public LedgerIntegrityHealthIndicator(IntegrityAlarm integrityAlarm) {
            this.integrityAlarm = integrityAlarm;
        }

        @Override
        public Health health() {
            long faults = integrityAlarm.getFaultCount();
            if (faults == 0) {
                return Health.up().withDetail("faults", 0).build();
            }
            return Health.down()
                    .withDetail("faults", faults)
                    .withDetail("lastFault", String.valueOf(integrityAlarm.getLastFault()))
                    .withDetail("lastFaultAt", String.valueOf(integrityAlarm.getLastFaultAt()))
                    .build();
        }
    }

    /**
     * Only registered where the outbox publisher runs, the one component that needs Kafka.
     */
    @Component("kafkaHealth")
    @ConditionalOnProperty(name = "outbox.publisher.enabled", havingValue = "true", matchIfMissing = true)
    public static class KafkaHealthIndicator implements HealthIndicator {

        private final KafkaTemplate<String, String> kafkaTemplate;

        public KafkaHealthIndicator(KafkaTemplate<String, String> kafkaTemplate) {
            this.kafkaTemplate = kafkaTemplate;
        }

        @Override
        public Health health() {
            try {
                var metrics = kafkaTemplate.metrics();
                if (metrics == null || metrics.isEmpty()) {
                    return Health.down()
                            .withDetail("error", "No Kafka connections established")
                            .build();
                }
                return Health.up()
                        .withDetail("metricsCount", metrics.size())
                        .build();

            } catch (RuntimeException e) {
                return Health.down()
                        .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                        .build();
            }
        }
    }
}
