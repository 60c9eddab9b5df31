package com.flagship.coin_ledger.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Topics the outbox publisher writes to. Declared only where the publisher runs,
 * so instances without a broker never try to reach one at startup.
 */
@Configuration
@ConditionalOnProperty(name = "outbox.publisher.enabled", havingValue = "true", matchIfMissing = true)
public class KafkaConfig {

    @Value("${kafka.topic.subjects:moderated-subjects}")
    private String subjectsTopic;

    @Value("${kafka.topic.audit:audit-records}")
    private String auditTopic;

    /**
     * Keyed by subject id; 3 partitions keep per-subject ordering with some parallelism.
     */
    @Bean
    public NewTopic subjectsTopic() {
        return TopicBuilder.name(subjectsTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }

    @Bean
    public NewTopic auditTopic() {
        return TopicBuilder.name(auditTopic)
                .partitions(1)
                .replicas(1)
                .build();
    }
}
