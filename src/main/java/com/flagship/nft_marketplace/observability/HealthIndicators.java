package com.flagship.nft_marketplace.observability;

import com.flagship.nft_marketplace.marketplace.MarketplaceLedger;
import com.flagship.nft_marketplace.outbox.OutboxEventRepository;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Health indicators for the marketplace service, exposed under /actuator/health.
 */
public class HealthIndicators {

    /**
     * Reports DOWN when the ledger's in-memory state breaks any of its invariants.
     */
    @Component("ledgerHealth")
    public static class LedgerHealthIndicator implements HealthIndicator {

        private final MarketplaceLedger ledger;

        public LedgerHealthIndicator(MarketplaceLedger ledger) {
            this.ledger = ledger;
        }

        @Override
        public Health health() {
            List<String> violations = ledger.verifyInvariants();
            Health.Builder builder = violations.isEmpty() ? Health.up() : Health.down();
            builder.withDetail("sequenceNumber", ledger.getSequenceNumber())
                    .withDetail("totalSupply", ledger.totalSupply())
                    .withDetail("unsold", ledger.getUnsoldTokens().size());
            if (!violations.isEmpty()) {
                builder.withDetail("violations", violations);
            }
            return builder.build();
        }
    }

    /**
     * Unhealthy if too many market events are waiting to be published.
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

                Health.Builder builder;
                if (backlogSize < BACKLOG_WARNING_THRESHOLD) {
                    builder = Health.up();
                } else if (backlogSize < BACKLOG_CRITICAL_THRESHOLD) {
                    builder = Health.status("WARNING");
                } else {
                    builder = Health.down();
                }
                return builder
                        .withDetail("backlogSize", backlogSize)
                        .withDetail("warningThreshold", BACKLOG_WARNING_THRESHOLD)
                        .withDetail("criticalThreshold", BACKLOG_CRITICAL_THRESHOLD)
                        .build();
            } catch (Exception e) {
                return Health.down().withDetail("error", describe(e)).build();
            }
        }
    }

    /**
     * Redis only backs the idempotency fast path, so losing it degrades the
     * service instead of taking it down.
     */
    @Component("redisHealth")
    public static class RedisHealthIndicator implements HealthIndicator {

        private static final String FALLBACK_NOTE = "Idempotency checks fall back to the receipts table";

        private final ObjectProvider<StringRedisTemplate> redisTemplate;

        public RedisHealthIndicator(ObjectProvider<StringRedisTemplate> redisTemplate) {
            this.redisTemplate = redisTemplate;
        }

        @Override
        public Health health() {
            StringRedisTemplate template = redisTemplate.getIfAvailable();
            if (template == null || template.getConnectionFactory() == null) {
                return Health.status("DEGRADED")
                        .withDetail("error", "Redis is not configured")
                        .withDetail("note", FALLBACK_NOTE)
                        .build();
            }
            try (var connection = template.getConnectionFactory().getConnection()) {
                String result = connection.ping();
                if ("PONG".equals(result)) {
                    return Health.up().withDetail("response", result).build();
                }
                return Health.status("DEGRADED")
                        .withDetail("response", String.valueOf(result))
                        .withDetail("note", FALLBACK_NOTE)
                        .build();
            } catch (Exception e) {
                return Health.status("DEGRADED")
                        .withDetail("error", describe(e))
                        .withDetail("note", FALLBACK_NOTE)
                        .build();
            }
        }
    }

    @Component("kafkaHealth")
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
                return Health.up().withDetail("metricsCount", metrics.size()).build();
            } catch (Exception e) {
                return Health.down().withDetail("error", describe(e)).build();
            }
        }
    }

    private static String describe(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
