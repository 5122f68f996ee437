package com.flagship.nft_marketplace.observability;

import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.time.Duration;

/**
 * Metrics for marketplace operations.
 *
 * - marketplace.operations: counter tagged by operation and outcome
 * - marketplace.latency: timer tagged by operation
 * - marketplace.volume: total purchase value, in the smallest currency unit
 * - idempotency.cache: hit/miss counter for replayed requests
 */
@Component
public class MarketplaceMetrics {

    private final MeterRegistry registry;

    public MarketplaceMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * @param status "success" or the lowercase error kind
     */
    public void recordOperation(String operation, String status) {
        registry.counter("marketplace.operations",
                "operation", sanitizeTag(operation),
                "status", sanitizeTag(status)
        ).increment();
    }

    public void recordLatency(String operation, long durationMs) {
        registry.timer("marketplace.latency",
                "operation", sanitizeTag(operation)
        ).record(Duration.ofMillis(durationMs));
    }

    /**
     * Amounts beyond double precision are recorded approximately.
     */
    public void recordPurchaseVolume(BigInteger value) {
        registry.counter("marketplace.volume").increment(value.doubleValue());
    }

    public void recordIdempotencyHit() {
        registry.counter("idempotency.cache", "result", "hit").increment();
    }

    public void recordIdempotencyMiss() {
        registry.counter("idempotency.cache", "result", "miss").increment();
    }

    /**
     * Keeps tag cardinality bounded.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
