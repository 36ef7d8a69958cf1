package com.flagship.pos_inventory.observability;

import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Metrics for the posting engines and the inventory ledger.
 *
 * Metrics exposed:
 * - pos.postings: counter tagged with operation and outcome
 *   (success or the lower-cased error code)
 * - pos.postings.latency: timer per operation
 * - pos.stock.rejections: ledger adjustments refused by the conditional update
 */
@Component
public class PostingMetrics {

    public static final String OUTCOME_SUCCESS = "success";

    private final MeterRegistry registry;

    public PostingMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordOutcome(String operation, String outcome) {
        registry.counter("pos.postings",
                "operation", sanitizeTag(operation),
                "outcome", sanitizeTag(outcome)
        ).increment();
    }

    public void recordLatency(String operation, long durationMs) {
        registry.timer("pos.postings.latency",
                "operation", sanitizeTag(operation)
        ).record(Duration.ofMillis(durationMs));
    }

    public void recordStockRejection(String direction) {
        registry.counter("pos.stock.rejections", "direction", sanitizeTag(direction)).increment();
    }

    /**
     * Keeps tag values short and free of special characters.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.toLowerCase().replaceAll("[^a-z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
