package com.flagship.pocket_ledger.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Micrometer meters for ledger writes.
 *
 * Metrics exposed:
 * - ledger.transactions.recorded: writes by mode and status (recorded, edited, deleted, rejected)
 * - ledger.rate.updates: exchange-rate cache updates derived from realized rates
 * - ledger.classification.fallback: line sets classified by the sign rule alone
 * - ledger.operation.latency: duration of service operations
 */
@Component
public class LedgerMetrics {

    private final MeterRegistry registry;
    private final Counter rateUpdates;
    private final Counter classificationFallbacks;

    public LedgerMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.rateUpdates = Counter.builder("ledger.rate.updates")
                .description("Exchange-rate cache updates from realized rates")
                .register(registry);

        this.classificationFallbacks = Counter.builder("ledger.classification.fallback")
                .description("Transactions classified by line sign because no shape matched")
                .register(registry);
    }

    public void recordTransaction(String mode, String status) {
        registry.counter("ledger.transactions.recorded",
                "mode", sanitizeTag(mode),
                "status", sanitizeTag(status)
        ).increment();
    }

    public void incrementRateUpdates() {
        rateUpdates.increment();
    }

    public void incrementClassificationFallbacks() {
        classificationFallbacks.increment();
    }

    public void recordLatency(String operation, Duration duration) {
        registry.timer("ledger.operation.latency",
                "operation", sanitizeTag(operation)
        ).record(duration);
    }

    /**
     * Keeps tag values to a bounded alphabet and length.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
