package com.pharmatrack.ledger_core.observability;

import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Centralized metrics for ledger operations.
 *
 * Metrics exposed:
 * - stock.movements{kind, status}: movements accepted or rejected
 * - journal.entries{action, status}: create, update, post and reverse outcomes
 * - ledger.transfers{status}: coordinated transfers
 * - ledger.latency{operation}: operation latency
 */
@Component
public class LedgerMetrics {

    private final MeterRegistry registry;

    public LedgerMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordMovement(String kind, String status) {
        registry.counter("stock.movements",
                "kind", sanitizeTag(kind),
                "status", sanitizeTag(status)
        ).increment();
    }

    public void recordJournalEntry(String action, String status) {
        registry.counter("journal.entries",
                "action", sanitizeTag(action),
                "status", sanitizeTag(status)
        ).increment();
    }

    public void recordTransfer(String status) {
        registry.counter("ledger.transfers", "status", sanitizeTag(status)).increment();
    }

    public void recordLatency(String operation, long durationMs) {
        registry.timer("ledger.latency",
                "operation", sanitizeTag(operation)
        ).record(Duration.ofMillis(durationMs));
    }

    /**
     * Sanitizes a tag value to prevent cardinality explosion.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
