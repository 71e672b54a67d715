package com.flagship.expense_ledger.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Centralized metrics for ledger operations.
 *
 * Metrics exposed:
 * - ledger.created: Counter of created ledgers, by settlement policy
 * - ledger.participants.created: Counter of created participants
 * - ledger.expenses: Counter of expense attempts, by split type and status
 * - ledger.settlements: Counter of settlement attempts, by policy and status
 * - ledger.operation.latency: Timer per operation
 * - ledger.count: Gauge of live ledgers
 */
@Component
public class LedgerMetrics {

    public static final String STATUS_SUCCESS = "success";
    public static final String STATUS_REJECTED = "rejected";

    private final MeterRegistry registry;
    private final Counter participantsCreated;

    public LedgerMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.participantsCreated = Counter.builder("ledger.participants.created")
                .description("Number of participants created")
                .register(registry);
    }

    public void incrementParticipantsCreated() {
        participantsCreated.increment();
    }

    public void recordLedgerCreated(String settlementPolicy) {
        registry.counter("ledger.created",
                "settlement_policy", sanitizeTag(settlementPolicy)
        ).increment();
    }

    /**
     * Records an expense attempt with split type and status tags.
     */
    public void recordExpense(String splitType, String status) {
        registry.counter("ledger.expenses",
                "split_type", sanitizeTag(splitType),
                "status", sanitizeTag(status)
        ).increment();
    }

    /**
     * Records a settlement attempt with policy and status tags.
     */
    public void recordSettlement(String policy, String status) {
        registry.counter("ledger.settlements",
                "policy", sanitizeTag(policy),
                "status", sanitizeTag(status)
        ).increment();
    }

    public void recordLatency(String operation, long durationMs) {
        registry.timer("ledger.operation.latency",
                "operation", sanitizeTag(operation)
        ).record(Duration.ofMillis(durationMs));
    }

    /**
     * Registers a gauge for the number of live ledgers.
     */
    public void registerLedgerCountGauge(Supplier<Number> supplier) {
        Gauge.builder("ledger.count", supplier, s -> s.get().doubleValue())
                .description("Number of live ledgers")
                .strongReference(true)
                .register(registry);
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
