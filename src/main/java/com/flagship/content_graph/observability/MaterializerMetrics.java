package com.flagship.content_graph.observability;

import com.flagship.content_graph.materializer.DispatchOutcome;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Centralized metrics for the materializer.
 *
 * Metrics exposed:
 * - materializer.events: events by kind and outcome
 * - materializer.transactions: ledger transactions by outcome
 * - materializer.fatal: fatal conditions by exception type
 * - materializer.dispatch.duration: time to settle one message
 */
@Component
public class MaterializerMetrics {

    private final MeterRegistry registry;

    private final Counter transactionsApplied;
    private final Counter transactionsIgnored;
    private final Timer dispatchTimer;

    public MaterializerMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.transactionsApplied = Counter.builder("materializer.transactions")
                .description("Ledger transactions materialized in full")
                .tag("outcome", "applied")
                .register(registry);

        this.transactionsIgnored = Counter.builder("materializer.transactions")
                .description("Ledger transactions ignored for an unresolved reference")
                .tag("outcome", "ignored")
                .register(registry);

        this.dispatchTimer = Timer.builder("materializer.dispatch.duration")
                .description("Time taken to materialize one ledger message")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);
    }

    public void recordEvent(String kind, DispatchOutcome outcome) {
        registry.counter("materializer.events",
                "kind", sanitizeTag(kind),
                "outcome", outcome.status().name().toLowerCase()
        ).increment();
    }

    public void recordTransactionApplied() {
        transactionsApplied.increment();
    }

    public void recordTransactionIgnored() {
        transactionsIgnored.increment();
    }

    public void recordFatal(String kind, Throwable error) {
        registry.counter("materializer.fatal",
                "kind", sanitizeTag(kind),
                "error", error.getClass().getSimpleName()
        ).increment();
    }

    public <T> T timeDispatch(Supplier<T> operation) {
        return dispatchTimer.record(operation);
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
