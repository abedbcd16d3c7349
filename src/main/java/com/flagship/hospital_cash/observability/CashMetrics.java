package com.flagship.hospital_cash.observability;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Micrometer meters for cash intake and the finance event stream.
 *
 * Meters:
 * - cash.payments.created{type,status}: payment creation attempts by outcome
 * - cash.payments.rejected{reason}: payloads refused before reaching the database
 * - cash.api.duration{operation}: handler latency
 * - finance.events.received{event,entity}: events seen by the reporting consumer
 */
@Component
public class CashMetrics {

    public static final String TYPE_INVOICE = "invoice";
    public static final String TYPE_CAUTION = "caution";

    private final MeterRegistry registry;

    public CashMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordPaymentCreated(String type, String status) {
        registry.counter("cash.payments.created",
                "type", sanitizeTag(type),
                "status", sanitizeTag(status)
        ).increment();
    }

    public void recordPaymentRejected(String reason) {
        registry.counter("cash.payments.rejected",
                "reason", sanitizeTag(reason)
        ).increment();
    }

    public void recordLatency(String operation, long durationMs) {
        Timer.builder("cash.api.duration")
                .description("Cash API response time")
                .tag("operation", sanitizeTag(operation))
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry)
                .record(durationMs, TimeUnit.MILLISECONDS);
    }

    public void recordFinanceEvent(String event, String entity) {
        registry.counter("finance.events.received",
                "event", sanitizeTag(event),
                "entity", sanitizeTag(entity)
        ).increment();
    }

    /**
     * Keeps tag cardinality bounded and values Prometheus-safe.
     */
    private String sanitizeTag(String value) {
        if (value == null || value.isBlank()) {
            return "unknown";
        }
        String sanitized = value.toLowerCase().replaceAll("[^a-z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
