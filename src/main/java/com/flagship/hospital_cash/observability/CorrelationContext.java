package com.flagship.hospital_cash.observability;

import java.util.UUID;

/**
 * Thread-local holder for the correlation id of the request being served,
 * plus the MDC keys the service logs under.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String CASH_UUID_MDC_KEY = "cashUuid";
    public static final String USER_ID_MDC_KEY = "userId";

    private static final ThreadLocal<String> correlationId = new ThreadLocal<>();

    private CorrelationContext() {
        // Utility class
    }

    /**
     * Gets the current correlation id, generating one if the thread has none.
     */
    public static String getCorrelationId() {
        String id = correlationId.get();
        if (id == null) {
            id = generateCorrelationId();
            correlationId.set(id);
        }
        return id;
    }

    public static void setCorrelationId(String id) {
        correlationId.set(id != null && !id.isBlank() ? id : generateCorrelationId());
    }

    public static void clear() {
        correlationId.remove();
    }

    /**
     * Short ids keep log lines readable.
     */
    public static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
