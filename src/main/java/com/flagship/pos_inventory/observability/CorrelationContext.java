package com.flagship.pos_inventory.observability;

import java.util.UUID;

/**
 * Thread-local correlation ID for the request being served, plus the MDC
 * keys used by the posting engines.
 *
 * The correlation ID arrives in the X-Correlation-ID header (or is generated)
 * and shows up in every log line of the request.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String INVOICE_NO_MDC_KEY = "invoiceNo";
    public static final String PURCHASE_NO_MDC_KEY = "purchaseNo";

    private static final ThreadLocal<String> correlationId = new ThreadLocal<>();

    private CorrelationContext() {
        // Utility class
    }

    public static String getCorrelationId() {
        String id = correlationId.get();
        if (id == null) {
            id = generateCorrelationId();
            correlationId.set(id);
        }
        return id;
    }

    public static void setCorrelationId(String id) {
        if (id != null && !id.isBlank()) {
            correlationId.set(id);
        } else {
            correlationId.set(generateCorrelationId());
        }
    }

    public static void clear() {
        correlationId.remove();
    }

    /**
     * Short form, easier to grep for in till logs.
     */
    public static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
