package com.pharmatrack.ledger_core.observability;

import java.util.UUID;

/**
 * MDC keys the ledger logs with, and the correlation id rules.
 *
 * The correlation id comes from the {@code X-Correlation-ID} request header
 * when it is usable, otherwise a short random id is generated.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String STOCK_KEY_MDC_KEY = "stockKey";
    public static final String ENTRY_ID_MDC_KEY = "entryId";
    public static final String TRANSFER_REFERENCE_MDC_KEY = "transferReference";

    // Longer ids are replaced rather than truncated
    static final int MAX_CORRELATION_ID_LENGTH = 64;

    private CorrelationContext() {
    }

    /**
     * Returns the incoming id if it is non-blank and short enough, otherwise a new one.
     */
    public static String resolve(String incoming) {
        if (incoming != null && !incoming.isBlank() && incoming.length() <= MAX_CORRELATION_ID_LENGTH) {
            return incoming.trim();
        }
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
