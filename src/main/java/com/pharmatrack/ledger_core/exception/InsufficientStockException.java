package com.pharmatrack.ledger_core.exception;

import lombok.Getter;

/**
 * An outbound movement would take the balance of a stock key below zero.
 */
@Getter
public class InsufficientStockException extends LedgerException {

    public static final String CODE = "INSUFFICIENT_STOCK";

    private final long available;
    private final long requested;

    public InsufficientStockException(String stockKey, long available, long requested) {
        super(CODE, String.format("Insufficient stock for %s: available=%d, requested=%d",
            stockKey, available, requested));
        this.available = available;
        this.requested = requested;
    }
}
