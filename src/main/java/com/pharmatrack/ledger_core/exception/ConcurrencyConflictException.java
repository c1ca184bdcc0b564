package com.pharmatrack.ledger_core.exception;

/**
 * A critical section could not be entered or the database aborted the
 * transaction because of contention. Callers may retry the whole operation.
 */
public class ConcurrencyConflictException extends LedgerException {

    public static final String CODE = "CONCURRENCY_CONFLICT";

    public ConcurrencyConflictException(String message, Throwable cause) {
        super(CODE, message, cause);
    }
}
