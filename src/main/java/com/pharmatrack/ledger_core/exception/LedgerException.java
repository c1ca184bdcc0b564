package com.pharmatrack.ledger_core.exception;

import lombok.Getter;

/**
 * Base type for every business failure raised by the ledger core.
 *
 * Each subtype carries a stable error code that is rendered to HTTP callers
 * and used as a metric tag.
 */
@Getter
public abstract class LedgerException extends RuntimeException {

    private final String errorCode;

    protected LedgerException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected LedgerException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
