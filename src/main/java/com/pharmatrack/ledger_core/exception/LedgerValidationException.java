package com.pharmatrack.ledger_core.exception;

/**
 * Raised when input is rejected before anything is written.
 */
public class LedgerValidationException extends LedgerException {

    public static final String CODE = "VALIDATION_ERROR";

    public LedgerValidationException(String message) {
        super(CODE, message);
    }

    protected LedgerValidationException(String code, String message) {
        super(code, message);
    }
}
