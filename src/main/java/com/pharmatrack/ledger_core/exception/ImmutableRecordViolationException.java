package com.pharmatrack.ledger_core.exception;

/**
 * An attempt to change a record that is permanent: a stored movement,
 * a posted journal entry, or an entry that has already been reversed.
 */
public class ImmutableRecordViolationException extends LedgerException {

    public static final String CODE = "IMMUTABLE_RECORD";

    public ImmutableRecordViolationException(String message) {
        super(CODE, message);
    }

    public ImmutableRecordViolationException(String message, Throwable cause) {
        super(CODE, message, cause);
    }
}
