package com.pharmatrack.ledger_core.exception;

public class RecordNotFoundException extends LedgerException {

    public static final String CODE = "NOT_FOUND";

    public RecordNotFoundException(String recordType, Object id) {
        super(CODE, recordType + " not found: " + id);
    }
}
