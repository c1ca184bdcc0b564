package com.pharmatrack.ledger_core.audit;

public enum AuditAction {
    CREATE,
    UPDATE,
    POST,
    REVERSE
}
