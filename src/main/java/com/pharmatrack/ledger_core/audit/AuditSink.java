package com.pharmatrack.ledger_core.audit;

/**
 * Receives an audit record for every accepted ledger write.
 *
 * Called synchronously inside the writing transaction. Implementations must
 * throw on failure; the write is then rolled back.
 */
public interface AuditSink {

    void record(AuditRecord auditRecord);
}
