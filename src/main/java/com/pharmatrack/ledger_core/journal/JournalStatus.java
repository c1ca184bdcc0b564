package com.pharmatrack.ledger_core.journal;

/**
 * DRAFT entries may still be edited; POSTED is terminal.
 */
public enum JournalStatus {
    DRAFT,
    POSTED
}
