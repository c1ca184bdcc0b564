package com.pharmatrack.ledger_core.stock;

/**
 * Closed set of stock movement kinds.
 *
 * IMPORT, TRANSFER_IN and RETURN add stock; TRANSFER_OUT, SALE and
 * RECALL_REMOVAL remove it. ADJUSTMENT carries its own sign.
 */
public enum MovementKind {
    IMPORT,
    TRANSFER_IN,
    TRANSFER_OUT,
    SALE,
    RETURN,
    ADJUSTMENT,
    RECALL_REMOVAL
}
