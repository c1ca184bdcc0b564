package com.pharmatrack.ledger_core.stock;

/**
 * Kind of supply-chain participant that holds stock.
 */
public enum EntityKind {
    WHOLESALE_PHARMACY,
    RETAIL_PHARMACY,
    PUBLIC_FACILITY
}
