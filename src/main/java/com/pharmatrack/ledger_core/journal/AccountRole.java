package com.pharmatrack.ledger_core.journal;

/**
 * Purpose of an entity-owned account, used to find the accounts a transfer posts to.
 */
public enum AccountRole {
    RECEIVABLE,
    PAYABLE,
    INVENTORY,
    REVENUE
}
