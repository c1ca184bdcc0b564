package com.pharmatrack.ledger_core.journal;

/**
 * Account classes of the chart of accounts.
 *
 * ASSET and EXPENSE balances grow with debits; the others grow with credits.
 */
public enum AccountClass {
    ASSET(true),
    LIABILITY(false),
    EQUITY(false),
    REVENUE(false),
    EXPENSE(true);

    private final boolean debitNormal;

    AccountClass(boolean debitNormal) {
        this.debitNormal = debitNormal;
    }

    public boolean isDebitNormal() {
        return debitNormal;
    }
}
