package com.pharmatrack.ledger_core.exception;

import lombok.Getter;

import java.math.BigDecimal;

@Getter
public class UnbalancedEntryException extends LedgerException {

    public static final String CODE = "UNBALANCED_ENTRY";

    private final BigDecimal debitTotal;
    private final BigDecimal creditTotal;

    public UnbalancedEntryException(BigDecimal debitTotal, BigDecimal creditTotal) {
        super(CODE, String.format("Journal entry is not balanced: debits=%s, credits=%s",
            debitTotal, creditTotal));
        this.debitTotal = debitTotal;
        this.creditTotal = creditTotal;
    }
}
