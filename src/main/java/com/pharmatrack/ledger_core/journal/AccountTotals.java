package com.pharmatrack.ledger_core.journal;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Debit and credit sums of the posted lines of one account.
 */
@Value
public class AccountTotals {
    BigDecimal debitTotal;
    BigDecimal creditTotal;
}
