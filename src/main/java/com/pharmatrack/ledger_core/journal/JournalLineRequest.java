package com.pharmatrack.ledger_core.journal;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * A line to be written into a journal entry. Missing amounts count as zero.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class JournalLineRequest {
    UUID accountId;
    BigDecimal debit;
    BigDecimal credit;
    String memo;

    public static JournalLineRequest of(UUID accountId, BigDecimal debit, BigDecimal credit, String memo) {
        return new JournalLineRequest(
            accountId,
            debit != null ? debit : BigDecimal.ZERO,
            credit != null ? credit : BigDecimal.ZERO,
            memo
        );
    }

    public static JournalLineRequest debit(UUID accountId, BigDecimal amount, String memo) {
        return of(accountId, amount, BigDecimal.ZERO, memo);
    }

    public static JournalLineRequest credit(UUID accountId, BigDecimal amount, String memo) {
        return of(accountId, BigDecimal.ZERO, amount, memo);
    }

    /**
     * Same account and memo with debit and credit exchanged.
     */
    public JournalLineRequest swapped() {
        return of(accountId, credit, debit, memo);
    }
}
