package com.pharmatrack.ledger_core.journal;

import com.pharmatrack.ledger_core.exception.LedgerValidationException;
import com.pharmatrack.ledger_core.exception.UnbalancedEntryException;

import java.math.BigDecimal;
import java.util.List;

/**
 * Shape and balance rules for journal lines, checked before anything is written.
 */
final class JournalLines {

    // journal_lines.debit / credit are NUMERIC(19, 4)
    private static final int MAX_SCALE = 4;

    static final int MAX_MEMO_LENGTH = 500;

    private JournalLines() {
    }

    static void validate(List<JournalLineRequest> lines) {
        if (lines == null || lines.isEmpty()) {
            throw new LedgerValidationException("A journal entry needs at least one line");
        }
        for (int i = 0; i < lines.size(); i++) {
            validateLine(i + 1, lines.get(i));
        }
    }

    static void requireBalanced(List<JournalLineRequest> lines) {
        BigDecimal debits = lines.stream().map(line -> amount(line.getDebit())).reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal credits = lines.stream().map(line -> amount(line.getCredit())).reduce(BigDecimal.ZERO, BigDecimal::add);
        if (debits.compareTo(credits) != 0) {
            throw new UnbalancedEntryException(debits, credits);
        }
    }

    private static void validateLine(int lineNumber, JournalLineRequest line) {
        if (line == null) {
            throw new LedgerValidationException("Line " + lineNumber + " is missing");
        }
        if (line.getAccountId() == null) {
            throw new LedgerValidationException("Line " + lineNumber + " has no account");
        }
        BigDecimal debit = amount(line.getDebit());
        BigDecimal credit = amount(line.getCredit());

        if (debit.signum() < 0 || credit.signum() < 0) {
            throw new LedgerValidationException("Line " + lineNumber + " has a negative amount");
        }
        if ((debit.signum() > 0) == (credit.signum() > 0)) {
            throw new LedgerValidationException(
                "Line " + lineNumber + " must have exactly one of debit or credit greater than zero");
        }
        if (debit.stripTrailingZeros().scale() > MAX_SCALE || credit.stripTrailingZeros().scale() > MAX_SCALE) {
            throw new LedgerValidationException(
                "Line " + lineNumber + " has more than " + MAX_SCALE + " decimal places");
        }
        if (line.getMemo() != null && line.getMemo().length() > MAX_MEMO_LENGTH) {
            throw new LedgerValidationException(
                "Line " + lineNumber + " memo must be at most " + MAX_MEMO_LENGTH + " characters");
        }
    }

    private static BigDecimal amount(BigDecimal value) {
        return value != null ? value : BigDecimal.ZERO;
    }
}
