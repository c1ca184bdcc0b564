package com.pharmatrack.ledger_core.journal;

import lombok.Value;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * A stored line of a journal entry. Exactly one of debit and credit is positive.
 */
@Value
public class JournalLine {
    UUID id;
    UUID entryId;
    int lineNumber;
    UUID accountId;
    BigDecimal debit;
    BigDecimal credit;
    String memo;

    public JournalLineRequest toRequest() {
        return JournalLineRequest.of(accountId, debit, credit, memo);
    }

    Map<String, Object> toAuditState() {
        Map<String, Object> state = new LinkedHashMap<>();
        state.put("lineNumber", lineNumber);
        state.put("accountId", accountId);
        state.put("debit", debit);
        state.put("credit", credit);
        state.put("memo", memo);
        return state;
    }
}
