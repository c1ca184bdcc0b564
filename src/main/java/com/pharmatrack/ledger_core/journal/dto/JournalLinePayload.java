package com.pharmatrack.ledger_core.journal.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.pharmatrack.ledger_core.journal.JournalLineRequest;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * One journal line in a request body. Exactly one of debit and credit must be positive.
 */
@Value
public class JournalLinePayload {

    @NotNull(message = "Account ID is required")
    @JsonProperty("account_id")
    UUID accountId;

    @DecimalMin(value = "0", message = "Debit must not be negative")
    @JsonProperty("debit")
    BigDecimal debit;

    @DecimalMin(value = "0", message = "Credit must not be negative")
    @JsonProperty("credit")
    BigDecimal credit;

    @Size(max = 500, message = "Memo must be at most 500 characters")
    @JsonProperty("memo")
    String memo;

    public JournalLineRequest toRequest() {
        return JournalLineRequest.of(accountId, debit, credit, memo);
    }
}
