package com.pharmatrack.ledger_core.coordinator.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.pharmatrack.ledger_core.coordinator.TransferResult;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
@Builder
public class TransferResponse {

    @JsonProperty("out_movement_id")
    UUID outMovementId;

    @JsonProperty("in_movement_id")
    UUID inMovementId;

    @JsonProperty("journal_entry_id")
    UUID journalEntryId;

    @JsonProperty("amount")
    BigDecimal amount;

    public static TransferResponse from(TransferResult result) {
        return TransferResponse.builder()
            .outMovementId(result.getOutMovementId())
            .inMovementId(result.getInMovementId())
            .journalEntryId(result.getJournalEntryId())
            .amount(result.getAmount())
            .build();
    }
}
