package com.pharmatrack.ledger_core.coordinator;

import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Ids of everything one coordinated transfer wrote.
 */
@Value
public class TransferResult {
    UUID outMovementId;
    UUID inMovementId;
    UUID journalEntryId;
    BigDecimal amount;
}
