package com.pharmatrack.ledger_core.coordinator;

import lombok.Value;

import java.util.UUID;

/**
 * The accounts an entity uses when it takes part in a transfer.
 */
@Value
public class TransferAccounts {
    UUID receivable;
    UUID payable;
    UUID inventory;
    UUID revenue;
}
