package com.pharmatrack.ledger_core.stock;

import lombok.Value;

/**
 * The TRANSFER_OUT / TRANSFER_IN pair written by one dual movement.
 */
@Value
public class DualMovement {
    Movement out;
    Movement in;
}
