package com.pharmatrack.ledger_core.stock;

import lombok.Value;

import java.util.UUID;

/**
 * Business document a movement belongs to (an order, an import batch, a recall).
 * Both parts are optional.
 */
@Value
public class MovementReference {
    UUID referenceId;
    String referenceKind;

    public static MovementReference of(UUID referenceId, String referenceKind) {
        return new MovementReference(referenceId, referenceKind);
    }

    public static MovementReference none() {
        return new MovementReference(null, null);
    }

    public boolean isPresent() {
        return referenceId != null;
    }
}
