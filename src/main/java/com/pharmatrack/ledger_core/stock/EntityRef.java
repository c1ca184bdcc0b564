package com.pharmatrack.ledger_core.stock;

import lombok.Value;

import java.util.UUID;

/**
 * Identifies a stock-holding entity. The id is opaque to the ledger.
 */
@Value
public class EntityRef {
    EntityKind kind;
    UUID id;

    public static EntityRef of(EntityKind kind, UUID id) {
        return new EntityRef(kind, id);
    }

    public StockKey key(UUID lotId) {
        return new StockKey(kind, id, lotId);
    }
}
