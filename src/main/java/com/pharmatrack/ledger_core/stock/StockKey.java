package com.pharmatrack.ledger_core.stock;

import lombok.Value;

import java.util.Comparator;
import java.util.UUID;

/**
 * The (entity kind, entity id, lot id) triple a balance is kept for.
 *
 * Natural ordering is the canonical lock order: kind, then entity id,
 * then lot id.
 */
@Value
public class StockKey implements Comparable<StockKey> {

    private static final Comparator<StockKey> CANONICAL_ORDER = Comparator
        .comparing(StockKey::getEntityKind)
        .thenComparing(StockKey::getEntityId)
        .thenComparing(StockKey::getLotId);

    EntityKind entityKind;
    UUID entityId;
    UUID lotId;

    @Override
    public int compareTo(StockKey other) {
        return CANONICAL_ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return entityKind + ":" + entityId + ":" + lotId;
    }
}
