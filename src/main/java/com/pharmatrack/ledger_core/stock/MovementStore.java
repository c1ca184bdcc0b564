package com.pharmatrack.ledger_core.stock;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Append-only storage of stock movements.
 *
 * Exposes no update or delete operation.
 */
public interface MovementStore {

    /**
     * Appends a movement.
     *
     * @return the id of the stored movement
     * @throws com.pharmatrack.ledger_core.exception.LedgerValidationException if the
     *         quantity or kind is invalid
     * @throws com.pharmatrack.ledger_core.exception.ImmutableRecordViolationException if a
     *         movement with the same id already exists
     */
    UUID append(Movement movement);

    /**
     * All movements for a key, oldest first.
     */
    List<Movement> queryOrdered(StockKey key);

    /**
     * Sum of stored quantities per movement kind for a key.
     * Kinds without movements are absent from the map.
     */
    Map<MovementKind, Long> totalsByKind(StockKey key);

    Optional<Movement> findById(UUID id);

    List<Movement> findByReference(UUID referenceId);
}
