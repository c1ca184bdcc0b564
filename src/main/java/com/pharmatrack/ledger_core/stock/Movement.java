package com.pharmatrack.ledger_core.stock;

import lombok.Value;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Immutable stock movement fact.
 *
 * Once appended a movement is never changed or deleted; corrections are
 * new movements.
 */
@Value
public class Movement {
    UUID id;
    EntityKind entityKind;
    UUID entityId;
    UUID lotId;
    MovementKind movementKind;
    int quantity;
    UUID referenceId;
    String referenceKind;
    UUID actorId;
    Instant createdAt;

    /**
     * Creates a new movement with a fresh id and the current timestamp.
     */
    public static Movement create(StockKey key, MovementKind kind, int quantity,
                                  MovementReference reference, UUID actorId) {
        MovementReference ref = reference != null ? reference : MovementReference.none();
        return new Movement(
            UUID.randomUUID(),
            key.getEntityKind(),
            key.getEntityId(),
            key.getLotId(),
            kind,
            quantity,
            ref.getReferenceId(),
            ref.getReferenceKind(),
            actorId,
            Instant.now()
        );
    }

    /**
     * Snapshot written to the audit log.
     */
    public Map<String, Object> toAuditState() {
        Map<String, Object> state = new LinkedHashMap<>();
        state.put("id", id);
        state.put("entityKind", entityKind);
        state.put("entityId", entityId);
        state.put("lotId", lotId);
        state.put("movementKind", movementKind);
        state.put("quantity", quantity);
        state.put("referenceId", referenceId);
        state.put("referenceKind", referenceKind);
        state.put("createdAt", createdAt);
        return state;
    }
}
