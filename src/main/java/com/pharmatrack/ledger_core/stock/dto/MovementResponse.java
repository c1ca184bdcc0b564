package com.pharmatrack.ledger_core.stock.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.pharmatrack.ledger_core.stock.EntityKind;
import com.pharmatrack.ledger_core.stock.Movement;
import com.pharmatrack.ledger_core.stock.MovementKind;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class MovementResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("entity_kind")
    EntityKind entityKind;

    @JsonProperty("entity_id")
    UUID entityId;

    @JsonProperty("lot_id")
    UUID lotId;

    @JsonProperty("movement_kind")
    MovementKind movementKind;

    @JsonProperty("quantity")
    int quantity;

    @JsonProperty("reference_id")
    UUID referenceId;

    @JsonProperty("reference_kind")
    String referenceKind;

    @JsonProperty("actor_id")
    UUID actorId;

    @JsonProperty("created_at")
    Instant createdAt;

    public static MovementResponse from(Movement movement) {
        return MovementResponse.builder()
            .id(movement.getId())
            .entityKind(movement.getEntityKind())
            .entityId(movement.getEntityId())
            .lotId(movement.getLotId())
            .movementKind(movement.getMovementKind())
            .quantity(movement.getQuantity())
            .referenceId(movement.getReferenceId())
            .referenceKind(movement.getReferenceKind())
            .actorId(movement.getActorId())
            .createdAt(movement.getCreatedAt())
            .build();
    }
}
