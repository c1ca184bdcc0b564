package com.pharmatrack.ledger_core.stock.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.pharmatrack.ledger_core.stock.EntityKind;
import com.pharmatrack.ledger_core.stock.MovementKind;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.util.UUID;

/**
 * Request DTO for recording a single movement. ADJUSTMENT quantities are signed.
 */
@Value
public class RecordMovementRequest {

    @NotNull(message = "Entity kind is required")
    @JsonProperty("entity_kind")
    EntityKind entityKind;

    @NotNull(message = "Entity ID is required")
    @JsonProperty("entity_id")
    UUID entityId;

    @NotNull(message = "Lot ID is required")
    @JsonProperty("lot_id")
    UUID lotId;

    @NotNull(message = "Movement kind is required")
    @JsonProperty("movement_kind")
    MovementKind movementKind;

    @NotNull(message = "Quantity is required")
    @JsonProperty("quantity")
    Integer quantity;

    @JsonProperty("reference_id")
    UUID referenceId;

    @Size(max = 100, message = "Reference kind must be at most 100 characters")
    @JsonProperty("reference_kind")
    String referenceKind;
}
