package com.pharmatrack.ledger_core.stock.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.pharmatrack.ledger_core.stock.EntityKind;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.util.UUID;

@Value
public class SaleRequest {

    @NotNull(message = "Entity kind is required")
    @JsonProperty("entity_kind")
    EntityKind entityKind;

    @NotNull(message = "Entity ID is required")
    @JsonProperty("entity_id")
    UUID entityId;

    @NotNull(message = "Lot ID is required")
    @JsonProperty("lot_id")
    UUID lotId;

    @NotNull(message = "Quantity is required")
    @Positive(message = "Quantity must be greater than 0")
    @JsonProperty("quantity")
    Integer quantity;

    @JsonProperty("reference_id")
    UUID referenceId;

    @Size(max = 100, message = "Reference kind must be at most 100 characters")
    @JsonProperty("reference_kind")
    String referenceKind;
}
