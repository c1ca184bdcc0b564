package com.pharmatrack.ledger_core.coordinator.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.pharmatrack.ledger_core.stock.EntityKind;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Request DTO for a coordinated stock transfer with its journal posting.
 */
@Value
public class TransferRequest {

    @NotNull(message = "Seller kind is required")
    @JsonProperty("seller_kind")
    EntityKind sellerKind;

    @NotNull(message = "Seller ID is required")
    @JsonProperty("seller_id")
    UUID sellerId;

    @NotNull(message = "Buyer kind is required")
    @JsonProperty("buyer_kind")
    EntityKind buyerKind;

    @NotNull(message = "Buyer ID is required")
    @JsonProperty("buyer_id")
    UUID buyerId;

    @NotNull(message = "Lot ID is required")
    @JsonProperty("lot_id")
    UUID lotId;

    @NotNull(message = "Quantity is required")
    @Positive(message = "Quantity must be greater than 0")
    @JsonProperty("quantity")
    Integer quantity;

    @NotNull(message = "Unit value is required")
    @DecimalMin(value = "0.0001", message = "Unit value must be greater than 0")
    @JsonProperty("unit_value")
    BigDecimal unitValue;

    @JsonProperty("reference_id")
    UUID referenceId;

    @Size(max = 100, message = "Reference kind must be at most 100 characters")
    @JsonProperty("reference_kind")
    String referenceKind;
}
