package com.pharmatrack.ledger_core.stock.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.pharmatrack.ledger_core.stock.EntityKind;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.util.UUID;

/**
 * Request DTO for a stock-only transfer between two entities.
 */
@Value
public class StockTransferRequest {

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

    @JsonProperty("reference_id")
    UUID referenceId;

    @Size(max = 100, message = "Reference kind must be at most 100 characters")
    @JsonProperty("reference_kind")
    String referenceKind;
}
