package com.pharmatrack.ledger_core.stock.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.pharmatrack.ledger_core.stock.EntityKind;
import lombok.Value;

import java.util.UUID;

@Value
public class BalanceResponse {

    @JsonProperty("entity_kind")
    EntityKind entityKind;

    @JsonProperty("entity_id")
    UUID entityId;

    @JsonProperty("lot_id")
    UUID lotId;

    @JsonProperty("balance")
    long balance;
}
