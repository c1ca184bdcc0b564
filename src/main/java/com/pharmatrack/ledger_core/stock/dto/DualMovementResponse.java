package com.pharmatrack.ledger_core.stock.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.pharmatrack.ledger_core.stock.DualMovement;
import lombok.Value;

@Value
public class DualMovementResponse {

    @JsonProperty("out")
    MovementResponse out;

    @JsonProperty("in")
    MovementResponse in;

    public static DualMovementResponse from(DualMovement dual) {
        return new DualMovementResponse(MovementResponse.from(dual.getOut()), MovementResponse.from(dual.getIn()));
    }
}
