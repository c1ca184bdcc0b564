package com.pharmatrack.ledger_core.journal.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import lombok.Value;

import java.util.List;

/**
 * New lines for a DRAFT entry. The existing lines are replaced wholesale.
 */
@Value
public class ReplaceLinesRequest {

    @NotEmpty(message = "At least one line is required")
    @JsonProperty("lines")
    List<@Valid JournalLinePayload> lines;
}
