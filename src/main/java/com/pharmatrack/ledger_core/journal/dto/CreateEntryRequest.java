package com.pharmatrack.ledger_core.journal.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;

@Value
public class CreateEntryRequest {

    @NotNull(message = "Entry date is required")
    @JsonProperty("entry_date")
    LocalDate entryDate;

    @NotBlank(message = "Reference is required")
    @Size(max = 200, message = "Reference must be at most 200 characters")
    @JsonProperty("reference")
    String reference;

    @Size(max = 1000, message = "Description must be at most 1000 characters")
    @JsonProperty("description")
    String description;

    @NotEmpty(message = "At least one line is required")
    @JsonProperty("lines")
    List<@Valid JournalLinePayload> lines;
}
