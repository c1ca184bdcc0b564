package com.pharmatrack.ledger_core.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.exc.UnrecognizedPropertyException;
import com.pharmatrack.ledger_core.journal.dto.JournalLinePayload;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JacksonConfigTest {

    private final ObjectMapper objectMapper = new JacksonConfig().objectMapper();

    @Test
    @DisplayName("Amounts are written in plain notation")
    void plainAmounts() throws Exception {
        String json = objectMapper.writeValueAsString(Map.of("amount", new BigDecimal("4E+2")));

        assertEquals("{\"amount\":400}", json);
    }

    @Test
    @DisplayName("Instants are written as ISO-8601 strings")
    void isoInstants() throws Exception {
        JsonNode node = objectMapper.readTree(objectMapper.writeValueAsString(
            Map.of("at", Instant.parse("2024-03-01T10:15:30Z"))));

        assertEquals("2024-03-01T10:15:30Z", node.get("at").asText());
    }

    @Test
    @DisplayName("Misspelled request fields are rejected")
    void unknownPropertiesRejected() {
        String body = "{\"account_id\":\"6a1f0b7e-3c2d-4e5f-8a9b-0c1d2e3f4a5b\",\"debt\":10}";

        assertThrows(UnrecognizedPropertyException.class,
            () -> objectMapper.readValue(body, JournalLinePayload.class));
    }
}
