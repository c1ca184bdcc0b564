package com.pharmatrack.ledger_core.coordinator;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pharmatrack.ledger_core.coordinator.dto.TransferRequest;
import com.pharmatrack.ledger_core.journal.AccountClass;
import com.pharmatrack.ledger_core.journal.AccountRole;
import com.pharmatrack.ledger_core.journal.AccountService;
import com.pharmatrack.ledger_core.stock.EntityKind;
import com.pharmatrack.ledger_core.stock.EntityRef;
import com.pharmatrack.ledger_core.stock.MovementKind;
import com.pharmatrack.ledger_core.stock.MovementReference;
import com.pharmatrack.ledger_core.stock.StockService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.math.BigDecimal;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class TransferControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private AccountService accountService;

    @Autowired
    private StockService stockService;

    private UUID actorId;
    private EntityRef wholesaler;
    private EntityRef pharmacy;
    private UUID lotId;

    @BeforeEach
    void setUp() {
        actorId = UUID.randomUUID();
        wholesaler = EntityRef.of(EntityKind.WHOLESALE_PHARMACY, UUID.randomUUID());
        pharmacy = EntityRef.of(EntityKind.RETAIL_PHARMACY, UUID.randomUUID());
        lotId = UUID.randomUUID();

        for (EntityRef entity : new EntityRef[]{wholesaler, pharmacy}) {
            String suffix = entity.getId().toString().substring(0, 8);
            accountService.createEntityAccount("AR-" + suffix, "Receivable", AccountClass.ASSET, entity, AccountRole.RECEIVABLE);
            accountService.createEntityAccount("AP-" + suffix, "Payable", AccountClass.LIABILITY, entity, AccountRole.PAYABLE);
            accountService.createEntityAccount("STK-" + suffix, "Inventory", AccountClass.ASSET, entity, AccountRole.INVENTORY);
            accountService.createEntityAccount("REV-" + suffix, "Revenue", AccountClass.REVENUE, entity, AccountRole.REVENUE);
        }
        stockService.recordMovement(wholesaler.getKind(), wholesaler.getId(), lotId, MovementKind.IMPORT, 50,
            MovementReference.none(), actorId, true);
    }

    private MvcResult transfer(int quantity, BigDecimal unitValue) throws Exception {
        TransferRequest request = new TransferRequest(wholesaler.getKind(), wholesaler.getId(),
            pharmacy.getKind(), pharmacy.getId(), lotId, quantity, unitValue, UUID.randomUUID(), "B2B_ORDER");
        return mockMvc.perform(post("/api/ledger/transfers")
                .contentType(MediaType.APPLICATION_JSON)
                .header("X-Actor-Id", actorId.toString())
                .content(objectMapper.writeValueAsString(request)))
            .andReturn();
    }

    @Test
    @DisplayName("Transfer returns 201 with both movement ids and the posted entry")
    void transferCreated() throws Exception {
        MvcResult result = transfer(20, new BigDecimal("3.25"));
        assertEquals(201, result.getResponse().getStatus(), result.getResponse().getContentAsString());

        JsonNode body = objectMapper.readTree(result.getResponse().getContentAsString());
        assertFalse(body.get("out_movement_id").isNull());
        assertFalse(body.get("in_movement_id").isNull());
        assertEquals(0, new BigDecimal("65.00").compareTo(new BigDecimal(body.get("amount").asText())));

        mockMvc.perform(get("/api/journal/entries/{id}", body.get("journal_entry_id").asText()))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("POSTED"));

        assertEquals(30L, stockService.getBalance(wholesaler.getKind(), wholesaler.getId(), lotId));
        assertEquals(20L, stockService.getBalance(pharmacy.getKind(), pharmacy.getId(), lotId));
    }

    @Test
    @DisplayName("Transfer beyond the seller balance is rejected with 409")
    void insufficientStock() throws Exception {
        MvcResult result = transfer(51, BigDecimal.ONE);

        assertEquals(409, result.getResponse().getStatus());
        assertEquals("INSUFFICIENT_STOCK",
            objectMapper.readTree(result.getResponse().getContentAsString()).get("code").asText());
        assertEquals(50L, stockService.getBalance(wholesaler.getKind(), wholesaler.getId(), lotId));
    }

    @Test
    @DisplayName("Zero unit value fails request validation")
    void zeroUnitValue() throws Exception {
        MvcResult result = transfer(1, BigDecimal.ZERO);

        assertEquals(400, result.getResponse().getStatus());
        JsonNode body = objectMapper.readTree(result.getResponse().getContentAsString());
        assertEquals("VALIDATION_ERROR", body.get("code").asText());
        assertTrue(body.get("details").has("unitValue"));
    }

    @Test
    @DisplayName("Malformed body is rejected with 400")
    void malformedBody() throws Exception {
        mockMvc.perform(post("/api/ledger/transfers")
                .contentType(MediaType.APPLICATION_JSON)
                .header("X-Actor-Id", actorId.toString())
                .content("{\"seller_kind\": \"NOT_A_KIND\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));
    }

    @Test
    @DisplayName("Health endpoint reports database and ledger integrity")
    void healthEndpoint() throws Exception {
        mockMvc.perform(get("/health"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("UP"))
            .andExpect(jsonPath("$.database").value("UP"))
            .andExpect(jsonPath("$.ledgerIntegrity").value("UP"));
    }
}
