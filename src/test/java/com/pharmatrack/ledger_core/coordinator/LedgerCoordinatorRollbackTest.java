package com.pharmatrack.ledger_core.coordinator;

import com.pharmatrack.ledger_core.exception.LedgerValidationException;
import com.pharmatrack.ledger_core.journal.JournalService;
import com.pharmatrack.ledger_core.stock.EntityKind;
import com.pharmatrack.ledger_core.stock.EntityRef;
import com.pharmatrack.ledger_core.stock.MovementKind;
import com.pharmatrack.ledger_core.stock.MovementReference;
import com.pharmatrack.ledger_core.stock.StockService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.context.ActiveProfiles;

import java.math.BigDecimal;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

/**
 * A journal failure after the dual movement has been written must undo the movement.
 */
@SpringBootTest
@ActiveProfiles("test")
class LedgerCoordinatorRollbackTest {

    @Autowired
    private LedgerCoordinator ledgerCoordinator;

    @Autowired
    private StockService stockService;

    @Autowired
    private JournalService journalService;

    @MockBean
    private AccountResolver accountResolver;

    @Test
    @DisplayName("Posting to an account that does not exist rolls back both movements")
    void journalFailureRollsBackMovements() {
        EntityRef wholesaler = EntityRef.of(EntityKind.WHOLESALE_PHARMACY, UUID.randomUUID());
        EntityRef pharmacy = EntityRef.of(EntityKind.RETAIL_PHARMACY, UUID.randomUUID());
        UUID lotId = UUID.randomUUID();
        UUID orderId = UUID.randomUUID();
        stockService.recordMovement(wholesaler.getKind(), wholesaler.getId(), lotId, MovementKind.IMPORT, 100,
            MovementReference.none(), null, true);

        // Resolver hands out ids that are not in the chart of accounts
        when(accountResolver.accountsFor(any())).thenAnswer(invocation -> new TransferAccounts(
            UUID.randomUUID(), UUID.randomUUID(), UUID.randomUUID(), UUID.randomUUID()));

        LedgerValidationException e = assertThrows(LedgerValidationException.class, () ->
            ledgerCoordinator.executeTransfer(wholesaler, pharmacy, lotId, 40, BigDecimal.TEN,
                MovementReference.of(orderId, "B2B_ORDER"), UUID.randomUUID(), true));

        assertTrue(e.getMessage().contains("Account not found"));
        assertEquals(100L, stockService.getBalance(wholesaler.getKind(), wholesaler.getId(), lotId));
        assertEquals(0L, stockService.getBalance(pharmacy.getKind(), pharmacy.getId(), lotId));
        assertTrue(stockService.getMovementsByReference(orderId).isEmpty());
        assertTrue(journalService.findByReference("B2B_ORDER:" + orderId).isEmpty());
    }
}
