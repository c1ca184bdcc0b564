package com.pharmatrack.ledger_core.audit;

import com.pharmatrack.ledger_core.journal.AccountClass;
import com.pharmatrack.ledger_core.journal.AccountService;
import com.pharmatrack.ledger_core.journal.JournalLineRequest;
import com.pharmatrack.ledger_core.journal.JournalService;
import com.pharmatrack.ledger_core.stock.EntityKind;
import com.pharmatrack.ledger_core.stock.MovementKind;
import com.pharmatrack.ledger_core.stock.MovementReference;
import com.pharmatrack.ledger_core.stock.StockService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.context.ActiveProfiles;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;

/**
 * The audit trail is fail-closed: if it cannot be written, neither is the record.
 */
@SpringBootTest
@ActiveProfiles("test")
class AuditFailureTest {

    @Autowired
    private StockService stockService;

    @Autowired
    private JournalService journalService;

    @Autowired
    private AccountService accountService;

    @MockBean
    private AuditSink auditSink;

    @BeforeEach
    void setUp() {
        doThrow(new IllegalStateException("audit store unavailable")).when(auditSink).record(any());
    }

    @Test
    @DisplayName("Movement is not stored when auditing fails")
    void movementRolledBack() {
        UUID pharmacyId = UUID.randomUUID();
        UUID lotId = UUID.randomUUID();

        assertThrows(IllegalStateException.class, () -> stockService.recordMovement(EntityKind.RETAIL_PHARMACY,
            pharmacyId, lotId, MovementKind.IMPORT, 10, MovementReference.none(), null, true));

        assertEquals(0L, stockService.getBalance(EntityKind.RETAIL_PHARMACY, pharmacyId, lotId));
        assertTrue(stockService.getMovementHistory(EntityKind.RETAIL_PHARMACY, pharmacyId, lotId).isEmpty());
    }

    @Test
    @DisplayName("Journal entry is not stored when auditing fails")
    void entryRolledBack() {
        String suffix = UUID.randomUUID().toString().substring(0, 8);
        UUID cash = accountService.createAccount("CASH-" + suffix, "Cash", AccountClass.ASSET).getId();
        UUID sales = accountService.createAccount("SALES-" + suffix, "Sales", AccountClass.REVENUE).getId();
        String reference = "AUDIT-" + suffix;

        assertThrows(IllegalStateException.class, () -> journalService.createEntry(LocalDate.now(), reference, null,
            List.of(JournalLineRequest.debit(cash, BigDecimal.ONE, null), JournalLineRequest.credit(sales, BigDecimal.ONE, null)),
            null));

        assertTrue(journalService.findByReference(reference).isEmpty());
    }
}
