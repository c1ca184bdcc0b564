package com.pharmatrack.ledger_core.postgres;

import com.pharmatrack.ledger_core.coordinator.LedgerCoordinator;
import com.pharmatrack.ledger_core.coordinator.TransferResult;
import com.pharmatrack.ledger_core.exception.InsufficientStockException;
import com.pharmatrack.ledger_core.journal.AccountClass;
import com.pharmatrack.ledger_core.journal.AccountRole;
import com.pharmatrack.ledger_core.journal.AccountService;
import com.pharmatrack.ledger_core.journal.JournalEntry;
import com.pharmatrack.ledger_core.journal.JournalLineRequest;
import com.pharmatrack.ledger_core.journal.JournalService;
import com.pharmatrack.ledger_core.stock.EntityKind;
import com.pharmatrack.ledger_core.stock.EntityRef;
import com.pharmatrack.ledger_core.stock.Movement;
import com.pharmatrack.ledger_core.stock.MovementKind;
import com.pharmatrack.ledger_core.stock.MovementReference;
import com.pharmatrack.ledger_core.stock.StockService;
import com.pharmatrack.ledger_core.stock.lock.AdvisoryStockLockManager;
import com.pharmatrack.ledger_core.stock.lock.StockLockManager;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs against a real PostgreSQL: advisory locks and the immutability triggers.
 * Skipped when Docker is not available.
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class PostgresLedgerIntegrationTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15-alpine")
            .withDatabaseName("test_ledger")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
    }

    @Autowired
    private StockService stockService;

    @Autowired
    private JournalService journalService;

    @Autowired
    private AccountService accountService;

    @Autowired
    private LedgerCoordinator ledgerCoordinator;

    @Autowired
    private StockLockManager stockLockManager;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private void createTransferAccounts(EntityRef entity) {
        String suffix = entity.getId().toString().substring(0, 8);
        accountService.createEntityAccount("AR-" + suffix, "Receivable", AccountClass.ASSET, entity, AccountRole.RECEIVABLE);
        accountService.createEntityAccount("AP-" + suffix, "Payable", AccountClass.LIABILITY, entity, AccountRole.PAYABLE);
        accountService.createEntityAccount("STK-" + suffix, "Inventory", AccountClass.ASSET, entity, AccountRole.INVENTORY);
        accountService.createEntityAccount("REV-" + suffix, "Revenue", AccountClass.REVENUE, entity, AccountRole.REVENUE);
    }

    private JournalEntry balancedDraft() {
        String suffix = UUID.randomUUID().toString().substring(0, 8);
        UUID cash = accountService.createAccount("CASH-" + suffix, "Cash", AccountClass.ASSET).getId();
        UUID sales = accountService.createAccount("SALES-" + suffix, "Sales", AccountClass.REVENUE).getId();
        return journalService.createEntry(LocalDate.now(), "PG-" + suffix, null, List.of(
            JournalLineRequest.debit(cash, new BigDecimal("50"), null),
            JournalLineRequest.credit(sales, new BigDecimal("50"), null)
        ), null);
    }

    @Test
    @DisplayName("Default configuration uses advisory locks")
    void advisoryLocksConfigured() {
        assertInstanceOf(AdvisoryStockLockManager.class, stockLockManager);
    }

    @Test
    @DisplayName("Concurrent sales for the last units never oversell")
    void concurrentSalesNeverOversell() throws Exception {
        EntityRef pharmacy = EntityRef.of(EntityKind.RETAIL_PHARMACY, UUID.randomUUID());
        UUID lotId = UUID.randomUUID();
        stockService.recordMovement(pharmacy.getKind(), pharmacy.getId(), lotId, MovementKind.IMPORT, 3,
            MovementReference.none(), null, true);

        int threads = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger successes = new AtomicInteger();
        AtomicInteger insufficient = new AtomicInteger();
        List<Throwable> unexpected = new ArrayList<>();

        List<Future<?>> futures = new ArrayList<>();
        for (int i = 0; i < threads; i++) {
            futures.add(executor.submit(() -> {
                try {
                    start.await();
                    stockService.processSingleSale(pharmacy, lotId, 1, MovementReference.none(), null, true);
                    successes.incrementAndGet();
                } catch (InsufficientStockException e) {
                    insufficient.incrementAndGet();
                } catch (Throwable e) {
                    synchronized (unexpected) {
                        unexpected.add(e);
                    }
                }
                return null;
            }));
        }

        start.countDown();
        for (Future<?> future : futures) {
            future.get(60, TimeUnit.SECONDS);
        }
        executor.shutdown();

        assertTrue(unexpected.isEmpty(), "Unexpected failures: " + unexpected);
        assertEquals(3, successes.get());
        assertEquals(5, insufficient.get());
        assertEquals(0L, stockService.getBalance(pharmacy.getKind(), pharmacy.getId(), lotId));
    }

    @Test
    @DisplayName("Stock movements cannot be updated or deleted")
    void movementsAreAppendOnly() {
        Movement movement = stockService.recordMovement(EntityKind.PUBLIC_FACILITY, UUID.randomUUID(),
            UUID.randomUUID(), MovementKind.IMPORT, 10, MovementReference.none(), null, true);

        DataAccessException update = assertThrows(DataAccessException.class, () ->
            jdbcTemplate.update("UPDATE stock_movements SET quantity = 99 WHERE id = ?", movement.getId()));
        assertTrue(update.getMessage().contains("append-only"));

        DataAccessException delete = assertThrows(DataAccessException.class, () ->
            jdbcTemplate.update("DELETE FROM stock_movements WHERE id = ?", movement.getId()));
        assertTrue(delete.getMessage().contains("append-only"));

        Integer quantity = jdbcTemplate.queryForObject(
            "SELECT quantity FROM stock_movements WHERE id = ?", Integer.class, movement.getId());
        assertEquals(10, quantity);
    }

    @Test
    @DisplayName("Posted entries and their lines cannot be modified")
    void postedEntriesAreImmutable() {
        JournalEntry posted = journalService.post(balancedDraft().getId(), UUID.randomUUID());

        DataAccessException entryUpdate = assertThrows(DataAccessException.class, () ->
            jdbcTemplate.update("UPDATE journal_entries SET description = 'edited' WHERE id = ?", posted.getId()));
        assertTrue(entryUpdate.getMessage().contains("cannot be modified"));

        DataAccessException lineUpdate = assertThrows(DataAccessException.class, () ->
            jdbcTemplate.update("UPDATE journal_lines SET memo = 'edited' WHERE entry_id = ?", posted.getId()));
        assertTrue(lineUpdate.getMessage().contains("cannot be changed"));
    }

    @Test
    @DisplayName("An unbalanced entry cannot be flipped to POSTED behind the service")
    void unbalancedPostingRejected() {
        JournalEntry draft = balancedDraft();
        jdbcTemplate.update("UPDATE journal_lines SET debit = 60 WHERE entry_id = ? AND line_number = 1", draft.getId());

        DataAccessException e = assertThrows(DataAccessException.class, () -> jdbcTemplate.update(
            "UPDATE journal_entries SET status = 'POSTED', posted_by = ?, posted_at = CURRENT_TIMESTAMP WHERE id = ?",
            UUID.randomUUID(), draft.getId()));
        assertTrue(e.getMessage().contains("not balanced"));
    }

    @Test
    @DisplayName("Coordinated transfer and its reversal on PostgreSQL")
    void transferAndReverse() {
        EntityRef wholesaler = EntityRef.of(EntityKind.WHOLESALE_PHARMACY, UUID.randomUUID());
        EntityRef pharmacy = EntityRef.of(EntityKind.RETAIL_PHARMACY, UUID.randomUUID());
        UUID lotId = UUID.randomUUID();
        createTransferAccounts(wholesaler);
        createTransferAccounts(pharmacy);
        stockService.recordMovement(wholesaler.getKind(), wholesaler.getId(), lotId, MovementKind.IMPORT, 100,
            MovementReference.none(), null, true);

        TransferResult result = ledgerCoordinator.executeTransfer(wholesaler, pharmacy, lotId, 40,
            new BigDecimal("10"), MovementReference.of(UUID.randomUUID(), "B2B_ORDER"), UUID.randomUUID(), true);

        assertEquals(60L, stockService.getBalance(wholesaler.getKind(), wholesaler.getId(), lotId));
        assertEquals(40L, stockService.getBalance(pharmacy.getKind(), pharmacy.getId(), lotId));

        JournalEntry reversal = journalService.reverse(result.getJournalEntryId(), UUID.randomUUID());
        assertTrue(reversal.isPosted());
        assertEquals(result.getJournalEntryId(), reversal.getReversesEntryId());
        assertEquals(0, new BigDecimal("400").compareTo(reversal.totalCredit()));
    }
}
