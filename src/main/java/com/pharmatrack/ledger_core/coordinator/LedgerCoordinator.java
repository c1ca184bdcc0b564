package com.pharmatrack.ledger_core.coordinator;

import com.pharmatrack.ledger_core.exception.LedgerException;
import com.pharmatrack.ledger_core.exception.LedgerValidationException;
import com.pharmatrack.ledger_core.journal.JournalEntry;
import com.pharmatrack.ledger_core.journal.JournalLineRequest;
import com.pharmatrack.ledger_core.journal.JournalService;
import com.pharmatrack.ledger_core.observability.CorrelationContext;
import com.pharmatrack.ledger_core.observability.LedgerMetrics;
import com.pharmatrack.ledger_core.stock.DualMovement;
import com.pharmatrack.ledger_core.stock.EntityRef;
import com.pharmatrack.ledger_core.stock.MovementReference;
import com.pharmatrack.ledger_core.stock.StockService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Runs a stock transfer and its journal posting as one unit of work.
 *
 * Steps, inside a single transaction:
 * 1. Resolve both parties' accounts (before any stock lock is taken)
 * 2. Dual movement: TRANSFER_OUT for the seller, TRANSFER_IN for the buyer
 * 3. Create and post a balanced entry: debit buyer inventory, credit seller revenue
 *
 * Any failure rolls back all of it. Receivable and payable are resolved so a
 * party without them is rejected up front; settlement against them is posted
 * by the payment workflow.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LedgerCoordinator {

    private final StockService stockService;
    private final JournalService journalService;
    private final AccountResolver accountResolver;
    private final LedgerMetrics metrics;

    @Transactional
    public TransferResult executeTransfer(EntityRef seller, EntityRef buyer, UUID lotId, int quantity,
                                          BigDecimal unitValue, MovementReference reference,
                                          UUID actorId, boolean lotUsable) {
        long startTime = System.currentTimeMillis();
        MovementReference ref = reference != null ? reference : MovementReference.none();

        try {
            if (seller == null || buyer == null) {
                throw new LedgerValidationException("Seller and buyer are required");
            }
            if (actorId == null) {
                throw new LedgerValidationException("Actor is required for a transfer");
            }
            if (unitValue == null || unitValue.signum() <= 0) {
                throw new LedgerValidationException("Unit value must be greater than zero");
            }
            if (quantity <= 0) {
                throw new LedgerValidationException("Quantity must be positive: " + quantity);
            }

            TransferAccounts sellerAccounts = accountResolver.accountsFor(seller);
            TransferAccounts buyerAccounts = accountResolver.accountsFor(buyer);

            DualMovement dual = stockService.processDualMovement(
                seller, buyer, lotId, quantity, ref, actorId, lotUsable);

            String journalReference = journalReference(ref, dual);
            MDC.put(CorrelationContext.TRANSFER_REFERENCE_MDC_KEY, journalReference);

            BigDecimal amount = unitValue.multiply(BigDecimal.valueOf(quantity));
            String memo = quantity + " x lot " + lotId;
            List<JournalLineRequest> lines = List.of(
                JournalLineRequest.debit(buyerAccounts.getInventory(), amount, memo),
                JournalLineRequest.credit(sellerAccounts.getRevenue(), amount, memo)
            );

            JournalEntry draft = journalService.createEntry(
                LocalDate.now(),
                journalReference,
                "Stock transfer " + seller.getKind() + ":" + seller.getId()
                    + " -> " + buyer.getKind() + ":" + buyer.getId(),
                lines,
                actorId
            );
            JournalEntry posted = journalService.post(draft.getId(), actorId);

            metrics.recordTransfer("success");
            metrics.recordLatency("transfer", System.currentTimeMillis() - startTime);
            log.info("Transfer completed: out={}, in={}, entry={}, amount={}",
                dual.getOut().getId(), dual.getIn().getId(), posted.getId(), amount);

            return new TransferResult(dual.getOut().getId(), dual.getIn().getId(), posted.getId(), amount);

        } catch (LedgerException e) {
            metrics.recordTransfer(e.getErrorCode());
            log.warn("Transfer rejected: reason={}", e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            metrics.recordTransfer("error");
            log.error("Transfer failed: error={}", e.getMessage());
            throw e;
        } finally {
            MDC.remove(CorrelationContext.TRANSFER_REFERENCE_MDC_KEY);
        }
    }

    /**
     * The business reference shared by the movements and the journal entry.
     */
    static String journalReference(MovementReference reference, DualMovement dual) {
        if (reference.isPresent()) {
            String kind = reference.getReferenceKind() != null ? reference.getReferenceKind() : "TRANSFER";
            return kind + ":" + reference.getReferenceId();
        }
        return "TRANSFER:" + dual.getOut().getId();
    }
}
