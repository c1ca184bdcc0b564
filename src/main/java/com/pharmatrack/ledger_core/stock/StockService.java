package com.pharmatrack.ledger_core.stock;

import com.pharmatrack.ledger_core.audit.AuditAction;
import com.pharmatrack.ledger_core.audit.AuditRecord;
import com.pharmatrack.ledger_core.audit.AuditSink;
import com.pharmatrack.ledger_core.exception.ConcurrencyConflictException;
import com.pharmatrack.ledger_core.exception.InsufficientStockException;
import com.pharmatrack.ledger_core.exception.LedgerException;
import com.pharmatrack.ledger_core.exception.LedgerValidationException;
import com.pharmatrack.ledger_core.exception.LotUnusableException;
import com.pharmatrack.ledger_core.observability.CorrelationContext;
import com.pharmatrack.ledger_core.observability.LedgerMetrics;
import com.pharmatrack.ledger_core.stock.lock.StockLockManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Records stock movements while keeping every balance non-negative.
 *
 * Movements that lower a balance run inside a critical section keyed by
 * (entity kind, entity id, lot id): the balance is recomputed under the
 * lock and the movement is appended only if the result stays at or above
 * zero. The lock is released when the transaction ends, on success or failure.
 *
 * Inbound movements need no lock since they can never drive a balance negative.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StockService {

    private final MovementStore movementStore;
    private final BalanceCalculator balanceCalculator;
    private final StockLockManager lockManager;
    private final AuditSink auditSink;
    private final LedgerMetrics metrics;

    /**
     * Records one movement for an entity and lot.
     *
     * @param quantity positive units; for ADJUSTMENT a signed, non-zero delta
     * @param lotUsable the lot registry's answer for {@code lotId}
     * @return the stored movement
     * @throws LedgerValidationException for a missing kind or an invalid quantity
     * @throws LotUnusableException if {@code lotUsable} is false
     * @throws InsufficientStockException if the balance would go negative
     */
    @Transactional
    public Movement recordMovement(EntityKind entityKind, UUID entityId, UUID lotId,
                                   MovementKind kind, int quantity, MovementReference reference,
                                   UUID actorId, boolean lotUsable) {
        long startTime = System.currentTimeMillis();
        StockKey key = new StockKey(entityKind, entityId, lotId);
        MDC.put(CorrelationContext.STOCK_KEY_MDC_KEY, key.toString());

        try {
            validateKey(key);
            validateQuantity(kind, quantity);
            requireUsableLot(lotId, lotUsable);

            Movement movement;
            if (BalanceCalculator.consumesStock(kind, quantity)) {
                // Stamped under the lock so history order matches what the balance check saw
                movement = inCriticalSection(List.of(key), () -> {
                    requireAvailable(key, -BalanceCalculator.signedQuantity(kind, quantity));
                    return append(Movement.create(key, kind, quantity, reference, actorId));
                });
            } else {
                movement = append(Movement.create(key, kind, quantity, reference, actorId));
            }

            metrics.recordMovement(kind.name(), "accepted");
            metrics.recordLatency("record_movement", System.currentTimeMillis() - startTime);
            log.info("Movement recorded: id={}, kind={}, quantity={}", movement.getId(), kind, quantity);
            return movement;

        } catch (LedgerException e) {
            metrics.recordMovement(kind != null ? kind.name() : null, e.getErrorCode());
            log.warn("Movement rejected: kind={}, quantity={}, reason={}", kind, quantity, e.getMessage());
            throw e;
        } finally {
            MDC.remove(CorrelationContext.STOCK_KEY_MDC_KEY);
        }
    }

    /**
     * Moves stock from seller to buyer: a TRANSFER_OUT for the seller and a
     * TRANSFER_IN for the buyer, both or neither.
     *
     * Both keys are locked in canonical order, whichever side is seller, so
     * two opposite transfers between the same pair cannot deadlock.
     */
    @Transactional
    public DualMovement processDualMovement(EntityRef seller, EntityRef buyer, UUID lotId, int quantity,
                                            MovementReference reference, UUID actorId, boolean lotUsable) {
        long startTime = System.currentTimeMillis();

        try {
            if (seller == null || buyer == null) {
                throw new LedgerValidationException("Seller and buyer are required");
            }
            StockKey sellerKey = seller.key(lotId);
            StockKey buyerKey = buyer.key(lotId);
            MDC.put(CorrelationContext.STOCK_KEY_MDC_KEY, sellerKey + "->" + buyerKey);

            validateKey(sellerKey);
            validateKey(buyerKey);
            if (seller.equals(buyer)) {
                throw new LedgerValidationException("Seller and buyer must be different entities");
            }
            validateQuantity(MovementKind.TRANSFER_OUT, quantity);
            requireUsableLot(lotId, lotUsable);

            DualMovement dual = inCriticalSection(List.of(sellerKey, buyerKey), () -> {
                requireAvailable(sellerKey, quantity);
                Movement out = append(Movement.create(sellerKey, MovementKind.TRANSFER_OUT, quantity, reference, actorId));
                Movement in = append(Movement.create(buyerKey, MovementKind.TRANSFER_IN, quantity, reference, actorId));
                return new DualMovement(out, in);
            });

            metrics.recordMovement("DUAL_TRANSFER", "accepted");
            metrics.recordLatency("dual_movement", System.currentTimeMillis() - startTime);
            log.info("Dual movement recorded: out={}, in={}, quantity={}",
                dual.getOut().getId(), dual.getIn().getId(), quantity);
            return dual;

        } catch (LedgerException e) {
            metrics.recordMovement("DUAL_TRANSFER", e.getErrorCode());
            log.warn("Dual movement rejected: quantity={}, reason={}", quantity, e.getMessage());
            throw e;
        } finally {
            MDC.remove(CorrelationContext.STOCK_KEY_MDC_KEY);
        }
    }

    /**
     * Records a SALE for a single entity.
     */
    @Transactional
    public Movement processSingleSale(EntityRef entity, UUID lotId, int quantity,
                                      MovementReference reference, UUID actorId, boolean lotUsable) {
        if (entity == null) {
            throw new LedgerValidationException("Entity is required");
        }
        return recordMovement(entity.getKind(), entity.getId(), lotId, MovementKind.SALE,
            quantity, reference, actorId, lotUsable);
    }

    @Transactional(readOnly = true)
    public long getBalance(EntityKind entityKind, UUID entityId, UUID lotId) {
        StockKey key = new StockKey(entityKind, entityId, lotId);
        validateKey(key);
        return balanceCalculator.computeBalance(key);
    }

    @Transactional(readOnly = true)
    public List<Movement> getMovementHistory(EntityKind entityKind, UUID entityId, UUID lotId) {
        StockKey key = new StockKey(entityKind, entityId, lotId);
        validateKey(key);
        return movementStore.queryOrdered(key);
    }

    @Transactional(readOnly = true)
    public List<Movement> getMovementsByReference(UUID referenceId) {
        return movementStore.findByReference(referenceId);
    }

    private <T> T inCriticalSection(List<StockKey> keys, Supplier<T> body) {
        try {
            lockManager.lock(keys);
            return body.get();
        } catch (ConcurrencyFailureException e) {
            throw new ConcurrencyConflictException("Concurrent update on " + keys + ", retry the operation", e);
        }
    }

    private void requireAvailable(StockKey key, long required) {
        long balance = balanceCalculator.computeBalance(key);
        if (balance - required < 0) {
            throw new InsufficientStockException(key.toString(), balance, required);
        }
    }

    private Movement append(Movement movement) {
        movementStore.append(movement);
        auditSink.record(AuditRecord.builder()
            .actorId(movement.getActorId())
            .action(AuditAction.CREATE)
            .entityDescriptor("Movement:" + movement.getId())
            .afterState(movement.toAuditState())
            .timestamp(movement.getCreatedAt())
            .build());
        return movement;
    }

    private static void validateKey(StockKey key) {
        if (key.getEntityKind() == null || key.getEntityId() == null || key.getLotId() == null) {
            throw new LedgerValidationException("Entity kind, entity id and lot id are required");
        }
    }

    private static void validateQuantity(MovementKind kind, int quantity) {
        if (kind == null) {
            throw new LedgerValidationException("Movement kind is required");
        }
        if (kind == MovementKind.ADJUSTMENT) {
            if (quantity == 0) {
                throw new LedgerValidationException("Adjustment quantity must be non-zero");
            }
        } else if (quantity <= 0) {
            throw new LedgerValidationException("Quantity must be positive: " + quantity);
        }
    }

    private static void requireUsableLot(UUID lotId, boolean lotUsable) {
        if (!lotUsable) {
            throw new LotUnusableException(lotId);
        }
    }
}
