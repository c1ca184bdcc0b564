package com.pharmatrack.ledger_core.stock;

import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Derives the balance of a stock key from its movements.
 *
 * Balances are never stored:
 * balance = inbound - outbound + signed adjustments.
 */
@Component
public class BalanceCalculator {

    public static final Set<MovementKind> INBOUND =
        EnumSet.of(MovementKind.IMPORT, MovementKind.TRANSFER_IN, MovementKind.RETURN);

    public static final Set<MovementKind> OUTBOUND =
        EnumSet.of(MovementKind.TRANSFER_OUT, MovementKind.SALE, MovementKind.RECALL_REMOVAL);

    private final MovementStore movementStore;

    public BalanceCalculator(MovementStore movementStore) {
        this.movementStore = movementStore;
    }

    public long computeBalance(StockKey key) {
        Map<MovementKind, Long> totals = movementStore.totalsByKind(key);
        long balance = 0;
        for (Map.Entry<MovementKind, Long> total : totals.entrySet()) {
            balance += signedQuantity(total.getKey(), total.getValue());
        }
        return balance;
    }

    /**
     * Same result as {@link #computeBalance(StockKey)} over an in-memory history.
     */
    public static long balanceOf(Iterable<Movement> movements) {
        long balance = 0;
        for (Movement movement : movements) {
            balance += signedQuantity(movement.getMovementKind(), movement.getQuantity());
        }
        return balance;
    }

    /**
     * Effect of a quantity of the given kind on the balance.
     */
    public static long signedQuantity(MovementKind kind, long quantity) {
        if (INBOUND.contains(kind)) {
            return quantity;
        }
        if (OUTBOUND.contains(kind)) {
            return -quantity;
        }
        // ADJUSTMENT is stored with its sign
        return quantity;
    }

    /**
     * True when the movement lowers the balance and must pass the balance check.
     */
    public static boolean consumesStock(MovementKind kind, long quantity) {
        return signedQuantity(kind, quantity) < 0;
    }
}
