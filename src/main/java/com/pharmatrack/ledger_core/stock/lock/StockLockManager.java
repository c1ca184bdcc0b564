package com.pharmatrack.ledger_core.stock.lock;

import com.pharmatrack.ledger_core.stock.StockKey;

import java.util.Collection;

/**
 * Keyed critical sections for stock writes.
 *
 * Locks are scoped to the current transaction: they are held until it
 * commits or rolls back, so a competing writer always sees the winner's
 * committed movement when it recomputes the balance.
 */
public interface StockLockManager {

    /**
     * Acquires the locks for all keys, in canonical key order.
     *
     * @throws IllegalStateException if no transaction is active
     * @throws org.springframework.dao.CannotAcquireLockException if a lock cannot
     *         be obtained within the configured timeout
     */
    void lock(Collection<StockKey> keys);
}
