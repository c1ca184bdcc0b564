package com.pharmatrack.ledger_core.stock.lock;

import com.pharmatrack.ledger_core.stock.StockKey;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * JVM-local keyed locks, released after the enclosing transaction completes.
 * An entry lives only while some thread holds or waits for its key.
 *
 * Only correct when a single instance writes to the database.
 */
public class InProcessStockLockManager implements StockLockManager {

    private final ConcurrentMap<StockKey, KeyLock> locks = new ConcurrentHashMap<>();
    private final Duration timeout;

    public InProcessStockLockManager(Duration timeout) {
        this.timeout = timeout;
    }

    @Override
    public void lock(Collection<StockKey> keys) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            throw new IllegalStateException("Stock locks require an active transaction");
        }

        List<StockKey> acquired = new ArrayList<>();
        try {
            for (StockKey key : new TreeSet<>(keys)) {
                KeyLock entry = retain(key);
                boolean locked = false;
                try {
                    locked = entry.lock.tryLock(timeout.toMillis(), TimeUnit.MILLISECONDS);
                } finally {
                    if (!locked) {
                        release(key);
                    }
                }
                if (!locked) {
                    throw new CannotAcquireLockException("Timed out waiting for stock lock " + key);
                }
                acquired.add(key);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            releaseAll(acquired);
            throw new CannotAcquireLockException("Interrupted while waiting for stock lock", e);
        } catch (RuntimeException e) {
            releaseAll(acquired);
            throw e;
        }

        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCompletion(int status) {
                releaseAll(acquired);
            }
        });
    }

    int trackedKeyCount() {
        return locks.size();
    }

    private KeyLock retain(StockKey key) {
        return locks.compute(key, (k, entry) -> {
            KeyLock retained = entry != null ? entry : new KeyLock();
            retained.users++;
            return retained;
        });
    }

    private void release(StockKey key) {
        locks.computeIfPresent(key, (k, entry) -> --entry.users == 0 ? null : entry);
    }

    private void releaseAll(List<StockKey> acquired) {
        for (int i = acquired.size() - 1; i >= 0; i--) {
            StockKey key = acquired.get(i);
            locks.get(key).lock.unlock();
            release(key);
        }
    }

    // users is only touched inside compute calls for its key
    private static final class KeyLock {
        private final ReentrantLock lock = new ReentrantLock();
        private int users;
    }
}
