package com.pharmatrack.ledger_core.stock.lock;

import com.pharmatrack.ledger_core.stock.StockKey;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.util.Collection;
import java.util.TreeSet;

/**
 * PostgreSQL transaction-scoped advisory locks.
 *
 * Each stock key maps to a 63-bit lock id taken from the SHA-256 of its
 * string form. {@code pg_advisory_xact_lock} is released by the database at
 * commit or rollback.
 */
@Slf4j
public class AdvisoryStockLockManager implements StockLockManager {

    private final JdbcTemplate jdbcTemplate;
    private final Duration timeout;

    public AdvisoryStockLockManager(JdbcTemplate jdbcTemplate, Duration timeout) {
        this.jdbcTemplate = jdbcTemplate;
        this.timeout = timeout;
    }

    @Override
    public void lock(Collection<StockKey> keys) {
        if (!TransactionSynchronizationManager.isActualTransactionActive()) {
            throw new IllegalStateException("Stock locks require an active transaction");
        }

        // lock_timeout is local to this transaction
        jdbcTemplate.queryForObject(
            "SELECT set_config('lock_timeout', ?, true)",
            String.class,
            timeout.toMillis() + "ms"
        );

        for (StockKey key : new TreeSet<>(keys)) {
            long lockId = lockIdFor(key);
            log.debug("Acquiring advisory lock {} for {}", lockId, key);
            jdbcTemplate.query("SELECT pg_advisory_xact_lock(?)", rs -> { }, lockId);
        }
    }

    static long lockIdFor(StockKey key) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(key.toString().getBytes(StandardCharsets.UTF_8));
            return ByteBuffer.wrap(hash, 0, Long.BYTES).getLong() & Long.MAX_VALUE;
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
