package com.pharmatrack.ledger_core.config;

import com.pharmatrack.ledger_core.stock.lock.AdvisoryStockLockManager;
import com.pharmatrack.ledger_core.stock.lock.InProcessStockLockManager;
import com.pharmatrack.ledger_core.stock.lock.StockLockManager;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * Chooses the critical-section implementation for stock keys.
 */
@Configuration
@Slf4j
public class LockingConfig {

    @Bean
    public StockLockManager stockLockManager(LedgerProperties properties, JdbcTemplate jdbcTemplate) {
        LedgerProperties.Locking locking = properties.getLocking();
        log.info("Stock lock strategy: {} (timeout={})", locking.getStrategy(), locking.getTimeout());

        return switch (locking.getStrategy()) {
            case ADVISORY -> new AdvisoryStockLockManager(jdbcTemplate, locking.getTimeout());
            case IN_PROCESS -> new InProcessStockLockManager(locking.getTimeout());
        };
    }
}
