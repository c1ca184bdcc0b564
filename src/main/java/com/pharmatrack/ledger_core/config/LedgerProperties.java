package com.pharmatrack.ledger_core.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Settings under the {@code ledger.*} prefix.
 */
@ConfigurationProperties("ledger")
@Getter
@Setter
public class LedgerProperties {

    private Locking locking = new Locking();
    private Lots lots = new Lots();

    public enum LockStrategy {
        /** PostgreSQL transaction-scoped advisory locks. */
        ADVISORY,
        /** JVM-local keyed locks; single instance only. */
        IN_PROCESS
    }

    @Getter
    @Setter
    public static class Locking {
        private LockStrategy strategy = LockStrategy.ADVISORY;
        private Duration timeout = Duration.ofSeconds(5);
    }

    @Getter
    @Setter
    public static class Lots {
        /** Lot ids reported as unusable by the configured lot registry. */
        private List<UUID> blocked = new ArrayList<>();
    }
}
