package com.pharmatrack.ledger_core.observability;

import com.pharmatrack.ledger_core.journal.JournalStore;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * DOWN when any posted journal entry does not balance.
 */
@Component("ledgerIntegrity")
public class LedgerIntegrityHealthIndicator implements HealthIndicator {

    private final JournalStore journalStore;

    public LedgerIntegrityHealthIndicator(JournalStore journalStore) {
        this.journalStore = journalStore;
    }

    @Override
    public Health health() {
        try {
            long unbalanced = journalStore.countUnbalancedPostedEntries();

            Health.Builder builder = unbalanced == 0 ? Health.up() : Health.down();
            return builder
                    .withDetail("unbalancedPostedEntries", unbalanced)
                    .build();

        } catch (Exception e) {
            return Health.down()
                    .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                    .build();
        }
    }
}
