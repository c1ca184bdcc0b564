package com.pharmatrack.ledger_core.lot;

import com.pharmatrack.ledger_core.config.LedgerProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.UUID;

/**
 * Lot registry driven by {@code ledger.lots.blocked}. Every lot not listed
 * there is usable.
 */
@Component
@Slf4j
public class ConfiguredLotRegistry implements LotRegistry {

    private final Set<UUID> blockedLots;

    public ConfiguredLotRegistry(LedgerProperties properties) {
        this.blockedLots = Set.copyOf(properties.getLots().getBlocked());
        if (!blockedLots.isEmpty()) {
            log.info("{} lot(s) configured as blocked", blockedLots.size());
        }
    }

    @Override
    public boolean isLotUsable(UUID lotId) {
        return lotId != null && !blockedLots.contains(lotId);
    }
}
