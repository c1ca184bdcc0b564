package com.pharmatrack.ledger_core.lot;

import com.pharmatrack.ledger_core.config.LedgerProperties;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class ConfiguredLotRegistryTest {

    @Test
    void blockedLotsAreUnusable() {
        UUID blocked = UUID.randomUUID();
        LedgerProperties properties = new LedgerProperties();
        properties.getLots().setBlocked(List.of(blocked));

        ConfiguredLotRegistry registry = new ConfiguredLotRegistry(properties);

        assertFalse(registry.isLotUsable(blocked));
        assertTrue(registry.isLotUsable(UUID.randomUUID()));
        assertFalse(registry.isLotUsable(null));
    }
}
