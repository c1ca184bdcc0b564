package com.pharmatrack.ledger_core.stock;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.TreeSet;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class StockKeyTest {

    @Test
    @DisplayName("Canonical order is kind, then entity id, then lot id, whatever the insertion order")
    void canonicalOrder() {
        UUID lot = UUID.fromString("00000000-0000-0000-0000-000000000001");
        UUID lowEntity = UUID.fromString("00000000-0000-0000-0000-00000000000a");
        UUID highEntity = UUID.fromString("00000000-0000-0000-0000-00000000000b");

        StockKey wholesale = new StockKey(EntityKind.WHOLESALE_PHARMACY, highEntity, lot);
        StockKey retailHigh = new StockKey(EntityKind.RETAIL_PHARMACY, highEntity, lot);
        StockKey retailLow = new StockKey(EntityKind.RETAIL_PHARMACY, lowEntity, lot);

        List<StockKey> forward = List.copyOf(new TreeSet<>(List.of(wholesale, retailHigh, retailLow)));
        List<StockKey> backward = List.copyOf(new TreeSet<>(List.of(retailLow, retailHigh, wholesale)));

        assertEquals(List.of(wholesale, retailLow, retailHigh), forward);
        assertEquals(forward, backward);
    }

    @Test
    void stringFormIncludesAllParts() {
        UUID entity = UUID.randomUUID();
        UUID lot = UUID.randomUUID();
        StockKey key = EntityRef.of(EntityKind.PUBLIC_FACILITY, entity).key(lot);

        assertEquals("PUBLIC_FACILITY:" + entity + ":" + lot, key.toString());
    }
}
