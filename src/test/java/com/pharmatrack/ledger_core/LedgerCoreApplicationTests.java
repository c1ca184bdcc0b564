package com.pharmatrack.ledger_core;

import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class LedgerCoreApplicationTests {

    @Test
    void contextLoads() {
    }
}
