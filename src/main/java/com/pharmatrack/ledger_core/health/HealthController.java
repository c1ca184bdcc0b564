package com.pharmatrack.ledger_core.health;

import com.pharmatrack.ledger_core.observability.LedgerIntegrityHealthIndicator;
import org.springframework.boot.actuate.health.Status;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import javax.sql.DataSource;
import java.sql.Connection;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Simple health check endpoint for liveness/readiness probes.
 * Unlike the Actuator health endpoint, this does not require authorization.
 */
@RestController
public class HealthController {

    private final DataSource dataSource;
    private final LedgerIntegrityHealthIndicator integrityIndicator;

    public HealthController(DataSource dataSource, LedgerIntegrityHealthIndicator integrityIndicator) {
        this.dataSource = dataSource;
        this.integrityIndicator = integrityIndicator;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "UP");
        response.put("timestamp", Instant.now().toString());

        boolean dbHealthy = checkDatabase();
        response.put("database", dbHealthy ? "UP" : "DOWN");

        boolean ledgerHealthy = dbHealthy && Status.UP.equals(integrityIndicator.health().getStatus());
        response.put("ledgerIntegrity", ledgerHealthy ? "UP" : "DOWN");

        if (!dbHealthy || !ledgerHealthy) {
            response.put("status", "DOWN");
            return ResponseEntity.status(503).body(response);
        }

        return ResponseEntity.ok(response);
    }

    private boolean checkDatabase() {
        try (Connection connection = dataSource.getConnection()) {
            return connection.isValid(2);
        } catch (Exception e) {
            return false;
        }
    }
}
