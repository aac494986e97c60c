package com.flagship.pocket_ledger.health;

import com.flagship.pocket_ledger.store.LedgerStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Liveness/readiness endpoint: the database answers and the reference currency is seeded.
 */
@RestController
@Slf4j
public class HealthController {

    private final DataSource dataSource;
    private final LedgerStore store;

    public HealthController(DataSource dataSource, LedgerStore store) {
        this.dataSource = dataSource;
        this.store = store;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "UP");
        response.put("timestamp", Instant.now().toString());

        boolean dbHealthy = checkDatabase();
        response.put("database", dbHealthy ? "UP" : "DOWN");
        boolean referenceHealthy = dbHealthy && checkReferenceCurrency();
        response.put("referenceCurrency", referenceHealthy ? "UP" : "DOWN");

        if (!dbHealthy || !referenceHealthy) {
            response.put("status", "DOWN");
            return ResponseEntity.status(503).body(response);
        }

        return ResponseEntity.ok(response);
    }

    private boolean checkDatabase() {
        try (Connection connection = dataSource.getConnection()) {
            return connection.isValid(2);
        } catch (SQLException e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return false;
        }
    }

    private boolean checkReferenceCurrency() {
        try {
            store.referenceCurrencyId();
            return true;
        } catch (IllegalStateException e) {
            log.warn("Reference currency check failed: {}", e.getMessage());
            return false;
        }
    }
}
