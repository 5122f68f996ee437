package com.flagship.nft_marketplace.health;

import com.flagship.nft_marketplace.marketplace.MarketplaceLedger;
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
 * Liveness endpoint that needs no actuator access.
 * Reports the database connection and the ledger's current sequence number.
 */
@RestController
public class HealthController {

    private final DataSource dataSource;
    private final MarketplaceLedger ledger;

    public HealthController(DataSource dataSource, MarketplaceLedger ledger) {
        this.dataSource = dataSource;
        this.ledger = ledger;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new LinkedHashMap<>();
        boolean dbHealthy = checkDatabase();

        response.put("status", dbHealthy ? "UP" : "DOWN");
        response.put("timestamp", Instant.now().toString());
        response.put("database", dbHealthy ? "UP" : "DOWN");
        response.put("ledgerSequence", ledger.getSequenceNumber());

        return dbHealthy ? ResponseEntity.ok(response) : ResponseEntity.status(503).body(response);
    }

    private boolean checkDatabase() {
        try (Connection connection = dataSource.getConnection()) {
            return connection.isValid(2);
        } catch (SQLException e) {
            return false;
        }
    }
}
