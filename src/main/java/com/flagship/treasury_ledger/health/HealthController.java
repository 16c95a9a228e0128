package com.flagship.treasury_ledger.health;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
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
 * Unauthenticated liveness endpoint. Also states whether this instance
 * holds real value: any mode other than {@code live} is non-value-bearing.
 */
@RestController
@Slf4j
public class HealthController {

    static final String LIVE_MODE = "live";

    private final DataSource dataSource;
    private final String mode;

    public HealthController(DataSource dataSource, @Value("${treasury.mode:demo}") String mode) {
        this.dataSource = dataSource;
        this.mode = mode;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        boolean dbHealthy = checkDatabase();

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", dbHealthy ? "UP" : "DOWN");
        response.put("timestamp", Instant.now().toString());
        response.put("database", dbHealthy ? "UP" : "DOWN");
        response.put("mode", mode);
        response.put("non_value_bearing", !LIVE_MODE.equals(mode));

        if (!dbHealthy) {
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
}
