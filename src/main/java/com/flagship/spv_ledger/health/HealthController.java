package com.flagship.spv_ledger.health;

import com.flagship.spv_ledger.spv.RebuildResult;
import com.flagship.spv_ledger.spv.RebuildStatus;
import com.flagship.spv_ledger.spv.SpvRebuildService;
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
 * Liveness endpoint. Unlike the Actuator health endpoint it needs no authorization.
 * A failed rebuild reports DOWN; a pending or running one does not.
 */
@RestController
@Slf4j
public class HealthController {

    private final DataSource dataSource;
    private final SpvRebuildService rebuildService;

    public HealthController(DataSource dataSource, SpvRebuildService rebuildService) {
        this.dataSource = dataSource;
        this.rebuildService = rebuildService;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "UP");
        response.put("timestamp", Instant.now().toString());

        boolean dbHealthy = checkDatabase();
        response.put("database", dbHealthy ? "UP" : "DOWN");

        RebuildStatus rebuild = rebuildService.getLastResult()
            .map(RebuildResult::getStatus)
            .orElse(null);
        response.put("rebuild", rebuild != null ? rebuild.name() : "PENDING");

        if (!dbHealthy || rebuild == RebuildStatus.FAILED) {
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
}
