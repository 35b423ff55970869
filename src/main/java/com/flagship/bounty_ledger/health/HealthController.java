package com.flagship.bounty_ledger.health;

import com.flagship.bounty_ledger.config.BountyProperties;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Public liveness endpoint: database reachability plus which collaborators are configured.
 * Collaborators are reported, not probed; an unconfigured one does not make the service DOWN.
 */
@RestController
public class HealthController {

    private final DataSource dataSource;
    private final BountyProperties properties;

    public HealthController(DataSource dataSource, BountyProperties properties) {
        this.dataSource = dataSource;
        this.properties = properties;
    }

    @GetMapping("/api/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "UP");
        response.put("timestamp", Instant.now().toString());

        boolean dbHealthy = checkDatabase();
        response.put("database", dbHealthy ? "UP" : "DOWN");
        response.put("services", services());

        if (!dbHealthy) {
            response.put("status", "DOWN");
            return ResponseEntity.status(503).body(response);
        }

        return ResponseEntity.ok(response);
    }

    private Map<String, Object> services() {
        BountyProperties.Settlement settlement = properties.getSettlement();

        Map<String, Object> solana = new LinkedHashMap<>();
        solana.put("configured", settlement.isSignerConfigured());
        solana.put("funding_address", settlement.hasFundingAddress() ? settlement.getFundingAddress() : null);
        solana.put("network", settlement.getNetwork());

        Map<String, Object> services = new LinkedHashMap<>();
        services.put("approval_judge", properties.getJudge().isConfigured());
        services.put("solana", solana);
        services.put("admin_api", properties.getAdmin().isConfigured());
        return services;
    }

    private boolean checkDatabase() {
        try (Connection connection = dataSource.getConnection()) {
            return connection.isValid(2);
        } catch (SQLException e) {
            return false;
        }
    }
}
