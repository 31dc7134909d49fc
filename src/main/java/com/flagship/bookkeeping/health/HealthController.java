package com.flagship.bookkeeping.health;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Plain liveness/readiness endpoint mirroring {@link LedgerHealthIndicator}, outside actuator.
 */
@RestController
public class HealthController {

    private final LedgerHealthIndicator ledgerHealth;
    private final Clock clock;

    public HealthController(LedgerHealthIndicator ledgerHealth, Clock clock) {
        this.ledgerHealth = ledgerHealth;
        this.clock = clock;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Health ledger = ledgerHealth.health();
        boolean up = Status.UP.equals(ledger.getStatus());

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", up ? "UP" : "DOWN");
        response.put("timestamp", Instant.now(clock).toString());
        response.put("ledger", ledger.getDetails());

        if (!up) {
            return ResponseEntity.status(503).body(response);
        }
        return ResponseEntity.ok(response);
    }
}
