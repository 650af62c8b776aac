package org.relaychat.controller;

import lombok.RequiredArgsConstructor;
import org.relaychat.kv.KvClient;
import org.relaychat.service.identity.OutboxService;
import org.relaychat.service.identity.OutboxStats;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequiredArgsConstructor
public class HealthController {

    private final KvClient kvClient;
    private final OutboxService outboxService;

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> health = new LinkedHashMap<>();
        boolean up = true;

        try {
            kvClient.exists("health-check");
            health.put("redis", "UP");
        } catch (Exception e) {
            health.put("redis", "DOWN");
            health.put("redisError", e.getMessage());
        }

        try {
            OutboxStats stats = outboxService.stats();
            health.put("database", "UP");
            health.put("outboxPending", stats.pending());
            health.put("outboxDead", stats.dead());
        } catch (Exception e) {
            up = false;
            health.put("database", "DOWN");
            health.put("databaseError", e.getMessage());
        }

        // Redis indisponible : service dégradé, les écritures continuent et l'outbox se videra au retour
        health.put("status", !up ? "DOWN" : "UP".equals(health.get("redis")) ? "UP" : "DEGRADED");
        return ResponseEntity.status(up ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE).body(health);
    }
}
