package com.example.chatrelay.controller;

import com.example.chatrelay.kv.KvClient;
import com.example.chatrelay.store.ItemKey;
import com.example.chatrelay.store.ItemRepository;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.Map;

@RestController
public class HealthController {

    private final ItemRepository chatEvents;
    private final KvClient kvClient;
    private final boolean kvInUse;

    public HealthController(@Qualifier("chatEventsRepository") ItemRepository chatEvents,
                            KvClient kvClient,
                            @Value("${app.idempotency.backend:store}") String idempotencyBackend) {
        this.chatEvents = chatEvents;
        this.kvClient = kvClient;
        this.kvInUse = "kv".equals(idempotencyBackend);
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> health = new HashMap<>();
        health.put("status", "UP");
        health.put("service", "chat-relay");

        try {
            chatEvents.findByKey(ItemKey.of("health-check"), null, 1);
            health.put("store", "UP");
        } catch (Exception e) {
            health.put("status", "DEGRADED");
            health.put("store", "DOWN");
            health.put("storeError", e.getMessage());
        }

        if (kvInUse) {
            try {
                kvClient.get("health-check");
                health.put("redis", "UP");
            } catch (Exception e) {
                health.put("status", "DEGRADED");
                health.put("redis", "DOWN");
                health.put("redisError", e.getMessage());
            }
        }

        return ResponseEntity.ok(health);
    }
}
