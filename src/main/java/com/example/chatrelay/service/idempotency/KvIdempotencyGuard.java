package com.example.chatrelay.service.idempotency;

import com.example.chatrelay.kv.KvClient;

import java.time.Duration;

/**
 * Guard kept in Redis; expiry is the key TTL.
 */
public class KvIdempotencyGuard implements IdempotencyGuard {

    private final KvClient kvClient;
    private final String prefix;

    public KvIdempotencyGuard(KvClient kvClient, String prefix) {
        this.kvClient = kvClient;
        this.prefix = prefix;
    }

    @Override
    public boolean alreadyProcessed(String eventId) {
        return kvClient.get(key(eventId)).isPresent();
    }

    @Override
    public void markProcessed(String eventId, long ttlSeconds) {
        kvClient.set(key(eventId), "COMPLETED", Duration.ofSeconds(ttlSeconds));
    }

    private String key(String eventId) {
        return prefix + ":" + eventId;
    }
}
