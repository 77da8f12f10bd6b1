package com.example.chatrelay.service.idempotency;

import com.example.chatrelay.store.CreateResult;
import com.example.chatrelay.store.ItemKey;
import com.example.chatrelay.store.ItemRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;

/**
 * Guard stored in its own table: one item per event id with an
 * {@code expiration} in unix seconds. Expired items count as absent and are
 * refreshed in place when the event is processed again.
 */
public class RepositoryIdempotencyGuard implements IdempotencyGuard {

    private static final Logger logger = LoggerFactory.getLogger(RepositoryIdempotencyGuard.class);

    static final String STATUS = "status";
    static final String EXPIRATION = "expiration";
    static final String COMPLETED = "COMPLETED";

    private final ItemRepository records;
    private final Clock clock;

    public RepositoryIdempotencyGuard(ItemRepository records, Clock clock) {
        this.records = records;
        this.clock = clock;
    }

    @Override
    public boolean alreadyProcessed(String eventId) {
        Optional<Map<String, Object>> record = records.findByKey(ItemKey.of(eventId));
        return record.map(item -> expiration(item) > now()).orElse(false);
    }

    @Override
    public void markProcessed(String eventId, long ttlSeconds) {
        long expiration = now() + ttlSeconds;
        String key = records.getTable().getPartitionKey();
        CreateResult result = records.createIfAbsent(Map.of(key, eventId, STATUS, COMPLETED, EXPIRATION, expiration));
        if (!result.isCreated()) {
            logger.debug("Refreshing expired idempotency record for {}", eventId);
            records.update(Map.of(STATUS, COMPLETED, EXPIRATION, expiration), ItemKey.of(eventId));
        }
    }

    private long now() {
        return clock.instant().getEpochSecond();
    }

    private static long expiration(Map<String, Object> item) {
        Object value = item.get(EXPIRATION);
        return value instanceof Number ? ((Number) value).longValue() : 0L;
    }
}
