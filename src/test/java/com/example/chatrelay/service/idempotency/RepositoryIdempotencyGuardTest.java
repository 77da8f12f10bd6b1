package com.example.chatrelay.service.idempotency;

import com.example.chatrelay.store.InMemoryItemRepository;
import com.example.chatrelay.store.ItemKey;
import com.example.chatrelay.store.TableDefinition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RepositoryIdempotencyGuardTest {

    private static final Instant NOW = Instant.ofEpochSecond(1_700_000_000L);

    private InMemoryItemRepository records;

    @BeforeEach
    void setUp() {
        records = new InMemoryItemRepository(TableDefinition.builder()
                .name("responder_idempotency")
                .partitionKey("id")
                .keyAutoAssign(false)
                .build());
    }

    private RepositoryIdempotencyGuard guardAt(Instant instant) {
        return new RepositoryIdempotencyGuard(records, Clock.fixed(instant, ZoneOffset.UTC));
    }

    @Test
    void testAlreadyProcessed_UnknownEvent() {
        assertFalse(guardAt(NOW).alreadyProcessed("m1"));
    }

    @Test
    void testMarkProcessed_StoresCompletedRecordWithExpiration() {
        // Given
        RepositoryIdempotencyGuard guard = guardAt(NOW);

        // When
        guard.markProcessed("m1", 3600);

        // Then
        assertTrue(guard.alreadyProcessed("m1"));
        Map<String, Object> record = records.getByKey(ItemKey.of("m1"));
        assertEquals("COMPLETED", record.get("status"));
        assertEquals(NOW.getEpochSecond() + 3600, ((Number) record.get("expiration")).longValue());
    }

    @Test
    void testAlreadyProcessed_ExpiredRecordCountsAsAbsent() {
        // Given
        guardAt(NOW).markProcessed("m1", 60);

        // When
        RepositoryIdempotencyGuard later = guardAt(NOW.plusSeconds(61));

        // Then
        assertFalse(later.alreadyProcessed("m1"));
    }

    @Test
    void testMarkProcessed_RefreshesExpiredRecord() {
        // Given
        guardAt(NOW).markProcessed("m1", 60);
        RepositoryIdempotencyGuard later = guardAt(NOW.plusSeconds(120));

        // When
        later.markProcessed("m1", 60);

        // Then
        assertTrue(later.alreadyProcessed("m1"));
        assertEquals(1, records.getList().size());
        assertEquals(NOW.getEpochSecond() + 180, ((Number) records.getByKey(ItemKey.of("m1")).get("expiration")).longValue());
    }
}
