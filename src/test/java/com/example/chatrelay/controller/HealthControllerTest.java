package com.example.chatrelay.controller;

import com.example.chatrelay.kv.KvClient;
import com.example.chatrelay.store.ItemRepository;
import com.example.chatrelay.store.StorageException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class HealthControllerTest {

    @Mock
    private ItemRepository chatEvents;

    @Mock
    private KvClient kvClient;

    @Test
    void testHealth_StoreUpWithoutRedisCheck() {
        // Given
        when(chatEvents.findByKey(any(), isNull(), anyInt())).thenReturn(Optional.empty());
        HealthController controller = new HealthController(chatEvents, kvClient, "store");

        // When
        Map<String, Object> body = controller.health().getBody();

        // Then
        assertEquals("UP", body.get("status"));
        assertEquals("UP", body.get("store"));
        assertFalse(body.containsKey("redis"));
        verifyNoInteractions(kvClient);
    }

    @Test
    void testHealth_DegradedWhenRedisDown() {
        // Given
        when(chatEvents.findByKey(any(), isNull(), anyInt())).thenReturn(Optional.empty());
        when(kvClient.get("health-check")).thenThrow(new IllegalStateException("connection refused"));
        HealthController controller = new HealthController(chatEvents, kvClient, "kv");

        // When
        Map<String, Object> body = controller.health().getBody();

        // Then
        assertEquals("DEGRADED", body.get("status"));
        assertEquals("DOWN", body.get("redis"));
    }

    @Test
    void testHealth_DegradedWhenStoreDown() {
        // Given
        when(chatEvents.findByKey(any(), isNull(), anyInt())).thenThrow(new StorageException("mongo down"));
        HealthController controller = new HealthController(chatEvents, kvClient, "store");

        // When
        Map<String, Object> body = controller.health().getBody();

        // Then
        assertEquals("DEGRADED", body.get("status"));
        assertEquals("DOWN", body.get("store"));
        assertEquals("mongo down", body.get("storeError"));
    }
}
