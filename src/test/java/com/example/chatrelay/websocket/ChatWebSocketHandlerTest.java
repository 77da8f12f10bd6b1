package com.example.chatrelay.websocket;

import com.example.chatrelay.model.ChannelMessageRequest;
import com.example.chatrelay.model.ChatEvent;
import com.example.chatrelay.model.ChatRole;
import com.example.chatrelay.service.ChannelMessageService;
import com.example.chatrelay.service.connection.ConnectionRegistry;
import com.example.chatrelay.service.connection.RepositoryConnectionRegistry;
import com.example.chatrelay.service.stage.DeliveryStage;
import com.example.chatrelay.store.InMemoryItemRepository;
import com.example.chatrelay.store.StorageException;
import com.example.chatrelay.store.TableDefinition;
import com.example.chatrelay.transport.LocalSessionTransport;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.net.URI;
import java.time.Clock;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ChatWebSocketHandlerTest {

    @Mock
    private ConnectionRegistry registry;

    @Mock
    private ChannelMessageService messageService;

    @Mock
    private WebSocketSession session;

    private final Map<String, Object> attributes = new HashMap<>();
    private LocalSessionTransport transport;
    private ChatWebSocketHandler handler;

    @BeforeEach
    void setUp() {
        transport = new LocalSessionTransport(5000, 512 * 1024);
        handler = new ChatWebSocketHandler(registry, transport, messageService, new ObjectMapper());
        lenient().when(session.getId()).thenReturn("s1");
        lenient().when(session.getAttributes()).thenReturn(attributes);
    }

    @Test
    void testConnect_RegistersChannelConnection() throws Exception {
        // Given
        when(session.getUri()).thenReturn(URI.create("ws://localhost:8080/ws?channelId=c1"));

        // When
        handler.afterConnectionEstablished(session);

        // Then
        verify(registry).add("s1", "c1");
        assertTrue(transport.isAttached("s1"));
        assertEquals("c1", attributes.get("channelId"));
    }

    @Test
    void testConnect_WithoutChannelReceivesEverything() throws Exception {
        // Given
        when(session.getUri()).thenReturn(URI.create("ws://localhost:8080/ws"));

        // When
        handler.afterConnectionEstablished(session);

        // Then
        verify(registry).add("s1", null);
        assertTrue(transport.isAttached("s1"));
    }

    @Test
    void testConnect_RegistryFailureClosesSession() throws Exception {
        // Given
        when(session.getUri()).thenReturn(URI.create("ws://localhost:8080/ws?channelId=c1"));
        doThrow(new StorageException("connections unavailable")).when(registry).add("s1", "c1");

        // When
        handler.afterConnectionEstablished(session);

        // Then
        verify(session).close(CloseStatus.SERVER_ERROR);
        assertFalse(transport.isAttached("s1"));
    }

    @Test
    void testConnect_DeliveryDuringRegistrationKeepsConnection() throws Exception {
        // Given
        when(session.getUri()).thenReturn(URI.create("ws://localhost:8080/ws?channelId=c1"));
        when(session.isOpen()).thenReturn(true);
        ExecutorService executor = Executors.newSingleThreadExecutor();
        ChatEvent concurrent = ChatEvent.builder()
                .id("m1").channelId("c1").ts(1_700_000_000L).senderId("u1").role(ChatRole.USER).content("hello")
                .build();
        DeliveryStage[] delivery = new DeliveryStage[1];
        ConnectionRegistry liveRegistry = new RepositoryConnectionRegistry(new InMemoryItemRepository(TableDefinition.builder()
                .name("connections")
                .partitionKey("connectionId")
                .build()), Clock.systemUTC()) {
            @Override
            public void add(String connectionId, String channelId) {
                super.add(connectionId, channelId);
                delivery[0].deliver(concurrent);
            }
        };
        delivery[0] = new DeliveryStage(liveRegistry, transport, new ObjectMapper(), executor);
        ChatWebSocketHandler liveHandler = new ChatWebSocketHandler(liveRegistry, transport, messageService, new ObjectMapper());

        try {
            // When
            liveHandler.afterConnectionEstablished(session);

            // Then
            assertTrue(transport.isAttached("s1"));
            assertEquals(1, liveRegistry.listConnections("c1").size());
            verify(session).sendMessage(any(TextMessage.class));
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void testClose_DetachesAndRemoves() throws Exception {
        // Given
        transport.attach("s1", session);

        // When
        handler.afterConnectionClosed(session, CloseStatus.NORMAL);

        // Then
        verify(registry).remove("s1");
        assertFalse(transport.isAttached("s1"));
    }

    @Test
    void testTextMessage_SubmitsToBoundChannel() throws Exception {
        // Given
        attributes.put("channelId", "c1");

        // When
        handler.handleMessage(session, new TextMessage("{\"id\":\"m1\",\"content\":\"hello\",\"senderId\":\"u1\"}"));

        // Then
        ArgumentCaptor<ChannelMessageRequest> captor = ArgumentCaptor.forClass(ChannelMessageRequest.class);
        verify(messageService).sendMessage(eq("c1"), captor.capture());
        assertEquals("m1", captor.getValue().getId());
        assertEquals("hello", captor.getValue().getContent());
    }

    @Test
    void testTextMessage_IgnoredWithoutChannel() throws Exception {
        // When
        handler.handleMessage(session, new TextMessage("{\"id\":\"m1\",\"content\":\"hello\",\"senderId\":\"u1\"}"));

        // Then
        verify(messageService, never()).sendMessage(anyString(), any());
    }

    @Test
    void testTextMessage_MalformedJsonIsRejected() throws Exception {
        // Given
        attributes.put("channelId", "c1");

        // When
        handler.handleMessage(session, new TextMessage("not json"));

        // Then
        verify(messageService, never()).sendMessage(anyString(), any());
    }
}
