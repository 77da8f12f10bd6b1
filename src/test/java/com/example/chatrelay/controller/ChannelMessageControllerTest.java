package com.example.chatrelay.controller;

import com.example.chatrelay.model.ChannelMessageRequest;
import com.example.chatrelay.model.ChatEvent;
import com.example.chatrelay.model.ChatRole;
import com.example.chatrelay.service.ChannelMessageService;
import com.example.chatrelay.service.stage.DeliveryResult;
import com.example.chatrelay.store.StorageException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;
import java.util.Set;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class ChannelMessageControllerTest {

    @Mock
    private ChannelMessageService messageService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new ChannelMessageController(messageService))
                .setControllerAdvice(new ApiExceptionHandler())
                .build();
    }

    private static ChatEvent event(String id, ChatRole role, String content) {
        return ChatEvent.builder()
                .id(id).channelId("c1").ts(1_700_000_000L).senderId("u1").role(role).content(content)
                .contentType("text").createdAtIso("2023-11-14T22:13:20Z")
                .build();
    }

    @Test
    void testList_ReturnsMessagesInOrder() throws Exception {
        // Given
        when(messageService.listMessages("c1")).thenReturn(List.of(
                event("m1", ChatRole.USER, "hello"),
                event("r1", ChatRole.ASSISTANT, "AI Response to: hello")));

        // When / Then
        mockMvc.perform(get("/channels/c1/messages"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].id").value("m1"))
                .andExpect(jsonPath("$[0].role").value("user"))
                .andExpect(jsonPath("$[1].role").value("assistant"))
                .andExpect(jsonPath("$[1].content").value("AI Response to: hello"));
    }

    @Test
    void testSend_ReturnsStoredEvent() throws Exception {
        // Given
        when(messageService.sendMessage(eq("c1"), any(ChannelMessageRequest.class)))
                .thenReturn(event("m1", ChatRole.USER, "hello"));

        // When / Then
        mockMvc.perform(post("/channels/c1/messages")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"id\":\"m1\",\"content\":\"hello\",\"senderId\":\"u1\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value("m1"))
                .andExpect(jsonPath("$.createdAtIso").value("2023-11-14T22:13:20Z"));
    }

    @Test
    void testSend_InvalidRequestIsBadRequest() throws Exception {
        // Given
        when(messageService.sendMessage(eq("c1"), any(ChannelMessageRequest.class)))
                .thenThrow(new IllegalArgumentException("Field 'id' is required"));

        // When / Then
        mockMvc.perform(post("/channels/c1/messages")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"content\":\"hello\",\"senderId\":\"u1\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Field 'id' is required"));
    }

    @Test
    void testList_StorageFailureIsServiceUnavailable() throws Exception {
        // Given
        when(messageService.listMessages("c1")).thenThrow(new StorageException("mongo down"));

        // When / Then
        mockMvc.perform(get("/channels/c1/messages"))
                .andExpect(status().isServiceUnavailable());
    }

    @Test
    void testBroadcast_ReportsCounts() throws Exception {
        // Given
        when(messageService.broadcast(eq("c1"), any(ChannelMessageRequest.class)))
                .thenReturn(new DeliveryResult(Set.of("A", "B"), Set.of("C"), Set.of()));

        // When / Then
        mockMvc.perform(post("/channels/c1/messages/websocket")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"id\":\"b1\",\"content\":\"ping\",\"senderId\":\"ops\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value("b1"))
                .andExpect(jsonPath("$.delivered").value(2))
                .andExpect(jsonPath("$.stale").value(1))
                .andExpect(jsonPath("$.failed").value(0));
    }
}
