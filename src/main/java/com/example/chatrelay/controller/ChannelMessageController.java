package com.example.chatrelay.controller;

import com.example.chatrelay.model.ChannelMessageRequest;
import com.example.chatrelay.model.ChatEventPayload;
import com.example.chatrelay.service.ChannelMessageService;
import com.example.chatrelay.service.stage.DeliveryResult;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/channels/{channelId}/messages")
public class ChannelMessageController {

    private final ChannelMessageService messageService;

    public ChannelMessageController(ChannelMessageService messageService) {
        this.messageService = messageService;
    }

    @GetMapping
    public List<ChatEventPayload> list(@PathVariable String channelId) {
        return messageService.listMessages(channelId).stream()
                .map(ChatEventPayload::from)
                .collect(Collectors.toList());
    }

    @PostMapping
    public ChatEventPayload send(@PathVariable String channelId, @RequestBody ChannelMessageRequest request) {
        return ChatEventPayload.from(messageService.sendMessage(channelId, request));
    }

    @PostMapping("/websocket")
    public ResponseEntity<Map<String, Object>> broadcast(@PathVariable String channelId,
                                                         @RequestBody ChannelMessageRequest request) {
        DeliveryResult result = messageService.broadcast(channelId, request);
        return ResponseEntity.ok(Map.of(
                "id", request.getId(),
                "delivered", result.getDelivered().size(),
                "stale", result.getStale().size(),
                "failed", result.getFailed().size()));
    }
}
