package com.example.chatrelay.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Value;

/**
 * JSON frame pushed to a subscriber connection.
 */
@Value
@JsonPropertyOrder({"id", "channelId", "senderId", "role", "content", "contentType", "createdAtIso"})
public class ChatEventPayload {
    String id;
    String channelId;
    String senderId;
    ChatRole role;
    String content;
    String contentType;
    String createdAtIso;

    public static ChatEventPayload from(ChatEvent event) {
        return new ChatEventPayload(event.getId(), event.getChannelId(), event.getSenderId(), event.getRole(),
                event.getContent(), event.getContentType(), event.getCreatedAtIso());
    }
}
