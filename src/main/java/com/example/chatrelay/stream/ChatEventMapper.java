package com.example.chatrelay.stream;

import com.example.chatrelay.model.ChatEvent;
import com.example.chatrelay.model.ChatRole;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Converts chat events to and from stored item images.
 */
public class ChatEventMapper {

    public Map<String, Object> toItem(ChatEvent event) {
        Map<String, Object> item = new LinkedHashMap<>();
        item.put("id", event.getId());
        item.put("channelId", event.getChannelId());
        item.put("ts", event.getTs());
        item.put("senderId", event.getSenderId());
        item.put("role", event.getRole().value());
        item.put("content", event.getContent());
        item.put("contentType", event.getContentType());
        item.put("createdAtIso", event.getCreatedAtIso() != null ? event.getCreatedAtIso() : ChatEvent.isoOf(event.getTs()));
        return item;
    }

    /**
     * @throws DecodeException when a required attribute is missing or has the wrong shape
     */
    public ChatEvent fromItem(Map<String, Object> image) {
        if (image == null || image.isEmpty()) {
            throw new DecodeException("Empty change image");
        }
        long ts = requireLong(image, "ts");
        ChatRole role;
        try {
            role = ChatRole.fromValue(requireString(image, "role"));
        } catch (IllegalArgumentException e) {
            throw new DecodeException("Invalid role in change image: " + e.getMessage(), e);
        }
        Object contentType = image.get("contentType");
        Object createdAtIso = image.get("createdAtIso");
        return ChatEvent.builder()
                .id(requireString(image, "id"))
                .channelId(requireString(image, "channelId"))
                .ts(ts)
                .senderId(image.get("senderId") != null ? image.get("senderId").toString() : null)
                .role(role)
                .content(requireString(image, "content"))
                .contentType(contentType != null ? contentType.toString() : ChatEvent.DEFAULT_CONTENT_TYPE)
                .createdAtIso(createdAtIso != null ? createdAtIso.toString() : ChatEvent.isoOf(ts))
                .build();
    }

    private static String requireString(Map<String, Object> image, String attribute) {
        Object value = image.get(attribute);
        if (!(value instanceof String)) {
            throw new DecodeException("Missing or non-string attribute '" + attribute + "'");
        }
        return (String) value;
    }

    private static long requireLong(Map<String, Object> image, String attribute) {
        Object value = image.get(attribute);
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        if (value instanceof String) {
            try {
                return Long.parseLong((String) value);
            } catch (NumberFormatException e) {
                throw new DecodeException("Attribute '" + attribute + "' is not a number: " + value, e);
            }
        }
        throw new DecodeException("Missing attribute '" + attribute + "'");
    }
}
