package com.example.chatrelay.stream;

import com.example.chatrelay.model.ChatEvent;
import com.example.chatrelay.model.ChatRole;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ChatEventMapperTest {

    private final ChatEventMapper mapper = new ChatEventMapper();

    @Test
    void testFromItem_FillsDefaultsAndDerivesIsoTimestamp() {
        ChatEvent event = mapper.fromItem(Map.of(
                "id", "m1", "channelId", "c1", "ts", 1700000000L, "role", "user", "content", "hi"));

        assertEquals(ChatRole.USER, event.getRole());
        assertEquals("text", event.getContentType());
        assertEquals("2023-11-14T22:13:20Z", event.getCreatedAtIso());
        assertNull(event.getSenderId());
    }

    @Test
    void testFromItem_AcceptsNumericStringTimestamp() {
        ChatEvent event = mapper.fromItem(Map.of(
                "id", "m1", "channelId", "c1", "ts", "150", "role", "assistant", "content", "hi"));

        assertEquals(150L, event.getTs());
        assertEquals(ChatRole.ASSISTANT, event.getRole());
    }

    @Test
    void testFromItem_RejectsMalformedImages() {
        Map<String, Object> valid = new HashMap<>(Map.of(
                "id", "m1", "channelId", "c1", "ts", 100L, "role", "user", "content", "hi"));

        Map<String, Object> noChannel = new HashMap<>(valid);
        noChannel.remove("channelId");
        Map<String, Object> badRole = new HashMap<>(valid);
        badRole.put("role", "robot");
        Map<String, Object> badTs = new HashMap<>(valid);
        badTs.put("ts", "yesterday");

        assertThrows(DecodeException.class, () -> mapper.fromItem(Map.of()));
        assertThrows(DecodeException.class, () -> mapper.fromItem(noChannel));
        assertThrows(DecodeException.class, () -> mapper.fromItem(badRole));
        assertThrows(DecodeException.class, () -> mapper.fromItem(badTs));
    }

    @Test
    void testToItem_UsesCamelCaseAttributesAndRoleValue() {
        ChatEvent event = ChatEvent.builder()
                .id("m1").channelId("c1").ts(100L).senderId("u1")
                .role(ChatRole.SYSTEM).content("hi").build();

        Map<String, Object> item = mapper.toItem(event);

        assertEquals("system", item.get("role"));
        assertEquals("text", item.get("contentType"));
        assertEquals("1970-01-01T00:01:40Z", item.get("createdAtIso"));
        assertEquals("u1", mapper.fromItem(item).getSenderId());
    }
}
