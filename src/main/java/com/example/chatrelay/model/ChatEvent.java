package com.example.chatrelay.model;

import lombok.*;

import java.time.Instant;

/**
 * One message in a channel. Append-only: built once, stored once, never
 * changed afterwards.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ChatEvent {

    public static final String DEFAULT_CONTENT_TYPE = "text";

    private String id;
    private String channelId;
    private long ts;
    private String senderId;
    private ChatRole role;
    private String content;
    @Builder.Default
    private String contentType = DEFAULT_CONTENT_TYPE;
    private String createdAtIso;

    public static String isoOf(long epochSeconds) {
        return Instant.ofEpochSecond(epochSeconds).toString();
    }
}
