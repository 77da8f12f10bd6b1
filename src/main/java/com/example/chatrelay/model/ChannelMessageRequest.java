package com.example.chatrelay.model;

import lombok.*;

/**
 * Client submission of a message to a channel. The {@code id} is chosen by the
 * client and makes the submission idempotent.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ChannelMessageRequest {
    private String id;
    private String content;
    @Builder.Default
    private String role = "user";
    private String senderId;
}
