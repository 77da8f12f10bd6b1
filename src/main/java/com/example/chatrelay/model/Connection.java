package com.example.chatrelay.model;

import lombok.*;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Connection {
    private String connectionId;
    private String channelId; // null = receives every channel
    private Long connectedAt;

    public boolean isSubscribedTo(String channel) {
        return channelId == null || channelId.equals(channel);
    }
}
