package com.example.chatrelay.model;

import com.example.chatrelay.stream.StreamEventName;
import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.Map;

/**
 * A change record whose dispatch failed and is waiting to be redelivered.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Document("stream_outbox")
public class StreamOutboxEntry {
    @Id
    private String id;
    private StreamEventName eventName;
    private Map<String, Object> changeImage;
    private Instant enqueuedAt;
    private int position; // order within the failed batch
    private int attempts;
    private String lastError;
    private boolean processed;
    private boolean dead;
}
