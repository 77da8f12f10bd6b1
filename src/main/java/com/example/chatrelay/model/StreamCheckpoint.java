package com.example.chatrelay.model;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Resume token of the last change that was dispatched or parked, one per
 * watched collection.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Document("stream_checkpoints")
public class StreamCheckpoint {
    @Id
    private String id; // watched collection
    private String resumeToken; // extended JSON of the change stream token
    private Instant updatedAt;
}
