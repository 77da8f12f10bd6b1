package com.example.chatrelay.stream;

import com.example.chatrelay.model.StreamOutboxEntry;
import com.example.chatrelay.repo.StreamOutboxRepo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Parks records that could not be dispatched in the stream outbox, where
 * {@link RedeliveryProjector} picks them up again.
 */
public class RedeliveryService {

    private static final Logger logger = LoggerFactory.getLogger(RedeliveryService.class);

    private final StreamOutboxRepo outboxRepo;
    private final Clock clock;

    public RedeliveryService(StreamOutboxRepo outboxRepo, Clock clock) {
        this.outboxRepo = outboxRepo;
        this.clock = clock;
    }

    public boolean hasPending() {
        return outboxRepo.existsByProcessedFalseAndDeadFalse();
    }

    public void enqueue(List<StreamRecord> records, String reason) {
        Instant now = clock.instant();
        List<StreamOutboxEntry> entries = new ArrayList<>();
        for (int i = 0; i < records.size(); i++) {
            StreamRecord record = records.get(i);
            entries.add(StreamOutboxEntry.builder()
                    .id(UUID.randomUUID().toString())
                    .eventName(record.getEventName())
                    .changeImage(record.getChangeImage())
                    .enqueuedAt(now)
                    .position(i)
                    .lastError(reason)
                    .build());
        }
        outboxRepo.saveAll(entries);
        logger.info("Queued {} stream records for redelivery", entries.size());
    }
}
