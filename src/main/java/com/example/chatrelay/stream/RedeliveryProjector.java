package com.example.chatrelay.stream;

import com.example.chatrelay.model.StreamOutboxEntry;
import com.example.chatrelay.repo.StreamOutboxRepo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;

import java.util.List;

/**
 * Replays outbox entries oldest first. A pass stops at the first entry that
 * fails again so later records are never delivered ahead of it; an entry that
 * keeps failing is marked dead after {@code maxAttempts}.
 */
public class RedeliveryProjector {

    private static final Logger logger = LoggerFactory.getLogger(RedeliveryProjector.class);

    private final StreamOutboxRepo outboxRepo;
    private final StreamDispatcher dispatcher;
    private final int maxAttempts;

    public RedeliveryProjector(StreamOutboxRepo outboxRepo, StreamDispatcher dispatcher, int maxAttempts) {
        this.outboxRepo = outboxRepo;
        this.dispatcher = dispatcher;
        this.maxAttempts = maxAttempts;
    }

    @Scheduled(fixedDelayString = "${app.stream.redelivery.fixed-delay-ms:2000}", initialDelay = 5000L)
    public void run() {
        List<StreamOutboxEntry> entries = outboxRepo.findTop50ByProcessedFalseAndDeadFalseOrderByEnqueuedAtAscPositionAsc();
        for (StreamOutboxEntry entry : entries) {
            StreamRecord record = new StreamRecord(entry.getEventName(), entry.getChangeImage());
            try {
                dispatcher.dispatch(List.of(record));
                entry.setProcessed(true);
                outboxRepo.save(entry);
            } catch (StreamDispatchException e) {
                entry.setAttempts(entry.getAttempts() + 1);
                entry.setLastError(e.getMessage());
                if (entry.getAttempts() >= maxAttempts) {
                    entry.setDead(true);
                    logger.error("Giving up on outbox entry {} after {} attempts", entry.getId(), entry.getAttempts(), e);
                    outboxRepo.save(entry);
                    continue;
                }
                logger.warn("Redelivery of outbox entry {} failed (attempt {}/{})", entry.getId(), entry.getAttempts(), maxAttempts);
                outboxRepo.save(entry);
                return;
            }
        }
    }
}
