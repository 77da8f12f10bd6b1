package com.example.chatrelay.service.idempotency;

import com.example.chatrelay.model.ChatEvent;
import com.example.chatrelay.stream.ProcessingOutcome;
import com.example.chatrelay.stream.StreamStage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wraps a stage so that each event id is handled at most once per window. An
 * event is marked only after the delegate returned normally; a throwing
 * delegate leaves it unmarked so the redelivery runs it again.
 */
public class IdempotentStage implements StreamStage {

    private static final Logger logger = LoggerFactory.getLogger(IdempotentStage.class);

    private final StreamStage delegate;
    private final IdempotencyGuard guard;
    private final long windowSeconds;

    public IdempotentStage(StreamStage delegate, IdempotencyGuard guard, long windowSeconds) {
        this.delegate = delegate;
        this.guard = guard;
        this.windowSeconds = windowSeconds;
    }

    @Override
    public String name() {
        return delegate.name();
    }

    @Override
    public ProcessingOutcome process(ChatEvent event) {
        if (guard.alreadyProcessed(event.getId())) {
            logger.info("Stage '{}' already processed event {}, skipping", delegate.name(), event.getId());
            return ProcessingOutcome.SKIPPED_DUPLICATE;
        }
        ProcessingOutcome outcome = delegate.process(event);
        if (outcome == ProcessingOutcome.PROCESSED || outcome == ProcessingOutcome.SKIPPED_NOT_APPLICABLE) {
            guard.markProcessed(event.getId(), windowSeconds);
        }
        return outcome;
    }
}
