package com.example.chatrelay.stream;

import com.example.chatrelay.store.ChangeCapture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;

import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Change stream for the in-memory backend. Records are queued and dispatched
 * one at a time in arrival order; writes made by a stage while a record is being
 * dispatched are queued behind it rather than dispatched re-entrantly.
 *
 * <p>A record whose dispatch fails stays at the head of the queue and is retried
 * on the next change or scheduled pass, up to {@code maxAttempts}.
 */
public class InProcessStreamSource implements ChangeCapture {

    private static final Logger logger = LoggerFactory.getLogger(InProcessStreamSource.class);

    private final StreamDispatcher dispatcher;
    private final int maxAttempts;
    private final Queue<StreamRecord> queue = new ConcurrentLinkedQueue<>();
    private final AtomicBoolean draining = new AtomicBoolean(false);
    private int headAttempts; // guarded by draining

    public InProcessStreamSource(StreamDispatcher dispatcher, int maxAttempts) {
        this.dispatcher = dispatcher;
        this.maxAttempts = maxAttempts;
    }

    @Override
    public void onChange(StreamRecord record) {
        queue.add(record);
        drain();
    }

    @Scheduled(fixedDelayString = "${app.stream.redelivery.fixed-delay-ms:2000}")
    public void retryPending() {
        if (!queue.isEmpty()) {
            drain();
        }
    }

    public int pending() {
        return queue.size();
    }

    void drain() {
        boolean stalled = false;
        while (!stalled && !queue.isEmpty() && draining.compareAndSet(false, true)) {
            try {
                StreamRecord next;
                while ((next = queue.peek()) != null) {
                    if (!dispatchHead(next)) {
                        stalled = true;
                        break;
                    }
                }
            } finally {
                draining.set(false);
            }
        }
    }

    private boolean dispatchHead(StreamRecord record) {
        try {
            dispatcher.dispatch(List.of(record));
        } catch (StreamDispatchException e) {
            headAttempts++;
            if (headAttempts < maxAttempts) {
                logger.warn("Dispatch failed (attempt {}/{}), will retry: {}", headAttempts, maxAttempts, e.getMessage());
                return false;
            }
            logger.error("Dropping record after {} failed attempts: {}", headAttempts, record, e);
        }
        queue.poll();
        headAttempts = 0;
        return true;
    }
}
