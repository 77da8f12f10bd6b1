package com.example.chatrelay.service.idempotency;

/**
 * Remembers which event ids a stage has already processed, for a bounded
 * window.
 *
 * <p>Checking and marking are separate calls, so two concurrent invocations
 * for the same id can both see "not processed". The guard only rules out
 * duplicate outcomes when invocations for one id are serialized, which holds
 * for a single ordered stream.
 */
public interface IdempotencyGuard {

    boolean alreadyProcessed(String eventId);

    void markProcessed(String eventId, long ttlSeconds);
}
