package com.example.chatrelay.store;

import com.example.chatrelay.stream.StreamRecord;

/**
 * Receives change records emitted by a repository that captures its own
 * writes (the in-memory backend).
 */
@FunctionalInterface
public interface ChangeCapture {

    void onChange(StreamRecord record);
}
