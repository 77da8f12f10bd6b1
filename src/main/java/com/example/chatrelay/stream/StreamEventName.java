package com.example.chatrelay.stream;

/**
 * Kind of change captured on the event store. Only INSERT carries a new chat
 * event.
 */
public enum StreamEventName {
    INSERT,
    MODIFY,
    REMOVE
}
