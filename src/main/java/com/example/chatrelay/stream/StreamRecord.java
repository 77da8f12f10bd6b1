package com.example.chatrelay.stream;

import lombok.Value;

import java.util.Map;

/**
 * Single change notification: what happened and the item image after the
 * change (the key attributes only, for REMOVE).
 */
@Value
public class StreamRecord {
    StreamEventName eventName;
    Map<String, Object> changeImage;

    public static StreamRecord insert(Map<String, Object> image) {
        return new StreamRecord(StreamEventName.INSERT, image);
    }
}
