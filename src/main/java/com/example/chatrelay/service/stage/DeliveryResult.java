package com.example.chatrelay.service.stage;

import lombok.Value;

import java.util.Set;

/**
 * Per-connection outcome of one fan-out.
 */
@Value
public class DeliveryResult {
    Set<String> delivered;
    Set<String> stale;
    Set<String> failed;

    public static DeliveryResult empty() {
        return new DeliveryResult(Set.of(), Set.of(), Set.of());
    }
}
