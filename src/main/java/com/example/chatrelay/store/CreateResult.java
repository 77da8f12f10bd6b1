package com.example.chatrelay.store;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Map;

/**
 * Outcome of a conditional create: either the item was written, or an item
 * with the same identity was already stored and is returned untouched.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class CreateResult {

    public enum Status { CREATED, ALREADY_EXISTS }

    private final Status status;
    private final Map<String, Object> item;

    public static CreateResult created(Map<String, Object> item) {
        return new CreateResult(Status.CREATED, item);
    }

    public static CreateResult alreadyExists(Map<String, Object> existing) {
        return new CreateResult(Status.ALREADY_EXISTS, existing);
    }

    public boolean isCreated() {
        return status == Status.CREATED;
    }
}
