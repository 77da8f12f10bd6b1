package com.example.chatrelay.store;

public class ObjectNotFoundException extends RuntimeException {

    private final ItemKey key;

    public ObjectNotFoundException(String table, ItemKey key) {
        super("Object " + key + " was not found in '" + table + "'");
        this.key = key;
    }

    public ItemKey getKey() {
        return key;
    }
}
