package com.example.chatrelay.store;

/**
 * Builds the repository for a table on the configured backend.
 */
@FunctionalInterface
public interface ItemRepositoryFactory {

    ItemRepository create(TableDefinition table);
}
