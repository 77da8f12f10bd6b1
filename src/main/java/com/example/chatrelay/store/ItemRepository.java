package com.example.chatrelay.store;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Backend-agnostic access to one partitioned key-value table. Items are plain
 * attribute maps so callers own their own (de)serialization.
 *
 * <p>Every backend fault surfaces as {@link StorageException}; a missing key on
 * {@link #getByKey(ItemKey)} surfaces as {@link ObjectNotFoundException}.
 */
public interface ItemRepository {

    TableDefinition getTable();

    /**
     * Stores a new item, assigning the partition key when it is absent and the
     * table allows auto-assignment. Never overwrites: a collision on the primary
     * or idempotency key fails with {@link StorageException}.
     */
    Map<String, Object> create(Map<String, Object> item);

    /**
     * Conditional create keyed on the item's identity (see
     * {@link TableDefinition#identityOf(Map)}).
     */
    CreateResult createIfAbsent(Map<String, Object> item);

    /**
     * Point lookup for a full key, first item of the partition (in sort-key
     * order) for a partition-only key.
     *
     * @throws ObjectNotFoundException when nothing matches
     */
    Map<String, Object> getByKey(ItemKey key);

    /**
     * Same lookup as {@link #getByKey(ItemKey)} without raising on a miss.
     * For partition-only keys the filter attributes are equality predicates and
     * at most {@code limit} matching items are examined.
     */
    Optional<Map<String, Object>> findByKey(ItemKey key, Map<String, Object> filterAttributes, int limit);

    default Optional<Map<String, Object>> findByKey(ItemKey key) {
        return findByKey(key, null, 1);
    }

    /**
     * Items of one partition matching the filter, ascending by sort key.
     * A {@code limit} of zero or less means no limit.
     */
    List<Map<String, Object>> queryPartition(ItemKey key, Map<String, Object> filterAttributes, int limit);

    /**
     * Full table scan. No ordering or size guarantee.
     */
    List<Map<String, Object>> getList();

    /**
     * Sets the given attributes on an existing item. Key attributes in
     * {@code params} are ignored; when nothing else is left the call is a no-op.
     *
     * @throws ObjectNotFoundException when no item has the given full key
     */
    void update(Map<String, Object> params, ItemKey key);

    /**
     * Removes an item. Deleting a missing key is not an error.
     */
    void delete(ItemKey key);
}
