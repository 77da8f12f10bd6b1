package com.example.chatrelay.store;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.util.Map;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Describes one partitioned table: its name, key attributes and how missing
 * partition keys get assigned on create.
 */
@Value
@Builder
public class TableDefinition {

    @NonNull
    String name;

    @NonNull
    String partitionKey;

    /** Null when the table has a simple (partition-only) primary key. */
    String sortKey;

    /**
     * Attribute used to deduplicate creates. Null means the primary key itself
     * is the identity of an item.
     */
    String idempotencyKey;

    @Builder.Default
    boolean keyAutoAssign = true;

    @Builder.Default
    Supplier<String> keyFactory = () -> UUID.randomUUID().toString();

    public boolean hasSortKey() {
        return sortKey != null;
    }

    /**
     * Primary key attributes plus the idempotency attribute; none of them may
     * change once an item is stored.
     */
    public boolean isKeyAttribute(String attribute) {
        return attribute.equals(partitionKey) || attribute.equals(sortKey) || attribute.equals(idempotencyKey);
    }

    /**
     * Checks a caller-supplied key against this table's schema.
     *
     * @throws IllegalArgumentException when the partition value is missing or a
     *                                  sort value is given for a table without a sort key
     */
    public ItemKey validate(ItemKey key) {
        if (key == null || key.getPartitionValue() == null) {
            throw new IllegalArgumentException("Missing partition key '" + partitionKey + "' for table '" + name + "'");
        }
        if (key.hasSortValue() && !hasSortKey()) {
            throw new IllegalArgumentException("Table '" + name + "' has no sort key but one was supplied");
        }
        return key;
    }

    public boolean isFullKey(ItemKey key) {
        return !hasSortKey() || key.hasSortValue();
    }

    /**
     * Like {@link #validate(ItemKey)} but also requires the sort value on
     * tables that have one. Used by writes that must address exactly one item.
     */
    public ItemKey validateFull(ItemKey key) {
        validate(key);
        if (!isFullKey(key)) {
            throw new IllegalArgumentException("Missing sort key '" + sortKey + "' for table '" + name + "'");
        }
        return key;
    }

    /**
     * Extracts the full primary key of a stored or about-to-be-stored item.
     */
    public ItemKey keyOf(Map<String, Object> item) {
        Object partition = item.get(partitionKey);
        if (partition == null) {
            throw new IllegalArgumentException("Item is missing partition key '" + partitionKey + "' for table '" + name + "'");
        }
        if (!hasSortKey()) {
            return ItemKey.of(partition);
        }
        Object sort = item.get(sortKey);
        if (sort == null) {
            throw new IllegalArgumentException("Item is missing sort key '" + sortKey + "' for table '" + name + "'");
        }
        return ItemKey.of(partition, sort);
    }

    /**
     * Value that identifies an item for duplicate suppression: the idempotency
     * attribute when configured, otherwise the encoded primary key.
     */
    public String identityOf(Map<String, Object> item) {
        if (idempotencyKey != null) {
            Object value = item.get(idempotencyKey);
            if (value == null) {
                throw new IllegalArgumentException("Item is missing idempotency key '" + idempotencyKey + "' for table '" + name + "'");
            }
            return value.toString();
        }
        return keyOf(item).toString();
    }
}
