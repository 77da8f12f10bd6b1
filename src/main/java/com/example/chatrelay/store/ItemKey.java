package com.example.chatrelay.store;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Primary key of an item: a partition value and, for tables with a sort key,
 * an optional sort value. Leaving the sort value out turns a lookup into a
 * partition query.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ItemKey {

    Object partitionValue;
    Object sortValue;

    public static ItemKey of(Object partitionValue) {
        return new ItemKey(partitionValue, null);
    }

    public static ItemKey of(Object partitionValue, Object sortValue) {
        return new ItemKey(partitionValue, sortValue);
    }

    public boolean hasSortValue() {
        return sortValue != null;
    }

    @Override
    public String toString() {
        return sortValue == null ? String.valueOf(partitionValue) : partitionValue + "#" + sortValue;
    }
}
