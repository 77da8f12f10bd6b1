package com.example.chatrelay.store;

import com.example.chatrelay.stream.StreamEventName;
import com.example.chatrelay.stream.StreamRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Process-local table backed by a map keyed on item identity. Writes can be
 * observed through {@link ChangeCapture} listeners, which get an INSERT, MODIFY
 * or REMOVE record after the write has been applied.
 */
public class InMemoryItemRepository implements ItemRepository {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryItemRepository.class);

    private final TableDefinition table;
    private final Map<String, Map<String, Object>> items = new LinkedHashMap<>();
    private final List<ChangeCapture> listeners = new CopyOnWriteArrayList<>();

    public InMemoryItemRepository(TableDefinition table) {
        this.table = table;
    }

    public void addChangeListener(ChangeCapture listener) {
        listeners.add(listener);
    }

    @Override
    public TableDefinition getTable() {
        return table;
    }

    @Override
    public Map<String, Object> create(Map<String, Object> item) {
        Map<String, Object> toStore = prepare(item);
        synchronized (this) {
            String identity = table.identityOf(toStore);
            if (items.containsKey(identity)) {
                throw new StorageException("Item " + identity + " already exists in '" + table.getName() + "'");
            }
            items.put(identity, toStore);
        }
        publish(StreamEventName.INSERT, toStore);
        return copy(toStore);
    }

    @Override
    public CreateResult createIfAbsent(Map<String, Object> item) {
        Map<String, Object> toStore = prepare(item);
        synchronized (this) {
            String identity = table.identityOf(toStore);
            Map<String, Object> existing = items.get(identity);
            if (existing != null) {
                return CreateResult.alreadyExists(copy(existing));
            }
            items.put(identity, toStore);
        }
        publish(StreamEventName.INSERT, toStore);
        return CreateResult.created(copy(toStore));
    }

    @Override
    public Map<String, Object> getByKey(ItemKey key) {
        return findByKey(key, null, 1).orElseThrow(() -> new ObjectNotFoundException(table.getName(), key));
    }

    @Override
    public synchronized Optional<Map<String, Object>> findByKey(ItemKey key, Map<String, Object> filterAttributes, int limit) {
        table.validate(key);
        if (table.isFullKey(key)) {
            return Optional.ofNullable(findExact(key)).map(InMemoryItemRepository::copy);
        }
        return queryPartition(key, filterAttributes, limit).stream().findFirst();
    }

    @Override
    public synchronized List<Map<String, Object>> queryPartition(ItemKey key, Map<String, Object> filterAttributes, int limit) {
        table.validate(key);
        var stream = items.values().stream()
                .filter(item -> matchesKey(item, key))
                .filter(item -> matchesFilter(item, filterAttributes))
                .sorted(sortKeyOrder());
        if (limit > 0) {
            stream = stream.limit(limit);
        }
        return stream.map(InMemoryItemRepository::copy).collect(Collectors.toList());
    }

    @Override
    public synchronized List<Map<String, Object>> getList() {
        return items.values().stream().map(InMemoryItemRepository::copy).collect(Collectors.toList());
    }

    @Override
    public void update(Map<String, Object> params, ItemKey key) {
        table.validateFull(key);
        Map<String, Object> changes = new LinkedHashMap<>();
        params.forEach((name, value) -> {
            if (!table.isKeyAttribute(name)) {
                changes.put(name, value);
            }
        });
        if (changes.isEmpty()) {
            logger.warn("No fields to update on '{}' for key {} (only key fields given)", table.getName(), key);
            return;
        }
        Map<String, Object> updated;
        synchronized (this) {
            Map<String, Object> existing = findExact(key);
            if (existing == null) {
                throw new ObjectNotFoundException(table.getName(), key);
            }
            existing.putAll(changes);
            updated = copy(existing);
        }
        publish(StreamEventName.MODIFY, updated);
    }

    @Override
    public void delete(ItemKey key) {
        table.validateFull(key);
        Map<String, Object> removed = null;
        synchronized (this) {
            Iterator<Map<String, Object>> it = items.values().iterator();
            while (it.hasNext()) {
                Map<String, Object> item = it.next();
                if (matchesKey(item, key)) {
                    it.remove();
                    removed = item;
                    break;
                }
            }
        }
        if (removed != null) {
            publish(StreamEventName.REMOVE, removed);
        }
    }

    private Map<String, Object> prepare(Map<String, Object> item) {
        Map<String, Object> toStore = new LinkedHashMap<>(item);
        if (table.isKeyAutoAssign() && toStore.get(table.getPartitionKey()) == null) {
            toStore.put(table.getPartitionKey(), table.getKeyFactory().get());
        }
        table.keyOf(toStore);
        return toStore;
    }

    private Map<String, Object> findExact(ItemKey key) {
        for (Map<String, Object> item : items.values()) {
            if (matchesKey(item, key)) {
                return item;
            }
        }
        return null;
    }

    private boolean matchesKey(Map<String, Object> item, ItemKey key) {
        if (!valueEquals(item.get(table.getPartitionKey()), key.getPartitionValue())) {
            return false;
        }
        return !key.hasSortValue() || valueEquals(item.get(table.getSortKey()), key.getSortValue());
    }

    private static boolean matchesFilter(Map<String, Object> item, Map<String, Object> filterAttributes) {
        if (filterAttributes == null) {
            return true;
        }
        return filterAttributes.entrySet().stream().allMatch(e -> valueEquals(item.get(e.getKey()), e.getValue()));
    }

    private Comparator<Map<String, Object>> sortKeyOrder() {
        if (!table.hasSortKey()) {
            return (a, b) -> 0;
        }
        return (a, b) -> compareValues(a.get(table.getSortKey()), b.get(table.getSortKey()));
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private static int compareValues(Object left, Object right) {
        if (left == null || right == null) {
            return left == null ? (right == null ? 0 : -1) : 1;
        }
        if (left instanceof Number && right instanceof Number) {
            return Long.compare(((Number) left).longValue(), ((Number) right).longValue());
        }
        return ((Comparable) left).compareTo(right);
    }

    // numbers compare by value so an Integer sort key matches a stored Long
    private static boolean valueEquals(Object stored, Object expected) {
        if (stored instanceof Number && expected instanceof Number) {
            return ((Number) stored).longValue() == ((Number) expected).longValue();
        }
        return Objects.equals(stored, expected);
    }

    private void publish(StreamEventName eventName, Map<String, Object> image) {
        if (listeners.isEmpty()) {
            return;
        }
        StreamRecord record = new StreamRecord(eventName, copy(image));
        for (ChangeCapture listener : listeners) {
            listener.onChange(record);
        }
    }

    private static Map<String, Object> copy(Map<String, Object> item) {
        return new LinkedHashMap<>(item);
    }
}
