package com.example.chatrelay.store;

import com.mongodb.client.result.UpdateResult;
import org.bson.Document;
import org.bson.types.ObjectId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.util.*;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * {@link ItemRepository} over one MongoDB collection. The document {@code _id}
 * holds the item identity (idempotency attribute, or the encoded primary key),
 * so inserts are naturally conditional; key attributes are stored as ordinary
 * fields and indexed together.
 */
public class MongoItemRepository implements ItemRepository {

    private static final Logger logger = LoggerFactory.getLogger(MongoItemRepository.class);

    public static final String ID_FIELD = "_id";
    // insertion order, breaks ties between items that share a sort key value
    public static final String SEQ_FIELD = "_seq";

    private final MongoTemplate mongo;
    private final TableDefinition table;

    public MongoItemRepository(MongoTemplate mongo, TableDefinition table) {
        this.mongo = mongo;
        this.table = table;
    }

    /**
     * Creates the compound key index. Called once when the bean is built; a
     * failure is logged so the service can still start against a read-only user.
     */
    public void ensureIndexes() {
        try {
            Index index = new Index().on(table.getPartitionKey(), Sort.Direction.ASC).named(table.getName() + "_key");
            if (table.hasSortKey()) {
                index.on(table.getSortKey(), Sort.Direction.ASC).on(SEQ_FIELD, Sort.Direction.ASC);
            }
            mongo.indexOps(table.getName()).ensureIndex(index);
        } catch (DataAccessException e) {
            logger.warn("Could not ensure key index on '{}': {}", table.getName(), e.getMessage());
        }
    }

    @Override
    public TableDefinition getTable() {
        return table;
    }

    @Override
    public Map<String, Object> create(Map<String, Object> item) {
        Map<String, Object> toStore = prepare(item);
        Document document = new Document(toStore);
        document.put(ID_FIELD, table.identityOf(toStore));
        document.put(SEQ_FIELD, new ObjectId());
        execute("insert", () -> mongo.insert(document, table.getName()));
        return toStore;
    }

    @Override
    public CreateResult createIfAbsent(Map<String, Object> item) {
        Map<String, Object> toStore = prepare(item);
        String identity = table.identityOf(toStore);
        Query query = new Query(Criteria.where(ID_FIELD).is(identity));
        Update update = new Update();
        toStore.forEach(update::setOnInsert);
        update.setOnInsert(SEQ_FIELD, new ObjectId());
        Document previous = execute("findAndModify", () -> mongo.findAndModify(query, update,
                FindAndModifyOptions.options().upsert(true).returnNew(false), Document.class, table.getName()));
        if (previous != null) {
            logger.debug("Item {} already exists in '{}'", identity, table.getName());
            return CreateResult.alreadyExists(toItem(previous));
        }
        return CreateResult.created(toStore);
    }

    @Override
    public Map<String, Object> getByKey(ItemKey key) {
        return findByKey(key, null, 1).orElseThrow(() -> new ObjectNotFoundException(table.getName(), key));
    }

    @Override
    public Optional<Map<String, Object>> findByKey(ItemKey key, Map<String, Object> filterAttributes, int limit) {
        table.validate(key);
        if (table.isFullKey(key)) {
            Document found = execute("findOne", () -> mongo.findOne(keyQuery(key), Document.class, table.getName()));
            return Optional.ofNullable(found).map(MongoItemRepository::toItem);
        }
        return queryPartition(key, filterAttributes, limit).stream().findFirst();
    }

    @Override
    public List<Map<String, Object>> queryPartition(ItemKey key, Map<String, Object> filterAttributes, int limit) {
        table.validate(key);
        Query query = keyQuery(key);
        if (filterAttributes != null) {
            filterAttributes.forEach((name, value) -> query.addCriteria(Criteria.where(name).is(value)));
        }
        if (table.hasSortKey()) {
            query.with(Sort.by(Sort.Direction.ASC, table.getSortKey(), SEQ_FIELD));
        }
        if (limit > 0) {
            query.limit(limit);
        }
        List<Document> docs = execute("find", () -> mongo.find(query, Document.class, table.getName()));
        return docs.stream().map(MongoItemRepository::toItem).collect(Collectors.toList());
    }

    @Override
    public List<Map<String, Object>> getList() {
        List<Document> docs = execute("findAll", () -> mongo.findAll(Document.class, table.getName()));
        return docs.stream().map(MongoItemRepository::toItem).collect(Collectors.toList());
    }

    @Override
    public void update(Map<String, Object> params, ItemKey key) {
        table.validateFull(key);
        Update update = new Update();
        int fields = 0;
        for (Map.Entry<String, Object> e : params.entrySet()) {
            if (table.isKeyAttribute(e.getKey()) || ID_FIELD.equals(e.getKey()) || SEQ_FIELD.equals(e.getKey())) {
                continue;
            }
            update.set(e.getKey(), e.getValue() instanceof Enum<?> ? ((Enum<?>) e.getValue()).name() : e.getValue());
            fields++;
        }
        if (fields == 0) {
            logger.warn("No fields to update on '{}' for key {} (only key fields given)", table.getName(), key);
            return;
        }
        UpdateResult result = execute("updateFirst", () -> mongo.updateFirst(keyQuery(key), update, table.getName()));
        if (result.getMatchedCount() == 0) {
            throw new ObjectNotFoundException(table.getName(), key);
        }
    }

    @Override
    public void delete(ItemKey key) {
        table.validateFull(key);
        execute("remove", () -> mongo.remove(keyQuery(key), table.getName()));
    }

    private Map<String, Object> prepare(Map<String, Object> item) {
        Map<String, Object> toStore = new LinkedHashMap<>(item);
        toStore.remove(ID_FIELD);
        toStore.remove(SEQ_FIELD);
        if (table.isKeyAutoAssign() && toStore.get(table.getPartitionKey()) == null) {
            toStore.put(table.getPartitionKey(), table.getKeyFactory().get());
        }
        table.keyOf(toStore);
        return toStore;
    }

    private Query keyQuery(ItemKey key) {
        Criteria criteria = Criteria.where(table.getPartitionKey()).is(key.getPartitionValue());
        if (key.hasSortValue()) {
            criteria = criteria.and(table.getSortKey()).is(key.getSortValue());
        }
        return new Query(criteria);
    }

    private static Map<String, Object> toItem(Document document) {
        Map<String, Object> item = new LinkedHashMap<>(document);
        item.remove(ID_FIELD);
        item.remove(SEQ_FIELD);
        return item;
    }

    private <T> T execute(String operation, Supplier<T> call) {
        try {
            return call.get();
        } catch (RuntimeException e) {
            String msg = "Error while calling '" + operation + "' for table '" + table.getName() + "'. Reason: " + e.getMessage();
            logger.error(msg, e);
            throw new StorageException(msg, e);
        }
    }
}
