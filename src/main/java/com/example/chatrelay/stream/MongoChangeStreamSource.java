package com.example.chatrelay.stream;

import com.example.chatrelay.model.StreamCheckpoint;
import com.example.chatrelay.repo.StreamCheckpointRepo;
import com.example.chatrelay.store.MongoItemRepository;
import com.mongodb.client.model.changestream.ChangeStreamDocument;
import com.mongodb.client.model.changestream.FullDocument;
import com.mongodb.client.model.changestream.OperationType;
import org.bson.BsonDocument;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.messaging.ChangeStreamRequest;
import org.springframework.data.mongodb.core.messaging.DefaultMessageListenerContainer;
import org.springframework.data.mongodb.core.messaging.Message;
import org.springframework.data.mongodb.core.messaging.MessageListener;
import org.springframework.data.mongodb.core.messaging.MessageListenerContainer;
import org.springframework.data.mongodb.core.messaging.Subscription;
import org.springframework.scheduling.annotation.Scheduled;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Feeds the dispatcher from the change stream of the chat events collection.
 * Every change is dispatched as a batch of one. While older records are
 * waiting in the outbox, new ones are queued behind them to keep order.
 *
 * <p>The resume token of each change is checkpointed only after the change was
 * dispatched or parked, and the stream resumes from the checkpoint on start, so
 * changes written while the service was down or in flight when it died are
 * read again. A change that can be neither dispatched nor parked halts the
 * subscription; {@link #resumeIfHalted()} reopens it from the last checkpoint.
 */
public class MongoChangeStreamSource {

    private static final Logger logger = LoggerFactory.getLogger(MongoChangeStreamSource.class);

    private final MessageListenerContainer container;
    private final String collection;
    private final StreamDispatcher dispatcher;
    private final RedeliveryService redeliveryService;
    private final StreamCheckpointRepo checkpointRepo;

    private volatile Subscription subscription;
    private volatile boolean halted;

    public MongoChangeStreamSource(MongoTemplate mongo, String collection, StreamDispatcher dispatcher,
                                   RedeliveryService redeliveryService, StreamCheckpointRepo checkpointRepo) {
        this(new DefaultMessageListenerContainer(mongo), collection, dispatcher, redeliveryService, checkpointRepo);
    }

    MongoChangeStreamSource(MessageListenerContainer container, String collection, StreamDispatcher dispatcher,
                            RedeliveryService redeliveryService, StreamCheckpointRepo checkpointRepo) {
        this.container = container;
        this.collection = collection;
        this.dispatcher = dispatcher;
        this.redeliveryService = redeliveryService;
        this.checkpointRepo = checkpointRepo;
    }

    public void start() {
        subscribe(loadCheckpoint());
        container.start();
        logger.info("Listening to change stream of '{}'", collection);
    }

    public void stop() {
        container.stop();
    }

    public boolean isHalted() {
        return halted;
    }

    @Scheduled(fixedDelayString = "${app.stream.redelivery.fixed-delay-ms:2000}", initialDelay = 5000L)
    public void resumeIfHalted() {
        if (!halted) {
            return;
        }
        if (subscription != null) {
            container.remove(subscription);
        }
        BsonDocument resumeToken = loadCheckpoint();
        halted = false;
        subscribe(resumeToken);
        logger.info("Change stream of '{}' reopened from last checkpoint", collection);
    }

    private void subscribe(BsonDocument resumeToken) {
        MessageListener<ChangeStreamDocument<Document>, Document> listener = this::onMessage;
        ChangeStreamRequest.ChangeStreamRequestBuilder<Document> builder = ChangeStreamRequest.builder(listener);
        builder.collection(collection).fullDocumentLookup(FullDocument.UPDATE_LOOKUP);
        if (resumeToken != null) {
            builder.resumeToken(resumeToken);
            logger.info("Resuming change stream of '{}' after {}", collection, resumeToken.toJson());
        }
        subscription = container.register(builder.build(), Document.class);
    }

    void onMessage(Message<ChangeStreamDocument<Document>, Document> message) {
        if (halted) {
            // read again after the subscription is reopened
            return;
        }
        ChangeStreamDocument<Document> raw = message.getRaw();
        if (raw == null) {
            return;
        }
        StreamEventName eventName = toEventName(raw.getOperationType());
        if (eventName == null) {
            logger.debug("Ignoring change stream event {}", raw.getOperationType());
        } else {
            List<StreamRecord> batch = List.of(new StreamRecord(eventName, toImage(message.getBody(), raw.getDocumentKey())));
            try {
                handle(batch);
            } catch (RuntimeException e) {
                halted = true;
                logger.error("Change on '{}' could be neither dispatched nor parked; halting at last checkpoint",
                        collection, e);
                return;
            }
        }
        if (raw.getOperationType() != OperationType.INVALIDATE) {
            checkpoint(raw.getResumeToken());
        }
    }

    void handle(List<StreamRecord> batch) {
        if (redeliveryService.hasPending()) {
            redeliveryService.enqueue(batch, "queued behind pending redeliveries");
            return;
        }
        try {
            dispatcher.dispatch(batch);
        } catch (StreamDispatchException e) {
            logger.warn("Dispatch failed, parking {} records for redelivery", batch.size() - e.getFailedIndex());
            redeliveryService.enqueue(e.remaining(batch), e.getMessage());
        }
    }

    private void checkpoint(BsonDocument resumeToken) {
        if (resumeToken == null) {
            return;
        }
        try {
            checkpointRepo.save(StreamCheckpoint.builder()
                    .id(collection)
                    .resumeToken(resumeToken.toJson())
                    .updatedAt(Instant.now())
                    .build());
        } catch (DataAccessException e) {
            // a stale checkpoint replays handled changes to the idempotent stages
            logger.warn("Could not save change stream checkpoint for '{}': {}", collection, e.getMessage());
        }
    }

    private BsonDocument loadCheckpoint() {
        return checkpointRepo.findById(collection)
                .map(StreamCheckpoint::getResumeToken)
                .map(BsonDocument::parse)
                .orElse(null);
    }

    static StreamEventName toEventName(OperationType type) {
        if (type == null) {
            return null;
        }
        switch (type) {
            case INSERT:
                return StreamEventName.INSERT;
            case UPDATE:
            case REPLACE:
                return StreamEventName.MODIFY;
            case DELETE:
                return StreamEventName.REMOVE;
            default:
                return null;
        }
    }

    private static Map<String, Object> toImage(Document body, BsonDocument documentKey) {
        Map<String, Object> image = new LinkedHashMap<>();
        if (body != null) {
            image.putAll(body);
        } else if (documentKey != null) {
            documentKey.forEach((name, value) -> image.put(name, value.isString() ? value.asString().getValue() : value.toString()));
        }
        image.remove(MongoItemRepository.ID_FIELD);
        image.remove(MongoItemRepository.SEQ_FIELD);
        return image;
    }
}
