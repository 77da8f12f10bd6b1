package com.example.chatrelay.config;

import com.example.chatrelay.kv.KvClient;
import com.example.chatrelay.repo.StreamCheckpointRepo;
import com.example.chatrelay.repo.StreamOutboxRepo;
import com.example.chatrelay.service.ChannelMessageService;
import com.example.chatrelay.service.connection.ConnectionRegistry;
import com.example.chatrelay.service.connection.RepositoryConnectionRegistry;
import com.example.chatrelay.service.idempotency.IdempotencyGuard;
import com.example.chatrelay.service.idempotency.IdempotentStage;
import com.example.chatrelay.service.idempotency.KvIdempotencyGuard;
import com.example.chatrelay.service.idempotency.RepositoryIdempotencyGuard;
import com.example.chatrelay.service.stage.ChatClientReplyGenerator;
import com.example.chatrelay.service.stage.DeliveryStage;
import com.example.chatrelay.service.stage.EchoReplyGenerator;
import com.example.chatrelay.service.stage.ReplyGenerator;
import com.example.chatrelay.service.stage.ResponderStage;
import com.example.chatrelay.store.InMemoryItemRepository;
import com.example.chatrelay.store.ItemRepository;
import com.example.chatrelay.stream.ChatEventMapper;
import com.example.chatrelay.stream.InProcessStreamSource;
import com.example.chatrelay.stream.MongoChangeStreamSource;
import com.example.chatrelay.stream.RedeliveryProjector;
import com.example.chatrelay.stream.RedeliveryService;
import com.example.chatrelay.stream.StreamDispatcher;
import com.example.chatrelay.transport.LocalSessionTransport;
import com.example.chatrelay.transport.Transport;
import com.example.chatrelay.websocket.ChatWebSocketHandler;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Wires the stream pipeline: guards, stages, dispatcher and the change source
 * that feeds it.
 */
@Configuration
public class PipelineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ChatEventMapper chatEventMapper() {
        return new ChatEventMapper();
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService deliveryExecutor(@Value("${app.delivery.max-threads:8}") int maxThreads) {
        int threadCount = maxThreads > 0 ? maxThreads : 8;
        return Executors.newFixedThreadPool(threadCount, r -> {
            Thread t = new Thread(r, "delivery-fanout");
            t.setDaemon(true);
            return t;
        });
    }

    @Bean
    public ConnectionRegistry connectionRegistry(@Qualifier("connectionsRepository") ItemRepository connections,
                                                 Clock clock) {
        return new RepositoryConnectionRegistry(connections, clock);
    }

    @Bean
    public ReplyGenerator replyGenerator(@Value("${app.responder.generator:echo}") String generator,
                                         @Value("${app.responder.system-prompt:You are a helpful chat assistant.}") String systemPrompt,
                                         ObjectProvider<ChatModel> chatModel) {
        if ("chat-client".equals(generator)) {
            ChatModel model = chatModel.getIfAvailable();
            if (model == null) {
                throw new IllegalStateException("app.responder.generator=chat-client requires a ChatModel bean");
            }
            return new ChatClientReplyGenerator(ChatClient.create(model), systemPrompt);
        }
        return new EchoReplyGenerator();
    }

    @Bean
    public ResponderStage responderStage(@Qualifier("chatEventsRepository") ItemRepository chatEvents,
                                         ChatEventMapper mapper, ReplyGenerator replyGenerator, Clock clock,
                                         @Value("${app.responder.sender-id:assistant-llm}") String senderId) {
        return new ResponderStage(chatEvents, mapper, replyGenerator, clock, senderId);
    }

    @Bean
    public DeliveryStage deliveryStage(ConnectionRegistry registry, Transport transport,
                                       ObjectMapper objectMapper,
                                       @Qualifier("deliveryExecutor") ExecutorService deliveryExecutor) {
        return new DeliveryStage(registry, transport, objectMapper, deliveryExecutor);
    }

    @Bean
    public StreamDispatcher streamDispatcher(ChatEventMapper mapper,
                                             ResponderStage responderStage,
                                             DeliveryStage deliveryStage,
                                             @Qualifier("responderIdempotencyRepository") ItemRepository responderRecords,
                                             @Qualifier("deliveryIdempotencyRepository") ItemRepository deliveryRecords,
                                             ObjectProvider<KvClient> kvClient,
                                             Clock clock,
                                             @Value("${app.idempotency.backend:store}") String backend,
                                             @Value("${app.idempotency.window-seconds:3600}") long windowSeconds) {
        IdempotencyGuard responderGuard;
        IdempotencyGuard deliveryGuard;
        if ("kv".equals(backend)) {
            responderGuard = new KvIdempotencyGuard(kvClient.getObject(), "idempotency:" + ResponderStage.NAME);
            deliveryGuard = new KvIdempotencyGuard(kvClient.getObject(), "idempotency:" + DeliveryStage.NAME);
        } else {
            responderGuard = new RepositoryIdempotencyGuard(responderRecords, clock);
            deliveryGuard = new RepositoryIdempotencyGuard(deliveryRecords, clock);
        }
        return new StreamDispatcher(mapper, List.of(
                new IdempotentStage(responderStage, responderGuard, windowSeconds),
                new IdempotentStage(deliveryStage, deliveryGuard, windowSeconds)));
    }

    @Bean
    public ChannelMessageService channelMessageService(@Qualifier("chatEventsRepository") ItemRepository chatEvents,
                                                       ChatEventMapper mapper, DeliveryStage deliveryStage,
                                                       Clock clock) {
        return new ChannelMessageService(chatEvents, mapper, deliveryStage, clock);
    }

    @Bean
    public ChatWebSocketHandler chatWebSocketHandler(ConnectionRegistry registry,
                                                     LocalSessionTransport localSessionTransport,
                                                     ChannelMessageService channelMessageService,
                                                     ObjectMapper objectMapper) {
        return new ChatWebSocketHandler(registry, localSessionTransport, channelMessageService, objectMapper);
    }

    /**
     * The in-memory backend captures its own writes; they are dispatched in
     * process.
     */
    @Bean
    @ConditionalOnProperty(name = "app.store.backend", havingValue = "memory")
    public InProcessStreamSource inProcessStreamSource(StreamDispatcher dispatcher,
                                                       @Qualifier("chatEventsRepository") ItemRepository chatEvents,
                                                       @Value("${app.stream.redelivery.max-attempts:5}") int maxAttempts) {
        InProcessStreamSource source = new InProcessStreamSource(dispatcher, maxAttempts);
        ((InMemoryItemRepository) chatEvents).addChangeListener(source);
        return source;
    }

    @Configuration
    @ConditionalOnExpression("'${app.store.backend:mongo}' == 'mongo' and '${app.stream.source:mongo-change-stream}' == 'mongo-change-stream'")
    static class MongoStreamConfig {

        @Bean
        public RedeliveryService redeliveryService(StreamOutboxRepo outboxRepo, Clock clock) {
            return new RedeliveryService(outboxRepo, clock);
        }

        @Bean
        public RedeliveryProjector redeliveryProjector(StreamOutboxRepo outboxRepo, StreamDispatcher dispatcher,
                                                       @Value("${app.stream.redelivery.max-attempts:5}") int maxAttempts) {
            return new RedeliveryProjector(outboxRepo, dispatcher, maxAttempts);
        }

        @Bean(initMethod = "start", destroyMethod = "stop")
        public MongoChangeStreamSource mongoChangeStreamSource(MongoTemplate mongoTemplate,
                                                               StreamDispatcher dispatcher,
                                                               RedeliveryService redeliveryService,
                                                               StreamCheckpointRepo checkpointRepo,
                                                               @Value("${app.tables.chat-events.name:chat_events}") String collection) {
            return new MongoChangeStreamSource(mongoTemplate, collection, dispatcher, redeliveryService, checkpointRepo);
        }
    }
}
