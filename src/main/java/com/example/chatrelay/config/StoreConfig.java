package com.example.chatrelay.config;

import com.example.chatrelay.store.InMemoryItemRepository;
import com.example.chatrelay.store.ItemRepository;
import com.example.chatrelay.store.ItemRepositoryFactory;
import com.example.chatrelay.store.MongoItemRepository;
import com.example.chatrelay.store.TableDefinition;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.core.MongoTemplate;

/**
 * One repository per table, all on the backend chosen by
 * {@code app.store.backend}. Built once per process and shared by every stage.
 */
@Configuration
public class StoreConfig {

    @Bean
    @ConditionalOnProperty(name = "app.store.backend", havingValue = "mongo", matchIfMissing = true)
    public ItemRepositoryFactory mongoRepositoryFactory(MongoTemplate mongoTemplate) {
        return table -> {
            MongoItemRepository repository = new MongoItemRepository(mongoTemplate, table);
            repository.ensureIndexes();
            return repository;
        };
    }

    @Bean
    @ConditionalOnProperty(name = "app.store.backend", havingValue = "memory")
    public ItemRepositoryFactory inMemoryRepositoryFactory() {
        return InMemoryItemRepository::new;
    }

    @Bean
    public ItemRepository chatEventsRepository(ItemRepositoryFactory factory,
                                               @Value("${app.tables.chat-events.name:chat_events}") String name) {
        return factory.create(TableDefinition.builder()
                .name(name)
                .partitionKey("channelId")
                .sortKey("ts")
                .idempotencyKey("id")
                .keyAutoAssign(false)
                .build());
    }

    @Bean
    public ItemRepository connectionsRepository(ItemRepositoryFactory factory,
                                                @Value("${app.tables.connections.name:connections}") String name) {
        return factory.create(TableDefinition.builder()
                .name(name)
                .partitionKey("connectionId")
                .build());
    }

    @Bean
    public ItemRepository responderIdempotencyRepository(ItemRepositoryFactory factory,
                                                         @Value("${app.tables.responder-idempotency.name:responder_idempotency}") String name) {
        return factory.create(idempotencyTable(name));
    }

    @Bean
    public ItemRepository deliveryIdempotencyRepository(ItemRepositoryFactory factory,
                                                        @Value("${app.tables.delivery-idempotency.name:delivery_idempotency}") String name) {
        return factory.create(idempotencyTable(name));
    }

    private static TableDefinition idempotencyTable(String name) {
        return TableDefinition.builder()
                .name(name)
                .partitionKey("id")
                .keyAutoAssign(false)
                .build();
    }
}
