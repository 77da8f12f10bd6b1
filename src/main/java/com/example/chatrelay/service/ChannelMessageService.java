package com.example.chatrelay.service;

import com.example.chatrelay.model.ChannelMessageRequest;
import com.example.chatrelay.model.ChatEvent;
import com.example.chatrelay.model.ChatRole;
import com.example.chatrelay.service.stage.DeliveryResult;
import com.example.chatrelay.service.stage.DeliveryStage;
import com.example.chatrelay.store.CreateResult;
import com.example.chatrelay.store.ItemKey;
import com.example.chatrelay.store.ItemRepository;
import com.example.chatrelay.stream.ChatEventMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Write and read path for channel messages. Writing only appends to the event
 * store; replies and delivery happen downstream on the change stream.
 */
public class ChannelMessageService {

    private static final Logger logger = LoggerFactory.getLogger(ChannelMessageService.class);

    private final ItemRepository chatEvents;
    private final ChatEventMapper mapper;
    private final DeliveryStage deliveryStage;
    private final Clock clock;

    public ChannelMessageService(ItemRepository chatEvents, ChatEventMapper mapper,
                                 DeliveryStage deliveryStage, Clock clock) {
        this.chatEvents = chatEvents;
        this.mapper = mapper;
        this.deliveryStage = deliveryStage;
        this.clock = clock;
    }

    /**
     * Messages of a channel, oldest first.
     */
    public List<ChatEvent> listMessages(String channelId) {
        logger.info("Getting messages for channel {}", channelId);
        List<ChatEvent> messages = chatEvents.queryPartition(ItemKey.of(channelId), null, 0).stream()
                .map(mapper::fromItem)
                .sorted(Comparator.comparingLong(ChatEvent::getTs))
                .collect(Collectors.toList());
        logger.info("Found {} messages for channel {}", messages.size(), channelId);
        return messages;
    }

    /**
     * Appends a message. Sending the same client id again returns the event that
     * was stored the first time, unchanged.
     */
    public ChatEvent sendMessage(String channelId, ChannelMessageRequest request) {
        requireText(request.getId(), "id");
        ChatEvent event = toEvent(channelId, request);
        logger.info("Processing message {} for channel {}", event.getId(), channelId);

        CreateResult result = chatEvents.createIfAbsent(mapper.toItem(event));
        if (!result.isCreated()) {
            logger.info("Duplicate message {}, returning existing", event.getId());
        } else {
            logger.info("Created message {}", event.getId());
        }
        return mapper.fromItem(result.getItem());
    }

    /**
     * Pushes a message straight to the channel's connections without storing
     * it.
     */
    public DeliveryResult broadcast(String channelId, ChannelMessageRequest request) {
        if (request.getId() == null || request.getId().isBlank()) {
            request.setId(UUID.randomUUID().toString());
        }
        return deliveryStage.deliver(toEvent(channelId, request));
    }

    private ChatEvent toEvent(String channelId, ChannelMessageRequest request) {
        requireText(channelId, "channelId");
        requireText(request.getContent(), "content");
        requireText(request.getSenderId(), "senderId");
        long ts = clock.instant().getEpochSecond();
        return ChatEvent.builder()
                .id(request.getId())
                .channelId(channelId)
                .ts(ts)
                .senderId(request.getSenderId())
                .role(request.getRole() != null ? ChatRole.fromValue(request.getRole()) : ChatRole.USER)
                .content(request.getContent())
                .contentType(ChatEvent.DEFAULT_CONTENT_TYPE)
                .createdAtIso(ChatEvent.isoOf(ts))
                .build();
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Field '" + field + "' is required");
        }
    }
}
