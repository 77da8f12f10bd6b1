package com.example.chatrelay.service.stage;

import com.example.chatrelay.model.ChatEvent;
import com.example.chatrelay.model.ChatRole;
import com.example.chatrelay.store.ItemRepository;
import com.example.chatrelay.stream.ChatEventMapper;
import com.example.chatrelay.stream.ProcessingOutcome;
import com.example.chatrelay.stream.StreamStage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.UUID;

/**
 * Answers user messages: builds an assistant event in the same channel and
 * appends it to the event store, where it flows back through the stream like
 * any other message.
 */
public class ResponderStage implements StreamStage {

    private static final Logger logger = LoggerFactory.getLogger(ResponderStage.class);

    public static final String NAME = "responder";

    private final ItemRepository chatEvents;
    private final ChatEventMapper mapper;
    private final ReplyGenerator replyGenerator;
    private final Clock clock;
    private final String senderId;

    public ResponderStage(ItemRepository chatEvents, ChatEventMapper mapper, ReplyGenerator replyGenerator,
                          Clock clock, String senderId) {
        this.chatEvents = chatEvents;
        this.mapper = mapper;
        this.replyGenerator = replyGenerator;
        this.clock = clock;
        this.senderId = senderId;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public ProcessingOutcome process(ChatEvent event) {
        if (event.getRole() != ChatRole.USER) {
            logger.info("Skipping non-user message with role: {}", event.getRole().value());
            return ProcessingOutcome.SKIPPED_NOT_APPLICABLE;
        }

        logger.info("Processing user message {} in channel {}", event.getId(), event.getChannelId());
        String content = replyGenerator.generate(event);

        // the reply must never sort before the message it answers
        long ts = Math.max(clock.instant().getEpochSecond(), event.getTs());
        ChatEvent reply = ChatEvent.builder()
                .id(UUID.randomUUID().toString())
                .channelId(event.getChannelId())
                .ts(ts)
                .senderId(senderId)
                .role(ChatRole.ASSISTANT)
                .content(content)
                .contentType(ChatEvent.DEFAULT_CONTENT_TYPE)
                .createdAtIso(ChatEvent.isoOf(ts))
                .build();
        chatEvents.create(mapper.toItem(reply));
        logger.info("Generated reply {} for channel {}", reply.getId(), reply.getChannelId());
        return ProcessingOutcome.PROCESSED;
    }
}
