package com.example.chatrelay.service.stage;

import com.example.chatrelay.model.ChatEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;

/**
 * Asks the configured chat model for the reply.
 */
public class ChatClientReplyGenerator implements ReplyGenerator {

    private static final Logger logger = LoggerFactory.getLogger(ChatClientReplyGenerator.class);

    private final ChatClient chatClient;
    private final String systemPrompt;

    public ChatClientReplyGenerator(ChatClient chatClient, String systemPrompt) {
        this.chatClient = chatClient;
        this.systemPrompt = systemPrompt;
    }

    @Override
    public String generate(ChatEvent userMessage) {
        logger.debug("Requesting model reply for event {}", userMessage.getId());
        String reply = chatClient.prompt()
                .system(systemPrompt)
                .user(userMessage.getContent())
                .call()
                .content();
        if (reply == null || reply.isBlank()) {
            throw new IllegalStateException("Chat model returned an empty reply for event " + userMessage.getId());
        }
        return reply;
    }
}
