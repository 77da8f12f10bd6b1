package com.example.chatrelay.service.stage;

import com.example.chatrelay.model.ChatEvent;

/**
 * Produces the assistant's reply text for a user message.
 */
@FunctionalInterface
public interface ReplyGenerator {

    String generate(ChatEvent userMessage);
}
