package com.example.chatrelay.service.stage;

import com.example.chatrelay.model.ChatEvent;

public class EchoReplyGenerator implements ReplyGenerator {

    @Override
    public String generate(ChatEvent userMessage) {
        return "AI Response to: " + userMessage.getContent();
    }
}
