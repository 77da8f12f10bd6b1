package com.example.chatrelay.stream;

import com.example.chatrelay.model.ChatEvent;

/**
 * A consumer of new chat events. Implementations throw to signal a failure
 * that should get the record redelivered.
 */
public interface StreamStage {

    String name();

    ProcessingOutcome process(ChatEvent event);
}
