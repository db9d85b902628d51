package com.shoptalk.assistant.events;

/**
 * Receives a summary of every handled turn. Publishing never affects the reply.
 */
public interface ConversationEventPublisher {

    void publish(ConversationEvent event);
}
