package com.shoptalk.assistant.events;

/**
 * Kafka topic names for ShopTalk.
 */
public final class AssistantTopics {

    private AssistantTopics() {} // Prevent instantiation

    /** One event per completed conversation turn */
    public static final String CONVERSATION_EVENTS = "assistant-events";
}
