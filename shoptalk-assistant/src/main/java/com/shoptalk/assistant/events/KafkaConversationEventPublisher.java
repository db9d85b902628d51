package com.shoptalk.assistant.events;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletableFuture;

/**
 * Streams conversation events to Kafka, keyed by session id so one session's turns
 * stay in order on a partition.
 */
@Service
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(name = "shoptalk.events.enabled", havingValue = "true")
public class KafkaConversationEventPublisher implements ConversationEventPublisher {

    private final KafkaTemplate<String, Object> kafkaTemplate;

    @Override
    public void publish(ConversationEvent event) {
        send(AssistantTopics.CONVERSATION_EVENTS, event.getSessionId(), event);
    }

    private void send(String topic, String key, Object event) {
        CompletableFuture<SendResult<String, Object>> future;
        try {
            future = kafkaTemplate.send(topic, key, event);
        } catch (RuntimeException e) {
            log.error("Failed to send event to {}: {}", topic, e.getMessage());
            return;
        }

        future.whenComplete((result, ex) -> {
            if (ex != null) {
                log.error("Failed to send event to {}: {}", topic, ex.getMessage());
            } else {
                log.debug("Sent to {} partition {} offset {}",
                        topic,
                        result.getRecordMetadata().partition(),
                        result.getRecordMetadata().offset());
            }
        });
    }
}
