package com.shoptalk.assistant.events;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Default publisher when the event stream is disabled: events only go to the log.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "shoptalk.events.enabled", havingValue = "false", matchIfMissing = true)
public class LoggingConversationEventPublisher implements ConversationEventPublisher {

    @Override
    public void publish(ConversationEvent event) {
        log.debug("Conversation event: session={}, sequence={}, intent={}, outcome={}, results={}",
                event.getSessionId(), event.getSequence(), event.getIntent(), event.getOutcome(),
                event.getResultsCount());
    }
}
