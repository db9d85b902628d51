package com.shoptalk.session.persistence;

import com.shoptalk.session.model.SessionState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Used when Redis is disabled: sessions live only in the store's own map.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "shoptalk.session.redis.enabled", havingValue = "false", matchIfMissing = true)
public class InMemorySessionPersistence implements SessionPersistence {

    public InMemorySessionPersistence() {
        log.info("Session persistence disabled, sessions are kept in memory only");
    }

    @Override
    public Optional<SessionState> load(String sessionId) {
        return Optional.empty();
    }

    @Override
    public void save(SessionState state) {
        // nothing to write through
    }

    @Override
    public void delete(String sessionId) {
        // nothing to delete
    }
}
