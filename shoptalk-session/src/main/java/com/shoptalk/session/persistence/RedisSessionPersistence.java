package com.shoptalk.session.persistence;

import com.shoptalk.session.config.SessionProperties;
import com.shoptalk.session.exception.SessionStorageException;
import com.shoptalk.session.model.SessionState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Writes sessions through to Redis with the inactivity timeout as TTL.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "shoptalk.session.redis.enabled", havingValue = "true")
public class RedisSessionPersistence implements SessionPersistence {

    private final RedisTemplate<String, SessionState> redisTemplate;
    private final SessionProperties sessionProperties;

    public RedisSessionPersistence(
            @Qualifier("sessionRedisTemplate") RedisTemplate<String, SessionState> redisTemplate,
            SessionProperties sessionProperties) {
        this.redisTemplate = redisTemplate;
        this.sessionProperties = sessionProperties;
    }

    @Override
    public Optional<SessionState> load(String sessionId) {
        try {
            SessionState state = redisTemplate.opsForValue().get(key(sessionId));
            if (state != null) {
                log.debug("Restored session {} from Redis", sessionId);
            }
            return Optional.ofNullable(state);
        } catch (DataAccessException e) {
            log.error("Failed to load session {} from Redis: {}", sessionId, e.getMessage());
            throw SessionStorageException.storageUnavailable(sessionId, e);
        }
    }

    @Override
    public void save(SessionState state) {
        try {
            redisTemplate.opsForValue().set(key(state.getSessionId()), state, sessionProperties.timeout());
        } catch (DataAccessException e) {
            log.error("Failed to save session {} to Redis: {}", state.getSessionId(), e.getMessage());
            throw SessionStorageException.storageUnavailable(state.getSessionId(), e);
        }
    }

    @Override
    public void delete(String sessionId) {
        try {
            redisTemplate.delete(key(sessionId));
        } catch (DataAccessException e) {
            log.error("Failed to delete session {} from Redis: {}", sessionId, e.getMessage());
            throw SessionStorageException.storageUnavailable(sessionId, e);
        }
    }

    private String key(String sessionId) {
        return sessionProperties.getRedis().getKeyPrefix() + sessionId;
    }
}
