package com.shoptalk.session.persistence;

import com.shoptalk.session.config.SessionProperties;
import com.shoptalk.session.exception.SessionStorageException;
import com.shoptalk.session.model.SessionState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RedisSessionPersistenceTest {

    @Mock
    private RedisTemplate<String, SessionState> redisTemplate;

    @Mock
    private ValueOperations<String, SessionState> valueOperations;

    private RedisSessionPersistence persistence;

    @BeforeEach
    void setUp() {
        persistence = new RedisSessionPersistence(redisTemplate, new SessionProperties());
    }

    @Test
    void savesWithPrefixedKeyAndTimeoutTtl() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        SessionState state = SessionState.create("abc", null, Instant.now());

        persistence.save(state);

        verify(valueOperations).set("shoptalk:session:abc", state, Duration.ofMinutes(30));
    }

    @Test
    void loadsStoredSession() {
        SessionState state = SessionState.create("abc", "u1", Instant.now());
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.get("shoptalk:session:abc")).thenReturn(state);

        assertThat(persistence.load("abc")).containsSame(state);
    }

    @Test
    void connectionFailureIsFatal() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.get("shoptalk:session:abc"))
                .thenThrow(new RedisConnectionFailureException("connection refused"));

        assertThatThrownBy(() -> persistence.load("abc"))
                .isInstanceOf(SessionStorageException.class)
                .hasMessageContaining("abc");
    }

    @Test
    void deleteRemovesKey() {
        persistence.delete("abc");

        verify(redisTemplate).delete("shoptalk:session:abc");
    }
}
