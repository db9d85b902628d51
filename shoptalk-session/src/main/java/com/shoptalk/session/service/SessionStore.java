package com.shoptalk.session.service;

import com.shoptalk.catalog.model.Product;
import com.shoptalk.common.enums.MessageRole;
import com.shoptalk.session.config.SessionProperties;
import com.shoptalk.session.model.ChatMessage;
import com.shoptalk.session.model.PendingClarification;
import com.shoptalk.session.model.SessionState;
import com.shoptalk.session.model.TurnTicket;
import com.shoptalk.session.persistence.SessionPersistence;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Keyed store of conversation sessions.
 *
 * Lookups go through a concurrent map. Every mutation of a session runs under that
 * session's own lock, so turns on different sessions never contend. Each turn takes an
 * arrival sequence from {@link #beginTurn}; shown products, pending clarifications and
 * search state written with a sequence older than the last applied one are discarded, and messages
 * are kept in arrival order even if they are appended out of order.
 */
@Slf4j
@Service
public class SessionStore {

    private final Map<String, SessionEntry> sessions = new ConcurrentHashMap<>();
    private final SessionPersistence sessionPersistence;
    private final SessionProperties sessionProperties;
    private final Clock clock;

    @Autowired
    public SessionStore(SessionPersistence sessionPersistence, SessionProperties sessionProperties) {
        this(sessionPersistence, sessionProperties, Clock.systemUTC());
    }

    public SessionStore(SessionPersistence sessionPersistence, SessionProperties sessionProperties, Clock clock) {
        this.sessionPersistence = sessionPersistence;
        this.sessionProperties = sessionProperties;
        this.clock = clock;
    }

    // ==================== Lookup ====================

    /**
     * Return the live session for the id, creating one if it is missing or expired.
     * A blank id starts a new session with a generated id.
     */
    public SessionState getOrCreate(String sessionId, String userId) {
        SessionEntry entry = entryFor(resolveId(sessionId), userId);
        return withLock(entry, state -> state.copy());
    }

    /**
     * Start a turn: fetch the session and assign the turn's arrival sequence.
     */
    public TurnTicket beginTurn(String sessionId, String userId) {
        SessionEntry entry = entryFor(resolveId(sessionId), userId);
        return withLock(entry, state -> new TurnTicket(state.copy(), entry.sequence.incrementAndGet()));
    }

    /**
     * Session if it exists and has not expired. Does not create or touch.
     */
    public Optional<SessionState> find(String sessionId) {
        if (sessionId == null) {
            return Optional.empty();
        }
        SessionEntry entry = sessions.get(sessionId);
        if (entry == null || entry.isExpired(now())) {
            return Optional.empty();
        }
        entry.lock.lock();
        try {
            return Optional.of(entry.state.copy());
        } finally {
            entry.lock.unlock();
        }
    }

    // ==================== Mutations ====================

    /**
     * Replace the shown products, keeping at most the configured number.
     *
     * @return false if a newer turn already replaced them
     */
    public boolean updateShownProducts(String sessionId, List<Product> products, long sequence) {
        return mutate(sessionId, state -> {
            if (sequence < state.getLastShownSequence()) {
                log.debug("Ignoring stale shown-products write for session {}: sequence {} < {}",
                        sessionId, sequence, state.getLastShownSequence());
                return false;
            }
            List<Product> shown = products != null ? products : List.of();
            int cap = sessionProperties.getMaxShownProducts();
            state.setLastShownProducts(new ArrayList<>(shown.subList(0, Math.min(cap, shown.size()))));
            state.setLastShownSequence(sequence);
            return true;
        });
    }

    public boolean updateShownProducts(String sessionId, List<Product> products) {
        return updateShownProducts(sessionId, products, nextSequence(sessionId));
    }

    /**
     * Record a question the assistant is waiting on. A null value clears it.
     *
     * @return false if a newer turn already set or cleared the clarification
     */
    public boolean setPendingClarification(String sessionId, PendingClarification info, long sequence) {
        return mutate(sessionId, state -> {
            if (sequence < state.getLastClarificationSequence()) {
                log.debug("Ignoring stale clarification write for session {}: sequence {} < {}",
                        sessionId, sequence, state.getLastClarificationSequence());
                return false;
            }
            state.setPendingClarification(info != null ? info.copy() : null);
            state.setLastClarificationSequence(sequence);
            return true;
        });
    }

    public boolean setPendingClarification(String sessionId, PendingClarification info) {
        return setPendingClarification(sessionId, info, nextSequence(sessionId));
    }

    public boolean clearPendingClarification(String sessionId, long sequence) {
        return setPendingClarification(sessionId, null, sequence);
    }

    /**
     * Append a message, keeping history in arrival order and within the configured size.
     */
    public void appendMessage(String sessionId, MessageRole role, String text, long sequence) {
        mutate(sessionId, state -> {
            List<ChatMessage> history = state.getMessageHistory();
            ChatMessage message = ChatMessage.builder()
                    .role(role)
                    .content(text)
                    .timestamp(now())
                    .sequence(sequence)
                    .build();

            int position = history.size();
            while (position > 0 && history.get(position - 1).getSequence() > sequence) {
                position--;
            }
            history.add(position, message);

            int overflow = history.size() - sessionProperties.getMaxHistory();
            if (overflow > 0) {
                history.subList(0, overflow).clear();
            }
            return null;
        });
    }

    public void appendMessage(String sessionId, MessageRole role, String text) {
        appendMessage(sessionId, role, text, nextSequence(sessionId));
    }

    /**
     * Merge filters into the accumulated set. Null values are ignored, so a category
     * can be replaced but never removed.
     *
     * @return false if a newer turn already wrote the search state
     */
    public boolean mergeFilters(String sessionId, Map<String, Object> filters, long sequence) {
        return writeSearchState(sessionId, sequence, state -> putAll(state.getAccumulatedFilters(), filters));
    }

    public boolean mergeFilters(String sessionId, Map<String, Object> filters) {
        return mergeFilters(sessionId, filters, nextSequence(sessionId));
    }

    /**
     * Replace the accumulated filters with the ones a new search ran with.
     *
     * @return false if a newer turn already wrote the search state
     */
    public boolean replaceFilters(String sessionId, Map<String, Object> filters, long sequence) {
        return writeSearchState(sessionId, sequence, state -> {
            Map<String, Object> replaced = new LinkedHashMap<>();
            putAll(replaced, filters);
            state.setAccumulatedFilters(replaced);
        });
    }

    /**
     * @return false if a newer turn already wrote the search state
     */
    public boolean setLastQuery(String sessionId, String query, long sequence) {
        return writeSearchState(sessionId, sequence, state -> state.setLastQuery(query));
    }

    public boolean setLastQuery(String sessionId, String query) {
        return setLastQuery(sessionId, query, nextSequence(sessionId));
    }

    /**
     * Next arrival sequence for the session, for writes made outside a turn.
     */
    public long nextSequence(String sessionId) {
        return entryFor(sessionId, null).sequence.incrementAndGet();
    }

    // ==================== Lifecycle ====================

    public boolean delete(String sessionId) {
        SessionEntry removed = sessions.remove(sessionId);
        sessionPersistence.delete(sessionId);
        if (removed != null) {
            log.info("Deleted session {}", sessionId);
        }
        return removed != null;
    }

    /**
     * Drop sessions idle longer than the timeout. Also applied lazily on access.
     */
    @Scheduled(fixedDelayString = "${shoptalk.session.sweep-interval-ms:60000}")
    public int evictExpired() {
        Instant now = now();
        int before = sessions.size();
        sessions.entrySet().removeIf(entry -> entry.getValue().isExpired(now));
        int evicted = before - sessions.size();
        if (evicted > 0) {
            log.info("Evicted {} expired sessions, {} active", evicted, sessions.size());
        }
        return evicted;
    }

    public int size() {
        return sessions.size();
    }

    @PreDestroy
    public void shutdown() {
        log.info("Shutting down session store: {} active sessions", sessions.size());
        sessions.clear();
    }

    // ==================== Helper Methods ====================

    private <T> T mutate(String sessionId, Function<SessionState, T> change) {
        SessionEntry entry = entryFor(sessionId, null);
        return withLock(entry, state -> {
            T result = change.apply(state);
            sessionPersistence.save(state.copy());
            return result;
        });
    }

    private boolean writeSearchState(String sessionId, long sequence, Consumer<SessionState> change) {
        return mutate(sessionId, state -> {
            if (sequence < state.getLastSearchSequence()) {
                log.debug("Ignoring stale search-state write for session {}: sequence {} < {}",
                        sessionId, sequence, state.getLastSearchSequence());
                return false;
            }
            change.accept(state);
            state.setLastSearchSequence(sequence);
            return true;
        });
    }

    private static void putAll(Map<String, Object> target, Map<String, Object> filters) {
        if (filters == null) {
            return;
        }
        filters.forEach((key, value) -> {
            if (key != null && value != null) {
                target.put(key, value);
            }
        });
    }

    private <T> T withLock(SessionEntry entry, Function<SessionState, T> action) {
        entry.lock.lock();
        try {
            Instant now = now();
            entry.state.setLastActiveAt(now);
            entry.lastActiveAt = now;
            return action.apply(entry.state);
        } finally {
            entry.lock.unlock();
        }
    }

    /**
     * Live entry for the id. Persistence is read outside the map so a slow load only
     * delays callers of the same session id.
     */
    private SessionEntry entryFor(String sessionId, String userId) {
        while (true) {
            Instant now = now();
            SessionEntry existing = sessions.get(sessionId);
            if (existing != null && !existing.isExpired(now)) {
                if (userId != null) {
                    withLock(existing, state -> {
                        if (state.getUserId() == null) {
                            state.setUserId(userId);
                        }
                        return null;
                    });
                }
                return existing;
            }
            if (existing != null) {
                log.info("Session {} expired after {} minutes of inactivity, starting fresh",
                        sessionId, sessionProperties.getTimeoutMinutes());
            }

            SessionState restored = sessionPersistence.load(sessionId)
                    .filter(state -> !state.isExpiredAt(now, sessionProperties.timeout()))
                    .orElse(null);
            SessionEntry created;
            if (restored != null) {
                created = new SessionEntry(restored, sessionProperties);
            } else {
                log.debug("Created session {} for user {}", sessionId, userId);
                created = new SessionEntry(SessionState.create(sessionId, userId, now), sessionProperties);
            }

            boolean installed = existing == null
                    ? sessions.putIfAbsent(sessionId, created) == null
                    : sessions.replace(sessionId, existing, created);
            if (installed) {
                return created;
            }
            // Another caller installed an entry first; use theirs.
        }
    }

    private String resolveId(String sessionId) {
        return sessionId != null && !sessionId.isBlank() ? sessionId : UUID.randomUUID().toString();
    }

    private Instant now() {
        return clock.instant();
    }

    private static class SessionEntry {
        final ReentrantLock lock = new ReentrantLock();
        final AtomicLong sequence;
        final SessionState state;
        final SessionProperties properties;
        volatile Instant lastActiveAt;

        SessionEntry(SessionState state, SessionProperties properties) {
            this.state = state;
            this.properties = properties;
            this.lastActiveAt = state.getLastActiveAt();
            long highest = Math.max(state.getLastSearchSequence(),
                    Math.max(state.getLastShownSequence(), state.getLastClarificationSequence()));
            for (ChatMessage message : state.getMessageHistory()) {
                highest = Math.max(highest, message.getSequence());
            }
            this.sequence = new AtomicLong(highest);
        }

        boolean isExpired(Instant now) {
            return lastActiveAt != null && lastActiveAt.plus(properties.timeout()).isBefore(now);
        }
    }
}
