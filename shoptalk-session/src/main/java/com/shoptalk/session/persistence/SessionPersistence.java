package com.shoptalk.session.persistence;

import com.shoptalk.session.model.SessionState;

import java.util.Optional;

/**
 * Durable backing for the in-memory session store.
 * Failures are reported as {@link com.shoptalk.session.exception.SessionStorageException}.
 */
public interface SessionPersistence {

    Optional<SessionState> load(String sessionId);

    void save(SessionState state);

    void delete(String sessionId);
}
