package com.shoptalk.session.model;

/**
 * Session state at the start of a turn plus the turn's arrival sequence.
 * Writes made with an older sequence than one already applied are discarded.
 */
public record TurnTicket(SessionState session, long sequence) {

    public String sessionId() {
        return session.getSessionId();
    }
}
