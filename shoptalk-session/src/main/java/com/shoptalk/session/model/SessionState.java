package com.shoptalk.session.model;

import com.shoptalk.catalog.model.Product;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Conversation state for one session.
 *
 * Instances handed out by {@link com.shoptalk.session.service.SessionStore} are copies;
 * changes must go through the store so they are serialized per session.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class SessionState {

    private String sessionId;
    private String userId;
    private Instant createdAt;
    private Instant lastActiveAt;

    @Builder.Default
    private List<ChatMessage> messageHistory = new ArrayList<>();

    /**
     * Products from the latest result, in display order. Position 1 is index 0.
     */
    @Builder.Default
    private List<Product> lastShownProducts = new ArrayList<>();

    private PendingClarification pendingClarification;

    /**
     * Filters gathered across turns; the category is only ever replaced, never dropped.
     */
    @Builder.Default
    private Map<String, Object> accumulatedFilters = new LinkedHashMap<>();

    private String lastQuery;

    /** Sequence of the turn that last replaced the shown products */
    private long lastShownSequence;

    /** Sequence of the turn that last set or cleared the pending clarification */
    private long lastClarificationSequence;

    /** Sequence of the turn that last wrote the query or the accumulated filters */
    private long lastSearchSequence;

    public static SessionState create(String sessionId, String userId, Instant now) {
        return SessionState.builder()
                .sessionId(sessionId)
                .userId(userId)
                .createdAt(now)
                .lastActiveAt(now)
                .build();
    }

    public boolean isExpiredAt(Instant now, Duration timeout) {
        return lastActiveAt != null && lastActiveAt.plus(timeout).isBefore(now);
    }

    public boolean hasShownProducts() {
        return lastShownProducts != null && !lastShownProducts.isEmpty();
    }

    public SessionState copy() {
        List<ChatMessage> history = new ArrayList<>();
        if (messageHistory != null) {
            for (ChatMessage message : messageHistory) {
                history.add(message.toBuilder().build());
            }
        }
        return toBuilder()
                .messageHistory(history)
                .lastShownProducts(lastShownProducts != null ? new ArrayList<>(lastShownProducts) : new ArrayList<>())
                .pendingClarification(pendingClarification != null ? pendingClarification.copy() : null)
                .accumulatedFilters(accumulatedFilters != null ? new LinkedHashMap<>(accumulatedFilters) : new LinkedHashMap<>())
                .build();
    }
}
