package com.shoptalk.assistant.dto;

import com.shoptalk.catalog.dto.ProductDTO;
import com.shoptalk.session.model.ChatMessage;
import com.shoptalk.session.model.SessionState;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Read-only view of a session for debugging and support tools.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SessionSummaryDTO {

    private String sessionId;
    private String userId;
    private Instant createdAt;
    private Instant lastActiveAt;
    private List<ChatMessage> messageHistory;
    private List<ProductDTO> lastShownProducts;
    private Map<String, Object> accumulatedFilters;
    private String lastQuery;
    private String pendingClarificationType;

    public static SessionSummaryDTO fromState(SessionState state) {
        return SessionSummaryDTO.builder()
                .sessionId(state.getSessionId())
                .userId(state.getUserId())
                .createdAt(state.getCreatedAt())
                .lastActiveAt(state.getLastActiveAt())
                .messageHistory(state.getMessageHistory())
                .lastShownProducts(state.getLastShownProducts().stream().map(ProductDTO::fromEntity).toList())
                .accumulatedFilters(state.getAccumulatedFilters())
                .lastQuery(state.getLastQuery())
                .pendingClarificationType(state.getPendingClarification() != null
                        ? state.getPendingClarification().getVagueType()
                        : null)
                .build();
    }
}
