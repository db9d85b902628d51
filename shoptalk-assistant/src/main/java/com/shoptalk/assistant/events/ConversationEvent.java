package com.shoptalk.assistant.events;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Summary of one conversation turn, published as JSON.
 * Enums are serialized as strings and timestamps as ISO-8601.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConversationEvent {
    private String eventId;
    private String sessionId;
    private String userId;
    private long sequence;
    private String intent;                  // new_search, refinement, reference, ...
    private String outcome;                 // found, no_attribute_match, catalog_not_ready, clarification, ...
    private String query;                   // Search text actually used, if any
    private String vagueCategory;
    private double confidence;
    private boolean clarificationNeeded;
    private int resultsCount;
    private List<String> returnedProductIds;
    private List<String> droppedFilters;
    private long processingTimeMs;
    private String timestamp;
}
