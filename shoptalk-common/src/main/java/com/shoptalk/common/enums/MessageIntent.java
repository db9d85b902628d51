package com.shoptalk.common.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Classification of a user message within a conversation.
 */
public enum MessageIntent {
    NEW_SEARCH,
    REFINEMENT,
    REFERENCE,
    COMPARISON,
    CLARIFICATION_ANSWER,
    CHIT_CHAT;

    @JsonValue
    public String toJson() {
        return name().toLowerCase();
    }
}
