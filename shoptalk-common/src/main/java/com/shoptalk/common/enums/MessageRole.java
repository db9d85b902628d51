package com.shoptalk.common.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Author of a message in the conversation history.
 */
public enum MessageRole {
    USER,
    ASSISTANT;

    @JsonValue
    public String toJson() {
        return name().toLowerCase();
    }
}
