package com.shoptalk.common.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Downstream action suggested by query interpretation.
 */
public enum SuggestedTool {
    SEARCH_PRODUCTS,
    BUILD_BUNDLE,
    GET_POLICY_INFO;

    @JsonValue
    public String toJson() {
        return name().toLowerCase();
    }
}
