package com.shoptalk.common.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kinds of indirect shopping requests the assistant can interpret.
 * Declaration order is also the rule table order used for tie-breaking.
 */
public enum VagueCategory {
    SYMPTOM_PROBLEM,
    SPATIAL_CONSTRAINT,
    SUBJECTIVE_SLANG,
    LIFESTYLE_CONTEXT,
    NEGATION_COMPLEXITY,
    SENTIMENT_ACTION,
    CLEAR;

    @JsonValue
    public String toJson() {
        return name().toLowerCase();
    }
}
