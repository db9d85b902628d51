package com.shoptalk.assistant.validation;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;

import java.util.Map;

/**
 * Outcome of weighing candidate filters against the message they were extracted from.
 */
@Getter
@Builder
@ToString
public class FilterValidation {

    private final boolean valid;
    private final double weight;

    /** Filters safe to apply, in the order they were proposed */
    @Singular("acceptedFilter")
    private final Map<String, Object> acceptedFilters;

    /** Filter key to the reason it was dropped */
    @Singular("droppedFilter")
    private final Map<String, String> droppedFilters;

    private final String message;

    public boolean hasDroppedFilters() {
        return !droppedFilters.isEmpty();
    }
}
