package com.shoptalk.session.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A question the assistant asked and is waiting on.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class PendingClarification {

    /**
     * What is missing, e.g. "category_only", "attribute_only", "contradiction" or a vague category.
     */
    private String vagueType;

    /**
     * Entities already understood from the original request.
     */
    @Builder.Default
    private Map<String, Object> partialEntities = new LinkedHashMap<>();

    private String originalQuery;

    /**
     * How many times the assistant has asked for this request.
     */
    private int clarificationCount;

    private Instant createdAt;

    public PendingClarification copy() {
        return toBuilder()
                .partialEntities(partialEntities != null ? new LinkedHashMap<>(partialEntities) : new LinkedHashMap<>())
                .build();
    }
}
