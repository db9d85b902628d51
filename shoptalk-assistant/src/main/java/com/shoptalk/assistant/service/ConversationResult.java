package com.shoptalk.assistant.service;

import com.shoptalk.assistant.bundle.BundlePlan;
import com.shoptalk.catalog.model.Product;
import com.shoptalk.common.enums.MessageIntent;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.List;
import java.util.Map;

/**
 * Outcome of one conversation turn.
 */
@Getter
@Builder
@ToString
public class ConversationResult {

    private final String sessionId;
    private final long sequence;
    private final MessageIntent messageIntent;
    private final String message;

    /** Products to display, in order; position 1 is index 0 */
    private final List<Product> products;

    private final BundlePlan bundlePlan;
    private final boolean clarificationNeeded;
    private final String clarificationMessage;

    /**
     * Diagnostics: outcome, intent rule, vague category and confidence, dropped
     * filters, unresolved references, search query and processing time.
     */
    private final Map<String, Object> metadata;

    public boolean hasProducts() {
        return products != null && !products.isEmpty();
    }
}
