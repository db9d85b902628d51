package com.shoptalk.assistant.reply;

import com.shoptalk.assistant.bundle.BundlePlan;
import com.shoptalk.assistant.lookup.ProductAvailability;
import com.shoptalk.catalog.model.Product;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;

import java.util.List;

/**
 * Everything a composer may mention. Built by the conversation handler after the
 * turn's outcome is fixed.
 */
@Getter
@Builder
@ToString
public class ReplyContext {

    private final ReplyKind kind;
    private final String userMessage;

    /** Search text used for the turn, if a search ran */
    private final String query;

    @Singular
    private final List<Product> products;

    private final BundlePlan bundlePlan;

    @Singular("productAvailability")
    private final List<ProductAvailability> availability;

    /** Product the similar results were matched against */
    private final Product similarTo;

    private final String clarificationMessage;

    // no_attribute_match
    private final String attribute;
    private final String requestedValue;
    @Singular
    private final List<String> availableValues;

    private final String policyText;

    /** Reference phrases that pointed past the shown products */
    @Singular
    private final List<String> unresolvedReferences;
}
