package com.shoptalk.assistant.bundle;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;

import java.math.BigDecimal;
import java.util.List;
import java.util.Set;

/**
 * A multi-item request: what to buy, how many, and the total budget.
 */
@Getter
@Builder(toBuilder = true)
@ToString
public class BundleRequest {

    /** Total budget; null means unconstrained */
    private final BigDecimal budget;

    @Singular
    private final Set<String> allowedCategories;

    @Singular
    private final List<ItemTemplate> itemTemplates;

    private final String color;
    private final String material;

    /** Starter template this request was built from, if any */
    private final String templateName;

    public int totalQuantity() {
        return itemTemplates.stream().mapToInt(ItemTemplate::getQuantity).sum();
    }
}
