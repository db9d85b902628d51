package com.shoptalk.assistant.bundle;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;

import java.math.BigDecimal;
import java.util.List;
import java.util.Set;

/**
 * Selected products for a bundle request.
 *
 * {@code totalCost <= budget} whenever {@code feasible} is true. When the cheapest
 * required items already exceed the budget the plan is still returned, marked
 * infeasible, with the overrun in {@code budgetShortfall}.
 */
@Getter
@Builder
@ToString
public class BundlePlan {

    @Singular
    private final List<BundleLine> items;

    private final BigDecimal totalCost;

    /** Null when the request had no budget */
    private final BigDecimal budget;

    /** Required item types with no in-stock candidate */
    @Singular
    private final Set<String> unmetItemTypes;

    /** Optional item types left out, for lack of candidates or budget */
    @Singular
    private final Set<String> skippedOptionalItemTypes;

    private final BigDecimal budgetShortfall;

    private final BigDecimal remainingBudget;

    private final boolean feasible;

    private final boolean usedFallbackSearch;

    private final String templateName;

    public boolean isComplete() {
        return feasible && unmetItemTypes.isEmpty();
    }
}
