package com.shoptalk.catalog.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.Singular;

import java.math.BigDecimal;
import java.util.Set;

/**
 * Hard and attribute filters applied by the product searcher.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class SearchFilters {

    /**
     * Any-of category names, matched against category, subcategory and tags.
     */
    @Singular(ignoreNullCollections = true)
    private Set<String> categories;

    /**
     * Inclusive lower price bound.
     */
    private BigDecimal priceMin;

    /**
     * Inclusive upper price bound.
     */
    private BigDecimal priceMax;

    private String color;

    private String material;

    /**
     * Terms that must not appear on a matching product (negated attributes).
     */
    @Singular(ignoreNullCollections = true)
    private Set<String> excludedTerms;

    private boolean includeOutOfStock;

    public static SearchFilters none() {
        return SearchFilters.builder().build();
    }
}
