package com.shoptalk.assistant.lookup;

import com.shoptalk.catalog.dto.SearchFilters;
import com.shoptalk.catalog.model.Product;
import com.shoptalk.catalog.service.ProductSearcher;
import com.shoptalk.catalog.service.SearchOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Finds products like a given one: its title as the query, restricted to its subcategory.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SimilarProductFinder {

    private final ProductSearcher productSearcher;

    /**
     * @param source the product to match
     * @param excludedIds products never returned, in addition to the source
     * @param limit maximum results
     */
    public SearchOutcome find(Product source, Collection<String> excludedIds, int limit) {
        Set<String> excluded = new HashSet<>(excludedIds);
        excluded.add(source.getId());

        SearchFilters.SearchFiltersBuilder filters = SearchFilters.builder();
        if (hasText(source.getSubcategory())) {
            filters.category(source.getSubcategory());
        }
        String query = hasText(source.getTitle()) ? source.getTitle()
                : hasText(source.getSubcategory()) ? source.getSubcategory() : source.getId();

        SearchOutcome outcome = productSearcher.search(query, filters.build(), limit + excluded.size());
        if (!(outcome instanceof SearchOutcome.Found found)) {
            return outcome;
        }
        List<Product> similar = found.products().stream()
                .filter(product -> !excluded.contains(product.getId()))
                .limit(limit)
                .toList();
        log.debug("Similar products for {}: {}", source.getId(), similar.size());
        return new SearchOutcome.Found(similar);
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
