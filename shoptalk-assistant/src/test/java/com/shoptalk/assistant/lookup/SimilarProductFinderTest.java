package com.shoptalk.assistant.lookup;

import com.shoptalk.assistant.AssistantFixtures;
import com.shoptalk.catalog.config.CatalogConfig;
import com.shoptalk.catalog.model.Product;
import com.shoptalk.catalog.service.CatalogIndex;
import com.shoptalk.catalog.service.ProductSearcher;
import com.shoptalk.catalog.service.SearchOutcome;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class SimilarProductFinderTest {

    private final SimilarProductFinder finder = new SimilarProductFinder(AssistantFixtures.searcher(AssistantFixtures.store()));

    private static Product stored(String id) {
        return AssistantFixtures.store().stream().filter(p -> p.getId().equals(id)).findFirst().orElseThrow();
    }

    @Test
    void staysInTheSourceSubcategoryAndLeavesTheSourceOut() {
        SearchOutcome outcome = finder.find(stored("toy-1"), Set.of(), 5);

        assertThat(outcome).isInstanceOf(SearchOutcome.Found.class);
        assertThat(outcome.products()).extracting(Product::getId)
                .doesNotContain("toy-1")
                .contains("toy-2")
                .allSatisfy(id -> assertThat(stored(id).getSubcategory()).isEqualTo("Bird Supplies"));
    }

    @Test
    void excludedIdsAndLimitAreHonoured() {
        SearchOutcome outcome = finder.find(stored("toy-1"), Set.of("toy-2"), 1);

        assertThat(outcome.products()).hasSize(1);
        assertThat(outcome.products()).extracting(Product::getId).doesNotContain("toy-1", "toy-2");
    }

    @Test
    void onlyProductInItsSubcategoryHasNoMatches() {
        assertThat(finder.find(stored("sofa-1"), Set.of(), 5).products()).isEmpty();
    }

    @Test
    void catalogNotReadyPassesThrough() {
        SimilarProductFinder unbuilt = new SimilarProductFinder(new ProductSearcher(new CatalogIndex(), new CatalogConfig()));

        assertThat(unbuilt.find(stored("toy-1"), List.of(), 5)).isInstanceOf(SearchOutcome.CatalogNotReady.class);
    }
}
