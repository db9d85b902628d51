package com.shoptalk.catalog.service;

import com.shoptalk.catalog.CatalogFixtures;
import com.shoptalk.catalog.config.CatalogConfig;
import com.shoptalk.catalog.dto.SearchFilters;
import com.shoptalk.catalog.model.Product;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static com.shoptalk.catalog.CatalogFixtures.product;
import static org.assertj.core.api.Assertions.assertThat;

class ProductSearcherTest {

    private CatalogIndex catalogIndex;
    private CatalogConfig catalogConfig;
    private ProductSearcher productSearcher;

    @BeforeEach
    void setUp() {
        catalogIndex = new CatalogIndex();
        catalogConfig = new CatalogConfig();
        productSearcher = new ProductSearcher(catalogIndex, catalogConfig);
        catalogIndex.rebuild(CatalogFixtures.furniture());
    }

    @Test
    void officeChairFindsArtissFirst() {
        SearchOutcome outcome = productSearcher.search("office chair", SearchFilters.none(), 5);

        assertThat(outcome).isInstanceOf(SearchOutcome.Found.class);
        assertThat(outcome.products()).isNotEmpty();
        assertThat(outcome.products().get(0).getId()).isEqualTo("artiss-1");
    }

    @Test
    void everyInStockProductIsFoundByItsOwnTitle() {
        for (Product product : CatalogFixtures.furniture()) {
            if (!product.isInStock()) {
                continue;
            }
            List<Product> results = productSearcher.search(product.getTitle(), SearchFilters.none(), 5).products();

            assertThat(results).as("search for '%s'", product.getTitle()).contains(product);
        }
    }

    @Test
    void notReadyBeforeFirstBuild() {
        ProductSearcher unbuilt = new ProductSearcher(new CatalogIndex(), catalogConfig);

        SearchOutcome outcome = unbuilt.search("chair", SearchFilters.none(), 5);

        assertThat(outcome).isInstanceOf(SearchOutcome.CatalogNotReady.class);
        assertThat(outcome.products()).isEmpty();
    }

    @Test
    void emptyCatalogYieldsNoProducts() {
        catalogIndex.rebuild(List.of());

        SearchOutcome outcome = productSearcher.search("chair", SearchFilters.none(), 5);

        assertThat(outcome.products()).isEmpty();
        assertThat(outcome.tag()).isEqualTo("catalog_not_ready");
    }

    @Test
    void outOfStockExcludedUnlessRequested() {
        assertThat(productSearcher.search("velvet chair", SearchFilters.none(), 10).products())
                .extracting(Product::getId).doesNotContain("velvet-1");

        SearchFilters includeAll = SearchFilters.builder().includeOutOfStock(true).build();
        assertThat(productSearcher.search("velvet chair", includeAll, 10).products())
                .extracting(Product::getId).startsWith("velvet-1");
    }

    @Test
    void categoryAndInclusivePriceFilters() {
        SearchFilters filters = SearchFilters.builder()
                .category("chair")
                .priceMax(new BigDecimal("89.00"))
                .build();

        List<Product> results = productSearcher.search("dining", filters, 10).products();

        assertThat(results).extracting(Product::getId).containsExactly("chair-2");
    }

    @Test
    void categoryFilterAcceptsMultiWordNames() {
        SearchFilters filters = SearchFilters.builder().category("Bird Cages & Stands").build();

        assertThat(productSearcher.search("", filters, 10).products())
                .extracting(Product::getId).containsExactly("cage-1");
    }

    @Test
    void blankQueryBrowsesByPriceThenCatalogOrder() {
        SearchFilters chairs = SearchFilters.builder().category("Chairs").build();

        assertThat(productSearcher.search("  ", chairs, 10).products())
                .extracting(Product::getId).containsExactly("chair-2", "artiss-1");
    }

    @Test
    void unavailableColorReportsAlternatives() {
        SearchFilters red = SearchFilters.builder().color("red").build();

        SearchOutcome outcome = productSearcher.search("chair", red, 10);

        assertThat(outcome).isInstanceOf(SearchOutcome.NoAttributeMatch.class);
        SearchOutcome.NoAttributeMatch noMatch = (SearchOutcome.NoAttributeMatch) outcome;
        assertThat(noMatch.attribute()).isEqualTo("color");
        assertThat(noMatch.requestedValue()).isEqualTo("red");
        assertThat(noMatch.availableValues()).contains("black", "brown");
        assertThat(outcome.products()).isEmpty();
    }

    @Test
    void colorMatchesTagsCaseInsensitively() {
        SearchFilters black = SearchFilters.builder().color("Black").build();

        assertThat(productSearcher.search("chair", black, 10).products())
                .extracting(Product::getId).containsExactly("artiss-1");
    }

    @Test
    void excludedTermsRemoveNegatedMaterials() {
        SearchFilters notWood = SearchFilters.builder().excludedTerm("wood").build();

        assertThat(productSearcher.search("dining chair", notWood, 10).products())
                .extracting(Product::getId).doesNotContain("chair-2", "table-1");
    }

    @Test
    void equalScoresBreakTiesByPriceThenInsertionOrder() {
        catalogIndex.rebuild(List.of(
                product("lamp-a", "Brass Floor Lamp", "Lighting", "80.00"),
                product("lamp-b", "Brass Floor Lamp", "Lighting", "60.00"),
                product("lamp-c", "Brass Floor Lamp", "Lighting", "60.00")));

        List<Product> first = productSearcher.search("brass lamp", SearchFilters.none(), 10).products();
        List<Product> second = productSearcher.search("brass lamp", SearchFilters.none(), 10).products();

        assertThat(first).extracting(Product::getId).containsExactly("lamp-b", "lamp-c", "lamp-a");
        assertThat(second).isEqualTo(first);
    }

    @Test
    void titlePhraseMatchesWholeTokensOnly() {
        Product riser = product("riser-1", "Office Desktop Monitor Riser", "Office", "35.00");
        Product desk = product("desk-9", "Compact Office Desk", "Desks", "150.00");

        assertThat(ProductSearcher.titleContainsPhrase(riser, List.of("desk"))).isFalse();
        assertThat(ProductSearcher.titleContainsPhrase(riser, List.of("office", "desk"))).isFalse();
        assertThat(ProductSearcher.titleContainsPhrase(desk, List.of("office", "desk"))).isTrue();
        assertThat(ProductSearcher.titleContainsPhrase(desk, List.of("desk"))).isTrue();
    }

    @Test
    void limitIsClampedToConfiguredMaximum() {
        catalogConfig.getSearch().setMaxLimit(2);

        assertThat(productSearcher.search("", SearchFilters.none(), 100).products()).hasSize(2);
    }

    @Test
    void rebuildInvalidatesCachedResults() {
        assertThat(productSearcher.search("lamp", SearchFilters.none(), 5).products()).isEmpty();

        catalogIndex.rebuild(List.of(product("lamp-a", "Desk Lamp", "Lighting", "20.00")));

        assertThat(productSearcher.search("lamp", SearchFilters.none(), 5).products())
                .extracting(Product::getId).containsExactly("lamp-a");
    }
}
