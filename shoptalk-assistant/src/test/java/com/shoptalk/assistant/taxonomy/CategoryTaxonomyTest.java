package com.shoptalk.assistant.taxonomy;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CategoryTaxonomyTest {

    private final CategoryTaxonomy categoryTaxonomy = new CategoryTaxonomy();

    @Test
    void longestPhraseDecidesTheCategory() {
        assertThat(categoryTaxonomy.matchCategory("i need an office chair")).contains(CategoryTaxonomy.OFFICE_FURNITURE);
        assertThat(categoryTaxonomy.matchSubcategory("i need an office chair")).contains("Ergonomic Chairs");
    }

    @Test
    void subcategoryAliasCountsForItsParent() {
        assertThat(categoryTaxonomy.matchCategory("a bird cage for my cockatiel")).contains(CategoryTaxonomy.PET_PRODUCTS);
        assertThat(categoryTaxonomy.matchSubcategory("a bird cage for my cockatiel")).contains("Bird Cages & Stands");
    }

    @Test
    void pluralAliasesMatch() {
        assertThat(categoryTaxonomy.matchCategory("show me scooters")).contains(CategoryTaxonomy.ELECTRIC_SCOOTERS);
    }

    @Test
    void unrelatedTextMatchesNothing() {
        assertThat(categoryTaxonomy.matchCategory("hello there")).isEmpty();
        assertThat(categoryTaxonomy.matchSubcategory("hello there")).isEmpty();
    }

    @Test
    void parentLookup() {
        assertThat(categoryTaxonomy.parentOf("Dumbbells")).contains(CategoryTaxonomy.SPORTS_FITNESS);
        assertThat(categoryTaxonomy.parentOf("dumbbells")).contains(CategoryTaxonomy.SPORTS_FITNESS);
        assertThat(categoryTaxonomy.parentOf("Spaceships")).isEmpty();
        assertThat(categoryTaxonomy.subcategoriesOf(CategoryTaxonomy.PET_PRODUCTS)).contains("Bird Supplies");
        assertThat(categoryTaxonomy.categories()).hasSize(6);
    }
}
