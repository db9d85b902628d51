package com.shoptalk.assistant.taxonomy;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CategoryIntelligenceTest {

    private final CategoryIntelligence categoryIntelligence = new CategoryIntelligence();

    @Test
    void contextWithMostKeywordsWins() {
        assertThat(categoryIntelligence.detectContext("my new puppy needs a bed"))
                .hasValueSatisfying(match -> {
                    assertThat(match.context()).isEqualTo("pet");
                    assertThat(match.categories()).contains("Dog Supplies");
                });
        assertThat(categoryIntelligence.detectContext("ergonomic setup for my home office desk"))
                .hasValueSatisfying(match -> assertThat(match.context()).isEqualTo("office"));
    }

    @Test
    void noContextForUnrelatedText() {
        assertThat(categoryIntelligence.detectContext("hmm")).isEmpty();
    }

    @Test
    void itemCategoriesPreferExactThenContainedEntries() {
        assertThat(categoryIntelligence.categoriesForItem("bird_cage")).containsExactly("Bird Cages & Stands");
        assertThat(categoryIntelligence.categoriesForItem("gaming desk")).containsExactly("Desks", "Workstation");
        assertThat(categoryIntelligence.categoriesForItem("lamp")).containsExactly("Lighting");
        assertThat(categoryIntelligence.categoriesForItem("")).isEmpty();
    }

    @Test
    void itemFallsBackToGroupCategoryNames() {
        assertThat(categoryIntelligence.categoriesForItem("recliner")).containsExactly("Recliners");
    }

    @Test
    void everydayPhrasesTranslateToCategories() {
        assertThat(categoryIntelligence.translatePhrase("my back hurts after work"))
                .hasValueSatisfying(translation -> {
                    assertThat(translation.categories()).containsExactly("Chairs", "Desks");
                    assertThat(translation.searchQuery()).isEqualTo("ergonomic lumbar support");
                });
    }
}
