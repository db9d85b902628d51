package com.shoptalk.catalog.index;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CatalogTokenizerTest {

    @Test
    void lowercasesSplitsAndDropsStopwords() {
        assertThat(CatalogTokenizer.tokenize("Show me THE best Office-Chair for $200"))
                .containsExactly("best", "office", "chair", "200");
    }

    @Test
    void foldsCommonPlurals() {
        assertThat(CatalogTokenizer.tokenize("chairs benches shelves accessories boxes"))
                .containsExactly("chair", "bench", "shelf", "accessory", "box");
    }

    @Test
    void keepsWordsThatOnlyLookPlural() {
        assertThat(CatalogTokenizer.tokenize("glass cactus chassis"))
                .containsExactly("glass", "cactus", "chassis");
    }

    @Test
    void blankTextHasNoTokens() {
        assertThat(CatalogTokenizer.tokenize(null)).isEmpty();
        assertThat(CatalogTokenizer.tokenize("   ")).isEmpty();
        assertThat(CatalogTokenizer.tokenize("the and of")).isEmpty();
    }
}
