package com.shoptalk.assistant.bundle;

import com.shoptalk.assistant.taxonomy.CategoryIntelligence;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

class BundleRequestParserTest {

    private final BundleRequestParser parser = new BundleRequestParser(new CategoryIntelligence());

    @Test
    void starterKitUsesTemplate() {
        assertThat(parser.parse("bird starter kit under 200")).hasValueSatisfying(request -> {
            assertThat(request.getTemplateName()).isEqualTo("bird");
            assertThat(request.getBudget()).isEqualByComparingTo("200");
            assertThat(request.getItemTemplates()).extracting(ItemTemplate::getItemType)
                    .containsExactly("bird_cage", "perch", "bird_toy", "feeder");
            assertThat(request.getAllowedCategories()).contains("Bird Cages & Stands", "Bird Supplies");
        });
    }

    @Test
    void explicitQuantitiesAreSummedPerType() {
        assertThat(parser.parse("2 chairs and 1 desk under 500")).hasValueSatisfying(request -> {
            assertThat(request.getItemTemplates()).extracting(ItemTemplate::getItemType).containsExactly("chair", "desk");
            assertThat(request.getItemTemplates()).extracting(ItemTemplate::getQuantity).containsExactly(2, 1);
            assertThat(request.totalQuantity()).isEqualTo(3);
            assertThat(request.getTemplateName()).isNull();
        });
    }

    @Test
    void pairOfProductsUnderBudget() {
        assertThat(parser.parse("desk and chair under 500")).hasValueSatisfying(request -> {
            assertThat(request.getBudget()).isEqualByComparingTo("500");
            assertThat(request.getItemTemplates()).extracting(ItemTemplate::getItemType).containsExactly("desk", "chair");
            assertThat(request.getItemTemplates().get(0).getCategories()).containsExactly("Desks", "Workstation");
            assertThat(request.getItemTemplates().get(0).getSearchTerms()).containsExactly("desk");
        });
    }

    @Test
    void roomPrefixesSearchTermsExceptForCoreItems() {
        assertThat(parser.parse("office desk and lamp under 300")).hasValueSatisfying(request -> {
            assertThat(request.getItemTemplates().get(0).getSearchTerms()).containsExactly("desk");
            assertThat(request.getItemTemplates().get(1).getSearchTerms()).containsExactly("office lamp", "lamp");
        });
    }

    @Test
    void colorIsCarriedToTheRequest() {
        assertThat(parser.parse("3x stools in black under 150")).hasValueSatisfying(request -> {
            assertThat(request.getColor()).isEqualTo("black");
            assertThat(request.getItemTemplates().get(0).getQuantity()).isEqualTo(3);
        });
    }

    @Test
    void singleItemsAreNotBundles() {
        assertThat(parser.parse("a red sofa")).isEmpty();
        assertThat(parser.parse("desk and chair")).isEmpty();
        assertThat(parser.isBundleRequest("")).isFalse();
    }

    @Test
    void budgetPhrasings() {
        assertThat(BundleRequestParser.extractBudget("my budget of $450")).contains(new BigDecimal("450"));
        assertThat(BundleRequestParser.extractBudget("total 99.50 please")).contains(new BigDecimal("99.50"));
        assertThat(BundleRequestParser.extractBudget("no limit")).isEmpty();
    }
}
