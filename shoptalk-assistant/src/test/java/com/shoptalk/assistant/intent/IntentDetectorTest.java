package com.shoptalk.assistant.intent;

import com.shoptalk.assistant.config.AssistantProperties;
import com.shoptalk.assistant.taxonomy.CategoryTaxonomy;
import com.shoptalk.assistant.validation.FilterValidator;
import com.shoptalk.common.enums.MessageIntent;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class IntentDetectorTest {

    private final CategoryTaxonomy categoryTaxonomy = new CategoryTaxonomy();
    private final IntentDetector intentDetector = new IntentDetector(categoryTaxonomy,
            new FilterValidator(new AssistantProperties(), categoryTaxonomy));

    private static IntentSignals fresh(String message) {
        return new IntentSignals(message, false, 0, false, false, false);
    }

    @Test
    void greetingIsChitChat() {
        IntentDetection detection = intentDetector.detect(fresh("Hi there"));

        assertThat(detection.intent()).isEqualTo(MessageIntent.CHIT_CHAT);
        assertThat(detection.rule()).isEqualTo("greeting");
    }

    @Test
    void helpIsChitChat() {
        assertThat(intentDetector.detect(fresh("what can you do?")).rule()).isEqualTo("help");
    }

    @Test
    void productMentionStartsNewSearch() {
        IntentDetection detection = intentDetector.detect(fresh("show me office chairs"));

        assertThat(detection.intent()).isEqualTo(MessageIntent.NEW_SEARCH);
        assertThat(detection.score()).isEqualTo(0.7);
    }

    @Test
    void resolvedReferenceWins() {
        IntentDetection detection = intentDetector.detect(
                new IntentSignals("tell me about Artiss Office Chair", true, 1, false, true, true));

        assertThat(detection.intent()).isEqualTo(MessageIntent.REFERENCE);
    }

    @Test
    void comparisonNeedsProductsOnScreen() {
        assertThat(intentDetector.detect(new IntentSignals("compare them", false, 0, false, true, true)).intent())
                .isEqualTo(MessageIntent.COMPARISON);
        assertThat(intentDetector.detect(fresh("compare them")).intent())
                .isNotEqualTo(MessageIntent.COMPARISON);
    }

    @Test
    void shortAnswerFillsPendingClarification() {
        IntentDetection detection = intentDetector.detect(new IntentSignals("wooden", false, 0, true, false, false));

        assertThat(detection.intent()).isEqualTo(MessageIntent.CLARIFICATION_ANSWER);
    }

    @Test
    void fullRequestReplacesPendingClarification() {
        IntentDetection detection = intentDetector.detect(
                new IntentSignals("show me red velvet sofas please", false, 0, true, false, false));

        assertThat(detection.intent()).isEqualTo(MessageIntent.NEW_SEARCH);
    }

    @Test
    void attributeOnlyMessageRefinesActiveSearch() {
        IntentDetection detection = intentDetector.detect(new IntentSignals("in red", false, 0, false, true, true));

        assertThat(detection.intent()).isEqualTo(MessageIntent.REFINEMENT);
        assertThat(intentDetector.isRefinement("under $300")).isTrue();
        assertThat(intentDetector.isRefinement("show me a red sofa")).isFalse();
    }

    @Test
    void unknownShortMessageFallsBackToChat() {
        IntentDetection detection = intentDetector.detect(fresh("blah"));

        assertThat(detection.intent()).isEqualTo(MessageIntent.CHIT_CHAT);
        assertThat(detection.rule()).isEqualTo("fallback_chat");
    }

    @Test
    void extractsStatedEntities() {
        Map<String, Object> entities = intentDetector.extractEntities(
                "black leather office chair under 300 for the living room");

        assertThat(entities)
                .containsEntry("category", "office chair")
                .containsEntry("price_max", new BigDecimal("300"))
                .containsEntry("color", "black")
                .containsEntry("material", "leather")
                .containsEntry("room_type", "living_room");
    }

    @Test
    void subjectivePriceBecomesCeiling() {
        assertThat(intentDetector.extractEntities("a cheap desk"))
                .containsEntry("category", "desk")
                .containsEntry("price_max", BigDecimal.valueOf(200));
    }

    @Test
    void stockAndSimilarQuestionsAreRecognised() {
        assertThat(intentDetector.asksAvailability("is [product:artiss-1] in stock?")).isTrue();
        assertThat(intentDetector.asksAvailability("how many are left of [product:desk-1]")).isTrue();
        assertThat(intentDetector.asksAvailability("tell me about [product:desk-1]")).isFalse();
        assertThat(intentDetector.asksForSimilar("show me more like [product:desk-1]")).isTrue();
        assertThat(intentDetector.asksForSimilar("any alternatives to [product:desk-1]")).isTrue();
        assertThat(intentDetector.asksForSimilar("I like [product:desk-1]")).isFalse();
    }
}
