package com.shoptalk.assistant.intent;

import com.shoptalk.assistant.taxonomy.AttributeVocabulary;
import com.shoptalk.assistant.taxonomy.CategoryTaxonomy;
import com.shoptalk.assistant.text.TextMatching;
import com.shoptalk.assistant.validation.FilterValidator;
import com.shoptalk.common.enums.MessageIntent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Classifies a message as a new search, refinement, reference, comparison,
 * clarification answer or chit chat.
 *
 * Rules are evaluated in declaration order, each with a fixed score; the highest
 * scoring rule that applies wins and earlier rules win ties.
 */
@Slf4j
@Component
public class IntentDetector {

    private static final Pattern GREETING = Pattern.compile(
            "^(hi|hello|hey|hiya|good (morning|afternoon|evening)|thanks|thank you|cheers|bye|goodbye)\\b.*");

    private static final Pattern HELP = Pattern.compile(
            "^(help|what can you do|how does this work|who are you)\\b.*");

    private static final Pattern COMPARISON = Pattern.compile(
            "\\b(compare|comparison|vs\\.?|versus|difference between|differences|which (one )?is better|better than|pros and cons)\\b");

    static final Pattern PRICE_PHRASE = Pattern.compile(
            "\\b(?:under|below|less than|max|maximum|up to|within|cheaper than)\\s*\\$?(\\d+(?:\\.\\d+)?)");

    private static final Pattern AVAILABILITY = Pattern.compile(
            "\\b(in stock|out of stock|sold out|available|availability|any left|how many (are )?left|when can i get|delivery)\\b");

    private static final Pattern SIMILAR = Pattern.compile(
            "\\b(similar|more like|something like|others like|alternatives?( to)?|anything else like)\\b");

    private static final Pattern REFINEMENT_PREFIX = Pattern.compile("^(for|in|with|under|over|without)\\s+.*");

    static final List<String> SEARCH_KEYWORDS = List.of(
            "find", "show", "search", "looking for", "need", "want", "get me", "recommend", "buy");

    static final List<String> PRODUCT_WORDS = List.of(
            "equipment", "gear", "supplies", "accessories", "products", "items", "furniture");

    static final List<String> FEATURE_WORDS = List.of(
            "adjustable", "foldable", "portable", "ergonomic", "reclining", "swivel", "wheels",
            "cushioned", "padded", "heavy duty", "lightweight", "compact", "cheaper", "bigger", "smaller");

    private record IntentRule(String name, MessageIntent intent, double score, Predicate<IntentSignals> applies) {}

    private final CategoryTaxonomy categoryTaxonomy;
    private final FilterValidator filterValidator;
    private final List<IntentRule> rules;

    public IntentDetector(CategoryTaxonomy categoryTaxonomy, FilterValidator filterValidator) {
        this.categoryTaxonomy = categoryTaxonomy;
        this.filterValidator = filterValidator;
        this.rules = List.of(
                new IntentRule("greeting", MessageIntent.CHIT_CHAT, 0.95,
                        s -> GREETING.matcher(text(s)).matches() && TextMatching.wordCount(s.message()) <= 4),
                new IntentRule("help", MessageIntent.CHIT_CHAT, 0.95,
                        s -> HELP.matcher(text(s)).matches()),
                new IntentRule("comparison", MessageIntent.COMPARISON, 0.9,
                        s -> COMPARISON.matcher(text(s)).find() && (s.resolvedCount() >= 2 || s.hasShownProducts())),
                new IntentRule("reference", MessageIntent.REFERENCE, 0.9,
                        IntentSignals::referencesResolved),
                new IntentRule("clarification_answer", MessageIntent.CLARIFICATION_ANSWER, 0.85,
                        s -> s.pendingClarification() && answersClarification(text(s))),
                new IntentRule("refinement", MessageIntent.REFINEMENT, 0.8,
                        s -> s.hasActiveSearch() && isRefinement(text(s))),
                new IntentRule("new_search", MessageIntent.NEW_SEARCH, 0.7,
                        s -> isNewSearch(text(s))));
    }

    public IntentDetection detect(IntentSignals signals) {
        IntentDetection best = null;
        for (IntentRule rule : rules) {
            if (rule.applies().test(signals) && (best == null || rule.score() > best.score())) {
                best = new IntentDetection(rule.intent(), rule.score(), rule.name());
            }
        }
        if (best == null) {
            best = TextMatching.wordCount(signals.message()) >= 3
                    ? new IntentDetection(MessageIntent.NEW_SEARCH, 0.4, "fallback_search")
                    : new IntentDetection(MessageIntent.CHIT_CHAT, 0.3, "fallback_chat");
        }
        log.info("Intent detected: intent={}, rule={}, score={}", best.intent(), best.rule(), best.score());
        return best;
    }

    /**
     * A message naming a product or category, or using a search verb, starts a new search.
     */
    public boolean isNewSearch(String message) {
        String text = TextMatching.normalize(message);
        return mentionsProduct(text)
                || SEARCH_KEYWORDS.stream().anyMatch(keyword -> TextMatching.containsPhrase(text, keyword))
                || PRODUCT_WORDS.stream().anyMatch(word -> TextMatching.containsPhrase(text, word));
    }

    /**
     * A short message (five words at most) that only adds an attribute, a price or a
     * "for/in/with" qualifier to the current search.
     */
    public boolean isRefinement(String message) {
        String text = TextMatching.normalize(message);
        if (isNewSearch(text) || TextMatching.wordCount(text) > 5) {
            return false;
        }
        return hasAttribute(text)
                || PRICE_PHRASE.matcher(text).find()
                || REFINEMENT_PREFIX.matcher(text).matches();
    }

    /**
     * Whether a message about referenced products asks if they can be bought now.
     */
    public boolean asksAvailability(String message) {
        return AVAILABILITY.matcher(TextMatching.normalize(message)).find();
    }

    /**
     * Whether a message about referenced products asks for others like them.
     */
    public boolean asksForSimilar(String message) {
        return SIMILAR.matcher(TextMatching.normalize(message)).find();
    }

    /**
     * Entities stated in a message: category, price_max, color, material, style and room_type.
     */
    public Map<String, Object> extractEntities(String message) {
        String text = TextMatching.normalize(message);
        Map<String, Object> entities = new LinkedHashMap<>();
        Optional<String> noun = AttributeVocabulary.findProductNoun(text);
        if (noun.isPresent()) {
            entities.put("category", noun.get());
        } else {
            categoryTaxonomy.matchSubcategory(text).ifPresent(sub -> entities.put("category", sub.toLowerCase()));
        }
        Matcher price = PRICE_PHRASE.matcher(text);
        if (price.find()) {
            entities.put("price_max", new BigDecimal(price.group(1)));
        } else {
            AttributeVocabulary.findSubjectivePrice(text).ifPresent(entry -> entities.put("price_max", BigDecimal.valueOf(entry.getValue())));
        }
        AttributeVocabulary.findColor(text).ifPresent(color -> entities.put("color", color));
        AttributeVocabulary.findMaterial(text).ifPresent(material -> entities.put("material", material));
        AttributeVocabulary.findStyle(text).ifPresent(style -> entities.put("style", style));
        AttributeVocabulary.findRoom(text).ifPresent(room -> entities.put("room_type", room));
        log.debug("Extracted entities from '{}': {}", message, entities);
        return entities;
    }

    // ==================== Helper Methods ====================

    private boolean answersClarification(String text) {
        if (filterValidator.isBypassPhrase(text)) {
            return true;
        }
        // A full new request replaces the pending question; a short answer fills it in.
        return !isNewSearch(text) || TextMatching.wordCount(text) <= 2;
    }

    private boolean mentionsProduct(String text) {
        return AttributeVocabulary.findProductNoun(text).isPresent() || categoryTaxonomy.matchSubcategory(text).isPresent();
    }

    private boolean hasAttribute(String text) {
        return AttributeVocabulary.findColor(text).isPresent()
                || AttributeVocabulary.findMaterial(text).isPresent()
                || AttributeVocabulary.findStyle(text).isPresent()
                || AttributeVocabulary.findRoom(text).isPresent()
                || AttributeVocabulary.findSubjectivePrice(text).isPresent()
                || FEATURE_WORDS.stream().anyMatch(word -> TextMatching.containsPhrase(text, word));
    }

    private static String text(IntentSignals signals) {
        return TextMatching.normalize(signals.message());
    }
}
