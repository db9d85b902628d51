package com.shoptalk.assistant.intent;

import com.shoptalk.assistant.taxonomy.AttributeVocabulary;
import com.shoptalk.assistant.text.TextMatching;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Folds a shopper's answer to a clarification question into the entities of the
 * request that prompted it.
 *
 * Answers are normalised before merging: material synonyms collapse ("wooden" becomes
 * "wood"), room phrases become tokens ("living room" becomes "living_room", prefixed with
 * "for"), and prices become a {@code price_max} plus an "under $N" fragment. Negated
 * materials and colors ("without wood") go to {@link #EXCLUDED} and never become filters.
 * The merged search text is the original query (or category) followed by the fragment.
 * The category is never removed.
 */
@Slf4j
@Component
public class ClarificationMerger {

    public static final String QUERY = "query";
    public static final String CATEGORY = "category";
    public static final String EXCLUDED = "excluded_terms";

    private static final Pattern PRICE = Pattern.compile(
            "^(?:(?:under|below|less than|max|maximum|up to|within|around|about)\\s*)?\\$?(\\d+(?:\\.\\d+)?)\\s*(?:dollars|bucks)?$");

    public Map<String, Object> mergeClarificationResponse(Map<String, Object> originalEntities,
                                                          String clarificationText,
                                                          String vagueType) {
        Map<String, Object> merged = originalEntities != null ? new LinkedHashMap<>(originalEntities) : new LinkedHashMap<>();
        String answer = TextMatching.normalize(clarificationText).replaceAll("[!.?,]+$", "").trim();
        String base = baseQuery(merged);

        String fragment;
        Matcher price = PRICE.matcher(answer);
        Optional<String> room = roomToken(answer);
        if (answer.isEmpty()) {
            fragment = "";
        } else if (price.matches()) {
            BigDecimal amount = new BigDecimal(price.group(1));
            merged.put("price_max", amount);
            fragment = "under $" + amount.stripTrailingZeros().toPlainString();
        } else if (answer.startsWith("for ")) {
            String target = AttributeVocabulary.normalizeRooms(answer.substring(4));
            roomToken(answer.substring(4)).ifPresent(token -> merged.put("room_type", token));
            fragment = "for " + target;
        } else if (room.isPresent()) {
            merged.put("room_type", room.get());
            fragment = "for " + room.get();
        } else {
            fragment = normalizeAttributes(answer, merged);
        }
        exclude(merged, AttributeVocabulary.negatedAttributes(answer));

        if (!merged.containsKey(CATEGORY)) {
            AttributeVocabulary.findProductNoun(answer).ifPresent(noun -> merged.put(CATEGORY, noun));
        }
        String query = (base + " " + fragment).trim().replaceAll("\\s+", " ");
        merged.put(QUERY, query);

        log.info("Merged clarification: type={}, answer='{}', query='{}'", vagueType, clarificationText, query);
        return merged;
    }

    // ==================== Helper Methods ====================

    private String baseQuery(Map<String, Object> entities) {
        Object query = entities.get(QUERY);
        if (query != null && !query.toString().isBlank()) {
            return query.toString();
        }
        Object category = entities.get(CATEGORY);
        return category != null ? category.toString() : "";
    }

    /**
     * Room token when the whole answer is a room phrase, e.g. "office" or "living room".
     */
    private Optional<String> roomToken(String answer) {
        String trimmed = answer.trim();
        String token = AttributeVocabulary.ROOMS.get(trimmed);
        return Optional.ofNullable(token);
    }

    /**
     * Canonicalises each word of an attribute answer and records what it names.
     */
    private String normalizeAttributes(String answer, Map<String, Object> merged) {
        String text = AttributeVocabulary.normalizeRooms(AttributeVocabulary.removeNegatedAttributes(answer));
        List<String> words = new ArrayList<>();
        for (String word : text.split(" ")) {
            if (!word.matches(".*[a-z0-9].*")) {
                continue;
            }
            String canonical = AttributeVocabulary.canonicalMaterial(word);
            if (AttributeVocabulary.MATERIALS.containsKey(canonical)) {
                merged.put("material", canonical);
                words.add(canonical);
                continue;
            }
            if (AttributeVocabulary.COLORS.contains(word)) {
                merged.put("color", word);
            } else if (AttributeVocabulary.STYLES.contains(word)) {
                merged.put("style", word);
            }
            words.add(word);
        }
        return String.join(" ", words);
    }

    /**
     * Adds ruled-out terms to the excluded list and drops any filter naming one of them.
     */
    private void exclude(Map<String, Object> merged, Set<String> negated) {
        if (negated.isEmpty()) {
            return;
        }
        Set<String> excluded = excludedTerms(merged);
        excluded.addAll(negated);
        merged.put(EXCLUDED, new ArrayList<>(excluded));
        for (String key : List.of("material", "color")) {
            Object value = merged.get(key);
            if (value != null && excluded.contains(AttributeVocabulary.canonicalMaterial(value.toString()))) {
                merged.remove(key);
            }
        }
    }

    /**
     * Terms listed under {@link #EXCLUDED}, in order.
     */
    public static Set<String> excludedTerms(Map<String, Object> entities) {
        Set<String> terms = new LinkedHashSet<>();
        Object value = entities != null ? entities.get(EXCLUDED) : null;
        if (value instanceof Collection<?> values) {
            values.forEach(term -> terms.add(String.valueOf(term)));
        } else if (value != null) {
            terms.add(value.toString());
        }
        return terms;
    }
}
