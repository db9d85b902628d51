package com.shoptalk.assistant.validation;

import com.shoptalk.assistant.config.AssistantProperties;
import com.shoptalk.assistant.taxonomy.AttributeVocabulary;
import com.shoptalk.assistant.taxonomy.CategoryTaxonomy;
import com.shoptalk.assistant.text.TextMatching;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Decides whether extracted filters are backed by the message strongly enough to search with.
 *
 * A weighted filter only counts when its value (or a synonym) appears in the message;
 * anything else is dropped rather than allowed to narrow the search. The result is a
 * pure function of its inputs and the configured thresholds.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FilterValidator {

    static final Map<String, Double> FILTER_WEIGHTS = weights();

    static final double KEYWORD_WEIGHT = 1.0;

    static final List<String> SUBJECTIVE_TERMS = List.of(
            "nice", "good", "comfy", "comfortable", "cute", "pretty", "cool", "stylish", "quality",
            "best", "decent", "beautiful", "elegant", "sturdy", "solid");

    /**
     * Word groups that cannot both hold for one product, per kind of disagreement.
     */
    static final Map<String, List<Set<String>>> INCOMPATIBLE_PAIRS = Map.of(
            "price", List.of(Set.of("cheap", "budget", "affordable", "inexpensive"),
                    Set.of("luxury", "premium", "expensive", "high-end", "designer")),
            "size", List.of(Set.of("small", "compact", "tiny", "mini"),
                    Set.of("large", "big", "huge", "oversized")),
            "style", List.of(Set.of("modern", "contemporary", "minimalist"),
                    Set.of("vintage", "antique", "retro", "rustic")));

    private static final List<String> CONTRADICTION_ORDER = List.of("price", "size", "style");

    private static final Pattern BYPASS = Pattern.compile(
            "^(show me anything|surprise me|anything|anything is fine|whatever|just show me|just search|"
                    + "doesn'?t matter|don'?t care|i don'?t mind|no preference|any|all of them|"
                    + "yes|yeah|yep|sure|ok|okay|go ahead)$");

    private static final Pattern NEGATED_WORD = Pattern.compile("\\b(?:not|no|never)\\s+(?:too\\s+)?$");

    private final AssistantProperties assistantProperties;
    private final CategoryTaxonomy categoryTaxonomy;

    /**
     * Weigh candidate filters against the message text.
     */
    public FilterValidation validateFilterCount(Map<String, Object> candidateFilters, String queryText) {
        String query = TextMatching.normalize(queryText);
        FilterValidation.FilterValidationBuilder result = FilterValidation.builder();
        Map<String, Object> filters = candidateFilters != null ? candidateFilters : Map.of();

        double weight = 0.0;
        for (Map.Entry<String, Object> entry : filters.entrySet()) {
            String key = entry.getKey();
            Object value = entry.getValue();
            if (value == null) {
                continue;
            }
            Double keyWeight = FILTER_WEIGHTS.get(key);
            if (keyWeight == null) {
                result.acceptedFilter(key, value);
                continue;
            }
            if (isAttested(key, value, query)) {
                result.acceptedFilter(key, value);
                weight += keyWeight;
            } else {
                result.droppedFilter(key, "'" + value + "' is not mentioned in the message");
                log.debug("Dropping unattested filter: {}={}", key, value);
            }
        }

        weight += implicitWeight(filters, query);
        weight += subjectiveWeight(query);

        double minWeight = assistantProperties.getFilters().getMinWeight();
        boolean valid = weight >= minWeight;
        FilterValidation validation = result
                .valid(valid)
                .weight(weight)
                .message(valid ? null : clarificationFor(filters))
                .build();

        log.info("Filter validation: weight={}, minWeight={}, valid={}, dropped={}",
                String.format(Locale.ROOT, "%.2f", weight), minWeight, valid, validation.getDroppedFilters().keySet());
        return validation;
    }

    /**
     * First pair of incompatible requirements in the message or filters, if any.
     */
    public Optional<Contradiction> detectContradictions(Map<String, Object> filters, String queryText) {
        String query = TextMatching.normalize(queryText);
        for (String kind : CONTRADICTION_ORDER) {
            List<Set<String>> groups = INCOMPATIBLE_PAIRS.get(kind);
            Optional<String> first = firstPositiveMention(query, groups.get(0));
            Optional<String> second = firstPositiveMention(query, groups.get(1));
            if (first.isPresent() && second.isPresent()) {
                return Optional.of(new Contradiction(kind, first.get(), second.get(),
                        contradictionMessage(kind, first.get(), second.get())));
            }
        }
        if (filters != null) {
            BigDecimal min = asDecimal(filters.get("price_min"));
            BigDecimal max = asDecimal(filters.get("price_max"));
            if (min != null && max != null && min.compareTo(max) > 0) {
                return Optional.of(new Contradiction("price_range", min.toPlainString(), max.toPlainString(),
                        "The minimum price ($" + min.toPlainString() + ") is above the maximum ($"
                                + max.toPlainString() + "). What price range should I use?"));
            }
        }
        return Optional.empty();
    }

    /**
     * Answers that mean "just search with what you have".
     */
    public boolean isBypassPhrase(String message) {
        String normalized = TextMatching.normalize(message).replaceAll("[!.?,]+$", "").trim();
        return BYPASS.matcher(normalized).matches();
    }

    /**
     * Short human description of filters, e.g. "desk, wood, under $500".
     */
    public String filterSummary(Map<String, Object> filters) {
        if (filters == null || filters.isEmpty()) {
            return "no filters";
        }
        List<String> parts = new ArrayList<>();
        for (Map.Entry<String, Object> entry : filters.entrySet()) {
            Object value = entry.getValue();
            if (value == null || entry.getKey().equals("query")) {
                continue;
            }
            switch (entry.getKey()) {
                case "price_max" -> parts.add("under $" + value);
                case "price_min" -> parts.add("over $" + value);
                case "room_type" -> parts.add("for " + value.toString().replace('_', ' '));
                case "categories" -> parts.add(value instanceof List<?> list ? joinValues(list) : value.toString());
                default -> parts.add(value.toString());
            }
        }
        return parts.isEmpty() ? "no filters" : String.join(", ", parts);
    }

    // ==================== Attestation ====================

    boolean isAttested(String key, Object value, String query) {
        String text = value.toString().toLowerCase(Locale.ROOT).trim();
        if (text.isEmpty()) {
            return false;
        }
        switch (key) {
            case "price_max":
                return attestsPrice(value, query);
            case "material":
                String canonical = AttributeVocabulary.canonicalMaterial(text);
                if (TextMatching.containsPhrase(query, canonical)) {
                    return true;
                }
                return AttributeVocabulary.synonymsOf(canonical).stream()
                        .anyMatch(synonym -> TextMatching.containsPhrase(query, synonym));
            case "color":
                if (text.equals("grey") || text.equals("gray")) {
                    return TextMatching.containsPhrase(query, "grey") || TextMatching.containsPhrase(query, "gray");
                }
                return TextMatching.containsPhrase(query, text);
            case "room_type":
                if (TextMatching.containsPhrase(query, text) || TextMatching.containsPhrase(query, text.replace('_', ' '))) {
                    return true;
                }
                return AttributeVocabulary.ROOMS.entrySet().stream()
                        .anyMatch(room -> room.getValue().equals(text) && TextMatching.containsPhrase(query, room.getKey()));
            default:
                return TextMatching.containsPhrase(query, text)
                        || TextMatching.containsPhrase(query, text.replace('-', ' '))
                        || TextMatching.containsPhrase(query, singular(text));
        }
    }

    private boolean attestsPrice(Object value, String query) {
        BigDecimal amount = asDecimal(value);
        if (amount != null && TextMatching.containsPhrase(query, amount.stripTrailingZeros().toPlainString())) {
            return true;
        }
        return AttributeVocabulary.findSubjectivePrice(query).isPresent();
    }

    private double implicitWeight(Map<String, Object> filters, String query) {
        double weight = 0.0;
        boolean categoryAttested = isAttestedKey(filters, "category", query)
                || isAttestedKey(filters, "subcategory", query);
        boolean productTypeAttested = isAttestedKey(filters, "product_type", query);

        if (!categoryAttested && categoryTaxonomy.matchCategory(query).isPresent()) {
            weight += KEYWORD_WEIGHT;
        }
        if (!productTypeAttested && !categoryAttested && AttributeVocabulary.findProductNoun(query).isPresent()) {
            weight += KEYWORD_WEIGHT;
        }
        return weight;
    }

    private boolean isAttestedKey(Map<String, Object> filters, String key, String query) {
        Object value = filters.get(key);
        return value != null && isAttested(key, value, query);
    }

    private double subjectiveWeight(String query) {
        int count = 0;
        for (String term : SUBJECTIVE_TERMS) {
            if (TextMatching.containsPhrase(query, term)) {
                count++;
            }
        }
        int counted = Math.min(count, assistantProperties.getFilters().getMaxSubjectiveTerms());
        return counted * assistantProperties.getFilters().getSubjectiveTermWeight();
    }

    // ==================== Helper Methods ====================

    private Optional<String> firstPositiveMention(String query, Set<String> words) {
        return words.stream()
                .sorted()
                .filter(word -> {
                    int index = TextMatching.indexOfPhrase(query, word);
                    return index >= 0 && !NEGATED_WORD.matcher(query.substring(0, index)).find();
                })
                .findFirst();
    }

    private String contradictionMessage(String kind, String first, String second) {
        switch (kind) {
            case "price":
                return "You mentioned both " + first + " and " + second
                        + ". Should I focus on keeping the price down, or on premium quality?";
            case "size":
                return "You mentioned both " + first + " and " + second
                        + ". Do you need something compact, or something larger?";
            default:
                return "You mentioned both " + first + " and " + second
                        + " styles. Which look would you like me to search for?";
        }
    }

    private String clarificationFor(Map<String, Object> filters) {
        Object category = filters.get("category");
        if (category != null) {
            return "What kind of " + category + " are you looking for? For example a material, color, room or budget.";
        }
        return "I need a little more detail to search well. What type of product are you after, "
                + "and do you have a preferred color, material or budget?";
    }

    private static String singular(String text) {
        return text.endsWith("s") && text.length() > 3 ? text.substring(0, text.length() - 1) : text;
    }

    private static String joinValues(List<?> values) {
        List<String> parts = new ArrayList<>();
        for (Object value : values) {
            parts.add(String.valueOf(value));
        }
        return String.join(" or ", parts);
    }

    static BigDecimal asDecimal(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof BigDecimal decimal) {
            return decimal;
        }
        if (value instanceof Number number) {
            return new BigDecimal(number.toString());
        }
        try {
            return new BigDecimal(value.toString().replace("$", "").trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static Map<String, Double> weights() {
        Map<String, Double> map = new LinkedHashMap<>();
        map.put("category", 1.0);
        map.put("subcategory", 1.0);
        map.put("product_type", 1.0);
        map.put("color", 1.0);
        map.put("material", 1.0);
        map.put("style", 1.0);
        map.put("room_type", 0.8);
        map.put("descriptor", 0.8);
        map.put("price_max", 0.5);
        map.put("age_group", 0.5);
        return map;
    }
}
