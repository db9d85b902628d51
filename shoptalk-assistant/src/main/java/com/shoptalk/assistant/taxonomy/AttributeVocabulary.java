package com.shoptalk.assistant.taxonomy;

import com.shoptalk.assistant.text.TextMatching;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Attribute words recognised in shopper messages: colors, materials (with synonyms),
 * styles, rooms, subjective price words and concrete product nouns.
 */
public final class AttributeVocabulary {

    private AttributeVocabulary() {}

    public static final List<String> COLORS = List.of(
            "black", "white", "red", "green", "blue", "brown", "grey", "gray",
            "yellow", "orange", "pink", "purple", "beige", "navy", "natural");

    /**
     * Canonical material to the words that mean it. Canonical names come first in lookups.
     */
    public static final Map<String, List<String>> MATERIALS = materials();

    public static final List<String> STYLES = List.of(
            "modern", "contemporary", "traditional", "rustic", "minimalist", "industrial",
            "vintage", "classic", "scandinavian", "mid-century", "gaming", "ergonomic");

    /**
     * Room phrases to the underscore token used in queries and filters.
     */
    public static final Map<String, String> ROOMS = rooms();

    /**
     * Subjective price words to the price ceiling they imply.
     */
    public static final Map<String, Integer> SUBJECTIVE_PRICES = subjectivePrices();

    public static final List<String> PRODUCT_NOUNS = List.of(
            "office chair", "gaming chair", "dining table", "coffee table", "standing desk",
            "bird cage", "dog bed", "cat tree", "pet bed", "bar stool", "filing cabinet",
            "exercise bike", "rowing machine", "yoga mat", "punching bag", "electric scooter",
            "chair", "desk", "table", "sofa", "couch", "bed", "mattress", "shelf", "bookshelf",
            "bookcase", "cabinet", "cupboard", "drawer", "wardrobe", "dresser", "lamp", "rug",
            "mirror", "ottoman", "bench", "stool", "locker", "recliner", "treadmill", "dumbbell",
            "kettlebell", "barbell", "scooter", "bike", "kennel", "cage", "feeder", "fountain",
            "carrier", "perch", "toy", "monitor arm", "whiteboard", "workstation");

    private static final Pattern NEGATION = Pattern.compile(
            "\\b(?:not|no|without|isn'?t|aren'?t|don'?t\\s+want|anything\\s+but)\\s+(?:made\\s+of\\s+|in\\s+)?([a-z-]+)");

    public static Optional<String> findColor(String text) {
        for (String color : COLORS) {
            if (TextMatching.containsPhrase(text, color)) {
                return Optional.of(color);
            }
        }
        return Optional.empty();
    }

    /**
     * First material mentioned, canonicalised (wooden becomes wood).
     */
    public static Optional<String> findMaterial(String text) {
        for (Map.Entry<String, List<String>> entry : MATERIALS.entrySet()) {
            if (TextMatching.containsPhrase(text, entry.getKey())) {
                return Optional.of(entry.getKey());
            }
            for (String synonym : entry.getValue()) {
                if (TextMatching.containsPhrase(text, synonym)) {
                    return Optional.of(entry.getKey());
                }
            }
        }
        return Optional.empty();
    }

    public static String canonicalMaterial(String word) {
        String normalized = TextMatching.normalize(word);
        for (Map.Entry<String, List<String>> entry : MATERIALS.entrySet()) {
            if (entry.getKey().equals(normalized) || entry.getValue().contains(normalized)) {
                return entry.getKey();
            }
        }
        return normalized;
    }

    public static List<String> synonymsOf(String material) {
        return MATERIALS.getOrDefault(canonicalMaterial(material), List.of());
    }

    public static Optional<String> findStyle(String text) {
        for (String style : STYLES) {
            if (TextMatching.containsPhrase(text, style)) {
                return Optional.of(style);
            }
        }
        return Optional.empty();
    }

    /**
     * Longest room phrase mentioned, as its underscore token.
     */
    public static Optional<String> findRoom(String text) {
        return TextMatching.longestPhrase(text, ROOMS.keySet()).map(ROOMS::get);
    }

    /**
     * Rewrites multi-word room phrases into their tokens, e.g. "living room" to "living_room".
     */
    public static String normalizeRooms(String text) {
        String result = TextMatching.normalize(text);
        for (Map.Entry<String, String> entry : ROOMS.entrySet()) {
            if (entry.getKey().contains(" ")) {
                result = result.replaceAll("\\b" + entry.getKey() + "\\b", entry.getValue());
            }
        }
        return result;
    }

    public static Optional<Map.Entry<String, Integer>> findSubjectivePrice(String text) {
        for (Map.Entry<String, Integer> entry : SUBJECTIVE_PRICES.entrySet()) {
            if (TextMatching.containsPhrase(text, entry.getKey())) {
                return Optional.of(entry);
            }
        }
        return Optional.empty();
    }

    /**
     * Longest concrete product noun in the text.
     */
    public static Optional<String> findProductNoun(String text) {
        return TextMatching.longestPhrase(text, PRODUCT_NOUNS);
    }

    /**
     * Materials and colors the shopper ruled out ("not wood", "no leather", "without metal").
     */
    public static Set<String> negatedAttributes(String text) {
        Set<String> terms = new LinkedHashSet<>();
        Matcher matcher = NEGATION.matcher(TextMatching.normalize(text));
        while (matcher.find()) {
            negatedAttribute(matcher.group(1)).ifPresent(terms::add);
        }
        return terms;
    }

    /**
     * The text without its negated material and color phrases, so "chairs without wood"
     * becomes "chairs".
     */
    public static String removeNegatedAttributes(String text) {
        Matcher matcher = NEGATION.matcher(TextMatching.normalize(text));
        StringBuilder result = new StringBuilder();
        while (matcher.find()) {
            String replacement = negatedAttribute(matcher.group(1)).isPresent() ? " " : matcher.group();
            matcher.appendReplacement(result, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(result);
        return result.toString().trim().replaceAll("\\s+", " ");
    }

    private static Optional<String> negatedAttribute(String word) {
        String canonical = canonicalMaterial(word);
        if (MATERIALS.containsKey(canonical)) {
            return Optional.of(canonical);
        }
        return COLORS.contains(word) ? Optional.of(word) : Optional.empty();
    }

    // ==================== Table Builders ====================

    private static Map<String, List<String>> materials() {
        Map<String, List<String>> map = new LinkedHashMap<>();
        map.put("wood", List.of("wooden", "timber", "oak", "pine", "walnut"));
        map.put("metal", List.of("metallic", "iron", "aluminium", "aluminum"));
        map.put("steel", List.of("stainless"));
        map.put("leather", List.of("leatherette", "pu leather"));
        map.put("fabric", List.of("cloth", "upholstered", "linen"));
        map.put("glass", List.of("tempered glass"));
        map.put("rattan", List.of("wicker"));
        map.put("plastic", List.of("acrylic"));
        map.put("velvet", List.of());
        map.put("mesh", List.of());
        return Collections.unmodifiableMap(map);
    }

    private static Map<String, String> rooms() {
        Map<String, String> map = new LinkedHashMap<>();
        map.put("living room", "living_room");
        map.put("lounge room", "living_room");
        map.put("dining room", "dining_room");
        map.put("kids room", "kids_room");
        map.put("home office", "office");
        map.put("office", "office");
        map.put("study", "office");
        map.put("workspace", "office");
        map.put("bedroom", "bedroom");
        map.put("kitchen", "kitchen");
        map.put("bathroom", "bathroom");
        map.put("outdoor", "outdoor");
        map.put("patio", "outdoor");
        map.put("garden", "outdoor");
        return Collections.unmodifiableMap(map);
    }

    private static Map<String, Integer> subjectivePrices() {
        Map<String, Integer> map = new LinkedHashMap<>();
        map.put("cheap", 200);
        map.put("affordable", 300);
        map.put("budget", 250);
        map.put("inexpensive", 250);
        map.put("expensive", 500);
        map.put("premium", 800);
        map.put("luxury", 1000);
        map.put("high-end", 1000);
        map.put("designer", 1200);
        return Collections.unmodifiableMap(map);
    }
}
