package com.shoptalk.assistant.text;

import java.util.Collection;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Whole-word phrase matching used by the rule tables.
 * A phrase matches with an optional plural suffix, so "chair" also matches "chairs".
 */
public final class TextMatching {

    private TextMatching() {}

    private static final Map<String, Pattern> PATTERNS = new ConcurrentHashMap<>();

    public static String normalize(String text) {
        return text == null ? "" : text.toLowerCase(Locale.ROOT).trim().replaceAll("\\s+", " ");
    }

    public static boolean containsPhrase(String text, String phrase) {
        return indexOfPhrase(text, phrase) >= 0;
    }

    /**
     * Position of the phrase in the text, or -1.
     */
    public static int indexOfPhrase(String text, String phrase) {
        if (text == null || phrase == null || phrase.isBlank()) {
            return -1;
        }
        var matcher = pattern(phrase).matcher(normalize(text));
        return matcher.find() ? matcher.start() : -1;
    }

    /**
     * Longest phrase present in the text; ties go to the earlier entry of the collection.
     */
    public static Optional<String> longestPhrase(String text, Collection<String> phrases) {
        String best = null;
        for (String phrase : phrases) {
            if (containsPhrase(text, phrase) && (best == null || phrase.length() > best.length())) {
                best = phrase;
            }
        }
        return Optional.ofNullable(best);
    }

    public static int wordCount(String text) {
        String normalized = normalize(text);
        return normalized.isEmpty() ? 0 : normalized.split(" ").length;
    }

    private static Pattern pattern(String phrase) {
        return PATTERNS.computeIfAbsent(normalize(phrase), p ->
                Pattern.compile("(?<![a-z0-9])" + Pattern.quote(p) + "(?:s|es)?(?![a-z0-9])"));
    }
}
