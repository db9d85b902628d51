package com.shoptalk.catalog.index;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Tokenizer shared by indexing and querying so both sides agree on terms.
 * Lowercases, splits on non-alphanumerics, drops stopwords and folds plurals.
 */
public final class CatalogTokenizer {

    private CatalogTokenizer() {}

    private static final Pattern SPLIT = Pattern.compile("[^a-z0-9]+");

    private static final Set<String> STOPWORDS = Set.of(
            "a", "an", "the", "and", "or", "for", "of", "in", "on", "with", "to", "from",
            "by", "at", "is", "are", "be", "me", "my", "i", "it", "this", "that", "some",
            "any", "show", "find", "want", "need", "looking", "get", "please", "can", "you",
            "do", "have", "under", "over", "below", "above", "than", "less", "up");

    private static final Map<String, String> IRREGULAR = Map.of(
            "shelves", "shelf",
            "knives", "knife",
            "mice", "mouse",
            "geese", "goose");

    /**
     * Tokens in text order, duplicates kept (used for term frequencies).
     */
    public static List<String> tokenize(String text) {
        List<String> tokens = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return tokens;
        }
        for (String raw : SPLIT.split(text.toLowerCase(Locale.ROOT))) {
            if (raw.isEmpty() || STOPWORDS.contains(raw)) {
                continue;
            }
            tokens.add(fold(raw));
        }
        return tokens;
    }

    public static Set<String> distinctTokens(String text) {
        return new LinkedHashSet<>(tokenize(text));
    }

    /**
     * Folds simple English plurals so "chairs" and "chair" share a term.
     */
    public static String fold(String token) {
        String irregular = IRREGULAR.get(token);
        if (irregular != null) {
            return irregular;
        }
        int len = token.length();
        if (len > 4 && token.endsWith("ies")) {
            return token.substring(0, len - 3) + "y";
        }
        if (len > 4 && (token.endsWith("ches") || token.endsWith("shes") || token.endsWith("xes"))) {
            return token.substring(0, len - 2);
        }
        if (len > 3 && token.endsWith("s")
                && !token.endsWith("ss") && !token.endsWith("us") && !token.endsWith("is")) {
            return token.substring(0, len - 1);
        }
        return token;
    }
}
