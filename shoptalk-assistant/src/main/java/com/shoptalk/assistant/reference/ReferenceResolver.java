package com.shoptalk.assistant.reference;

import com.shoptalk.assistant.taxonomy.AttributeVocabulary;
import com.shoptalk.catalog.model.Product;
import com.shoptalk.session.model.SessionState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Rewrites positional references ("option 2", "the first one", "1 and 3") into
 * {@code [product:<id>]} tokens using the products last shown in the session.
 *
 * Positions are 1-based. Existing tokens are never rescanned, so resolving an already
 * resolved message returns it unchanged.
 */
@Slf4j
@Component
public class ReferenceResolver {

    public static final Pattern PRODUCT_TOKEN = Pattern.compile("\\[product:([^\\]]+)\\]");

    private static final Pattern NUMBERED = Pattern.compile(
            "\\b(?:options?|numbers?|items?|products?|no\\.?)\\s*(\\d+(?:\\s*(?:,|and|&)\\s*\\d+)*)\\b",
            Pattern.CASE_INSENSITIVE);

    private static final Map<String, Integer> ORDINALS = ordinals();

    private static final Pattern ORDINAL = Pattern.compile(
            "\\b(?:the\\s+)?(" + String.join("|", ORDINALS.keySet()) + ")\\s+(one|item|option|product|choice|"
                    + singleWordNouns() + ")s?\\b",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern BARE_LIST = Pattern.compile(
            "(?<![\\w$.])(\\d+(?:\\s*(?:,|and|&)\\s*\\d+)+)(?![\\w.])",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern NUMBER = Pattern.compile("\\d+");

    private static final int MAX_POSITION_DIGITS = 4;

    public String resolve(SessionState session, String text) {
        return resolveDetailed(session, text).rewrittenText();
    }

    public ResolvedReferences resolveDetailed(SessionState session, String text) {
        List<Product> shown = session != null && session.getLastShownProducts() != null
                ? session.getLastShownProducts()
                : List.of();
        if (text == null || text.isBlank()) {
            return new ResolvedReferences(text == null ? "" : text, List.of(), List.of());
        }

        List<String> unresolved = new ArrayList<>();
        String rewritten = text;
        rewritten = outsideTokens(rewritten, segment -> replaceNumbered(segment, shown, unresolved));
        rewritten = outsideTokens(rewritten, segment -> replaceOrdinals(segment, shown, unresolved));
        rewritten = outsideTokens(rewritten, segment -> replaceBareLists(segment, shown));

        List<Product> products = referencedProducts(rewritten, shown);
        if (!unresolved.isEmpty()) {
            log.info("Reference unresolved: phrases={}, shownCount={}", unresolved, shown.size());
        }
        if (!products.isEmpty()) {
            log.debug("Resolved references to products {}", products.stream().map(Product::getId).toList());
        }
        return new ResolvedReferences(rewritten, products, unresolved);
    }

    /**
     * Product ids named by tokens in the text, in order.
     */
    public static List<String> tokenIds(String text) {
        List<String> ids = new ArrayList<>();
        if (text == null) {
            return ids;
        }
        Matcher matcher = PRODUCT_TOKEN.matcher(text);
        while (matcher.find()) {
            ids.add(matcher.group(1));
        }
        return ids;
    }

    public static String token(Product product) {
        return "[product:" + product.getId() + "]";
    }

    // ==================== Rewriting Passes ====================

    private String replaceNumbered(String segment, List<Product> shown, List<String> unresolved) {
        return replace(NUMBERED.matcher(segment), match -> {
            List<Integer> positions = numbers(match.group(1));
            if (!allInRange(positions, shown.size())) {
                unresolved.add(match.group());
                return null;
            }
            return tokens(positions, shown);
        });
    }

    private String replaceOrdinals(String segment, List<Product> shown, List<String> unresolved) {
        return replace(ORDINAL.matcher(segment), match -> {
            String ordinal = match.group(1).toLowerCase(Locale.ROOT);
            int position = ordinal.equals("last") ? shown.size() : ORDINALS.get(ordinal);
            if (position < 1 || position > shown.size()) {
                unresolved.add(match.group());
                return null;
            }
            return token(shown.get(position - 1));
        });
    }

    private String replaceBareLists(String segment, List<Product> shown) {
        return replace(BARE_LIST.matcher(segment), match -> {
            List<Integer> positions = numbers(match.group(1));
            return allInRange(positions, shown.size()) ? tokens(positions, shown) : null;
        });
    }

    // ==================== Helper Methods ====================

    /**
     * Applies a rewrite to the text between existing product tokens only.
     */
    private static String outsideTokens(String text, Function<String, String> rewrite) {
        StringBuilder result = new StringBuilder();
        Matcher token = PRODUCT_TOKEN.matcher(text);
        int last = 0;
        while (token.find()) {
            result.append(rewrite.apply(text.substring(last, token.start())));
            result.append(token.group());
            last = token.end();
        }
        result.append(rewrite.apply(text.substring(last)));
        return result.toString();
    }

    /**
     * Replaces each match with the function's result; a null result keeps the match as written.
     */
    private static String replace(Matcher matcher, Function<Matcher, String> replacement) {
        StringBuilder result = new StringBuilder();
        while (matcher.find()) {
            String value = replacement.apply(matcher);
            matcher.appendReplacement(result, Matcher.quoteReplacement(value != null ? value : matcher.group()));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    /**
     * Positions in the text; digit runs too long to be a position come back as -1 (out of range).
     */
    private static List<Integer> numbers(String text) {
        List<Integer> numbers = new ArrayList<>();
        Matcher matcher = NUMBER.matcher(text);
        while (matcher.find()) {
            String digits = matcher.group();
            numbers.add(digits.length() > MAX_POSITION_DIGITS ? -1 : Integer.parseInt(digits));
        }
        return numbers;
    }

    private static boolean allInRange(List<Integer> positions, int shownCount) {
        return !positions.isEmpty() && positions.stream().allMatch(p -> p >= 1 && p <= shownCount);
    }

    private static String tokens(List<Integer> positions, List<Product> shown) {
        return positions.stream()
                .map(p -> token(shown.get(p - 1)))
                .collect(Collectors.joining(" and "));
    }

    private static List<Product> referencedProducts(String text, List<Product> shown) {
        Map<String, Product> byId = new LinkedHashMap<>();
        for (Product product : shown) {
            byId.putIfAbsent(product.getId(), product);
        }
        Map<String, Product> referenced = new LinkedHashMap<>();
        for (String id : tokenIds(text)) {
            Product product = byId.get(id);
            if (product != null) {
                referenced.putIfAbsent(id, product);
            }
        }
        return new ArrayList<>(referenced.values());
    }

    private static String singleWordNouns() {
        return AttributeVocabulary.PRODUCT_NOUNS.stream()
                .filter(noun -> !noun.contains(" "))
                .collect(Collectors.joining("|"));
    }

    private static Map<String, Integer> ordinals() {
        Map<String, Integer> map = new LinkedHashMap<>();
        map.put("first", 1);
        map.put("second", 2);
        map.put("third", 3);
        map.put("fourth", 4);
        map.put("fifth", 5);
        map.put("sixth", 6);
        map.put("seventh", 7);
        map.put("eighth", 8);
        map.put("ninth", 9);
        map.put("tenth", 10);
        map.put("1st", 1);
        map.put("2nd", 2);
        map.put("3rd", 3);
        map.put("4th", 4);
        map.put("5th", 5);
        map.put("last", 0);
        return map;
    }
}
