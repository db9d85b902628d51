package com.shoptalk.assistant.bundle;

import com.shoptalk.assistant.taxonomy.AttributeVocabulary;
import com.shoptalk.assistant.taxonomy.CategoryIntelligence;
import com.shoptalk.assistant.text.TextMatching;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recognises multi-item requests and turns them into a {@link BundleRequest}.
 *
 * Three shapes are understood, in this order: a named starter kit ("bird starter kit
 * under 200"), explicit quantities ("2 chairs and 3x tables"), and plain pairs
 * ("desk and chair under 500").
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BundleRequestParser {

    private static final List<Pattern> BUDGET_PATTERNS = List.of(
            Pattern.compile("\\bunder\\s+\\$?(\\d+(?:\\.\\d+)?)"),
            Pattern.compile("\\bbudget\\s+(?:of\\s+|is\\s+)?\\$?(\\d+(?:\\.\\d+)?)"),
            Pattern.compile("\\btotal\\s+(?:of\\s+)?\\$?(\\d+(?:\\.\\d+)?)"),
            Pattern.compile("\\$?(\\d+(?:\\.\\d+)?)\\s+budget\\b"),
            Pattern.compile("\\bwithin\\s+\\$?(\\d+(?:\\.\\d+)?)"));

    private static final Pattern ITEM_PATTERN = Pattern.compile(
            "\\b(\\d+)\\s*(?:x\\s*)?(chairs?|tables?|desks?|sofas?|couch(?:es)?|beds?|stools?|lockers?|cabinets?|shel(?:f|ves)|lamps?|bench(?:es)?)\\b");

    private static final Map<String, String> ITEM_ALIASES = Map.of(
            "couch", "sofa", "couches", "sofa", "shelves", "shelf", "benches", "bench");

    /** Items searched by their own name even when a room is mentioned */
    private static final Set<String> UNPREFIXED_ITEMS = Set.of("desk", "chair", "table", "bed");

    private final CategoryIntelligence categoryIntelligence;

    /**
     * Bundle request described by the text, or empty when it is not a multi-item request.
     */
    public Optional<BundleRequest> parse(String text) {
        String normalized = TextMatching.normalize(text);
        if (normalized.isEmpty()) {
            return Optional.empty();
        }
        BigDecimal budget = extractBudget(normalized).orElse(null);

        BundleRequest.BundleRequestBuilder request = BundleRequest.builder()
                .budget(budget)
                .color(AttributeVocabulary.findColor(normalized).orElse(null))
                .material(AttributeVocabulary.findMaterial(normalized).orElse(null));

        Optional<BundleTemplates.Template> template = BundleTemplates.match(normalized);
        List<ItemTemplate> items;
        if (template.isPresent()) {
            items = template.get().items();
            request.templateName(template.get().name());
        } else {
            items = explicitItems(normalized);
            if (items.isEmpty() && budget != null && TextMatching.containsPhrase(normalized, "and")) {
                items = pairedItems(normalized);
            }
            boolean multiItem = items.size() >= 2 || (items.size() == 1 && items.get(0).getQuantity() > 1);
            if (!multiItem) {
                return Optional.empty();
            }
        }

        for (ItemTemplate item : items) {
            request.itemTemplate(item);
            request.allowedCategories(item.getCategories());
        }
        BundleRequest result = request.build();
        log.info("Parsed bundle request: template={}, items={}, budget={}",
                result.getTemplateName(), result.getItemTemplates().size(), budget);
        return Optional.of(result);
    }

    public boolean isBundleRequest(String text) {
        return parse(text).isPresent();
    }

    // ==================== Helper Methods ====================

    static Optional<BigDecimal> extractBudget(String text) {
        for (Pattern pattern : BUDGET_PATTERNS) {
            Matcher matcher = pattern.matcher(text);
            if (matcher.find()) {
                return Optional.of(new BigDecimal(matcher.group(1)));
            }
        }
        return Optional.empty();
    }

    private List<ItemTemplate> explicitItems(String text) {
        Map<String, Integer> quantities = new LinkedHashMap<>();
        Matcher matcher = ITEM_PATTERN.matcher(text);
        while (matcher.find()) {
            String raw = matcher.group(2);
            String type = ITEM_ALIASES.getOrDefault(raw, raw.endsWith("s") ? raw.substring(0, raw.length() - 1) : raw);
            quantities.merge(type, Integer.parseInt(matcher.group(1)), Integer::sum);
        }
        List<ItemTemplate> items = new ArrayList<>();
        Optional<String> room = AttributeVocabulary.findRoom(text);
        quantities.forEach((type, quantity) -> items.add(itemFor(type, quantity, room)));
        return items;
    }

    /**
     * Product nouns joined by "and", in the order they are written.
     */
    private List<ItemTemplate> pairedItems(String text) {
        List<String> nouns = new ArrayList<>(AttributeVocabulary.PRODUCT_NOUNS);
        nouns.sort(Comparator.comparingInt(String::length).reversed());

        Map<Integer, String> found = new TreeMap<>();
        boolean[] taken = new boolean[text.length()];
        for (String noun : nouns) {
            Matcher matcher = Pattern.compile("(?<![a-z])" + Pattern.quote(noun) + "s?(?![a-z])").matcher(text);
            while (matcher.find()) {
                if (!isTaken(taken, matcher.start(), matcher.end())) {
                    for (int i = matcher.start(); i < matcher.end(); i++) {
                        taken[i] = true;
                    }
                    found.put(matcher.start(), noun);
                }
            }
        }
        Optional<String> room = AttributeVocabulary.findRoom(text);
        List<ItemTemplate> items = new ArrayList<>();
        List<String> seen = new ArrayList<>();
        for (String noun : found.values()) {
            if (!seen.contains(noun)) {
                seen.add(noun);
                items.add(itemFor(noun, 1, room));
            }
        }
        return items;
    }

    private ItemTemplate itemFor(String type, int quantity, Optional<String> room) {
        ItemTemplate.ItemTemplateBuilder item = ItemTemplate.builder()
                .itemType(type.replace(' ', '_'))
                .quantity(quantity)
                .required(true)
                .categories(categoryIntelligence.categoriesForItem(type));
        if (room.isPresent() && !UNPREFIXED_ITEMS.contains(type)) {
            item.searchTerm(room.get().replace('_', ' ') + " " + type);
        }
        item.searchTerm(type);
        return item.build();
    }

    private static boolean isTaken(boolean[] taken, int start, int end) {
        for (int i = start; i < end; i++) {
            if (taken[i]) {
                return true;
            }
        }
        return false;
    }
}
