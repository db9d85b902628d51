package com.shoptalk.catalog.service;

import com.shoptalk.catalog.config.CatalogConfig;
import com.shoptalk.catalog.dto.SearchFilters;
import com.shoptalk.catalog.index.CatalogTokenizer;
import com.shoptalk.catalog.index.IndexSnapshot;
import com.shoptalk.catalog.index.MatchMode;
import com.shoptalk.catalog.index.Posting;
import com.shoptalk.catalog.model.Product;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.BiPredicate;
import java.util.regex.Pattern;

/**
 * Ranks catalog products for a free-text query and applies hard and attribute filters.
 *
 * Relevance is TF-IDF over field-weighted term frequencies, scaled by how many of the
 * query tokens a product covers. Ties fall back to price (ascending) and then to catalog
 * insertion order, so identical calls on the same snapshot return identical lists.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProductSearcher {

    static final List<String> COLOR_KEYWORDS = List.of(
            "black", "white", "red", "green", "blue", "brown", "grey", "gray",
            "yellow", "orange", "pink", "purple", "beige", "natural", "walnut", "oak");

    static final List<String> MATERIAL_KEYWORDS = List.of(
            "wood", "metal", "leather", "fabric", "glass", "plastic", "steel",
            "rattan", "velvet", "bamboo", "mesh", "marble");

    private final CatalogIndex catalogIndex;
    private final CatalogConfig catalogConfig;

    private final Map<SearchKey, SearchOutcome> outcomeCache = new ConcurrentHashMap<>();
    private volatile long cachedGeneration = -1;

    /**
     * Search the current catalog snapshot.
     *
     * @param query free text; blank or stopword-only text browses by filters alone
     * @param filters hard and attribute filters, may be null
     * @param limit maximum results; non-positive means the configured default
     */
    public SearchOutcome search(String query, SearchFilters filters, int limit) {
        return search(query, filters, effectiveLimit(limit), true);
    }

    public SearchOutcome search(String query, SearchFilters filters) {
        return search(query, filters, 0);
    }

    /**
     * Every match in rank order, without the result limit. For callers that choose among
     * matches by something other than relevance, such as price.
     */
    public SearchOutcome searchAll(String query, SearchFilters filters) {
        return search(query, filters, Integer.MAX_VALUE, false);
    }

    /**
     * The product as the current snapshot has it, for fresh stock and price.
     */
    public Optional<Product> findById(String id) {
        if (id == null) {
            return Optional.empty();
        }
        return catalogIndex.snapshot().flatMap(snapshot -> snapshot.product(id));
    }

    private SearchOutcome search(String query, SearchFilters filters, int effectiveLimit, boolean cacheable) {
        IndexSnapshot snapshot = catalogIndex.snapshot().orElse(null);
        if (snapshot == null || snapshot.isEmpty()) {
            log.warn("Search requested before catalog is ready: query='{}'", query);
            return new SearchOutcome.CatalogNotReady();
        }

        SearchFilters effective = filters != null ? filters.toBuilder().build() : SearchFilters.none();
        if (!cacheable) {
            return execute(snapshot, query, effective, effectiveLimit);
        }
        SearchKey key = new SearchKey(snapshot.getGeneration(), normalize(query), effective, effectiveLimit);

        if (cachedGeneration != snapshot.getGeneration()) {
            outcomeCache.clear();
            cachedGeneration = snapshot.getGeneration();
        }
        SearchOutcome cached = outcomeCache.get(key);
        if (cached != null) {
            log.debug("Search cache hit for '{}'", query);
            return cached;
        }

        SearchOutcome outcome = execute(snapshot, query, effective, effectiveLimit);

        if (outcomeCache.size() >= catalogConfig.getSearch().getCacheSize()) {
            outcomeCache.clear();
        }
        outcomeCache.put(key, outcome);
        return outcome;
    }

    private SearchOutcome execute(IndexSnapshot snapshot, String query, SearchFilters filters, int limit) {
        List<String> queryTokens = CatalogTokenizer.tokenize(query);
        Set<String> distinctTokens = new LinkedHashSet<>(queryTokens);

        Map<String, Double> scores = new HashMap<>();
        List<Product> candidates = new ArrayList<>();
        if (distinctTokens.isEmpty()) {
            // Category browse: every product is a candidate with a neutral score
            candidates.addAll(snapshot.getProducts());
        } else {
            scores = score(snapshot, queryTokens, distinctTokens);
            for (String id : CatalogIndex.candidateIds(snapshot, distinctTokens, MatchMode.UNION)) {
                snapshot.product(id).ifPresent(candidates::add);
            }
        }

        List<Product> base = candidates.stream()
                .filter(p -> filters.isIncludeOutOfStock() || p.isInStock())
                .filter(p -> withinPrice(p, filters.getPriceMin(), filters.getPriceMax()))
                .filter(p -> matchesAnyCategory(p, filters.getCategories()))
                .filter(p -> !containsExcludedTerm(p, filters.getExcludedTerms()))
                .toList();

        List<Product> matched = base;
        if (!base.isEmpty() && hasText(filters.getColor())) {
            matched = matched.stream().filter(p -> matchesColor(p, filters.getColor())).toList();
            if (matched.isEmpty()) {
                List<String> available = availableValues(base, COLOR_KEYWORDS, ProductSearcher::matchesColor);
                log.info("Search: query='{}', no products in color '{}', available={}",
                        query, filters.getColor(), available);
                return new SearchOutcome.NoAttributeMatch("color", filters.getColor(), available);
            }
        }
        if (!matched.isEmpty() && hasText(filters.getMaterial())) {
            List<Product> beforeMaterial = matched;
            matched = matched.stream().filter(p -> matchesMaterial(p, filters.getMaterial())).toList();
            if (matched.isEmpty()) {
                List<String> available = availableValues(beforeMaterial, MATERIAL_KEYWORDS, ProductSearcher::matchesMaterial);
                log.info("Search: query='{}', no products in material '{}', available={}",
                        query, filters.getMaterial(), available);
                return new SearchOutcome.NoAttributeMatch("material", filters.getMaterial(), available);
            }
        }

        final Map<String, Double> finalScores = scores;
        Comparator<Product> ranking = Comparator
                .comparingDouble((Product p) -> finalScores.getOrDefault(p.getId(), 0.0)).reversed()
                .thenComparing(Product::priceOrZero)
                .thenComparingInt(p -> snapshot.ordinalOf(p.getId()));

        List<Product> results = matched.stream()
                .sorted(ranking)
                .limit(limit)
                .toList();

        log.info("Search: query='{}', candidates={}, afterFilters={}, returned={}",
                query, candidates.size(), matched.size(), results.size());
        return new SearchOutcome.Found(results);
    }

    // ==================== Scoring ====================

    private Map<String, Double> score(IndexSnapshot snapshot, List<String> queryTokens, Set<String> distinctTokens) {
        int documentCount = snapshot.size();
        Map<String, Double> scores = new HashMap<>();
        Map<String, Integer> covered = new HashMap<>();

        for (String token : distinctTokens) {
            List<Posting> postings = snapshot.postings(token);
            if (postings.isEmpty()) {
                continue;
            }
            double idf = Math.log(1.0 + (double) documentCount / postings.size());
            for (Posting posting : postings) {
                scores.merge(posting.productId(), posting.weightedFrequency() * idf, Double::sum);
                covered.merge(posting.productId(), 1, Integer::sum);
            }
        }

        double boost = catalogConfig.getSearch().getTitlePhraseBoost();
        scores.replaceAll((id, raw) -> {
            double coverage = (double) covered.getOrDefault(id, 0) / distinctTokens.size();
            double value = raw * coverage;
            Product product = snapshot.product(id).orElse(null);
            if (product != null && titleContainsPhrase(product, queryTokens)) {
                value *= boost;
            }
            return value;
        });
        return scores;
    }

    /**
     * Whether the title holds the query tokens in order, on token boundaries ("desk" is not inside "desktop").
     */
    static boolean titleContainsPhrase(Product product, List<String> queryTokens) {
        String title = " " + String.join(" ", CatalogTokenizer.tokenize(product.getTitle())) + " ";
        return title.contains(" " + String.join(" ", queryTokens) + " ");
    }

    // ==================== Filters ====================

    private static boolean withinPrice(Product product, BigDecimal min, BigDecimal max) {
        if (min == null && max == null) {
            return true;
        }
        BigDecimal price = product.getPrice();
        if (price == null) {
            return false;
        }
        return (min == null || price.compareTo(min) >= 0) && (max == null || price.compareTo(max) <= 0);
    }

    /**
     * A category filter matches when all of its tokens appear in the product's
     * category, subcategory or tags. Several filters combine as any-of.
     */
    static boolean matchesAnyCategory(Product product, Set<String> categories) {
        if (categories == null || categories.isEmpty()) {
            return true;
        }
        Set<String> productTerms = new LinkedHashSet<>();
        productTerms.addAll(CatalogTokenizer.tokenize(product.getCategory()));
        productTerms.addAll(CatalogTokenizer.tokenize(product.getSubcategory()));
        for (String tag : product.getTags()) {
            productTerms.addAll(CatalogTokenizer.tokenize(tag));
        }
        for (String category : categories) {
            Set<String> wanted = CatalogTokenizer.distinctTokens(category);
            if (!wanted.isEmpty() && productTerms.containsAll(wanted)) {
                return true;
            }
        }
        return false;
    }

    private static boolean containsExcludedTerm(Product product, Set<String> excluded) {
        if (excluded == null || excluded.isEmpty()) {
            return false;
        }
        String text = searchableText(product);
        for (String term : excluded) {
            if (hasText(term) && wordPrefix(term).matcher(text).find()) {
                return true;
            }
        }
        return false;
    }

    /**
     * Color lookup order: color tags, plain tags, title, then description.
     */
    static boolean matchesColor(Product product, String color) {
        for (String variant : colorVariants(color)) {
            if (product.colorTags().contains(variant)) {
                return true;
            }
            for (String tag : product.getTags()) {
                if (tag.equalsIgnoreCase(variant)) {
                    return true;
                }
            }
            Pattern word = wholeWord(variant);
            if (product.getTitle() != null && word.matcher(product.getTitle().toLowerCase(Locale.ROOT)).find()) {
                return true;
            }
            if (product.getDescription() != null
                    && word.matcher(product.getDescription().toLowerCase(Locale.ROOT)).find()) {
                return true;
            }
        }
        return false;
    }

    static boolean matchesMaterial(Product product, String material) {
        return wordPrefix(material).matcher(searchableText(product)).find();
    }

    private static List<String> availableValues(List<Product> products, List<String> vocabulary,
                                                BiPredicate<Product, String> matcher) {
        Set<String> values = new LinkedHashSet<>();
        for (Product product : products) {
            if (vocabulary == COLOR_KEYWORDS) {
                values.addAll(product.colorTags());
            }
            for (String value : vocabulary) {
                if (matcher.test(product, value)) {
                    values.add(value);
                }
            }
        }
        return new ArrayList<>(values);
    }

    private static List<String> colorVariants(String color) {
        String lower = color.trim().toLowerCase(Locale.ROOT);
        if (lower.equals("grey") || lower.equals("gray")) {
            return List.of("grey", "gray");
        }
        return List.of(lower);
    }

    private static String searchableText(Product product) {
        StringBuilder text = new StringBuilder();
        if (product.getTitle() != null) {
            text.append(product.getTitle()).append(' ');
        }
        text.append(String.join(" ", product.getTags())).append(' ');
        if (product.getDescription() != null) {
            text.append(product.getDescription());
        }
        return text.toString().toLowerCase(Locale.ROOT);
    }

    private static Pattern wholeWord(String value) {
        return Pattern.compile("\\b" + Pattern.quote(value.toLowerCase(Locale.ROOT)) + "\\b");
    }

    private static Pattern wordPrefix(String value) {
        return Pattern.compile("\\b" + Pattern.quote(value.trim().toLowerCase(Locale.ROOT)));
    }

    // ==================== Helper Methods ====================

    private int effectiveLimit(int limit) {
        CatalogConfig.Search search = catalogConfig.getSearch();
        int requested = limit > 0 ? limit : search.getDefaultLimit();
        return Math.min(requested, search.getMaxLimit());
    }

    private static String normalize(String query) {
        return query == null ? "" : query.trim().toLowerCase(Locale.ROOT);
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    private record SearchKey(long generation, String query, SearchFilters filters, int limit) {}
}
