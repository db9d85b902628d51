package com.shoptalk.catalog.index;

import com.shoptalk.catalog.model.Product;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable view of the catalog and its inverted index.
 * A snapshot is built once and never mutated; rebuilds publish a new instance.
 */
@Slf4j
public final class IndexSnapshot {

    private final long generation;
    private final Instant builtAt;
    private final List<Product> products;
    private final Map<String, Product> productsById;
    private final Map<String, Integer> ordinals;
    private final Map<String, List<Posting>> postings;

    private IndexSnapshot(long generation, Instant builtAt, List<Product> products,
                          Map<String, Product> productsById, Map<String, Integer> ordinals,
                          Map<String, List<Posting>> postings) {
        this.generation = generation;
        this.builtAt = builtAt;
        this.products = products;
        this.productsById = productsById;
        this.ordinals = ordinals;
        this.postings = postings;
    }

    /**
     * Build a snapshot from a full product list.
     * Products without an id are skipped; for duplicate ids the first occurrence wins.
     */
    public static IndexSnapshot build(long generation, List<Product> source) {
        List<Product> accepted = new ArrayList<>();
        Map<String, Product> byId = new LinkedHashMap<>();
        Map<String, Integer> ordinals = new HashMap<>();
        int skipped = 0;

        for (Product product : source) {
            if (product == null || product.getId() == null || product.getId().isBlank()) {
                skipped++;
                continue;
            }
            if (byId.containsKey(product.getId())) {
                log.warn("Duplicate product id {} ignored during indexing", product.getId());
                skipped++;
                continue;
            }
            ordinals.put(product.getId(), accepted.size());
            byId.put(product.getId(), product);
            accepted.add(product);
        }

        Map<String, List<Posting>> postings = new HashMap<>();
        for (int ordinal = 0; ordinal < accepted.size(); ordinal++) {
            Product product = accepted.get(ordinal);
            Map<String, int[]> counts = new LinkedHashMap<>();
            Map<String, Double> weighted = new HashMap<>();
            for (IndexField field : IndexField.values()) {
                for (String token : CatalogTokenizer.tokenize(field.textOf(product))) {
                    counts.computeIfAbsent(token, t -> new int[1])[0]++;
                    weighted.merge(token, field.getWeight(), Double::sum);
                }
            }
            for (Map.Entry<String, int[]> entry : counts.entrySet()) {
                String token = entry.getKey();
                postings.computeIfAbsent(token, t -> new ArrayList<>())
                        .add(new Posting(product.getId(), ordinal, entry.getValue()[0], weighted.get(token)));
            }
        }
        postings.replaceAll((token, list) -> Collections.unmodifiableList(list));

        if (skipped > 0) {
            log.warn("Index generation {} skipped {} invalid or duplicate products", generation, skipped);
        }

        return new IndexSnapshot(
                generation,
                Instant.now(),
                Collections.unmodifiableList(accepted),
                Collections.unmodifiableMap(byId),
                Collections.unmodifiableMap(ordinals),
                Collections.unmodifiableMap(postings));
    }

    public long getGeneration() {
        return generation;
    }

    public Instant getBuiltAt() {
        return builtAt;
    }

    /**
     * Products in catalog insertion order.
     */
    public List<Product> getProducts() {
        return products;
    }

    public int size() {
        return products.size();
    }

    public boolean isEmpty() {
        return products.isEmpty();
    }

    public Optional<Product> product(String id) {
        return Optional.ofNullable(productsById.get(id));
    }

    public int ordinalOf(String id) {
        return ordinals.getOrDefault(id, Integer.MAX_VALUE);
    }

    public List<Posting> postings(String token) {
        return postings.getOrDefault(token, List.of());
    }

    public int documentFrequency(String token) {
        return postings(token).size();
    }

    public int vocabularySize() {
        return postings.size();
    }
}
