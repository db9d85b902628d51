package com.shoptalk.catalog.service;

import com.shoptalk.catalog.index.IndexSnapshot;
import com.shoptalk.catalog.index.MatchMode;
import com.shoptalk.catalog.index.Posting;
import com.shoptalk.catalog.model.Product;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-memory inverted index over the product catalog.
 *
 * Readers never lock: they take the current {@link IndexSnapshot} and work against it.
 * Rebuilds are serialized among writers and publish a new snapshot atomically, so a
 * concurrent search sees either the old or the new catalog, never a mix.
 */
@Slf4j
@Service
public class CatalogIndex {

    private final AtomicReference<IndexSnapshot> current = new AtomicReference<>();
    private final ReentrantLock rebuildLock = new ReentrantLock();
    private long generation = 0;

    /**
     * Replace the whole catalog.
     *
     * @return the published snapshot
     */
    public IndexSnapshot rebuild(List<Product> products) {
        rebuildLock.lock();
        try {
            long start = System.currentTimeMillis();
            IndexSnapshot snapshot = IndexSnapshot.build(++generation, products != null ? products : List.of());
            current.set(snapshot);
            log.info("Catalog index rebuilt: generation={}, products={}, terms={}, durationMs={}",
                    snapshot.getGeneration(), snapshot.size(), snapshot.vocabularySize(),
                    System.currentTimeMillis() - start);
            return snapshot;
        } finally {
            rebuildLock.unlock();
        }
    }

    /**
     * Current snapshot, empty until the first rebuild.
     */
    public Optional<IndexSnapshot> snapshot() {
        return Optional.ofNullable(current.get());
    }

    /**
     * Whether a non-empty catalog has been published.
     */
    public boolean isReady() {
        IndexSnapshot snapshot = current.get();
        return snapshot != null && !snapshot.isEmpty();
    }

    /**
     * Candidate product ids for the given tokens, in catalog insertion order.
     */
    public Set<String> candidateIds(Collection<String> tokens, MatchMode mode) {
        IndexSnapshot snapshot = current.get();
        if (snapshot == null) {
            return Set.of();
        }
        return candidateIds(snapshot, tokens, mode);
    }

    static Set<String> candidateIds(IndexSnapshot snapshot, Collection<String> tokens, MatchMode mode) {
        if (tokens == null || tokens.isEmpty()) {
            return Set.of();
        }
        Set<String> distinct = new LinkedHashSet<>(tokens);
        Map<String, Integer> hits = new HashMap<>();
        Map<String, Integer> ordinals = new HashMap<>();
        for (String token : distinct) {
            for (Posting posting : snapshot.postings(token)) {
                hits.merge(posting.productId(), 1, Integer::sum);
                ordinals.putIfAbsent(posting.productId(), posting.ordinal());
            }
        }

        List<String> ids = new ArrayList<>();
        for (Map.Entry<String, Integer> entry : hits.entrySet()) {
            if (mode == MatchMode.UNION || entry.getValue() == distinct.size()) {
                ids.add(entry.getKey());
            }
        }
        ids.sort(Comparator.comparingInt(ordinals::get));
        return new LinkedHashSet<>(ids);
    }

    /**
     * Drop the published snapshot. Searches report the catalog as not ready afterwards.
     */
    public void shutdown() {
        IndexSnapshot previous = current.getAndSet(null);
        if (previous != null) {
            log.info("Catalog index released: generation={}", previous.getGeneration());
        }
    }
}
