package com.shoptalk.catalog.controller;

import com.shoptalk.catalog.dto.ProductDTO;
import com.shoptalk.catalog.dto.SearchFilters;
import com.shoptalk.catalog.index.IndexSnapshot;
import com.shoptalk.catalog.service.CatalogIndex;
import com.shoptalk.catalog.service.CatalogSyncService;
import com.shoptalk.catalog.service.ProductSearcher;
import com.shoptalk.catalog.service.SearchOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.Map;

/**
 * Catalog maintenance and debug search endpoints.
 */
@RestController
@RequestMapping("/api/catalog")
@RequiredArgsConstructor
@Slf4j
public class CatalogController {

    private final CatalogSyncService catalogSyncService;
    private final CatalogIndex catalogIndex;
    private final ProductSearcher productSearcher;

    /**
     * Current index status.
     */
    @GetMapping("/status")
    public ResponseEntity<Map<String, Object>> status() {
        Map<String, Object> status = new HashMap<>();
        status.put("ready", catalogIndex.isReady());
        status.put("syncInProgress", catalogSyncService.isSyncInProgress());
        catalogIndex.snapshot().ifPresent(snapshot -> {
            status.put("generation", snapshot.getGeneration());
            status.put("products", snapshot.size());
            status.put("terms", snapshot.vocabularySize());
            status.put("builtAt", snapshot.getBuiltAt().toString());
        });
        return ResponseEntity.ok(status);
    }

    /**
     * Re-sync the catalog from its source.
     * Source failures surface as 503 through the catalog exception handler.
     */
    @PostMapping("/rebuild")
    public ResponseEntity<Map<String, Object>> rebuild() {
        log.info("Catalog rebuild requested");
        IndexSnapshot snapshot = catalogSyncService.rebuild();

        Map<String, Object> response = new HashMap<>();
        response.put("status", "completed");
        response.put("generation", snapshot.getGeneration());
        response.put("products", snapshot.size());
        return ResponseEntity.ok(response);
    }

    /**
     * Direct catalog search, bypassing conversation handling.
     */
    @GetMapping("/search")
    public ResponseEntity<Map<String, Object>> search(
            @RequestParam(value = "q", required = false, defaultValue = "") String query,
            @RequestParam(value = "category", required = false) String category,
            @RequestParam(value = "minPrice", required = false) BigDecimal minPrice,
            @RequestParam(value = "maxPrice", required = false) BigDecimal maxPrice,
            @RequestParam(value = "color", required = false) String color,
            @RequestParam(value = "material", required = false) String material,
            @RequestParam(value = "limit", required = false, defaultValue = "0") int limit) {

        SearchFilters.SearchFiltersBuilder filters = SearchFilters.builder()
                .priceMin(minPrice)
                .priceMax(maxPrice)
                .color(color)
                .material(material);
        if (category != null && !category.isBlank()) {
            filters.category(category);
        }

        SearchOutcome outcome = productSearcher.search(query, filters.build(), limit);

        Map<String, Object> response = new HashMap<>();
        response.put("outcome", outcome.tag());
        response.put("products", outcome.products().stream().map(ProductDTO::fromEntity).toList());
        if (outcome instanceof SearchOutcome.NoAttributeMatch noMatch) {
            response.put("attribute", noMatch.attribute());
            response.put("availableValues", noMatch.availableValues());
        }
        return ResponseEntity.ok(response);
    }
}
