package com.shoptalk.assistant.bundle;

import com.shoptalk.assistant.config.AssistantProperties;
import com.shoptalk.catalog.dto.SearchFilters;
import com.shoptalk.catalog.index.CatalogTokenizer;
import com.shoptalk.catalog.model.Product;
import com.shoptalk.catalog.service.ProductSearcher;
import com.shoptalk.catalog.service.SearchOutcome;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Selects products for a multi-item request under a total budget.
 *
 * Candidate searches for all item types run concurrently, but selection walks the
 * templates in declared order (required first), so the same catalog snapshot and
 * request always give the same plan.
 */
@Slf4j
@Service
public class BundlePlanner {

    private final ProductSearcher productSearcher;
    private final AssistantProperties assistantProperties;
    private final Executor searchExecutor;

    public BundlePlanner(ProductSearcher productSearcher,
                         AssistantProperties assistantProperties,
                         @Qualifier("bundleSearchExecutor") Executor searchExecutor) {
        this.productSearcher = productSearcher;
        this.assistantProperties = assistantProperties;
        this.searchExecutor = searchExecutor;
    }

    /**
     * Candidates for one item type, cheapest first; equal prices keep search rank order.
     */
    private record Candidates(ItemTemplate template, List<Product> products, boolean usedFallback) {

        List<Product> available(Set<String> picked) {
            return products.stream().filter(p -> !picked.contains(p.getId())).toList();
        }
    }

    public BundlePlan plan(BundleRequest request) {
        long startTime = System.currentTimeMillis();
        BigDecimal budget = request.getBudget();
        BigDecimal unitCap = unitCap(request);

        List<ItemTemplate> ordered = new ArrayList<>();
        request.getItemTemplates().stream().filter(ItemTemplate::isRequired).forEach(ordered::add);
        request.getItemTemplates().stream().filter(t -> !t.isRequired()).forEach(ordered::add);

        // Phase 1: candidate searches, joined in declaration order
        List<CompletableFuture<Candidates>> futures = ordered.stream()
                .map(template -> CompletableFuture.supplyAsync(
                        () -> findCandidates(template, request, unitCap), searchExecutor))
                .toList();
        List<Candidates> candidates = futures.stream().map(CompletableFuture::join).toList();

        BundlePlan.BundlePlanBuilder plan = BundlePlan.builder()
                .budget(budget)
                .templateName(request.getTemplateName());
        Set<String> picked = new HashSet<>();
        BigDecimal total = BigDecimal.ZERO;
        boolean usedFallback = false;

        // Phase 2: required items, cheapest candidate each
        for (Candidates itemCandidates : candidates) {
            ItemTemplate template = itemCandidates.template();
            if (!template.isRequired()) {
                continue;
            }
            List<Product> available = itemCandidates.available(picked);
            if (available.isEmpty()) {
                log.info("Bundle item unmet: itemType={}", template.getItemType());
                plan.unmetItemType(template.getItemType());
                continue;
            }
            Product choice = cheapest(available);
            BundleLine line = line(template, choice, template.getQuantity());
            if (budget != null && total.add(line.getLineTotal()).compareTo(budget) > 0) {
                log.warn("Required item exceeds remaining budget: itemType={}, lineTotal={}, remaining={}",
                        template.getItemType(), line.getLineTotal(), budget.subtract(total));
            }
            plan.item(line);
            picked.add(choice.getId());
            total = total.add(line.getLineTotal());
            usedFallback |= itemCandidates.usedFallback();
        }

        // Phase 3: optional items, cheapest first, quantity trimmed to what still fits
        List<Candidates> optional = new ArrayList<>(candidates.stream()
                .filter(c -> !c.template().isRequired())
                .toList());
        Set<String> pickedBeforeOptional = new HashSet<>(picked);
        optional.sort(Comparator.comparing(c -> cheapestPrice(c.available(pickedBeforeOptional))));

        for (Candidates itemCandidates : optional) {
            ItemTemplate template = itemCandidates.template();
            List<Product> available = itemCandidates.available(picked);
            if (available.isEmpty()) {
                plan.skippedOptionalItemType(template.getItemType());
                continue;
            }
            Product choice = cheapest(available);
            int quantity = affordableQuantity(template.getQuantity(), choice.priceOrZero(), budget, total);
            if (quantity < 1) {
                log.debug("Optional item does not fit budget: itemType={}", template.getItemType());
                plan.skippedOptionalItemType(template.getItemType());
                continue;
            }
            BundleLine line = line(template, choice, quantity);
            plan.item(line);
            picked.add(choice.getId());
            total = total.add(line.getLineTotal());
            usedFallback |= itemCandidates.usedFallback();
        }

        boolean feasible = budget == null || total.compareTo(budget) <= 0;
        BundlePlan result = plan
                .totalCost(total)
                .feasible(feasible)
                .budgetShortfall(feasible ? BigDecimal.ZERO : total.subtract(budget))
                .remainingBudget(budget == null ? null : budget.subtract(total).max(BigDecimal.ZERO))
                .usedFallbackSearch(usedFallback)
                .build();

        log.info("Bundle planned: template={}, items={}, total={}, budget={}, feasible={}, unmet={}, skipped={}, timeMs={}",
                request.getTemplateName(), result.getItems().size(), total, budget, feasible,
                result.getUnmetItemTypes(), result.getSkippedOptionalItemTypes(),
                System.currentTimeMillis() - startTime);
        return result;
    }

    // ==================== Candidate Search ====================

    private Candidates findCandidates(ItemTemplate template, BundleRequest request, BigDecimal unitCap) {
        if (unitCap != null) {
            List<Product> capped = searchTerms(template, request, unitCap, true);
            if (!capped.isEmpty()) {
                return new Candidates(template, capped, false);
            }
        }
        List<Product> uncapped = searchTerms(template, request, null, true);
        if (!uncapped.isEmpty()) {
            if (unitCap != null) {
                log.debug("Uncapped fallback search used for itemType={}", template.getItemType());
            }
            return new Candidates(template, uncapped, unitCap != null);
        }
        if (request.getColor() != null || request.getMaterial() != null) {
            List<Product> relaxed = searchTerms(template, request, null, false);
            if (!relaxed.isEmpty()) {
                log.debug("Attribute-free fallback search used for itemType={}", template.getItemType());
                return new Candidates(template, relaxed, true);
            }
        }
        return new Candidates(template, List.of(), false);
    }

    private List<Product> searchTerms(ItemTemplate template, BundleRequest request, BigDecimal priceMax,
                                      boolean withAttributes) {
        SearchFilters.SearchFiltersBuilder filters = SearchFilters.builder()
                .categories(template.getCategories().isEmpty() ? request.getAllowedCategories() : template.getCategories())
                .priceMax(priceMax);
        if (withAttributes) {
            filters.color(request.getColor()).material(request.getMaterial());
        }
        SearchFilters built = filters.build();
        int limit = assistantProperties.getBundle().getSearchLimit();

        List<String> terms = template.getSearchTerms().isEmpty()
                ? List.of(template.getItemType().replace('_', ' '))
                : template.getSearchTerms();
        for (String term : terms) {
            // All matches, so the cheapest is found however it ranks
            SearchOutcome outcome = productSearcher.searchAll(term, built);
            List<Product> inStock = outcome.products().stream().filter(Product::isInStock).toList();
            if (!inStock.isEmpty()) {
                // Union matching admits neighbours ("bird toy" for "bird perch"); keep full matches when there are any
                List<Product> covering = inStock.stream().filter(p -> coversTerm(p, term)).toList();
                List<Product> chosen = (covering.isEmpty() ? inStock : covering).stream()
                        .sorted(Comparator.comparing(Product::priceOrZero))
                        .limit(limit)
                        .toList();
                log.debug("Bundle candidates: itemType={}, term='{}', matches={}, fullMatches={}, kept={}",
                        template.getItemType(), term, inStock.size(), covering.size(), chosen.size());
                return chosen;
            }
        }
        return List.of();
    }

    // ==================== Helper Methods ====================

    static boolean coversTerm(Product product, String term) {
        Set<String> wanted = CatalogTokenizer.distinctTokens(term);
        Set<String> have = new HashSet<>(CatalogTokenizer.tokenize(product.getTitle()));
        have.addAll(CatalogTokenizer.tokenize(product.getSubcategory()));
        for (String tag : product.getTags()) {
            have.addAll(CatalogTokenizer.tokenize(tag));
        }
        return !wanted.isEmpty() && have.containsAll(wanted);
    }

    /**
     * Lowest price; ties go to the earlier candidate.
     */
    private static Product cheapest(List<Product> ranked) {
        Product best = null;
        for (Product product : ranked) {
            if (best == null) {
                best = product;
                continue;
            }
            int byPrice = product.priceOrZero().compareTo(best.priceOrZero());
            if (byPrice < 0) {
                best = product;
            }
        }
        return best;
    }

    private static BigDecimal cheapestPrice(List<Product> products) {
        return products.stream()
                .map(Product::priceOrZero)
                .min(Comparator.naturalOrder())
                .orElse(BigDecimal.valueOf(Long.MAX_VALUE));
    }

    private static BigDecimal unitCap(BundleRequest request) {
        int totalQuantity = request.totalQuantity();
        if (request.getBudget() == null || totalQuantity <= 0) {
            return null;
        }
        return request.getBudget().divide(BigDecimal.valueOf(totalQuantity), 2, RoundingMode.DOWN);
    }

    private static int affordableQuantity(int wanted, BigDecimal unitPrice, BigDecimal budget, BigDecimal spent) {
        if (budget == null || unitPrice.signum() == 0) {
            return wanted;
        }
        BigDecimal remaining = budget.subtract(spent);
        if (remaining.signum() <= 0) {
            return 0;
        }
        int affordable = remaining.divide(unitPrice, 0, RoundingMode.DOWN).intValue();
        return Math.min(wanted, affordable);
    }

    private static BundleLine line(ItemTemplate template, Product product, int quantity) {
        BigDecimal unitPrice = product.priceOrZero();
        return BundleLine.builder()
                .itemType(template.getItemType())
                .product(product)
                .unitPrice(unitPrice)
                .quantity(quantity)
                .lineTotal(unitPrice.multiply(BigDecimal.valueOf(quantity)))
                .required(template.isRequired())
                .build();
    }
}
