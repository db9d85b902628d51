package com.shoptalk.assistant.service;

import com.shoptalk.assistant.bundle.BundleLine;
import com.shoptalk.assistant.bundle.BundlePlan;
import com.shoptalk.assistant.bundle.BundlePlanner;
import com.shoptalk.assistant.bundle.BundleRequest;
import com.shoptalk.assistant.bundle.BundleRequestParser;
import com.shoptalk.assistant.config.AssistantProperties;
import com.shoptalk.assistant.events.ConversationEvent;
import com.shoptalk.assistant.events.ConversationEventPublisher;
import com.shoptalk.assistant.exception.AssistantException;
import com.shoptalk.assistant.intent.ClarificationMerger;
import com.shoptalk.assistant.intent.IntentDetection;
import com.shoptalk.assistant.intent.IntentDetector;
import com.shoptalk.assistant.intent.IntentSignals;
import com.shoptalk.assistant.lookup.AvailabilityChecker;
import com.shoptalk.assistant.lookup.ProductAvailability;
import com.shoptalk.assistant.lookup.SimilarProductFinder;
import com.shoptalk.assistant.reference.ReferenceResolver;
import com.shoptalk.assistant.reference.ResolvedReferences;
import com.shoptalk.assistant.reply.ReplyComposer;
import com.shoptalk.assistant.reply.ReplyContext;
import com.shoptalk.assistant.reply.ReplyKind;
import com.shoptalk.assistant.text.TextMatching;
import com.shoptalk.assistant.validation.Contradiction;
import com.shoptalk.assistant.validation.FilterValidation;
import com.shoptalk.assistant.validation.FilterValidator;
import com.shoptalk.assistant.vague.VagueQueryInterpreter;
import com.shoptalk.assistant.vague.VagueQueryResult;
import com.shoptalk.catalog.dto.SearchFilters;
import com.shoptalk.catalog.model.Product;
import com.shoptalk.catalog.service.ProductSearcher;
import com.shoptalk.catalog.service.SearchOutcome;
import com.shoptalk.common.enums.MessageIntent;
import com.shoptalk.common.enums.MessageRole;
import com.shoptalk.common.enums.VagueCategory;
import com.shoptalk.session.model.PendingClarification;
import com.shoptalk.session.model.SessionState;
import com.shoptalk.session.model.TurnTicket;
import com.shoptalk.session.service.SessionStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Runs one conversation turn: resolve references, classify the message, act on it,
 * update the session and write the reply.
 *
 * Turns for different sessions run in parallel. Session writes carry the turn's arrival
 * sequence, so a slow earlier turn cannot overwrite what a later turn showed.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ConversationHandler {

    static final String FALLBACK_POLICY = "I don't have details on that policy right now. "
            + "Please contact our support team and they will be happy to help.";

    /** Filter keys the searcher has no field for; reported but not applied */
    private static final Set<String> HINT_KEYS = Set.of("sort_by", "size");

    /** Filter values that belong in the search text rather than a hard filter */
    private static final List<String> TEXT_KEYS = List.of("style", "room_type", "descriptor", "product_type");

    private final SessionStore sessionStore;
    private final ReferenceResolver referenceResolver;
    private final IntentDetector intentDetector;
    private final ClarificationMerger clarificationMerger;
    private final VagueQueryInterpreter vagueQueryInterpreter;
    private final FilterValidator filterValidator;
    private final ProductSearcher productSearcher;
    private final BundleRequestParser bundleRequestParser;
    private final BundlePlanner bundlePlanner;
    private final AvailabilityChecker availabilityChecker;
    private final SimilarProductFinder similarProductFinder;
    private final ReplyComposer replyComposer;
    private final ConversationEventPublisher eventPublisher;
    private final AssistantProperties assistantProperties;

    /**
     * Mutable record of what one turn decided. Never shared between turns.
     */
    private static final class Turn {
        final SessionState session;
        final long sequence;
        final String message;
        final ResolvedReferences references;
        final Map<String, Object> metadata = new LinkedHashMap<>();

        MessageIntent intent;
        ReplyKind kind;
        String outcome;
        String query;
        List<Product> products = List.of();
        BundlePlan bundlePlan;
        List<ProductAvailability> availability = List.of();
        Product similarTo;
        boolean clarificationNeeded;
        String clarificationMessage;
        SearchOutcome.NoAttributeMatch noAttributeMatch;
        String policyText;
        VagueQueryResult vague;
        List<String> droppedFilters = List.of();

        Turn(SessionState session, long sequence, String message, ResolvedReferences references) {
            this.session = session;
            this.sequence = sequence;
            this.message = message;
            this.references = references;
        }

        String sessionId() {
            return session.getSessionId();
        }

        /** Message text with resolved references in place */
        String text() {
            return references.rewrittenText();
        }
    }

    public ConversationResult handle(String sessionId, String userId, String message) {
        if (sessionId == null || sessionId.isBlank()) {
            throw AssistantException.invalidMessage("session id is required");
        }
        if (message == null || message.isBlank()) {
            throw AssistantException.invalidMessage("message must not be empty");
        }
        long startTime = System.currentTimeMillis();

        TurnTicket ticket = sessionStore.beginTurn(sessionId, userId);
        sessionStore.appendMessage(sessionId, MessageRole.USER, message, ticket.sequence());

        ResolvedReferences references = referenceResolver.resolveDetailed(ticket.session(), message);
        Turn turn = new Turn(ticket.session(), ticket.sequence(), message, references);

        IntentDetection detection = intentDetector.detect(signals(turn));
        turn.intent = detection.intent();
        turn.metadata.put("intent_rule", detection.rule());
        turn.metadata.put("intent_score", detection.score());

        switch (detection.intent()) {
            case CHIT_CHAT -> chitChat(turn, detection);
            case REFERENCE -> reference(turn);
            case COMPARISON -> comparison(turn);
            case CLARIFICATION_ANSWER -> clarificationAnswer(turn);
            case REFINEMENT -> refinement(turn);
            case NEW_SEARCH -> newSearch(turn);
        }

        long processingTime = System.currentTimeMillis() - startTime;
        finishMetadata(turn, processingTime);

        String reply = replyComposer.compose(replyContext(turn));
        sessionStore.appendMessage(sessionId, MessageRole.ASSISTANT, reply, turn.sequence);
        publishEvent(turn, userId, processingTime);

        log.info("Turn handled: sessionId={}, sequence={}, intent={}, outcome={}, products={}, clarification={}, timeMs={}",
                sessionId, turn.sequence, turn.intent.toJson(), turn.outcome, turn.products.size(),
                turn.clarificationNeeded, processingTime);

        return ConversationResult.builder()
                .sessionId(sessionId)
                .sequence(turn.sequence)
                .messageIntent(turn.intent)
                .message(reply)
                .products(turn.products)
                .bundlePlan(turn.bundlePlan)
                .clarificationNeeded(turn.clarificationNeeded)
                .clarificationMessage(turn.clarificationMessage)
                .metadata(turn.metadata)
                .build();
    }

    // ==================== Intent Handlers ====================

    private void chitChat(Turn turn, IntentDetection detection) {
        turn.kind = "help".equals(detection.rule()) ? ReplyKind.HELP : ReplyKind.GREETING;
        turn.outcome = "chit_chat";
    }

    /**
     * The referenced products, exactly. What was shown stays as it was unless the
     * shopper asks for similar products.
     */
    private void reference(Turn turn) {
        if (intentDetector.asksForSimilar(turn.text())) {
            similar(turn);
            return;
        }
        if (intentDetector.asksAvailability(turn.text())) {
            availability(turn);
            return;
        }
        turn.kind = ReplyKind.REFERENCE;
        turn.outcome = "reference";
        turn.products = turn.references.products();
    }

    private void availability(Turn turn) {
        List<ProductAvailability> statuses = availabilityChecker.check(turn.references.products());
        turn.kind = ReplyKind.AVAILABILITY;
        turn.outcome = "availability";
        turn.availability = statuses;
        turn.products = statuses.stream().map(ProductAvailability::product).toList();

        List<Map<String, Object>> stock = new ArrayList<>();
        for (ProductAvailability status : statuses) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("product_id", status.product().getId());
            entry.put("in_stock", status.inStock());
            entry.put("quantity_available", status.quantityAvailable());
            entry.put("low_stock", status.lowStock());
            entry.put("estimated_delivery", status.estimatedDelivery() != null ? status.estimatedDelivery() : "Out of stock");
            stock.add(entry);
        }
        turn.metadata.put("availability", stock);
    }

    /**
     * Products like the first referenced one. They replace what was shown, so "option 1"
     * afterwards means the first similar product.
     */
    private void similar(Turn turn) {
        List<Product> referenced = turn.references.products();
        Product source = referenced.get(0);
        turn.similarTo = source;
        turn.query = source.getTitle();
        turn.metadata.put("similar_to", source.getId());

        SearchOutcome outcome = similarProductFinder.find(source,
                referenced.stream().map(Product::getId).toList(),
                assistantProperties.getAvailability().getSimilarLimit());
        turn.outcome = outcome.tag();
        if (!(outcome instanceof SearchOutcome.Found found)) {
            turn.kind = ReplyKind.CATALOG_NOT_READY;
            return;
        }
        if (found.products().isEmpty()) {
            turn.kind = ReplyKind.NO_RESULTS;
            turn.outcome = "no_results";
            return;
        }
        turn.kind = ReplyKind.SIMILAR;
        turn.outcome = "similar";
        turn.products = found.products();
        if (!sessionStore.updateShownProducts(turn.sessionId(), found.products(), turn.sequence)) {
            log.info("Later turn already updated session {}, similar products of sequence {} not stored",
                    turn.sessionId(), turn.sequence);
        }
    }

    private void comparison(Turn turn) {
        turn.kind = ReplyKind.COMPARISON;
        turn.outcome = "comparison";
        turn.products = turn.references.hasProducts()
                ? turn.references.products()
                : List.copyOf(turn.session.getLastShownProducts());
    }

    private void clarificationAnswer(Turn turn) {
        PendingClarification pending = turn.session.getPendingClarification();
        if (pending == null) {
            newSearch(turn);
            return;
        }
        turn.metadata.put("clarification_type", pending.getVagueType());

        if (filterValidator.isBypassPhrase(turn.text())) {
            log.info("Clarification bypassed: sessionId={}, originalQuery='{}'", turn.sessionId(), pending.getOriginalQuery());
            Map<String, Object> filters = new LinkedHashMap<>(pending.getPartialEntities());
            filters.remove(ClarificationMerger.QUERY);
            sessionStore.clearPendingClarification(turn.sessionId(), turn.sequence);
            search(turn, pending.getOriginalQuery(), filters, Set.of(), false);
            return;
        }

        Map<String, Object> merged = clarificationMerger.mergeClarificationResponse(
                pending.getPartialEntities(), turn.text(), pending.getVagueType());
        String query = String.valueOf(merged.get(ClarificationMerger.QUERY));
        Map<String, Object> filters = new LinkedHashMap<>(merged);
        filters.remove(ClarificationMerger.QUERY);
        filters.remove(ClarificationMerger.EXCLUDED);
        Set<String> excluded = ClarificationMerger.excludedTerms(merged);
        turn.metadata.put("merged_query", query);

        FilterValidation validation = filterValidator.validateFilterCount(filters, query);
        recordDropped(turn, validation);
        int maxAttempts = assistantProperties.getClarification().getMaxAttempts();
        if (!validation.isValid() && pending.getClarificationCount() < maxAttempts) {
            askClarification(turn, pending.getVagueType(), merged, pending.getOriginalQuery(),
                    validation.getMessage(), pending.getClarificationCount() + 1);
            return;
        }

        sessionStore.clearPendingClarification(turn.sessionId(), turn.sequence);
        search(turn, query, validation.getAcceptedFilters(), excluded, false);
    }

    /**
     * Narrows the current search: the message is merged into the last query and the
     * accumulated filters. Negated attributes narrow by exclusion.
     */
    private void refinement(Turn turn) {
        Map<String, Object> base = new LinkedHashMap<>(turn.session.getAccumulatedFilters());
        base.put(ClarificationMerger.QUERY, turn.session.getLastQuery());
        Map<String, Object> merged = clarificationMerger.mergeClarificationResponse(base, turn.text(), "refinement");

        String query = String.valueOf(merged.remove(ClarificationMerger.QUERY));
        turn.metadata.put("refined_from", turn.session.getLastQuery());
        search(turn, query, merged, Set.of(), true);
    }

    private void newSearch(Turn turn) {
        String text = turn.text();

        Optional<BundleRequest> bundleRequest = bundleRequestParser.parse(text);
        if (bundleRequest.isPresent()) {
            bundle(turn, bundleRequest.get());
            return;
        }

        Map<String, Object> entities = intentDetector.extractEntities(text);
        Optional<Contradiction> contradiction = filterValidator.detectContradictions(entities, text);
        if (contradiction.isPresent()) {
            turn.metadata.put("contradiction", contradiction.get().kind());
            askClarification(turn, "contradiction", entities, text, contradiction.get().message(), 1);
            return;
        }

        VagueQueryResult vague = vagueQueryInterpreter.analyze(text);
        turn.vague = vague;
        turn.metadata.put("vague_category", vague.getCategory().toJson());
        turn.metadata.put("vague_confidence", vague.getConfidence());

        // No rule matched: the filter validator decides whether there is enough to go on.
        boolean unmatched = vague.getCategory() == VagueCategory.CLEAR;

        if (!unmatched && vague.isClarificationNeeded()) {
            Map<String, Object> partial = new LinkedHashMap<>(entities);
            if (vague.getSuggestedQuery() != null && !vague.getSuggestedQuery().equalsIgnoreCase(text)) {
                partial.put(ClarificationMerger.QUERY, vague.getSuggestedQuery());
            }
            askClarification(turn, vague.getCategory().toJson(), partial, text, vague.getClarificationMessage(), 1);
            return;
        }
        if (vague.isPolicyRequest()) {
            policy(turn, vague);
            return;
        }
        if (vague.isBundleRequest()) {
            log.info("Bundle suggested but not parseable, searching instead: '{}'", text);
        }

        Map<String, Object> candidates = new LinkedHashMap<>(entities);
        if (!unmatched) {
            vague.getSuggestedFilters().forEach(candidates::putIfAbsent);
        }
        FilterValidation validation = filterValidator.validateFilterCount(candidates, text);
        recordDropped(turn, validation);

        if (unmatched && !validation.isValid()) {
            String type = entities.containsKey(ClarificationMerger.CATEGORY) ? "category_only" : "missing_category";
            askClarification(turn, type, entities, text, validation.getMessage(), 1);
            return;
        }

        String query = unmatched ? text : vague.getSuggestedQuery();
        sessionStore.clearPendingClarification(turn.sessionId(), turn.sequence);
        search(turn, query, validation.getAcceptedFilters(), vague.getExcludedTerms(), false);
    }

    // ==================== Actions ====================

    /**
     * Runs the search and, when it finds products, records them with the query and filters.
     * A refinement merges into the accumulated filters; any other search replaces them.
     */
    private void search(Turn turn, String query, Map<String, Object> filters, Set<String> excludedTerms,
                        boolean refining) {
        Set<String> excluded = new LinkedHashSet<>(excludedTerms);
        excluded.addAll(ClarificationMerger.excludedTerms(filters));
        Map<String, Object> applied = new LinkedHashMap<>();
        Map<String, Object> hints = new LinkedHashMap<>();
        filters.forEach((key, value) -> {
            if (value == null || ClarificationMerger.EXCLUDED.equals(key)) {
                return;
            }
            if (HINT_KEYS.contains(key)) {
                hints.put(key, value);
            } else {
                applied.put(key, value);
            }
        });
        // A ruled-out value never applies as a positive filter
        for (String key : List.of("material", "color")) {
            Object value = applied.get(key);
            if (value != null && excluded.contains(value.toString().toLowerCase(Locale.ROOT))) {
                applied.remove(key);
            }
        }
        if (!hints.isEmpty()) {
            turn.metadata.put("search_hints", hints);
        }
        if (!excluded.isEmpty()) {
            turn.metadata.put("excluded_terms", List.copyOf(excluded));
        }

        String searchText = searchText(query, applied);
        SearchFilters searchFilters = searchFilters(applied, excluded);
        turn.query = searchText;
        turn.metadata.put("search_query", searchText);

        SearchOutcome outcome = productSearcher.search(searchText, searchFilters,
                assistantProperties.getSearch().getResultLimit());
        turn.outcome = outcome.tag();

        if (outcome instanceof SearchOutcome.Found found) {
            if (found.products().isEmpty()) {
                turn.kind = ReplyKind.NO_RESULTS;
                turn.outcome = "no_results";
                return;
            }
            turn.kind = ReplyKind.PRODUCTS;
            turn.products = found.products();
            if (sessionStore.updateShownProducts(turn.sessionId(), found.products(), turn.sequence)) {
                Map<String, Object> stored = new LinkedHashMap<>(applied);
                if (!excluded.isEmpty()) {
                    stored.put(ClarificationMerger.EXCLUDED, new ArrayList<>(excluded));
                }
                sessionStore.setLastQuery(turn.sessionId(), searchText, turn.sequence);
                if (refining) {
                    sessionStore.mergeFilters(turn.sessionId(), stored, turn.sequence);
                } else {
                    sessionStore.replaceFilters(turn.sessionId(), stored, turn.sequence);
                }
            } else {
                log.info("Later turn already updated session {}, results of sequence {} not stored",
                        turn.sessionId(), turn.sequence);
            }
        } else if (outcome instanceof SearchOutcome.NoAttributeMatch noMatch) {
            turn.kind = ReplyKind.NO_ATTRIBUTE_MATCH;
            turn.noAttributeMatch = noMatch;
            turn.metadata.put("available_values", noMatch.availableValues());
        } else {
            turn.kind = ReplyKind.CATALOG_NOT_READY;
        }
    }

    private void bundle(Turn turn, BundleRequest request) {
        BundlePlan plan = bundlePlanner.plan(request);
        turn.kind = ReplyKind.BUNDLE;
        turn.outcome = "bundle";
        turn.bundlePlan = plan;
        turn.products = plan.getItems().stream().map(BundleLine::getProduct).toList();
        turn.metadata.put("bundle_template", request.getTemplateName());
        turn.metadata.put("bundle_feasible", plan.isFeasible());
        turn.metadata.put("bundle_total", plan.getTotalCost());

        sessionStore.clearPendingClarification(turn.sessionId(), turn.sequence);
        if (!turn.products.isEmpty()) {
            sessionStore.updateShownProducts(turn.sessionId(), turn.products, turn.sequence);
        }
    }

    private void policy(Turn turn, VagueQueryResult vague) {
        Object type = vague.getToolArgs().get("policy_type");
        String policyType = type != null ? type.toString() : "returns";
        turn.kind = ReplyKind.POLICY;
        turn.outcome = "policy";
        turn.policyText = assistantProperties.getPolicies().getOrDefault(policyType, FALLBACK_POLICY);
        turn.metadata.put("policy_type", policyType);
    }

    private void askClarification(Turn turn, String type, Map<String, Object> partialEntities,
                                  String originalQuery, String question, int count) {
        PendingClarification pending = PendingClarification.builder()
                .vagueType(type)
                .partialEntities(new LinkedHashMap<>(partialEntities))
                .originalQuery(originalQuery)
                .clarificationCount(count)
                .createdAt(Instant.now())
                .build();
        sessionStore.setPendingClarification(turn.sessionId(), pending, turn.sequence);

        turn.kind = ReplyKind.CLARIFICATION;
        turn.outcome = "clarification";
        turn.clarificationNeeded = true;
        turn.clarificationMessage = question;
        turn.metadata.put("clarification_type", type);
    }

    // ==================== Helper Methods ====================

    private IntentSignals signals(Turn turn) {
        SessionState session = turn.session;
        return new IntentSignals(
                turn.text(),
                turn.references.hasProducts(),
                turn.references.products().size(),
                session.getPendingClarification() != null,
                session.hasShownProducts(),
                session.getLastQuery() != null && session.hasShownProducts());
    }

    /**
     * Query text with text-only filter values (style, room) appended when missing.
     */
    static String searchText(String query, Map<String, Object> filters) {
        StringBuilder text = new StringBuilder(query != null ? query.trim() : "");
        String normalized = TextMatching.normalize(text.toString());
        for (String key : TEXT_KEYS) {
            Object value = filters.get(key);
            if (value == null) {
                continue;
            }
            String word = value.toString().toLowerCase(Locale.ROOT);
            if (!normalized.contains(word) && !normalized.contains(word.replace('_', ' '))) {
                text.append(' ').append(word.replace('_', ' '));
            }
        }
        return text.toString().trim();
    }

    static SearchFilters searchFilters(Map<String, Object> filters, Set<String> excludedTerms) {
        SearchFilters.SearchFiltersBuilder builder = SearchFilters.builder()
                .priceMin(decimal(filters.get("price_min")))
                .priceMax(decimal(filters.get("price_max")))
                .color(string(filters.get("color")))
                .material(string(filters.get("material")))
                .excludedTerms(excludedTerms);
        Object categories = filters.get("categories");
        if (categories instanceof Collection<?> values) {
            for (Object value : values) {
                builder.category(String.valueOf(value));
            }
        }
        return builder.build();
    }

    private static BigDecimal decimal(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof BigDecimal decimal) {
            return decimal;
        }
        try {
            return new BigDecimal(value.toString().replace("$", "").trim());
        } catch (NumberFormatException e) {
            log.debug("Ignoring non-numeric price filter '{}'", value);
            return null;
        }
    }

    private static String string(Object value) {
        return value != null ? value.toString() : null;
    }

    private void recordDropped(Turn turn, FilterValidation validation) {
        if (validation.hasDroppedFilters()) {
            List<String> dropped = new ArrayList<>();
            validation.getDroppedFilters().forEach((key, reason) -> dropped.add(key + ": " + reason));
            turn.droppedFilters = dropped;
            turn.metadata.put("dropped_filters", validation.getDroppedFilters());
        }
    }

    private void finishMetadata(Turn turn, long processingTime) {
        turn.metadata.put("outcome", turn.outcome);
        if (!turn.references.unresolvedPhrases().isEmpty()) {
            turn.metadata.put("unresolved_references", turn.references.unresolvedPhrases());
        }
        turn.metadata.put("processing_time_ms", processingTime);
    }

    private ReplyContext replyContext(Turn turn) {
        ReplyContext.ReplyContextBuilder context = ReplyContext.builder()
                .kind(turn.kind)
                .userMessage(turn.message)
                .query(turn.query)
                .products(turn.products)
                .bundlePlan(turn.bundlePlan)
                .availability(turn.availability)
                .similarTo(turn.similarTo)
                .clarificationMessage(turn.clarificationMessage)
                .policyText(turn.policyText)
                .unresolvedReferences(turn.references.unresolvedPhrases());
        if (turn.noAttributeMatch != null) {
            context.attribute(turn.noAttributeMatch.attribute())
                    .requestedValue(turn.noAttributeMatch.requestedValue())
                    .availableValues(turn.noAttributeMatch.availableValues());
        }
        return context.build();
    }

    private void publishEvent(Turn turn, String userId, long processingTime) {
        ConversationEvent event = ConversationEvent.builder()
                .eventId(UUID.randomUUID().toString())
                .sessionId(turn.sessionId())
                .userId(userId)
                .sequence(turn.sequence)
                .intent(turn.intent.toJson())
                .outcome(turn.outcome)
                .query(turn.query)
                .vagueCategory(turn.vague != null ? turn.vague.getCategory().toJson() : null)
                .confidence(turn.vague != null ? turn.vague.getConfidence() : 0.0)
                .clarificationNeeded(turn.clarificationNeeded)
                .resultsCount(turn.products.size())
                .returnedProductIds(turn.products.stream().map(Product::getId).toList())
                .droppedFilters(turn.droppedFilters)
                .processingTimeMs(processingTime)
                .timestamp(Instant.now().toString())
                .build();
        try {
            eventPublisher.publish(event);
        } catch (RuntimeException e) {
            log.warn("Failed to publish conversation event for session {}: {}", turn.sessionId(), e.getMessage());
        }
    }
}
