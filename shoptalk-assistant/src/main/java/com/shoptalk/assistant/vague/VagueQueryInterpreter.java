package com.shoptalk.assistant.vague;

import com.shoptalk.assistant.config.AssistantProperties;
import com.shoptalk.assistant.taxonomy.AttributeVocabulary;
import com.shoptalk.assistant.taxonomy.CategoryIntelligence;
import com.shoptalk.assistant.taxonomy.CategoryIntelligence.PhraseTranslation;
import com.shoptalk.assistant.text.TextMatching;
import com.shoptalk.common.enums.SuggestedTool;
import com.shoptalk.common.enums.VagueCategory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.MatchResult;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns indirect requests ("my back is killing me", "something boujee", "desks that
 * aren't wood") into a concrete search, a tool call, or a clarification question.
 *
 * Every rule in {@link VagueRuleTable} is scored against the message in one pass:
 * {@code min(0.5 + matchLength / messageLength, 0.95)}, plus a grounding bonus when the
 * message also names a concrete product. The best score wins, earlier rules win ties,
 * and a winner below the confidence threshold produces a question instead of a guess.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class VagueQueryInterpreter {

    static final double MAX_RULE_CONFIDENCE = 0.95;
    static final double PHRASE_CONFIDENCE = 0.85;
    static final double UNKNOWN_CONFIDENCE = 0.3;

    static final String GENERIC_CLARIFICATION =
            "I'd like to help you find what you're looking for. Could you tell me more about the type of "
                    + "product you need? For example, are you after seating, storage, a desk, or something else?";

    private static final Pattern NUMBER = Pattern.compile("\\d+");

    private static final int MAX_SEAT_DIGITS = 3;

    private final CategoryIntelligence categoryIntelligence;
    private final AssistantProperties assistantProperties;

    /**
     * A scored rule match. {@code rule} is null for a phrase translation.
     */
    private record Candidate(VagueRule rule, PhraseTranslation phrase, MatchResult match, double score) {}

    public VagueQueryResult analyze(String text) {
        String normalized = TextMatching.normalize(text);
        Optional<String> productNoun = AttributeVocabulary.findProductNoun(normalized);
        Set<String> negated = negatedTerms(normalized);

        Candidate best = bestCandidate(normalized, productNoun.isPresent());

        if (best == null) {
            return noRuleMatched(text, productNoun.isPresent(), negated);
        }

        double threshold = assistantProperties.getVague().getConfidenceThreshold();
        VagueQueryResult result;
        if (best.score() < threshold) {
            result = belowThreshold(text, best, negated);
        } else if (best.phrase() != null) {
            result = fromPhrase(text, best, negated);
        } else {
            result = fromRule(text, normalized, best, productNoun.orElse(null), negated);
        }

        log.info("Vague analysis: category={}, confidence={}, clarification={}, query='{}'",
                result.getCategory(), String.format(Locale.ROOT, "%.2f", result.getConfidence()),
                result.isClarificationNeeded(), result.getSuggestedQuery());
        return result;
    }

    // ==================== Scoring ====================

    private Candidate bestCandidate(String normalized, boolean grounded) {
        if (normalized.isEmpty()) {
            return null;
        }
        Candidate best = null;

        // Everyday phrases map straight onto catalog categories, but a named product takes precedence.
        if (!grounded) {
            Optional<PhraseTranslation> phrase = categoryIntelligence.translatePhrase(normalized);
            if (phrase.isPresent()) {
                best = new Candidate(null, phrase.get(), null, PHRASE_CONFIDENCE);
            }
        }

        double bonus = grounded ? assistantProperties.getVague().getGroundingBonus() : 0.0;
        for (VagueRule rule : VagueRuleTable.RULES) {
            Matcher matcher = rule.getPattern().matcher(normalized);
            if (!matcher.find()) {
                continue;
            }
            double coverage = (double) (matcher.end() - matcher.start()) / normalized.length();
            double score = Math.min(Math.min(0.5 + coverage, MAX_RULE_CONFIDENCE) + bonus, MAX_RULE_CONFIDENCE);
            log.debug("Rule matched: category={}, intent='{}', score={}", rule.getCategory(), rule.getIntent(), score);
            if (best == null || score > best.score()) {
                best = new Candidate(rule, null, matcher.toMatchResult(), score);
            }
        }
        return best;
    }

    // ==================== Result Builders ====================

    private VagueQueryResult noRuleMatched(String text, boolean grounded, Set<String> negated) {
        if (grounded) {
            return VagueQueryResult.builder()
                    .vague(false)
                    .category(VagueCategory.CLEAR)
                    .originalQuery(text)
                    .interpretedIntent("Clear product search")
                    .suggestedQuery(text)
                    .suggestedTool(SuggestedTool.SEARCH_PRODUCTS)
                    .toolArg("query", text)
                    .confidence(1.0)
                    .excludedTerms(negated)
                    .build();
        }
        return VagueQueryResult.builder()
                .vague(true)
                .category(VagueCategory.CLEAR)
                .originalQuery(text)
                .interpretedIntent("Unable to determine intent")
                .suggestedQuery(text)
                .clarificationNeeded(true)
                .clarificationMessage(GENERIC_CLARIFICATION)
                .confidence(UNKNOWN_CONFIDENCE)
                .excludedTerms(negated)
                .build();
    }

    private VagueQueryResult belowThreshold(String text, Candidate best, Set<String> negated) {
        VagueCategory category = best.rule() != null ? best.rule().getCategory() : VagueCategory.LIFESTYLE_CONTEXT;
        String need = best.rule() != null ? best.rule().getIntent() : "products for " + best.phrase().phrase();
        return VagueQueryResult.builder()
                .vague(true)
                .category(category)
                .originalQuery(text)
                .interpretedIntent(need)
                .suggestedQuery(text)
                .clarificationNeeded(true)
                .clarificationMessage("It sounds like you might be after " + need
                        + ". Could you tell me which kind of product you have in mind?")
                .confidence(best.score())
                .excludedTerms(negated)
                .build();
    }

    private VagueQueryResult fromPhrase(String text, Candidate best, Set<String> negated) {
        PhraseTranslation phrase = best.phrase();
        String query = phrase.searchTerms().isEmpty() ? text : phrase.searchQuery();
        Map<String, Object> filters = new LinkedHashMap<>();
        filters.put("categories", phrase.categories());
        return VagueQueryResult.builder()
                .vague(true)
                .category(VagueCategory.LIFESTYLE_CONTEXT)
                .originalQuery(text)
                .interpretedIntent("products related to " + phrase.phrase())
                .suggestedQuery(query)
                .suggestedFilters(filters)
                .suggestedTool(SuggestedTool.SEARCH_PRODUCTS)
                .toolArg("query", query)
                .toolArg("filters", filters)
                .confidence(best.score())
                .excludedTerms(negated)
                .build();
    }

    private VagueQueryResult fromRule(String text, String normalized, Candidate best, String productNoun,
                                      Set<String> negated) {
        VagueRule rule = best.rule();
        String query = rule.getQuery();
        Map<String, Object> filters = new LinkedHashMap<>(rule.getFilters());
        Map<String, Object> toolArgs = new LinkedHashMap<>(rule.getToolArgs());
        Set<String> excluded = new LinkedHashSet<>(negated);
        excluded.addAll(rule.getExcludes());

        if (rule.isExtractNumber()) {
            Matcher number = NUMBER.matcher(best.match().group());
            // Longer digit runs are not a party size; the rule's own query stands.
            if (number.find() && number.group().length() <= MAX_SEAT_DIGITS) {
                int seats = Integer.parseInt(number.group());
                if (seats >= 6) {
                    query = "large dining table " + seats + " seater";
                    filters.put("size", "large");
                }
            }
        }

        if (productNoun != null && !query.isEmpty() && rule.getTool() == SuggestedTool.SEARCH_PRODUCTS) {
            query = (productNoun + " " + stripProductNouns(query)).trim();
        }

        // A negated value never survives as a positive filter.
        filters.entrySet().removeIf(entry -> entry.getValue() instanceof String value
                && excluded.contains(AttributeVocabulary.canonicalMaterial(value)));

        if (rule.getTool() == SuggestedTool.SEARCH_PRODUCTS) {
            toolArgs.put("query", query);
            toolArgs.putAll(filters);
        } else if (rule.getTool() == SuggestedTool.BUILD_BUNDLE) {
            toolArgs.put("request", text);
        }

        return VagueQueryResult.builder()
                .vague(true)
                .category(rule.getCategory())
                .originalQuery(text)
                .interpretedIntent(rule.getIntent())
                .suggestedQuery(query.isEmpty() ? normalized : query)
                .suggestedFilters(filters)
                .suggestedTool(rule.getTool())
                .toolArgs(toolArgs)
                .clarificationNeeded(rule.getClarification() != null)
                .clarificationMessage(rule.getClarification())
                .confidence(best.score())
                .excludedTerms(excluded)
                .build();
    }

    // ==================== Helper Methods ====================

    /**
     * Materials and colors the shopper ruled out ("not wood", "no leather", "without metal").
     */
    static Set<String> negatedTerms(String normalized) {
        return AttributeVocabulary.negatedAttributes(normalized);
    }

    /**
     * Drops product nouns from a rule's query so the shopper's own noun leads.
     */
    static String stripProductNouns(String query) {
        String result = " " + query + " ";
        List<String> nouns = AttributeVocabulary.PRODUCT_NOUNS.stream()
                .sorted(Comparator.comparingInt(String::length).reversed())
                .toList();
        for (String noun : nouns) {
            result = result.replaceAll("(?<=\\s)" + Pattern.quote(noun) + "s?(?=\\s)", " ");
        }
        return result.trim().replaceAll("\\s+", " ");
    }
}
