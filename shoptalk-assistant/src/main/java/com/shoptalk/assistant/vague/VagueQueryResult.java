package com.shoptalk.assistant.vague;

import com.shoptalk.common.enums.SuggestedTool;
import com.shoptalk.common.enums.VagueCategory;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;

import java.util.Map;
import java.util.Set;

/**
 * Interpretation of one message by {@link VagueQueryInterpreter}.
 */
@Getter
@Builder
@ToString
public class VagueQueryResult {

    private final boolean vague;
    private final VagueCategory category;
    private final String originalQuery;
    private final String interpretedIntent;
    private final String suggestedQuery;

    @Singular("suggestedFilter")
    private final Map<String, Object> suggestedFilters;

    /** Null when nothing should be called yet */
    private final SuggestedTool suggestedTool;

    @Singular("toolArg")
    private final Map<String, Object> toolArgs;

    private final boolean clarificationNeeded;
    private final String clarificationMessage;
    private final double confidence;

    /** Negated materials, colors or features, canonicalised */
    @Singular("excludedTerm")
    private final Set<String> excludedTerms;

    public boolean isPolicyRequest() {
        return suggestedTool == SuggestedTool.GET_POLICY_INFO;
    }

    public boolean isBundleRequest() {
        return suggestedTool == SuggestedTool.BUILD_BUNDLE;
    }
}
