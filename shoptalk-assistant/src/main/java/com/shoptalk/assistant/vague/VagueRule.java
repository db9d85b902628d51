package com.shoptalk.assistant.vague;

import com.shoptalk.common.enums.SuggestedTool;
import com.shoptalk.common.enums.VagueCategory;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * One row of the vague query rule table: a pattern and the rewrite it implies.
 */
@Getter
@Builder
public class VagueRule {

    private final VagueCategory category;
    private final Pattern pattern;
    private final String intent;

    /** Replacement search text; empty for rules that do not search */
    @Builder.Default
    private final String query = "";

    @Singular("filter")
    private final Map<String, Object> filters;

    @Builder.Default
    private final SuggestedTool tool = SuggestedTool.SEARCH_PRODUCTS;

    @Singular("toolArg")
    private final Map<String, Object> toolArgs;

    /** Question to ask instead of searching, when the rule alone cannot settle the need */
    private final String clarification;

    /** Terms the shopper ruled out */
    @Singular("exclude")
    private final List<String> excludes;

    /** Rewrite "family of N" style matches into a seat count */
    private final boolean extractNumber;

    public static class VagueRuleBuilder {

        public VagueRuleBuilder regex(String regex) {
            return pattern(Pattern.compile(regex, Pattern.CASE_INSENSITIVE));
        }
    }
}
