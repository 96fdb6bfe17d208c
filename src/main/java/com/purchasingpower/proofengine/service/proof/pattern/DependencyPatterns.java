package com.purchasingpower.proofengine.service.proof.pattern;

import com.purchasingpower.proofengine.model.proof.InferenceRule;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Phrases that name an inference rule and, through their capture groups, the
 * earlier statements a step cites.
 *
 * <p>All patterns are tried; the first one that matches names the rule.
 */
public final class DependencyPatterns {

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;

    /**
     * @param rule            inference rule this phrasing signals
     * @param pattern         searched anywhere in the step text plus its justification
     * @param referenceGroups capture groups holding referenced statement text
     */
    public record Rule(InferenceRule rule, Pattern pattern, int[] referenceGroups) {

        public List<String> references(Matcher matcher) {
            List<String> references = new ArrayList<>();
            for (int group : referenceGroups) {
                String text = matcher.group(group);
                if (text != null && !text.isBlank()) {
                    references.add(text.trim());
                }
            }
            return references;
        }
    }

    public static final List<Rule> RULES = List.of(
            new Rule(InferenceRule.MODUS_PONENS,
                    Pattern.compile("\\b(?:by|from|using)\\s+(.+?)(?:,\\s*(?:we have|we get|it follows|we obtain)|$)", FLAGS),
                    new int[]{1}),
            new Rule(InferenceRule.SUBSTITUTION,
                    Pattern.compile("substitut(?:e|ing)\\s+(.+?)\\s+(?:into|in)\\s+(.+)", FLAGS),
                    new int[]{1, 2}),
            new Rule(InferenceRule.DEFINITION_EXPANSION,
                    Pattern.compile("(?:by\\s+)?(?:the\\s+)?definition\\s+(?:of\\s+)?(.+)", FLAGS),
                    new int[]{1}),
            new Rule(InferenceRule.CONTRADICTION,
                    Pattern.compile("(?:this\\s+)?contradicts?\\s+(.+)", FLAGS),
                    new int[]{1}),
            new Rule(InferenceRule.MATHEMATICAL_INDUCTION,
                    Pattern.compile("by\\s+(?:mathematical\\s+)?induction", FLAGS),
                    new int[]{}),
            new Rule(InferenceRule.HYPOTHETICAL_SYLLOGISM,
                    Pattern.compile("since\\s+(.+?)\\s+implies\\s+(.+?),\\s+and\\s+(.+?)\\s+implies\\s+(.+)", FLAGS),
                    new int[]{1, 2})
    );

    private DependencyPatterns() {
    }
}
