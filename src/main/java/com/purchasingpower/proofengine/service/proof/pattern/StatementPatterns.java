package com.purchasingpower.proofengine.service.proof.pattern;

import com.purchasingpower.proofengine.model.proof.StatementType;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Ordered classification rules for a single proof step.
 *
 * <p>Rules are tried top to bottom and the first match wins, so the order is part
 * of the contract: "Let x be ..." is a definition before it can be a hypothesis,
 * and anything unmatched falls through to a derived statement.
 */
public final class StatementPatterns {

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.DOTALL;

    /**
     * One classification rule.
     *
     * @param name          rule name, used in debug logging
     * @param pattern       anchored pattern tested against the trimmed step
     * @param type          statement type assigned on match
     * @param text          extracts the statement text from the match
     * @param justification extracts an inline justification, or null
     */
    public record Rule(String name, Pattern pattern, StatementType type,
                       Function<Matcher, String> text, Function<Matcher, String> justification) {
    }

    /**
     * Outcome of classifying one step.
     */
    public record Classification(String rule, StatementType type, String text, String justification) {
    }

    public static final List<Rule> RULES = List.of(
            new Rule("axiom",
                    Pattern.compile("^(?:Axiom|Postulate)\\b\\s*(?:\\d+)?[:.]?\\s*(.+)$", FLAGS),
                    StatementType.AXIOM, m -> m.group(1).trim(), m -> null),
            new Rule("definition",
                    Pattern.compile("^(?:Definition\\b|Def\\b\\.?)\\s*(?:\\d+)?[:.]?\\s*(.+)$", FLAGS),
                    StatementType.DEFINITION, m -> m.group(1).trim(), m -> null),
            new Rule("let-binding",
                    Pattern.compile("^(?:Let|Define)\\s+(.+?)(?:\\s+be\\s+|\\s*:=\\s*|\\s*=\\s*)(.+)$", FLAGS),
                    StatementType.DEFINITION, m -> (m.group(1) + " be " + m.group(2)).trim(), m -> null),
            new Rule("hypothesis",
                    Pattern.compile("^(?:Assume|Suppose|Given|Hypothesis|Let)\\b\\s*[:,]?\\s*(?:that\\s+)?(.+)$", FLAGS),
                    StatementType.HYPOTHESIS, m -> m.group(1).trim(), m -> null),
            new Rule("lemma",
                    Pattern.compile("^(?:Lemma|Claim)\\b\\s*(?:\\d+)?[:.]?\\s*(.+)$", FLAGS),
                    StatementType.LEMMA, m -> m.group(1).trim(), m -> null),
            new Rule("conclusion",
                    Pattern.compile("^(?:(?:Therefore|Thus|Hence|So|Consequently|It follows that|We conclude(?: that)?|QED)\\b|∴)\\s*[,:]?\\s*(.+)$", FLAGS),
                    StatementType.CONCLUSION, m -> m.group(1).trim(), m -> null),
            new Rule("cited-derivation",
                    Pattern.compile("^(?:By|From|Using|Since)\\s+(.+?)[,\\s]+(?:we have|we get|we obtain|it follows|this gives)\\s+(?:that\\s+)?(.+)$", FLAGS),
                    StatementType.DERIVED, m -> m.group(2).trim(), m -> m.group(1).trim()),
            new Rule("implication",
                    Pattern.compile("^(?:This|Which)\\s+(?:implies|gives|yields|means|shows)\\s+(?:that\\s+)?(.+)$", FLAGS),
                    StatementType.DERIVED, m -> m.group(1).trim(), m -> null),
            new Rule("fallback",
                    Pattern.compile("^(.+)$", FLAGS),
                    StatementType.DERIVED, m -> m.group(1).trim(), m -> null)
    );

    private StatementPatterns() {
    }

    /**
     * Classifies a step by the first matching rule. Empty for blank content.
     */
    public static Optional<Classification> classify(String content) {
        if (content == null || content.isBlank()) {
            return Optional.empty();
        }
        String trimmed = content.trim();
        for (Rule rule : RULES) {
            Matcher matcher = rule.pattern().matcher(trimmed);
            if (matcher.matches()) {
                return Optional.of(new Classification(
                        rule.name(), rule.type(), rule.text().apply(matcher), rule.justification().apply(matcher)));
            }
        }
        return Optional.of(new Classification("fallback", StatementType.DERIVED, trimmed, null));
    }
}
