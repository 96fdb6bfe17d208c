package com.purchasingpower.proofengine.service.proof.pattern;

import com.purchasingpower.proofengine.model.proof.ImplicitAssumptionType;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Wording that hides an assumption: hedges like "clearly", unqualified
 * quantifiers, uniqueness, continuity and finiteness claims.
 */
public final class ImplicitAssumptionPatterns {

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;

    public record Rule(Pattern pattern, ImplicitAssumptionType type, Function<Matcher, String> formulation) {
    }

    public record Hit(ImplicitAssumptionType type, String suggestedFormulation) {
    }

    public static final List<Rule> RULES = List.of(
            new Rule(Pattern.compile("\\b(?:clearly|obviously|trivially|it is clear that)\\b", FLAGS),
                    ImplicitAssumptionType.EXISTENCE_ASSUMPTION, null),
            new Rule(Pattern.compile("(?:\\bfor\\s+(?:all|any|every)|∀)\\s*([a-zA-Z_]\\w*)", FLAGS),
                    ImplicitAssumptionType.DOMAIN_ASSUMPTION, m -> "Specify the domain of " + m.group(1)),
            new Rule(Pattern.compile("(?:\\bthere\\s+exists?|∃)\\s*([a-zA-Z_]\\w*)", FLAGS),
                    ImplicitAssumptionType.EXISTENCE_ASSUMPTION, m -> "Prove existence of " + m.group(1) + " or cite a theorem"),
            new Rule(Pattern.compile("\\b(?:unique|the\\s+only)\\b", FLAGS),
                    ImplicitAssumptionType.UNIQUENESS_ASSUMPTION, m -> "Prove uniqueness or cite a uniqueness theorem"),
            new Rule(Pattern.compile("\\b(?:continuous|differentiable|integrable)\\b", FLAGS),
                    ImplicitAssumptionType.CONTINUITY_ASSUMPTION, m -> "State continuity/differentiability assumptions explicitly"),
            new Rule(Pattern.compile("\\b(?:finite|bounded)\\b", FLAGS),
                    ImplicitAssumptionType.FINITENESS_ASSUMPTION, m -> "State finiteness/boundedness assumptions explicitly")
    );

    private ImplicitAssumptionPatterns() {
    }

    /**
     * First matching rule for a step; at most one hit per step.
     */
    public static Optional<Hit> firstMatch(String text) {
        if (text == null) {
            return Optional.empty();
        }
        for (Rule rule : RULES) {
            Matcher matcher = rule.pattern().matcher(text);
            if (matcher.find()) {
                String formulation = rule.formulation() != null
                        ? rule.formulation().apply(matcher)
                        : "Explicitly state and justify: \"" + truncate(text) + "\"";
                return Optional.of(new Hit(rule.type(), formulation));
            }
        }
        return Optional.empty();
    }

    private static String truncate(String text) {
        return text.length() <= 50 ? text : text.substring(0, 50) + "...";
    }
}
