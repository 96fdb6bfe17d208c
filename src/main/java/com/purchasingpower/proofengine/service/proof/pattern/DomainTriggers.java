package com.purchasingpower.proofengine.service.proof.pattern;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Operations whose use silently restricts the domain of their argument:
 * division needs a non-zero divisor, square roots a non-negative radicand and
 * logarithms a positive argument.
 *
 * <p>A division is not reported when some statement of the proof already says
 * the divisor is non-zero (for example {@code x != 0}, {@code x > 0} or
 * "x is nonzero").
 */
public final class DomainTriggers {

    private static final Pattern DIVISION = Pattern.compile("/\\s*([a-zA-Z_]\\w*|\\([^)]+\\))");
    private static final Pattern SQUARE_ROOT = Pattern.compile("√|\\\\sqrt|\\bsqrt\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern LOGARITHM = Pattern.compile("\\\\log|\\b(?:log|ln)\\b", Pattern.CASE_INSENSITIVE);

    public enum Kind {
        DIVISION("Division operation implies non-zero divisor", "State that the divisor is non-zero"),
        SQUARE_ROOT("Square root implies non-negative argument", "State that the argument is non-negative"),
        LOGARITHM("Logarithm implies positive argument", "State that the argument is positive");

        private final String description;
        private final String formulation;

        Kind(String description, String formulation) {
            this.description = description;
            this.formulation = formulation;
        }

        public String getDescription() {
            return description;
        }

        public String getFormulation() {
            return formulation;
        }
    }

    /**
     * A trigger found in one statement; {@code subject} is the divisor for divisions.
     */
    public record Trigger(Kind kind, String subject) {

        public String suggestedFormulation() {
            if (kind == Kind.DIVISION && subject != null) {
                return "State that " + subject + " is non-zero";
            }
            return kind.getFormulation();
        }
    }

    private DomainTriggers() {
    }

    /**
     * Triggers in {@code text}, checked against everything the proof states in {@code context}.
     */
    public static List<Trigger> scan(String text, Collection<String> context) {
        List<Trigger> triggers = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return triggers;
        }

        Matcher division = DIVISION.matcher(text);
        while (division.find()) {
            String divisor = division.group(1);
            if (!isStatedNonZero(divisor, context)) {
                triggers.add(new Trigger(Kind.DIVISION, divisor));
                break;
            }
        }
        if (SQUARE_ROOT.matcher(text).find()) {
            triggers.add(new Trigger(Kind.SQUARE_ROOT, null));
        }
        if (LOGARITHM.matcher(text).find()) {
            triggers.add(new Trigger(Kind.LOGARITHM, null));
        }
        return triggers;
    }

    static boolean isStatedNonZero(String divisor, Collection<String> context) {
        String quoted = Pattern.quote(divisor);
        Pattern comparison = Pattern.compile(
                "(?<![/\\w])" + quoted + "\\s*(?:≠|!=|<>|>(?!=)|<(?!=))\\s*0(?!\\d)(?!\\.\\d)");
        Pattern wording = Pattern.compile(
                "(?<![/\\w])" + quoted + "\\s+is\\s+(?:non-?zero|not\\s+zero|positive|negative)",
                Pattern.CASE_INSENSITIVE);

        for (String statement : context) {
            if (statement == null) {
                continue;
            }
            if (comparison.matcher(statement).find() || wording.matcher(statement).find()) {
                return true;
            }
        }
        return false;
    }
}
