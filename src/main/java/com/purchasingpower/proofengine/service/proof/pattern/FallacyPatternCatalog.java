package com.purchasingpower.proofengine.service.proof.pattern;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Known fallacy shapes matched against proof text.
 *
 * <p>Patterns marked {@code crossSentence} relate several sentences (premise
 * and conclusion) and only make sense against the whole proof; the rest are
 * matched one statement at a time.
 */
public final class FallacyPatternCatalog {

    public record FallacyPattern(String id, String name, String category, String description,
                                 Pattern pattern, String severity, String suggestion, boolean crossSentence) {
    }

    private static final int CI = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;

    public static final List<FallacyPattern> PATTERNS = List.of(
            new FallacyPattern("division_by_hidden_zero", "Division by Hidden Zero", "division_error",
                    "Division by an expression that could equal zero without explicit check",
                    Pattern.compile("(?:divid(?:e|ing)|/)\\s*(?:by\\s+)?(?:\\(\\s*)?([a-zA-Z](?:\\s*[-+]\\s*[a-zA-Z])?)(?:\\s*\\))?", CI),
                    "error", "Verify that the divisor is non-zero before dividing", false),
            new FallacyPattern("assuming_conclusion", "Assuming What Is to Be Proved", "logical_fallacy",
                    "The conclusion appears as an assumption in the proof",
                    Pattern.compile("(?:assume|suppose|let)\\s+(?:that\\s+)?(.{10,50}).*(?:therefore|thus|hence)\\s+\\1",
                            CI | Pattern.DOTALL),
                    "critical", "Derive the conclusion from independent premises", true),
            new FallacyPattern("affirming_consequent", "Affirming the Consequent", "logical_fallacy",
                    "Invalid inference: concluding P from \"P implies Q\" and Q",
                    Pattern.compile("if\\s+(.+?)\\s+then\\s+(.+?)[.,].*\\2.*therefore\\s+\\1", CI | Pattern.DOTALL),
                    "error", "This inference is invalid. P→Q and Q does not entail P.", true),
            new FallacyPattern("denying_antecedent", "Denying the Antecedent", "logical_fallacy",
                    "Invalid inference: concluding not-Q from \"P implies Q\" and not-P",
                    Pattern.compile("if\\s+(.+?)\\s+then\\s+(.+?)[.,].*not\\s+\\1.*therefore\\s+not\\s+\\2",
                            CI | Pattern.DOTALL),
                    "error", "This inference is invalid. P→Q and ¬P does not entail ¬Q.", true),
            new FallacyPattern("hasty_generalization", "Hasty Generalization", "logical_fallacy",
                    "Generalizing to all cases from only a few examples",
                    Pattern.compile("(?:for\\s+)?(?:n\\s*=\\s*)?[123](?:\\s*(?:,|and)\\s*[123])*\\s*[,.]\\s*(?:therefore|thus|hence|so)\\s+(?:for\\s+all|∀)", CI),
                    "warning", "Provide a general proof or use mathematical induction", true),
            new FallacyPattern("illegal_cancellation", "Illegal Cancellation", "division_error",
                    "Cancelling terms without verifying they are non-zero",
                    Pattern.compile("cancel(?:l?ing|l?ed)?\\s+(?:the\\s+)?(?:common\\s+)?(?:term|factor)", CI),
                    "warning", "Verify the cancelled term is non-zero", false),
            new FallacyPattern("infinity_arithmetic", "Infinity Arithmetic Error", "infinity_error",
                    "Performing undefined arithmetic operations with infinity",
                    Pattern.compile("∞\\s*[-+*/]\\s*∞|∞\\s*[*/]\\s*0|0\\s*[*/]\\s*∞"),
                    "critical", "Use proper limit analysis instead of infinity arithmetic", false),
            new FallacyPattern("necessary_sufficient_confusion", "Necessary/Sufficient Condition Confusion",
                    "logical_fallacy", "Confusing necessary conditions with sufficient conditions",
                    Pattern.compile("(?:necessary|sufficient)\\s+(?:and\\s+)?(?:necessary|sufficient)", CI),
                    "warning", "Clarify whether the condition is necessary, sufficient, or both", false),
            new FallacyPattern("existential_instantiation_error", "Existential Instantiation Error", "quantifier_error",
                    "Treating an existentially quantified variable as universal",
                    Pattern.compile("(?:there\\s+exists?|∃)\\s+(\\w+).*(?:for\\s+all|∀|any|every)\\s+\\1\\b",
                            CI | Pattern.DOTALL),
                    "error", "The existential variable cannot be used universally", true),
            new FallacyPattern("sqrt_sign_error", "Square Root Sign Error", "type_error",
                    "Ignoring that √x denotes the principal (non-negative) square root",
                    Pattern.compile("√\\s*\\(?([^)]+)\\)?.*=.*-"),
                    "warning", "Remember that √x ≥ 0 by convention", false),
            new FallacyPattern("limit_exchange_error", "Limit Exchange Error", "limit_error",
                    "Exchanging limits without justification",
                    Pattern.compile("lim\\s*lim|limit\\s+(?:of\\s+)?(?:the\\s+)?limit", CI),
                    "warning", "Verify conditions for exchanging limits (uniform convergence, etc.)", false)
    );

    private FallacyPatternCatalog() {
    }
}
