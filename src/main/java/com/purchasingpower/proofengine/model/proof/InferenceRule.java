package com.purchasingpower.proofengine.model.proof;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Named inference rules a derived statement may claim.
 */
public enum InferenceRule {
    MODUS_PONENS,
    MODUS_TOLLENS,
    HYPOTHETICAL_SYLLOGISM,
    DISJUNCTIVE_SYLLOGISM,
    UNIVERSAL_INSTANTIATION,
    UNIVERSAL_GENERALIZATION,
    EXISTENTIAL_INSTANTIATION,
    EXISTENTIAL_GENERALIZATION,
    MATHEMATICAL_INDUCTION,
    CONTRADICTION,
    CASE_ANALYSIS,
    SUBSTITUTION,
    ALGEBRAIC_MANIPULATION,
    DEFINITION_EXPANSION,
    DIRECT_IMPLICATION;

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
