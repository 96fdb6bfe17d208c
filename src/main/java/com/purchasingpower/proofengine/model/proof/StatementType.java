package com.purchasingpower.proofengine.model.proof;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Role a statement plays inside a proof.
 *
 * <p>Axioms, definitions and hypotheses are foundational: they may be
 * assumed without derivation. Everything else has to be derived from
 * earlier statements.
 */
public enum StatementType {
    AXIOM,
    DEFINITION,
    HYPOTHESIS,
    LEMMA,
    DERIVED,
    CONCLUSION;

    public boolean isFoundational() {
        return this == AXIOM || this == DEFINITION || this == HYPOTHESIS;
    }

    /**
     * Base confidence assigned when a statement of this type is classified.
     */
    public double baseConfidence() {
        return switch (this) {
            case LEMMA -> 0.9;
            case DERIVED -> 0.8;
            case CONCLUSION -> 0.85;
            default -> 1.0;
        };
    }

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
