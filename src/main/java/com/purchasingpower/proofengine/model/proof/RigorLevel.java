package com.purchasingpower.proofengine.model.proof;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Coarse bucket summarizing how carefully a proof is justified.
 */
public enum RigorLevel {
    INFORMAL,
    TEXTBOOK,
    RIGOROUS,
    FORMAL;

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
