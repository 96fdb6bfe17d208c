package com.purchasingpower.proofengine.model.analysis;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Kind of analysis requested by the host. Anything unrecognised runs the full pipeline.
 */
public enum ThoughtType {
    PROOF_DECOMPOSITION,
    DEPENDENCY_ANALYSIS,
    CONSISTENCY_CHECK,
    GAP_IDENTIFICATION,
    ASSUMPTION_TRACE,
    FULL;

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ThoughtType fromValue(String value) {
        if (value == null || value.isBlank()) {
            return FULL;
        }
        for (ThoughtType type : values()) {
            if (type.getValue().equalsIgnoreCase(value.trim())) {
                return type;
            }
        }
        return FULL;
    }
}
