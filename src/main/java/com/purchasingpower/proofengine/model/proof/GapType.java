package com.purchasingpower.proofengine.model.proof;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum GapType {
    UNJUSTIFIED_LEAP,
    MISSING_STEP,
    SCOPE_ERROR,
    UNDEFINED_TERM;

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
