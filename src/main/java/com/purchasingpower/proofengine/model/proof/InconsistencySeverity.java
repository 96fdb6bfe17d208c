package com.purchasingpower.proofengine.model.proof;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum InconsistencySeverity {
    WARNING,
    ERROR,
    CRITICAL;

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
