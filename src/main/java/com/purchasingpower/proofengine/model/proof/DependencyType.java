package com.purchasingpower.proofengine.model.proof;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Nature of a derivation edge.
 */
public enum DependencyType {
    LOGICAL,
    DEFINITIONAL,
    COMPUTATIONAL;

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
