package com.purchasingpower.proofengine.model.proof;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum InconsistencyType {
    DIRECT_CONTRADICTION,
    TYPE_MISMATCH,
    DOMAIN_VIOLATION,
    UNDEFINED_OPERATION,
    AXIOM_CONFLICT,
    QUANTIFIER_ERROR;

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
