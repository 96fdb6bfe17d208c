package com.purchasingpower.proofengine.model.proof;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ImplicitAssumptionType {
    DOMAIN_ASSUMPTION,
    EXISTENCE_ASSUMPTION,
    UNIQUENESS_ASSUMPTION,
    CONTINUITY_ASSUMPTION,
    FINITENESS_ASSUMPTION,
    ASSUMPTION_CHAIN;

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
