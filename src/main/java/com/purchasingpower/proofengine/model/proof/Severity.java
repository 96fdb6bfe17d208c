package com.purchasingpower.proofengine.model.proof;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Severity of a structural finding (gaps, cycles) with the completeness
 * penalty a gap of that severity carries.
 */
public enum Severity {
    MINOR(0.03),
    SIGNIFICANT(0.10),
    CRITICAL(0.25);

    private final double penalty;

    Severity(double penalty) {
        this.penalty = penalty;
    }

    public double getPenalty() {
        return penalty;
    }

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
