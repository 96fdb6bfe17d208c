package com.purchasingpower.proofengine.model.proof;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.List;

/**
 * A proof as submitted: either free prose or an explicit list of steps.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ProofInput {
    String text;
    List<ProofStep> steps;

    public static ProofInput text(String text) {
        return new ProofInput(text, null);
    }

    public static ProofInput steps(List<ProofStep> steps) {
        return new ProofInput(null, steps != null ? List.copyOf(steps) : List.of());
    }

    public boolean isStructured() {
        return steps != null;
    }
}
