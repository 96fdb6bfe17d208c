package com.purchasingpower.proofengine.service.proof;

import lombok.Builder;
import lombok.Value;

/**
 * Outcome of checking a single step-to-step transition.
 */
@Value
@Builder
public class TransitionValidation {
    boolean valid;
    String reason;
    String suggestedFix;

    public static TransitionValidation ok() {
        return TransitionValidation.builder().valid(true).build();
    }

    public static TransitionValidation ok(String reason) {
        return TransitionValidation.builder().valid(true).reason(reason).build();
    }

    public static TransitionValidation invalid(String reason, String suggestedFix) {
        return TransitionValidation.builder().valid(false).reason(reason).suggestedFix(suggestedFix).build();
    }
}
