package com.purchasingpower.proofengine.model.proof;

import lombok.Builder;
import lombok.Value;

/**
 * An assumption a step relies on without stating it.
 */
@Value
@Builder(toBuilder = true)
public class ImplicitAssumption {
    String id;
    String statement;
    ImplicitAssumptionType type;
    String usedInStep;
    boolean shouldBeExplicit;
    String suggestedFormulation;
}
