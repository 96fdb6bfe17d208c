package com.purchasingpower.proofengine.model.proof;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Trace from a conclusion back to the foundational statements it rests on.
 */
@Value
@Builder
public class AssumptionChain {
    String conclusion;
    List<String> assumptions;
    List<String> path;
    boolean allAssumptionsExplicit;
    List<ImplicitAssumption> implicitAssumptions;
}
