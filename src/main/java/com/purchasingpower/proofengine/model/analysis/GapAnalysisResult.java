package com.purchasingpower.proofengine.model.analysis;

import com.purchasingpower.proofengine.model.proof.Gap;
import com.purchasingpower.proofengine.model.proof.ImplicitAssumption;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Gaps found by re-validating a decomposition.
 *
 * <p>{@code completeness} supersedes the estimate carried by the decomposition.
 */
@Value
@Builder
public class GapAnalysisResult {
    double completeness;
    List<Gap> gaps;
    List<ImplicitAssumption> implicitAssumptions;
    List<String> unjustifiedSteps;
    List<String> suggestions;
}
