package com.purchasingpower.proofengine.model.analysis;

import com.purchasingpower.proofengine.model.proof.ImplicitAssumption;
import com.purchasingpower.proofengine.model.proof.Statement;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Foundational-statement usage across every conclusion of a proof.
 *
 * <p>{@code minimalSets} maps each conclusion to a locally minimal subset of
 * {@code conclusionDependencies} from which it is still derivable.
 */
@Value
@Builder
public class AssumptionAnalysis {
    List<Statement> explicitAssumptions;
    List<ImplicitAssumption> implicitAssumptions;
    List<String> unusedAssumptions;
    Map<String, List<String>> conclusionDependencies;
    Map<String, List<String>> minimalSets;
}
