package com.purchasingpower.proofengine.service.proof;

import com.purchasingpower.proofengine.model.analysis.AssumptionAnalysis;
import com.purchasingpower.proofengine.model.analysis.DischargeStatus;
import com.purchasingpower.proofengine.model.analysis.StructureValidation;
import com.purchasingpower.proofengine.model.proof.AssumptionChain;
import com.purchasingpower.proofengine.model.proof.DependencyGraph;
import com.purchasingpower.proofengine.model.proof.ProofDecomposition;

import java.util.List;

/**
 * Traces conclusions back to the axioms, definitions and hypotheses they rest on.
 *
 * @since 1.0.0
 */
public interface AssumptionTracker {

    /**
     * Walks {@code derivedFrom} links down from a statement. Foundational
     * statements become assumptions; a non-foundational statement with nothing
     * to derive it from becomes an implicit assumption rather than an error.
     */
    AssumptionChain traceToAssumptions(String conclusionId, DependencyGraph graph);

    /**
     * Traces every conclusion (every leaf when there is none), then reports
     * unused assumptions and a locally minimal sufficient set per conclusion.
     */
    AssumptionAnalysis analyzeAssumptions(ProofDecomposition decomposition);

    /**
     * Foundational statements no edge or derivation ever cites.
     */
    List<String> findUnusedAssumptions(ProofDecomposition decomposition);

    /**
     * Whether each hypothesis is discharged, either by a contradiction that
     * depends on it or by a conclusion stated as an implication.
     */
    List<DischargeStatus> checkAssumptionDischarge(ProofDecomposition decomposition);

    /**
     * Every statement that transitively depends on the given one.
     */
    List<String> getAssumptionImpact(String assumptionId, DependencyGraph graph);

    List<String> getSuggestions(AssumptionAnalysis analysis);

    StructureValidation validateStructure(ProofDecomposition decomposition);
}
