package com.purchasingpower.proofengine.service.proof;

import com.purchasingpower.proofengine.model.analysis.GapAnalysisResult;
import com.purchasingpower.proofengine.model.proof.ProofDecomposition;
import com.purchasingpower.proofengine.model.proof.Statement;

/**
 * Re-validates every statement and edge of a decomposition looking for holes:
 * unjustified leaps, missing intermediate steps, variables used without being
 * introduced, and terms cited "by definition" that were never defined.
 *
 * <p>The completeness it reports supersedes the decomposer's first estimate.
 *
 * @since 1.0.0
 */
public interface GapAnalyzer {

    GapAnalysisResult analyzeGaps(ProofDecomposition decomposition, AnalysisBudget budget);

    GapAnalysisResult analyzeGaps(ProofDecomposition decomposition);

    /**
     * Checks whether {@code to} can reasonably follow from {@code from}.
     *
     * <p>Foundational targets are always valid. A declared dependency is valid,
     * with the claimed rule optionally checked against textual cues. Otherwise
     * an implied connection (shared significant words, or a justification
     * citing {@code from}'s id) is required.
     */
    TransitionValidation isValidTransition(Statement from, Statement to);
}
