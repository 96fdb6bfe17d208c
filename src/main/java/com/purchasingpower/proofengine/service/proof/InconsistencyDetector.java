package com.purchasingpower.proofengine.service.proof;

import com.purchasingpower.proofengine.model.analysis.FallacyWarning;
import com.purchasingpower.proofengine.model.analysis.InconsistencySummary;
import com.purchasingpower.proofengine.model.proof.Inconsistency;
import com.purchasingpower.proofengine.model.proof.ProofDecomposition;

import java.util.List;

/**
 * Finds statements that cannot all hold at once: direct contradictions, type
 * clashes, domain violations, undefined operations, conflicting axioms and
 * quantifier misuse.
 *
 * @since 1.0.0
 */
public interface InconsistencyDetector {

    List<Inconsistency> analyze(ProofDecomposition decomposition, AnalysisBudget budget);

    List<Inconsistency> analyze(ProofDecomposition decomposition);

    /**
     * Reduces findings to a verdict. This is the single authoritative
     * "proof is invalid" signal.
     */
    InconsistencySummary getSummary(List<Inconsistency> inconsistencies);

    /**
     * Matches the statements against the catalogue of common fallacies. Advisory only.
     */
    List<FallacyWarning> detectFallacies(ProofDecomposition decomposition);
}
