package com.purchasingpower.proofengine.service.proof;

import com.purchasingpower.proofengine.model.analysis.CircularReasoningResult;
import com.purchasingpower.proofengine.model.analysis.CycleAnalysis;
import com.purchasingpower.proofengine.model.proof.CircularPath;
import com.purchasingpower.proofengine.model.proof.DependencyGraph;
import com.purchasingpower.proofengine.model.proof.ProofDecomposition;
import com.purchasingpower.proofengine.model.proof.Statement;

import java.util.List;

/**
 * Detects reasoning that leans on itself: dependency cycles, self-referential
 * statements, conclusions that restate a premise, and tautologies.
 *
 * @since 1.0.0
 */
public interface CircularReasoningDetector {

    CircularReasoningResult detectCircularReasoning(ProofDecomposition decomposition, AnalysisBudget budget);

    CircularReasoningResult detectCircularReasoning(ProofDecomposition decomposition);

    List<CircularPath> findReasoningCycles(DependencyGraph graph);

    boolean isSelfReferential(Statement statement);

    CycleAnalysis analyzeCycle(CircularPath cycle, DependencyGraph graph);

    boolean conclusionDependsOnItself(String conclusionId, DependencyGraph graph);
}
