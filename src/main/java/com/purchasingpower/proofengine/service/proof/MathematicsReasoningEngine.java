package com.purchasingpower.proofengine.service.proof;

import com.purchasingpower.proofengine.model.analysis.EngineStats;
import com.purchasingpower.proofengine.model.analysis.ProofAnalysisResult;
import com.purchasingpower.proofengine.model.analysis.ThoughtType;
import com.purchasingpower.proofengine.model.proof.ProofInput;

/**
 * Runs the whole proof analysis pipeline and aggregates a verdict.
 *
 * <p>Decomposition runs first; gap analysis, assumption tracking,
 * inconsistency detection and circular-reasoning detection are independent
 * read-only passes over the same decomposition. The overall score is the
 * product of both completeness figures, scaled by 0.3 when the proof is
 * inconsistent and by 0.95 when it carries unused assumptions. A proof is
 * valid when it is consistent and scores above 0.5.
 *
 * <p>Stateless: every call is independent.
 *
 * @since 1.0.0
 */
public interface MathematicsReasoningEngine {

    ProofAnalysisResult analyzeProof(ProofInput proof, String theorem);

    /**
     * Narrower entry point that only runs the passes a thought type needs.
     */
    ProofAnalysisResult analyzeForThoughtType(ProofInput proof, ThoughtType thoughtType, String theorem);

    /**
     * Decomposition plus inconsistency and circular-reasoning detection only.
     */
    ProofAnalysisResult checkConsistency(ProofInput proof, String theorem);

    /**
     * Markdown summary of an analysis.
     */
    String generateReport(ProofAnalysisResult result);

    EngineStats getStats();
}
