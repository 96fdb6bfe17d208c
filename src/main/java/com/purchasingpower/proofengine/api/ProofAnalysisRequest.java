package com.purchasingpower.proofengine.api;

import com.purchasingpower.proofengine.model.proof.ProofStep;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Proof analysis request. Either {@code proof} prose or structured {@code steps}.
 *
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProofAnalysisRequest {

    private String proof;
    private List<ProofStep> steps;
    private String theorem;

    /**
     * One of proof_decomposition, dependency_analysis, consistency_check,
     * gap_identification, assumption_trace or full. Defaults to full.
     */
    private String thoughtType;
}
