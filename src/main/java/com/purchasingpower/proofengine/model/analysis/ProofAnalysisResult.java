package com.purchasingpower.proofengine.model.analysis;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.purchasingpower.proofengine.model.proof.ProofDecomposition;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Everything the engine learned about one proof.
 *
 * <p>Passes that were disabled or not requested are left {@code null}, and so
 * are the score and verdict of narrow analyses that do not produce them.
 *
 * @since 1.0.0
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ProofAnalysisResult {
    ProofDecomposition decomposition;
    ConsistencyReport consistencyReport;
    GapAnalysisResult gapAnalysis;
    AssumptionAnalysis assumptionAnalysis;
    Double overallScore;

    @Builder.Default
    List<String> recommendations = List.of();

    @JsonProperty("isValid")
    Boolean valid;
}
