package com.purchasingpower.proofengine.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.purchasingpower.proofengine.model.analysis.ProofAnalysisResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Proof analysis response.
 *
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ProofAnalysisResponse {

    private boolean success;
    private String error;
    private ProofAnalysisResult analysis;

    /**
     * Markdown report, only on the report endpoint.
     */
    private String report;

    public static ProofAnalysisResponse success(ProofAnalysisResult analysis) {
        return ProofAnalysisResponse.builder()
            .success(true)
            .analysis(analysis)
            .build();
    }

    public static ProofAnalysisResponse success(ProofAnalysisResult analysis, String report) {
        return ProofAnalysisResponse.builder()
            .success(true)
            .analysis(analysis)
            .report(report)
            .build();
    }

    public static ProofAnalysisResponse error(String error) {
        return ProofAnalysisResponse.builder()
            .success(false)
            .error(error)
            .build();
    }
}
