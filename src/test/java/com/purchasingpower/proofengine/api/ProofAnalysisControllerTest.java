package com.purchasingpower.proofengine.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.proofengine.model.proof.ProofStep;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Integration tests for ProofAnalysisController.
 *
 * Runs the full context so analysis passes go through the shared executor.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class ProofAnalysisControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Test
    void analyzeStructuredProof_shouldReturnValidVerdict() throws Exception {
        // Given
        ProofAnalysisRequest request = ProofAnalysisRequest.builder()
                .steps(List.of(ProofStep.of(1, "Axiom: x > 0."), ProofStep.of(2, "Therefore x >= 0.")))
                .build();

        // When / Then
        mockMvc.perform(post("/api/v1/proofs/analyze")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(request)))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.success").value(true))
            .andExpect(jsonPath("$.analysis.isValid").value(true))
            .andExpect(jsonPath("$.analysis.overallScore").value(1.0))
            .andExpect(jsonPath("$.analysis.decomposition.atomCount").value(2))
            .andExpect(jsonPath("$.error").doesNotExist());
    }

    @Test
    void analyzeContradiction_shouldReportCriticalInconsistency() throws Exception {
        // Given
        ProofAnalysisRequest request = ProofAnalysisRequest.builder()
                .steps(List.of(
                        ProofStep.of(1, "Assume P."),
                        ProofStep.of(2, "Assume not P."),
                        ProofStep.of(3, "Therefore this is a contradiction.")))
                .build();

        // When / Then
        mockMvc.perform(post("/api/v1/proofs/analyze")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(request)))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.analysis.isValid").value(false))
            .andExpect(jsonPath("$.analysis.consistencyReport.consistent").value(false))
            .andExpect(jsonPath("$.analysis.consistencyReport.inconsistencies[0].type").value("direct_contradiction"))
            .andExpect(jsonPath("$.analysis.consistencyReport.inconsistencies[0].severity").value("critical"));
    }

    @Test
    void analyzeWithThoughtType_shouldNarrowTheResult() throws Exception {
        // Given
        ProofAnalysisRequest request = ProofAnalysisRequest.builder()
                .steps(List.of(ProofStep.of(1, "Axiom: x > 0."), ProofStep.of(2, "Therefore x >= 0.")))
                .thoughtType("dependency_analysis")
                .build();

        // When / Then
        mockMvc.perform(post("/api/v1/proofs/analyze")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(request)))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.analysis.recommendations[0]").value("Proof depth: 2"))
            .andExpect(jsonPath("$.analysis.consistencyReport").doesNotExist())
            .andExpect(jsonPath("$.analysis.isValid").doesNotExist());
    }

    @Test
    void analyzeWithoutInput_shouldReturnBadRequest() throws Exception {
        mockMvc.perform(post("/api/v1/proofs/analyze")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.success").value(false))
            .andExpect(jsonPath("$.error").value("Either proof text or steps are required"));
    }

    @Test
    void analyzeWithTextAndSteps_shouldReturnBadRequest() throws Exception {
        // Given
        ProofAnalysisRequest request = ProofAnalysisRequest.builder()
                .proof("Assume P.")
                .steps(List.of(ProofStep.of(1, "Assume P.")))
                .build();

        // When / Then
        mockMvc.perform(post("/api/v1/proofs/analyze")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(request)))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("Provide either proof text or steps, not both"));
    }

    @Test
    void report_shouldReturnMarkdown() throws Exception {
        // Given
        ProofAnalysisRequest request = ProofAnalysisRequest.builder()
                .proof("Assume n is odd. Then n = 2k + 1. Therefore n squared is odd.")
                .theorem("The square of an odd number is odd")
                .build();

        // When
        MvcResult result = mockMvc.perform(post("/api/v1/proofs/report")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(request)))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.success").value(true))
            .andExpect(jsonPath("$.report", containsString("# Proof Analysis Report")))
            .andReturn();

        // Then
        String body = result.getResponse().getContentAsString();
        assertThat(body).contains("## Gap Analysis", "## Recommendations");
    }

    @Test
    void stats_shouldListFeatures() throws Exception {
        mockMvc.perform(get("/api/v1/proofs/stats"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.version").value("1.0.0"))
            .andExpect(jsonPath("$.features.decomposition").value(true))
            .andExpect(jsonPath("$.features.circularDetection").value(true));
    }
}
