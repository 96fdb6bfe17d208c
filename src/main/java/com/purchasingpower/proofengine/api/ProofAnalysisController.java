package com.purchasingpower.proofengine.api;

import com.purchasingpower.proofengine.exception.StatementNotFoundException;
import com.purchasingpower.proofengine.model.analysis.EngineStats;
import com.purchasingpower.proofengine.model.analysis.ProofAnalysisResult;
import com.purchasingpower.proofengine.model.analysis.ThoughtType;
import com.purchasingpower.proofengine.model.proof.ProofInput;
import com.purchasingpower.proofengine.service.proof.MathematicsReasoningEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for proof analysis.
 *
 * @since 1.0.0
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/proofs")
@RequiredArgsConstructor
public class ProofAnalysisController {

    private final MathematicsReasoningEngine engine;

    /**
     * Analyze a proof, optionally narrowed to one thought type.
     *
     * POST /api/v1/proofs/analyze
     */
    @PostMapping("/analyze")
    public ResponseEntity<ProofAnalysisResponse> analyze(@RequestBody ProofAnalysisRequest request) {
        try {
            String problem = validate(request);
            if (problem != null) {
                return ResponseEntity.badRequest().body(ProofAnalysisResponse.error(problem));
            }

            ThoughtType thoughtType = ThoughtType.fromValue(request.getThoughtType());
            log.info("Analyze proof: thoughtType={}, structured={}", thoughtType.getValue(), hasSteps(request));

            ProofAnalysisResult result = engine.analyzeForThoughtType(toInput(request), thoughtType,
                    request.getTheorem());
            return ResponseEntity.ok(ProofAnalysisResponse.success(result));

        } catch (StatementNotFoundException | IllegalArgumentException e) {
            log.warn("Rejected proof analysis request: {}", e.getMessage());
            return ResponseEntity.badRequest().body(ProofAnalysisResponse.error(e.getMessage()));
        } catch (Exception e) {
            log.error("Proof analysis failed", e);
            return ResponseEntity.internalServerError()
                .body(ProofAnalysisResponse.error("Analysis failed: " + e.getMessage()));
        }
    }

    /**
     * Full analysis plus a Markdown report.
     *
     * POST /api/v1/proofs/report
     */
    @PostMapping("/report")
    public ResponseEntity<ProofAnalysisResponse> report(@RequestBody ProofAnalysisRequest request) {
        try {
            String problem = validate(request);
            if (problem != null) {
                return ResponseEntity.badRequest().body(ProofAnalysisResponse.error(problem));
            }

            ProofAnalysisResult result = engine.analyzeProof(toInput(request), request.getTheorem());
            return ResponseEntity.ok(ProofAnalysisResponse.success(result, engine.generateReport(result)));

        } catch (StatementNotFoundException | IllegalArgumentException e) {
            log.warn("Rejected proof report request: {}", e.getMessage());
            return ResponseEntity.badRequest().body(ProofAnalysisResponse.error(e.getMessage()));
        } catch (Exception e) {
            log.error("Proof report failed", e);
            return ResponseEntity.internalServerError()
                .body(ProofAnalysisResponse.error("Report failed: " + e.getMessage()));
        }
    }

    /**
     * Enabled analysis passes and engine version.
     *
     * GET /api/v1/proofs/stats
     */
    @GetMapping("/stats")
    public ResponseEntity<EngineStats> stats() {
        return ResponseEntity.ok(engine.getStats());
    }

    private String validate(ProofAnalysisRequest request) {
        if (request == null) {
            return "Request body is required";
        }
        boolean hasText = request.getProof() != null && !request.getProof().isBlank();
        if (!hasText && !hasSteps(request)) {
            return "Either proof text or steps are required";
        }
        if (hasText && hasSteps(request)) {
            return "Provide either proof text or steps, not both";
        }
        return null;
    }

    private boolean hasSteps(ProofAnalysisRequest request) {
        return request.getSteps() != null && !request.getSteps().isEmpty();
    }

    private ProofInput toInput(ProofAnalysisRequest request) {
        return hasSteps(request) ? ProofInput.steps(request.getSteps()) : ProofInput.text(request.getProof());
    }
}
