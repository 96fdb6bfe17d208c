package com.purchasingpower.proofengine.model.analysis;

import com.purchasingpower.proofengine.model.proof.CircularPath;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Circularity findings. Tautologies are reported but do not count as circular reasoning.
 */
@Value
@Builder
public class CircularReasoningResult {
    boolean hasCircularReasoning;
    List<CircularPath> cycles;
    List<String> selfReferentialStatements;
    List<String> beggingTheQuestion;
    List<String> tautologies;
    String summary;
}
