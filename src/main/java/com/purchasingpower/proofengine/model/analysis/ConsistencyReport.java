package com.purchasingpower.proofengine.model.analysis;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.purchasingpower.proofengine.model.proof.CircularPath;
import com.purchasingpower.proofengine.model.proof.Inconsistency;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Merged verdict of the inconsistency and circular-reasoning passes.
 */
@Value
@Builder
public class ConsistencyReport {

    @JsonProperty("isConsistent")
    boolean consistent;

    double overallScore;
    List<Inconsistency> inconsistencies;
    List<String> warnings;
    List<CircularPath> circularReasoning;

    @Builder.Default
    List<FallacyWarning> fallacyWarnings = List.of();

    String summary;
}
