package com.purchasingpower.proofengine.model.proof;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

/**
 * Directed derivation edge: {@code to} is derived using {@code from}.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DependencyEdge {
    String from;
    String to;

    @Builder.Default
    DependencyType type = DependencyType.LOGICAL;

    @Builder.Default
    double strength = 1.0;

    InferenceRule inferenceRule;
}
