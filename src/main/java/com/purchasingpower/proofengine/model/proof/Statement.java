package com.purchasingpower.proofengine.model.proof;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * A single classified proposition extracted from a proof (an "atom").
 *
 * <p>Created once by the decomposer and never mutated. Dependency inference
 * produces an enriched copy through {@link #toBuilder()}.
 *
 * @since 1.0.0
 */
@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Statement {

    String id;
    String text;
    String latex;
    StatementType type;
    String justification;
    double confidence;

    @JsonProperty("isExplicit")
    @Builder.Default
    boolean explicit = true;

    @Builder.Default
    List<String> derivedFrom = List.of();

    InferenceRule usedInferenceRule;
    SourceLocation sourceLocation;

    @JsonIgnore
    public boolean isFoundational() {
        return type != null && type.isFoundational();
    }

    public boolean hasDerivation() {
        return derivedFrom != null && !derivedFrom.isEmpty();
    }
}
