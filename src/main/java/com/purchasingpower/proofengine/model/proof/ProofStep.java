package com.purchasingpower.proofengine.model.proof;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * One step of a structured proof as submitted by a caller.
 *
 * <p>{@code referencesSteps} holds 1-based step numbers this step is derived from.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ProofStep {
    private int stepNumber;
    private String statement;
    private String justification;
    private String latex;

    @Builder.Default
    private List<Integer> referencesSteps = new ArrayList<>();

    public static ProofStep of(int stepNumber, String statement) {
        return ProofStep.builder().stepNumber(stepNumber).statement(statement).build();
    }
}
