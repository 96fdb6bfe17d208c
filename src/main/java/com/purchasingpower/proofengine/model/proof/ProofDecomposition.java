package com.purchasingpower.proofengine.model.proof;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Optional;

/**
 * Result of splitting a proof into atoms and wiring their dependencies.
 *
 * <p>Immutable; every later analysis pass reads it without changing it.
 *
 * @since 1.0.0
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ProofDecomposition {
    String id;
    String originalProof;
    String theorem;
    List<Statement> atoms;
    DependencyGraph dependencies;
    List<AssumptionChain> assumptionChains;
    List<Gap> gaps;
    List<ImplicitAssumption> implicitAssumptions;
    double completeness;
    RigorLevel rigorLevel;
    int atomCount;
    int maxDependencyDepth;

    public Optional<Statement> findAtom(String id) {
        return atoms.stream().filter(a -> a.getId().equals(id)).findFirst();
    }
}
