package com.purchasingpower.proofengine.service.proof;

import com.purchasingpower.proofengine.model.analysis.DecompositionMetrics;
import com.purchasingpower.proofengine.model.proof.ProofDecomposition;
import com.purchasingpower.proofengine.model.proof.ProofInput;
import com.purchasingpower.proofengine.model.proof.ProofStep;
import com.purchasingpower.proofengine.model.proof.Statement;

import java.util.List;

/**
 * Splits a proof into typed atomic statements and wires their dependencies.
 *
 * <p>Prose is segmented at sentence ends and line breaks; structured steps are
 * taken as given. Each step is classified by an ordered rule list, then
 * dependencies are inferred from citation phrasing (or taken from the step's
 * explicit references), falling back to the nearest earlier non-conclusion.
 * The result carries a first completeness and rigor estimate.
 *
 * <p>Never throws on bad proof text: empty input yields a decomposition with
 * no atoms and zero completeness.
 *
 * @since 1.0.0
 */
public interface ProofDecomposer {

    /**
     * Decomposes a proof under the given work budget.
     *
     * @param proof   prose or structured steps
     * @param theorem statement being proved, may be null
     * @param budget  shared work limit; parsing stops early once it runs out
     * @return immutable decomposition
     */
    ProofDecomposition decompose(ProofInput proof, String theorem, AnalysisBudget budget);

    /**
     * Decomposes a proof with a budget taken from configuration.
     */
    ProofDecomposition decompose(ProofInput proof, String theorem);

    default ProofDecomposition decompose(String proof, String theorem) {
        return decompose(ProofInput.text(proof), theorem);
    }

    default ProofDecomposition decompose(List<ProofStep> steps, String theorem) {
        return decompose(ProofInput.steps(steps), theorem);
    }

    /**
     * Classifies steps into statements without inferring dependencies.
     *
     * @return one statement per non-blank step, ids {@code stmt-1}, {@code stmt-2}, ...
     */
    List<Statement> extractStatements(List<ProofStep> steps);

    /**
     * Size and shape figures for a decomposition.
     */
    DecompositionMetrics computeMetrics(ProofDecomposition decomposition);
}
