package com.purchasingpower.proofengine.service.proof;

import com.purchasingpower.proofengine.model.proof.Gap;
import com.purchasingpower.proofengine.model.proof.Statement;

import java.util.List;

/**
 * Completeness score shared by the decomposer and the gap analyzer.
 *
 * <p>Starts at 1, subtracts each gap's severity penalty, then blends 70/30 with
 * the fraction of atoms that are foundational or have a derivation. Clamped to
 * [0, 1]; a proof with no atoms scores 0.
 */
public final class CompletenessCalculator {

    private CompletenessCalculator() {
    }

    public static double compute(List<Statement> atoms, List<Gap> gaps) {
        if (atoms.isEmpty()) {
            return 0;
        }

        double score = 1.0;
        for (Gap gap : gaps) {
            score -= gap.getSeverity().getPenalty();
        }

        long justified = atoms.stream()
                .filter(a -> a.isFoundational() || a.hasDerivation())
                .count();
        double justificationScore = (double) justified / atoms.size();

        score = score * 0.7 + justificationScore * 0.3;
        return Math.max(0, Math.min(1, score));
    }
}
