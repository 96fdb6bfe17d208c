package com.purchasingpower.proofengine.service.proof.impl;

import com.purchasingpower.proofengine.configuration.ProofAnalysisProperties;
import com.purchasingpower.proofengine.model.analysis.DecompositionMetrics;
import com.purchasingpower.proofengine.model.proof.AssumptionChain;
import com.purchasingpower.proofengine.model.proof.GapType;
import com.purchasingpower.proofengine.model.proof.ImplicitAssumption;
import com.purchasingpower.proofengine.model.proof.ImplicitAssumptionType;
import com.purchasingpower.proofengine.model.proof.InferenceRule;
import com.purchasingpower.proofengine.model.proof.ProofDecomposition;
import com.purchasingpower.proofengine.model.proof.ProofInput;
import com.purchasingpower.proofengine.model.proof.ProofStep;
import com.purchasingpower.proofengine.model.proof.RigorLevel;
import com.purchasingpower.proofengine.model.proof.Severity;
import com.purchasingpower.proofengine.model.proof.Statement;
import com.purchasingpower.proofengine.model.proof.StatementType;
import com.purchasingpower.proofengine.service.proof.AnalysisBudget;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.offset;

@DisplayName("Proof Decomposer Tests")
class ProofDecomposerImplTest {

    private ProofDecomposerImpl decomposer;

    @BeforeEach
    void setUp() {
        decomposer = new ProofDecomposerImpl(new ProofAnalysisProperties(), new AssumptionTrackerImpl());
    }

    @Test
    @DisplayName("Axiom followed by a conclusion forms a complete two-node chain")
    void axiomThenConclusion() {
        // Given
        List<String> steps = List.of("Axiom: x > 0.", "Therefore x >= 0.");

        // When
        ProofDecomposition decomposition = decomposer.decompose(steps(steps), null);

        // Then
        assertThat(decomposition.getAtoms()).extracting(Statement::getType)
                .containsExactly(StatementType.AXIOM, StatementType.CONCLUSION);
        Statement conclusion = decomposition.getAtoms().get(1);
        assertThat(conclusion.getId()).isEqualTo("stmt-2");
        assertThat(conclusion.getText()).isEqualTo("x >= 0.");
        assertThat(conclusion.getDerivedFrom()).containsExactly("stmt-1");
        assertThat(conclusion.getUsedInferenceRule()).isEqualTo(InferenceRule.DIRECT_IMPLICATION);

        assertThat(decomposition.getGaps()).isEmpty();
        assertThat(decomposition.getCompleteness()).isEqualTo(1.0, offset(1e-9));
        assertThat(decomposition.getRigorLevel()).isEqualTo(RigorLevel.RIGOROUS);
        assertThat(decomposition.getDependencies().getEdges()).hasSize(1);
        assertThat(decomposition.getMaxDependencyDepth()).isEqualTo(2);

        assertThat(decomposition.getAssumptionChains()).hasSize(1);
        AssumptionChain chain = decomposition.getAssumptionChains().get(0);
        assertThat(chain.getConclusion()).isEqualTo("stmt-2");
        assertThat(chain.getAssumptions()).containsExactly("stmt-1");
        assertThat(chain.isAllAssumptionsExplicit()).isTrue();
    }

    @Test
    @DisplayName("Chain of steps each citing the previous one is a single path")
    void linearChain() {
        // Given
        int length = 5;
        List<ProofStep> steps = new ArrayList<>();
        steps.add(ProofStep.of(1, "Axiom: v1 > 0."));
        for (int i = 2; i < length; i++) {
            steps.add(ProofStep.builder().stepNumber(i)
                    .statement("v" + i + " = v" + (i - 1) + " + 1.")
                    .referencesSteps(List.of(i - 1)).build());
        }
        steps.add(ProofStep.builder().stepNumber(length)
                .statement("Therefore v" + (length - 1) + " > 3.")
                .referencesSteps(List.of(length - 1)).build());

        // When
        ProofDecomposition decomposition = decomposer.decompose(ProofInput.steps(steps), null);

        // Then
        assertThat(decomposition.getAtomCount()).isEqualTo(length);
        assertThat(decomposition.getDependencies().getDepth()).isEqualTo(length);
        assertThat(decomposition.getMaxDependencyDepth()).isEqualTo(length);
        assertThat(decomposition.getDependencies().getWidth()).isEqualTo(1);
        assertThat(decomposition.getDependencies().isHasCycles()).isFalse();
        assertThat(decomposition.getDependencies().getTopologicalOrder())
                .containsExactly("stmt-1", "stmt-2", "stmt-3", "stmt-4", "stmt-5");
        assertThat(decomposition.getGaps()).noneMatch(gap -> gap.getType() == GapType.UNJUSTIFIED_LEAP);
    }

    @Test
    @DisplayName("Prose is split into sentences and classified by leading keyword")
    void textIsSplitIntoSentences() {
        // Given
        String proof = "Assume n is an odd integer. Then n = 2k + 1 for some integer k.\n"
                + "Therefore n squared is odd.";

        // When
        ProofDecomposition decomposition = decomposer.decompose(proof, "Odd squares are odd");

        // Then
        assertThat(decomposition.getAtomCount()).isEqualTo(3);
        assertThat(decomposition.getAtoms()).extracting(Statement::getType)
                .containsExactly(StatementType.HYPOTHESIS, StatementType.DERIVED, StatementType.CONCLUSION);
        assertThat(decomposition.getAtoms().get(0).getText()).isEqualTo("n is an odd integer.");
        assertThat(decomposition.getAtoms().get(2).getDerivedFrom()).containsExactly("stmt-2");
        assertThat(decomposition.getOriginalProof()).isEqualTo(proof);
        assertThat(decomposition.getTheorem()).isEqualTo("Odd squares are odd");
    }

    @Test
    @DisplayName("Explicit step references take precedence over the nearest premise")
    void explicitReferences() {
        // Given
        List<ProofStep> steps = List.of(
                ProofStep.of(1, "Assume a > 0."),
                ProofStep.of(2, "Assume b > 0."),
                ProofStep.builder().stepNumber(3).statement("a + b > 0.")
                        .referencesSteps(List.of(1, 2)).build());

        // When
        ProofDecomposition decomposition = decomposer.decompose(ProofInput.steps(steps), null);

        // Then
        assertThat(decomposition.getAtoms().get(2).getDerivedFrom()).containsExactly("stmt-1", "stmt-2");
        assertThat(decomposition.getDependencies().dependenciesOf("stmt-3"))
                .containsExactlyInAnyOrder("stmt-1", "stmt-2");
        assertThat(decomposition.getDependencies().getRoots()).containsExactly("stmt-1", "stmt-2");
    }

    @Test
    @DisplayName("Conclusion with nothing before it is a critical unjustified leap")
    void unjustifiedConclusion() {
        // When
        ProofDecomposition decomposition = decomposer.decompose(steps(List.of("Therefore P holds.")), null);

        // Then
        assertThat(decomposition.getGaps()).hasSize(1);
        assertThat(decomposition.getGaps().get(0).getType()).isEqualTo(GapType.UNJUSTIFIED_LEAP);
        assertThat(decomposition.getGaps().get(0).getSeverity()).isEqualTo(Severity.CRITICAL);
        assertThat(decomposition.getGaps().get(0).getLocation().getTo()).isEqualTo("stmt-1");
        assertThat(decomposition.getCompleteness()).isEqualTo(0.525, offset(1e-9));
        assertThat(decomposition.getRigorLevel()).isEqualTo(RigorLevel.INFORMAL);
        assertThat(decomposition.getAssumptionChains().get(0).isAllAssumptionsExplicit()).isFalse();
    }

    @Test
    @DisplayName("Division by an unconstrained variable records a domain assumption")
    void divisionNeedsNonZeroDivisor() {
        // When
        ProofDecomposition decomposition = decomposer.decompose(steps(List.of("1/x > 0.")), null);

        // Then
        assertThat(decomposition.getImplicitAssumptions()).hasSize(1);
        ImplicitAssumption assumption = decomposition.getImplicitAssumptions().get(0);
        assertThat(assumption.getType()).isEqualTo(ImplicitAssumptionType.DOMAIN_ASSUMPTION);
        assertThat(assumption.getStatement()).isEqualTo("Division operation implies non-zero divisor");
        assertThat(assumption.getSuggestedFormulation()).isEqualTo("State that x is non-zero");
        assertThat(assumption.getUsedInStep()).isEqualTo("stmt-1");
    }

    @Test
    @DisplayName("Division is not flagged when the proof states the divisor is positive")
    void divisionWithStatedConstraint() {
        // When
        ProofDecomposition decomposition = decomposer.decompose(
                steps(List.of("Assume x > 0.", "Then 1/x > 0.")), null);

        // Then
        assertThat(decomposition.getImplicitAssumptions()).isEmpty();
    }

    @Test
    @DisplayName("Hedge words and quantifiers surface as implicit assumptions")
    void hedgesAndQuantifiers() {
        // When
        ProofDecomposition decomposition = decomposer.decompose(steps(List.of(
                "Assume f is continuous on [a, b].",
                "Clearly f attains a maximum.")), null);

        // Then
        assertThat(decomposition.getImplicitAssumptions()).extracting(ImplicitAssumption::getType)
                .containsExactly(ImplicitAssumptionType.CONTINUITY_ASSUMPTION,
                        ImplicitAssumptionType.EXISTENCE_ASSUMPTION);
        assertThat(decomposition.getImplicitAssumptions()).extracting(ImplicitAssumption::getId)
                .containsExactly("impl-1", "impl-2");
    }

    @Test
    @DisplayName("Same input decomposes to an equal value")
    void decompositionIsDeterministic() {
        // Given
        String proof = "Let n be an integer. Assume n > 2. Therefore n > 1.";

        // When
        ProofDecomposition first = decomposer.decompose(proof, "n > 1");
        ProofDecomposition second = decomposer.decompose(proof, "n > 1");

        // Then
        assertThat(first).isEqualTo(second);
        assertThat(first.getId()).isEqualTo(second.getId());
        assertThat(decomposer.decompose(proof, "other").getId()).isNotEqualTo(first.getId());
    }

    @Test
    @DisplayName("Blank input yields an empty decomposition")
    void blankInput() {
        // When
        ProofDecomposition decomposition = decomposer.decompose(ProofInput.text("   "), null);

        // Then
        assertThat(decomposition.getAtoms()).isEmpty();
        assertThat(decomposition.getGaps()).isEmpty();
        assertThat(decomposition.getCompleteness()).isZero();
        assertThat(decomposition.getDependencies().getRoots()).isEmpty();
    }

    @Test
    @DisplayName("Blank steps are dropped and missing step numbers filled by position")
    void blankStepsAreNormalized() {
        // Given
        List<ProofStep> steps = List.of(
                ProofStep.builder().statement("Assume y > 1.").build(),
                ProofStep.builder().statement("  ").build(),
                ProofStep.builder().statement("Hence y > 0.").build());

        // When
        List<Statement> statements = decomposer.extractStatements(steps);

        // Then
        assertThat(statements).hasSize(2);
        assertThat(statements.get(0).getSourceLocation().getStepNumber()).isEqualTo(1);
        assertThat(statements.get(1).getSourceLocation().getStepNumber()).isEqualTo(3);
    }

    @Test
    @DisplayName("Cited derivation keeps its citation as the justification")
    void citedDerivation() {
        // When
        List<Statement> statements = decomposer.extractStatements(
                List.of(ProofStep.of(1, "By Lemma 1, we have x > 1")));

        // Then
        Statement statement = statements.get(0);
        assertThat(statement.getType()).isEqualTo(StatementType.DERIVED);
        assertThat(statement.getText()).isEqualTo("x > 1");
        assertThat(statement.getJustification()).isEqualTo("Lemma 1");
        assertThat(statement.getConfidence()).isEqualTo(0.9, offset(1e-9));
    }

    @Test
    @DisplayName("Exhausted budget stops decomposition without failing")
    void budgetExhaustion() {
        // Given
        AnalysisBudget budget = new AnalysisBudget(1, Duration.ofSeconds(5));

        // When
        ProofDecomposition decomposition = decomposer.decompose(
                ProofInput.text("Assume a > 0. Assume b > 0. Therefore a + b > 0."), null, budget);

        // Then
        assertThat(budget.isExhausted()).isTrue();
        assertThat(budget.getExhaustedIn()).isEqualTo("decomposition");
        assertThat(decomposition.getAtomCount()).isLessThan(3);
    }

    @Test
    @DisplayName("Metrics summarize the decomposition")
    void metrics() {
        // Given
        ProofDecomposition decomposition = decomposer.decompose(
                steps(List.of("Assume a > 0.", "Assume b > 0.", "Therefore a + b > 0.")), null);

        // When
        DecompositionMetrics metrics = decomposer.computeMetrics(decomposition);

        // Then
        assertThat(metrics.getAtomCount()).isEqualTo(3);
        assertThat(metrics.getRootCount()).isEqualTo(2);
        assertThat(metrics.getLeafCount()).isEqualTo(2);
        assertThat(metrics.getAvgDependencies()).isEqualTo(1.0 / 3, offset(1e-9));
        assertThat(metrics.getGapCount()).isZero();
    }

    private static List<ProofStep> steps(List<String> statements) {
        List<ProofStep> steps = new ArrayList<>();
        for (int i = 0; i < statements.size(); i++) {
            steps.add(ProofStep.of(i + 1, statements.get(i)));
        }
        return steps;
    }
}
