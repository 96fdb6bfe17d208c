package com.purchasingpower.proofengine.service.proof.impl;

import com.purchasingpower.proofengine.configuration.ProofAnalysisProperties;
import com.purchasingpower.proofengine.model.analysis.FallacyWarning;
import com.purchasingpower.proofengine.model.analysis.InconsistencySummary;
import com.purchasingpower.proofengine.model.proof.DependencyGraph;
import com.purchasingpower.proofengine.model.proof.Inconsistency;
import com.purchasingpower.proofengine.model.proof.InconsistencySeverity;
import com.purchasingpower.proofengine.model.proof.InconsistencyType;
import com.purchasingpower.proofengine.model.proof.ProofDecomposition;
import com.purchasingpower.proofengine.model.proof.ProofStep;
import com.purchasingpower.proofengine.model.proof.RigorLevel;
import com.purchasingpower.proofengine.model.proof.Statement;
import com.purchasingpower.proofengine.model.proof.StatementType;
import com.purchasingpower.proofengine.service.graph.DependencyGraphBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Inconsistency Detector Tests")
class InconsistencyDetectorImplTest {

    private ProofAnalysisProperties properties;
    private ProofDecomposerImpl decomposer;
    private InconsistencyDetectorImpl detector;

    @BeforeEach
    void setUp() {
        properties = new ProofAnalysisProperties();
        decomposer = new ProofDecomposerImpl(properties, new AssumptionTrackerImpl());
        detector = new InconsistencyDetectorImpl(properties);
    }

    @Test
    @DisplayName("P and not P is a critical direct contradiction")
    void directContradiction() {
        // When
        List<Inconsistency> found = detector.analyze(
                decompose("Assume P.", "Assume not P.", "Therefore this is a contradiction."));

        // Then
        assertThat(found).hasSize(1);
        Inconsistency contradiction = found.get(0);
        assertThat(contradiction.getId()).isEqualTo("inc-1");
        assertThat(contradiction.getType()).isEqualTo(InconsistencyType.DIRECT_CONTRADICTION);
        assertThat(contradiction.getSeverity()).isEqualTo(InconsistencySeverity.CRITICAL);
        assertThat(contradiction.getInvolvedStatements()).containsExactly("stmt-1", "stmt-2");

        InconsistencySummary summary = detector.getSummary(found);
        assertThat(summary.isConsistent()).isFalse();
        assertThat(summary.getCriticalCount()).isEqualTo(1);
        assertThat(summary.getSummary()).isEqualTo("CRITICAL: 1 critical inconsistencies found. The proof is invalid.");
    }

    @Test
    @DisplayName("Opposite sign claims about one variable contradict")
    void polarityContradiction() {
        // When
        List<Inconsistency> found = detector.analyze(decompose("Assume x > 0.", "Then x <= 0."));

        // Then
        assertThat(found).singleElement().satisfies(inconsistency -> {
            assertThat(inconsistency.getType()).isEqualTo(InconsistencyType.DIRECT_CONTRADICTION);
            assertThat(inconsistency.getExplanation())
                    .isEqualTo("Positive and non-positive contradiction: \"x\" has conflicting properties");
        });
    }

    @Test
    @DisplayName("Pairwise search is capped by the comparison budget")
    void pairwiseCap() {
        // Given
        properties.getInconsistency().setMaxPairwiseComparisons(1);

        // When
        List<Inconsistency> found = detector.analyze(decompose("Assume P.", "Assume not P."));

        // Then
        assertThat(found).isEmpty();
    }

    @Test
    @DisplayName("Incompatible type declarations are a mismatch unless typing is lenient")
    void typeMismatch() {
        // Given
        ProofDecomposition decomposition = decompose("Let n be an integer.", "Then n is a matrix.");

        // When
        List<Inconsistency> strict = detector.analyze(decomposition);
        properties.getInconsistency().setStrictTyping(false);
        List<Inconsistency> lenient = detector.analyze(decomposition);

        // Then
        assertThat(strict).singleElement().satisfies(inconsistency -> {
            assertThat(inconsistency.getType()).isEqualTo(InconsistencyType.TYPE_MISMATCH);
            assertThat(inconsistency.getSeverity()).isEqualTo(InconsistencySeverity.ERROR);
            assertThat(inconsistency.getExplanation())
                    .isEqualTo("Variable \"n\" is declared as both \"integer\" and \"matrix\"");
        });
        assertThat(lenient).isEmpty();
    }

    @Test
    @DisplayName("Subtypes are compatible with their supertypes")
    void compatibleTypes() {
        assertThat(InconsistencyDetectorImpl.areTypesCompatible("natural", "integer")).isTrue();
        assertThat(InconsistencyDetectorImpl.areTypesCompatible("Real", "rational")).isTrue();
        assertThat(InconsistencyDetectorImpl.areTypesCompatible("integer", "matrix")).isFalse();
    }

    @Test
    @DisplayName("Operations outside their domain are reported")
    void domainViolations() {
        // When
        List<Inconsistency> found = detector.analyze(
                decompose("sqrt(-4) = 2i", "y = x/0", "arcsin(2) = t", "arcsin(0.5) = s"));

        // Then
        List<String> explanations = found.stream()
                .filter(i -> i.getType() == InconsistencyType.DOMAIN_VIOLATION)
                .map(Inconsistency::getExplanation)
                .collect(Collectors.toList());
        assertThat(explanations).containsExactly(
                "Square root of negative number in \"sqrt(-4) = 2i\"",
                "Division by zero in \"y = x/0\"",
                "Arcsin of value outside [-1, 1] in \"arcsin(2) = t\"");
    }

    @Test
    @DisplayName("Indeterminate forms are undefined operations")
    void undefinedOperation() {
        // When
        List<Inconsistency> found = detector.analyze(decompose("0/0 = 1"));

        // Then
        assertThat(found).filteredOn(i -> i.getType() == InconsistencyType.UNDEFINED_OPERATION)
                .singleElement()
                .satisfies(inconsistency -> {
                    assertThat(inconsistency.getSeverity()).isEqualTo(InconsistencySeverity.CRITICAL);
                    assertThat(inconsistency.getExplanation())
                            .isEqualTo("Undefined operation: 0/0 - indeterminate form");
                });
    }

    @Test
    @DisplayName("Axioms asserting and denying the same universal predicate may conflict")
    void axiomConflict() {
        // When
        List<Inconsistency> found = detector.analyze(
                decompose("Axiom: For all x, x is bounded.", "Axiom: For all x, x is not bounded."));

        // Then
        assertThat(found).singleElement().satisfies(inconsistency -> {
            assertThat(inconsistency.getType()).isEqualTo(InconsistencyType.AXIOM_CONFLICT);
            assertThat(inconsistency.getSeverity()).isEqualTo(InconsistencySeverity.WARNING);
        });
        InconsistencySummary summary = detector.getSummary(found);
        assertThat(summary.isConsistent()).isTrue();
        assertThat(summary.getSummary()).isEqualTo("WARNING: 1 potential issues found. Review recommended.");
    }

    @Test
    @DisplayName("Bound variable used by an unrelated statement is out of scope")
    void quantifierScope() {
        // Given
        Statement binder = statement("q1", "For all x, x^2 >= 0");
        Statement outside = statement("q2", "x > 5");

        // When
        List<Inconsistency> unrelated = detector.analyze(decompositionOf(List.of(binder, outside), false));
        List<Inconsistency> linked = detector.analyze(decompositionOf(List.of(binder, outside), true));

        // Then
        assertThat(unrelated).singleElement().satisfies(inconsistency -> {
            assertThat(inconsistency.getType()).isEqualTo(InconsistencyType.QUANTIFIER_ERROR);
            assertThat(inconsistency.getInvolvedStatements()).containsExactly("q1", "q2");
            assertThat(inconsistency.getExplanation()).isEqualTo("Variable \"x\" used outside its quantifier scope");
        });
        assertThat(linked).isEmpty();
    }

    @Test
    @DisplayName("Syntactic negation covers the supported phrasings")
    void syntacticNegation() {
        assertThat(InconsistencyDetectorImpl.isSyntacticNegation("P", "not P")).isTrue();
        assertThat(InconsistencyDetectorImpl.isSyntacticNegation("¬Q", "Q")).isTrue();
        assertThat(InconsistencyDetectorImpl.isSyntacticNegation("The claim holds.", "the claim does not hold.")).isTrue();
        assertThat(InconsistencyDetectorImpl.isSyntacticNegation("It is true that x > 1", "it is false that x > 1"))
                .isTrue();
        assertThat(InconsistencyDetectorImpl.isSyntacticNegation("x > 1", "x < 1")).isFalse();
    }

    @Test
    @DisplayName("Summary of an empty list is consistent")
    void emptySummary() {
        // When
        InconsistencySummary summary = detector.getSummary(List.of());

        // Then
        assertThat(summary.isConsistent()).isTrue();
        assertThat(summary.getSummary()).isEqualTo("No inconsistencies detected. The proof appears to be consistent.");
    }

    @Test
    @DisplayName("Fallacies are reported per statement or across the whole proof")
    void fallacies() {
        // Given
        ProofDecomposition decomposition = decomposer.decompose(
                "We checked n = 1, 2, 3. Therefore for all n the identity holds. Hence ∞ - ∞ = 0.", null);

        // When
        List<FallacyWarning> warnings = detector.detectFallacies(decomposition);

        // Then
        assertThat(warnings).extracting(FallacyWarning::getPatternId)
                .contains("hasty_generalization", "infinity_arithmetic");
        assertThat(warnings).filteredOn(w -> w.getPatternId().equals("hasty_generalization"))
                .singleElement()
                .satisfies(w -> assertThat(w.getStatementId()).isNull());
        assertThat(warnings).filteredOn(w -> w.getPatternId().equals("infinity_arithmetic"))
                .singleElement()
                .satisfies(w -> {
                    assertThat(w.getStatementId()).isEqualTo("stmt-3");
                    assertThat(w.getSeverity()).isEqualTo("critical");
                });
    }

    private ProofDecomposition decompose(String... statements) {
        List<ProofStep> steps = new ArrayList<>();
        for (int i = 0; i < statements.length; i++) {
            steps.add(ProofStep.of(i + 1, statements[i]));
        }
        return decomposer.decompose(steps, null);
    }

    private static Statement statement(String id, String text) {
        return Statement.builder()
                .id(id)
                .text(text)
                .type(StatementType.DERIVED)
                .confidence(0.8)
                .build();
    }

    private static ProofDecomposition decompositionOf(List<Statement> atoms, boolean chained) {
        DependencyGraphBuilder builder = new DependencyGraphBuilder();
        atoms.forEach(builder::addStatement);
        if (chained) {
            for (int i = 1; i < atoms.size(); i++) {
                builder.addDependency(atoms.get(i - 1).getId(), atoms.get(i).getId());
            }
        }
        DependencyGraph graph = builder.build();
        return ProofDecomposition.builder()
                .id("test")
                .originalProof("")
                .atoms(atoms)
                .dependencies(graph)
                .assumptionChains(List.of())
                .gaps(List.of())
                .implicitAssumptions(List.of())
                .rigorLevel(RigorLevel.INFORMAL)
                .atomCount(atoms.size())
                .build();
    }
}
