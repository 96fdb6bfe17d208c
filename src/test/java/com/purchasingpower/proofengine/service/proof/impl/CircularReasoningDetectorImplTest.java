package com.purchasingpower.proofengine.service.proof.impl;

import com.purchasingpower.proofengine.configuration.ProofAnalysisProperties;
import com.purchasingpower.proofengine.model.analysis.CircularReasoningResult;
import com.purchasingpower.proofengine.model.analysis.CycleAnalysis;
import com.purchasingpower.proofengine.model.proof.CircularPath;
import com.purchasingpower.proofengine.model.proof.DependencyEdge;
import com.purchasingpower.proofengine.model.proof.DependencyGraph;
import com.purchasingpower.proofengine.model.proof.ProofDecomposition;
import com.purchasingpower.proofengine.model.proof.ProofStep;
import com.purchasingpower.proofengine.model.proof.Severity;
import com.purchasingpower.proofengine.model.proof.Statement;
import com.purchasingpower.proofengine.model.proof.StatementType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Circular Reasoning Detector Tests")
class CircularReasoningDetectorImplTest {

    private ProofDecomposerImpl decomposer;
    private CircularReasoningDetectorImpl detector;

    @BeforeEach
    void setUp() {
        ProofAnalysisProperties properties = new ProofAnalysisProperties();
        decomposer = new ProofDecomposerImpl(properties, new AssumptionTrackerImpl());
        detector = new CircularReasoningDetectorImpl(properties);
    }

    @Test
    @DisplayName("Mutually referencing steps form one cycle of length two")
    void mutualReferences() {
        // Given
        ProofDecomposition decomposition = decomposer.decompose(List.of(
                step(1, "a > 1", 2),
                step(2, "b > 1", 1)), null);

        // When
        CircularReasoningResult result = detector.detectCircularReasoning(decomposition);

        // Then
        assertThat(result.isHasCircularReasoning()).isTrue();
        assertThat(result.getCycles()).hasSize(1);
        CircularPath cycle = result.getCycles().get(0);
        assertThat(cycle.getCycleLength()).isEqualTo(2);
        assertThat(cycle.getStatements()).containsExactly("stmt-1", "stmt-2");
        assertThat(cycle.getSeverity()).isEqualTo(Severity.MINOR);
        assertThat(cycle.getVisualPath()).isEqualTo("stmt-1 → stmt-2 → stmt-1");
        assertThat(cycle.getExplanation()).startsWith("Circular reasoning detected: a > 1... depends on b > 1...");
        assertThat(result.getSummary()).isEqualTo("1 circular reasoning cycle(s) detected.");
    }

    @Test
    @DisplayName("Cycle through a conclusion is critical")
    void cycleThroughConclusion() {
        // Given
        ProofDecomposition decomposition = decomposer.decompose(List.of(
                step(1, "x > 1", 2),
                step(2, "Therefore x > 0", 1)), null);

        // When
        CircularReasoningResult result = detector.detectCircularReasoning(decomposition);

        // Then
        assertThat(result.getCycles()).singleElement()
                .satisfies(cycle -> assertThat(cycle.getSeverity()).isEqualTo(Severity.CRITICAL));
        assertThat(result.getSummary()).isEqualTo("CRITICAL: 1 circular reasoning cycle(s) involving conclusions.");
        assertThat(detector.conclusionDependsOnItself("stmt-2", decomposition.getDependencies())).isTrue();
    }

    @Test
    @DisplayName("Conclusion restating the hypothesis begs the question")
    void beggingTheQuestion() {
        // Given
        ProofDecomposition decomposition = decomposer.decompose(
                List.of(ProofStep.of(1, "Assume x is even."), ProofStep.of(2, "Therefore x is even.")), null);

        // When
        CircularReasoningResult result = detector.detectCircularReasoning(decomposition);

        // Then
        assertThat(result.isHasCircularReasoning()).isTrue();
        assertThat(result.getCycles()).isEmpty();
        assertThat(result.getBeggingTheQuestion()).containsExactly("stmt-2");
        assertThat(result.getSummary()).isEqualTo("1 instance(s) of begging the question.");
    }

    @Test
    @DisplayName("Self-loop is self-referential rather than a cycle")
    void selfLoop() {
        // Given
        ProofDecomposition decomposition = decomposer.decompose(List.of(step(1, "n is prime", 1)), null);

        // When
        CircularReasoningResult result = detector.detectCircularReasoning(decomposition);

        // Then
        assertThat(decomposition.getDependencies().isHasCycles()).isTrue();
        assertThat(result.getCycles()).isEmpty();
        assertThat(result.getSelfReferentialStatements()).containsExactly("stmt-1");
        assertThat(result.isHasCircularReasoning()).isTrue();
    }

    @Test
    @DisplayName("Self-describing wording is self-referential")
    void selfReferentialWording() {
        // Given
        Statement statement = Statement.builder()
                .id("s1")
                .text("This statement is true")
                .type(StatementType.DERIVED)
                .confidence(0.8)
                .build();

        // When / Then
        assertThat(detector.isSelfReferential(statement)).isTrue();
    }

    @Test
    @DisplayName("Tautologies are listed but are not circular")
    void tautology() {
        // Given
        ProofDecomposition decomposition = decomposer.decompose(List.of(ProofStep.of(1, "Either P or P.")), null);

        // When
        CircularReasoningResult result = detector.detectCircularReasoning(decomposition);

        // Then
        assertThat(result.getTautologies()).containsExactly("stmt-1");
        assertThat(result.isHasCircularReasoning()).isFalse();
        assertThat(result.getSummary()).isEqualTo("1 tautological statement(s) (may be intentional).");
    }

    @Test
    @DisplayName("Sound proof reports nothing")
    void soundProof() {
        // Given
        ProofDecomposition decomposition = decomposer.decompose(
                List.of(ProofStep.of(1, "Axiom: x > 0."), ProofStep.of(2, "Therefore x >= 0.")), null);

        // When
        CircularReasoningResult result = detector.detectCircularReasoning(decomposition);

        // Then
        assertThat(result.isHasCircularReasoning()).isFalse();
        assertThat(result.getSummary()).isEqualTo("No circular reasoning detected. The proof structure appears sound.");
    }

    @Test
    @DisplayName("Depth-first search finds cycles when no component list is available")
    void depthFirstFallback() {
        // Given
        Map<String, Statement> nodes = new LinkedHashMap<>();
        nodes.put("p", derived("p", "P", "q"));
        nodes.put("q", derived("q", "Q", "p"));
        DependencyGraph graph = DependencyGraph.builder()
                .nodes(nodes)
                .edges(List.of(
                        DependencyEdge.builder().from("q").to("p").build(),
                        DependencyEdge.builder().from("p").to("q").build()))
                .roots(List.of())
                .leaves(List.of())
                .hasCycles(true)
                .stronglyConnectedComponents(List.of())
                .build();

        // When
        List<CircularPath> cycles = detector.findReasoningCycles(graph);

        // Then
        assertThat(cycles).singleElement()
                .satisfies(cycle -> assertThat(cycle.getStatements()).containsExactlyInAnyOrder("p", "q"));
    }

    @Test
    @DisplayName("Cycle analysis suggests independent justification")
    void analyzeCycle() {
        // Given
        ProofDecomposition decomposition = decomposer.decompose(List.of(
                step(1, "a > 1", 2),
                step(2, "b > 1", 1)), null);
        CircularPath cycle = detector.findReasoningCycles(decomposition.getDependencies()).get(0);

        // When
        CycleAnalysis analysis = detector.analyzeCycle(cycle, decomposition.getDependencies());

        // Then
        assertThat(analysis.getInvolvedStatements()).extracting(Statement::getId).containsExactly("stmt-1", "stmt-2");
        assertThat(analysis.getBreakPoints()).isEmpty();
        assertThat(analysis.getSuggestedFix())
                .isEqualTo("Add independent justification for one of the statements in the cycle");
    }

    @Test
    @DisplayName("Equivalent phrasings are recognised")
    void equivalentPhrasings() {
        assertThat(detector.statementsEquivalent("It follows that n is prime.", "n is prime")).isTrue();
        assertThat(detector.statementsEquivalent("The sum is TRUE", "the sum")).isTrue();
        assertThat(detector.statementsEquivalent("x squared is positive", "x squared is positive.")).isTrue();
        assertThat(detector.statementsEquivalent("x > 0", "y < 3")).isFalse();
    }

    private static ProofStep step(int number, String statement, Integer... references) {
        return ProofStep.builder()
                .stepNumber(number)
                .statement(statement)
                .referencesSteps(List.of(references))
                .build();
    }

    private static Statement derived(String id, String text, String from) {
        return Statement.builder()
                .id(id)
                .text(text)
                .type(StatementType.DERIVED)
                .confidence(0.8)
                .derivedFrom(List.of(from))
                .build();
    }
}
