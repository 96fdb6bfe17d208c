package com.purchasingpower.proofengine.service.proof.impl;

import com.purchasingpower.proofengine.configuration.ProofAnalysisProperties;
import com.purchasingpower.proofengine.model.analysis.GapAnalysisResult;
import com.purchasingpower.proofengine.model.proof.Gap;
import com.purchasingpower.proofengine.model.proof.GapType;
import com.purchasingpower.proofengine.model.proof.InferenceRule;
import com.purchasingpower.proofengine.model.proof.ProofDecomposition;
import com.purchasingpower.proofengine.model.proof.ProofStep;
import com.purchasingpower.proofengine.model.proof.Severity;
import com.purchasingpower.proofengine.model.proof.Statement;
import com.purchasingpower.proofengine.model.proof.StatementType;
import com.purchasingpower.proofengine.service.proof.TransitionValidation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.offset;

@DisplayName("Gap Analyzer Tests")
class GapAnalyzerImplTest {

    private ProofAnalysisProperties properties;
    private ProofDecomposerImpl decomposer;
    private GapAnalyzerImpl analyzer;

    @BeforeEach
    void setUp() {
        properties = new ProofAnalysisProperties();
        decomposer = new ProofDecomposerImpl(properties, new AssumptionTrackerImpl());
        analyzer = new GapAnalyzerImpl(properties);
    }

    @Test
    @DisplayName("Justified two-step proof has no gaps")
    void completeProof() {
        // When
        GapAnalysisResult result = analyze("Axiom: x > 0.", "Therefore x >= 0.");

        // Then
        assertThat(result.getGaps()).isEmpty();
        assertThat(result.getUnjustifiedSteps()).isEmpty();
        assertThat(result.getCompleteness()).isEqualTo(1.0, offset(1e-9));
        assertThat(result.getSuggestions())
                .containsExactly("The proof appears complete with no significant gaps identified");
    }

    @Test
    @DisplayName("Conclusion without premises is a critical leap")
    void unjustifiedConclusion() {
        // When
        GapAnalysisResult result = analyze("Therefore P holds.");

        // Then
        assertThat(result.getGaps()).hasSize(1);
        Gap gap = result.getGaps().get(0);
        assertThat(gap.getId()).isEqualTo("gap-leap-1");
        assertThat(gap.getType()).isEqualTo(GapType.UNJUSTIFIED_LEAP);
        assertThat(gap.getSeverity()).isEqualTo(Severity.CRITICAL);
        assertThat(result.getUnjustifiedSteps()).containsExactly("stmt-1");
        assertThat(result.getSuggestions().get(0)).startsWith("CRITICAL: Address 1 critical gap(s)");
    }

    @Test
    @DisplayName("Large complexity jump is a significant leap unless strictness is lenient")
    void largeLeap() {
        // Given
        String[] steps = {
                "Assume x > 0.",
                "x + 1 > 1 holds because adding one to a positive quantity keeps the result strictly above one."
        };

        // When
        GapAnalysisResult standard = analyze(steps);
        properties.getGap().setStrictness(ProofAnalysisProperties.Strictness.LENIENT);
        GapAnalysisResult lenient = analyze(steps);

        // Then
        assertThat(ofType(standard, GapType.UNJUSTIFIED_LEAP)).singleElement()
                .satisfies(gap -> {
                    assertThat(gap.getSeverity()).isEqualTo(Severity.SIGNIFICANT);
                    assertThat(gap.getLocation().getFrom()).isEqualTo("stmt-1");
                    assertThat(gap.getDescription()).startsWith("Large logical leap");
                });
        assertThat(ofType(lenient, GapType.UNJUSTIFIED_LEAP)).isEmpty();
    }

    @Test
    @DisplayName("Variable used without introduction is a scope error")
    void scopeError() {
        // When
        GapAnalysisResult result = analyze("Assume n > 0.", "m + n > 0.");

        // Then
        List<Gap> scope = ofType(result, GapType.SCOPE_ERROR);
        assertThat(scope).hasSize(1);
        assertThat(scope.get(0).getDescription()).contains("\"m\"");
        assertThat(scope.get(0).getSuggestedFix()).isEqualTo("Introduce m with \"Let m...\" or specify its domain");
    }

    @Test
    @DisplayName("Variables bound by a universal quantifier are in scope")
    void quantifiedVariableIsInScope() {
        // When
        GapAnalysisResult result = analyze("Assume for all k the claim holds.", "k + 1 > k.");

        // Then
        assertThat(ofType(result, GapType.SCOPE_ERROR)).isEmpty();
    }

    @Test
    @DisplayName("Citing an unknown definition is an undefined term")
    void undefinedTerm() {
        // When
        GapAnalysisResult result = analyze("Assume G is a group.", "By definition of quasigroup, G is closed.");

        // Then
        List<Gap> undefined = ofType(result, GapType.UNDEFINED_TERM);
        assertThat(undefined).hasSize(1);
        assertThat(undefined.get(0).getId()).isEqualTo("gap-undef-1");
        assertThat(undefined.get(0).getSeverity()).isEqualTo(Severity.SIGNIFICANT);
        assertThat(undefined.get(0).getDescription()).isEqualTo("Term \"quasigroup\" is used but not defined");
    }

    @Test
    @DisplayName("Standard and locally defined terms are not reported")
    void knownTerms() {
        // When
        GapAnalysisResult result = analyze(
                "Definition: A widget is defined as a bounded set.",
                "By definition of widget, W is bounded.",
                "By definition of prime, p has two divisors.");

        // Then
        assertThat(ofType(result, GapType.UNDEFINED_TERM)).isEmpty();
    }

    @Test
    @DisplayName("Division domain assumptions can be switched off")
    void domainAssumptionToggle() {
        // When
        GapAnalysisResult enabled = analyze("1/x > 0.");
        properties.getGap().setCheckDomainAssumptions(false);
        GapAnalysisResult disabled = analyze("1/x > 0.");

        // Then
        assertThat(enabled.getImplicitAssumptions()).hasSize(1);
        assertThat(enabled.getImplicitAssumptions().get(0).getSuggestedFormulation())
                .isEqualTo("State that x is non-zero");
        assertThat(disabled.getImplicitAssumptions()).isEmpty();
    }

    @Test
    @DisplayName("Transition into a foundational statement is always valid")
    void transitionIntoFoundation() {
        // Given
        Statement from = statement("stmt-1", "a > 0", StatementType.DERIVED, List.of(), null);
        Statement to = statement("stmt-2", "b < 1", StatementType.AXIOM, List.of(), null);

        // When / Then
        assertThat(analyzer.isValidTransition(from, to).isValid()).isTrue();
    }

    @Test
    @DisplayName("Unrelated statements have no valid transition")
    void unrelatedTransition() {
        // Given
        Statement from = statement("stmt-1", "a > 0", StatementType.DERIVED, List.of(), null);
        Statement to = statement("stmt-2", "b < 1", StatementType.DERIVED, List.of(), null);

        // When
        TransitionValidation validation = analyzer.isValidTransition(from, to);

        // Then
        assertThat(validation.isValid()).isFalse();
        assertThat(validation.getReason()).startsWith("No clear logical connection");
        assertThat(validation.getSuggestedFix()).isEqualTo("Add explicit derivation step or justification");
    }

    @Test
    @DisplayName("Shared concepts imply a connection")
    void impliedTransition() {
        // Given
        Statement from = statement("stmt-1", "every prime number above two is odd", StatementType.DERIVED,
                List.of(), null);
        Statement to = statement("stmt-2", "seven is a prime number", StatementType.DERIVED, List.of(), null);

        // When
        TransitionValidation validation = analyzer.isValidTransition(from, to);

        // Then
        assertThat(validation.isValid()).isTrue();
        assertThat(validation.getReason()).isEqualTo("Implied connection through shared concepts");
    }

    @Test
    @DisplayName("Missing rule cue is noted for review without invalidating the step")
    void ruleWithoutCue() {
        // Given
        Statement from = statement("stmt-1", "x > 0", StatementType.HYPOTHESIS, List.of(), null);
        Statement to = statement("stmt-2", "x squared > 0", StatementType.DERIVED, List.of("stmt-1"),
                InferenceRule.MODUS_PONENS);

        // When
        TransitionValidation validation = analyzer.isValidTransition(from, to);

        // Then
        assertThat(validation.isValid()).isTrue();
        assertThat(validation.getReason()).isEqualTo("Inference rule modus_ponens application may need review");
    }

    private GapAnalysisResult analyze(String... statements) {
        List<ProofStep> steps = new ArrayList<>();
        for (int i = 0; i < statements.length; i++) {
            steps.add(ProofStep.of(i + 1, statements[i]));
        }
        ProofDecomposition decomposition = decomposer.decompose(steps, null);
        return analyzer.analyzeGaps(decomposition);
    }

    private static List<Gap> ofType(GapAnalysisResult result, GapType type) {
        return result.getGaps().stream()
                .filter(g -> g.getType() == type)
                .collect(Collectors.toList());
    }

    private static Statement statement(String id, String text, StatementType type, List<String> derivedFrom,
                                       InferenceRule rule) {
        return Statement.builder()
                .id(id)
                .text(text)
                .type(type)
                .confidence(type.baseConfidence())
                .derivedFrom(derivedFrom)
                .usedInferenceRule(rule)
                .build();
    }
}
