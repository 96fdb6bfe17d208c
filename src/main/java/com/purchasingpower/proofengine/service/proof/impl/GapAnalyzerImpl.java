package com.purchasingpower.proofengine.service.proof.impl;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSet;
import com.purchasingpower.proofengine.configuration.ProofAnalysisProperties;
import com.purchasingpower.proofengine.configuration.ProofAnalysisProperties.Strictness;
import com.purchasingpower.proofengine.model.analysis.GapAnalysisResult;
import com.purchasingpower.proofengine.model.proof.DependencyGraph;
import com.purchasingpower.proofengine.model.proof.Gap;
import com.purchasingpower.proofengine.model.proof.GapLocation;
import com.purchasingpower.proofengine.model.proof.GapType;
import com.purchasingpower.proofengine.model.proof.ImplicitAssumption;
import com.purchasingpower.proofengine.model.proof.ImplicitAssumptionType;
import com.purchasingpower.proofengine.model.proof.InferenceRule;
import com.purchasingpower.proofengine.model.proof.ProofDecomposition;
import com.purchasingpower.proofengine.model.proof.Severity;
import com.purchasingpower.proofengine.model.proof.Statement;
import com.purchasingpower.proofengine.model.proof.StatementType;
import com.purchasingpower.proofengine.service.proof.AnalysisBudget;
import com.purchasingpower.proofengine.service.proof.CompletenessCalculator;
import com.purchasingpower.proofengine.service.proof.GapAnalyzer;
import com.purchasingpower.proofengine.service.proof.TransitionValidation;
import com.purchasingpower.proofengine.service.proof.pattern.DomainTriggers;
import com.purchasingpower.proofengine.util.TextHeuristics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

@Slf4j
@Service
@RequiredArgsConstructor
public class GapAnalyzerImpl implements GapAnalyzer {

    private static final String STAGE = "gap analysis";

    private static final Pattern COMPLEX_SYMBOL = Pattern.compile("[∀∃∈∉⊆⊇∩∪∧∨¬⇒⇔∫∑∏√≤≥≠±∞]");
    private static final Pattern NESTING = Pattern.compile("[(\\[{]");
    private static final Pattern VARIABLE = Pattern.compile("\\b[a-zA-Z](?:_\\d+)?\\b");
    private static final Pattern OPERATOR = Pattern.compile("[+\\-*/=<>≤≥≠∈∉⊆⊇]");
    private static final Pattern INTRODUCTION = Pattern.compile(
            "(?:let|for\\s+(?:all|any|every)|∀)\\s+([a-zA-Z](?:_\\d+)?)", Pattern.CASE_INSENSITIVE);
    private static final Pattern SCOPED_VARIABLE = Pattern.compile("\\b([a-zA-Z](?:_\\d+)?)\\b");
    private static final Pattern DEFINED_TERM = Pattern.compile(
            "(?:define|let)\\s+(\\w+)|(\\w+)\\s+(?:is|are|be)\\s+defined", Pattern.CASE_INSENSITIVE);
    private static final Pattern BY_DEFINITION_OF = Pattern.compile(
            "by\\s+(?:the\\s+)?definition\\s+of\\s+(\\w+)", Pattern.CASE_INSENSITIVE);

    private static final Set<String> SCOPE_STOP_WORDS = ImmutableSet.of(
            "a", "an", "the", "if", "is", "or", "be", "to", "in", "of");

    private static final Set<String> STANDARD_TERMS = ImmutableSet.of(
            "integer", "integers", "real", "reals", "natural", "naturals", "rational", "rationals",
            "complex", "prime", "even", "odd", "positive", "negative", "zero", "function",
            "continuous", "differentiable", "derivative", "integral", "limit", "sequence", "series",
            "set", "subset", "superset", "union", "intersection", "element", "member", "domain",
            "range", "codomain", "bijection", "injection", "surjection", "isomorphism", "homomorphism");

    private final ProofAnalysisProperties properties;

    @Override
    public GapAnalysisResult analyzeGaps(ProofDecomposition decomposition) {
        return analyzeGaps(decomposition, AnalysisBudget.from(properties.getBudget()));
    }

    @Override
    public GapAnalysisResult analyzeGaps(ProofDecomposition decomposition, AnalysisBudget budget) {
        Preconditions.checkNotNull(decomposition, "decomposition must not be null");

        List<Statement> atoms = decomposition.getAtoms();
        DependencyGraph graph = decomposition.getDependencies();

        List<Gap> gaps = new ArrayList<>();
        gaps.addAll(findUnjustifiedLeaps(atoms, graph, budget));
        gaps.addAll(findMissingSteps(atoms, graph, budget));
        gaps.addAll(findScopeErrors(atoms, budget));
        gaps.addAll(findUndefinedTerms(atoms));

        List<ImplicitAssumption> implicitAssumptions = findImplicitAssumptions(atoms);
        List<String> unjustifiedSteps = findUnjustifiedSteps(atoms);
        List<String> suggestions = generateSuggestions(gaps, implicitAssumptions, unjustifiedSteps);
        double completeness = CompletenessCalculator.compute(atoms, gaps);

        log.debug("Gap analysis for {}: {} gaps, {} implicit assumptions, completeness {}",
                decomposition.getId(), gaps.size(), implicitAssumptions.size(),
                String.format("%.2f", completeness));

        return GapAnalysisResult.builder()
                .completeness(completeness)
                .gaps(List.copyOf(gaps))
                .implicitAssumptions(List.copyOf(implicitAssumptions))
                .unjustifiedSteps(List.copyOf(unjustifiedSteps))
                .suggestions(List.copyOf(suggestions))
                .build();
    }

    @Override
    public TransitionValidation isValidTransition(Statement from, Statement to) {
        if (to.isFoundational()) {
            return TransitionValidation.ok();
        }

        if (to.getDerivedFrom().contains(from.getId())) {
            if (to.getUsedInferenceRule() != null && properties.getGap().isVerifyInferenceRules()) {
                return verifyInferenceRule(from, to);
            }
            return TransitionValidation.ok();
        }

        TransitionValidation implied = checkImpliedConnection(from, to);
        if (implied.isValid()) {
            return implied;
        }

        return TransitionValidation.invalid(
                String.format("No clear logical connection from \"%s\" to \"%s\"",
                        TextHeuristics.truncate(from.getText(), 30), TextHeuristics.truncate(to.getText(), 30)),
                "Add explicit derivation step or justification");
    }

    /**
     * Looks for textual cues of the claimed rule. A missing cue is only noted
     * for review and never invalidates the transition.
     */
    private TransitionValidation verifyInferenceRule(Statement from, Statement to) {
        InferenceRule rule = to.getUsedInferenceRule();
        String fromText = from.getText().toLowerCase(Locale.ROOT);
        String toText = to.getText().toLowerCase(Locale.ROOT);

        boolean cuePresent = switch (rule) {
            case MODUS_PONENS -> (fromText.contains("if") && fromText.contains("then"))
                    || fromText.contains("implies") || fromText.contains("⇒");
            case MODUS_TOLLENS -> toText.contains("not") || toText.contains("¬") || toText.contains("false");
            case CONTRADICTION -> toText.contains("contradiction") || toText.contains("impossible")
                    || toText.contains("false");
            case SUBSTITUTION -> fromText.contains("=") || fromText.contains("equals");
            case UNIVERSAL_INSTANTIATION -> fromText.contains("for all") || fromText.contains("∀")
                    || fromText.contains("every");
            case EXISTENTIAL_GENERALIZATION -> toText.contains("exists") || toText.contains("∃")
                    || toText.contains("there is");
            default -> true;
        };

        return cuePresent
                ? TransitionValidation.ok()
                : TransitionValidation.ok("Inference rule " + rule.getValue() + " application may need review");
    }

    private TransitionValidation checkImpliedConnection(Statement from, Statement to) {
        Set<String> fromWords = TextHeuristics.significantWords(from.getText(), 3);
        Set<String> toWords = TextHeuristics.significantWords(to.getText(), 3);

        if (TextHeuristics.countShared(fromWords, toWords)
                >= properties.getThresholds().getImpliedConnectionSharedWords()) {
            return TransitionValidation.ok("Implied connection through shared concepts");
        }

        if (to.getJustification() != null
                && to.getJustification().toLowerCase(Locale.ROOT).contains(from.getId().toLowerCase(Locale.ROOT))) {
            return TransitionValidation.ok();
        }

        return TransitionValidation.builder().valid(false).build();
    }

    List<Gap> findUnjustifiedLeaps(List<Statement> atoms, DependencyGraph graph, AnalysisBudget budget) {
        List<Gap> gaps = new ArrayList<>();
        int count = 0;

        for (Statement atom : atoms) {
            if (atom.isFoundational() || !budget.tryConsume(STAGE)) {
                continue;
            }

            if (!atom.hasDerivation()) {
                gaps.add(Gap.builder()
                        .id("gap-leap-" + (++count))
                        .type(GapType.UNJUSTIFIED_LEAP)
                        .location(GapLocation.of("unknown", atom.getId()))
                        .description(String.format("Statement \"%s\" appears without justification",
                                TextHeuristics.truncate(atom.getText(), 50)))
                        .severity(ProofDecomposerImpl.severityForUnjustified(atom.getType()))
                        .suggestedFix(suggestJustification(atom, atoms))
                        .build());
                continue;
            }

            if (properties.getGap().getStrictness() != Strictness.LENIENT) {
                int distance = computeLeapDistance(atom, graph);
                if (distance > properties.getGap().getMaxLeapDistance()) {
                    gaps.add(Gap.builder()
                            .id("gap-leap-" + (++count))
                            .type(GapType.UNJUSTIFIED_LEAP)
                            .location(GapLocation.of(atom.getDerivedFrom().get(0), atom.getId()))
                            .description(String.format("Large logical leap (distance %d) to reach this statement",
                                    distance))
                            .severity(Severity.SIGNIFICANT)
                            .suggestedFix("Add intermediate steps to bridge the logical gap")
                            .build());
                }
            }
        }
        return gaps;
    }

    /**
     * Estimated number of skipped steps, from the complexity jump over the premises.
     */
    private int computeLeapDistance(Statement atom, DependencyGraph graph) {
        List<Statement> premises = atom.getDerivedFrom().stream()
                .map(graph::findNode)
                .flatMap(Optional::stream)
                .collect(Collectors.toList());
        if (premises.isEmpty()) {
            return 0;
        }

        double average = premises.stream()
                .mapToInt(p -> estimateComplexity(p.getText()))
                .average()
                .orElse(0);
        int divisor = Math.max(1, properties.getThresholds().getLeapComplexityDivisor());
        return (int) Math.max(0, Math.floor((estimateComplexity(atom.getText()) - average) / divisor));
    }

    static int estimateComplexity(String text) {
        return text.length() + 5 * countMatches(COMPLEX_SYMBOL, text) + 3 * countMatches(NESTING, text);
    }

    List<Gap> findMissingSteps(List<Statement> atoms, DependencyGraph graph, AnalysisBudget budget) {
        List<Gap> gaps = new ArrayList<>();
        int count = 0;

        for (Statement atom : atoms) {
            for (String dependencyId : atom.getDerivedFrom()) {
                if (!budget.tryConsume(STAGE)) {
                    return gaps;
                }
                Statement dependency = graph.getNodes().get(dependencyId);
                if (dependency == null) {
                    continue;
                }
                TransitionValidation validation = isValidTransition(dependency, atom);
                if (!validation.isValid()) {
                    gaps.add(Gap.builder()
                            .id("gap-step-" + (++count))
                            .type(GapType.MISSING_STEP)
                            .location(GapLocation.of(dependencyId, atom.getId()))
                            .description(validation.getReason() != null
                                    ? validation.getReason() : "Missing intermediate step")
                            .severity(Severity.MINOR)
                            .suggestedFix(validation.getSuggestedFix())
                            .build());
                }
            }
        }

        List<String> order = graph.getTopologicalOrder();
        if (order != null) {
            for (int i = 1; i < order.size(); i++) {
                Statement previous = graph.getNodes().get(order.get(i - 1));
                Statement current = graph.getNodes().get(order.get(i));
                if (previous != null && current != null
                        && current.getDerivedFrom().contains(previous.getId())
                        && needsIntermediateStep(previous, current)) {
                    gaps.add(Gap.builder()
                            .id("gap-step-" + (++count))
                            .type(GapType.MISSING_STEP)
                            .location(GapLocation.of(previous.getId(), current.getId()))
                            .description(String.format("Step from \"%s\" to \"%s\" may need clarification",
                                    TextHeuristics.truncate(previous.getText(), 30),
                                    TextHeuristics.truncate(current.getText(), 30)))
                            .severity(Severity.MINOR)
                            .suggestedFix("Consider adding an intermediate derivation step")
                            .build());
                }
            }
        }
        return gaps;
    }

    private boolean needsIntermediateStep(Statement from, Statement to) {
        Strictness strictness = properties.getGap().getStrictness();
        if (strictness == Strictness.LENIENT) {
            return false;
        }

        List<String> fromSymbols = extractMathSymbols(from.getText());
        List<String> toSymbols = extractMathSymbols(to.getText());
        boolean anyShared = fromSymbols.stream().anyMatch(toSymbols::contains);
        if (!anyShared && !fromSymbols.isEmpty() && !toSymbols.isEmpty()) {
            return true;
        }

        if (strictness == Strictness.STRICT) {
            double ratio = (double) to.getText().length() / Math.max(1, from.getText().length());
            return ratio > 2 || ratio < 0.5;
        }
        return false;
    }

    private List<String> extractMathSymbols(String text) {
        List<String> symbols = new ArrayList<>();
        Matcher variables = VARIABLE.matcher(text);
        while (variables.find()) {
            symbols.add(variables.group());
        }
        Matcher operators = OPERATOR.matcher(text);
        while (operators.find()) {
            symbols.add(operators.group());
        }
        return symbols;
    }

    List<Gap> findScopeErrors(List<Statement> atoms, AnalysisBudget budget) {
        List<Gap> gaps = new ArrayList<>();
        Set<String> introduced = new HashSet<>();
        int count = 0;

        for (int i = 0; i < atoms.size(); i++) {
            Statement atom = atoms.get(i);
            if (!budget.tryConsume(STAGE)) {
                break;
            }

            Matcher introduction = INTRODUCTION.matcher(atom.getText());
            if (introduction.find()) {
                introduced.add(introduction.group(1));
            }
            if (atom.getType() != StatementType.DERIVED) {
                continue;
            }

            Set<String> reported = new HashSet<>();
            Matcher variables = SCOPED_VARIABLE.matcher(atom.getText());
            while (variables.find()) {
                String variable = variables.group(1);
                if (variable.length() != 1
                        || SCOPE_STOP_WORDS.contains(variable.toLowerCase(Locale.ROOT))
                        || introduced.contains(variable)
                        || !reported.add(variable)
                        || usedBefore(variable, atoms, i)) {
                    continue;
                }
                gaps.add(Gap.builder()
                        .id("gap-scope-" + (++count))
                        .type(GapType.SCOPE_ERROR)
                        .location(GapLocation.of("introduction", atom.getId()))
                        .description(String.format("Variable \"%s\" appears without explicit introduction", variable))
                        .severity(Severity.MINOR)
                        .suggestedFix(String.format("Introduce %s with \"Let %s...\" or specify its domain",
                                variable, variable))
                        .build());
            }
        }
        return gaps;
    }

    private boolean usedBefore(String variable, List<Statement> atoms, int index) {
        for (int j = 0; j < index; j++) {
            if (atoms.get(j).getText().contains(variable)) {
                return true;
            }
        }
        return false;
    }

    List<Gap> findUndefinedTerms(List<Statement> atoms) {
        Set<String> defined = new HashSet<>();
        for (Statement atom : atoms) {
            if (atom.getType() != StatementType.DEFINITION) {
                continue;
            }
            Matcher matcher = DEFINED_TERM.matcher(atom.getText());
            if (matcher.find()) {
                String term = matcher.group(1) != null ? matcher.group(1) : matcher.group(2);
                defined.add(term.toLowerCase(Locale.ROOT));
            }
        }

        List<Gap> gaps = new ArrayList<>();
        int count = 0;
        for (Statement atom : atoms) {
            Matcher matcher = BY_DEFINITION_OF.matcher(atom.getText());
            if (!matcher.find()) {
                continue;
            }
            String term = matcher.group(1);
            String key = term.toLowerCase(Locale.ROOT);
            if (!defined.contains(key) && !STANDARD_TERMS.contains(key)) {
                gaps.add(Gap.builder()
                        .id("gap-undef-" + (++count))
                        .type(GapType.UNDEFINED_TERM)
                        .location(GapLocation.of("definition", atom.getId()))
                        .description(String.format("Term \"%s\" is used but not defined", term))
                        .severity(Severity.SIGNIFICANT)
                        .suggestedFix(String.format("Add a definition for \"%s\"", term))
                        .build());
            }
        }
        return gaps;
    }

    private List<ImplicitAssumption> findImplicitAssumptions(List<Statement> atoms) {
        if (!properties.getGap().isCheckDomainAssumptions()) {
            return List.of();
        }

        List<String> context = atoms.stream().map(Statement::getText).collect(Collectors.toList());
        List<ImplicitAssumption> assumptions = new ArrayList<>();
        int count = 0;
        for (Statement atom : atoms) {
            for (DomainTriggers.Trigger trigger : DomainTriggers.scan(atom.getText(), context)) {
                assumptions.add(ImplicitAssumption.builder()
                        .id("impl-" + (++count))
                        .statement(trigger.kind().getDescription())
                        .type(ImplicitAssumptionType.DOMAIN_ASSUMPTION)
                        .usedInStep(atom.getId())
                        .shouldBeExplicit(true)
                        .suggestedFormulation(trigger.suggestedFormulation())
                        .build());
            }
        }
        return assumptions;
    }

    private List<String> findUnjustifiedSteps(List<Statement> atoms) {
        return atoms.stream()
                .filter(a -> a.getType() == StatementType.DERIVED || a.getType() == StatementType.CONCLUSION)
                .filter(a -> !a.hasDerivation() && a.getJustification() == null)
                .map(Statement::getId)
                .collect(Collectors.toList());
    }

    private String suggestJustification(Statement atom, List<Statement> atoms) {
        Set<String> words = TextHeuristics.significantWords(atom.getText(), 2);
        double threshold = properties.getThresholds().getSuggestionOverlap();

        String related = atoms.stream()
                .filter(a -> !a.getId().equals(atom.getId()))
                .filter(a -> TextHeuristics.overlapOfLarger(
                        TextHeuristics.significantWords(a.getText(), 2), words) > threshold)
                .map(Statement::getId)
                .collect(Collectors.joining(", "));

        return related.isEmpty()
                ? "Add explicit justification or reference to supporting statements"
                : "Consider deriving from: " + related;
    }

    private List<String> generateSuggestions(List<Gap> gaps, List<ImplicitAssumption> implicitAssumptions,
                                             List<String> unjustifiedSteps) {
        long critical = gaps.stream().filter(g -> g.getSeverity() == Severity.CRITICAL).count();
        long significant = gaps.stream().filter(g -> g.getSeverity() == Severity.SIGNIFICANT).count();
        long minor = gaps.stream().filter(g -> g.getSeverity() == Severity.MINOR).count();
        long explicitWorthy = implicitAssumptions.stream().filter(ImplicitAssumption::isShouldBeExplicit).count();

        List<String> suggestions = new ArrayList<>();
        if (critical > 0) {
            suggestions.add(String.format(
                    "CRITICAL: Address %d critical gap(s) in the proof - conclusions lack proper justification",
                    critical));
        }
        if (significant > 0) {
            suggestions.add(String.format("Add intermediate steps to bridge %d significant logical gap(s)",
                    significant));
        }
        if (explicitWorthy > 0) {
            suggestions.add(String.format("Make %d implicit assumption(s) explicit", explicitWorthy));
        }
        if (!unjustifiedSteps.isEmpty()) {
            suggestions.add(String.format("Provide justification for %d unjustified step(s)", unjustifiedSteps.size()));
        }
        if (minor > 0 && properties.getGap().getStrictness() != Strictness.LENIENT) {
            suggestions.add(String.format("Consider clarifying %d minor gap(s) for improved rigor", minor));
        }
        if (suggestions.isEmpty()) {
            suggestions.add("The proof appears complete with no significant gaps identified");
        }
        return suggestions;
    }

    private static int countMatches(Pattern pattern, String text) {
        Matcher matcher = pattern.matcher(text);
        int count = 0;
        while (matcher.find()) {
            count++;
        }
        return count;
    }
}
