package com.purchasingpower.proofengine.service.proof.impl;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.purchasingpower.proofengine.configuration.ProofAnalysisProperties;
import com.purchasingpower.proofengine.model.analysis.DecompositionMetrics;
import com.purchasingpower.proofengine.model.proof.AssumptionChain;
import com.purchasingpower.proofengine.model.proof.DependencyGraph;
import com.purchasingpower.proofengine.model.proof.DependencyType;
import com.purchasingpower.proofengine.model.proof.Gap;
import com.purchasingpower.proofengine.model.proof.GapLocation;
import com.purchasingpower.proofengine.model.proof.GapType;
import com.purchasingpower.proofengine.model.proof.ImplicitAssumption;
import com.purchasingpower.proofengine.model.proof.ImplicitAssumptionType;
import com.purchasingpower.proofengine.model.proof.InferenceRule;
import com.purchasingpower.proofengine.model.proof.ProofDecomposition;
import com.purchasingpower.proofengine.model.proof.ProofInput;
import com.purchasingpower.proofengine.model.proof.ProofStep;
import com.purchasingpower.proofengine.model.proof.RigorLevel;
import com.purchasingpower.proofengine.model.proof.Severity;
import com.purchasingpower.proofengine.model.proof.SourceLocation;
import com.purchasingpower.proofengine.model.proof.Statement;
import com.purchasingpower.proofengine.model.proof.StatementType;
import com.purchasingpower.proofengine.service.graph.DependencyGraphBuilder;
import com.purchasingpower.proofengine.service.proof.AnalysisBudget;
import com.purchasingpower.proofengine.service.proof.AssumptionTracker;
import com.purchasingpower.proofengine.service.proof.CompletenessCalculator;
import com.purchasingpower.proofengine.service.proof.ProofDecomposer;
import com.purchasingpower.proofengine.service.proof.pattern.DependencyPatterns;
import com.purchasingpower.proofengine.service.proof.pattern.DomainTriggers;
import com.purchasingpower.proofengine.service.proof.pattern.ImplicitAssumptionPatterns;
import com.purchasingpower.proofengine.service.proof.pattern.StatementPatterns;
import com.purchasingpower.proofengine.util.TextHeuristics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

@Slf4j
@Service
@RequiredArgsConstructor
public class ProofDecomposerImpl implements ProofDecomposer {

    private static final Pattern SENTENCE_BOUNDARY = Pattern.compile("(?<=[.!?])\\s+|\\n+");
    private static final List<String> FORMAL_NOTATION = List.of(
            "\\forall", "\\exists", "\\vdash", "\\Rightarrow", "∀", "∃", "⊢");
    private static final String STAGE = "decomposition";

    private final ProofAnalysisProperties properties;
    private final AssumptionTracker assumptionTracker;

    @Override
    public ProofDecomposition decompose(ProofInput proof, String theorem) {
        return decompose(proof, theorem, AnalysisBudget.from(properties.getBudget()));
    }

    @Override
    public ProofDecomposition decompose(ProofInput proof, String theorem, AnalysisBudget budget) {
        Preconditions.checkNotNull(proof, "proof must not be null");
        Preconditions.checkNotNull(budget, "budget must not be null");

        List<ProofStep> steps = proof.isStructured()
                ? normalizeSteps(proof.getSteps())
                : parseProofText(proof.getText(), budget);
        String originalProof = proof.isStructured()
                ? steps.stream().map(ProofStep::getStatement).collect(Collectors.joining("\n"))
                : Strings.nullToEmpty(proof.getText());

        List<Statement> classified = new ArrayList<>();
        for (int i = 0; i < steps.size(); i++) {
            if (!budget.tryConsume(STAGE)) {
                break;
            }
            classified.add(classifyStatement(steps.get(i), i));
        }
        steps = steps.subList(0, classified.size());

        List<Statement> atoms = inferDependencies(classified, steps, budget);
        DependencyGraph graph = buildDependencyGraph(atoms);

        List<AssumptionChain> chains = atoms.stream()
                .filter(a -> a.getType() == StatementType.CONCLUSION)
                .map(a -> assumptionTracker.traceToAssumptions(a.getId(), graph))
                .collect(Collectors.toList());

        List<Gap> gaps = detectBasicGaps(atoms, graph);
        List<ImplicitAssumption> implicitAssumptions = findImplicitAssumptions(atoms, steps, theorem);
        double completeness = CompletenessCalculator.compute(atoms, gaps);
        RigorLevel rigorLevel = assessRigorLevel(atoms, gaps, implicitAssumptions);

        log.debug("Decomposed proof into {} atoms ({} edges, depth {}), {} gaps, completeness {}",
                atoms.size(), graph.getEdges().size(), graph.getDepth(), gaps.size(),
                String.format("%.2f", completeness));

        return ProofDecomposition.builder()
                .id(decompositionId(originalProof, theorem))
                .originalProof(originalProof)
                .theorem(theorem)
                .atoms(List.copyOf(atoms))
                .dependencies(graph)
                .assumptionChains(List.copyOf(chains))
                .gaps(List.copyOf(gaps))
                .implicitAssumptions(List.copyOf(implicitAssumptions))
                .completeness(completeness)
                .rigorLevel(rigorLevel)
                .atomCount(atoms.size())
                .maxDependencyDepth(graph.getDepth())
                .build();
    }

    @Override
    public List<Statement> extractStatements(List<ProofStep> steps) {
        List<ProofStep> normalized = normalizeSteps(steps);
        List<Statement> statements = new ArrayList<>();
        for (int i = 0; i < normalized.size(); i++) {
            statements.add(classifyStatement(normalized.get(i), i));
        }
        return statements;
    }

    @Override
    public DecompositionMetrics computeMetrics(ProofDecomposition decomposition) {
        List<Statement> atoms = decomposition.getAtoms();
        int totalDependencies = atoms.stream().mapToInt(a -> a.getDerivedFrom().size()).sum();

        return DecompositionMetrics.builder()
                .atomCount(atoms.size())
                .rootCount(decomposition.getDependencies().getRoots().size())
                .leafCount(decomposition.getDependencies().getLeaves().size())
                .avgDependencies(atoms.isEmpty() ? 0 : (double) totalDependencies / atoms.size())
                .maxDependencyDepth(decomposition.getDependencies().getDepth())
                .completeness(decomposition.getCompleteness())
                .gapCount(decomposition.getGaps().size())
                .implicitAssumptionCount(decomposition.getImplicitAssumptions().size())
                .build();
    }

    private List<ProofStep> parseProofText(String text, AnalysisBudget budget) {
        if (text == null || text.isBlank()) {
            return List.of();
        }

        List<ProofStep> steps = new ArrayList<>();
        for (String sentence : SENTENCE_BOUNDARY.split(text)) {
            if (!budget.tryConsume(STAGE)) {
                break;
            }
            String trimmed = sentence.trim();
            if (!trimmed.isEmpty()) {
                steps.add(ProofStep.of(steps.size() + 1, trimmed));
            }
        }
        return steps;
    }

    /**
     * Drops blank steps and fills in missing step numbers by position.
     */
    private List<ProofStep> normalizeSteps(List<ProofStep> steps) {
        if (steps == null) {
            return List.of();
        }

        List<ProofStep> normalized = new ArrayList<>();
        for (int i = 0; i < steps.size(); i++) {
            ProofStep step = steps.get(i);
            if (step == null || Strings.isNullOrEmpty(step.getStatement()) || step.getStatement().isBlank()) {
                continue;
            }
            normalized.add(ProofStep.builder()
                    .stepNumber(step.getStepNumber() >= 1 ? step.getStepNumber() : i + 1)
                    .statement(step.getStatement().trim())
                    .justification(step.getJustification())
                    .latex(step.getLatex())
                    .referencesSteps(step.getReferencesSteps() != null
                            ? List.copyOf(step.getReferencesSteps()) : List.of())
                    .build());
        }
        return normalized;
    }

    private Statement classifyStatement(ProofStep step, int index) {
        StatementPatterns.Classification classification = StatementPatterns.classify(step.getStatement())
                .orElseThrow(() -> new IllegalStateException("Blank step reached classification"));

        String justification = classification.justification() != null
                ? classification.justification()
                : Strings.emptyToNull(step.getJustification());

        double confidence = classification.type().baseConfidence();
        if (justification != null) {
            confidence = Math.min(1.0, confidence + 0.1);
        }

        return Statement.builder()
                .id(statementId(index))
                .text(classification.text())
                .latex(step.getLatex())
                .type(classification.type())
                .justification(justification)
                .confidence(confidence)
                .explicit(true)
                .sourceLocation(SourceLocation.builder().stepNumber(step.getStepNumber()).build())
                .build();
    }

    /**
     * Second pass producing enriched copies with {@code derivedFrom} and the inference rule.
     * Explicit step references win over citation phrasing; with neither, the nearest
     * earlier non-conclusion statement is used so the graph stays connected.
     */
    private List<Statement> inferDependencies(List<Statement> atoms, List<ProofStep> steps, AnalysisBudget budget) {
        Map<Integer, String> idsByStepNumber = new HashMap<>();
        for (int i = 0; i < atoms.size(); i++) {
            idsByStepNumber.putIfAbsent(steps.get(i).getStepNumber(), atoms.get(i).getId());
        }

        List<Statement> enriched = new ArrayList<>(atoms.size());
        for (int i = 0; i < atoms.size(); i++) {
            Statement atom = atoms.get(i);
            ProofStep step = steps.get(i);

            if (atom.isFoundational()) {
                enriched.add(atom);
                continue;
            }

            Set<String> dependencies = new LinkedHashSet<>();
            for (Integer referenced : step.getReferencesSteps()) {
                String id = referenced != null ? idsByStepNumber.get(referenced) : null;
                if (id != null) {
                    dependencies.add(id);
                } else {
                    log.debug("Step {} references unknown step {}", step.getStepNumber(), referenced);
                }
            }
            boolean explicitReferences = !dependencies.isEmpty();

            InferenceRule rule = null;
            String fullText = step.getStatement() + " " + Strings.nullToEmpty(step.getJustification());
            for (DependencyPatterns.Rule pattern : DependencyPatterns.RULES) {
                if (!budget.tryConsume(STAGE)) {
                    break;
                }
                Matcher matcher = pattern.pattern().matcher(fullText);
                if (!matcher.find()) {
                    continue;
                }
                if (rule == null) {
                    rule = pattern.rule();
                }
                if (!explicitReferences) {
                    for (String reference : pattern.references(matcher)) {
                        dependencies.addAll(findMatchingStatements(reference, atoms.subList(0, i)));
                    }
                }
            }

            if (dependencies.isEmpty()) {
                nearestPremise(atoms, i).ifPresent(dependencies::add);
            }

            if (dependencies.isEmpty()) {
                enriched.add(atom);
            } else {
                enriched.add(atom.toBuilder()
                        .derivedFrom(List.copyOf(dependencies))
                        .usedInferenceRule(rule != null ? rule : InferenceRule.DIRECT_IMPLICATION)
                        .build());
            }
        }
        return enriched;
    }

    private Optional<String> nearestPremise(List<Statement> atoms, int index) {
        for (int j = index - 1; j >= 0; j--) {
            if (atoms.get(j).getType() != StatementType.CONCLUSION) {
                return Optional.of(atoms.get(j).getId());
            }
        }
        return Optional.empty();
    }

    /**
     * Earlier statements a reference plausibly names: either text contains the
     * other, or most of the smaller set of significant words is shared.
     */
    private List<String> findMatchingStatements(String reference, List<Statement> candidates) {
        String referenceLower = reference.toLowerCase(Locale.ROOT).trim();
        Set<String> referenceWords = TextHeuristics.significantWords(referenceLower, 2);
        double threshold = properties.getThresholds().getReferenceOverlap();

        List<String> matches = new ArrayList<>();
        for (Statement candidate : candidates) {
            String statementLower = candidate.getText().toLowerCase(Locale.ROOT).trim();
            boolean substring = statementLower.length() >= 3 && referenceLower.length() >= 3
                    && (statementLower.contains(referenceLower) || referenceLower.contains(statementLower));
            if (substring || TextHeuristics.overlapOfSmaller(referenceWords,
                    TextHeuristics.significantWords(statementLower, 2)) > threshold) {
                matches.add(candidate.getId());
            }
        }
        return matches;
    }

    private DependencyGraph buildDependencyGraph(List<Statement> atoms) {
        DependencyGraphBuilder builder = new DependencyGraphBuilder();
        atoms.forEach(builder::addStatement);

        for (Statement atom : atoms) {
            for (String dependencyId : atom.getDerivedFrom()) {
                if (builder.hasNode(dependencyId)) {
                    builder.addDependency(dependencyId, atom.getId(), DependencyType.LOGICAL, 1.0,
                            atom.getUsedInferenceRule());
                }
            }
        }
        return builder.build();
    }

    private List<Gap> detectBasicGaps(List<Statement> atoms, DependencyGraph graph) {
        List<Gap> gaps = new ArrayList<>();
        int count = 0;

        for (Statement atom : atoms) {
            if (!atom.isFoundational() && !atom.hasDerivation()) {
                gaps.add(Gap.builder()
                        .id("gap-" + (++count))
                        .type(GapType.UNJUSTIFIED_LEAP)
                        .location(GapLocation.of("unknown", atom.getId()))
                        .description(String.format("Statement \"%s\" lacks explicit justification",
                                TextHeuristics.truncate(atom.getText(), 50)))
                        .severity(severityForUnjustified(atom.getType()))
                        .suggestedFix("Add explicit derivation steps or reference to supporting statements")
                        .build());
            }
        }

        Set<String> reachable = reachableFromRoots(graph);
        for (Statement atom : atoms) {
            if (!reachable.contains(atom.getId()) && !atom.isFoundational()) {
                gaps.add(Gap.builder()
                        .id("gap-" + (++count))
                        .type(GapType.MISSING_STEP)
                        .location(GapLocation.of("root", atom.getId()))
                        .description(String.format("Statement \"%s\" is disconnected from the proof structure",
                                TextHeuristics.truncate(atom.getText(), 50)))
                        .severity(Severity.SIGNIFICANT)
                        .suggestedFix("Connect this statement to the main proof chain")
                        .build());
            }
        }
        return gaps;
    }

    static Severity severityForUnjustified(StatementType type) {
        return switch (type) {
            case CONCLUSION -> Severity.CRITICAL;
            case LEMMA -> Severity.SIGNIFICANT;
            default -> Severity.MINOR;
        };
    }

    private Set<String> reachableFromRoots(DependencyGraph graph) {
        Set<String> reachable = new HashSet<>();
        Deque<String> stack = new ArrayDeque<>(graph.getRoots());
        while (!stack.isEmpty()) {
            String id = stack.pop();
            if (reachable.add(id)) {
                graph.dependentsOf(id).stream()
                        .filter(next -> !reachable.contains(next))
                        .forEach(stack::push);
            }
        }
        return reachable;
    }

    private List<ImplicitAssumption> findImplicitAssumptions(List<Statement> atoms, List<ProofStep> steps,
                                                             String theorem) {
        List<String> context = new ArrayList<>();
        atoms.forEach(a -> context.add(a.getText()));
        if (theorem != null) {
            context.add(theorem);
        }

        List<ImplicitAssumption> implicitAssumptions = new ArrayList<>();
        int count = 0;
        for (int i = 0; i < atoms.size(); i++) {
            Statement atom = atoms.get(i);
            String content = steps.get(i).getStatement();

            for (DomainTriggers.Trigger trigger : DomainTriggers.scan(atom.getText(), context)) {
                implicitAssumptions.add(ImplicitAssumption.builder()
                        .id("impl-" + (++count))
                        .statement(trigger.kind().getDescription())
                        .type(ImplicitAssumptionType.DOMAIN_ASSUMPTION)
                        .usedInStep(atom.getId())
                        .shouldBeExplicit(true)
                        .suggestedFormulation(trigger.suggestedFormulation())
                        .build());
            }

            Optional<ImplicitAssumptionPatterns.Hit> hit = ImplicitAssumptionPatterns.firstMatch(content);
            if (hit.isPresent()) {
                implicitAssumptions.add(ImplicitAssumption.builder()
                        .id("impl-" + (++count))
                        .statement(content.length() <= 100 ? content : content.substring(0, 100))
                        .type(hit.get().type())
                        .usedInStep(atom.getId())
                        .shouldBeExplicit(true)
                        .suggestedFormulation(hit.get().suggestedFormulation())
                        .build());
            }
        }
        return implicitAssumptions;
    }

    private RigorLevel assessRigorLevel(List<Statement> atoms, List<Gap> gaps,
                                        List<ImplicitAssumption> implicitAssumptions) {
        long critical = gaps.stream().filter(g -> g.getSeverity() == Severity.CRITICAL).count();
        long significant = gaps.stream().filter(g -> g.getSeverity() == Severity.SIGNIFICANT).count();
        long implicit = implicitAssumptions.stream().filter(ImplicitAssumption::isShouldBeExplicit).count();
        boolean allJustified = atoms.stream()
                .allMatch(a -> a.isFoundational() || (a.hasDerivation() && a.getUsedInferenceRule() != null));

        if (critical > 0 || significant > 2 || implicit > 3) {
            return RigorLevel.INFORMAL;
        }
        if (significant > 0 || implicit > 0 || !allJustified) {
            return RigorLevel.TEXTBOOK;
        }
        if (gaps.isEmpty() && hasFormalNotation(atoms)) {
            return RigorLevel.FORMAL;
        }
        return RigorLevel.RIGOROUS;
    }

    private boolean hasFormalNotation(List<Statement> atoms) {
        return atoms.stream()
                .map(Statement::getLatex)
                .filter(latex -> latex != null && !latex.isEmpty())
                .anyMatch(latex -> FORMAL_NOTATION.stream().anyMatch(latex::contains));
    }

    private static String statementId(int index) {
        return "stmt-" + (index + 1);
    }

    /**
     * Name-based id so identical input always decomposes to an identical value.
     */
    private static String decompositionId(String originalProof, String theorem) {
        String key = String.join("\u0000", Arrays.asList(originalProof, Strings.nullToEmpty(theorem)));
        return UUID.nameUUIDFromBytes(key.getBytes(StandardCharsets.UTF_8)).toString();
    }
}
