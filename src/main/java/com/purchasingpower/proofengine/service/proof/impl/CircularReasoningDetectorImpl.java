package com.purchasingpower.proofengine.service.proof.impl;

import com.google.common.base.Preconditions;
import com.purchasingpower.proofengine.configuration.ProofAnalysisProperties;
import com.purchasingpower.proofengine.model.analysis.CircularReasoningResult;
import com.purchasingpower.proofengine.model.analysis.CycleAnalysis;
import com.purchasingpower.proofengine.model.proof.CircularPath;
import com.purchasingpower.proofengine.model.proof.DependencyEdge;
import com.purchasingpower.proofengine.model.proof.DependencyGraph;
import com.purchasingpower.proofengine.model.proof.ProofDecomposition;
import com.purchasingpower.proofengine.model.proof.Severity;
import com.purchasingpower.proofengine.model.proof.Statement;
import com.purchasingpower.proofengine.model.proof.StatementType;
import com.purchasingpower.proofengine.service.proof.AnalysisBudget;
import com.purchasingpower.proofengine.service.proof.CircularReasoningDetector;
import com.purchasingpower.proofengine.util.TextHeuristics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

@Slf4j
@Service
@RequiredArgsConstructor
public class CircularReasoningDetectorImpl implements CircularReasoningDetector {

    private static final String STAGE = "circular detection";

    private static final List<Pattern> SELF_REFERENCE = List.of(
            Pattern.compile("this\\s+(?:statement|proposition|claim)\\s+(?:is|implies)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("(?:the\\s+)?above\\s+(?:statement|claim)\\s+proves\\s+itself", Pattern.CASE_INSENSITIVE),
            Pattern.compile("by\\s+definition\\s+of\\s+itself", Pattern.CASE_INSENSITIVE));

    private static final List<Pattern> TAUTOLOGIES = List.of(
            Pattern.compile("\\b(.+)\\s+is\\s+\\1\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("if\\s+(.+)\\s+then\\s+\\1\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\b(.+)\\s+or\\s+not\\s+\\1\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\b(.+)\\s+implies\\s+\\1\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("(?:it is )?true\\s+that\\s+(.+)\\s+is\\s+(?:true|the case)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("either\\s+(.+)\\s+or\\s+\\1\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("all\\s+(\\w+)\\s+are\\s+\\1\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("(\\b\\w+\\b)\\s+or\\s+\\1\\b", Pattern.CASE_INSENSITIVE));

    private static final Pattern THEREFORE = Pattern.compile("therefore\\s+(.+)");
    private static final Pattern THUS = Pattern.compile("thus\\s+(.+)");
    private static final Pattern IS_TRUE = Pattern.compile("(.+)\\s+is\\s+true");
    private static final Pattern FOLLOWS = Pattern.compile("it follows that\\s+(.+)");

    private final ProofAnalysisProperties properties;

    @Override
    public CircularReasoningResult detectCircularReasoning(ProofDecomposition decomposition) {
        return detectCircularReasoning(decomposition, AnalysisBudget.from(properties.getBudget()));
    }

    @Override
    public CircularReasoningResult detectCircularReasoning(ProofDecomposition decomposition, AnalysisBudget budget) {
        Preconditions.checkNotNull(decomposition, "decomposition must not be null");

        List<Statement> atoms = decomposition.getAtoms();
        DependencyGraph graph = decomposition.getDependencies();

        List<CircularPath> cycles = findReasoningCycles(graph);
        List<String> selfReferential = atoms.stream()
                .filter(this::isSelfReferential)
                .map(Statement::getId)
                .collect(Collectors.toList());
        List<String> begging = findBeggingTheQuestion(atoms, graph, budget);
        List<String> tautologies = findTautologies(atoms, budget);

        boolean circular = !cycles.isEmpty() || !selfReferential.isEmpty() || !begging.isEmpty();
        if (circular) {
            log.debug("Circular reasoning in {}: {} cycles, {} self-referential, {} begging",
                    decomposition.getId(), cycles.size(), selfReferential.size(), begging.size());
        }

        return CircularReasoningResult.builder()
                .hasCircularReasoning(circular)
                .cycles(List.copyOf(cycles))
                .selfReferentialStatements(List.copyOf(selfReferential))
                .beggingTheQuestion(List.copyOf(begging))
                .tautologies(List.copyOf(tautologies))
                .summary(summarize(cycles, selfReferential, begging, tautologies))
                .build();
    }

    @Override
    public boolean isSelfReferential(Statement statement) {
        if (statement.getDerivedFrom().contains(statement.getId())) {
            return true;
        }
        return SELF_REFERENCE.stream().anyMatch(p -> p.matcher(statement.getText()).find());
    }

    /**
     * One path per strongly connected component with more than one statement.
     * Self-loops are reported as self-referential statements instead.
     */
    @Override
    public List<CircularPath> findReasoningCycles(DependencyGraph graph) {
        if (!graph.isHasCycles()) {
            return List.of();
        }

        List<List<String>> components = graph.getStronglyConnectedComponents();
        if (components == null || components.isEmpty()) {
            return findCyclesByDepthFirstSearch(graph);
        }

        List<String> proofOrder = new ArrayList<>(graph.getNodes().keySet());
        return components.stream()
                .filter(scc -> scc.size() > 1)
                .map(scc -> scc.stream().sorted((a, b) -> proofOrder.indexOf(a) - proofOrder.indexOf(b))
                        .collect(Collectors.toList()))
                .map(ids -> createCircularPath(ids, graph))
                .collect(Collectors.toList());
    }

    /**
     * Back-edge search used when no component list is available.
     */
    private List<CircularPath> findCyclesByDepthFirstSearch(DependencyGraph graph) {
        Map<String, List<String>> children = new HashMap<>();
        for (DependencyEdge edge : graph.getEdges()) {
            children.computeIfAbsent(edge.getFrom(), k -> new ArrayList<>()).add(edge.getTo());
        }

        List<CircularPath> cycles = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        for (String start : graph.getNodes().keySet()) {
            if (visited.contains(start)) {
                continue;
            }
            Deque<String> path = new ArrayDeque<>();
            Deque<Integer> cursors = new ArrayDeque<>();
            Set<String> onPath = new LinkedHashSet<>();
            path.push(start);
            cursors.push(0);
            onPath.add(start);
            visited.add(start);

            while (!path.isEmpty()) {
                String node = path.peek();
                int cursor = cursors.pop();
                List<String> next = children.getOrDefault(node, List.of());
                if (cursor >= next.size()) {
                    path.pop();
                    onPath.remove(node);
                    continue;
                }
                cursors.push(cursor + 1);
                String child = next.get(cursor);
                if (onPath.contains(child)) {
                    List<String> ids = new ArrayList<>();
                    boolean inCycle = false;
                    for (String id : onPath) {
                        inCycle = inCycle || id.equals(child);
                        if (inCycle) {
                            ids.add(id);
                        }
                    }
                    if (ids.size() > 1) {
                        cycles.add(createCircularPath(ids, graph));
                    }
                } else if (visited.add(child)) {
                    path.push(child);
                    cursors.push(0);
                    onPath.add(child);
                }
            }
        }
        return cycles;
    }

    private CircularPath createCircularPath(List<String> ids, DependencyGraph graph) {
        List<Statement> nodes = ids.stream()
                .map(id -> graph.getNodes().get(id))
                .filter(Objects::nonNull)
                .collect(Collectors.toList());

        Severity severity = Severity.MINOR;
        if (nodes.stream().anyMatch(n -> n.getType() == StatementType.CONCLUSION)) {
            severity = Severity.CRITICAL;
        } else if (nodes.stream().anyMatch(n -> n.getType() == StatementType.HYPOTHESIS) || ids.size() > 3) {
            severity = Severity.SIGNIFICANT;
        }

        String chain = ids.stream()
                .map(id -> graph.findNode(id).map(Statement::getText).orElse(id))
                .map(text -> text.length() <= 20 ? text + "..." : text.substring(0, 20) + "...")
                .collect(Collectors.joining(" depends on "));

        return CircularPath.builder()
                .statements(List.copyOf(ids))
                .cycleLength(ids.size())
                .explanation("Circular reasoning detected: " + chain + " which depends on the first statement")
                .severity(severity)
                .visualPath(String.join(" → ", ids) + " → " + ids.get(0))
                .build();
    }

    private List<String> findBeggingTheQuestion(List<Statement> atoms, DependencyGraph graph, AnalysisBudget budget) {
        List<Statement> hypotheses = atoms.stream()
                .filter(a -> a.getType() == StatementType.HYPOTHESIS)
                .collect(Collectors.toList());

        Set<String> begging = new LinkedHashSet<>();
        for (Statement conclusion : atoms) {
            if (conclusion.getType() != StatementType.CONCLUSION || !budget.tryConsume(STAGE)) {
                continue;
            }
            boolean restatesHypothesis = hypotheses.stream()
                    .anyMatch(h -> statementsEquivalent(conclusion.getText(), h.getText()));
            boolean restatesPremise = conclusion.getDerivedFrom().stream()
                    .map(id -> graph.getNodes().get(id))
                    .filter(Objects::nonNull)
                    .anyMatch(premise -> statementsEquivalent(conclusion.getText(), premise.getText()));
            if (restatesHypothesis || restatesPremise) {
                begging.add(conclusion.getId());
            }
        }
        return new ArrayList<>(begging);
    }

    /**
     * Normalized equality, a few equivalent phrasings, or high significant-word overlap.
     */
    boolean statementsEquivalent(String first, String second) {
        String a = TextHeuristics.normalize(first);
        String b = TextHeuristics.normalize(second);
        if (a.equals(b)) {
            return true;
        }
        if (equivalentForm(a, b) || equivalentForm(b, a)) {
            return true;
        }
        return TextHeuristics.overlapOfLarger(TextHeuristics.significantWords(a, 3),
                TextHeuristics.significantWords(b, 3)) > properties.getThresholds().getBeggingOverlap();
    }

    private boolean equivalentForm(String a, String b) {
        Matcher therefore = THEREFORE.matcher(a);
        Matcher thus = THUS.matcher(b);
        if (therefore.find() && thus.find() && therefore.group(1).equals(thus.group(1))) {
            return true;
        }
        Matcher isTrue = IS_TRUE.matcher(a);
        if (isTrue.matches() && isTrue.group(1).equals(b)) {
            return true;
        }
        Matcher follows = FOLLOWS.matcher(a);
        return follows.find() && follows.group(1).equals(b);
    }

    private List<String> findTautologies(List<Statement> atoms, AnalysisBudget budget) {
        List<String> tautologies = new ArrayList<>();
        for (Statement atom : atoms) {
            if (!budget.tryConsume(STAGE)) {
                break;
            }
            String text = atom.getText().toLowerCase(Locale.ROOT);
            if (TAUTOLOGIES.stream().anyMatch(p -> p.matcher(text).find())) {
                tautologies.add(atom.getId());
            }
        }
        return tautologies;
    }

    private String summarize(List<CircularPath> cycles, List<String> selfReferential, List<String> begging,
                             List<String> tautologies) {
        List<String> parts = new ArrayList<>();
        if (!cycles.isEmpty()) {
            long critical = cycles.stream().filter(c -> c.getSeverity() == Severity.CRITICAL).count();
            parts.add(critical > 0
                    ? String.format("CRITICAL: %d circular reasoning cycle(s) involving conclusions", critical)
                    : String.format("%d circular reasoning cycle(s) detected", cycles.size()));
        }
        if (!selfReferential.isEmpty()) {
            parts.add(String.format("%d self-referential statement(s)", selfReferential.size()));
        }
        if (!begging.isEmpty()) {
            parts.add(String.format("%d instance(s) of begging the question", begging.size()));
        }
        if (!tautologies.isEmpty()) {
            parts.add(String.format("%d tautological statement(s) (may be intentional)", tautologies.size()));
        }
        return parts.isEmpty()
                ? "No circular reasoning detected. The proof structure appears sound."
                : String.join(". ", parts) + ".";
    }

    @Override
    public CycleAnalysis analyzeCycle(CircularPath cycle, DependencyGraph graph) {
        List<Statement> involved = new ArrayList<>();
        List<String> breakPoints = new ArrayList<>();
        for (String id : cycle.getStatements()) {
            Statement node = graph.getNodes().get(id);
            if (node == null) {
                continue;
            }
            involved.add(node);
            if (node.getType() == StatementType.DERIVED && node.getDerivedFrom().size() > 1) {
                breakPoints.add(id);
            }
        }

        String suggestedFix;
        if (!breakPoints.isEmpty()) {
            suggestedFix = String.format("Consider independently justifying statement(s) %s to break the cycle",
                    String.join(", ", breakPoints));
        } else if (involved.stream().anyMatch(s -> s.getType() == StatementType.HYPOTHESIS)) {
            suggestedFix = "Review the hypothesis - it may be assuming what needs to be proved";
        } else {
            suggestedFix = "Add independent justification for one of the statements in the cycle";
        }

        return CycleAnalysis.builder()
                .involvedStatements(List.copyOf(involved))
                .breakPoints(List.copyOf(breakPoints))
                .suggestedFix(suggestedFix)
                .build();
    }

    @Override
    public boolean conclusionDependsOnItself(String conclusionId, DependencyGraph graph) {
        Statement conclusion = graph.getNodes().get(conclusionId);
        if (conclusion == null) {
            return false;
        }

        Set<String> visited = new HashSet<>();
        Deque<String> queue = new ArrayDeque<>(conclusion.getDerivedFrom());
        while (!queue.isEmpty()) {
            String current = queue.poll();
            if (current.equals(conclusionId)) {
                return true;
            }
            if (!visited.add(current)) {
                continue;
            }
            Statement node = graph.getNodes().get(current);
            if (node != null) {
                node.getDerivedFrom().stream().filter(d -> !visited.contains(d)).forEach(queue::add);
            }
        }
        return false;
    }
}
