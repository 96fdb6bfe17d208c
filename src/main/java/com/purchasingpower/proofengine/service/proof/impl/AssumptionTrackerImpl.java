package com.purchasingpower.proofengine.service.proof.impl;

import com.google.common.base.Preconditions;
import com.purchasingpower.proofengine.model.analysis.AssumptionAnalysis;
import com.purchasingpower.proofengine.model.analysis.DischargeStatus;
import com.purchasingpower.proofengine.model.analysis.StructureValidation;
import com.purchasingpower.proofengine.model.proof.AssumptionChain;
import com.purchasingpower.proofengine.model.proof.DependencyEdge;
import com.purchasingpower.proofengine.model.proof.DependencyGraph;
import com.purchasingpower.proofengine.model.proof.ImplicitAssumption;
import com.purchasingpower.proofengine.model.proof.ImplicitAssumptionType;
import com.purchasingpower.proofengine.model.proof.InferenceRule;
import com.purchasingpower.proofengine.model.proof.ProofDecomposition;
import com.purchasingpower.proofengine.model.proof.Statement;
import com.purchasingpower.proofengine.model.proof.StatementType;
import com.purchasingpower.proofengine.service.proof.AssumptionTracker;
import com.purchasingpower.proofengine.util.TextHeuristics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

@Slf4j
@Service
public class AssumptionTrackerImpl implements AssumptionTracker {

    @Override
    public AssumptionChain traceToAssumptions(String conclusionId, DependencyGraph graph) {
        Preconditions.checkNotNull(graph, "graph must not be null");

        Set<String> assumptions = new LinkedHashSet<>();
        List<String> path = new ArrayList<>();
        List<ImplicitAssumption> implicitAssumptions = new ArrayList<>();
        Set<String> visited = new HashSet<>();

        Deque<String> stack = new ArrayDeque<>();
        stack.push(conclusionId);
        while (!stack.isEmpty()) {
            String id = stack.pop();
            if (!visited.add(id)) {
                continue;
            }
            Statement node = graph.getNodes().get(id);
            if (node == null) {
                continue;
            }
            path.add(id);

            if (node.isFoundational()) {
                assumptions.add(id);
            } else if (node.hasDerivation()) {
                List<String> premises = node.getDerivedFrom();
                for (int i = premises.size() - 1; i >= 0; i--) {
                    stack.push(premises.get(i));
                }
            } else {
                implicitAssumptions.add(ImplicitAssumption.builder()
                        .id("impl-trace-" + id)
                        .statement(node.getText())
                        .type(ImplicitAssumptionType.EXISTENCE_ASSUMPTION)
                        .usedInStep(id)
                        .shouldBeExplicit(true)
                        .suggestedFormulation(String.format("Make explicit: \"%s\"",
                                TextHeuristics.truncate(node.getText(), 50)))
                        .build());
            }
        }

        Collections.reverse(path);
        return AssumptionChain.builder()
                .conclusion(conclusionId)
                .assumptions(List.copyOf(assumptions))
                .path(List.copyOf(path))
                .allAssumptionsExplicit(implicitAssumptions.isEmpty())
                .implicitAssumptions(List.copyOf(implicitAssumptions))
                .build();
    }

    @Override
    public AssumptionAnalysis analyzeAssumptions(ProofDecomposition decomposition) {
        Preconditions.checkNotNull(decomposition, "decomposition must not be null");

        List<Statement> atoms = decomposition.getAtoms();
        DependencyGraph graph = decomposition.getDependencies();

        List<Statement> explicitAssumptions = atoms.stream()
                .filter(Statement::isFoundational)
                .collect(Collectors.toList());

        List<String> targets = atoms.stream()
                .filter(a -> a.getType() == StatementType.CONCLUSION)
                .map(Statement::getId)
                .collect(Collectors.toList());
        if (targets.isEmpty()) {
            targets = graph.getLeaves();
        }

        Map<String, List<String>> conclusionDependencies = new LinkedHashMap<>();
        List<ImplicitAssumption> implicitAssumptions = new ArrayList<>();
        for (String target : targets) {
            AssumptionChain chain = traceToAssumptions(target, graph);
            conclusionDependencies.put(target, chain.getAssumptions());
            implicitAssumptions.addAll(chain.getImplicitAssumptions());
        }

        Set<String> used = conclusionDependencies.values().stream()
                .flatMap(List::stream)
                .collect(Collectors.toSet());
        List<String> unused = explicitAssumptions.stream()
                .map(Statement::getId)
                .filter(id -> !used.contains(id))
                .collect(Collectors.toList());

        Map<String, List<String>> minimalSets = new LinkedHashMap<>();
        conclusionDependencies.forEach((conclusion, assumptions) ->
                minimalSets.put(conclusion, computeMinimalSet(conclusion, assumptions, graph)));

        log.debug("Assumption analysis for {}: {} explicit, {} unused, {} conclusions traced",
                decomposition.getId(), explicitAssumptions.size(), unused.size(), targets.size());

        return AssumptionAnalysis.builder()
                .explicitAssumptions(List.copyOf(explicitAssumptions))
                .implicitAssumptions(deduplicate(implicitAssumptions))
                .unusedAssumptions(List.copyOf(unused))
                .conclusionDependencies(Collections.unmodifiableMap(conclusionDependencies))
                .minimalSets(Collections.unmodifiableMap(minimalSets))
                .build();
    }

    /**
     * Greedy backward elimination. Reachability only shrinks as assumptions
     * are removed, so one pass already leaves a locally minimal set.
     */
    List<String> computeMinimalSet(String conclusion, List<String> assumptions, DependencyGraph graph) {
        if (assumptions.size() <= 1) {
            return List.copyOf(assumptions);
        }

        List<String> current = new ArrayList<>(assumptions);
        int i = 0;
        while (i < current.size()) {
            List<String> candidate = new ArrayList<>(current);
            candidate.remove(i);
            if (isReachable(candidate, conclusion, graph)) {
                current = candidate;
            } else {
                i++;
            }
        }
        return List.copyOf(current);
    }

    /**
     * Forward closure: a statement becomes reachable once all its premises are.
     */
    boolean isReachable(List<String> assumptions, String conclusion, DependencyGraph graph) {
        Set<String> reachable = new HashSet<>(assumptions);
        boolean changed = true;
        while (changed && !reachable.contains(conclusion)) {
            changed = false;
            for (Statement node : graph.getNodes().values()) {
                if (!reachable.contains(node.getId()) && node.hasDerivation()
                        && reachable.containsAll(node.getDerivedFrom())) {
                    reachable.add(node.getId());
                    changed = true;
                }
            }
        }
        return reachable.contains(conclusion);
    }

    @Override
    public List<String> findUnusedAssumptions(ProofDecomposition decomposition) {
        Set<String> referenced = new HashSet<>();
        decomposition.getAtoms().forEach(a -> referenced.addAll(a.getDerivedFrom()));
        decomposition.getDependencies().getEdges().stream()
                .map(DependencyEdge::getFrom)
                .forEach(referenced::add);

        return decomposition.getAtoms().stream()
                .filter(Statement::isFoundational)
                .map(Statement::getId)
                .filter(id -> !referenced.contains(id))
                .collect(Collectors.toList());
    }

    @Override
    public List<DischargeStatus> checkAssumptionDischarge(ProofDecomposition decomposition) {
        List<Statement> atoms = decomposition.getAtoms();
        DependencyGraph graph = decomposition.getDependencies();

        List<Statement> contradictions = atoms.stream()
                .filter(a -> a.getText().toLowerCase(Locale.ROOT).contains("contradiction")
                        || a.getText().contains("⊥")
                        || a.getUsedInferenceRule() == InferenceRule.CONTRADICTION)
                .collect(Collectors.toList());
        Optional<Statement> implication = atoms.stream()
                .filter(a -> a.getType() == StatementType.CONCLUSION)
                .filter(a -> a.getText().toLowerCase(Locale.ROOT).contains("implies")
                        || a.getText().contains("⇒") || a.getText().contains("→"))
                .findFirst();

        List<DischargeStatus> statuses = new ArrayList<>();
        for (Statement hypothesis : atoms) {
            if (hypothesis.getType() != StatementType.HYPOTHESIS) {
                continue;
            }

            Optional<Statement> contradiction = contradictions.stream()
                    .filter(c -> c.getDerivedFrom().stream()
                            .anyMatch(premise -> dependsOn(premise, hypothesis.getId(), graph)))
                    .findFirst();

            if (contradiction.isPresent()) {
                statuses.add(DischargeStatus.builder()
                        .assumptionId(hypothesis.getId())
                        .discharged(true)
                        .dischargedAt(contradiction.get().getId())
                        .dischargeReason("Used in proof by contradiction")
                        .build());
            } else if (implication.isPresent()) {
                statuses.add(DischargeStatus.builder()
                        .assumptionId(hypothesis.getId())
                        .discharged(true)
                        .dischargedAt(implication.get().getId())
                        .dischargeReason("Used in implication introduction")
                        .build());
            } else {
                statuses.add(DischargeStatus.builder()
                        .assumptionId(hypothesis.getId())
                        .discharged(false)
                        .dischargeReason("Hypothesis not discharged - may need attention")
                        .build());
            }
        }
        return statuses;
    }

    private boolean dependsOn(String fromId, String targetId, DependencyGraph graph) {
        Set<String> visited = new HashSet<>();
        Deque<String> stack = new ArrayDeque<>();
        stack.push(fromId);
        while (!stack.isEmpty()) {
            String id = stack.pop();
            if (id.equals(targetId)) {
                return true;
            }
            if (!visited.add(id)) {
                continue;
            }
            Statement node = graph.getNodes().get(id);
            if (node != null) {
                node.getDerivedFrom().forEach(stack::push);
            }
        }
        return false;
    }

    @Override
    public List<String> getAssumptionImpact(String assumptionId, DependencyGraph graph) {
        List<String> dependents = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        queue.add(assumptionId);
        visited.add(assumptionId);

        while (!queue.isEmpty()) {
            String current = queue.poll();
            for (Statement node : graph.getNodes().values()) {
                if (node.getDerivedFrom().contains(current) && visited.add(node.getId())) {
                    dependents.add(node.getId());
                    queue.add(node.getId());
                }
            }
        }
        return dependents;
    }

    @Override
    public List<String> getSuggestions(AssumptionAnalysis analysis) {
        List<String> suggestions = new ArrayList<>();

        if (!analysis.getUnusedAssumptions().isEmpty()) {
            suggestions.add(String.format("Consider removing %d unused assumption(s): %s",
                    analysis.getUnusedAssumptions().size(), String.join(", ", analysis.getUnusedAssumptions())));
        }

        List<ImplicitAssumption> critical = analysis.getImplicitAssumptions().stream()
                .filter(ImplicitAssumption::isShouldBeExplicit)
                .collect(Collectors.toList());
        if (!critical.isEmpty()) {
            suggestions.add(String.format("Make %d implicit assumption(s) explicit for improved rigor", critical.size()));
            critical.stream()
                    .limit(3)
                    .forEach(a -> suggestions.add("  - " + a.getSuggestedFormulation()));
        }

        analysis.getMinimalSets().forEach((conclusion, minimal) -> {
            List<String> full = analysis.getConclusionDependencies().getOrDefault(conclusion, List.of());
            long redundant = full.stream().filter(a -> !minimal.contains(a)).count();
            if (redundant > 0) {
                suggestions.add(String.format("For conclusion %s: %d assumption(s) may be redundant",
                        conclusion, redundant));
            }
        });

        if (suggestions.isEmpty()) {
            suggestions.add("Assumption structure appears sound");
        }
        return suggestions;
    }

    @Override
    public StructureValidation validateStructure(ProofDecomposition decomposition) {
        List<String> issues = new ArrayList<>();
        List<Statement> atoms = decomposition.getAtoms();
        DependencyGraph graph = decomposition.getDependencies();

        List<Statement> foundations = atoms.stream()
                .filter(Statement::isFoundational)
                .collect(Collectors.toList());
        if (foundations.isEmpty()) {
            issues.add("No foundational assumptions (axioms, definitions, or hypotheses) found");
        }

        for (String rootId : graph.getRoots()) {
            Statement root = graph.getNodes().get(rootId);
            if (root != null && !root.isFoundational()) {
                issues.add(String.format("Root statement \"%s\" is not a foundational type",
                        TextHeuristics.truncate(root.getText(), 30)));
            }
        }

        if (graph.isHasCycles()) {
            Set<String> cycleNodes = graph.getStronglyConnectedComponents().stream()
                    .filter(scc -> scc.size() > 1)
                    .flatMap(List::stream)
                    .collect(Collectors.toSet());
            for (Statement foundation : foundations) {
                if (cycleNodes.contains(foundation.getId())) {
                    issues.add(String.format("Assumption \"%s\" is involved in circular reasoning",
                            TextHeuristics.truncate(foundation.getText(), 30)));
                }
            }
        }

        for (Statement conclusion : atoms) {
            if (conclusion.getType() != StatementType.CONCLUSION) {
                continue;
            }
            AssumptionChain chain = traceToAssumptions(conclusion.getId(), graph);
            if (chain.getAssumptions().isEmpty() && !chain.isAllAssumptionsExplicit()) {
                issues.add(String.format("Conclusion \"%s\" cannot be traced to any assumption",
                        TextHeuristics.truncate(conclusion.getText(), 30)));
            }
        }

        return StructureValidation.builder()
                .valid(issues.isEmpty())
                .issues(List.copyOf(issues))
                .build();
    }

    private List<ImplicitAssumption> deduplicate(List<ImplicitAssumption> assumptions) {
        Map<String, ImplicitAssumption> seen = new LinkedHashMap<>();
        for (ImplicitAssumption assumption : assumptions) {
            String key = assumption.getType() + ":" + assumption.getStatement().toLowerCase(Locale.ROOT).trim();
            seen.putIfAbsent(key, assumption);
        }
        return List.copyOf(seen.values());
    }
}
