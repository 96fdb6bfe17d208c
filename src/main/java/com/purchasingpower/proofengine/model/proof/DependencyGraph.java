package com.purchasingpower.proofengine.model.proof;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Frozen snapshot of the statement dependency graph.
 *
 * <p>{@code hasCycles} is true exactly when {@code stronglyConnectedComponents}
 * is non-empty, and {@code topologicalOrder} is present exactly when it is false.
 * Any change to a statement requires building a new graph.
 *
 * @since 1.0.0
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DependencyGraph {

    Map<String, Statement> nodes;
    List<DependencyEdge> edges;
    List<String> roots;
    List<String> leaves;
    int depth;
    int width;
    boolean hasCycles;
    List<List<String>> stronglyConnectedComponents;
    List<String> topologicalOrder;

    public Optional<Statement> findNode(String id) {
        return Optional.ofNullable(nodes.get(id));
    }

    /**
     * Ids of the statements that {@code id} is derived from (incoming edges).
     */
    public List<String> dependenciesOf(String id) {
        return edges.stream()
                .filter(e -> e.getTo().equals(id))
                .map(DependencyEdge::getFrom)
                .collect(Collectors.toList());
    }

    /**
     * Ids of the statements derived using {@code id} (outgoing edges).
     */
    public List<String> dependentsOf(String id) {
        return edges.stream()
                .filter(e -> e.getFrom().equals(id))
                .map(DependencyEdge::getTo)
                .collect(Collectors.toList());
    }

    public static DependencyGraph empty() {
        return DependencyGraph.builder()
                .nodes(Map.of())
                .edges(List.of())
                .roots(List.of())
                .leaves(List.of())
                .stronglyConnectedComponents(List.of())
                .topologicalOrder(List.of())
                .build();
    }
}
