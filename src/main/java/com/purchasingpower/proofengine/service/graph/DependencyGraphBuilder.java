package com.purchasingpower.proofengine.service.graph;

import com.google.common.base.Preconditions;
import com.purchasingpower.proofengine.exception.StatementNotFoundException;
import com.purchasingpower.proofengine.model.proof.DependencyEdge;
import com.purchasingpower.proofengine.model.proof.DependencyGraph;
import com.purchasingpower.proofengine.model.proof.DependencyType;
import com.purchasingpower.proofengine.model.proof.InferenceRule;
import com.purchasingpower.proofengine.model.proof.Statement;
import com.purchasingpower.proofengine.model.proof.StatementType;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Mutable builder for a statement dependency graph.
 *
 * <p>Statements are added first, then edges between them. {@link #build()} freezes
 * the current state into an immutable {@link DependencyGraph} together with its
 * structural properties:
 * <ul>
 *   <li>roots (no incoming edge) and leaves (no outgoing edge)</li>
 *   <li>depth: longest root-to-leaf path, counted in nodes</li>
 *   <li>width: largest BFS level reachable from the roots</li>
 *   <li>cycles: Tarjan strongly connected components of size &gt; 1, or self-loops</li>
 *   <li>topological order (Kahn), present only for acyclic graphs</li>
 * </ul>
 *
 * <p>Every traversal is iterative and guarded by a visited set, so cyclic input
 * always terminates. Not thread-safe; one builder per decomposition.
 *
 * @since 1.0.0
 */
public class DependencyGraphBuilder {

    public static final int DEFAULT_MAX_PATHS = 100;

    private final Map<String, Statement> nodes = new LinkedHashMap<>();
    private final List<DependencyEdge> edges = new ArrayList<>();
    private final Map<String, List<String>> adjacency = new HashMap<>();
    private final Map<String, List<String>> reverseAdjacency = new HashMap<>();

    public void addStatement(Statement statement) {
        Preconditions.checkNotNull(statement, "statement must not be null");
        Preconditions.checkArgument(statement.getId() != null, "statement id must not be null");

        nodes.put(statement.getId(), statement);
        adjacency.computeIfAbsent(statement.getId(), k -> new ArrayList<>());
        reverseAdjacency.computeIfAbsent(statement.getId(), k -> new ArrayList<>());
    }

    /**
     * Creates a statement with a random id and adds it to the graph.
     */
    public Statement createStatement(String text, StatementType type, Statement.StatementBuilder options) {
        Statement.StatementBuilder builder = options != null ? options : Statement.builder().confidence(1.0);
        Statement statement = builder
                .id(UUID.randomUUID().toString())
                .text(text)
                .type(type)
                .build();
        addStatement(statement);
        return statement;
    }

    public void addDependency(String from, String to) {
        addDependency(from, to, DependencyType.LOGICAL, 1.0, null);
    }

    /**
     * Adds the edge {@code from -> to}: {@code to} is derived using {@code from}.
     *
     * @throws StatementNotFoundException if either endpoint has not been added
     */
    public void addDependency(String from, String to, DependencyType type, double strength,
                              InferenceRule inferenceRule) {
        if (!nodes.containsKey(from)) {
            throw new StatementNotFoundException("Source", from);
        }
        if (!nodes.containsKey(to)) {
            throw new StatementNotFoundException("Target", to);
        }

        edges.add(DependencyEdge.builder()
                .from(from)
                .to(to)
                .type(type != null ? type : DependencyType.LOGICAL)
                .strength(strength)
                .inferenceRule(inferenceRule)
                .build());

        adjacency.get(from).add(to);
        reverseAdjacency.get(to).add(from);
    }

    public List<String> findRoots() {
        List<String> roots = new ArrayList<>();
        for (String id : nodes.keySet()) {
            if (reverseAdjacency.get(id).isEmpty()) {
                roots.add(id);
            }
        }
        return roots;
    }

    public List<String> findLeaves() {
        List<String> leaves = new ArrayList<>();
        for (String id : nodes.keySet()) {
            if (adjacency.get(id).isEmpty()) {
                leaves.add(id);
            }
        }
        return leaves;
    }

    /**
     * All nodes from which {@code nodeId} can be reached.
     */
    public List<String> getAncestors(String nodeId) {
        return collectReachable(nodeId, reverseAdjacency);
    }

    /**
     * All nodes reachable from {@code nodeId}.
     */
    public List<String> getDescendants(String nodeId) {
        return collectReachable(nodeId, adjacency);
    }

    private List<String> collectReachable(String start, Map<String, List<String>> links) {
        Set<String> found = new LinkedHashSet<>();
        Set<String> visited = new HashSet<>();
        Deque<String> stack = new ArrayDeque<>();
        stack.push(start);

        while (!stack.isEmpty()) {
            String current = stack.pop();
            if (!visited.add(current)) {
                continue;
            }
            for (String next : links.getOrDefault(current, List.of())) {
                found.add(next);
                stack.push(next);
            }
        }
        return new ArrayList<>(found);
    }

    /**
     * Longest root-to-leaf path in nodes. A node's depth is memoized only once its
     * whole subtree has been explored; an edge back onto the current path counts as 0.
     */
    public int computeDepth() {
        List<String> roots = findRoots();
        if (roots.isEmpty()) {
            return 0;
        }

        Map<String, Integer> memo = new HashMap<>();
        int maxDepth = 0;
        for (String root : roots) {
            maxDepth = Math.max(maxDepth, depthFrom(root, memo));
        }
        return maxDepth;
    }

    private int depthFrom(String start, Map<String, Integer> memo) {
        if (memo.containsKey(start)) {
            return memo.get(start);
        }

        Deque<DepthFrame> stack = new ArrayDeque<>();
        Set<String> onPath = new HashSet<>();
        stack.push(new DepthFrame(start));
        onPath.add(start);
        int result = 0;

        while (!stack.isEmpty()) {
            DepthFrame frame = stack.peek();
            List<String> children = adjacency.get(frame.nodeId);

            if (frame.nextChild < children.size()) {
                String child = children.get(frame.nextChild++);
                if (memo.containsKey(child)) {
                    frame.best = Math.max(frame.best, memo.get(child));
                } else if (!onPath.contains(child)) {
                    stack.push(new DepthFrame(child));
                    onPath.add(child);
                }
                continue;
            }

            int depth = 1 + frame.best;
            memo.put(frame.nodeId, depth);
            onPath.remove(frame.nodeId);
            stack.pop();

            if (stack.isEmpty()) {
                result = depth;
            } else {
                stack.peek().best = Math.max(stack.peek().best, depth);
            }
        }
        return result;
    }

    private static final class DepthFrame {
        private final String nodeId;
        private int nextChild;
        private int best;

        private DepthFrame(String nodeId) {
            this.nodeId = nodeId;
        }
    }

    /**
     * Maximum number of nodes sharing a BFS level, levels assigned from all roots at once.
     */
    public int computeWidth() {
        List<String> roots = findRoots();
        if (roots.isEmpty()) {
            return 0;
        }

        Map<String, Integer> levels = new HashMap<>();
        Deque<String> queue = new ArrayDeque<>();
        for (String root : roots) {
            levels.put(root, 0);
            queue.add(root);
        }

        while (!queue.isEmpty()) {
            String current = queue.poll();
            int level = levels.get(current);
            for (String child : adjacency.get(current)) {
                if (!levels.containsKey(child)) {
                    levels.put(child, level + 1);
                    queue.add(child);
                }
            }
        }

        Map<Integer, Integer> counts = new HashMap<>();
        for (int level : levels.values()) {
            counts.merge(level, 1, Integer::sum);
        }
        return counts.values().stream().mapToInt(Integer::intValue).max().orElse(0);
    }

    /**
     * Tarjan's strongly connected components, keeping only the ones that form a
     * cycle: more than one node, or a single node with a self-loop.
     */
    public List<List<String>> detectCycles() {
        Map<String, Integer> index = new HashMap<>();
        Map<String, Integer> lowlink = new HashMap<>();
        Set<String> onStack = new HashSet<>();
        Deque<String> sccStack = new ArrayDeque<>();
        List<List<String>> cycles = new ArrayList<>();
        int counter = 0;

        for (String start : nodes.keySet()) {
            if (index.containsKey(start)) {
                continue;
            }

            Deque<int[]> childCursor = new ArrayDeque<>();
            Deque<String> callStack = new ArrayDeque<>();
            index.put(start, counter);
            lowlink.put(start, counter);
            counter++;
            sccStack.push(start);
            onStack.add(start);
            callStack.push(start);
            childCursor.push(new int[]{0});

            while (!callStack.isEmpty()) {
                String node = callStack.peek();
                int[] cursor = childCursor.peek();
                List<String> neighbors = adjacency.get(node);

                if (cursor[0] < neighbors.size()) {
                    String next = neighbors.get(cursor[0]++);
                    if (!index.containsKey(next)) {
                        index.put(next, counter);
                        lowlink.put(next, counter);
                        counter++;
                        sccStack.push(next);
                        onStack.add(next);
                        callStack.push(next);
                        childCursor.push(new int[]{0});
                    } else if (onStack.contains(next)) {
                        lowlink.put(node, Math.min(lowlink.get(node), index.get(next)));
                    }
                    continue;
                }

                callStack.pop();
                childCursor.pop();
                if (!callStack.isEmpty()) {
                    String parent = callStack.peek();
                    lowlink.put(parent, Math.min(lowlink.get(parent), lowlink.get(node)));
                }

                if (lowlink.get(node).equals(index.get(node))) {
                    List<String> component = new ArrayList<>();
                    String member;
                    do {
                        member = sccStack.pop();
                        onStack.remove(member);
                        component.add(member);
                    } while (!member.equals(node));

                    if (component.size() > 1 || adjacency.get(node).contains(node)) {
                        cycles.add(Collections.unmodifiableList(component));
                    }
                }
            }
        }
        return cycles;
    }

    public boolean hasCycles() {
        return !detectCycles().isEmpty();
    }

    /**
     * Kahn's algorithm. Empty when the graph has a cycle.
     */
    public Optional<List<String>> getTopologicalOrder() {
        Map<String, Integer> inDegree = new LinkedHashMap<>();
        for (String id : nodes.keySet()) {
            inDegree.put(id, 0);
        }
        for (DependencyEdge edge : edges) {
            inDegree.merge(edge.getTo(), 1, Integer::sum);
        }

        Deque<String> queue = new ArrayDeque<>();
        inDegree.forEach((id, degree) -> {
            if (degree == 0) {
                queue.add(id);
            }
        });

        List<String> order = new ArrayList<>();
        while (!queue.isEmpty()) {
            String current = queue.poll();
            order.add(current);
            for (String next : adjacency.get(current)) {
                int remaining = inDegree.merge(next, -1, Integer::sum);
                if (remaining == 0) {
                    queue.add(next);
                }
            }
        }

        return order.size() == nodes.size() ? Optional.of(order) : Optional.empty();
    }

    /**
     * Shortest path by BFS, or empty if {@code to} is unreachable.
     */
    public Optional<List<String>> findPath(String from, String to) {
        if (!nodes.containsKey(from) || !nodes.containsKey(to)) {
            return Optional.empty();
        }

        Map<String, String> parent = new HashMap<>();
        Set<String> visited = new HashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        queue.add(from);
        visited.add(from);

        while (!queue.isEmpty()) {
            String current = queue.poll();
            if (current.equals(to)) {
                List<String> path = new ArrayList<>();
                for (String node = to; node != null; node = parent.get(node)) {
                    path.add(0, node);
                }
                return Optional.of(path);
            }
            for (String next : adjacency.get(current)) {
                if (visited.add(next)) {
                    parent.put(next, current);
                    queue.add(next);
                }
            }
        }
        return Optional.empty();
    }

    public List<List<String>> findAllPaths(String from, String to) {
        return findAllPaths(from, to, DEFAULT_MAX_PATHS);
    }

    /**
     * Simple paths from {@code from} to {@code to}, stopping after {@code maxPaths}.
     */
    public List<List<String>> findAllPaths(String from, String to, int maxPaths) {
        List<List<String>> paths = new ArrayList<>();
        if (!nodes.containsKey(from) || !nodes.containsKey(to) || maxPaths <= 0) {
            return paths;
        }

        List<String> path = new ArrayList<>();
        Set<String> onPath = new HashSet<>();
        Deque<int[]> cursors = new ArrayDeque<>();
        path.add(from);
        onPath.add(from);
        cursors.push(new int[]{0});

        while (!cursors.isEmpty() && paths.size() < maxPaths) {
            String current = path.get(path.size() - 1);
            if (current.equals(to)) {
                paths.add(List.copyOf(path));
                backtrack(path, onPath, cursors);
                continue;
            }

            int[] cursor = cursors.peek();
            List<String> neighbors = adjacency.get(current);
            if (cursor[0] < neighbors.size()) {
                String next = neighbors.get(cursor[0]++);
                if (!onPath.contains(next)) {
                    path.add(next);
                    onPath.add(next);
                    cursors.push(new int[]{0});
                }
            } else {
                backtrack(path, onPath, cursors);
            }
        }
        return paths;
    }

    private void backtrack(List<String> path, Set<String> onPath, Deque<int[]> cursors) {
        cursors.pop();
        onPath.remove(path.remove(path.size() - 1));
    }

    /**
     * Freezes the current state. Later changes to this builder do not affect the result.
     */
    public DependencyGraph build() {
        List<List<String>> cycles = detectCycles();
        boolean hasCycles = !cycles.isEmpty();

        return DependencyGraph.builder()
                .nodes(Collections.unmodifiableMap(new LinkedHashMap<>(nodes)))
                .edges(List.copyOf(edges))
                .roots(List.copyOf(findRoots()))
                .leaves(List.copyOf(findLeaves()))
                .depth(computeDepth())
                .width(computeWidth())
                .hasCycles(hasCycles)
                .stronglyConnectedComponents(List.copyOf(cycles))
                .topologicalOrder(hasCycles ? null : getTopologicalOrder().map(List::copyOf).orElse(null))
                .build();
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int edgeCount() {
        return edges.size();
    }

    public boolean hasNode(String id) {
        return nodes.containsKey(id);
    }

    public Optional<Statement> getNode(String id) {
        return Optional.ofNullable(nodes.get(id));
    }

    public List<Statement> getAllNodes() {
        return new ArrayList<>(nodes.values());
    }

    public List<DependencyEdge> getAllEdges() {
        return new ArrayList<>(edges);
    }

    public void clear() {
        nodes.clear();
        edges.clear();
        adjacency.clear();
        reverseAdjacency.clear();
    }
}
