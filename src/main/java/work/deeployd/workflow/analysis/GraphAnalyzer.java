package work.deeployd.workflow.analysis;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.TreeSet;
import work.deeployd.workflow.graph.Connection;
import work.deeployd.workflow.graph.Node;
import work.deeployd.workflow.graph.NodeIdOrder;
import work.deeployd.workflow.graph.WorkflowException;
import work.deeployd.workflow.graph.WorkflowGraph;
import work.deeployd.workflow.registry.NodeRegistry;

/**
 * Structural queries over a canonical graph. Only connection-valued inputs create edges; a connection
 * to a node outside the graph is reported by {@link #connectionIssues} and otherwise ignored.
 */
public final class GraphAnalyzer {
    private final NodeRegistry registry;

    public GraphAnalyzer(NodeRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    public NodeKind nodeKind(String classType) {
        if (classType == null || classType.isEmpty()) {
            return NodeKind.UNKNOWN;
        }
        return registry.isBuiltin(classType) ? NodeKind.BUILTIN : NodeKind.CUSTOM;
    }

    public WorkflowSummary summary(WorkflowGraph graph) {
        int builtin = 0;
        int custom = 0;
        var customTypes = new LinkedHashSet<String>();
        var types = new LinkedHashSet<String>();
        for (var node : graph.nodes().values()) {
            types.add(node.classType());
            switch (nodeKind(node.classType())) {
                case BUILTIN -> builtin++;
                case CUSTOM -> {
                    custom++;
                    customTypes.add(node.classType());
                }
                default -> { }
            }
        }
        return new WorkflowSummary(graph.size(), builtin, custom, new ArrayList<>(customTypes), new ArrayList<>(types));
    }

    public Map<String, NodeDependencies> dependencyGraph(WorkflowGraph graph) {
        var result = new LinkedHashMap<String, NodeDependencies>();
        for (var node : graph.nodes().values()) {
            var dependencies = new LinkedHashMap<String, List<String>>();
            node.connections().forEach((input, connection) ->
                dependencies.computeIfAbsent(connection.sourceNodeId(), k -> new ArrayList<>()).add(input));
            result.put(node.id(), new NodeDependencies(node.classType(), dependencies));
        }
        return result;
    }

    /**
     * Kahn's algorithm; among ready nodes the smallest id (numeric ids compared as numbers) goes first.
     *
     * @throws WorkflowException with {@code CYCLE} naming a node on a cycle
     */
    public List<String> executionOrder(WorkflowGraph graph) {
        var dependents = new HashMap<String, List<String>>();
        var inDegree = new HashMap<String, Integer>();
        for (var id : graph.ids()) {
            dependents.put(id, new ArrayList<>());
            inDegree.put(id, 0);
        }
        for (var node : graph.nodes().values()) {
            for (var connection : node.connections().values()) {
                if (graph.contains(connection.sourceNodeId())) {
                    dependents.get(connection.sourceNodeId()).add(node.id());
                    inDegree.merge(node.id(), 1, Integer::sum);
                }
            }
        }

        var ready = new PriorityQueue<String>(NodeIdOrder.INSTANCE);
        inDegree.forEach((id, degree) -> {
            if (degree == 0) {
                ready.add(id);
            }
        });
        var order = new ArrayList<String>(graph.size());
        while (!ready.isEmpty()) {
            var id = ready.poll();
            order.add(id);
            for (var dependent : dependents.get(id)) {
                if (inDegree.merge(dependent, -1, Integer::sum) == 0) {
                    ready.add(dependent);
                }
            }
        }

        if (order.size() < graph.size()) {
            var remaining = new TreeSet<String>(NodeIdOrder.INSTANCE);
            remaining.addAll(graph.ids());
            order.forEach(remaining::remove);
            throw WorkflowException.cycle(nodeOnCycle(graph, remaining));
        }
        return order;
    }

    public Set<String> isolatedNodes(WorkflowGraph graph) {
        var consumed = new HashSet<String>();
        for (var node : graph.nodes().values()) {
            node.connections().values().forEach(c -> consumed.add(c.sourceNodeId()));
        }
        var isolated = new LinkedHashSet<String>();
        for (var node : graph.nodes().values()) {
            if (!node.hasConnections() && !consumed.contains(node.id())) {
                isolated.add(node.id());
            }
        }
        return isolated;
    }

    public ConnectionStats connectionStats(WorkflowGraph graph) {
        int total = 0;
        int max = 0;
        String busiest = null;
        var inputCounts = new LinkedHashMap<String, Integer>();
        var outputConsumers = new LinkedHashMap<Connection, Integer>();
        for (var node : graph.nodes().values()) {
            var connections = node.connections().values();
            inputCounts.put(node.id(), connections.size());
            total += connections.size();
            if (connections.size() > max) {
                max = connections.size();
                busiest = node.id();
            }
            for (var connection : connections) {
                outputConsumers.merge(connection, 1, Integer::sum);
            }
        }
        return new ConnectionStats(total, busiest, inputCounts, outputConsumers);
    }

    public List<ModelLoader> modelLoaders(WorkflowGraph graph) {
        var loaders = new ArrayList<ModelLoader>();
        for (var node : graph.nodes().values()) {
            registry.modelField(node.classType()).ifPresent(field -> {
                var value = node.inputs().get(field);
                var filename = value instanceof String str ? str : null;
                loaders.add(new ModelLoader(node.id(), node.classType(), field, filename));
            });
        }
        return loaders;
    }

    public List<String> outputNodes(WorkflowGraph graph) {
        var outputs = new ArrayList<String>();
        for (var node : graph.nodes().values()) {
            if (registry.isOutputNode(node.classType())) {
                outputs.add(node.id());
            }
        }
        return outputs;
    }

    /**
     * @throws WorkflowException with {@code CYCLE} when the graph is cyclic
     */
    public Complexity complexity(WorkflowGraph graph) {
        int connections = 0;
        int custom = 0;
        for (var node : graph.nodes().values()) {
            connections += node.connections().size();
            if (nodeKind(node.classType()) == NodeKind.CUSTOM) {
                custom++;
            }
        }
        return Complexity.of(graph.size(), connections, longestChain(graph), custom);
    }

    /**
     * Number of nodes on the longest dependency chain.
     */
    public int longestChain(WorkflowGraph graph) {
        var depth = new HashMap<String, Integer>();
        int longest = 0;
        for (var id : executionOrder(graph)) {
            int best = 0;
            for (var connection : graph.nodes().get(id).connections().values()) {
                best = Math.max(best, depth.getOrDefault(connection.sourceNodeId(), 0));
            }
            depth.put(id, best + 1);
            longest = Math.max(longest, best + 1);
        }
        return longest;
    }

    public List<String> connectionIssues(WorkflowGraph graph) {
        var issues = new ArrayList<String>();
        for (var node : graph.nodes().values()) {
            node.connections().forEach((input, connection) -> {
                if (!graph.contains(connection.sourceNodeId())) {
                    issues.add(String.format("Node %s: input '%s' references non-existent node '%s'",
                        node.id(), input, connection.sourceNodeId()));
                }
            });
        }
        return issues;
    }

    public Map<NodeCategory, Set<String>> groupByCategory(WorkflowGraph graph) {
        var groups = new EnumMap<NodeCategory, Set<String>>(NodeCategory.class);
        for (var node : graph.nodes().values()) {
            groups.computeIfAbsent(category(node.classType()), k -> new LinkedHashSet<>()).add(node.id());
        }
        return groups;
    }

    public NodeCategory category(String classType) {
        if (registry.isModelLoader(classType)) {
            return NodeCategory.LOADER;
        }
        if (registry.isOutputNode(classType)) {
            return NodeCategory.OUTPUT;
        }
        return NodeCategory.classify(classType);
    }

    /**
     * Literal inputs of a node, i.e. the parameters a caller could override.
     */
    public Map<String, Object> nodeParameters(Node node) {
        return node.literals();
    }

    private static String nodeOnCycle(WorkflowGraph graph, Set<String> remaining) {
        var current = remaining.iterator().next();
        var path = new LinkedHashSet<String>();
        while (path.add(current)) {
            String next = null;
            for (var connection : graph.nodes().get(current).connections().values()) {
                if (remaining.contains(connection.sourceNodeId())) {
                    next = connection.sourceNodeId();
                    break;
                }
            }
            if (next == null) {
                return current;
            }
            current = next;
        }
        return current;
    }
}
