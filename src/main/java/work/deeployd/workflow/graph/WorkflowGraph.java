package work.deeployd.workflow.graph;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable mapping from node id to {@link Node}; keeps insertion order for diagnostics.
 */
public final class WorkflowGraph {
    private static final WorkflowGraph EMPTY = new WorkflowGraph(Map.of());

    private final Map<String, Node> nodes;

    private WorkflowGraph(Map<String, Node> nodes) {
        this.nodes = Collections.unmodifiableMap(new LinkedHashMap<>(nodes));
    }

    public static WorkflowGraph of(Map<String, Node> nodes) {
        if (nodes == null || nodes.isEmpty()) {
            return EMPTY;
        }
        return new WorkflowGraph(nodes);
    }

    public static WorkflowGraph of(Collection<Node> nodes) {
        var map = new LinkedHashMap<String, Node>();
        for (var node : nodes) {
            map.put(node.id(), node);
        }
        return of(map);
    }

    public static WorkflowGraph empty() {
        return EMPTY;
    }

    public Map<String, Node> nodes() {
        return nodes;
    }

    public Optional<Node> node(String id) {
        return Optional.ofNullable(nodes.get(id));
    }

    public boolean contains(String id) {
        return nodes.containsKey(id);
    }

    public Set<String> ids() {
        return nodes.keySet();
    }

    public int size() {
        return nodes.size();
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    /**
     * Every connection-valued input in node order, including ones whose producer is missing.
     */
    public List<GraphEdge> edges() {
        var edges = new ArrayList<GraphEdge>();
        for (var node : nodes.values()) {
            node.connections().forEach((input, connection) ->
                edges.add(new GraphEdge(connection.sourceNodeId(), connection.outputIndex(), node.id(), input)));
        }
        return edges;
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof WorkflowGraph graph && nodes.equals(graph.nodes);
    }

    @Override
    public int hashCode() {
        return nodes.hashCode();
    }

    @Override
    public String toString() {
        return "WorkflowGraph" + nodes.keySet();
    }
}
