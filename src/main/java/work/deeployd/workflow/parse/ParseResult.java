package work.deeployd.workflow.parse;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import work.deeployd.workflow.convert.WorkflowFormat;
import work.deeployd.workflow.graph.GraphEdge;
import work.deeployd.workflow.graph.Node;
import work.deeployd.workflow.graph.WorkflowException;
import work.deeployd.workflow.graph.WorkflowGraph;
import work.deeployd.workflow.registry.NodeRegistry;

/**
 * Validated graph plus the format it was read from. Connections and custom node types are computed
 * on first access and cached for the lifetime of the instance.
 */
public final class ParseResult {
    private final WorkflowGraph graph;
    private final WorkflowFormat format;
    private final boolean valid;
    private final List<String> errors;
    private final NodeRegistry registry;

    private List<GraphEdge> connections;
    private Set<String> customNodes;

    public ParseResult(WorkflowGraph graph, WorkflowFormat format, NodeRegistry registry) {
        this(graph, format, true, List.of(), registry);
    }

    public ParseResult(WorkflowGraph graph, WorkflowFormat format, boolean valid, List<String> errors, NodeRegistry registry) {
        this.graph = Objects.requireNonNull(graph, "graph");
        this.format = Objects.requireNonNull(format, "format");
        this.valid = valid;
        this.errors = errors == null ? List.of() : List.copyOf(errors);
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    public WorkflowGraph graph() {
        return graph;
    }

    public Map<String, Node> nodes() {
        return graph.nodes();
    }

    public WorkflowFormat format() {
        return format;
    }

    public boolean isValid() {
        return valid;
    }

    public List<String> errors() {
        return errors;
    }

    public List<GraphEdge> connections() {
        if (connections == null) {
            connections = Collections.unmodifiableList(graph.edges());
        }
        return connections;
    }

    /**
     * Distinct class_types that the registry does not list as built-in.
     */
    public Set<String> customNodes() {
        if (customNodes == null) {
            var custom = new LinkedHashSet<String>();
            for (var node : graph.nodes().values()) {
                if (!node.classType().isEmpty() && !registry.isBuiltin(node.classType())) {
                    custom.add(node.classType());
                }
            }
            customNodes = Collections.unmodifiableSet(custom);
        }
        return customNodes;
    }

    public Map<String, Object> metadata() {
        var types = new LinkedHashSet<String>();
        graph.nodes().values().forEach(node -> types.add(node.classType()));
        var metadata = new LinkedHashMap<String, Object>();
        metadata.put("node_count", graph.size());
        metadata.put("node_types", new ArrayList<>(types));
        metadata.put("has_custom_nodes", !customNodes().isEmpty());
        metadata.put("connection_count", connections().size());
        metadata.put("format", format.tag());
        return metadata;
    }

    /**
     * Depth-first cycle check over consumer to producer edges, driven by an explicit stack.
     * Edges to nodes outside the graph are ignored.
     *
     * @throws WorkflowException with {@code CIRCULAR_DEPENDENCY} naming a node on the cycle
     */
    public void validateConnections() {
        var dependencies = new LinkedHashMap<String, List<String>>();
        for (var id : graph.ids()) {
            dependencies.put(id, new ArrayList<>());
        }
        for (var edge : connections()) {
            if (dependencies.containsKey(edge.fromNode()) && dependencies.containsKey(edge.toNode())) {
                dependencies.get(edge.toNode()).add(edge.fromNode());
            }
        }

        var visited = new HashSet<String>();
        var onStack = new HashSet<String>();
        for (var root : dependencies.keySet()) {
            if (visited.contains(root)) {
                continue;
            }
            Deque<Frame> stack = new ArrayDeque<>();
            visited.add(root);
            onStack.add(root);
            stack.push(new Frame(root, dependencies.get(root).iterator()));
            while (!stack.isEmpty()) {
                var frame = stack.peek();
                if (frame.next.hasNext()) {
                    var neighbor = frame.next.next();
                    if (onStack.contains(neighbor)) {
                        throw WorkflowException.circularDependency(neighbor);
                    }
                    if (visited.add(neighbor)) {
                        onStack.add(neighbor);
                        stack.push(new Frame(neighbor, dependencies.get(neighbor).iterator()));
                    }
                } else {
                    onStack.remove(frame.node);
                    stack.pop();
                }
            }
        }
    }

    private record Frame(String node, Iterator<String> next) {}
}
