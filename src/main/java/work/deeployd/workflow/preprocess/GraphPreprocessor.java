package work.deeployd.workflow.preprocess;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.deeployd.workflow.convert.FormatConverter;
import work.deeployd.workflow.graph.Connection;
import work.deeployd.workflow.graph.Node;
import work.deeployd.workflow.graph.WorkflowGraph;
import work.deeployd.workflow.registry.NodeRegistry;

/**
 * Removes presentation-only nodes so the graph can be executed.
 *
 * <p>Routing nodes (the registry's bypass set) are elided by pointing their consumers at the routing
 * node's own upstream connection; chains of routing nodes are followed to the first real producer.
 * Other presentation nodes (drop set) are deleted together with every input that referenced them.
 * A final pass deletes any connection whose producer no longer exists. Anomalies are recorded as
 * warnings, never thrown.
 */
public final class GraphPreprocessor {
    private static final Logger LOG = LoggerFactory.getLogger(GraphPreprocessor.class);

    private final NodeRegistry registry;
    private final FormatConverter converter;

    public GraphPreprocessor(NodeRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.converter = new FormatConverter(registry);
    }

    /**
     * Accepts either serialization; UI documents are converted first.
     */
    public PreprocessResult preprocess(Map<String, Object> document) {
        return preprocess(converter.convert(document));
    }

    public PreprocessResult preprocess(WorkflowGraph graph) {
        var working = new LinkedHashMap<>(graph.nodes());
        var consumers = consumersByProducer(working);
        var removed = new LinkedHashSet<String>();
        var warnings = new ArrayList<String>();

        var bypass = new LinkedHashSet<String>();
        var drop = new LinkedHashSet<String>();
        for (var node : working.values()) {
            if (registry.isBypassable(node.classType())) {
                bypass.add(node.id());
            } else if (registry.isDroppable(node.classType())) {
                drop.add(node.id());
            }
        }

        var upstream = new LinkedHashMap<String, Connection>();
        for (var id : bypass) {
            working.get(id).connections().values().stream().findFirst().ifPresent(c -> upstream.put(id, c));
        }

        for (var id : bypass) {
            var target = resolveUpstream(upstream.get(id), bypass, upstream);
            for (var ref : consumers.getOrDefault(id, List.of())) {
                if (bypass.contains(ref.nodeId())) {
                    continue;
                }
                var consumer = working.get(ref.nodeId());
                if (consumer == null || !referencesNode(consumer, ref.input(), id)) {
                    continue;
                }
                if (target != null) {
                    working.put(consumer.id(), consumer.withInput(ref.input(), target));
                } else {
                    working.put(consumer.id(), consumer.withoutInput(ref.input()));
                    warnings.add(warn("Removed input %s.%s: routing node %s has no upstream connection",
                        consumer.id(), ref.input(), id));
                }
            }
            working.remove(id);
            removed.add(id);
            LOG.info("Bypassed routing node {}", id);
        }

        for (var id : drop) {
            var node = working.get(id);
            for (var ref : consumers.getOrDefault(id, List.of())) {
                var consumer = working.get(ref.nodeId());
                if (consumer == null || !referencesNode(consumer, ref.input(), id)) {
                    continue;
                }
                working.put(consumer.id(), consumer.withoutInput(ref.input()));
                warnings.add(warn("Removed input %s.%s that referenced presentation node %s (%s)",
                    consumer.id(), ref.input(), id, node.classType()));
            }
            working.remove(id);
            removed.add(id);
            warnings.add(warn("Removed presentation-only node %s (%s)", id, node.classType()));
        }

        removeBrokenConnections(working, warnings);
        return new PreprocessResult(WorkflowGraph.of(working), removed, warnings);
    }

    /**
     * Snapshot of producer id to the (consumer, input) pairs that read from it.
     */
    private static Map<String, List<InputRef>> consumersByProducer(Map<String, Node> nodes) {
        var consumers = new LinkedHashMap<String, List<InputRef>>();
        for (var node : nodes.values()) {
            node.connections().forEach((input, connection) ->
                consumers.computeIfAbsent(connection.sourceNodeId(), k -> new ArrayList<>())
                    .add(new InputRef(node.id(), input)));
        }
        return consumers;
    }

    private static Connection resolveUpstream(Connection start, Set<String> bypass, Map<String, Connection> upstream) {
        var current = start;
        var seen = new HashSet<String>();
        while (current != null && bypass.contains(current.sourceNodeId())) {
            if (!seen.add(current.sourceNodeId())) {
                return null;
            }
            current = upstream.get(current.sourceNodeId());
        }
        return current;
    }

    private static boolean referencesNode(Node consumer, String input, String producerId) {
        return consumer.inputs().get(input) instanceof Connection connection && connection.references(producerId);
    }

    private static void removeBrokenConnections(Map<String, Node> working, List<String> warnings) {
        for (var id : new ArrayList<>(working.keySet())) {
            var node = working.get(id);
            for (var entry : node.connections().entrySet()) {
                var source = entry.getValue().sourceNodeId();
                if (!working.containsKey(source)) {
                    node = node.withoutInput(entry.getKey());
                    warnings.add(warn("Removing broken connection from %s to %s.%s", source, id, entry.getKey()));
                }
            }
            working.put(id, node);
        }
    }

    private static String warn(String template, Object... args) {
        var message = String.format(template, args);
        LOG.warn(message);
        return message;
    }

    private record InputRef(String nodeId, String input) {}
}
