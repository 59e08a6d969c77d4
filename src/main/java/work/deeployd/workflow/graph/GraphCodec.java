package work.deeployd.workflow.graph;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;
import work.deeployd.workflow.shared.JsonValues;

/**
 * Maps between the API-form JSON document (node id to {@code class_type}/{@code inputs}) and {@link WorkflowGraph}.
 */
public final class GraphCodec {
    public static final String CLASS_TYPE = "class_type";
    public static final String INPUTS = "inputs";
    public static final String OUTPUTS = "outputs";
    public static final String META = "_meta";

    private GraphCodec() {}

    /**
     * Keys starting with {@code _} hold document metadata rather than nodes.
     */
    public static boolean isMetadataKey(String key) {
        return key.startsWith("_");
    }

    /**
     * Lenient decode: entries that are not objects are skipped, a missing class_type becomes empty.
     */
    public static WorkflowGraph decode(Map<String, Object> document) {
        if (document == null || document.isEmpty()) {
            return WorkflowGraph.empty();
        }
        var nodes = new LinkedHashMap<String, Node>();
        for (var entry : document.entrySet()) {
            if (isMetadataKey(entry.getKey())) {
                continue;
            }
            var body = JsonValues.asMap(entry.getValue());
            if (body == null) {
                continue;
            }
            nodes.put(entry.getKey(), decodeNode(entry.getKey(), body));
        }
        return WorkflowGraph.of(nodes);
    }

    public static Node decodeNode(String id, Map<String, Object> body) {
        var classType = JsonValues.asText(body.get(CLASS_TYPE));
        var inputs = new LinkedHashMap<String, Object>();
        var rawInputs = JsonValues.asMap(body.get(INPUTS));
        if (rawInputs != null) {
            rawInputs.forEach((name, value) -> inputs.put(name, decodeInput(value)));
        }
        var outputs = new ArrayList<String>();
        var rawOutputs = JsonValues.asList(body.get(OUTPUTS));
        if (rawOutputs != null) {
            for (var output : rawOutputs) {
                outputs.add(String.valueOf(output));
            }
        }
        var meta = JsonValues.asMap(JsonValues.copy(body.get(META)));
        return new Node(id, classType, inputs, outputs, meta);
    }

    public static Object decodeInput(Object value) {
        return Connection.fromValue(value).<Object>map(c -> c).orElseGet(() -> JsonValues.copy(value));
    }

    public static Map<String, Object> encode(WorkflowGraph graph) {
        var document = new LinkedHashMap<String, Object>();
        for (var node : graph.nodes().values()) {
            document.put(node.id(), encodeNode(node));
        }
        return document;
    }

    public static Map<String, Object> encodeNode(Node node) {
        var body = new LinkedHashMap<String, Object>();
        body.put(CLASS_TYPE, node.classType());
        var inputs = new LinkedHashMap<String, Object>();
        node.inputs().forEach((name, value) -> inputs.put(name, encodeInput(value)));
        body.put(INPUTS, inputs);
        body.put(OUTPUTS, new ArrayList<>(node.outputs()));
        if (!node.meta().isEmpty()) {
            body.put(META, JsonValues.copy(node.meta()));
        }
        return body;
    }

    public static Object encodeInput(Object value) {
        if (value instanceof Connection connection) {
            return new ArrayList<>(connection.toList());
        }
        return JsonValues.copy(value);
    }
}
