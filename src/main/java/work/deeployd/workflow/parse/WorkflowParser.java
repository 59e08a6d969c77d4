package work.deeployd.workflow.parse;

import com.fasterxml.jackson.core.JsonProcessingException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import work.deeployd.workflow.convert.FormatConverter;
import work.deeployd.workflow.convert.WorkflowFormat;
import work.deeployd.workflow.graph.GraphCodec;
import work.deeployd.workflow.graph.WorkflowException;
import work.deeployd.workflow.graph.WorkflowGraph;
import work.deeployd.workflow.registry.NodeRegistry;
import work.deeployd.workflow.shared.JsonValues;

/**
 * Reads workflow documents in either serialization and validates node structure. Cycle detection is
 * left to {@link ParseResult#validateConnections()}.
 */
public final class WorkflowParser {
    private final NodeRegistry registry;
    private final FormatConverter converter;

    public WorkflowParser(NodeRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.converter = new FormatConverter(registry);
    }

    public ParseResult parse(Object document) {
        if (!(document instanceof Map<?, ?>)) {
            throw WorkflowException.malformed("Workflow document must be a JSON object", null);
        }
        var workflow = JsonValues.asMap(document);
        if (workflow.isEmpty()) {
            throw WorkflowException.emptyGraph("Empty workflow provided");
        }

        var format = FormatConverter.detectFormat(workflow);
        WorkflowGraph graph;
        if (format == WorkflowFormat.UI) {
            graph = converter.uiToApi(workflow);
            for (var node : graph.nodes().values()) {
                if (node.classType().isBlank()) {
                    throw WorkflowException.invalidNode(node.id(), "class_type must be a non-empty string");
                }
            }
        } else {
            validateApiNodes(workflow);
            graph = GraphCodec.decode(workflow);
        }

        if (graph.isEmpty()) {
            throw WorkflowException.emptyGraph("No nodes found in workflow");
        }
        return new ParseResult(graph, format, registry);
    }

    public ParseResult parseFromText(String text) {
        if (text == null) {
            throw WorkflowException.malformed("Workflow text is null", null);
        }
        try {
            return parse(JsonValues.read(text));
        } catch (JsonProcessingException ex) {
            throw WorkflowException.malformed("Malformed workflow JSON: " + ex.getOriginalMessage(), ex);
        }
    }

    public ParseResult parseFromPath(Path path) {
        if (path == null || !Files.exists(path)) {
            throw WorkflowException.fileNotFound(String.valueOf(path));
        }
        String text;
        try {
            text = Files.readString(path);
        } catch (IOException ex) {
            throw WorkflowException.malformed("Unable to read workflow file: " + path, ex);
        }
        return parseFromText(text);
    }

    private static void validateApiNodes(Map<String, Object> workflow) {
        for (var entry : workflow.entrySet()) {
            var nodeId = entry.getKey();
            if (GraphCodec.isMetadataKey(nodeId)) {
                continue;
            }
            if (!(entry.getValue() instanceof Map<?, ?> body)) {
                throw WorkflowException.invalidNode(nodeId, "node must be an object");
            }
            if (!(body.get(GraphCodec.CLASS_TYPE) instanceof String classType) || classType.isBlank()) {
                throw WorkflowException.invalidNode(nodeId, "class_type must be a non-empty string");
            }
            if (body.containsKey(GraphCodec.INPUTS) && !(body.get(GraphCodec.INPUTS) instanceof Map<?, ?>)) {
                throw WorkflowException.invalidNode(nodeId, "inputs must be an object");
            }
            var outputs = body.get(GraphCodec.OUTPUTS);
            if (outputs != null && !(outputs instanceof List<?>)) {
                throw WorkflowException.invalidNode(nodeId, "outputs must be a list");
            }
        }
    }
}
