package work.deeployd.workflow.validate;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;
import work.deeployd.workflow.analysis.GraphAnalyzer;
import work.deeployd.workflow.analysis.NodeKind;
import work.deeployd.workflow.convert.FormatConverter;
import work.deeployd.workflow.deps.DependencyExtractor;
import work.deeployd.workflow.graph.NodeIdOrder;
import work.deeployd.workflow.graph.WorkflowError;
import work.deeployd.workflow.graph.WorkflowException;
import work.deeployd.workflow.graph.WorkflowGraph;
import work.deeployd.workflow.registry.NodeRegistry;

/**
 * Collects every problem in a graph instead of stopping at the first one. Errors make the result
 * invalid; warnings never do.
 */
public final class WorkflowValidator {
    private final NodeRegistry registry;
    private final FormatConverter converter;
    private final GraphAnalyzer analyzer;
    private final DependencyExtractor extractor;

    public WorkflowValidator(NodeRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.converter = new FormatConverter(registry);
        this.analyzer = new GraphAnalyzer(registry);
        this.extractor = new DependencyExtractor(registry);
    }

    public ValidationResult validate(Map<String, Object> document) {
        return validate(converter.convert(document));
    }

    public ValidationResult validate(WorkflowGraph graph) {
        var errors = new ArrayList<String>();
        var warnings = new ArrayList<String>();
        var metadata = new LinkedHashMap<String, Object>();
        if (graph.isEmpty()) {
            errors.add("Workflow is empty");
            return ValidationResult.of(errors, warnings, metadata);
        }
        metadata.put("node_count", graph.size());

        checkStructure(graph, errors);
        errors.addAll(analyzer.connectionIssues(graph));
        checkOutputIndexes(graph, errors);
        var acyclic = checkCycles(graph, errors);
        checkRequiredInputs(graph, errors);
        checkModelPaths(graph, errors);

        checkOutputNodes(graph, warnings);
        checkCustomNodes(graph, warnings);
        checkUnusedNodes(graph, warnings);

        if (acyclic) {
            metadata.put("complexity", analyzer.complexity(graph).toMap());
        }
        return ValidationResult.of(errors, warnings, metadata);
    }

    private static void checkStructure(WorkflowGraph graph, List<String> errors) {
        for (var node : graph.nodes().values()) {
            if (node.classType().isBlank()) {
                errors.add(String.format("Node %s: missing 'class_type' field", node.id()));
            }
        }
    }

    private static void checkOutputIndexes(WorkflowGraph graph, List<String> errors) {
        for (var node : graph.nodes().values()) {
            node.connections().forEach((input, connection) -> {
                var producer = graph.node(connection.sourceNodeId());
                if (producer.isEmpty()) {
                    return;
                }
                var outputs = producer.get().outputs();
                int index = connection.outputIndex();
                if (index < 0 || (!outputs.isEmpty() && index >= outputs.size())) {
                    errors.add(String.format("Node %s: input '%s' references invalid output index %d (node '%s' has %d outputs)",
                        node.id(), input, index, connection.sourceNodeId(), outputs.size()));
                }
            });
        }
    }

    private boolean checkCycles(WorkflowGraph graph, List<String> errors) {
        try {
            analyzer.executionOrder(graph);
            return true;
        } catch (WorkflowException ex) {
            if (ex.error() != WorkflowError.CYCLE) {
                throw ex;
            }
            errors.add(ex.getMessage());
            return false;
        }
    }

    private void checkRequiredInputs(WorkflowGraph graph, List<String> errors) {
        for (var node : graph.nodes().values()) {
            for (var required : registry.requiredInputs(node.classType())) {
                if (node.inputs().get(required) == null) {
                    errors.add(String.format("Node %s (%s): missing required input '%s'", node.id(), node.classType(), required));
                }
            }
        }
    }

    private void checkModelPaths(WorkflowGraph graph, List<String> errors) {
        for (var loader : analyzer.modelLoaders(graph)) {
            if (loader.filename() != null && !extractor.validateModelPath(loader.filename())) {
                errors.add(String.format("Node %s: unsafe model path in '%s': %s",
                    loader.nodeId(), loader.field(), loader.filename()));
            }
        }
    }

    private void checkOutputNodes(WorkflowGraph graph, List<String> warnings) {
        if (analyzer.outputNodes(graph).isEmpty()) {
            warnings.add("No output nodes found; workflow may not produce visible results");
        }
    }

    private void checkCustomNodes(WorkflowGraph graph, List<String> warnings) {
        var custom = new TreeSet<String>();
        for (var node : graph.nodes().values()) {
            if (analyzer.nodeKind(node.classType()) == NodeKind.CUSTOM) {
                custom.add(node.classType());
            }
        }
        if (!custom.isEmpty()) {
            warnings.add("Workflow contains custom nodes: " + String.join(", ", custom) + ". Ensure these are installed.");
        }
    }

    /**
     * Nodes whose outputs nobody consumes, output nodes excepted.
     */
    private void checkUnusedNodes(WorkflowGraph graph, List<String> warnings) {
        var referenced = new HashSet<String>();
        graph.nodes().values().forEach(node -> node.connections().values().forEach(c -> referenced.add(c.sourceNodeId())));
        var unused = new TreeSet<String>(NodeIdOrder.INSTANCE);
        for (var node : graph.nodes().values()) {
            if (!referenced.contains(node.id()) && !registry.isOutputNode(node.classType())) {
                unused.add(node.id());
            }
        }
        if (!unused.isEmpty()) {
            warnings.add("Disconnected or unused nodes found: " + String.join(", ", unused));
        }
    }
}
