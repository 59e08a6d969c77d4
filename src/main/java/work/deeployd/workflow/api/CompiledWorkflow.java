package work.deeployd.workflow.api;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import work.deeployd.workflow.analysis.Complexity;
import work.deeployd.workflow.convert.WorkflowFormat;
import work.deeployd.workflow.deps.WorkflowDependencies;
import work.deeployd.workflow.graph.GraphCodec;
import work.deeployd.workflow.graph.WorkflowGraph;
import work.deeployd.workflow.validate.ValidationResult;

/**
 * Everything {@link WorkflowCompiler#compile} learned about one workflow document.
 */
public record CompiledWorkflow(
    WorkflowFormat sourceFormat,
    WorkflowGraph graph,
    Set<String> removedNodeIds,
    List<String> warnings,
    List<String> executionOrder,
    Complexity complexity,
    WorkflowDependencies dependencies,
    ValidationResult validation,
    Map<String, Object> metadata
) {
    public CompiledWorkflow {
        removedNodeIds = Collections.unmodifiableSet(new LinkedHashSet<>(removedNodeIds));
        warnings = List.copyOf(warnings);
        executionOrder = List.copyOf(executionOrder);
        metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public boolean isValid() {
        return validation.valid();
    }

    public Map<String, Object> toSerializableMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("format", sourceFormat.tag());
        map.put("valid", validation.valid());
        map.put("workflow", GraphCodec.encode(graph));
        map.put("removed_nodes", new ArrayList<>(removedNodeIds));
        map.put("warnings", warnings);
        map.put("execution_order", executionOrder);
        map.put("complexity", complexity.toMap());
        map.put("dependencies", dependencies.toSerializableMap());
        map.put("validation", validation.toSerializableMap());
        map.put("metadata", metadata);
        return map;
    }
}
