package work.deeployd.workflow.preprocess;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import work.deeployd.workflow.graph.WorkflowGraph;

/**
 * Cleaned graph together with the ids of removed nodes and the recovered anomalies.
 */
public record PreprocessResult(WorkflowGraph graph, Set<String> removedNodeIds, List<String> warnings) {
    public PreprocessResult {
        removedNodeIds = removedNodeIds == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(removedNodeIds));
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }
}
