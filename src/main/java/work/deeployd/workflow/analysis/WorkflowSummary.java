package work.deeployd.workflow.analysis;

import java.util.List;

public record WorkflowSummary(
    int totalNodes,
    int builtinNodes,
    int customNodes,
    List<String> customNodeTypes,
    List<String> nodeTypes
) {
    public WorkflowSummary {
        customNodeTypes = List.copyOf(customNodeTypes);
        nodeTypes = List.copyOf(nodeTypes);
    }
}
