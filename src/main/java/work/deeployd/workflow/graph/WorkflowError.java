package work.deeployd.workflow.graph;

/**
 * Failure categories raised while reading or ordering a workflow graph.
 */
public enum WorkflowError {
    MALFORMED_INPUT,
    FILE_NOT_FOUND,
    EMPTY_GRAPH,
    INVALID_NODE_STRUCTURE,
    CIRCULAR_DEPENDENCY,
    CYCLE
}
