package work.deeployd.workflow.graph;

/**
 * A connection seen from both ends: producer output slot to consumer input.
 */
public record GraphEdge(String fromNode, int fromOutput, String toNode, String toInput) {}
