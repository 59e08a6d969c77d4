package work.deeployd.workflow.analysis;

/**
 * Loader node and the model file named in its designated field; {@code filename} is null when the
 * field is missing or not a literal string.
 */
public record ModelLoader(String nodeId, String classType, String field, String filename) {}
