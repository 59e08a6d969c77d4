package work.deeployd.workflow.analysis;

public enum NodeKind {
    BUILTIN,
    CUSTOM,
    UNKNOWN
}
