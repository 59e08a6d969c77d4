package work.deeployd.workflow.graph;

/**
 * Exception carrying a {@link WorkflowError} code and the node id or path it concerns.
 */
public final class WorkflowException extends RuntimeException {
    private final WorkflowError error;
    private final String subject;

    public WorkflowException(WorkflowError error, String subject, String message) {
        this(error, subject, message, null);
    }

    public WorkflowException(WorkflowError error, String subject, String message, Throwable cause) {
        super(message, cause);
        this.error = error;
        this.subject = subject;
    }

    public static WorkflowException malformed(String message, Throwable cause) {
        return new WorkflowException(WorkflowError.MALFORMED_INPUT, null, message, cause);
    }

    public static WorkflowException fileNotFound(String path) {
        return new WorkflowException(WorkflowError.FILE_NOT_FOUND, path, "Workflow file not found: " + path);
    }

    public static WorkflowException emptyGraph(String message) {
        return new WorkflowException(WorkflowError.EMPTY_GRAPH, null, message);
    }

    public static WorkflowException invalidNode(String nodeId, String reason) {
        return new WorkflowException(
            WorkflowError.INVALID_NODE_STRUCTURE,
            nodeId,
            "Invalid workflow: Node " + nodeId + " has invalid structure (" + reason + ")"
        );
    }

    public static WorkflowException circularDependency(String nodeId) {
        return new WorkflowException(
            WorkflowError.CIRCULAR_DEPENDENCY,
            nodeId,
            "Circular dependency detected involving node " + nodeId
        );
    }

    public static WorkflowException cycle(String nodeId) {
        return new WorkflowException(
            WorkflowError.CYCLE,
            nodeId,
            "Workflow contains a cycle; node " + nodeId + " cannot be scheduled"
        );
    }

    public WorkflowError error() {
        return error;
    }

    public String subject() {
        return subject;
    }
}
