package work.deeployd.workflow.deps;

import java.util.List;

/**
 * A non built-in node type, with whatever repository information its {@code _meta} record carried.
 */
public record CustomNodeInfo(String classType, String repository, String commit, List<String> pythonDependencies) {
    public CustomNodeInfo {
        pythonDependencies = pythonDependencies == null ? List.of() : List.copyOf(pythonDependencies);
    }
}
