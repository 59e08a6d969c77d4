package work.deeployd.workflow.analysis;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Producers a node reads from, each with the input names fed by it.
 */
public record NodeDependencies(String classType, Map<String, List<String>> dependencies) {
    public NodeDependencies {
        var copy = new LinkedHashMap<String, List<String>>();
        dependencies.forEach((producer, inputs) -> copy.put(producer, List.copyOf(inputs)));
        dependencies = Collections.unmodifiableMap(copy);
    }
}
