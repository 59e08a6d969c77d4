package work.deeployd.workflow.analysis;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import work.deeployd.workflow.graph.Connection;

/**
 * Connection counts for a graph. {@code outputConsumers} is keyed by producer output slot.
 */
public record ConnectionStats(
    int totalConnections,
    String maxInputsNode,
    Map<String, Integer> inputCounts,
    Map<Connection, Integer> outputConsumers
) {
    public ConnectionStats {
        inputCounts = Collections.unmodifiableMap(new LinkedHashMap<>(inputCounts));
        outputConsumers = Collections.unmodifiableMap(new LinkedHashMap<>(outputConsumers));
    }

    public Optional<String> busiestNode() {
        return Optional.ofNullable(maxInputsNode);
    }

    public int maxOutputConsumers() {
        return outputConsumers.values().stream().mapToInt(Integer::intValue).max().orElse(0);
    }
}
