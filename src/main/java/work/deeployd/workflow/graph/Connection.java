package work.deeployd.workflow.graph;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import work.deeployd.workflow.shared.JsonValues;

/**
 * Reference from a consumer input to output slot {@code outputIndex} of node {@code sourceNodeId}.
 */
public record Connection(String sourceNodeId, int outputIndex) {
    public Connection {
        Objects.requireNonNull(sourceNodeId, "sourceNodeId");
    }

    /**
     * Interprets a decoded input value; only a two-element {@code [string, integer]} list is a connection.
     */
    public static Optional<Connection> fromValue(Object value) {
        if (value instanceof Connection connection) {
            return Optional.of(connection);
        }
        if (value instanceof List<?> list && list.size() == 2
            && list.get(0) instanceof String source
            && JsonValues.isIntegral(list.get(1))) {
            return Optional.of(new Connection(source, ((Number) list.get(1)).intValue()));
        }
        return Optional.empty();
    }

    public boolean references(String nodeId) {
        return sourceNodeId.equals(nodeId);
    }

    public List<Object> toList() {
        return List.of(sourceNodeId, outputIndex);
    }

    @Override
    public String toString() {
        return sourceNodeId + ":" + outputIndex;
    }
}
