package work.deeployd.workflow.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable workflow node. Input values are either literals or {@link Connection}s.
 */
public record Node(
    String id,
    String classType,
    Map<String, Object> inputs,
    List<String> outputs,
    Map<String, Object> meta
) {
    public Node {
        Objects.requireNonNull(id, "id");
        classType = classType == null ? "" : classType;
        inputs = inputs == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(inputs));
        outputs = outputs == null ? List.of() : List.copyOf(outputs);
        meta = meta == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(meta));
    }

    public Node(String id, String classType, Map<String, Object> inputs) {
        this(id, classType, inputs, List.of(), Map.of());
    }

    /**
     * Connection-valued inputs keyed by input name, in declaration order.
     */
    public Map<String, Connection> connections() {
        var result = new LinkedHashMap<String, Connection>();
        inputs.forEach((name, value) -> {
            if (value instanceof Connection connection) {
                result.put(name, connection);
            }
        });
        return result;
    }

    /**
     * Literal-valued inputs keyed by input name, in declaration order.
     */
    public Map<String, Object> literals() {
        var result = new LinkedHashMap<String, Object>();
        inputs.forEach((name, value) -> {
            if (!(value instanceof Connection)) {
                result.put(name, value);
            }
        });
        return result;
    }

    public boolean hasConnections() {
        return inputs.values().stream().anyMatch(Connection.class::isInstance);
    }

    public Node withInput(String name, Object value) {
        var copy = new LinkedHashMap<>(inputs);
        copy.put(name, value);
        return new Node(id, classType, copy, outputs, meta);
    }

    public Node withoutInput(String name) {
        if (!inputs.containsKey(name)) {
            return this;
        }
        var copy = new LinkedHashMap<>(inputs);
        copy.remove(name);
        return new Node(id, classType, copy, outputs, meta);
    }

    public Node withOutputs(List<String> newOutputs) {
        return new Node(id, classType, inputs, new ArrayList<>(newOutputs), meta);
    }
}
