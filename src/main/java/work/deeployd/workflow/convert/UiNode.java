package work.deeployd.workflow.convert;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record UiNode(
    Object id,
    String type,
    List<Object> widgetsValues,
    List<UiInput> inputs,
    List<UiOutput> outputs,
    int x,
    int y,
    int order
) {
    static final int WIDTH = 270;
    static final int HEIGHT = 100;

    public UiNode {
        widgetsValues = widgetsValues == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(widgetsValues));
        inputs = inputs == null ? List.of() : List.copyOf(inputs);
        outputs = outputs == null ? List.of() : List.copyOf(outputs);
    }

    Map<String, Object> toMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("id", id);
        map.put("type", type);
        map.put("pos", List.of(x, y));
        map.put("size", List.of(WIDTH, HEIGHT));
        map.put("flags", new LinkedHashMap<>());
        map.put("order", order);
        map.put("mode", 0);
        var inputMaps = new ArrayList<Object>();
        inputs.forEach(input -> inputMaps.add(input.toMap()));
        map.put("inputs", inputMaps);
        var outputMaps = new ArrayList<Object>();
        outputs.forEach(output -> outputMaps.add(output.toMap()));
        map.put("outputs", outputMaps);
        map.put("properties", new LinkedHashMap<>());
        map.put("widgets_values", new ArrayList<>(widgetsValues));
        return map;
    }
}
