package work.deeployd.workflow.convert;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Declared input slot of a UI node; {@code link} is null when the slot is unconnected.
 */
public record UiInput(String name, Integer link) {
    Map<String, Object> toMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("name", name);
        map.put("link", link);
        return map;
    }
}
