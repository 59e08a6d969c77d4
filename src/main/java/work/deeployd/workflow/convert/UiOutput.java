package work.deeployd.workflow.convert;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record UiOutput(String name, List<Integer> links) {
    public UiOutput {
        links = links == null ? List.of() : List.copyOf(links);
    }

    Map<String, Object> toMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("name", name);
        map.put("type", name);
        map.put("links", new ArrayList<>(links));
        return map;
    }
}
