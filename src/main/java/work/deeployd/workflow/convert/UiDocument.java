package work.deeployd.workflow.convert;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Editor-form workflow produced by {@link FormatConverter#apiToUi}.
 */
public record UiDocument(List<UiNode> nodes, List<UiLink> links) {
    static final double VERSION = 0.4;

    public UiDocument {
        nodes = nodes == null ? List.of() : List.copyOf(nodes);
        links = links == null ? List.of() : List.copyOf(links);
    }

    public static UiDocument empty() {
        return new UiDocument(List.of(), List.of());
    }

    public int lastNodeId() {
        int last = 0;
        for (var node : nodes) {
            if (node.id() instanceof Integer numeric && numeric > last) {
                last = numeric;
            }
        }
        return last;
    }

    public int lastLinkId() {
        return links.stream().mapToInt(UiLink::id).max().orElse(0);
    }

    /**
     * JSON-ready view in the editor export layout.
     */
    public Map<String, Object> toMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("last_node_id", lastNodeId());
        map.put("last_link_id", lastLinkId());
        var nodeMaps = new ArrayList<Object>();
        nodes.forEach(node -> nodeMaps.add(node.toMap()));
        map.put("nodes", nodeMaps);
        var linkRows = new ArrayList<Object>();
        links.forEach(link -> linkRows.add(link.toList()));
        map.put("links", linkRows);
        map.put("groups", new ArrayList<>());
        map.put("config", new LinkedHashMap<>());
        map.put("extra", new LinkedHashMap<>());
        map.put("version", VERSION);
        return map;
    }
}
