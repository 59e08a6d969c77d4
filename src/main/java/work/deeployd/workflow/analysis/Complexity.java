package work.deeployd.workflow.analysis;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Composite size score: {@code nodes + 2 * connections + 3 * customNodes + depth}.
 */
public record Complexity(int nodes, int connections, int depth, int customNodes, int score, String level) {
    static final int MODERATE_THRESHOLD = 20;
    static final int COMPLEX_THRESHOLD = 50;

    public static Complexity of(int nodes, int connections, int depth, int customNodes) {
        int score = nodes + connections * 2 + customNodes * 3 + depth;
        return new Complexity(nodes, connections, depth, customNodes, score, levelFor(score));
    }

    static String levelFor(int score) {
        if (score < MODERATE_THRESHOLD) {
            return "simple";
        }
        if (score < COMPLEX_THRESHOLD) {
            return "moderate";
        }
        return "complex";
    }

    public Map<String, Object> toMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("nodes", nodes);
        map.put("connections", connections);
        map.put("depth", depth);
        map.put("custom_nodes", customNodes);
        map.put("score", score);
        map.put("level", level);
        return map;
    }
}
