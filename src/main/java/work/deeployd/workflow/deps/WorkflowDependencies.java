package work.deeployd.workflow.deps;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

public record WorkflowDependencies(
    Map<String, List<String>> models,
    List<CustomNodeInfo> customNodes,
    Set<String> pythonPackages
) {
    public WorkflowDependencies {
        var copy = new LinkedHashMap<String, List<String>>();
        models.forEach((category, files) -> copy.put(category, List.copyOf(files)));
        models = Collections.unmodifiableMap(copy);
        customNodes = List.copyOf(customNodes);
        pythonPackages = Collections.unmodifiableSet(new LinkedHashSet<>(pythonPackages));
    }

    public boolean isEmpty() {
        return customNodes.isEmpty()
            && pythonPackages.isEmpty()
            && models.values().stream().allMatch(List::isEmpty);
    }

    public Map<String, Object> toSerializableMap() {
        var nodes = new ArrayList<Map<String, Object>>();
        for (var info : customNodes) {
            var node = new LinkedHashMap<String, Object>();
            node.put("class_type", info.classType());
            node.put("repository", info.repository());
            node.put("commit", info.commit());
            node.put("python_dependencies", info.pythonDependencies());
            nodes.add(node);
        }
        var map = new LinkedHashMap<String, Object>();
        map.put("models", models);
        map.put("custom_nodes", nodes);
        map.put("python_packages", new ArrayList<>(pythonPackages));
        return map;
    }
}
