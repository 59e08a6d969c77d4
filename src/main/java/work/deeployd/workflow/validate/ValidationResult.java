package work.deeployd.workflow.validate;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of {@link WorkflowValidator#validate}. A result is valid exactly when it carries no errors.
 */
public record ValidationResult(boolean valid, List<String> errors, List<String> warnings, Map<String, Object> metadata) {
    public ValidationResult {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
        metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static ValidationResult of(List<String> errors, List<String> warnings, Map<String, Object> metadata) {
        return new ValidationResult(errors.isEmpty(), errors, warnings, metadata);
    }

    public String report() {
        var lines = new ArrayList<String>();
        lines.add("Validation Status: " + (valid ? "VALID" : "INVALID"));
        if (metadata.containsKey("node_count")) {
            lines.add("Total: " + metadata.get("node_count") + " nodes");
        }
        lines.add("Errors: " + errors.size());
        errors.forEach(error -> lines.add("  - " + error));
        lines.add("Warnings: " + warnings.size());
        warnings.forEach(warning -> lines.add("  - " + warning));
        if (metadata.get("complexity") instanceof Map<?, ?> complexity) {
            lines.add("Complexity: " + complexity.get("level"));
        }
        return String.join("\n", lines);
    }

    public Map<String, Object> toSerializableMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("valid", valid);
        map.put("errors", errors);
        map.put("warnings", warnings);
        map.put("metadata", metadata);
        return map;
    }
}
