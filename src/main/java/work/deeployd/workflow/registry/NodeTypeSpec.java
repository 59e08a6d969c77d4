package work.deeployd.workflow.registry;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Static description of one class_type: widget schema, input slot order, loader field and required inputs.
 */
public record NodeTypeSpec(
    String classType,
    boolean builtin,
    List<WidgetField> widgets,
    List<String> inputSlots,
    String modelField,
    String modelCategory,
    List<String> requiredInputs,
    boolean output
) {
    public NodeTypeSpec {
        Objects.requireNonNull(classType, "classType");
        widgets = widgets == null ? List.of() : List.copyOf(widgets);
        inputSlots = inputSlots == null ? List.of() : List.copyOf(inputSlots);
        requiredInputs = requiredInputs == null ? List.of() : List.copyOf(requiredInputs);
    }

    public static NodeTypeSpec builtin(String classType, List<WidgetField> widgets, List<String> inputSlots) {
        return new NodeTypeSpec(classType, true, widgets, inputSlots, null, null, List.of(), false);
    }

    public Optional<String> modelFieldName() {
        return Optional.ofNullable(modelField).filter(f -> !f.isBlank());
    }

    public boolean isModelLoader() {
        return modelFieldName().isPresent();
    }
}
