package work.deeployd.workflow.registry;

import java.util.Objects;

public record WidgetField(String name, WidgetRole role) {
    public WidgetField {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(role, "role");
    }

    public static WidgetField value(String name) {
        return new WidgetField(name, WidgetRole.VALUE);
    }

    public static WidgetField control(String name) {
        return new WidgetField(name, WidgetRole.CONTROL);
    }

    public boolean isControl() {
        return role == WidgetRole.CONTROL;
    }
}
