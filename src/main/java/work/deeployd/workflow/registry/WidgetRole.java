package work.deeployd.workflow.registry;

/**
 * Whether a positional widget value is stored as an input or only read (control tokens such as
 * {@code control_after_generate}).
 */
public enum WidgetRole {
    VALUE,
    CONTROL
}
