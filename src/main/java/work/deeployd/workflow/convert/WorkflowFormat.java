package work.deeployd.workflow.convert;

import java.util.Locale;

/**
 * Serialization convention of a workflow document.
 */
public enum WorkflowFormat {
    /** Editor export: positional widget values plus a link table. */
    UI,
    /** Canonical form: node id to named inputs. */
    API;

    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }
}
