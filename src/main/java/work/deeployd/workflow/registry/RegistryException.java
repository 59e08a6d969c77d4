package work.deeployd.workflow.registry;

/**
 * Raised when a node registry manifest cannot be read or is not valid TOML.
 */
public final class RegistryException extends IllegalStateException {
    public RegistryException(String message) {
        super(message);
    }

    public RegistryException(String message, Throwable cause) {
        super(message, cause);
    }
}
