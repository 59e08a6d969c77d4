package work.deeployd.workflow.analysis;

import java.util.Locale;

/**
 * Functional grouping derived from class_type naming conventions.
 */
public enum NodeCategory {
    LOADER,
    SAMPLER,
    ENCODER,
    DECODER,
    OUTPUT,
    LATENT,
    CONDITIONING,
    OTHER;

    public static NodeCategory classify(String classType) {
        if (classType == null || classType.isEmpty()) {
            return OTHER;
        }
        if (classType.contains("Load")) {
            return LOADER;
        }
        if (classType.contains("Sampler")) {
            return SAMPLER;
        }
        if (classType.contains("Encode")) {
            return ENCODER;
        }
        if (classType.contains("Decode")) {
            return DECODER;
        }
        if (classType.contains("Save") || classType.contains("Preview")) {
            return OUTPUT;
        }
        if (classType.contains("Latent")) {
            return LATENT;
        }
        if (classType.contains("Conditioning") || classType.contains("CLIP")) {
            return CONDITIONING;
        }
        return OTHER;
    }

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }
}
