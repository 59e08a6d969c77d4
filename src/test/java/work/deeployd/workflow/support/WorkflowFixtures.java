package work.deeployd.workflow.support;

import com.fasterxml.jackson.core.JsonProcessingException;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import work.deeployd.workflow.graph.GraphCodec;
import work.deeployd.workflow.graph.WorkflowGraph;
import work.deeployd.workflow.registry.NodeRegistry;
import work.deeployd.workflow.shared.JsonValues;

/**
 * Shared helpers for loading the JSON workflows under {@code src/test/resources/workflows}.
 */
public final class WorkflowFixtures {
    public static final String TXT2IMG_UI = "txt2img-ui.json";
    public static final String TXT2IMG_API = "txt2img-api.json";
    public static final String CUSTOM_NODES_API = "custom-nodes-api.json";

    /** Two-node checkpoint to sampler graph. */
    public static final String MINIMAL_API = """
        {
          "1": {"class_type": "CheckpointLoaderSimple", "inputs": {"ckpt_name": "m.safetensors"}},
          "2": {"class_type": "KSampler", "inputs": {"model": ["1", 0], "seed": 42}}
        }
        """;

    private WorkflowFixtures() {}

    public static NodeRegistry registry() {
        return NodeRegistry.defaults();
    }

    public static Path path(String name) {
        return Path.of("src", "test", "resources", "workflows", name).toAbsolutePath();
    }

    public static Map<String, Object> load(String name) {
        try {
            return json(Files.readString(path(name)));
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        }
    }

    public static Map<String, Object> json(String text) {
        try {
            return JsonValues.asMap(JsonValues.read(text));
        } catch (JsonProcessingException ex) {
            throw new IllegalArgumentException("Invalid test JSON", ex);
        }
    }

    public static WorkflowGraph graph(String apiJson) {
        return GraphCodec.decode(json(apiJson));
    }

    public static WorkflowGraph loadGraph(String name) {
        return GraphCodec.decode(load(name));
    }
}
