package work.deeployd.workflow.deps;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.Test;
import work.deeployd.workflow.graph.WorkflowGraph;
import work.deeployd.workflow.support.WorkflowFixtures;

class DependencyExtractorTest {
    private final DependencyExtractor extractor = new DependencyExtractor(WorkflowFixtures.registry());

    @Test
    void extractsCheckpointFromMinimalGraph() {
        var dependencies = extractor.extractAll(WorkflowFixtures.graph(WorkflowFixtures.MINIMAL_API));

        assertEquals(List.of("m.safetensors"), dependencies.models().get("checkpoints"));
        assertTrue(dependencies.models().get("loras").isEmpty());
        assertTrue(dependencies.customNodes().isEmpty());
        assertTrue(dependencies.pythonPackages().isEmpty());
    }

    @Test
    void emptyGraphYieldsEmptyCategories() {
        var dependencies = extractor.extractAll(WorkflowGraph.empty());

        assertTrue(dependencies.isEmpty());
        assertTrue(dependencies.models().keySet().containsAll(List.of("checkpoints", "loras", "vaes", "controlnets")));
        dependencies.models().values().forEach(files -> assertTrue(files.isEmpty()));
    }

    @Test
    void deduplicatesModelsWithinCategory() {
        var graph = WorkflowFixtures.graph("""
            {
              "1": {"class_type": "CheckpointLoaderSimple", "inputs": {"ckpt_name": "a.safetensors"}},
              "2": {"class_type": "CheckpointLoaderSimple", "inputs": {"ckpt_name": "a.safetensors"}},
              "3": {"class_type": "LoraLoader", "inputs": {"lora_name": "style.safetensors", "model": ["1", 0]}},
              "4": {"class_type": "VAELoader", "inputs": {"vae_name": ["9", 0]}}
            }
            """);

        var models = extractor.extractModels(graph);

        assertEquals(List.of("a.safetensors"), models.get("checkpoints"));
        assertEquals(List.of("style.safetensors"), models.get("loras"));
        assertTrue(models.get("vaes").isEmpty());
    }

    @Test
    void acceptsUiDocuments() {
        var dependencies = extractor.extractAll(WorkflowFixtures.load(WorkflowFixtures.TXT2IMG_UI));

        assertEquals(List.of("sd15.safetensors"), dependencies.models().get("checkpoints"));
    }

    @Test
    void readsCustomNodeMetadata() {
        var graph = WorkflowFixtures.loadGraph(WorkflowFixtures.CUSTOM_NODES_API);

        var custom = extractor.extractCustomNodes(graph);

        assertEquals(2, custom.size());
        var magCache = custom.get(0);
        assertEquals("MagCache", magCache.classType());
        assertEquals("https://github.com/Zehong-Ma/ComfyUI-MagCache.git", magCache.repository());
        assertEquals("a1b2c3d", magCache.commit());
        assertEquals(List.of("torch>=2.1", "numpy"), magCache.pythonDependencies());
        assertEquals("ShowText|pysssss", custom.get(1).classType());
        assertNull(custom.get(1).commit());
    }

    @Test
    void customNodesWithoutMetadataAreStillListed() {
        var graph = WorkflowFixtures.graph("""
            {"1": {"class_type": "SomePack Node"}, "2": {"class_type": "SomePack Node"}}
            """);

        var custom = extractor.extractCustomNodes(graph);

        assertEquals(List.of(new CustomNodeInfo("SomePack Node", null, null, List.of())), custom);
    }

    @Test
    void collectsDeclaredPythonPackages() {
        var graph = WorkflowFixtures.loadGraph(WorkflowFixtures.CUSTOM_NODES_API);

        assertEquals(List.of("numpy", "opencv-python", "torch>=2.1"), List.copyOf(extractor.extractPythonPackages(graph)));
        assertEquals("numpy\nopencv-python\ntorch>=2.1", extractor.requirementsText(graph));
    }

    @Test
    void detectsCudaPackages() {
        var cuda = extractor.cudaRequirements(WorkflowFixtures.loadGraph(WorkflowFixtures.CUSTOM_NODES_API));

        assertTrue(cuda.requiresCuda());
        assertEquals(List.of("torch"), cuda.cudaPackages());
        assertEquals(Optional.of("11.8"), cuda.recommendedVersion());

        var none = extractor.cudaRequirements(WorkflowFixtures.loadGraph(WorkflowFixtures.TXT2IMG_API));
        assertFalse(none.requiresCuda());
        assertEquals(Optional.empty(), none.recommendedVersion());
    }

    @Test
    void validatesModelPaths() {
        assertFalse(extractor.validateModelPath("../../etc/passwd"));
        assertFalse(extractor.validateModelPath("/etc/passwd"));
        assertFalse(extractor.validateModelPath("C:\\Windows\\x"));
        assertFalse(extractor.validateModelPath("models\\..\\secret.bin"));
        assertFalse(extractor.validateModelPath(""));
        assertTrue(extractor.validateModelPath("models/checkpoints/a.safetensors"));
        assertTrue(extractor.validateModelPath("v1..5.safetensors"));
    }

    @Test
    void describesModelFiles() {
        var info = extractor.modelFileInfo("models/loras/style.safetensors");

        assertEquals("style.safetensors", info.filename());
        assertEquals(".safetensors", info.extension());
        assertEquals("lora", info.type());
        assertEquals("checkpoint", extractor.modelFileInfo("plain.bin").type());
        assertEquals("", extractor.modelFileInfo("README").extension());
    }

    @Test
    void missingPathsAndUrlsDescribeAsUnknown() {
        assertEquals(new ModelFileInfo("", "", "unknown", ""), extractor.modelFileInfo(null));
        assertEquals(new ModelFileInfo("", "", "unknown", ""), extractor.modelFileInfo(" "));
        assertEquals(new RepositoryInfo("unknown", "unknown", "unknown", ""), extractor.resolveRepository(null));
        assertEquals("unknown", extractor.resolveRepository("").platform());
    }

    @Test
    void resolvesRepositoryCoordinates() {
        var github = extractor.resolveRepository("https://github.com/Zehong-Ma/ComfyUI-MagCache.git");
        assertEquals(new RepositoryInfo("github", "Zehong-Ma", "ComfyUI-MagCache",
            "https://github.com/Zehong-Ma/ComfyUI-MagCache.git"), github);

        var gitlab = extractor.resolveRepository("https://gitlab.com/group/project");
        assertEquals("gitlab", gitlab.platform());
        assertEquals("project", gitlab.repo());

        var unknown = extractor.resolveRepository("not a url");
        assertEquals("unknown", unknown.owner());
        assertEquals("unknown", unknown.platform());
    }

    @Test
    void scansImportsThroughExtractor() {
        assertEquals(Set.of("pillow", "numpy"), extractor.pythonImportsFromSource("from PIL import Image\nimport numpy as np"));
    }
}
