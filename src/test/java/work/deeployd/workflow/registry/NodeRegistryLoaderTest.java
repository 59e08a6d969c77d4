package work.deeployd.workflow.registry;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class NodeRegistryLoaderTest {
    @Test
    void bundledManifestDescribesStockNodes() {
        var registry = NodeRegistry.defaults();

        assertTrue(registry.isBuiltin("KSampler"));
        assertTrue(registry.isBuiltin("VAEDecodeTiled"));
        assertFalse(registry.isBuiltin("MagCache"));
        assertTrue(registry.isKnown("MagCache"));
        assertEquals(Optional.of("ckpt_name"), registry.modelField("CheckpointLoaderSimple"));
        assertEquals(Optional.of("checkpoints"), registry.modelCategory("CheckpointLoaderSimple"));
        assertEquals(Optional.of("latent_image"), registry.inputSlotName("KSampler", 3));
        assertEquals(Optional.empty(), registry.inputSlotName("KSampler", 9));
        assertTrue(registry.isOutputNode("SaveImage"));
        assertTrue(registry.isBypassable("Reroute"));
        assertTrue(registry.isDroppable("Note"));
        assertFalse(registry.isDroppable("Reroute"));
        assertTrue(registry.modelCategories().containsAll(List.of("checkpoints", "loras", "vaes", "controlnets")));
    }

    @Test
    void widgetSchemaMarksControlTokens() {
        var schema = NodeRegistry.defaults().widgetSchema("KSampler");

        assertEquals("seed", schema.get(0).name());
        assertFalse(schema.get(0).isControl());
        assertEquals("control_after_generate", schema.get(1).name());
        assertTrue(schema.get(1).isControl());
        assertEquals(7, schema.size());
    }

    @Test
    void parsesQuotedNodeKeys() {
        var registry = NodeRegistryLoader.parse("""
            [builtin]
            types = ["Primitive"]

            [nodes."My Node|pack"]
            builtin = false
            widgets = ["value", "mode"]
            controls = ["mode"]
            inputs = ["source"]

            [presentation]
            bypass = ["Relay"]
            """, "inline");

        assertTrue(registry.isBuiltin("Primitive"));
        assertFalse(registry.isBuiltin("My Node|pack"));
        assertTrue(registry.widgetSchema("My Node|pack").get(1).isControl());
        assertEquals(Optional.of("source"), registry.inputSlotName("My Node|pack", 0));
        assertTrue(registry.isBypassable("Relay"));
        assertTrue(registry.modelCategories().isEmpty());
    }

    @Test
    void loadsManifestFromPath(@TempDir Path dir) throws Exception {
        var manifest = dir.resolve("nodes.toml");
        Files.writeString(manifest, """
            [nodes.Loader]
            widgets = ["file"]
            model_field = "file"
            model_category = "weights"
            """);

        var registry = NodeRegistryLoader.load(manifest);

        assertTrue(registry.isModelLoader("Loader"));
        assertEquals(List.of("weights"), registry.modelCategories());
    }

    @Test
    void rejectsInvalidManifests(@TempDir Path dir) {
        assertThrows(RegistryException.class, () -> NodeRegistryLoader.parse("[nodes\nbroken", "inline"));
        assertThrows(RegistryException.class, () -> NodeRegistryLoader.load(dir.resolve("missing.toml")));
    }
}
