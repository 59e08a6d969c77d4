package work.deeployd.workflow.registry;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tomlj.Toml;
import org.tomlj.TomlArray;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;

/**
 * Builds {@link NodeRegistry} instances from TOML manifests.
 *
 * <pre>
 * [builtin]
 * types = ["VAEDecode", ...]
 *
 * [nodes.KSampler]
 * widgets = ["seed", "control_after_generate", "steps"]
 * controls = ["control_after_generate"]
 * inputs = ["model", "positive"]
 *
 * [presentation]
 * bypass = ["Reroute"]
 * drop = ["Note"]
 * </pre>
 */
public final class NodeRegistryLoader {
    private static final Logger LOG = LoggerFactory.getLogger(NodeRegistryLoader.class);

    private NodeRegistryLoader() {}

    public static NodeRegistry load(Path manifestPath) {
        if (manifestPath == null || !Files.isRegularFile(manifestPath)) {
            throw new RegistryException("Node registry manifest not found: " + manifestPath);
        }
        try {
            return parse(Files.readString(manifestPath), manifestPath.toString());
        } catch (IOException ex) {
            throw new RegistryException("Failed to read node registry manifest: " + manifestPath, ex);
        }
    }

    public static NodeRegistry fromClasspath(String resource) {
        try (InputStream in = NodeRegistryLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new RegistryException("Node registry resource not found on classpath: " + resource);
            }
            return parse(new String(in.readAllBytes(), StandardCharsets.UTF_8), "classpath:" + resource);
        } catch (IOException ex) {
            throw new RegistryException("Failed to read node registry resource: " + resource, ex);
        }
    }

    public static NodeRegistry parse(String text, String source) {
        TomlParseResult manifest = Toml.parse(text);
        if (manifest.hasErrors()) {
            throw new RegistryException("Invalid node registry manifest " + source + ": " + manifest.errors().get(0));
        }
        var builder = NodeRegistry.builder();

        TomlTable builtin = manifest.getTable("builtin");
        if (builtin != null) {
            builder.builtin(readStrings(builtin, "types"));
        }

        TomlTable nodes = manifest.getTable("nodes");
        int specCount = 0;
        if (nodes != null) {
            for (String classType : nodes.keySet()) {
                TomlTable table = nodes.getTable(List.of(classType));
                if (table == null) {
                    continue;
                }
                builder.spec(readSpec(classType, table));
                specCount++;
            }
        }

        TomlTable presentation = manifest.getTable("presentation");
        if (presentation != null) {
            builder.bypass(readStrings(presentation, "bypass"));
            builder.drop(readStrings(presentation, "drop"));
        }
        var registry = builder.build();
        LOG.debug("Loaded node registry from {} ({} built-in types, {} schemas)",
            source, registry.builtinTypes().size(), specCount);
        return registry;
    }

    private static NodeTypeSpec readSpec(String classType, TomlTable table) {
        List<String> widgetNames = readStrings(table, "widgets");
        Set<String> controls = new LinkedHashSet<>(readStrings(table, "controls"));
        var widgets = new ArrayList<WidgetField>(widgetNames.size());
        for (String name : widgetNames) {
            widgets.add(controls.contains(name) ? WidgetField.control(name) : WidgetField.value(name));
        }
        Boolean builtin = table.getBoolean("builtin");
        Boolean output = table.getBoolean("output");
        return new NodeTypeSpec(
            classType,
            builtin == null || builtin,
            widgets,
            readStrings(table, "inputs"),
            table.getString("model_field"),
            table.getString("model_category"),
            readStrings(table, "required"),
            Boolean.TRUE.equals(output)
        );
    }

    private static List<String> readStrings(TomlTable table, String key) {
        TomlArray array = table.getArray(key);
        if (array == null || array.size() == 0) {
            return List.of();
        }
        var values = new ArrayList<String>(array.size());
        for (int i = 0; i < array.size(); i++) {
            values.add(String.valueOf(array.get(i)));
        }
        return values;
    }
}
