package work.deeployd.workflow.deps;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.deeployd.workflow.convert.FormatConverter;
import work.deeployd.workflow.graph.Node;
import work.deeployd.workflow.graph.WorkflowGraph;
import work.deeployd.workflow.registry.NodeRegistry;
import work.deeployd.workflow.shared.JsonValues;

/**
 * Collects what a workflow needs at runtime: model files per category, custom node packs and the
 * python packages they declare. Every operation is total; an empty graph yields empty collections.
 */
public final class DependencyExtractor {
    private static final Logger LOG = LoggerFactory.getLogger(DependencyExtractor.class);

    private static final String UNKNOWN = "unknown";
    private static final Pattern DRIVE_PREFIX = Pattern.compile("^[A-Za-z]:.*");
    private static final Pattern VERSION_SPEC = Pattern.compile("[<>=!~\\[;\\s]");
    private static final List<String> CUDA_PACKAGES = List.of("torch", "xformers", "triton", "cupy", "pycuda");
    static final String TORCH_CUDA_VERSION = "11.8";

    private final NodeRegistry registry;
    private final FormatConverter converter;

    public DependencyExtractor(NodeRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.converter = new FormatConverter(registry);
    }

    /**
     * Accepts either document form; UI documents are converted first.
     */
    public WorkflowDependencies extractAll(Map<String, Object> document) {
        return extractAll(converter.convert(document));
    }

    public WorkflowDependencies extractAll(WorkflowGraph graph) {
        return new WorkflowDependencies(extractModels(graph), extractCustomNodes(graph), extractPythonPackages(graph));
    }

    /**
     * Model filenames grouped by registry category. Every category the registry knows is present,
     * possibly empty; duplicates within a category are dropped.
     */
    public Map<String, List<String>> extractModels(WorkflowGraph graph) {
        var models = new LinkedHashMap<String, Set<String>>();
        registry.modelCategories().forEach(category -> models.put(category, new LinkedHashSet<>()));
        for (var node : graph.nodes().values()) {
            var field = registry.modelField(node.classType());
            var category = registry.modelCategory(node.classType());
            if (field.isEmpty() || category.isEmpty()) {
                continue;
            }
            var filename = JsonValues.asText(node.inputs().get(field.get()));
            if (filename == null || filename.isBlank()) {
                LOG.debug("Loader {} ({}) has no literal {}", node.id(), node.classType(), field.get());
                continue;
            }
            models.computeIfAbsent(category.get(), k -> new LinkedHashSet<>()).add(filename);
        }
        var result = new LinkedHashMap<String, List<String>>();
        models.forEach((category, files) -> result.put(category, new ArrayList<>(files)));
        return result;
    }

    /**
     * One entry per distinct non built-in class_type, in first-seen order.
     */
    public List<CustomNodeInfo> extractCustomNodes(WorkflowGraph graph) {
        var seen = new LinkedHashSet<String>();
        var result = new ArrayList<CustomNodeInfo>();
        for (var node : graph.nodes().values()) {
            var type = node.classType();
            if (type.isEmpty() || registry.isBuiltin(type) || !seen.add(type)) {
                continue;
            }
            var meta = node.meta();
            result.add(new CustomNodeInfo(
                type,
                JsonValues.asText(meta.get("repository")),
                JsonValues.asText(meta.get("commit")),
                declaredPackages(node)
            ));
        }
        return result;
    }

    public Set<String> extractPythonPackages(WorkflowGraph graph) {
        var packages = new TreeSet<String>();
        graph.nodes().values().forEach(node -> packages.addAll(declaredPackages(node)));
        return packages;
    }

    public Set<String> pythonImportsFromSource(String source) {
        return PythonImports.scan(source);
    }

    /**
     * Sorted package list, one per line, in {@code requirements.txt} form.
     */
    public String requirementsText(WorkflowGraph graph) {
        return String.join("\n", extractPythonPackages(graph));
    }

    /**
     * Rejects blank paths, parent-directory segments, absolute paths and drive-letter prefixes.
     */
    public boolean validateModelPath(String path) {
        if (path == null || path.isBlank()) {
            return false;
        }
        if (path.startsWith("/") || path.startsWith("\\") || DRIVE_PREFIX.matcher(path).matches()) {
            return false;
        }
        for (var segment : path.split("[/\\\\]")) {
            if (segment.equals("..")) {
                return false;
            }
        }
        return true;
    }

    public ModelFileInfo modelFileInfo(String path) {
        if (path == null || path.isBlank()) {
            return new ModelFileInfo("", "", UNKNOWN, "");
        }
        var slash = Math.max(path.lastIndexOf('/'), path.lastIndexOf('\\'));
        var filename = path.substring(slash + 1);
        var dot = filename.lastIndexOf('.');
        var extension = dot > 0 ? filename.substring(dot) : "";
        return new ModelFileInfo(filename, extension, modelType(path), path);
    }

    public RepositoryInfo resolveRepository(String url) {
        if (url == null || url.isBlank()) {
            return new RepositoryInfo(UNKNOWN, UNKNOWN, UNKNOWN, "");
        }
        String host = "";
        String path = "";
        try {
            var uri = new URI(url.trim());
            host = uri.getHost() == null ? "" : uri.getHost().toLowerCase(Locale.ROOT);
            path = uri.getPath() == null ? "" : uri.getPath();
        } catch (URISyntaxException ex) {
            LOG.warn("Unparseable repository URL {}: {}", url, ex.getMessage());
        }
        var parts = new ArrayList<String>();
        for (var part : path.split("/")) {
            if (!part.isEmpty()) {
                parts.add(part);
            }
        }
        var owner = UNKNOWN;
        var repo = UNKNOWN;
        if (parts.size() >= 2) {
            owner = parts.get(0);
            repo = parts.get(1).endsWith(".git") ? parts.get(1).substring(0, parts.get(1).length() - 4) : parts.get(1);
        }
        return new RepositoryInfo(platform(host), owner, repo, url);
    }

    public CudaRequirements cudaRequirements(WorkflowGraph graph) {
        var found = new ArrayList<String>();
        for (var requirement : extractPythonPackages(graph)) {
            var name = VERSION_SPEC.split(requirement, 2)[0].toLowerCase(Locale.ROOT);
            if (CUDA_PACKAGES.contains(name) && !found.contains(name)) {
                found.add(name);
            }
        }
        return new CudaRequirements(found, found.contains("torch") ? TORCH_CUDA_VERSION : null);
    }

    private static List<String> declaredPackages(Node node) {
        var declared = JsonValues.asList(node.meta().get("python_dependencies"));
        if (declared == null) {
            return List.of();
        }
        var packages = new ArrayList<String>();
        for (var item : declared) {
            if (item instanceof String name && !name.isBlank()) {
                packages.add(name.trim());
            }
        }
        return packages;
    }

    private static String modelType(String path) {
        var lower = path.toLowerCase(Locale.ROOT);
        if (lower.contains("checkpoint") || lower.contains("ckpt")) {
            return "checkpoint";
        }
        if (lower.contains("lora")) {
            return "lora";
        }
        if (lower.contains("vae")) {
            return "vae";
        }
        if (lower.contains("control")) {
            return "controlnet";
        }
        if (lower.contains("embedding")) {
            return "embedding";
        }
        if (lower.contains("upscale")) {
            return "upscaler";
        }
        return "checkpoint";
    }

    private static String platform(String host) {
        if (host.equals("github.com") || host.endsWith(".github.com")) {
            return "github";
        }
        if (host.equals("gitlab.com") || host.endsWith(".gitlab.com") || host.startsWith("gitlab.")) {
            return "gitlab";
        }
        return UNKNOWN;
    }
}
