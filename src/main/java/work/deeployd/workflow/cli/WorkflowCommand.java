package work.deeployd.workflow.cli;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.deeployd.workflow.api.CompiledWorkflow;
import work.deeployd.workflow.api.WorkflowCompiler;
import work.deeployd.workflow.graph.GraphCodec;
import work.deeployd.workflow.registry.NodeRegistry;
import work.deeployd.workflow.registry.NodeRegistryLoader;
import work.deeployd.workflow.shared.JsonValues;

@CommandLine.Command(
    name = "workflow-compile",
    description = "Parse, clean and analyze a workflow export, printing JSON to stdout.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true
)
final class WorkflowCommand implements Callable<Integer> {
    enum Emit { API, UI, ANALYSIS, DEPENDENCIES, VALIDATION, ALL }

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(
        names = {"-w", "--workflow"},
        required = true,
        paramLabel = "PATH|-",
        description = "Workflow JSON file (UI or API form); use '-' to read from stdin."
    )
    private String workflow;

    @CommandLine.Option(
        names = "--emit",
        description = "What to print: ${COMPLETION-CANDIDATES}.",
        defaultValue = "ALL"
    )
    private Emit emit = Emit.ALL;

    @CommandLine.Option(
        names = "--no-preprocess",
        description = "Keep reroute and annotation nodes."
    )
    private boolean noPreprocess;

    @CommandLine.Option(
        names = "--registry",
        description = "Node registry TOML manifest (default: bundled node-registry.toml).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path registryPath;

    @Override
    public Integer call() throws Exception {
        var registry = registryPath == null ? NodeRegistry.defaults() : NodeRegistryLoader.load(registryPath);
        var compiler = new WorkflowCompiler(registry);
        var preprocess = !noPreprocess;
        var compiled = "-".equals(workflow)
            ? compiler.compileText(readStdin(), preprocess)
            : compiler.compilePath(Path.of(workflow), preprocess);

        var out = spec.commandLine().getOut();
        out.println(JsonValues.write(project(compiler, compiled)));
        out.flush();
        return compiled.isValid() ? 0 : 1;
    }

    private Object project(WorkflowCompiler compiler, CompiledWorkflow compiled) {
        return switch (emit) {
            case API -> GraphCodec.encode(compiled.graph());
            case UI -> compiler.toUi(compiled).toMap();
            case ANALYSIS -> analysis(compiled);
            case DEPENDENCIES -> compiled.dependencies().toSerializableMap();
            case VALIDATION -> compiled.validation().toSerializableMap();
            case ALL -> compiled.toSerializableMap();
        };
    }

    private static Map<String, Object> analysis(CompiledWorkflow compiled) {
        var map = new LinkedHashMap<String, Object>();
        map.put("format", compiled.sourceFormat().tag());
        map.put("execution_order", compiled.executionOrder());
        map.put("complexity", compiled.complexity().toMap());
        map.put("removed_nodes", compiled.removedNodeIds());
        map.put("warnings", compiled.warnings());
        map.put("metadata", compiled.metadata());
        return map;
    }

    private String readStdin() {
        try {
            return new String(System.in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new CommandLine.ExecutionException(spec.commandLine(), "Unable to read stdin: " + ex.getMessage(), ex);
        }
    }
}
