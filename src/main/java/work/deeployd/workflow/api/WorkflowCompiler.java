package work.deeployd.workflow.api;

import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.deeployd.workflow.analysis.GraphAnalyzer;
import work.deeployd.workflow.convert.FormatConverter;
import work.deeployd.workflow.convert.UiDocument;
import work.deeployd.workflow.deps.DependencyExtractor;
import work.deeployd.workflow.parse.ParseResult;
import work.deeployd.workflow.parse.WorkflowParser;
import work.deeployd.workflow.preprocess.GraphPreprocessor;
import work.deeployd.workflow.preprocess.PreprocessResult;
import work.deeployd.workflow.registry.NodeRegistry;
import work.deeployd.workflow.validate.WorkflowValidator;

/**
 * Public entry point: parse, clean, analyze and extract dependencies in one call.
 */
public final class WorkflowCompiler {
    private static final Logger LOG = LoggerFactory.getLogger(WorkflowCompiler.class);

    private final WorkflowParser parser;
    private final FormatConverter converter;
    private final GraphPreprocessor preprocessor;
    private final GraphAnalyzer analyzer;
    private final DependencyExtractor extractor;
    private final WorkflowValidator validator;

    public WorkflowCompiler() {
        this(NodeRegistry.defaults());
    }

    public WorkflowCompiler(NodeRegistry registry) {
        Objects.requireNonNull(registry, "registry");
        this.parser = new WorkflowParser(registry);
        this.converter = new FormatConverter(registry);
        this.preprocessor = new GraphPreprocessor(registry);
        this.analyzer = new GraphAnalyzer(registry);
        this.extractor = new DependencyExtractor(registry);
        this.validator = new WorkflowValidator(registry);
    }

    public CompiledWorkflow compile(Map<String, Object> document) {
        return compile(document, true);
    }

    public CompiledWorkflow compile(Map<String, Object> document, boolean preprocess) {
        return compile(parser.parse(document), preprocess);
    }

    public CompiledWorkflow compileText(String text, boolean preprocess) {
        return compile(parser.parseFromText(text), preprocess);
    }

    public CompiledWorkflow compilePath(Path path, boolean preprocess) {
        return compile(parser.parseFromPath(path), preprocess);
    }

    /**
     * @throws work.deeployd.workflow.graph.WorkflowException when the parsed graph is cyclic
     */
    public CompiledWorkflow compile(ParseResult parsed, boolean preprocess) {
        parsed.validateConnections();
        var cleaned = preprocess
            ? preprocessor.preprocess(parsed.graph())
            : new PreprocessResult(parsed.graph(), null, null);
        var graph = cleaned.graph();
        LOG.debug("Compiling {} node(s) read as {}", graph.size(), parsed.format().tag());

        return new CompiledWorkflow(
            parsed.format(),
            graph,
            cleaned.removedNodeIds(),
            cleaned.warnings(),
            analyzer.executionOrder(graph),
            analyzer.complexity(graph),
            extractor.extractAll(graph),
            validator.validate(graph),
            parsed.metadata()
        );
    }

    public UiDocument toUi(CompiledWorkflow compiled) {
        return converter.apiToUi(compiled.graph());
    }
}
