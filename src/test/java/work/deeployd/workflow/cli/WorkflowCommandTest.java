package work.deeployd.workflow.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.deeployd.workflow.shared.JsonValues;
import work.deeployd.workflow.support.WorkflowFixtures;

class WorkflowCommandTest {
    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private int run(String... args) {
        var commandLine = Main.commandLine();
        commandLine.setOut(new PrintWriter(out, true));
        commandLine.setErr(new PrintWriter(err, true));
        return commandLine.execute(args);
    }

    private Map<String, Object> output() throws Exception {
        return JsonValues.asMap(JsonValues.read(out.toString()));
    }

    @Test
    void emitsAnalysis() throws Exception {
        int code = run("-w", WorkflowFixtures.path(WorkflowFixtures.TXT2IMG_UI).toString(), "--emit", "analysis");

        assertEquals(0, code, err.toString());
        var analysis = output();
        assertEquals("ui", analysis.get("format"));
        assertEquals(List.of("4", "5", "6", "7", "3", "8", "9"), analysis.get("execution_order"));
        assertEquals(List.of("10", "11"), analysis.get("removed_nodes"));
    }

    @Test
    void emitsCanonicalGraph() throws Exception {
        int code = run("--workflow", WorkflowFixtures.path(WorkflowFixtures.TXT2IMG_UI).toString(), "--emit", "API");

        assertEquals(0, code, err.toString());
        assertEquals(7, output().size());
    }

    @Test
    void emitsUiDocumentWithoutPreprocessing() throws Exception {
        int code = run("-w", WorkflowFixtures.path(WorkflowFixtures.TXT2IMG_UI).toString(), "--emit", "ui", "--no-preprocess");

        assertEquals(0, code, err.toString());
        var ui = output();
        assertEquals(9, ((List<?>) ui.get("nodes")).size());
        assertEquals(10, ((List<?>) ui.get("links")).size());
    }

    @Test
    void defaultEmitsEverything() throws Exception {
        int code = run("-w", WorkflowFixtures.path(WorkflowFixtures.TXT2IMG_API).toString());

        assertEquals(0, code, err.toString());
        var all = output();
        assertTrue(all.keySet().containsAll(List.of("workflow", "execution_order", "dependencies", "validation")));
    }

    @Test
    void invalidWorkflowExitsWithOne(@TempDir Path dir) throws Exception {
        var file = dir.resolve("minimal.json");
        Files.writeString(file, WorkflowFixtures.MINIMAL_API);

        int code = run("-w", file.toString(), "--emit", "validation");

        assertEquals(1, code);
        assertEquals(false, output().get("valid"));
    }

    @Test
    void reportsMissingFileBriefly() {
        int code = run("-w", "no-such-workflow.json");

        assertEquals(1, code);
        assertTrue(err.toString().contains("FILE_NOT_FOUND"), err.toString());
        assertTrue(out.toString().isEmpty());
    }

    @Test
    void usesAlternateRegistry(@TempDir Path dir) throws Exception {
        var manifest = dir.resolve("registry.toml");
        Files.writeString(manifest, """
            [builtin]
            types = ["KSampler"]
            """);

        int code = run("-w", WorkflowFixtures.path(WorkflowFixtures.TXT2IMG_API).toString(),
            "--emit", "dependencies", "--registry", manifest.toString());

        assertEquals(0, code, err.toString());
        var dependencies = output();
        assertEquals(5, ((List<?>) dependencies.get("custom_nodes")).size());
        assertTrue(((Map<?, ?>) dependencies.get("models")).isEmpty());
    }
}
