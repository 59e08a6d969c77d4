package work.deeployd.workflow.api;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;
import work.deeployd.workflow.convert.WorkflowFormat;
import work.deeployd.workflow.graph.WorkflowError;
import work.deeployd.workflow.graph.WorkflowException;
import work.deeployd.workflow.shared.JsonValues;
import work.deeployd.workflow.support.WorkflowFixtures;

class WorkflowCompilerTest {
    private final WorkflowCompiler compiler = new WorkflowCompiler(WorkflowFixtures.registry());

    @Test
    void compilesUiExportEndToEnd() {
        var compiled = compiler.compilePath(WorkflowFixtures.path(WorkflowFixtures.TXT2IMG_UI), true);

        assertEquals(WorkflowFormat.UI, compiled.sourceFormat());
        assertEquals(Set.of("10", "11"), compiled.removedNodeIds());
        assertEquals(List.of("4", "5", "6", "7", "3", "8", "9"), compiled.executionOrder());
        assertEquals(List.of("sd15.safetensors"), compiled.dependencies().models().get("checkpoints"));
        assertEquals("moderate", compiled.complexity().level());
        assertTrue(compiled.isValid(), compiled.validation().report());
        assertEquals(9, compiled.metadata().get("node_count"));
    }

    @Test
    void compilesMinimalApiGraph() {
        var compiled = compiler.compile(WorkflowFixtures.json(WorkflowFixtures.MINIMAL_API));

        assertEquals(List.of("1", "2"), compiled.executionOrder());
        assertEquals(List.of("m.safetensors"), compiled.dependencies().models().get("checkpoints"));
    }

    @Test
    void preprocessingCanBeSkipped() throws Exception {
        var compiled = compiler.compileText(
            JsonValues.write(WorkflowFixtures.load(WorkflowFixtures.TXT2IMG_UI)), false);

        assertEquals(9, compiled.graph().size());
        assertTrue(compiled.removedNodeIds().isEmpty());
        assertTrue(compiled.executionOrder().containsAll(List.of("10", "11")));
    }

    @Test
    void rejectsCyclicWorkflows() {
        var ex = assertThrows(WorkflowException.class, () -> compiler.compile(WorkflowFixtures.json("""
            {
              "1": {"class_type": "A", "inputs": {"x": ["2", 0]}},
              "2": {"class_type": "B", "inputs": {"y": ["1", 0]}}
            }
            """)));

        assertEquals(WorkflowError.CIRCULAR_DEPENDENCY, ex.error());
    }

    @Test
    void serializableViewIsPlainJson() throws Exception {
        var compiled = compiler.compile(WorkflowFixtures.load(WorkflowFixtures.CUSTOM_NODES_API));

        var map = compiled.toSerializableMap();
        var text = assertDoesNotThrow(() -> JsonValues.write(map));
        var reread = JsonValues.asMap(JsonValues.read(text));

        assertEquals("api", reread.get("format"));
        assertEquals(List.of("1", "2", "3", "4"), reread.get("execution_order"));
        var workflow = (Map<?, ?>) reread.get("workflow");
        assertEquals(List.of("1", 0), ((Map<?, ?>) ((Map<?, ?>) workflow.get("2")).get("inputs")).get("model"));
        var dependencies = (Map<?, ?>) reread.get("dependencies");
        assertEquals(2, ((List<?>) dependencies.get("custom_nodes")).size());
    }

    @Test
    void convertsCompiledGraphToUi() {
        var compiled = compiler.compile(WorkflowFixtures.load(WorkflowFixtures.TXT2IMG_UI));

        var ui = compiler.toUi(compiled);

        assertEquals(7, ui.nodes().size());
        assertEquals(9, ui.links().size());
    }
}
