package work.deeployd.workflow.parse;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;
import work.deeployd.workflow.convert.WorkflowFormat;
import work.deeployd.workflow.graph.GraphCodec;
import work.deeployd.workflow.graph.GraphEdge;
import work.deeployd.workflow.graph.WorkflowError;
import work.deeployd.workflow.graph.WorkflowException;
import work.deeployd.workflow.support.WorkflowFixtures;

class WorkflowParserTest {
    private final WorkflowParser parser = new WorkflowParser(WorkflowFixtures.registry());

    @Test
    void parsesMinimalApiGraph() {
        var result = parser.parseFromText(WorkflowFixtures.MINIMAL_API);

        assertEquals(WorkflowFormat.API, result.format());
        assertTrue(result.isValid());
        assertEquals(2, result.nodes().size());
        assertEquals(List.of(new GraphEdge("1", 0, "2", "model")), result.connections());
        assertTrue(result.customNodes().isEmpty());
        assertDoesNotThrow(result::validateConnections);
    }

    @Test
    void serializedGraphParsesBackToSameShape() {
        var graph = WorkflowFixtures.loadGraph(WorkflowFixtures.TXT2IMG_API);

        var result = parser.parse(GraphCodec.encode(graph));

        assertEquals(graph.size(), result.nodes().size());
        graph.nodes().forEach((id, node) -> assertEquals(node.classType(), result.nodes().get(id).classType()));
    }

    @Test
    void parsesUiExportFromPath() {
        var result = parser.parseFromPath(WorkflowFixtures.path(WorkflowFixtures.TXT2IMG_UI));

        assertEquals(WorkflowFormat.UI, result.format());
        assertEquals(9, result.nodes().size());
        assertEquals(10, result.connections().size());
    }

    @Test
    void metadataSummarizesGraph() {
        var result = parser.parse(WorkflowFixtures.load(WorkflowFixtures.CUSTOM_NODES_API));

        var metadata = result.metadata();
        assertEquals(4, metadata.get("node_count"));
        assertEquals(true, metadata.get("has_custom_nodes"));
        assertEquals(2, metadata.get("connection_count"));
        assertEquals("api", metadata.get("format"));
        assertEquals(Set.of("MagCache", "ShowText|pysssss"), result.customNodes());
    }

    @Test
    void derivedViewsAreComputedOnce() {
        var result = parser.parse(WorkflowFixtures.load(WorkflowFixtures.CUSTOM_NODES_API));

        assertSame(result.connections(), result.connections());
        assertSame(result.customNodes(), result.customNodes());
    }

    @Test
    void rejectsMalformedInput() {
        var notJson = assertThrows(WorkflowException.class, () -> parser.parseFromText("{not json"));
        assertEquals(WorkflowError.MALFORMED_INPUT, notJson.error());

        var notObject = assertThrows(WorkflowException.class, () -> parser.parse(List.of(1, 2)));
        assertEquals(WorkflowError.MALFORMED_INPUT, notObject.error());
    }

    @Test
    void rejectsEmptyGraphs() {
        assertEquals(WorkflowError.EMPTY_GRAPH,
            assertThrows(WorkflowException.class, () -> parser.parse(Map.of())).error());
        assertEquals(WorkflowError.EMPTY_GRAPH,
            assertThrows(WorkflowException.class, () -> parser.parseFromText("{\"_comment\": \"only metadata\"}")).error());
    }

    @Test
    void rejectsInvalidNodeStructure() {
        var notAnObject = assertThrows(WorkflowException.class, () -> parser.parseFromText("{\"1\": 5}"));
        assertEquals(WorkflowError.INVALID_NODE_STRUCTURE, notAnObject.error());
        assertEquals("1", notAnObject.subject());

        var missingType = assertThrows(WorkflowException.class,
            () -> parser.parseFromText("{\"4\": {\"inputs\": {}}}"));
        assertEquals(WorkflowError.INVALID_NODE_STRUCTURE, missingType.error());
        assertTrue(missingType.getMessage().contains("Node 4"));

        var badOutputs = assertThrows(WorkflowException.class,
            () -> parser.parseFromText("{\"4\": {\"class_type\": \"A\", \"outputs\": \"x\"}}"));
        assertEquals(WorkflowError.INVALID_NODE_STRUCTURE, badOutputs.error());
    }

    @Test
    void reportsMissingFiles() {
        var ex = assertThrows(WorkflowException.class, () -> parser.parseFromPath(Path.of("does", "not", "exist.json")));

        assertEquals(WorkflowError.FILE_NOT_FOUND, ex.error());
    }

    @Test
    void detectsCyclesNamingANodeOnTheCycle() {
        var result = parser.parseFromText("""
            {
              "1": {"class_type": "A", "inputs": {"x": ["2", 0]}},
              "2": {"class_type": "B", "inputs": {"y": ["1", 0]}},
              "3": {"class_type": "C", "inputs": {"z": ["2", 0]}}
            }
            """);

        var ex = assertThrows(WorkflowException.class, result::validateConnections);
        assertEquals(WorkflowError.CIRCULAR_DEPENDENCY, ex.error());
        assertTrue(Set.of("1", "2").contains(ex.subject()));
    }

    @Test
    void detectsSelfLoops() {
        var result = parser.parseFromText("{\"5\": {\"class_type\": \"A\", \"inputs\": {\"x\": [\"5\", 0]}}}");

        var ex = assertThrows(WorkflowException.class, result::validateConnections);
        assertEquals("5", ex.subject());
    }

    @Test
    void danglingReferencesAreNotCycles() {
        var result = parser.parseFromText("{\"1\": {\"class_type\": \"SaveImage\", \"inputs\": {\"images\": [\"999\", 0]}}}");

        assertDoesNotThrow(result::validateConnections);
    }
}
