package work.deeployd.workflow.convert;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.deeployd.workflow.graph.Connection;
import work.deeployd.workflow.graph.GraphCodec;
import work.deeployd.workflow.graph.Node;
import work.deeployd.workflow.graph.WorkflowGraph;
import work.deeployd.workflow.registry.NodeRegistry;
import work.deeployd.workflow.registry.WidgetField;
import work.deeployd.workflow.shared.JsonValues;

/**
 * Converts between the editor (UI) export and the canonical API graph.
 *
 * <p>UI to API resolves positional widget values through the registry's widget schema and then
 * overlays the link table, so a linked input always wins over a widget value of the same name.
 * Widget values are always stored as literals, even when shaped like a {@code [string, integer]}
 * connection; only links produce {@link Connection} inputs. Literal inputs the widget schema does not
 * name are appended after the schema positions when converting API to UI.
 * API to UI is lossy with respect to layout: positions are a plain grid.
 */
public final class FormatConverter {
    private static final Logger LOG = LoggerFactory.getLogger(FormatConverter.class);

    static final String CONTROL_PLACEHOLDER = "fixed";
    private static final int GRID_STEP_X = 300;
    private static final int GRID_STEP_Y = 200;
    private static final int GRID_WRAP_X = 1200;

    private final NodeRegistry registry;

    public FormatConverter(NodeRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    /**
     * A document with both a {@code nodes} list and a {@code links} list is UI form; anything else is
     * treated as API form.
     */
    public static WorkflowFormat detectFormat(Map<String, Object> document) {
        if (document != null && document.get("nodes") instanceof List<?> && document.get("links") instanceof List<?>) {
            return WorkflowFormat.UI;
        }
        return WorkflowFormat.API;
    }

    public WorkflowGraph convert(Map<String, Object> document) {
        if (detectFormat(document) == WorkflowFormat.UI) {
            return uiToApi(document);
        }
        return GraphCodec.decode(document);
    }

    public WorkflowGraph uiToApi(UiDocument document) {
        return uiToApi(document.toMap());
    }

    public WorkflowGraph uiToApi(Map<String, Object> document) {
        var rawNodes = document == null ? null : JsonValues.asList(document.get("nodes"));
        if (rawNodes == null || rawNodes.isEmpty()) {
            return WorkflowGraph.empty();
        }

        var drafts = new LinkedHashMap<String, NodeDraft>();
        for (var raw : rawNodes) {
            var body = JsonValues.asMap(raw);
            if (body == null) {
                continue;
            }
            var id = nodeId(body.get("id"));
            if (id == null) {
                LOG.warn("Skipping UI node without a usable id (type {})", body.get("type"));
                continue;
            }
            var type = JsonValues.asText(body.get("type"));
            if (type == null || type.isBlank()) {
                LOG.warn("Node {} has no type field", id);
                continue;
            }
            var draft = new NodeDraft(id, type);
            readSlots(body, draft);
            applyWidgets(draft, body.get("widgets_values"));
            drafts.put(id, draft);
        }

        var links = JsonValues.asList(document.get("links"));
        if (links != null) {
            for (var raw : links) {
                var link = readLink(raw);
                if (link == null) {
                    LOG.warn("Skipping malformed link entry {}", raw);
                    continue;
                }
                applyLink(drafts, link);
            }
        }

        var nodes = new LinkedHashMap<String, Node>();
        drafts.forEach((id, draft) -> nodes.put(id, draft.toNode()));
        return WorkflowGraph.of(nodes);
    }

    public UiDocument apiToUi(WorkflowGraph graph) {
        if (graph == null || graph.isEmpty()) {
            return UiDocument.empty();
        }
        var uiIds = new HashMap<String, Object>();
        graph.ids().forEach(id -> uiIds.put(id, uiId(id)));

        var links = new ArrayList<UiLink>();
        var inputsByNode = new HashMap<String, List<UiInput>>();
        var outputLinks = new HashMap<String, Map<Integer, List<Integer>>>();
        int nextLinkId = 1;
        for (var node : graph.nodes().values()) {
            var inputs = new ArrayList<UiInput>();
            for (var entry : node.connections().entrySet()) {
                var connection = entry.getValue();
                if (!graph.contains(connection.sourceNodeId())) {
                    LOG.debug("Not emitting link for {}.{}: source {} is absent",
                        node.id(), entry.getKey(), connection.sourceNodeId());
                    continue;
                }
                int linkId = nextLinkId++;
                int targetSlot = inputs.size();
                inputs.add(new UiInput(entry.getKey(), linkId));
                links.add(new UiLink(
                    linkId,
                    uiIds.get(connection.sourceNodeId()),
                    connection.outputIndex(),
                    uiIds.get(node.id()),
                    targetSlot
                ));
                outputLinks
                    .computeIfAbsent(connection.sourceNodeId(), k -> new HashMap<>())
                    .computeIfAbsent(connection.outputIndex(), k -> new ArrayList<>())
                    .add(linkId);
            }
            inputsByNode.put(node.id(), inputs);
        }

        var uiNodes = new ArrayList<UiNode>();
        int x = 0;
        int y = 0;
        int order = 0;
        for (var node : graph.nodes().values()) {
            var slots = outputLinks.getOrDefault(node.id(), Map.of());
            var outputs = new ArrayList<UiOutput>();
            for (int slot = 0; slot < node.outputs().size(); slot++) {
                outputs.add(new UiOutput(node.outputs().get(slot), slots.getOrDefault(slot, List.of())));
            }
            uiNodes.add(new UiNode(
                uiIds.get(node.id()),
                node.classType(),
                widgetValues(node),
                inputsByNode.get(node.id()),
                outputs,
                x,
                y,
                order++
            ));
            x += GRID_STEP_X;
            if (x > GRID_WRAP_X) {
                x = 0;
                y += GRID_STEP_Y;
            }
        }
        return new UiDocument(uiNodes, links);
    }

    private void applyWidgets(NodeDraft draft, Object rawValues) {
        if (rawValues instanceof Map<?, ?> named) {
            var controls = registry.widgetSchema(draft.type).stream()
                .filter(WidgetField::isControl)
                .map(WidgetField::name)
                .toList();
            named.forEach((name, value) -> {
                var key = String.valueOf(name);
                if (value != null && !controls.contains(key)) {
                    draft.inputs.put(key, JsonValues.copy(value));
                }
            });
            return;
        }
        var values = JsonValues.asList(rawValues);
        if (values == null || values.isEmpty()) {
            return;
        }
        var schema = registry.widgetSchema(draft.type);
        if (schema.isEmpty()) {
            LOG.debug("No widget schema for {}; {} widget values ignored on node {}", draft.type, values.size(), draft.id);
            return;
        }
        int position = 0;
        for (var field : schema) {
            if (position >= values.size()) {
                break;
            }
            var value = values.get(position++);
            if (field.isControl() || value == null) {
                continue;
            }
            draft.inputs.put(field.name(), JsonValues.copy(value));
        }
        if (values.size() > schema.size()) {
            LOG.debug("{} widget values beyond the {} schema ignored on node {}",
                values.size() - schema.size(), draft.type, draft.id);
        }
    }

    private void applyLink(Map<String, NodeDraft> drafts, LinkRef link) {
        var target = drafts.get(link.targetNodeId());
        if (target == null) {
            LOG.debug("Link into unconverted node {} ignored", link.targetNodeId());
            return;
        }
        var name = target.inputName(link.targetSlot());
        if (name == null) {
            name = registry.inputSlotName(target.type, link.targetSlot()).orElse(null);
        }
        if (name == null) {
            LOG.warn("Cannot resolve input slot {} of node {} ({}); link from {} dropped",
                link.targetSlot(), target.id, target.type, link.sourceNodeId());
            return;
        }
        target.inputs.put(name, new Connection(link.sourceNodeId(), link.sourceSlot()));
    }

    private List<Object> widgetValues(Node node) {
        var schema = registry.widgetSchema(node.classType());
        if (schema.isEmpty()) {
            var literals = new ArrayList<Object>();
            node.literals().values().forEach(value -> literals.add(JsonValues.copy(value)));
            return literals;
        }
        var values = new ArrayList<Object>(schema.size());
        var named = new HashSet<String>();
        int lastStored = -1;
        for (var field : schema) {
            named.add(field.name());
            if (field.isControl()) {
                values.add(CONTROL_PLACEHOLDER);
                continue;
            }
            var value = node.inputs().get(field.name());
            if (value == null || value instanceof Connection) {
                values.add(null);
            } else {
                values.add(JsonValues.copy(value));
                lastStored = values.size() - 1;
            }
        }
        var extras = new ArrayList<Object>();
        node.literals().forEach((name, value) -> {
            if (!named.contains(name)) {
                extras.add(JsonValues.copy(value));
            }
        });
        if (extras.isEmpty()) {
            return new ArrayList<>(values.subList(0, lastStored + 1));
        }
        // schema positions stay fixed so the extras start right after them
        values.addAll(extras);
        return values;
    }

    private static void readSlots(Map<String, Object> body, NodeDraft draft) {
        var inputs = JsonValues.asList(body.get("inputs"));
        if (inputs != null) {
            for (var raw : inputs) {
                var slot = JsonValues.asMap(raw);
                draft.declaredInputs.add(slot == null ? null : JsonValues.asText(slot.get("name")));
            }
        }
        var outputs = JsonValues.asList(body.get("outputs"));
        if (outputs != null) {
            for (var raw : outputs) {
                var slot = JsonValues.asMap(raw);
                if (slot == null) {
                    continue;
                }
                var name = JsonValues.asText(slot.get("name"));
                if (name == null) {
                    name = JsonValues.asText(slot.get("type"));
                }
                draft.outputs.add(name == null ? "" : name);
            }
        }
        draft.meta = JsonValues.asMap(JsonValues.copy(body.get(GraphCodec.META)));
    }

    private static LinkRef readLink(Object raw) {
        String source;
        Integer sourceSlot;
        String target;
        Integer targetSlot;
        if (raw instanceof List<?> row) {
            if (row.size() < 5) {
                return null;
            }
            source = nodeId(row.get(1));
            sourceSlot = JsonValues.asInt(row.get(2));
            target = nodeId(row.get(3));
            targetSlot = JsonValues.asInt(row.get(4));
        } else if (raw instanceof Map<?, ?> object) {
            source = nodeId(object.get("origin_id"));
            sourceSlot = JsonValues.asInt(object.get("origin_slot"));
            target = nodeId(object.get("target_id"));
            targetSlot = JsonValues.asInt(object.get("target_slot"));
        } else {
            return null;
        }
        if (source == null || sourceSlot == null || target == null || targetSlot == null) {
            return null;
        }
        return new LinkRef(source, sourceSlot, target, targetSlot);
    }

    private static String nodeId(Object raw) {
        if (raw instanceof String str) {
            return str.isBlank() ? null : str;
        }
        if (JsonValues.isIntegral(raw) || raw instanceof Long) {
            return String.valueOf(((Number) raw).longValue());
        }
        var asInt = raw instanceof Number ? JsonValues.asInt(raw) : null;
        return asInt == null ? null : String.valueOf(asInt);
    }

    private static Object uiId(String id) {
        try {
            int numeric = Integer.parseInt(id);
            return String.valueOf(numeric).equals(id) ? numeric : id;
        } catch (NumberFormatException ex) {
            return id;
        }
    }

    private record LinkRef(String sourceNodeId, int sourceSlot, String targetNodeId, int targetSlot) {}

    private static final class NodeDraft {
        private final String id;
        private final String type;
        private final Map<String, Object> inputs = new LinkedHashMap<>();
        private final List<String> declaredInputs = new ArrayList<>();
        private final List<String> outputs = new ArrayList<>();
        private Map<String, Object> meta;

        private NodeDraft(String id, String type) {
            this.id = id;
            this.type = type;
        }

        private String inputName(int slot) {
            return slot >= 0 && slot < declaredInputs.size() ? declaredInputs.get(slot) : null;
        }

        private Node toNode() {
            return new Node(id, type, inputs, outputs, meta);
        }
    }
}
