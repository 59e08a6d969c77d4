package work.deeployd.workflow.registry;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only lookup of node types: built-in set, widget schemas, link slot names, loader fields and
 * presentation-only types. Safe to share between threads once built.
 */
public final class NodeRegistry {
    public static final String DEFAULT_RESOURCE = "node-registry.toml";

    private final Set<String> builtinTypes;
    private final Map<String, NodeTypeSpec> specs;
    private final Set<String> bypassTypes;
    private final Set<String> dropTypes;
    private final List<String> modelCategories;

    private NodeRegistry(Builder builder) {
        var builtin = new LinkedHashSet<>(builder.builtinTypes);
        builder.specs.values().stream().filter(NodeTypeSpec::builtin).forEach(s -> builtin.add(s.classType()));
        this.builtinTypes = Collections.unmodifiableSet(builtin);
        this.specs = Collections.unmodifiableMap(new LinkedHashMap<>(builder.specs));
        this.bypassTypes = Collections.unmodifiableSet(new LinkedHashSet<>(builder.bypassTypes));
        this.dropTypes = Collections.unmodifiableSet(new LinkedHashSet<>(builder.dropTypes));
        var categories = new LinkedHashSet<String>();
        for (var spec : specs.values()) {
            if (spec.isModelLoader() && spec.modelCategory() != null && !spec.modelCategory().isBlank()) {
                categories.add(spec.modelCategory());
            }
        }
        this.modelCategories = List.copyOf(categories);
    }

    /**
     * Registry described by the bundled {@value #DEFAULT_RESOURCE} manifest, loaded once.
     */
    public static NodeRegistry defaults() {
        return DefaultHolder.INSTANCE;
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isBuiltin(String classType) {
        return classType != null && builtinTypes.contains(classType);
    }

    public Set<String> builtinTypes() {
        return builtinTypes;
    }

    public Optional<NodeTypeSpec> spec(String classType) {
        return Optional.ofNullable(classType == null ? null : specs.get(classType));
    }

    public boolean isKnown(String classType) {
        return isBuiltin(classType) || spec(classType).isPresent();
    }

    public List<WidgetField> widgetSchema(String classType) {
        return spec(classType).map(NodeTypeSpec::widgets).orElse(List.of());
    }

    public Optional<String> inputSlotName(String classType, int slot) {
        return spec(classType)
            .map(NodeTypeSpec::inputSlots)
            .filter(slots -> slot >= 0 && slot < slots.size())
            .map(slots -> slots.get(slot));
    }

    public Optional<String> modelField(String classType) {
        return spec(classType).flatMap(NodeTypeSpec::modelFieldName);
    }

    public Optional<String> modelCategory(String classType) {
        return spec(classType).filter(NodeTypeSpec::isModelLoader).map(NodeTypeSpec::modelCategory);
    }

    public boolean isModelLoader(String classType) {
        return modelField(classType).isPresent();
    }

    public List<String> modelCategories() {
        return modelCategories;
    }

    public List<String> requiredInputs(String classType) {
        return spec(classType).map(NodeTypeSpec::requiredInputs).orElse(List.of());
    }

    public boolean isOutputNode(String classType) {
        return spec(classType).map(NodeTypeSpec::output).orElse(false);
    }

    public boolean isBypassable(String classType) {
        return classType != null && bypassTypes.contains(classType);
    }

    public boolean isDroppable(String classType) {
        return classType != null && dropTypes.contains(classType) && !bypassTypes.contains(classType);
    }

    public static final class Builder {
        private final Set<String> builtinTypes = new LinkedHashSet<>();
        private final Map<String, NodeTypeSpec> specs = new LinkedHashMap<>();
        private final Set<String> bypassTypes = new LinkedHashSet<>();
        private final Set<String> dropTypes = new LinkedHashSet<>();

        private Builder() {}

        public Builder builtin(String... classTypes) {
            Collections.addAll(builtinTypes, classTypes);
            return this;
        }

        public Builder builtin(List<String> classTypes) {
            builtinTypes.addAll(classTypes);
            return this;
        }

        public Builder spec(NodeTypeSpec spec) {
            specs.put(spec.classType(), spec);
            return this;
        }

        public Builder bypass(List<String> classTypes) {
            bypassTypes.addAll(classTypes);
            return this;
        }

        public Builder drop(List<String> classTypes) {
            dropTypes.addAll(classTypes);
            return this;
        }

        public NodeRegistry build() {
            return new NodeRegistry(this);
        }
    }

    private static final class DefaultHolder {
        private static final NodeRegistry INSTANCE = NodeRegistryLoader.fromClasspath(DEFAULT_RESOURCE);
    }
}
