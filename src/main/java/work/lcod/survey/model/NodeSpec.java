package work.lcod.survey.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Detached node description used to create nodes. Ids are optional; a tree assigns fresh ones
 * where they are missing.
 */
public record NodeSpec(
    String id,
    NodeType type,
    String typeName,
    String name,
    String label,
    String fieldName,
    List<Child> children,
    List<NavigationRule> navigationRules,
    List<ValidationRule> validationRules,
    Map<String, Object> attributes
) {
    public NodeSpec {
        Objects.requireNonNull(type, "type");
        id = id == null || id.isBlank() ? null : id;
        children = List.copyOf(children);
        navigationRules = List.copyOf(navigationRules);
        validationRules = List.copyOf(validationRules);
        attributes = new LinkedHashMap<>(attributes);
    }

    public static NodeSpec section(String name) {
        return new NodeSpec(null, NodeType.SECTION, "section", name, null, null, List.of(), List.of(), List.of(), Map.of());
    }

    public static NodeSpec page(String name) {
        return new NodeSpec(null, NodeType.PAGE, "set", name, null, null, List.of(), List.of(), List.of(), Map.of());
    }

    public static NodeSpec block(String typeName, String fieldName) {
        return new NodeSpec(null, NodeType.fromTypeName(typeName), typeName, fieldName, null, fieldName, List.of(), List.of(), List.of(), Map.of());
    }

    public NodeSpec withId(String newId) {
        return new NodeSpec(newId, type, typeName, name, label, fieldName, children, navigationRules, validationRules, attributes);
    }

    public NodeSpec withNavigationRules(List<NavigationRule> rules) {
        return new NodeSpec(id, type, typeName, name, label, fieldName, children, rules, validationRules, attributes);
    }

    public NodeSpec withItem(NodeSpec child) {
        return withChild(Child.item(child));
    }

    public NodeSpec withNode(NodeSpec child) {
        return withChild(Child.node(child));
    }

    public NodeSpec withReference(String referencedId) {
        return withChild(Child.reference(referencedId));
    }

    public NodeSpec withChild(Child child) {
        var copy = new ArrayList<>(children);
        copy.add(child);
        return new NodeSpec(id, type, typeName, name, label, fieldName, copy, navigationRules, validationRules, attributes);
    }

    /** Child kind used when this node is attached under a parent: sections go to {@code nodes}. */
    public ChildKind attachKind() {
        return type == NodeType.SECTION ? ChildKind.NODE : ChildKind.ITEM;
    }

    /**
     * Child entry: an embedded node description, or a bare id reference.
     */
    public record Child(ChildKind kind, NodeSpec node, String referenceId) {
        public Child {
            Objects.requireNonNull(kind, "kind");
            if (kind == ChildKind.REFERENCE) {
                Objects.requireNonNull(referenceId, "referenceId");
            } else {
                Objects.requireNonNull(node, "node");
            }
        }

        public static Child item(NodeSpec node) {
            return new Child(ChildKind.ITEM, node, null);
        }

        public static Child node(NodeSpec node) {
            return new Child(ChildKind.NODE, node, null);
        }

        public static Child reference(String id) {
            return new Child(ChildKind.REFERENCE, null, id);
        }
    }
}
