package work.lcod.survey.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One entry of a survey document. Children are referenced by id; the owning
 * {@code DocumentTree} resolves them.
 *
 * @param typeName raw document type, e.g. {@code section}, {@code set}, {@code radio}
 * @param attributes every other document property, kept verbatim
 */
public record FormNode(
    String id,
    NodeType type,
    String typeName,
    String name,
    String label,
    String fieldName,
    List<ChildRef> children,
    List<NavigationRule> navigationRules,
    List<ValidationRule> validationRules,
    Map<String, Object> attributes
) {
    public FormNode {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(type, "type");
        typeName = typeName == null || typeName.isBlank() ? type.defaultTypeName() : typeName;
        children = List.copyOf(children);
        navigationRules = List.copyOf(navigationRules);
        validationRules = List.copyOf(validationRules);
        attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    /** Label when set, otherwise name, otherwise the type name. */
    public String displayName() {
        if (label != null && !label.isBlank()) {
            return label;
        }
        if (name != null && !name.isBlank()) {
            return name;
        }
        return typeName;
    }

    public boolean isBlock() {
        return type == NodeType.BLOCK;
    }

    public boolean isPage() {
        return type == NodeType.PAGE;
    }

    public boolean isSection() {
        return type == NodeType.SECTION;
    }

    public List<String> embeddedChildIds() {
        var ids = new ArrayList<String>();
        for (var child : children) {
            if (child.kind().isEmbedded()) {
                ids.add(child.id());
            }
        }
        return ids;
    }

    public List<String> embeddedChildIds(ChildKind kind) {
        var ids = new ArrayList<String>();
        for (var child : children) {
            if (child.kind() == kind) {
                ids.add(child.id());
            }
        }
        return ids;
    }

    public FormNode withChildren(List<ChildRef> newChildren) {
        return new FormNode(id, type, typeName, name, label, fieldName, newChildren, navigationRules, validationRules, attributes);
    }

    public FormNode withNavigationRules(List<NavigationRule> rules) {
        return new FormNode(id, type, typeName, name, label, fieldName, children, rules, validationRules, attributes);
    }
}
