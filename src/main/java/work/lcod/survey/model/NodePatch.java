package work.lcod.survey.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Partial update of a node. {@code null} fields are left untouched; attributes are merged key by
 * key. The id can never be patched.
 */
public record NodePatch(
    String typeName,
    String name,
    String label,
    String fieldName,
    List<NavigationRule> navigationRules,
    List<ValidationRule> validationRules,
    Map<String, Object> attributes
) {
    public NodePatch {
        navigationRules = navigationRules == null ? null : List.copyOf(navigationRules);
        validationRules = validationRules == null ? null : List.copyOf(validationRules);
        attributes = attributes == null ? Map.of() : new LinkedHashMap<>(attributes);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns {@code node} itself when the patch changes nothing.
     */
    public FormNode applyTo(FormNode node) {
        var newTypeName = typeName != null ? typeName : node.typeName();
        var newType = typeName != null ? NodeType.fromTypeName(typeName) : node.type();
        var newName = name != null ? name : node.name();
        var newLabel = label != null ? label : node.label();
        var newFieldName = fieldName != null ? fieldName : node.fieldName();
        var newNavigation = navigationRules != null ? navigationRules : node.navigationRules();
        var newValidation = validationRules != null ? validationRules : node.validationRules();
        var newAttributes = new LinkedHashMap<>(node.attributes());
        newAttributes.putAll(attributes);

        boolean changed = !Objects.equals(newTypeName, node.typeName())
            || newType != node.type()
            || !Objects.equals(newName, node.name())
            || !Objects.equals(newLabel, node.label())
            || !Objects.equals(newFieldName, node.fieldName())
            || !newNavigation.equals(node.navigationRules())
            || !newValidation.equals(node.validationRules())
            || !newAttributes.equals(node.attributes());
        if (!changed) {
            return node;
        }
        return new FormNode(
            node.id(),
            newType,
            newTypeName,
            newName,
            newLabel,
            newFieldName,
            node.children(),
            newNavigation,
            newValidation,
            newAttributes
        );
    }

    public static final class Builder {
        private String typeName;
        private String name;
        private String label;
        private String fieldName;
        private List<NavigationRule> navigationRules;
        private List<ValidationRule> validationRules;
        private final Map<String, Object> attributes = new LinkedHashMap<>();

        public Builder typeName(String typeName) {
            this.typeName = typeName;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder label(String label) {
            this.label = label;
            return this;
        }

        public Builder fieldName(String fieldName) {
            this.fieldName = fieldName;
            return this;
        }

        public Builder navigationRules(List<NavigationRule> navigationRules) {
            this.navigationRules = navigationRules;
            return this;
        }

        public Builder validationRules(List<ValidationRule> validationRules) {
            this.validationRules = validationRules;
            return this;
        }

        public Builder attribute(String key, Object value) {
            this.attributes.put(key, value);
            return this;
        }

        public NodePatch build() {
            return new NodePatch(typeName, name, label, fieldName, navigationRules, validationRules, attributes);
        }
    }
}
