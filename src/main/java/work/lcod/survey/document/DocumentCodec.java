package work.lcod.survey.document;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.survey.model.ChildKind;
import work.lcod.survey.model.FormNode;
import work.lcod.survey.model.NavigationRule;
import work.lcod.survey.model.NodeSpec;
import work.lcod.survey.model.NodeType;
import work.lcod.survey.model.RuleValue;
import work.lcod.survey.model.Severity;
import work.lcod.survey.model.ValidationRule;
import work.lcod.survey.shared.SurveyException;
import work.lcod.survey.tree.DocumentTree;
import work.lcod.survey.validation.ValidationRuleFormat;

/**
 * Reads and writes survey documents ({@code rootNode}, {@code localizations}, {@code theme}).
 *
 * <p>Both historical child shapes are accepted: {@code items} holding embedded nodes and
 * {@code nodes} holding embedded nodes or bare ids. Ids may be stored under {@code uuid} or
 * {@code id}; they are always written back under {@code uuid}. Unknown node properties are kept
 * as attributes and written back unchanged. Validation rules may also be given in the compact
 * {@code operator|value|message} string form; they are written back as objects.</p>
 */
public final class DocumentCodec {
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());
    private static final ObjectWriter JSON_WRITER = JSON.writerWithDefaultPrettyPrinter();
    private static final TypeReference<Map<String, Object>> MAP_REF = new TypeReference<>() {};
    private static final Set<String> NODE_KEYS = Set.of(
        "uuid", "id", "type", "name", "label", "fieldName", "items", "nodes", "navigationRules", "validationRules"
    );

    private final Supplier<String> idGenerator;
    private final Logger log;

    public DocumentCodec() {
        this(() -> UUID.randomUUID().toString(), LoggerFactory.getLogger(DocumentCodec.class));
    }

    public DocumentCodec(Supplier<String> idGenerator, Logger log) {
        this.idGenerator = Objects.requireNonNull(idGenerator, "idGenerator");
        this.log = Objects.requireNonNull(log, "log");
    }

    public SurveyDocument read(Path path) {
        var name = path.getFileName() == null ? "" : path.getFileName().toString().toLowerCase(Locale.ROOT);
        String content;
        try {
            content = Files.readString(path);
        } catch (IOException ex) {
            throw new SurveyException("document_unreadable", "Unable to read " + path + ": " + ex.getMessage(), Map.of("path", path.toString()), ex);
        }
        if (name.endsWith(".yaml") || name.endsWith(".yml")) {
            return readYaml(content);
        }
        return readJson(content);
    }

    public SurveyDocument readJson(String json) {
        return fromMap(parse(JSON, json, "invalid_json"));
    }

    public SurveyDocument readYaml(String yaml) {
        return fromMap(parse(YAML, yaml, "invalid_yaml"));
    }

    public String writeJson(SurveyDocument document) {
        try {
            return JSON_WRITER.writeValueAsString(toMap(document));
        } catch (JsonProcessingException ex) {
            throw new SurveyException("document_unwritable", "Unable to serialize document: " + ex.getOriginalMessage(), null, ex);
        }
    }

    public SurveyDocument fromMap(Map<String, Object> raw) {
        if (raw == null || !(raw.get("rootNode") instanceof Map<?, ?> rootNode)) {
            throw new SurveyException("invalid_document", "Document has no rootNode object", null);
        }
        var nodeSpec = readNode(asStringMap(rootNode), "rootNode");
        var tree = DocumentTree.of(nodeSpec, idGenerator, log);
        return new SurveyDocument(tree, optionalMap(raw.get("localizations"), "localizations"), optionalMap(raw.get("theme"), "theme"));
    }

    public Map<String, Object> toMap(SurveyDocument document) {
        var map = new LinkedHashMap<String, Object>();
        map.put("rootNode", writeNode(document.tree(), document.tree().rootId()));
        map.put("localizations", document.localizations());
        map.put("theme", document.theme());
        return map;
    }

    private NodeSpec readNode(Map<String, Object> raw, String path) {
        var typeName = raw.get("type") instanceof String s && !s.isBlank() ? s : null;
        var type = typeName == null ? (path.equals("rootNode") ? NodeType.SECTION : NodeType.BLOCK) : NodeType.fromTypeName(typeName);
        var attributes = new LinkedHashMap<String, Object>();
        for (var entry : raw.entrySet()) {
            if (!NODE_KEYS.contains(entry.getKey())) {
                attributes.put(entry.getKey(), entry.getValue());
            }
        }
        var nodeSpec = new NodeSpec(
            idOf(raw),
            type,
            typeName,
            text(raw.get("name")),
            text(raw.get("label")),
            text(raw.get("fieldName")),
            List.of(),
            readNavigationRules(raw.get("navigationRules"), path),
            readValidationRules(raw.get("validationRules"), path),
            attributes
        );
        var items = list(raw.get("items"), path + ".items");
        for (int i = 0; i < items.size(); i++) {
            var childPath = path + ".items[" + i + "]";
            if (!(items.get(i) instanceof Map<?, ?> child)) {
                throw new SurveyException("invalid_document", "Expected an object at " + childPath, Map.of("path", childPath));
            }
            nodeSpec = nodeSpec.withItem(readNode(asStringMap(child), childPath));
        }
        var nodes = list(raw.get("nodes"), path + ".nodes");
        for (int i = 0; i < nodes.size(); i++) {
            var childPath = path + ".nodes[" + i + "]";
            var entry = nodes.get(i);
            if (entry instanceof String reference) {
                nodeSpec = nodeSpec.withReference(reference);
            } else if (entry instanceof Map<?, ?> child) {
                nodeSpec = nodeSpec.withNode(readNode(asStringMap(child), childPath));
            } else {
                throw new SurveyException("invalid_document", "Expected an id or object at " + childPath, Map.of("path", childPath));
            }
        }
        return nodeSpec;
    }

    private List<NavigationRule> readNavigationRules(Object raw, String path) {
        var result = new ArrayList<NavigationRule>();
        var rules = list(raw, path + ".navigationRules");
        for (int i = 0; i < rules.size(); i++) {
            if (!(rules.get(i) instanceof Map<?, ?> rule)) {
                throw new SurveyException("invalid_document", "Expected a rule object at " + path + ".navigationRules[" + i + "]", null);
            }
            var target = rule.get("target");
            if (target == null) {
                log.warn("Dropping navigation rule without target at {}.navigationRules[{}]", path, i);
                continue;
            }
            result.add(new NavigationRule(
                text(rule.get("condition")),
                String.valueOf(target),
                Boolean.TRUE.equals(rule.get("isPage")),
                Boolean.TRUE.equals(rule.get("isDefault")),
                null
            ));
        }
        return result;
    }

    private List<ValidationRule> readValidationRules(Object raw, String path) {
        var result = new ArrayList<ValidationRule>();
        var rules = list(raw, path + ".validationRules");
        for (int i = 0; i < rules.size(); i++) {
            if (rules.get(i) instanceof String compact) {
                result.add(ValidationRuleFormat.parse(compact));
                continue;
            }
            if (!(rules.get(i) instanceof Map<?, ?> rule) || !(rule.get("operator") instanceof String operator)) {
                throw new SurveyException("invalid_document", "Expected a rule with an operator at " + path + ".validationRules[" + i + "]", null);
            }
            var dependencies = new ArrayList<String>();
            for (var dependency : list(rule.get("dependencies"), path + ".dependencies")) {
                dependencies.add(String.valueOf(dependency));
            }
            result.add(new ValidationRule(
                text(rule.get("field")),
                operator,
                readRuleValue(rule.get("value")),
                text(rule.get("message")),
                severity(rule.get("severity"), path),
                text(rule.get("condition")),
                dependencies,
                null
            ));
        }
        return result;
    }

    private static Severity severity(Object raw, String path) {
        try {
            return Severity.from(text(raw));
        } catch (IllegalArgumentException ex) {
            throw new SurveyException("invalid_document", ex.getMessage() + " at " + path, Map.of("path", path), ex);
        }
    }

    private static RuleValue readRuleValue(Object raw) {
        if (raw == null) {
            return RuleValue.none();
        }
        if (raw instanceof List<?> values) {
            var typed = !values.isEmpty() && values.stream().allMatch(DocumentCodec::isOperand);
            if (!typed) {
                return RuleValue.array(values);
            }
            var operands = new ArrayList<RuleValue.Operand>();
            for (var value : values) {
                var operand = (Map<?, ?>) value;
                operands.add("variable".equals(operand.get("type"))
                    ? RuleValue.Operand.variable(String.valueOf(operand.get("value")))
                    : RuleValue.Operand.literal(operand.get("value")));
            }
            return RuleValue.of(operands);
        }
        return RuleValue.single(raw);
    }

    private static boolean isOperand(Object value) {
        return value instanceof Map<?, ?> map
            && ("variable".equals(map.get("type")) || "literal".equals(map.get("type")));
    }

    private Map<String, Object> writeNode(DocumentTree tree, String id) {
        var node = tree.find(id).orElseThrow();
        var map = new LinkedHashMap<String, Object>();
        map.put("uuid", node.id());
        map.put("type", node.typeName());
        putIfPresent(map, "name", node.name());
        putIfPresent(map, "label", node.label());
        putIfPresent(map, "fieldName", node.fieldName());
        map.putAll(node.attributes());
        var items = new ArrayList<Object>();
        var nodes = new ArrayList<Object>();
        for (var child : node.children()) {
            switch (child.kind()) {
                case ITEM -> items.add(writeNode(tree, child.id()));
                case NODE -> nodes.add(writeNode(tree, child.id()));
                case REFERENCE -> nodes.add(child.id());
            }
        }
        if (!items.isEmpty() || hasNoNodeChildren(node) && !node.isBlock()) {
            map.put("items", items);
        }
        if (!nodes.isEmpty()) {
            map.put("nodes", nodes);
        }
        if (!node.navigationRules().isEmpty()) {
            map.put("navigationRules", node.navigationRules().stream().map(DocumentCodec::writeNavigationRule).toList());
        }
        if (!node.validationRules().isEmpty()) {
            map.put("validationRules", node.validationRules().stream().map(DocumentCodec::writeValidationRule).toList());
        }
        return map;
    }

    private static boolean hasNoNodeChildren(FormNode node) {
        return node.children().stream().noneMatch(child -> child.kind() != ChildKind.ITEM);
    }

    private static Map<String, Object> writeNavigationRule(NavigationRule rule) {
        var map = new LinkedHashMap<String, Object>();
        map.put("condition", rule.isDefault() ? "true" : rule.condition());
        map.put("target", rule.target());
        map.put("isPage", rule.pageTarget());
        if (rule.isDefault()) {
            map.put("isDefault", true);
        }
        return map;
    }

    private static Map<String, Object> writeValidationRule(ValidationRule rule) {
        var map = new LinkedHashMap<String, Object>();
        putIfPresent(map, "field", rule.field());
        map.put("operator", rule.operator());
        var value = rule.value();
        switch (value.shape()) {
            case NONE -> { }
            case SINGLE -> map.put("value", value.operands().get(0).value());
            case ARRAY -> map.put("value", value.operands().stream().map(RuleValue.Operand::value).toList());
            case OPERANDS -> map.put("value", value.operands().stream().map(operand -> {
                var entry = new LinkedHashMap<String, Object>();
                entry.put("type", operand.kind().name().toLowerCase(Locale.ROOT));
                entry.put("value", operand.value());
                return entry;
            }).toList());
        }
        map.put("message", rule.message());
        map.put("severity", rule.severity().wireName());
        putIfPresent(map, "condition", rule.condition());
        if (!rule.dependencies().isEmpty()) {
            map.put("dependencies", rule.dependencies());
        }
        return map;
    }

    private static Map<String, Object> parse(ObjectMapper mapper, String content, String code) {
        if (content == null || content.isBlank()) {
            throw new SurveyException("invalid_document", "Document is empty", null);
        }
        try {
            return mapper.readValue(content, MAP_REF);
        } catch (JsonProcessingException ex) {
            throw new SurveyException(code, "Unable to parse document: " + ex.getOriginalMessage(), null, ex);
        }
    }

    private static String idOf(Map<String, Object> raw) {
        if (raw.get("uuid") instanceof String uuid && !uuid.isBlank()) {
            return uuid;
        }
        if (raw.get("id") instanceof String id && !id.isBlank()) {
            return id;
        }
        return null;
    }

    private static List<?> list(Object raw, String path) {
        if (raw == null) {
            return List.of();
        }
        if (raw instanceof List<?> values) {
            return values;
        }
        throw new SurveyException("invalid_document", "Expected a list at " + path, Map.of("path", path));
    }

    private static Map<String, Object> optionalMap(Object raw, String key) {
        if (raw == null) {
            return null;
        }
        if (raw instanceof Map<?, ?> map) {
            return asStringMap(map);
        }
        throw new SurveyException("invalid_document", "Expected an object for " + key, Map.of("key", key));
    }

    private static Map<String, Object> asStringMap(Map<?, ?> raw) {
        var map = new LinkedHashMap<String, Object>();
        for (var entry : raw.entrySet()) {
            map.put(String.valueOf(entry.getKey()), entry.getValue());
        }
        return map;
    }

    private static String text(Object value) {
        return value == null ? null : String.valueOf(value);
    }

    private static void putIfPresent(Map<String, Object> map, String key, Object value) {
        if (value != null) {
            map.put(key, value);
        }
    }
}
