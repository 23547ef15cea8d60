package work.lcod.survey.tree;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.survey.model.ChildKind;
import work.lcod.survey.model.ChildRef;
import work.lcod.survey.model.FormNode;
import work.lcod.survey.model.NodePatch;
import work.lcod.survey.model.NodeSpec;
import work.lcod.survey.model.NodeType;

/**
 * Immutable snapshot of a survey document, stored as a flat {@code id -> node} arena.
 *
 * <p>Mutations return a new snapshot in which only the touched nodes (and the parent whose child
 * list changed) are new instances; every other node is shared with the previous snapshot. A
 * mutation that changes nothing returns {@code this}. Unknown ids are never an error.</p>
 */
public final class DocumentTree {
    private static final Supplier<String> RANDOM_IDS = () -> UUID.randomUUID().toString();

    private final String rootId;
    private final Map<String, FormNode> nodes;
    private final Map<String, String> parents;
    private final Supplier<String> idGenerator;
    private final Logger log;

    private DocumentTree(
        String rootId,
        Map<String, FormNode> nodes,
        Map<String, String> parents,
        Supplier<String> idGenerator,
        Logger log
    ) {
        this.rootId = rootId;
        this.nodes = Collections.unmodifiableMap(nodes);
        this.parents = Collections.unmodifiableMap(parents);
        this.idGenerator = idGenerator;
        this.log = log;
    }

    public static DocumentTree of(NodeSpec root) {
        return of(root, RANDOM_IDS, LoggerFactory.getLogger(DocumentTree.class));
    }

    /**
     * Builds a snapshot from a detached node description. Missing ids, and ids already used elsewhere in the
     * document, are replaced with generated ones.
     */
    public static DocumentTree of(NodeSpec root, Supplier<String> idGenerator, Logger log) {
        Objects.requireNonNull(root, "root");
        Objects.requireNonNull(idGenerator, "idGenerator");
        Objects.requireNonNull(log, "log");
        var nodes = new LinkedHashMap<String, FormNode>();
        var parents = new HashMap<String, String>();
        var rootId = materialize(root, null, nodes, parents, idGenerator, log);
        return new DocumentTree(rootId, nodes, parents, idGenerator, log);
    }

    /** Empty survey: a single root section. */
    public static DocumentTree empty() {
        return of(NodeSpec.section("root"));
    }

    public String rootId() {
        return rootId;
    }

    public FormNode root() {
        return nodes.get(rootId);
    }

    public Optional<FormNode> find(String id) {
        return id == null ? Optional.empty() : Optional.ofNullable(nodes.get(id));
    }

    public boolean contains(String id) {
        return id != null && nodes.containsKey(id);
    }

    public int size() {
        return nodes.size();
    }

    public Optional<FormNode> parentOf(String id) {
        var parentId = id == null ? null : parents.get(id);
        return parentId == null ? Optional.empty() : Optional.ofNullable(nodes.get(parentId));
    }

    /** Embedded children of {@code id} in document order; bare references are not resolved. */
    public List<FormNode> children(String id) {
        var node = nodes.get(id);
        if (node == null) {
            return List.of();
        }
        var result = new ArrayList<FormNode>();
        for (var childId : node.embeddedChildIds()) {
            var child = nodes.get(childId);
            if (child != null) {
                result.add(child);
            }
        }
        return result;
    }

    /** Ancestors of {@code id}, nearest first, ending with the root. */
    public List<FormNode> ancestors(String id) {
        var result = new ArrayList<FormNode>();
        var current = id == null ? null : parents.get(id);
        while (current != null) {
            result.add(nodes.get(current));
            current = parents.get(current);
        }
        return result;
    }

    /** All nodes reachable through embedded children, depth first in document order. */
    public List<FormNode> walk() {
        var result = new ArrayList<FormNode>(nodes.size());
        var stack = new ArrayDeque<String>();
        stack.push(rootId);
        while (!stack.isEmpty()) {
            var node = nodes.get(stack.pop());
            if (node == null) {
                continue;
            }
            result.add(node);
            var childIds = node.embeddedChildIds();
            for (int i = childIds.size() - 1; i >= 0; i--) {
                stack.push(childIds.get(i));
            }
        }
        return result;
    }

    public List<FormNode> nodesOfType(NodeType type) {
        var result = new ArrayList<FormNode>();
        for (var node : walk()) {
            if (node.type() == type) {
                result.add(node);
            }
        }
        return result;
    }

    public Optional<FormNode> blockByFieldName(String fieldName) {
        if (fieldName == null) {
            return Optional.empty();
        }
        for (var node : walk()) {
            if (node.isBlock() && fieldName.equals(node.fieldName())) {
                return Optional.of(node);
            }
        }
        return Optional.empty();
    }

    public Set<String> fieldNames() {
        var names = new LinkedHashSet<String>();
        for (var node : walk()) {
            if (node.isBlock() && node.fieldName() != null && !node.fieldName().isBlank()) {
                names.add(node.fieldName());
            }
        }
        return names;
    }

    /**
     * Attaches {@code nodeSpec} (and its nested children) as the last child of {@code parentId}.
     * Sections go to the {@code nodes} list, everything else to {@code items}.
     */
    public DocumentTree addChild(String parentId, NodeSpec nodeSpec) {
        Objects.requireNonNull(nodeSpec, "nodeSpec");
        var parent = parentId == null ? null : nodes.get(parentId);
        if (parent == null) {
            log.debug("addChild: parent {} not found, tree unchanged", parentId);
            return this;
        }
        var nextNodes = new LinkedHashMap<>(nodes);
        var nextParents = new HashMap<>(parents);
        var childId = materialize(nodeSpec, parentId, nextNodes, nextParents, idGenerator, log);
        var children = new ArrayList<>(parent.children());
        children.add(new ChildRef(childId, nodeSpec.attachKind()));
        nextNodes.put(parentId, parent.withChildren(children));
        return new DocumentTree(rootId, nextNodes, nextParents, idGenerator, log);
    }

    /** Merges {@code patch} into the node with {@code id}; the id itself never changes. */
    public DocumentTree updateById(String id, NodePatch patch) {
        Objects.requireNonNull(patch, "patch");
        var node = id == null ? null : nodes.get(id);
        if (node == null) {
            log.debug("updateById: node {} not found, tree unchanged", id);
            return this;
        }
        var updated = patch.applyTo(node);
        if (updated == node) {
            return this;
        }
        var nextNodes = new LinkedHashMap<>(nodes);
        nextNodes.put(id, updated);
        return new DocumentTree(rootId, nextNodes, new HashMap<>(parents), idGenerator, log);
    }

    /**
     * Removes the node with {@code id} and its whole subtree, plus every bare reference to a removed
     * id. Navigation rules that target removed nodes are left as they are. The root cannot be
     * removed.
     */
    public DocumentTree removeById(String id) {
        if (id == null) {
            return this;
        }
        if (id.equals(rootId)) {
            log.warn("removeById: refusing to remove the root node {}", id);
            return this;
        }
        var removed = new HashSet<String>();
        if (nodes.containsKey(id)) {
            collectSubtree(id, removed);
        } else {
            removed.add(id);
        }

        var nextNodes = new LinkedHashMap<String, FormNode>();
        boolean changed = nodes.containsKey(id);
        for (var entry : nodes.entrySet()) {
            if (removed.contains(entry.getKey())) {
                continue;
            }
            var node = entry.getValue();
            var kept = pruneChildren(node, removed);
            changed |= kept != node;
            nextNodes.put(entry.getKey(), kept);
        }
        if (!changed) {
            log.debug("removeById: node {} not found, tree unchanged", id);
            return this;
        }
        var nextParents = new HashMap<>(parents);
        nextParents.keySet().removeAll(removed);
        return new DocumentTree(rootId, nextNodes, nextParents, idGenerator, log);
    }

    /**
     * Inserts a deep copy of {@code id} (fresh ids throughout) right after the original.
     */
    public DocumentTree duplicate(String id) {
        var node = id == null ? null : nodes.get(id);
        var parentId = id == null ? null : parents.get(id);
        if (node == null || parentId == null) {
            log.debug("duplicate: node {} not found or is the root, tree unchanged", id);
            return this;
        }
        var parent = nodes.get(parentId);
        var nextNodes = new LinkedHashMap<>(nodes);
        var nextParents = new HashMap<>(parents);
        var copyId = materialize(toSpec(id, true), parentId, nextNodes, nextParents, idGenerator, log);
        var children = new ArrayList<ChildRef>();
        for (var child : parent.children()) {
            children.add(child);
            if (child.id().equals(id) && child.kind().isEmbedded()) {
                children.add(new ChildRef(copyId, child.kind()));
            }
        }
        nextNodes.put(parentId, parent.withChildren(children));
        return new DocumentTree(rootId, nextNodes, nextParents, idGenerator, log);
    }

    /** Appends a bare reference to {@code targetId} in the {@code nodes} list of {@code sourceId}. */
    public DocumentTree linkReference(String sourceId, String targetId) {
        var source = sourceId == null ? null : nodes.get(sourceId);
        if (source == null || !contains(targetId) || sourceId.equals(targetId)) {
            log.debug("linkReference: cannot link {} -> {}, tree unchanged", sourceId, targetId);
            return this;
        }
        for (var child : source.children()) {
            if (child.id().equals(targetId)) {
                return this;
            }
        }
        var children = new ArrayList<>(source.children());
        children.add(ChildRef.reference(targetId));
        var nextNodes = new LinkedHashMap<>(nodes);
        nextNodes.put(sourceId, source.withChildren(children));
        return new DocumentTree(rootId, nextNodes, new HashMap<>(parents), idGenerator, log);
    }

    /**
     * Replaces the node with {@code id} by {@code replacement}, keeping its children and id. Used
     * by bulk rewrites such as rule pruning.
     */
    public DocumentTree replaceNode(FormNode replacement) {
        var current = nodes.get(replacement.id());
        if (current == null || current.equals(replacement)) {
            return this;
        }
        var nextNodes = new LinkedHashMap<>(nodes);
        nextNodes.put(replacement.id(), replacement.withChildren(current.children()));
        return new DocumentTree(rootId, nextNodes, new HashMap<>(parents), idGenerator, log);
    }

    /** Detached copy of the subtree under {@code id}, ids included. */
    public Optional<NodeSpec> toSpec(String id) {
        return contains(id) ? Optional.of(toSpec(id, false)) : Optional.empty();
    }

    private NodeSpec toSpec(String id, boolean dropIds) {
        var node = nodes.get(id);
        var nodeSpec = new NodeSpec(
            dropIds ? null : node.id(),
            node.type(),
            node.typeName(),
            node.name(),
            node.label(),
            node.fieldName(),
            List.of(),
            node.navigationRules(),
            node.validationRules(),
            node.attributes()
        );
        for (var child : node.children()) {
            nodeSpec = switch (child.kind()) {
                case ITEM -> nodeSpec.withItem(toSpec(child.id(), dropIds));
                case NODE -> nodeSpec.withNode(toSpec(child.id(), dropIds));
                case REFERENCE -> nodeSpec.withReference(child.id());
            };
        }
        return nodeSpec;
    }

    private void collectSubtree(String id, Set<String> sink) {
        var stack = new ArrayDeque<String>();
        stack.push(id);
        while (!stack.isEmpty()) {
            var current = stack.pop();
            if (!sink.add(current)) {
                continue;
            }
            var node = nodes.get(current);
            if (node != null) {
                node.embeddedChildIds().forEach(stack::push);
            }
        }
    }

    private static FormNode pruneChildren(FormNode node, Set<String> removed) {
        List<ChildRef> kept = null;
        var children = node.children();
        for (int i = 0; i < children.size(); i++) {
            var child = children.get(i);
            if (removed.contains(child.id())) {
                if (kept == null) {
                    kept = new ArrayList<>(children.subList(0, i));
                }
            } else if (kept != null) {
                kept.add(child);
            }
        }
        return kept == null ? node : node.withChildren(kept);
    }

    private static String materialize(
        NodeSpec nodeSpec,
        String parentId,
        Map<String, FormNode> sink,
        Map<String, String> parents,
        Supplier<String> idGenerator,
        Logger log
    ) {
        var id = nodeSpec.id();
        if (id == null) {
            id = freshId(sink, idGenerator);
        } else if (sink.containsKey(id)) {
            var replacement = freshId(sink, idGenerator);
            log.warn("Duplicate node id {} replaced with {}", id, replacement);
            id = replacement;
        }
        // reserve the id before descending so nested duplicates are detected
        sink.put(id, null);
        var children = new ArrayList<ChildRef>();
        for (var child : nodeSpec.children()) {
            if (child.kind() == ChildKind.REFERENCE) {
                children.add(ChildRef.reference(child.referenceId()));
                continue;
            }
            var childId = materialize(child.node(), id, sink, parents, idGenerator, log);
            children.add(new ChildRef(childId, child.kind()));
        }
        sink.put(id, new FormNode(
            id,
            nodeSpec.type(),
            nodeSpec.typeName(),
            nodeSpec.name(),
            nodeSpec.label(),
            nodeSpec.fieldName(),
            children,
            nodeSpec.navigationRules(),
            nodeSpec.validationRules(),
            nodeSpec.attributes()
        ));
        if (parentId != null) {
            parents.put(id, parentId);
        }
        return id;
    }

    private static String freshId(Map<String, FormNode> taken, Supplier<String> idGenerator) {
        for (int attempt = 0; attempt < 16; attempt++) {
            var candidate = idGenerator.get();
            if (candidate != null && !candidate.isBlank() && !taken.containsKey(candidate)) {
                return candidate;
            }
        }
        return UUID.randomUUID().toString();
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof DocumentTree tree)) {
            return false;
        }
        return rootId.equals(tree.rootId) && nodes.equals(tree.nodes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(rootId, nodes);
    }

    @Override
    public String toString() {
        return "DocumentTree[root=" + rootId + ", nodes=" + nodes.size() + "]";
    }
}
