package work.lcod.survey.graph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.survey.model.FormNode;
import work.lcod.survey.navigation.SurveyPages;
import work.lcod.survey.tree.DocumentTree;

/**
 * Derives the positioned flow graph of a survey: one node per section, page and block plus the
 * virtual start and submit nodes, implicit sequential edges and one edge per navigation rule.
 *
 * <p>Sections and pages are laid out by breadth-first level from the start node (edges are
 * projected onto the container a block sits in), siblings spread horizontally, and each placement
 * goes through {@link CollisionResolver}. Blocks are stacked inside their container.</p>
 */
public final class FlowGraphBuilder {
    static final String BEGIN_LABEL = "Begin Survey";
    static final String DEFAULT_LABEL = "default";

    private final LayoutSettings settings;
    private final CollisionResolver collisions;
    private final Logger log;

    public FlowGraphBuilder() {
        this(LayoutSettings.defaults(), LoggerFactory.getLogger(FlowGraphBuilder.class));
    }

    public FlowGraphBuilder(LayoutSettings settings, Logger log) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.collisions = new CollisionResolver(settings);
        this.log = Objects.requireNonNull(log, "log");
    }

    public LayoutSettings settings() {
        return settings;
    }

    /** Full layout from scratch. */
    public FlowGraph build(DocumentTree tree) {
        return layoutFull(describe(tree));
    }

    /**
     * Lays out {@code tree} reusing {@code previous} positions. A full layout runs when there is
     * no previous graph or the number of pages changed; otherwise existing nodes keep their
     * place and only containers whose block list changed get their blocks restacked.
     */
    public FlowGraph relayout(FlowGraph previous, DocumentTree tree) {
        var structure = describe(tree);
        if (previous == null) {
            return layoutFull(structure);
        }
        var pageCount = structure.nodes().values().stream().filter(node -> node.kind() == FlowNode.Kind.PAGE).count();
        if (pageCount != previous.count(FlowNode.Kind.PAGE)) {
            log.debug("Page count changed ({} -> {}); running full layout", previous.count(FlowNode.Kind.PAGE), pageCount);
            return layoutFull(structure);
        }
        return layoutIncremental(previous, structure);
    }

    private Structure describe(DocumentTree tree) {
        var nodes = new LinkedHashMap<String, FlowNode>();
        var blocksByContainer = new LinkedHashMap<String, List<String>>();
        var edges = new LinkedHashMap<String, FlowEdge>();

        nodes.put(FlowNode.START_ID, new FlowNode(
            FlowNode.START_ID, FlowNode.Kind.START, 0, 0, settings.terminalWidth(), settings.terminalHeight(), "Start", false, null));

        for (var node : tree.walk()) {
            if (node.isBlock()) {
                var container = containerOf(tree, node);
                blocksByContainer.computeIfAbsent(container, key -> new ArrayList<>()).add(node.id());
            }
        }
        for (var node : tree.walk()) {
            nodes.put(node.id(), flowNode(tree, node, blocksByContainer));
        }
        nodes.put(FlowNode.SUBMIT_ID, new FlowNode(
            FlowNode.SUBMIT_ID, FlowNode.Kind.SUBMIT, 0, 0, settings.terminalWidth(), settings.terminalHeight(), "Submit", false, null));

        addEdge(edges, new FlowEdge("edge-start", FlowNode.START_ID, tree.rootId(), BEGIN_LABEL, false, FlowEdge.Kind.START));

        for (var node : tree.walk()) {
            if (node.isBlock()) {
                continue;
            }
            var children = node.embeddedChildIds();
            if (!children.isEmpty()) {
                addEdge(edges, new FlowEdge("entry-" + node.id(), node.id(), children.get(0), "", false, FlowEdge.Kind.ENTRY));
            }
        }

        for (var blockIds : blocksByContainer.values()) {
            for (int i = 0; i + 1 < blockIds.size(); i++) {
                var current = tree.find(blockIds.get(i)).orElseThrow();
                if (current.navigationRules().isEmpty()) {
                    addSequential(edges, current.id(), blockIds.get(i + 1));
                }
            }
        }

        var pages = SurveyPages.of(tree).pages();
        for (int i = 0; i < pages.size(); i++) {
            var blocks = pages.get(i).blocks();
            if (blocks.isEmpty()) {
                continue;
            }
            var last = blocks.get(blocks.size() - 1);
            if (!last.navigationRules().isEmpty()) {
                continue;
            }
            var next = i + 1 < pages.size() ? pages.get(i + 1).id() : FlowNode.SUBMIT_ID;
            if (!next.equals(last.id())) {
                addSequential(edges, last.id(), next);
            }
        }

        for (var node : tree.walk()) {
            var rules = node.navigationRules();
            for (int i = 0; i < rules.size(); i++) {
                var rule = rules.get(i);
                var target = rule.isSubmit() ? FlowNode.SUBMIT_ID : rule.target();
                if (!nodes.containsKey(target)) {
                    log.debug("Skipping edge for rule {} on {}: target {} not found", i, node.id(), rule.target());
                    continue;
                }
                var label = rule.isDefault() ? DEFAULT_LABEL : rule.condition();
                addEdge(edges, new FlowEdge(
                    "nav-" + node.id() + "-" + i, node.id(), target, label, !rule.isUnconditional(), FlowEdge.Kind.NAVIGATION));
            }
        }

        return new Structure(nodes, new ArrayList<>(edges.values()), blocksByContainer);
    }

    private FlowNode flowNode(DocumentTree tree, FormNode node, Map<String, List<String>> blocksByContainer) {
        var conditional = node.navigationRules().stream().anyMatch(rule -> !rule.isUnconditional());
        var blockCount = blocksByContainer.getOrDefault(node.id(), List.of()).size();
        return switch (node.type()) {
            case SECTION -> new FlowNode(
                node.id(), FlowNode.Kind.SECTION, 0, 0,
                Math.max(settings.sectionWidth(), blockCount > 0 ? settings.pageWidth() : 0),
                settings.containerHeight(settings.sectionHeight(), blockCount),
                node.displayName(), conditional, null);
            case PAGE -> new FlowNode(
                node.id(), FlowNode.Kind.PAGE, 0, 0,
                settings.pageWidth(),
                settings.containerHeight(settings.minPageHeight(), blockCount),
                node.displayName(), conditional, null);
            case BLOCK -> new FlowNode(
                node.id(), FlowNode.Kind.BLOCK, 0, 0,
                settings.blockWidth(), settings.blockHeight(),
                node.displayName(), conditional, containerOf(tree, node));
        };
    }

    private FlowGraph layoutFull(Structure structure) {
        var positioned = new LinkedHashMap<String, FlowNode>();
        var placed = new ArrayList<Bounds>();
        var preferred = preferredPositions(structure);
        for (var entry : preferred.entrySet()) {
            var node = structure.nodes().get(entry.getKey());
            var bounds = collisions.findAvailablePosition(entry.getValue(), placed);
            placed.add(bounds);
            positioned.put(node.id(), node.at(bounds.x(), bounds.y()));
        }
        var restacked = new ArrayList<String>();
        for (var entry : structure.blocksByContainer().entrySet()) {
            stack(structure, positioned, entry.getKey(), entry.getValue());
            restacked.add(entry.getKey());
        }
        return new FlowGraph(ordered(structure, positioned), structure.edges(), LayoutMode.FULL, restacked);
    }

    private FlowGraph layoutIncremental(FlowGraph previous, Structure structure) {
        var previousById = new HashMap<String, FlowNode>();
        for (var node : previous.nodes()) {
            previousById.put(node.id(), node);
        }
        var positioned = new LinkedHashMap<String, FlowNode>();
        var placed = new ArrayList<Bounds>();
        var fresh = new ArrayList<String>();
        for (var node : structure.nodes().values()) {
            if (node.isBlock()) {
                continue;
            }
            var before = previousById.get(node.id());
            if (before != null && !before.isBlock()) {
                var kept = node.at(before.x(), before.y());
                positioned.put(node.id(), kept);
                placed.add(kept.bounds());
            } else {
                fresh.add(node.id());
            }
        }
        if (!fresh.isEmpty()) {
            var preferred = preferredPositions(structure);
            for (var id : fresh) {
                var bounds = collisions.findAvailablePosition(preferred.get(id), placed);
                placed.add(bounds);
                positioned.put(id, structure.nodes().get(id).at(bounds.x(), bounds.y()));
            }
        }

        var previousBlocks = new LinkedHashMap<String, List<String>>();
        for (var node : previous.nodes()) {
            if (node.isBlock() && node.containerId() != null) {
                previousBlocks.computeIfAbsent(node.containerId(), key -> new ArrayList<>()).add(node.id());
            }
        }
        var containers = new LinkedHashSet<String>(structure.blocksByContainer().keySet());
        containers.addAll(previousBlocks.keySet());
        var restacked = new ArrayList<String>();
        for (var containerId : containers) {
            var blockIds = structure.blocksByContainer().getOrDefault(containerId, List.of());
            var before = previousBlocks.getOrDefault(containerId, List.of());
            var container = positioned.get(containerId);
            var previousContainer = previousById.get(containerId);
            var unchanged = blockIds.equals(before)
                && container != null
                && previousContainer != null
                && container.x() == previousContainer.x()
                && container.y() == previousContainer.y();
            if (unchanged) {
                for (var blockId : blockIds) {
                    var old = previousById.get(blockId);
                    positioned.put(blockId, structure.nodes().get(blockId).at(old.x(), old.y()));
                }
                continue;
            }
            if (container != null) {
                stack(structure, positioned, containerId, blockIds);
            }
            restacked.add(containerId);
        }
        log.debug("Incremental layout restacked {}", restacked);
        return new FlowGraph(ordered(structure, positioned), structure.edges(), LayoutMode.INCREMENTAL, restacked);
    }

    /**
     * Level-based preferred positions (no collision handling) for every non-block node, in
     * placement order.
     */
    private Map<String, Bounds> preferredPositions(Structure structure) {
        var levels = levels(structure);
        var byLevel = new TreeMap<Integer, List<String>>();
        for (var entry : levels.entrySet()) {
            byLevel.computeIfAbsent(entry.getValue(), key -> new ArrayList<>()).add(entry.getKey());
        }
        var result = new LinkedHashMap<String, Bounds>();
        var y = settings.startY();
        for (var ids : byLevel.values()) {
            var count = ids.size();
            var tallest = 0d;
            for (int i = 0; i < count; i++) {
                var node = structure.nodes().get(ids.get(i));
                var x = settings.startX() + (i - (count - 1) / 2.0) * settings.siblingSpacing();
                result.put(node.id(), new Bounds(Math.round(x), y, node.width(), node.height()));
                tallest = Math.max(tallest, node.height());
            }
            y += Math.max(settings.levelSpacing(), tallest + 2 * settings.padding());
        }
        return result;
    }

    /** BFS levels from the start node; unreachable nodes go one level below the deepest. */
    private Map<String, Integer> levels(Structure structure) {
        var adjacency = new LinkedHashMap<String, Set<String>>();
        for (var edge : structure.edges()) {
            var source = owner(structure, edge.source());
            var target = owner(structure, edge.target());
            if (!source.equals(target)) {
                adjacency.computeIfAbsent(source, key -> new LinkedHashSet<>()).add(target);
            }
        }
        var levels = new LinkedHashMap<String, Integer>();
        var queue = new ArrayDeque<String>();
        levels.put(FlowNode.START_ID, 0);
        queue.add(FlowNode.START_ID);
        var deepest = 0;
        while (!queue.isEmpty()) {
            var current = queue.poll();
            var level = levels.get(current);
            deepest = Math.max(deepest, level);
            for (var next : adjacency.getOrDefault(current, Set.of())) {
                if (!levels.containsKey(next)) {
                    levels.put(next, level + 1);
                    queue.add(next);
                }
            }
        }
        var ordered = new LinkedHashMap<String, Integer>();
        for (var node : structure.nodes().values()) {
            if (node.isBlock()) {
                continue;
            }
            ordered.put(node.id(), levels.getOrDefault(node.id(), deepest + 1));
        }
        return ordered;
    }

    private void stack(Structure structure, Map<String, FlowNode> positioned, String containerId, List<String> blockIds) {
        var container = positioned.get(containerId);
        if (container == null) {
            return;
        }
        for (int i = 0; i < blockIds.size(); i++) {
            var block = structure.nodes().get(blockIds.get(i));
            positioned.put(block.id(), block.at(
                container.x() + settings.blockOffsetX(),
                container.y() + settings.blockOffsetY() + i * settings.blockSpacing()));
        }
    }

    private static List<FlowNode> ordered(Structure structure, Map<String, FlowNode> positioned) {
        var result = new ArrayList<FlowNode>(structure.nodes().size());
        for (var id : structure.nodes().keySet()) {
            var node = positioned.get(id);
            result.add(node != null ? node : structure.nodes().get(id));
        }
        return result;
    }

    private static String owner(Structure structure, String id) {
        var node = structure.nodes().get(id);
        if (node != null && node.isBlock() && node.containerId() != null) {
            return node.containerId();
        }
        return id;
    }

    private static String containerOf(DocumentTree tree, FormNode block) {
        for (var ancestor : tree.ancestors(block.id())) {
            if (!ancestor.isBlock()) {
                return ancestor.id();
            }
        }
        return tree.rootId();
    }

    private static void addSequential(Map<String, FlowEdge> edges, String source, String target) {
        addEdge(edges, new FlowEdge("seq-" + source + "-" + target, source, target, "", false, FlowEdge.Kind.SEQUENTIAL));
    }

    private static void addEdge(Map<String, FlowEdge> edges, FlowEdge edge) {
        edges.putIfAbsent(edge.id(), edge);
    }

    private record Structure(
        Map<String, FlowNode> nodes,
        List<FlowEdge> edges,
        Map<String, List<String>> blocksByContainer
    ) {}
}
