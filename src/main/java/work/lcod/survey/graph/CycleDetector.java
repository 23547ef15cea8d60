package work.lcod.survey.graph;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.survey.model.NavigationRule;
import work.lcod.survey.tree.DocumentTree;

/**
 * Finds navigation loops. Cycles are advisory: a survey with a loop still loads and runs.
 */
public final class CycleDetector {
    static final String ARROW = " → ";

    private final Logger log;

    public CycleDetector() {
        this(LoggerFactory.getLogger(CycleDetector.class));
    }

    public CycleDetector(Logger log) {
        this.log = Objects.requireNonNull(log, "log");
    }

    /** Cycles rendered as {@code A → B → C → A}. */
    public List<String> detectCycles(DocumentTree tree) {
        var result = new ArrayList<String>();
        for (var cycle : findCycles(tree)) {
            result.add(String.join(ARROW, cycle));
        }
        return result;
    }

    /**
     * Cycles as id paths, first id repeated at the end. Every node is explored once, so each
     * ring is reported a single time and disjoint rings are all found.
     */
    public List<List<String>> findCycles(DocumentTree tree) {
        var adjacency = adjacency(tree);
        var cycles = new ArrayList<List<String>>();
        var visited = new HashSet<String>();
        for (var start : adjacency.keySet()) {
            if (!visited.contains(start)) {
                visit(start, adjacency, visited, new LinkedHashSet<>(), new ArrayList<>(), cycles);
            }
        }
        if (!cycles.isEmpty()) {
            log.warn("Navigation contains {} cycle(s)", cycles.size());
        }
        return cycles;
    }

    /** Rule targets per node, {@code submit} excluded. */
    static Map<String, Set<String>> adjacency(DocumentTree tree) {
        var adjacency = new LinkedHashMap<String, Set<String>>();
        for (var node : tree.walk()) {
            var targets = new LinkedHashSet<String>();
            for (var rule : node.navigationRules()) {
                if (!NavigationRule.SUBMIT.equals(rule.target())) {
                    targets.add(rule.target());
                }
            }
            adjacency.put(node.id(), targets);
        }
        return adjacency;
    }

    private static void visit(
        String node,
        Map<String, Set<String>> adjacency,
        Set<String> visited,
        Set<String> onStack,
        List<String> path,
        List<List<String>> cycles
    ) {
        visited.add(node);
        onStack.add(node);
        path.add(node);
        for (var next : adjacency.getOrDefault(node, Set.of())) {
            if (onStack.contains(next)) {
                var cycle = new ArrayList<>(path.subList(path.indexOf(next), path.size()));
                cycle.add(next);
                cycles.add(cycle);
            } else if (!visited.contains(next)) {
                visit(next, adjacency, visited, onStack, path, cycles);
            }
        }
        path.remove(path.size() - 1);
        onStack.remove(node);
    }
}
