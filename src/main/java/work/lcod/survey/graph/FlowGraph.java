package work.lcod.survey.graph;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Positioned graph handed to drawing hosts.
 *
 * @param restackedContainers containers whose block stack was (re)computed by the last layout
 */
public record FlowGraph(List<FlowNode> nodes, List<FlowEdge> edges, LayoutMode mode, List<String> restackedContainers) {
    public FlowGraph {
        nodes = List.copyOf(nodes);
        edges = List.copyOf(edges);
        restackedContainers = List.copyOf(restackedContainers);
    }

    public Optional<FlowNode> node(String id) {
        return nodes.stream().filter(node -> node.id().equals(id)).findFirst();
    }

    public List<FlowEdge> edgesOfKind(FlowEdge.Kind kind) {
        return edges.stream().filter(edge -> edge.kind() == kind).toList();
    }

    public long count(FlowNode.Kind kind) {
        return nodes.stream().filter(node -> node.kind() == kind).count();
    }

    public Map<String, Object> toMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("layout", mode.name().toLowerCase());
        map.put("nodes", nodes.stream().map(FlowNode::toMap).toList());
        map.put("edges", edges.stream().map(FlowEdge::toMap).toList());
        return map;
    }
}
