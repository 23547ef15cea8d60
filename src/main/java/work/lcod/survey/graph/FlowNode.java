package work.lcod.survey.graph;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Positioned node of the flow graph.
 *
 * @param containerId for blocks, the page or section they are drawn inside; otherwise {@code null}
 * @param conditional whether the node carries at least one conditional navigation rule
 */
public record FlowNode(
    String id,
    Kind kind,
    double x,
    double y,
    double width,
    double height,
    String label,
    boolean conditional,
    String containerId
) {
    public static final String START_ID = "start-node";
    public static final String SUBMIT_ID = "submit-node";

    public FlowNode {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(kind, "kind");
        label = label == null ? "" : label;
    }

    public FlowNode at(double newX, double newY) {
        return new FlowNode(id, kind, newX, newY, width, height, label, conditional, containerId);
    }

    public Bounds bounds() {
        return new Bounds(x, y, width, height);
    }

    public boolean isBlock() {
        return kind == Kind.BLOCK;
    }

    public Map<String, Object> toMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("id", id);
        map.put("type", kind.name().toLowerCase());
        map.put("x", x);
        map.put("y", y);
        map.put("w", width);
        map.put("h", height);
        map.put("label", label);
        map.put("conditional", conditional);
        if (containerId != null) {
            map.put("parentId", containerId);
        }
        return map;
    }

    public enum Kind {
        START,
        SECTION,
        PAGE,
        BLOCK,
        SUBMIT
    }
}
