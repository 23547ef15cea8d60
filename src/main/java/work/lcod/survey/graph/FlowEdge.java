package work.lcod.survey.graph;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

public record FlowEdge(String id, String source, String target, String label, boolean conditional, Kind kind) {
    public FlowEdge {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(kind, "kind");
        label = label == null ? "" : label;
    }

    public Map<String, Object> toMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("id", id);
        map.put("source", source);
        map.put("target", target);
        map.put("label", label);
        map.put("conditional", conditional);
        map.put("type", kind.name().toLowerCase());
        return map;
    }

    public enum Kind {
        /** Virtual start node to the root. */
        START,
        /** Container to its first child. */
        ENTRY,
        /** Implicit next-in-order link between rule-less blocks and pages. */
        SEQUENTIAL,
        /** One per navigation rule. */
        NAVIGATION
    }
}
