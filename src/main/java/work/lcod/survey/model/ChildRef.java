package work.lcod.survey.model;

import java.util.Objects;

public record ChildRef(String id, ChildKind kind) {
    public ChildRef {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(kind, "kind");
    }

    public static ChildRef item(String id) {
        return new ChildRef(id, ChildKind.ITEM);
    }

    public static ChildRef node(String id) {
        return new ChildRef(id, ChildKind.NODE);
    }

    public static ChildRef reference(String id) {
        return new ChildRef(id, ChildKind.REFERENCE);
    }
}
