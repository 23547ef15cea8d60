package work.lcod.survey.model;

/**
 * Where a child entry came from: the embedded {@code items} list, the {@code nodes} list, or a
 * bare id inside {@code nodes} that only references another node.
 */
public enum ChildKind {
    ITEM,
    NODE,
    REFERENCE;

    public boolean isEmbedded() {
        return this != REFERENCE;
    }
}
