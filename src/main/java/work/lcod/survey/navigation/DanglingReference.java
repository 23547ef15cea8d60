package work.lcod.survey.navigation;

/**
 * Navigation rule pointing at a node that is not in the tree.
 */
public record DanglingReference(String sourceId, int ruleIndex, String target) {}
