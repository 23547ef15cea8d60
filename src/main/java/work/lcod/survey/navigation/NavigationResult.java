package work.lcod.survey.navigation;

/**
 * Outcome of resolving a block's navigation rules.
 *
 * @param ruleIndex index of the winning rule, {@code -1} when nothing matched
 */
public record NavigationResult(boolean matched, String target, boolean pageTarget, boolean terminal, int ruleIndex) {
    private static final NavigationResult NO_MATCH = new NavigationResult(false, null, false, false, -1);

    public static NavigationResult noMatch() {
        return NO_MATCH;
    }

    public static NavigationResult matched(String target, boolean pageTarget, boolean terminal, int ruleIndex) {
        return new NavigationResult(true, target, pageTarget, terminal, ruleIndex);
    }
}
