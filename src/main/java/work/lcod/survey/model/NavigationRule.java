package work.lcod.survey.model;

import java.util.Objects;
import work.lcod.survey.condition.ConditionExpression;
import work.lcod.survey.condition.ConditionParser;

/**
 * Condition plus target pair deciding where a respondent goes after a block.
 *
 * @param condition  condition string as stored in documents; {@code "true"} is unconditional
 * @param target     node id, or {@link #SUBMIT}
 * @param pageTarget whether {@code target} names a page rather than a block
 * @param isDefault  default rules always match, whatever their condition says
 * @param expression compiled condition
 */
public record NavigationRule(
    String condition,
    String target,
    boolean pageTarget,
    boolean isDefault,
    ConditionExpression expression
) {
    public static final String SUBMIT = "submit";

    public NavigationRule {
        condition = condition == null || condition.isBlank() ? "true" : condition.trim();
        Objects.requireNonNull(target, "target");
        if (expression == null) {
            expression = isDefault ? ConditionExpression.ALWAYS : ConditionParser.compile(condition);
        }
    }

    public static NavigationRule of(String condition, String target) {
        return new NavigationRule(condition, target, false, false, null);
    }

    public static NavigationRule toPage(String condition, String pageId) {
        return new NavigationRule(condition, pageId, true, false, null);
    }

    public static NavigationRule defaultTo(String target) {
        return new NavigationRule("true", target, false, true, null);
    }

    /** The comparison is stored in its built (quoted) form, the way it is written to documents. */
    public static NavigationRule of(ConditionExpression.Comparison comparison, String target) {
        return new NavigationRule(ConditionParser.build(comparison), target, false, false, null);
    }

    public boolean isSubmit() {
        return SUBMIT.equals(target);
    }

    /** True for default rules and rules whose condition is the literal {@code true}. */
    public boolean isUnconditional() {
        return isDefault || expression instanceof ConditionExpression.Always;
    }
}
