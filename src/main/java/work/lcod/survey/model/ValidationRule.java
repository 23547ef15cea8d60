package work.lcod.survey.model;

import java.util.List;
import java.util.Objects;
import work.lcod.survey.condition.ConditionExpression;
import work.lcod.survey.condition.ConditionParser;

/**
 * Structured validation rule. The operator is kept as its catalog name so that documents
 * carrying operators this engine does not know still load.
 *
 * @param field        answer to check instead of the value under test, if set
 * @param condition    guard; the rule only applies when it holds
 * @param dependencies fields whose change should re-trigger this rule
 */
public record ValidationRule(
    String field,
    String operator,
    RuleValue value,
    String message,
    Severity severity,
    String condition,
    List<String> dependencies,
    ConditionExpression guard
) {
    public static final String DEFAULT_MESSAGE = "Validation failed";

    public ValidationRule {
        field = field == null || field.isBlank() ? null : field;
        Objects.requireNonNull(operator, "operator");
        value = value == null ? RuleValue.none() : value;
        message = message == null || message.isBlank() ? DEFAULT_MESSAGE : message;
        severity = severity == null ? Severity.ERROR : severity;
        condition = condition == null || condition.isBlank() ? null : condition.trim();
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
        if (guard == null && condition != null) {
            guard = ConditionParser.compile(condition);
        }
    }

    public static ValidationRule of(String operator, RuleValue value, String message) {
        return new ValidationRule(null, operator, value, message, Severity.ERROR, null, List.of(), null);
    }

    public ValidationRule withField(String newField) {
        return new ValidationRule(newField, operator, value, message, severity, condition, dependencies, null);
    }

    public ValidationRule withSeverity(Severity newSeverity) {
        return new ValidationRule(field, operator, value, message, newSeverity, condition, dependencies, guard);
    }

    public ValidationRule withCondition(String newCondition) {
        return new ValidationRule(field, operator, value, message, severity, newCondition, dependencies, null);
    }

    public boolean isWarning() {
        return severity == Severity.WARNING;
    }
}
