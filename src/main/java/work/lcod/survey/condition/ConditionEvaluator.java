package work.lcod.survey.condition;

import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.survey.condition.ConditionExpression.Always;
import work.lcod.survey.condition.ConditionExpression.Comparison;
import work.lcod.survey.condition.ConditionExpression.Junction;
import work.lcod.survey.condition.ConditionExpression.Never;
import work.lcod.survey.condition.ConditionExpression.Unparsable;
import work.lcod.survey.shared.LooseValues;

/**
 * Evaluates navigation conditions against a flat answer map. A condition that holds means
 * "route here".
 */
public final class ConditionEvaluator {
    private final Logger log;

    public ConditionEvaluator() {
        this(LoggerFactory.getLogger(ConditionEvaluator.class));
    }

    public ConditionEvaluator(Logger log) {
        this.log = Objects.requireNonNull(log, "log");
    }

    public boolean evaluate(String condition, Map<String, ?> context) {
        return evaluate(ConditionParser.compile(condition), context);
    }

    public boolean evaluate(ConditionExpression expression, Map<String, ?> context) {
        if (expression == null || expression instanceof Always) {
            return true;
        }
        if (expression instanceof Never) {
            return false;
        }
        if (expression instanceof Comparison comparison) {
            return compare(comparison, lookup(context, comparison.field()));
        }
        if (expression instanceof Junction junction) {
            if (junction.kind() == Junction.Kind.AND) {
                return junction.operands().stream().allMatch(operand -> evaluate(operand, context));
            }
            return junction.operands().stream().anyMatch(operand -> evaluate(operand, context));
        }
        if (expression instanceof Unparsable unparsable) {
            log.debug("Condition '{}' does not match the grammar; treating as false", unparsable.source());
            return false;
        }
        throw new IllegalArgumentException("Unsupported condition node: " + expression.getClass().getName());
    }

    private boolean compare(Comparison comparison, Object fieldValue) {
        var operator = comparison.operator();
        var text = comparison.value();
        if (fieldValue == null) {
            return operator == ConditionOperator.NOT_EQUALS;
        }
        var expected = literal(comparison);
        return switch (operator) {
            case EQUALS -> LooseValues.looseEquals(fieldValue, expected);
            case NOT_EQUALS -> !LooseValues.looseEquals(fieldValue, expected);
            case GREATER_THAN -> LooseValues.toNumber(fieldValue) > LooseValues.toNumber(expected);
            case GREATER_OR_EQUAL -> LooseValues.toNumber(fieldValue) >= LooseValues.toNumber(expected);
            case LESS_THAN -> LooseValues.toNumber(fieldValue) < LooseValues.toNumber(expected);
            case LESS_OR_EQUAL -> LooseValues.toNumber(fieldValue) <= LooseValues.toNumber(expected);
            case CONTAINS -> LooseValues.stringify(fieldValue).contains(text);
            case STARTS_WITH -> LooseValues.stringify(fieldValue).startsWith(text);
            case ENDS_WITH -> LooseValues.stringify(fieldValue).endsWith(text);
        };
    }

    /** Unquoted {@code true}/{@code false} and numeric literals keep their type; the rest is text. */
    private static Object literal(Comparison comparison) {
        var value = comparison.value();
        if (comparison.quoted()) {
            return value;
        }
        if ("true".equals(value)) {
            return Boolean.TRUE;
        }
        if ("false".equals(value)) {
            return Boolean.FALSE;
        }
        if (!value.isBlank() && LooseValues.isNumeric(value)) {
            return LooseValues.toNumber(value);
        }
        return value;
    }

    /** Looks up {@code field} directly, then as a dotted path into nested maps. */
    static Object lookup(Map<String, ?> context, String field) {
        if (context == null || field == null || field.isEmpty()) {
            return null;
        }
        if (context.containsKey(field)) {
            return context.get(field);
        }
        if (!field.contains(".")) {
            return null;
        }
        Object current = context;
        for (var segment : field.split("\\.")) {
            if (!(current instanceof Map<?, ?> map)) {
                return null;
            }
            current = map.get(segment);
        }
        return current;
    }
}
