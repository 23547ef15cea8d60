package work.lcod.survey.validation;

import java.util.Arrays;
import java.util.List;
import work.lcod.survey.model.RuleValue;
import work.lcod.survey.model.Severity;
import work.lcod.survey.model.ValidationRule;

/**
 * Legacy compact form {@code operator|value|message}, where list values are comma separated.
 */
public final class ValidationRuleFormat {
    private ValidationRuleFormat() {}

    /** Unparseable input yields {@code == ""} with the default message. */
    public static ValidationRule parse(String text) {
        if (text != null) {
            var parts = text.split("\\|", -1);
            if (parts.length >= 2) {
                var operatorName = parts[0].trim();
                var rawValue = parts[1].trim();
                var message = String.join("|", Arrays.copyOfRange(parts, 2, parts.length)).trim();
                return ValidationRule.of(operatorName, valueFor(operatorName, rawValue), message);
            }
        }
        return new ValidationRule(null, "==", RuleValue.single(""), ValidationRule.DEFAULT_MESSAGE, Severity.ERROR, null, List.of(), null);
    }

    public static String format(ValidationRule rule) {
        var values = rule.value().operands().stream()
            .map(operand -> operand.value() == null ? "" : String.valueOf(operand.value()))
            .toList();
        return rule.operator() + "|" + String.join(",", values) + "|" + rule.message();
    }

    private static RuleValue valueFor(String operatorName, String rawValue) {
        var operator = ValidationOperator.fromName(operatorName);
        var listShaped = operator
            .map(op -> op.valueShape() == ValidationOperator.ValueShape.ARRAY || op.valueShape() == ValidationOperator.ValueShape.MIXED)
            .orElse(false);
        if (operator.map(op -> op.valueShape() == ValidationOperator.ValueShape.NONE).orElse(false) && rawValue.isEmpty()) {
            return RuleValue.none();
        }
        if (listShaped && rawValue.contains(",")) {
            return RuleValue.array(Arrays.stream(rawValue.split(",")).map(String::trim).toList());
        }
        return RuleValue.single(rawValue);
    }
}
