package work.lcod.survey.validation;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.survey.condition.ConditionEvaluator;
import work.lcod.survey.model.FormNode;
import work.lcod.survey.model.ValidationRule;
import work.lcod.survey.shared.SurveyErrors;
import work.lcod.survey.tree.DocumentTree;

/**
 * Evaluates structured validation rules. Errors raised while checking one rule fail that rule
 * with its own message and never stop the remaining rules.
 */
public final class ValidationEngine {
    private final ConditionEvaluator conditions;
    private final CheckContext checkContext;
    private final Logger log;

    public ValidationEngine() {
        this(new ConditionEvaluator(), Clock.systemDefaultZone(), LoggerFactory.getLogger(ValidationEngine.class));
    }

    public ValidationEngine(ConditionEvaluator conditions, Clock clock, Logger log) {
        this.conditions = Objects.requireNonNull(conditions, "conditions");
        this.checkContext = new CheckContext(clock);
        this.log = Objects.requireNonNull(log, "log");
    }

    /**
     * Checks one rule. Returns {@code null} when the value passes (or the rule does not apply),
     * the rule's message otherwise.
     */
    public String evaluate(ValidationRule rule, Object currentValue, Map<String, ?> formValues) {
        Objects.requireNonNull(rule, "rule");
        var values = formValues == null ? Map.<String, Object>of() : formValues;
        try {
            if (rule.guard() != null && !conditions.evaluate(rule.guard(), values)) {
                return null;
            }
            var operator = ValidationOperator.fromName(rule.operator()).orElse(null);
            if (operator == null) {
                log.warn("Unknown validation operator '{}'; rule ignored", rule.operator());
                return null;
            }
            var subject = rule.field() != null ? values.get(rule.field()) : currentValue;
            var operands = rule.value().resolve(values);
            return operator.passes(subject, operands, checkContext) ? null : rule.message();
        } catch (RuntimeException ex) {
            log.warn("Validation rule '{}' failed to evaluate: {}", rule.operator(), SurveyErrors.normalize(ex));
            return rule.message();
        }
    }

    public FieldValidation validateField(String fieldName, List<ValidationRule> rules, Object value, Map<String, ?> formValues) {
        if (rules == null || rules.isEmpty()) {
            return FieldValidation.passed(fieldName);
        }
        var failures = new ArrayList<ValidationFailure>();
        for (int i = 0; i < rules.size(); i++) {
            var rule = rules.get(i);
            var message = evaluate(rule, value, formValues);
            if (message != null) {
                failures.add(new ValidationFailure(i, rule.operator(), message, rule.severity()));
            }
        }
        return new FieldValidation(fieldName, failures);
    }

    /** Validates the answer stored under the block's field name. */
    public FieldValidation validateBlock(FormNode block, Map<String, ?> formValues) {
        var fieldName = block.fieldName();
        var value = fieldName == null || formValues == null ? null : formValues.get(fieldName);
        return validateField(fieldName, block.validationRules(), value, formValues);
    }

    /** Validates every block that has a field name and at least one rule. */
    public Map<String, FieldValidation> validateDocument(DocumentTree tree, Map<String, ?> formValues) {
        var result = new LinkedHashMap<String, FieldValidation>();
        for (var node : tree.walk()) {
            if (!node.isBlock() || node.fieldName() == null || node.fieldName().isBlank()) {
                continue;
            }
            if (node.validationRules().isEmpty()) {
                continue;
            }
            result.put(node.fieldName(), validateBlock(node, formValues));
        }
        return result;
    }
}
