package work.lcod.survey.validation;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Catalog of validation operators, keyed by the name stored in documents.
 */
public enum ValidationOperator {
    EQUALS("==", Category.COMPARISON, ValueShape.VARIABLE, OperatorChecks::equalTo),
    NOT_EQUALS("!=", Category.COMPARISON, ValueShape.VARIABLE, OperatorChecks::notEqualTo),
    GREATER_THAN(">", Category.COMPARISON, ValueShape.VARIABLE, OperatorChecks::greaterThan),
    GREATER_OR_EQUAL(">=", Category.COMPARISON, ValueShape.VARIABLE, OperatorChecks::greaterOrEqual),
    LESS_THAN("<", Category.COMPARISON, ValueShape.VARIABLE, OperatorChecks::lessThan),
    LESS_OR_EQUAL("<=", Category.COMPARISON, ValueShape.VARIABLE, OperatorChecks::lessOrEqual),

    CONTAINS("contains", Category.STRING, ValueShape.SINGLE, OperatorChecks::contains),
    NOT_CONTAINS("notContains", Category.STRING, ValueShape.SINGLE, OperatorChecks::notContains),
    STARTS_WITH("startsWith", Category.STRING, ValueShape.SINGLE, OperatorChecks::startsWith),
    ENDS_WITH("endsWith", Category.STRING, ValueShape.SINGLE, OperatorChecks::endsWith),
    MATCHES("matches", Category.STRING, ValueShape.SINGLE, OperatorChecks::matches),
    LENGTH_EQUALS("lengthEquals", Category.STRING, ValueShape.SINGLE, OperatorChecks::lengthEquals),
    LENGTH_GREATER_THAN("lengthGreaterThan", Category.STRING, ValueShape.SINGLE, OperatorChecks::lengthGreaterThan),
    LENGTH_LESS_THAN("lengthLessThan", Category.STRING, ValueShape.SINGLE, OperatorChecks::lengthLessThan),
    MIN_LENGTH("minLength", Category.STRING, ValueShape.SINGLE, OperatorChecks::minLength),
    MAX_LENGTH("maxLength", Category.STRING, ValueShape.SINGLE, OperatorChecks::maxLength),

    IN("in", Category.ARRAY, ValueShape.MIXED, OperatorChecks::in),
    NOT_IN("notIn", Category.ARRAY, ValueShape.MIXED, OperatorChecks::notIn),
    CONTAINS_ANY("containsAny", Category.ARRAY, ValueShape.ARRAY, OperatorChecks::containsAny),
    CONTAINS_ALL("containsAll", Category.ARRAY, ValueShape.ARRAY, OperatorChecks::containsAll),
    CONTAINS_NONE("containsNone", Category.ARRAY, ValueShape.ARRAY, OperatorChecks::containsNone),

    IS_EMPTY("isEmpty", Category.LOGICAL, ValueShape.NONE, OperatorChecks::isEmpty),
    IS_NOT_EMPTY("isNotEmpty", Category.LOGICAL, ValueShape.NONE, OperatorChecks::isNotEmpty),
    BETWEEN("between", Category.LOGICAL, ValueShape.ARRAY, OperatorChecks::between),
    NOT_BETWEEN("notBetween", Category.LOGICAL, ValueShape.ARRAY, OperatorChecks::notBetween),

    IS_EMAIL("isEmail", Category.FORMAT, ValueShape.NONE, OperatorChecks::isEmail),
    IS_URL("isUrl", Category.FORMAT, ValueShape.NONE, OperatorChecks::isUrl),
    IS_NUMBER("isNumber", Category.FORMAT, ValueShape.NONE, OperatorChecks::isNumber),
    IS_INTEGER("isInteger", Category.FORMAT, ValueShape.NONE, OperatorChecks::isInteger),
    IS_DATE("isDate", Category.FORMAT, ValueShape.NONE, OperatorChecks::isDate),
    IS_PHONE("isPhone", Category.FORMAT, ValueShape.NONE, OperatorChecks::isPhone),

    DATE_EQUALS("dateEquals", Category.DATE, ValueShape.SINGLE, OperatorChecks::dateEquals),
    DATE_NOT_EQUALS("dateNotEquals", Category.DATE, ValueShape.SINGLE, OperatorChecks::dateNotEquals),
    DATE_GREATER_THAN("dateGreaterThan", Category.DATE, ValueShape.SINGLE, OperatorChecks::dateGreaterThan),
    DATE_GREATER_OR_EQUAL("dateGreaterThanOrEqual", Category.DATE, ValueShape.SINGLE, OperatorChecks::dateGreaterOrEqual),
    DATE_LESS_THAN("dateLessThan", Category.DATE, ValueShape.SINGLE, OperatorChecks::dateLessThan),
    DATE_LESS_OR_EQUAL("dateLessThanOrEqual", Category.DATE, ValueShape.SINGLE, OperatorChecks::dateLessOrEqual),
    DATE_BETWEEN("dateBetween", Category.DATE, ValueShape.ARRAY, OperatorChecks::dateBetween),
    DATE_NOT_BETWEEN("dateNotBetween", Category.DATE, ValueShape.ARRAY, OperatorChecks::dateNotBetween),
    IS_TODAY("isToday", Category.DATE, ValueShape.NONE, OperatorChecks::isToday),
    IS_PAST_DATE("isPastDate", Category.DATE, ValueShape.NONE, OperatorChecks::isPastDate),
    IS_FUTURE_DATE("isFutureDate", Category.DATE, ValueShape.NONE, OperatorChecks::isFutureDate),
    IS_WEEKDAY("isWeekday", Category.DATE, ValueShape.NONE, OperatorChecks::isWeekday),
    IS_WEEKEND("isWeekend", Category.DATE, ValueShape.NONE, OperatorChecks::isWeekend),
    DAY_OF_WEEK_EQUALS("dayOfWeekEquals", Category.DATE, ValueShape.SINGLE, OperatorChecks::dayOfWeekEquals),
    MONTH_EQUALS("monthEquals", Category.DATE, ValueShape.SINGLE, OperatorChecks::monthEquals),
    YEAR_EQUALS("yearEquals", Category.DATE, ValueShape.SINGLE, OperatorChecks::yearEquals),
    AGE_GREATER_THAN("ageGreaterThan", Category.DATE, ValueShape.SINGLE, OperatorChecks::ageGreaterThan),
    AGE_LESS_THAN("ageLessThan", Category.DATE, ValueShape.SINGLE, OperatorChecks::ageLessThan),
    AGE_BETWEEN("ageBetween", Category.DATE, ValueShape.ARRAY, OperatorChecks::ageBetween);

    private static final Map<String, ValidationOperator> BY_NAME = new HashMap<>();

    static {
        for (var operator : values()) {
            BY_NAME.put(operator.wireName, operator);
        }
    }

    private final String wireName;
    private final Category category;
    private final ValueShape valueShape;
    private final Check check;

    ValidationOperator(String wireName, Category category, ValueShape valueShape, Check check) {
        this.wireName = wireName;
        this.category = category;
        this.valueShape = valueShape;
        this.check = check;
    }

    public static Optional<ValidationOperator> fromName(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(BY_NAME.get(name.trim()));
    }

    public String wireName() {
        return wireName;
    }

    public Category category() {
        return category;
    }

    public ValueShape valueShape() {
        return valueShape;
    }

    /**
     * Comparison operators describe the failure: {@code age > 65} rejects ages above 65. Every
     * other category describes what a valid answer looks like.
     */
    public boolean failsWhenHolds() {
        return category == Category.COMPARISON;
    }

    /** Raw predicate, without polarity. */
    boolean holds(Object subject, List<Object> operands, CheckContext ctx) {
        return check.test(subject, operands, ctx);
    }

    /** Whether {@code subject} passes, polarity applied. */
    boolean passes(Object subject, List<Object> operands, CheckContext ctx) {
        var holds = holds(subject, operands, ctx);
        return failsWhenHolds() != holds;
    }

    public enum Category {
        COMPARISON,
        STRING,
        ARRAY,
        LOGICAL,
        FORMAT,
        DATE
    }

    public enum ValueShape {
        NONE,
        SINGLE,
        ARRAY,
        VARIABLE,
        MIXED
    }

    @FunctionalInterface
    interface Check {
        boolean test(Object subject, List<Object> operands, CheckContext ctx);
    }
}
