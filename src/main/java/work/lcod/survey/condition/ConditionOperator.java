package work.lcod.survey.condition;

import java.util.Optional;

/**
 * Operators understood by navigation conditions.
 */
public enum ConditionOperator {
    EQUALS("==", false),
    NOT_EQUALS("!=", false),
    GREATER_THAN(">", false),
    GREATER_OR_EQUAL(">=", false),
    LESS_THAN("<", false),
    LESS_OR_EQUAL("<=", false),
    CONTAINS("contains", true),
    STARTS_WITH("startsWith", true),
    ENDS_WITH("endsWith", true);

    private final String symbol;
    private final boolean stringMethod;

    ConditionOperator(String symbol, boolean stringMethod) {
        this.symbol = symbol;
        this.stringMethod = stringMethod;
    }

    public String symbol() {
        return symbol;
    }

    /** Serialized as {@code field.op("value")} rather than infix. */
    public boolean isStringMethod() {
        return stringMethod;
    }

    public static Optional<ConditionOperator> fromSymbol(String symbol) {
        if (symbol == null) {
            return Optional.empty();
        }
        var trimmed = symbol.trim();
        for (var operator : values()) {
            if (operator.symbol.equals(trimmed)) {
                return Optional.of(operator);
            }
        }
        return Optional.empty();
    }
}
