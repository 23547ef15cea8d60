package work.lcod.survey.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Operand of a validation rule. Operators decide which shape they expect; the value keeps the
 * shape it was authored in.
 */
public record RuleValue(Shape shape, List<Operand> operands) {
    private static final RuleValue NONE = new RuleValue(Shape.NONE, List.of());

    public RuleValue {
        Objects.requireNonNull(shape, "shape");
        operands = Collections.unmodifiableList(new ArrayList<>(operands));
    }

    public static RuleValue none() {
        return NONE;
    }

    public static RuleValue single(Object value) {
        if (value == null) {
            return NONE;
        }
        return new RuleValue(Shape.SINGLE, List.of(Operand.literal(value)));
    }

    public static RuleValue array(List<?> values) {
        var operands = new ArrayList<Operand>();
        for (var value : values) {
            operands.add(Operand.literal(value));
        }
        return new RuleValue(Shape.ARRAY, operands);
    }

    public static RuleValue of(List<Operand> operands) {
        return new RuleValue(Shape.OPERANDS, operands);
    }

    public boolean isEmpty() {
        return operands.isEmpty();
    }

    /** Operand values with variables replaced by the current answers. */
    public List<Object> resolve(Map<String, ?> formValues) {
        var resolved = new ArrayList<Object>(operands.size());
        for (var operand : operands) {
            resolved.add(operand.resolve(formValues));
        }
        return resolved;
    }

    public enum Shape {
        NONE,
        SINGLE,
        ARRAY,
        OPERANDS
    }

    public record Operand(Kind kind, Object value) {
        public Operand {
            Objects.requireNonNull(kind, "kind");
        }

        public static Operand literal(Object value) {
            return new Operand(Kind.LITERAL, value);
        }

        public static Operand variable(String fieldName) {
            return new Operand(Kind.VARIABLE, fieldName);
        }

        Object resolve(Map<String, ?> formValues) {
            if (kind == Kind.VARIABLE) {
                return formValues == null ? null : formValues.get(String.valueOf(value));
            }
            return value;
        }

        public enum Kind {
            LITERAL,
            VARIABLE
        }
    }
}
