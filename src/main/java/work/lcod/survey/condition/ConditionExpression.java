package work.lcod.survey.condition;

import java.util.List;
import java.util.Objects;

/**
 * Compiled form of a navigation condition. Strings are only parsed once, when a rule is created
 * or read from a document; evaluation walks this tree.
 */
public interface ConditionExpression {
    ConditionExpression ALWAYS = new Always();
    ConditionExpression NEVER = new Never();

    /** Canonical string form, as written back to documents. */
    String source();

    /** The literal {@code true}, a blank condition, or a default rule. */
    record Always() implements ConditionExpression {
        @Override
        public String source() {
            return "true";
        }
    }

    record Never() implements ConditionExpression {
        @Override
        public String source() {
            return "false";
        }
    }

    /**
     * A single {@code field op value} test.
     *
     * @param quoted whether the value was written as a string literal; unquoted {@code true},
     *               {@code false} and numbers compare as booleans and numbers
     */
    record Comparison(String field, ConditionOperator operator, String value, boolean quoted) implements ConditionExpression {
        public Comparison {
            Objects.requireNonNull(field, "field");
            Objects.requireNonNull(operator, "operator");
            value = value == null ? "" : value;
        }

        public Comparison(String field, ConditionOperator operator, String value) {
            this(field, operator, value, true);
        }

        @Override
        public String source() {
            return ConditionParser.build(this);
        }
    }

    /** {@code &&} / {@code ||} chain; {@code &&} binds tighter when compiled from a string. */
    record Junction(Kind kind, List<ConditionExpression> operands) implements ConditionExpression {
        public Junction {
            Objects.requireNonNull(kind, "kind");
            operands = List.copyOf(operands);
        }

        @Override
        public String source() {
            var separator = kind == Kind.AND ? " && " : " || ";
            var builder = new StringBuilder();
            for (int i = 0; i < operands.size(); i++) {
                if (i > 0) {
                    builder.append(separator);
                }
                var operand = operands.get(i);
                var text = operand.source();
                if (kind == Kind.AND && operand instanceof Junction nested && nested.kind() == Kind.OR) {
                    text = "(" + text + ")";
                }
                builder.append(text);
            }
            return builder.toString();
        }

        public enum Kind {
            AND,
            OR
        }
    }

    /** Text that does not match the grammar. Always evaluates to false. */
    record Unparsable(String source) implements ConditionExpression {
        public Unparsable {
            source = source == null ? "" : source;
        }
    }
}
