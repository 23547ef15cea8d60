package work.lcod.survey.condition;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.io.JsonStringEncoder;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import work.lcod.survey.condition.ConditionExpression.Comparison;
import work.lcod.survey.condition.ConditionExpression.Junction;

/**
 * Reads and writes the condition mini-language used by navigation rules.
 *
 * <p>Accepted shapes: {@code age >= "18"}, {@code age >= 18}, {@code name contains 'x'},
 * {@code name.startsWith("x")}, the literals {@code true}/{@code false}, and {@code &&} /
 * {@code ||} chains of those (optionally parenthesized).</p>
 */
public final class ConditionParser {
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final Pattern INFIX = Pattern.compile("^([\\w.]+)\\s*(==|!=|>=|<=|>|<)\\s*(.*)$");
    private static final Pattern WORD_INFIX = Pattern.compile("^([\\w.]+)\\s+(contains|startsWith|endsWith)\\s+(.+)$");
    private static final Pattern METHOD = Pattern.compile("^([\\w.]+)\\.(contains|startsWith|endsWith)\\(\\s*(.*?)\\s*\\)$");

    private ConditionParser() {}

    /**
     * Parses a single comparison. Returns {@code null} when the text does not match the grammar.
     */
    public static Comparison parse(String text) {
        if (text == null) {
            return null;
        }
        var trimmed = text.trim();
        var method = METHOD.matcher(trimmed);
        if (method.matches()) {
            return comparison(method.group(1), method.group(2), method.group(3));
        }
        var word = WORD_INFIX.matcher(trimmed);
        if (word.matches()) {
            return comparison(word.group(1), word.group(2), word.group(3));
        }
        var infix = INFIX.matcher(trimmed);
        if (infix.matches()) {
            return comparison(infix.group(1), infix.group(2), infix.group(3));
        }
        return null;
    }

    /** Same as {@link #parse(String)} but falls back to the neutral rule {@code "" == ""}. */
    public static Comparison parseOrNeutral(String text) {
        var parsed = parse(text);
        return parsed != null ? parsed : neutral();
    }

    public static Comparison neutral() {
        return new Comparison("", ConditionOperator.EQUALS, "");
    }

    public static String build(Comparison comparison) {
        return build(comparison.field(), comparison.operator(), comparison.value(), false);
    }

    /**
     * Serializes a rule draft. A default rule is always written as {@code "true"}.
     */
    public static String build(String field, ConditionOperator operator, String value, boolean isDefault) {
        if (isDefault) {
            return "true";
        }
        var quoted = quote(value == null ? "" : value);
        var name = field == null ? "" : field;
        if (operator.isStringMethod()) {
            return name + "." + operator.symbol() + "(" + quoted + ")";
        }
        return name + " " + operator.symbol() + " " + quoted;
    }

    /**
     * Compiles a full condition string into an expression tree. Blank text and {@code true}
     * compile to {@link ConditionExpression#ALWAYS}; anything outside the grammar compiles to
     * {@link ConditionExpression.Unparsable}.
     */
    public static ConditionExpression compile(String text) {
        if (text == null || text.isBlank()) {
            return ConditionExpression.ALWAYS;
        }
        var trimmed = text.trim();
        var compiled = compileOr(trimmed);
        return compiled != null ? compiled : new ConditionExpression.Unparsable(trimmed);
    }

    private static ConditionExpression compileOr(String text) {
        var parts = splitTopLevel(text, "||");
        if (parts == null) {
            return null;
        }
        if (parts.size() == 1) {
            return compileAnd(parts.get(0));
        }
        var operands = new ArrayList<ConditionExpression>();
        for (var part : parts) {
            var operand = compileAnd(part);
            if (operand == null) {
                return null;
            }
            operands.add(operand);
        }
        return new Junction(Junction.Kind.OR, operands);
    }

    private static ConditionExpression compileAnd(String text) {
        var parts = splitTopLevel(text, "&&");
        if (parts == null) {
            return null;
        }
        if (parts.size() == 1) {
            return compileAtom(parts.get(0));
        }
        var operands = new ArrayList<ConditionExpression>();
        for (var part : parts) {
            var operand = compileAtom(part);
            if (operand == null) {
                return null;
            }
            operands.add(operand);
        }
        return new Junction(Junction.Kind.AND, operands);
    }

    private static ConditionExpression compileAtom(String text) {
        var trimmed = text.trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        if (isWrapped(trimmed)) {
            return compileOr(trimmed.substring(1, trimmed.length() - 1).trim());
        }
        if ("true".equals(trimmed)) {
            return ConditionExpression.ALWAYS;
        }
        if ("false".equals(trimmed)) {
            return ConditionExpression.NEVER;
        }
        return parse(trimmed);
    }

    /**
     * Splits on {@code separator} outside quotes and parentheses. Returns {@code null} on
     * unbalanced parentheses.
     */
    private static List<String> splitTopLevel(String text, String separator) {
        var parts = new ArrayList<String>();
        int depth = 0;
        char quote = 0;
        int start = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quote != 0) {
                if (c == '\\') {
                    i++;
                } else if (c == quote) {
                    quote = 0;
                }
                continue;
            }
            if (c == '"' || c == '\'') {
                quote = c;
            } else if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
                if (depth < 0) {
                    return null;
                }
            } else if (depth == 0 && text.startsWith(separator, i)) {
                parts.add(text.substring(start, i));
                start = i + separator.length();
                i += separator.length() - 1;
            }
        }
        if (depth != 0) {
            return null;
        }
        parts.add(text.substring(start));
        return parts;
    }

    private static boolean isWrapped(String text) {
        if (!text.startsWith("(") || !text.endsWith(")")) {
            return false;
        }
        int depth = 0;
        char quote = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quote != 0) {
                if (c == '\\') {
                    i++;
                } else if (c == quote) {
                    quote = 0;
                }
                continue;
            }
            if (c == '"' || c == '\'') {
                quote = c;
            } else if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
                if (depth == 0 && i < text.length() - 1) {
                    return false;
                }
            }
        }
        return depth == 0;
    }

    private static Comparison comparison(String field, String symbol, String rawValue) {
        var operator = ConditionOperator.fromSymbol(symbol).orElse(null);
        if (operator == null) {
            return null;
        }
        var trimmed = rawValue == null ? "" : rawValue.trim();
        var quoted = trimmed.startsWith("\"") || trimmed.startsWith("'");
        return new Comparison(field, operator, unquote(trimmed), quoted);
    }

    static String quote(String value) {
        return "\"" + new String(JsonStringEncoder.getInstance().quoteAsString(value)) + "\"";
    }

    static String unquote(String raw) {
        var value = raw == null ? "" : raw.trim();
        if (value.length() >= 2 && value.startsWith("\"") && value.endsWith("\"")) {
            try {
                return JSON.readValue(value, String.class);
            } catch (JsonProcessingException ex) {
                return value.substring(1, value.length() - 1);
            }
        }
        if (value.length() >= 2 && value.startsWith("'") && value.endsWith("'")) {
            return value.substring(1, value.length() - 1);
        }
        if (value.startsWith("\"") || value.startsWith("'")) {
            value = value.substring(1);
        }
        if (value.endsWith("\"") || value.endsWith("'")) {
            value = value.substring(0, value.length() - 1);
        }
        return value;
    }
}
