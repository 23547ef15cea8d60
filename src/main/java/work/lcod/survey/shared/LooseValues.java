package work.lcod.survey.shared;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Loose (coercive) conversions shared by the condition and validation evaluators.
 *
 * <p>Answers arrive from form widgets as strings, numbers, booleans or lists, so comparisons
 * coerce the way browser-side survey runtimes always have: {@code "5"} equals {@code 5},
 * {@code ""} is numerically zero and anything non-numeric becomes {@code NaN}.</p>
 */
public final class LooseValues {
    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");
    private static final Pattern HEX = Pattern.compile("0[xX][0-9a-fA-F]+");

    private LooseValues() {}

    public static double toNumber(Object value) {
        if (value == null) {
            return 0d;
        }
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value instanceof Boolean bool) {
            return bool ? 1d : 0d;
        }
        if (value instanceof CharSequence chars) {
            return parseNumber(chars.toString());
        }
        if (value instanceof List<?> list) {
            if (list.isEmpty()) {
                return 0d;
            }
            return list.size() == 1 ? toNumber(list.get(0)) : Double.NaN;
        }
        return Double.NaN;
    }

    public static boolean isNumeric(Object value) {
        var number = toNumber(value);
        return !Double.isNaN(number) && !Double.isInfinite(number);
    }

    public static String stringify(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof Double || value instanceof Float) {
            return formatNumber(((Number) value).doubleValue());
        }
        if (value instanceof BigDecimal decimal) {
            return decimal.stripTrailingZeros().toPlainString();
        }
        if (value instanceof Collection<?> items) {
            return items.stream()
                .map(item -> item == null ? "" : stringify(item))
                .collect(Collectors.joining(","));
        }
        if (value instanceof Map<?, ?>) {
            return "[object Object]";
        }
        return String.valueOf(value);
    }

    /**
     * Abstract equality: same-kind values compare directly, otherwise both sides are coerced to
     * numbers when either side is a number or boolean, and to strings in every other case.
     */
    public static boolean looseEquals(Object left, Object right) {
        if (left == null || right == null) {
            return left == null && right == null;
        }
        if (left instanceof Number || right instanceof Number || left instanceof Boolean || right instanceof Boolean) {
            if (left instanceof Boolean && right instanceof Boolean) {
                return left.equals(right);
            }
            if (left instanceof Collection<?> || right instanceof Collection<?>) {
                return stringify(left).equals(stringify(right));
            }
            return toNumber(left) == toNumber(right);
        }
        if (left instanceof CharSequence && right instanceof CharSequence) {
            return left.toString().equals(right.toString());
        }
        if (left instanceof Collection<?> && right instanceof Collection<?>) {
            return left == right;
        }
        return stringify(left).equals(stringify(right));
    }

    /**
     * Strict membership used by list operators: numbers match numbers by value, everything else by
     * {@link Object#equals}.
     */
    public static boolean strictEquals(Object left, Object right) {
        if (left instanceof Number a && right instanceof Number b) {
            return a.doubleValue() == b.doubleValue();
        }
        return Objects.equals(left, right);
    }

    public static boolean isTruthy(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean bool) {
            return bool;
        }
        if (value instanceof Number number) {
            var d = number.doubleValue();
            return d != 0d && !Double.isNaN(d);
        }
        if (value instanceof CharSequence chars) {
            return chars.length() > 0;
        }
        return true;
    }

    /** Empty means falsy, the empty string, or an empty list. */
    public static boolean isEmpty(Object value) {
        if (!isTruthy(value)) {
            return true;
        }
        return value instanceof Collection<?> items && items.isEmpty();
    }

    private static double parseNumber(String raw) {
        var trimmed = raw.trim();
        if (trimmed.isEmpty()) {
            return 0d;
        }
        if (DECIMAL.matcher(trimmed).matches()) {
            return Double.parseDouble(trimmed);
        }
        if (HEX.matcher(trimmed).matches()) {
            return new BigInteger(trimmed.substring(2), 16).doubleValue();
        }
        return switch (trimmed) {
            case "Infinity", "+Infinity" -> Double.POSITIVE_INFINITY;
            case "-Infinity" -> Double.NEGATIVE_INFINITY;
            default -> Double.NaN;
        };
    }

    private static String formatNumber(double value) {
        if (Double.isNaN(value)) {
            return "NaN";
        }
        if (Double.isInfinite(value)) {
            return value > 0 ? "Infinity" : "-Infinity";
        }
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }
}
