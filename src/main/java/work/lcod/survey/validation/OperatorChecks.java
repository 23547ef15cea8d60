package work.lcod.survey.validation;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import work.lcod.survey.shared.DateValues;
import work.lcod.survey.shared.LooseValues;

/**
 * Check functions behind {@link ValidationOperator}. Each returns whether the operator's
 * predicate holds; polarity is applied by the engine.
 */
final class OperatorChecks {
    static final double MILLIS_PER_YEAR = 365.25 * 24 * 60 * 60 * 1000;

    private static final Pattern EMAIL = Pattern.compile("^[^\\s@]+@[^\\s@]+\\.[^\\s@]+$");
    private static final Pattern PHONE = Pattern.compile("^\\+?[\\d\\s\\-()]+$");

    private OperatorChecks() {}

    // comparison

    static boolean equalTo(Object subject, List<Object> operands, CheckContext ctx) {
        return LooseValues.looseEquals(subject, first(operands));
    }

    static boolean notEqualTo(Object subject, List<Object> operands, CheckContext ctx) {
        return !LooseValues.looseEquals(subject, first(operands));
    }

    static boolean greaterThan(Object subject, List<Object> operands, CheckContext ctx) {
        return LooseValues.toNumber(subject) > LooseValues.toNumber(first(operands));
    }

    static boolean greaterOrEqual(Object subject, List<Object> operands, CheckContext ctx) {
        return LooseValues.toNumber(subject) >= LooseValues.toNumber(first(operands));
    }

    static boolean lessThan(Object subject, List<Object> operands, CheckContext ctx) {
        return LooseValues.toNumber(subject) < LooseValues.toNumber(first(operands));
    }

    static boolean lessOrEqual(Object subject, List<Object> operands, CheckContext ctx) {
        return LooseValues.toNumber(subject) <= LooseValues.toNumber(first(operands));
    }

    // string

    static boolean contains(Object subject, List<Object> operands, CheckContext ctx) {
        return text(subject).contains(text(first(operands)));
    }

    static boolean notContains(Object subject, List<Object> operands, CheckContext ctx) {
        return !contains(subject, operands, ctx);
    }

    static boolean startsWith(Object subject, List<Object> operands, CheckContext ctx) {
        return text(subject).startsWith(text(first(operands)));
    }

    static boolean endsWith(Object subject, List<Object> operands, CheckContext ctx) {
        return text(subject).endsWith(text(first(operands)));
    }

    /** Unanchored search; an invalid pattern throws and fails the rule. */
    static boolean matches(Object subject, List<Object> operands, CheckContext ctx) {
        return Pattern.compile(text(first(operands))).matcher(text(subject)).find();
    }

    static boolean lengthEquals(Object subject, List<Object> operands, CheckContext ctx) {
        return text(subject).length() == LooseValues.toNumber(first(operands));
    }

    static boolean lengthGreaterThan(Object subject, List<Object> operands, CheckContext ctx) {
        return text(subject).length() > LooseValues.toNumber(first(operands));
    }

    static boolean lengthLessThan(Object subject, List<Object> operands, CheckContext ctx) {
        return text(subject).length() < LooseValues.toNumber(first(operands));
    }

    static boolean minLength(Object subject, List<Object> operands, CheckContext ctx) {
        return text(subject).length() >= LooseValues.toNumber(first(operands));
    }

    static boolean maxLength(Object subject, List<Object> operands, CheckContext ctx) {
        return text(subject).length() <= LooseValues.toNumber(first(operands));
    }

    // array

    static boolean in(Object subject, List<Object> operands, CheckContext ctx) {
        return operands.stream().anyMatch(operand -> LooseValues.strictEquals(operand, subject));
    }

    static boolean notIn(Object subject, List<Object> operands, CheckContext ctx) {
        return !in(subject, operands, ctx);
    }

    static boolean containsAny(Object subject, List<Object> operands, CheckContext ctx) {
        if (!(subject instanceof Collection<?> values)) {
            return false;
        }
        return values.stream().anyMatch(value -> includes(operands, value));
    }

    static boolean containsAll(Object subject, List<Object> operands, CheckContext ctx) {
        if (!(subject instanceof Collection<?> values)) {
            return false;
        }
        return operands.stream().allMatch(operand -> includes(values, operand));
    }

    static boolean containsNone(Object subject, List<Object> operands, CheckContext ctx) {
        if (!(subject instanceof Collection<?> values)) {
            return false;
        }
        return values.stream().noneMatch(value -> includes(operands, value));
    }

    // logical

    static boolean isEmpty(Object subject, List<Object> operands, CheckContext ctx) {
        return LooseValues.isEmpty(subject);
    }

    static boolean isNotEmpty(Object subject, List<Object> operands, CheckContext ctx) {
        return !LooseValues.isEmpty(subject);
    }

    static boolean between(Object subject, List<Object> operands, CheckContext ctx) {
        var number = LooseValues.toNumber(subject);
        return number >= LooseValues.toNumber(lower(operands)) && number <= LooseValues.toNumber(upper(operands));
    }

    static boolean notBetween(Object subject, List<Object> operands, CheckContext ctx) {
        var number = LooseValues.toNumber(subject);
        return number < LooseValues.toNumber(lower(operands)) || number > LooseValues.toNumber(upper(operands));
    }

    // format

    static boolean isEmail(Object subject, List<Object> operands, CheckContext ctx) {
        return EMAIL.matcher(LooseValues.stringify(subject)).matches();
    }

    static boolean isUrl(Object subject, List<Object> operands, CheckContext ctx) {
        try {
            var uri = new URI(LooseValues.stringify(subject));
            return uri.isAbsolute() && (uri.isOpaque() || uri.getHost() != null || uri.getPath() != null);
        } catch (URISyntaxException ex) {
            return false;
        }
    }

    static boolean isNumber(Object subject, List<Object> operands, CheckContext ctx) {
        return LooseValues.isNumeric(subject);
    }

    static boolean isInteger(Object subject, List<Object> operands, CheckContext ctx) {
        var number = LooseValues.toNumber(subject);
        return LooseValues.isNumeric(subject) && number == Math.rint(number);
    }

    static boolean isDate(Object subject, List<Object> operands, CheckContext ctx) {
        return date(subject, ctx).isPresent();
    }

    static boolean isPhone(Object subject, List<Object> operands, CheckContext ctx) {
        return PHONE.matcher(LooseValues.stringify(subject)).matches();
    }

    // date

    static boolean dateEquals(Object subject, List<Object> operands, CheckContext ctx) {
        var left = date(subject, ctx);
        var right = date(first(operands), ctx);
        return left.isPresent() && right.isPresent() && sameDay(left.get(), right.get(), ctx);
    }

    static boolean dateNotEquals(Object subject, List<Object> operands, CheckContext ctx) {
        var left = date(subject, ctx);
        var right = date(first(operands), ctx);
        return left.isPresent() && right.isPresent() && !sameDay(left.get(), right.get(), ctx);
    }

    static boolean dateGreaterThan(Object subject, List<Object> operands, CheckContext ctx) {
        return compareDates(subject, first(operands), ctx).map(c -> c > 0).orElse(false);
    }

    static boolean dateGreaterOrEqual(Object subject, List<Object> operands, CheckContext ctx) {
        return compareDates(subject, first(operands), ctx).map(c -> c >= 0).orElse(false);
    }

    static boolean dateLessThan(Object subject, List<Object> operands, CheckContext ctx) {
        return compareDates(subject, first(operands), ctx).map(c -> c < 0).orElse(false);
    }

    static boolean dateLessOrEqual(Object subject, List<Object> operands, CheckContext ctx) {
        return compareDates(subject, first(operands), ctx).map(c -> c <= 0).orElse(false);
    }

    static boolean dateBetween(Object subject, List<Object> operands, CheckContext ctx) {
        var low = compareDates(subject, lower(operands), ctx);
        var high = compareDates(subject, upper(operands), ctx);
        return low.isPresent() && high.isPresent() && low.get() >= 0 && high.get() <= 0;
    }

    static boolean dateNotBetween(Object subject, List<Object> operands, CheckContext ctx) {
        var low = compareDates(subject, lower(operands), ctx);
        var high = compareDates(subject, upper(operands), ctx);
        return low.isPresent() && high.isPresent() && (low.get() < 0 || high.get() > 0);
    }

    static boolean isToday(Object subject, List<Object> operands, CheckContext ctx) {
        return date(subject, ctx).map(d -> sameDay(d, ctx.now(), ctx)).orElse(false);
    }

    static boolean isPastDate(Object subject, List<Object> operands, CheckContext ctx) {
        return date(subject, ctx).map(d -> d.isBefore(ctx.now())).orElse(false);
    }

    static boolean isFutureDate(Object subject, List<Object> operands, CheckContext ctx) {
        return date(subject, ctx).map(d -> d.isAfter(ctx.now())).orElse(false);
    }

    static boolean isWeekday(Object subject, List<Object> operands, CheckContext ctx) {
        return date(subject, ctx).map(d -> !isWeekendDay(zoned(d, ctx).getDayOfWeek())).orElse(false);
    }

    static boolean isWeekend(Object subject, List<Object> operands, CheckContext ctx) {
        return date(subject, ctx).map(d -> isWeekendDay(zoned(d, ctx).getDayOfWeek())).orElse(false);
    }

    /** 0 is Sunday, 6 is Saturday. */
    static boolean dayOfWeekEquals(Object subject, List<Object> operands, CheckContext ctx) {
        var expected = LooseValues.toNumber(first(operands));
        return date(subject, ctx).map(d -> zoned(d, ctx).getDayOfWeek().getValue() % 7 == expected).orElse(false);
    }

    /** 1 is January. */
    static boolean monthEquals(Object subject, List<Object> operands, CheckContext ctx) {
        var expected = LooseValues.toNumber(first(operands));
        return date(subject, ctx).map(d -> zoned(d, ctx).getMonthValue() == expected).orElse(false);
    }

    static boolean yearEquals(Object subject, List<Object> operands, CheckContext ctx) {
        var expected = LooseValues.toNumber(first(operands));
        return date(subject, ctx).map(d -> zoned(d, ctx).getYear() == expected).orElse(false);
    }

    static boolean ageGreaterThan(Object subject, List<Object> operands, CheckContext ctx) {
        var limit = LooseValues.toNumber(first(operands));
        return ageOf(subject, ctx).map(age -> age > limit).orElse(false);
    }

    static boolean ageLessThan(Object subject, List<Object> operands, CheckContext ctx) {
        var limit = LooseValues.toNumber(first(operands));
        return ageOf(subject, ctx).map(age -> age < limit).orElse(false);
    }

    static boolean ageBetween(Object subject, List<Object> operands, CheckContext ctx) {
        var min = LooseValues.toNumber(lower(operands));
        var max = LooseValues.toNumber(upper(operands));
        return ageOf(subject, ctx).map(age -> age >= min && age <= max).orElse(false);
    }

    /**
     * Whole years between {@code birth} and now, using 365.25-day years. Not calendar-exact:
     * a respondent can be a day or so short of a birthday and still count as older.
     */
    static Optional<Long> ageOf(Object birth, CheckContext ctx) {
        return date(birth, ctx).map(d -> (long) Math.floor((ctx.now().toEpochMilli() - d.toEpochMilli()) / MILLIS_PER_YEAR));
    }

    private static Optional<Integer> compareDates(Object left, Object right, CheckContext ctx) {
        var a = date(left, ctx);
        var b = date(right, ctx);
        if (a.isEmpty() || b.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(a.get().compareTo(b.get()));
    }

    private static Optional<Instant> date(Object value, CheckContext ctx) {
        return DateValues.toInstant(value, ctx.zone());
    }

    private static ZonedDateTime zoned(Instant instant, CheckContext ctx) {
        return instant.atZone(ctx.zone());
    }

    private static boolean sameDay(Instant a, Instant b, CheckContext ctx) {
        return zoned(a, ctx).toLocalDate().equals(zoned(b, ctx).toLocalDate());
    }

    private static boolean isWeekendDay(DayOfWeek day) {
        return day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY;
    }

    private static Object first(List<Object> operands) {
        return operands.isEmpty() ? null : operands.get(0);
    }

    private static Object lower(List<Object> operands) {
        return first(operands);
    }

    /** A single operand serves as both bounds. */
    private static Object upper(List<Object> operands) {
        return operands.size() > 1 ? operands.get(1) : first(operands);
    }

    private static boolean includes(Collection<?> values, Object candidate) {
        return values.stream().anyMatch(value -> LooseValues.strictEquals(value, candidate));
    }

    /** Missing answers read as the empty string in text checks. */
    private static String text(Object value) {
        return value == null ? "" : LooseValues.stringify(value);
    }
}
