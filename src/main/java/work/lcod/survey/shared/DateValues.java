package work.lcod.survey.shared;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.util.Date;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Turns answer values into instants. Date-only strings are read as UTC midnight, date-times
 * without an offset as local time in the supplied zone, numbers as epoch milliseconds. Instants
 * more than 8.64e15 ms away from the epoch are not dates.
 */
public final class DateValues {
    private static final Pattern DATE_ONLY = Pattern.compile("\\d{4}-\\d{2}-\\d{2}");
    private static final Pattern LOCAL_DATE_TIME = Pattern.compile("\\d{4}-\\d{2}-\\d{2}T\\d{2}:\\d{2}(:\\d{2}(\\.\\d{1,9})?)?");

    private static final long MAX_EPOCH_MILLIS = 8_640_000_000_000_000L;
    private static final Instant EARLIEST = Instant.ofEpochMilli(-MAX_EPOCH_MILLIS);
    private static final Instant LATEST = Instant.ofEpochMilli(MAX_EPOCH_MILLIS);

    private DateValues() {}

    public static Optional<Instant> toInstant(Object value, ZoneId zone) {
        return convert(value, zone).filter(instant -> !instant.isBefore(EARLIEST) && !instant.isAfter(LATEST));
    }

    private static Optional<Instant> convert(Object value, ZoneId zone) {
        if (value == null) {
            return Optional.empty();
        }
        if (value instanceof Instant instant) {
            return Optional.of(instant);
        }
        if (value instanceof ZonedDateTime zoned) {
            return Optional.of(zoned.toInstant());
        }
        if (value instanceof OffsetDateTime offset) {
            return Optional.of(offset.toInstant());
        }
        if (value instanceof LocalDate date) {
            return Optional.of(date.atStartOfDay(ZoneOffset.UTC).toInstant());
        }
        if (value instanceof LocalDateTime dateTime) {
            return Optional.of(dateTime.atZone(zone).toInstant());
        }
        if (value instanceof Date date) {
            return Optional.of(date.toInstant());
        }
        if (value instanceof Number number) {
            var millis = number.doubleValue();
            if (Double.isNaN(millis) || Math.abs(millis) > MAX_EPOCH_MILLIS) {
                return Optional.empty();
            }
            return Optional.of(Instant.ofEpochMilli((long) millis));
        }
        if (value instanceof CharSequence chars) {
            return parse(chars.toString().trim(), zone);
        }
        return Optional.empty();
    }

    private static Optional<Instant> parse(String raw, ZoneId zone) {
        if (raw.isEmpty()) {
            return Optional.empty();
        }
        try {
            if (DATE_ONLY.matcher(raw).matches()) {
                return Optional.of(LocalDate.parse(raw).atStartOfDay(ZoneOffset.UTC).toInstant());
            }
            if (LOCAL_DATE_TIME.matcher(raw).matches()) {
                return Optional.of(LocalDateTime.parse(raw).atZone(zone).toInstant());
            }
            return Optional.of(OffsetDateTime.parse(raw).toInstant());
        } catch (DateTimeParseException ex) {
            try {
                return Optional.of(ZonedDateTime.parse(raw).toInstant());
            } catch (DateTimeParseException ignored) {
                return Optional.empty();
            }
        }
    }
}
