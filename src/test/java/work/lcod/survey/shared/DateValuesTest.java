package work.lcod.survey.shared;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;

class DateValuesTest {
    private static final ZoneId PARIS = ZoneId.of("Europe/Paris");

    @Test
    void readsDateOnlyAsUtcMidnight() {
        assertEquals(Instant.parse("2024-03-01T00:00:00Z"), DateValues.toInstant("2024-03-01", PARIS).orElseThrow());
    }

    @Test
    void readsLocalDateTimeInTheGivenZone() {
        assertEquals(Instant.parse("2024-03-01T09:30:00Z"), DateValues.toInstant("2024-03-01T10:30", PARIS).orElseThrow());
    }

    @Test
    void readsOffsetsAndEpochMillis() {
        assertEquals(Instant.parse("2024-03-01T08:00:00Z"), DateValues.toInstant("2024-03-01T10:00:00+02:00", ZoneOffset.UTC).orElseThrow());
        assertEquals(Instant.ofEpochMilli(86_400_000L), DateValues.toInstant(86_400_000L, ZoneOffset.UTC).orElseThrow());
    }

    @Test
    void rejectsGarbage() {
        assertTrue(DateValues.toInstant("not a date", ZoneOffset.UTC).isEmpty());
        assertTrue(DateValues.toInstant(null, ZoneOffset.UTC).isEmpty());
    }

    @Test
    void rejectsInstantsOutsideTheDateRange() {
        assertTrue(DateValues.toInstant(1e20, ZoneOffset.UTC).isEmpty());
        assertTrue(DateValues.toInstant(-1e20, ZoneOffset.UTC).isEmpty());
        assertTrue(DateValues.toInstant(Instant.MAX, ZoneOffset.UTC).isEmpty());
        assertEquals(Instant.ofEpochMilli(8_640_000_000_000_000L), DateValues.toInstant(8.64e15, ZoneOffset.UTC).orElseThrow());
    }
}
