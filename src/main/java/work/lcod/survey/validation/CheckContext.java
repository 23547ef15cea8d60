package work.lcod.survey.validation;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Objects;

/**
 * Environment of a single check: the clock "now" and calendar fields are read from.
 */
record CheckContext(Clock clock) {
    CheckContext {
        Objects.requireNonNull(clock, "clock");
    }

    Instant now() {
        return clock.instant();
    }

    ZoneId zone() {
        return clock.getZone();
    }
}
