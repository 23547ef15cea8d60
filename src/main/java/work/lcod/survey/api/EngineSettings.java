package work.lcod.survey.api;

import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Objects;
import work.lcod.survey.graph.LayoutSettings;
import work.lcod.survey.navigation.DanglingTargetPolicy;

/**
 * Immutable configuration of a {@link SurveyEngine}.
 *
 * @param zone zone used for "today", calendar fields and local date-times in validation
 */
public record EngineSettings(
    LayoutSettings layout,
    DanglingTargetPolicy danglingPolicy,
    ZoneId zone,
    LogLevel logLevel
) {
    public EngineSettings {
        Objects.requireNonNull(layout, "layout");
        Objects.requireNonNull(danglingPolicy, "danglingPolicy");
        Objects.requireNonNull(zone, "zone");
        Objects.requireNonNull(logLevel, "logLevel");
    }

    public static EngineSettings defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .layout(layout)
            .danglingPolicy(danglingPolicy)
            .zone(zone)
            .logLevel(logLevel);
    }

    public static final class Builder {
        private LayoutSettings layout = LayoutSettings.defaults();
        private DanglingTargetPolicy danglingPolicy = DanglingTargetPolicy.SKIP;
        private ZoneId zone = ZoneOffset.UTC;
        private LogLevel logLevel = LogLevel.WARN;

        public Builder layout(LayoutSettings layout) {
            this.layout = layout;
            return this;
        }

        public Builder danglingPolicy(DanglingTargetPolicy danglingPolicy) {
            this.danglingPolicy = danglingPolicy;
            return this;
        }

        public Builder zone(ZoneId zone) {
            this.zone = zone;
            return this;
        }

        public Builder logLevel(LogLevel logLevel) {
            this.logLevel = logLevel;
            return this;
        }

        public EngineSettings build() {
            return new EngineSettings(layout, danglingPolicy, zone, logLevel);
        }
    }
}
