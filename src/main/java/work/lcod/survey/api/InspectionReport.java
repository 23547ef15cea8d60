package work.lcod.survey.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Outcome of {@link SurveyEngine#inspect}, printable by the CLI.
 */
public record InspectionReport(Status status, Map<String, Object> metadata, Instant startedAt, Instant finishedAt) {
    private static final ObjectWriter WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();

    public InspectionReport {
        metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static InspectionReport clean(Map<String, Object> metadata, Instant startedAt, Instant finishedAt) {
        return new InspectionReport(Status.CLEAN, metadata, startedAt, finishedAt);
    }

    public static InspectionReport issues(Map<String, Object> metadata, Instant startedAt, Instant finishedAt) {
        return new InspectionReport(Status.ISSUES, metadata, startedAt, finishedAt);
    }

    public static InspectionReport failure(String message, Map<String, Object> metadata, Instant startedAt, Instant finishedAt) {
        Map<String, Object> meta = new LinkedHashMap<>(metadata);
        meta.putIfAbsent("error", message);
        return new InspectionReport(Status.FAILURE, meta, startedAt, finishedAt);
    }

    public Map<String, Object> toSerializableMap() {
        Map<String, Object> serializable = new LinkedHashMap<>();
        serializable.put("status", status.name().toLowerCase(Locale.ROOT));
        serializable.put("metadata", metadata);
        serializable.put("startedAt", startedAt.toString());
        serializable.put("finishedAt", finishedAt.toString());
        return serializable;
    }

    public String toPrettyJson() {
        try {
            return WRITER.writeValueAsString(toSerializableMap());
        } catch (Exception ex) {
            return "{\"status\":\"error\",\"message\":\"" + ex.getMessage() + "\"}";
        }
    }

    public enum Status {
        CLEAN(0),
        ISSUES(1),
        FAILURE(2);

        private final int exitCode;

        Status(int exitCode) {
            this.exitCode = exitCode;
        }

        public int exitCode() {
            return exitCode;
        }
    }
}
