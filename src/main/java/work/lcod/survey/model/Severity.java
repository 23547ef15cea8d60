package work.lcod.survey.model;

import java.util.Locale;

public enum Severity {
    ERROR,
    WARNING;

    public static Severity from(String value) {
        if (value == null || value.isBlank()) {
            return ERROR;
        }
        try {
            return Severity.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported severity: " + value);
        }
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
