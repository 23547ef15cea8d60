package work.lcod.survey.navigation;

import java.util.Locale;

/**
 * What tree-aware resolution does with a rule whose target no longer exists.
 */
public enum DanglingTargetPolicy {
    /** Treat the rule as a non-match and keep scanning. */
    SKIP,
    /** Return the stale id and let the caller deal with it. */
    RETURN;

    public static DanglingTargetPolicy from(String value) {
        if (value == null || value.isBlank()) {
            return SKIP;
        }
        try {
            return DanglingTargetPolicy.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported dangling target policy: " + value);
        }
    }
}
