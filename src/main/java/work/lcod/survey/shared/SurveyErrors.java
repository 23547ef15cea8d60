package work.lcod.survey.shared;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.PatternSyntaxException;

/**
 * Normalizes failures into {@code {code, message, data}} maps for logs and reports.
 */
public final class SurveyErrors {
    private SurveyErrors() {}

    public static Map<String, Object> normalize(Throwable error) {
        if (error instanceof SurveyException se) {
            return toMap(se.code(), se.getMessage(), se.data());
        }
        if (error == null) {
            return toMap("unexpected_error", "Unexpected error", null);
        }
        var message = error.getMessage() != null && !error.getMessage().isBlank()
            ? error.getMessage()
            : "Unexpected error";
        if (error instanceof PatternSyntaxException) {
            return toMap("invalid_pattern", message, null);
        }
        if (error instanceof ArithmeticException || error instanceof NumberFormatException) {
            return toMap("invalid_number", message, null);
        }
        return toMap("unexpected_error", message, null);
    }

    private static Map<String, Object> toMap(String code, String message, Object data) {
        var map = new LinkedHashMap<String, Object>();
        map.put("code", code);
        map.put("message", message);
        if (data != null) {
            map.put("data", data);
        }
        return map;
    }
}
