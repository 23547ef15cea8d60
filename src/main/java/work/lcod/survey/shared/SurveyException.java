package work.lcod.survey.shared;

/**
 * Exception carrying an error code and optional structured data, raised at the document
 * boundary (reading, writing, loading settings).
 */
public final class SurveyException extends RuntimeException {
    private final String code;
    private final Object data;

    public SurveyException(String code, String message, Object data) {
        super(message);
        this.code = code;
        this.data = data;
    }

    public SurveyException(String code, String message, Object data, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.data = data;
    }

    public String code() {
        return code;
    }

    public Object data() {
        return data;
    }
}
