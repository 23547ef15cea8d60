package work.lcod.survey.shared;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.Map;
import java.util.regex.PatternSyntaxException;
import org.junit.jupiter.api.Test;

class SurveyErrorsTest {
    @Test
    void keepsCodeAndDataOfSurveyExceptions() {
        var error = SurveyErrors.normalize(new SurveyException("invalid_document", "bad", Map.of("path", "rootNode")));
        assertEquals("invalid_document", error.get("code"));
        assertEquals("bad", error.get("message"));
        assertEquals(Map.of("path", "rootNode"), error.get("data"));
    }

    @Test
    void classifiesKnownRuntimeFailures() {
        assertEquals("invalid_pattern", SurveyErrors.normalize(new PatternSyntaxException("Unclosed group", "(", 1)).get("code"));
        assertEquals("invalid_number", SurveyErrors.normalize(new NumberFormatException("x")).get("code"));
        assertEquals("unexpected_error", SurveyErrors.normalize(new IllegalStateException()).get("code"));
        assertEquals("Unexpected error", SurveyErrors.normalize(new IllegalStateException()).get("message"));
    }
}
