package work.lcod.survey.condition;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ConditionEvaluatorTest {
    private final ConditionEvaluator evaluator = new ConditionEvaluator();

    @Test
    void numericComparisonCoercesQuotedValues() {
        var condition = ConditionParser.parse("age >= \"18\"");
        assertTrue(evaluator.evaluate(condition, Map.of("age", 20)));
        assertFalse(evaluator.evaluate(condition, Map.of("age", 16)));
        assertTrue(evaluator.evaluate(condition, Map.of("age", "18")));
    }

    @Test
    void equalityIsLoose() {
        assertTrue(evaluator.evaluate("count == \"3\"", Map.of("count", 3)));
        assertTrue(evaluator.evaluate("consent == \"true\"", Map.of("consent", "true")));
        assertFalse(evaluator.evaluate("count != \"3\"", Map.of("count", 3)));
    }

    @Test
    void missingFieldOnlySatisfiesNotEquals() {
        var values = new HashMap<String, Object>();
        values.put("empty", null);
        assertFalse(evaluator.evaluate("missing == \"\"", values));
        assertFalse(evaluator.evaluate("missing > \"0\"", values));
        assertFalse(evaluator.evaluate("empty.contains(\"\")", values));
        assertTrue(evaluator.evaluate("missing != \"x\"", values));
    }

    @Test
    void stringMethodsWorkOnStringifiedValues() {
        assertTrue(evaluator.evaluate("tags.contains(\"b\")", Map.of("tags", List.of("a", "b"))));
        assertTrue(evaluator.evaluate("email.endsWith(\"@example.org\")", Map.of("email", "jo@example.org")));
        assertFalse(evaluator.evaluate("name.startsWith(\"Jo\")", Map.of("name", "Anna")));
    }

    @Test
    void nonNumericOrderingIsFalse() {
        assertFalse(evaluator.evaluate("age > \"10\"", Map.of("age", "unknown")));
        assertFalse(evaluator.evaluate("age <= \"10\"", Map.of("age", "unknown")));
    }

    @Test
    void unquotedBooleansMatchBooleanAnswers() {
        assertTrue(evaluator.evaluate("agreed == true", Map.of("agreed", true)));
        assertTrue(evaluator.evaluate("agreed == false", Map.of("agreed", false)));
        assertFalse(evaluator.evaluate("agreed == true", Map.of("agreed", false)));
        assertTrue(evaluator.evaluate("agreed != true", Map.of("agreed", false)));
        assertFalse(evaluator.evaluate("agreed == \"true\"", Map.of("agreed", true)));
    }

    @Test
    void unquotedNumbersCompareAsNumbers() {
        assertTrue(evaluator.evaluate("count == 3", Map.of("count", "3.0")));
        assertTrue(evaluator.evaluate("age >= 18", Map.of("age", 18)));
        assertTrue(evaluator.evaluate("code == ABC", Map.of("code", "ABC")));
    }

    @Test
    void oversizedHexValuesDoNotBreakEvaluation() {
        assertTrue(evaluator.evaluate("age > 5", Map.of("age", "0x10000000000000000")));
        assertFalse(evaluator.evaluate("age > 0xFFFFFFFFFFFFFFFFFF", Map.of("age", 5)));
    }

    @Test
    void junctionsCombineOperands() {
        var values = Map.<String, Object>of("a", "1", "b", "0", "c", "3");
        assertTrue(evaluator.evaluate("a == \"1\" || b == \"2\" && c == \"9\"", values));
        assertFalse(evaluator.evaluate("(a == \"1\" || b == \"2\") && c == \"9\"", values));
    }

    @Test
    void unparsableConditionsNeverHold() {
        assertFalse(evaluator.evaluate("age is roughly 3", Map.of("age", 3)));
    }

    @Test
    void dottedFieldsReadNestedAnswers() {
        assertTrue(evaluator.evaluate("address.city == \"Lyon\"", Map.of("address", Map.of("city", "Lyon"))));
        assertTrue(evaluator.evaluate("address.city == \"Paris\"", Map.of("address.city", "Paris")));
    }
}
