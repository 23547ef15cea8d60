package work.lcod.survey.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.lcod.survey.support.SurveyTestSupport.twoPageSurvey;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;
import work.lcod.survey.condition.ConditionEvaluator;
import work.lcod.survey.model.NodePatch;
import work.lcod.survey.model.RuleValue;
import work.lcod.survey.model.Severity;
import work.lcod.survey.model.ValidationRule;

class ValidationEngineTest {
    private final ValidationEngine engine = new ValidationEngine(
        new ConditionEvaluator(),
        Clock.fixed(Instant.parse("2026-10-17T12:00:00Z"), ZoneOffset.UTC),
        LoggerFactory.getLogger(ValidationEngineTest.class)
    );

    @Test
    void betweenAcceptsValuesInsideTheRange() {
        var rule = ValidationRule.of("between", RuleValue.array(List.of("10", "20")), "out of range");
        assertNull(engine.evaluate(rule, 15, Map.of()));
        assertNull(engine.evaluate(rule, "10", Map.of()));
        assertEquals("out of range", engine.evaluate(rule, 25, Map.of()));
    }

    @Test
    void comparisonRulesDescribeTheFailure() {
        var rule = ValidationRule.of(">", RuleValue.single(65), "Too old");
        assertEquals("Too old", engine.evaluate(rule, 70, Map.of()));
        assertNull(engine.evaluate(rule, 40, Map.of()));
    }

    @Test
    void variableOperandsReadOtherAnswers() {
        var rule = ValidationRule.of("!=", RuleValue.of(List.of(RuleValue.Operand.variable("password"))), "Passwords differ");
        assertNull(engine.evaluate(rule, "secret", Map.of("password", "secret")));
        assertEquals("Passwords differ", engine.evaluate(rule, "other", Map.of("password", "secret")));
    }

    @Test
    void fieldOverridesTheCurrentValue() {
        var rule = ValidationRule.of("isNotEmpty", RuleValue.none(), "Email required").withField("email");
        assertEquals("Email required", engine.evaluate(rule, "ignored", Map.of("email", "")));
        assertNull(engine.evaluate(rule, null, Map.of("email", "jo@example.org")));
    }

    @Test
    void guardedRulesOnlyApplyWhenTheConditionHolds() {
        var rule = ValidationRule.of("isNotEmpty", RuleValue.none(), "Tell us more").withCondition("other == \"yes\"");
        assertNull(engine.evaluate(rule, "", Map.of("other", "no")));
        assertEquals("Tell us more", engine.evaluate(rule, "", Map.of("other", "yes")));
    }

    @Test
    void unknownOperatorsAreIgnored() {
        assertNull(engine.evaluate(ValidationRule.of("isPrime", RuleValue.none(), "nope"), 4, Map.of()));
    }

    @Test
    void checkErrorsFailWithTheRuleMessage() {
        var rule = ValidationRule.of("matches", RuleValue.single("(unclosed"), "Bad format");
        assertEquals("Bad format", engine.evaluate(rule, "abc", Map.of()));
    }

    @Test
    void missingMessageUsesTheDefault() {
        var rule = ValidationRule.of("isEmail", RuleValue.none(), null);
        assertEquals(ValidationRule.DEFAULT_MESSAGE, engine.evaluate(rule, "nope", Map.of()));
    }

    @Test
    void validateFieldCollectsEveryFailureAndSeparatesWarnings() {
        var rules = List.of(
            ValidationRule.of("minLength", RuleValue.single(3), "Too short"),
            ValidationRule.of("startsWith", RuleValue.single("A"), "Should start with A").withSeverity(Severity.WARNING),
            ValidationRule.of("matches", RuleValue.single("^[a-z]+$"), "Lowercase only")
        );
        var result = engine.validateField("code", rules, "Zx", Map.of());
        assertEquals(3, result.failures().size());
        assertFalse(result.valid());
        assertEquals("Too short", result.firstError().orElseThrow());
        assertEquals(1, result.warnings().size());

        var warningOnly = engine.validateField("code", rules.subList(1, 2), "Zebra", Map.of());
        assertTrue(warningOnly.valid());
        assertTrue(warningOnly.firstError().isEmpty());
    }

    @Test
    void validateDocumentCoversBlocksWithRules() {
        var tree = twoPageSurvey()
            .updateById("b1", NodePatch.builder().validationRules(List.of(
                ValidationRule.of("<", RuleValue.single(18), "Adults only"))).build())
            .updateById("b3", NodePatch.builder().validationRules(List.of(
                ValidationRule.of("isEmail", RuleValue.none(), "Invalid email"))).build());
        var results = engine.validateDocument(tree, Map.of("age", 16, "email", "jo@example.org"));
        assertEquals(List.of("age", "email"), List.copyOf(results.keySet()));
        assertEquals("Adults only", results.get("age").firstError().orElseThrow());
        assertTrue(results.get("email").valid());
    }
}
