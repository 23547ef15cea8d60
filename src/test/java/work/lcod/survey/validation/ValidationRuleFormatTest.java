package work.lcod.survey.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.List;
import org.junit.jupiter.api.Test;
import work.lcod.survey.model.RuleValue;
import work.lcod.survey.model.ValidationRule;

class ValidationRuleFormatTest {
    @Test
    void parsesSingleValues() {
        var rule = ValidationRuleFormat.parse("minLength|3|Too short");
        assertEquals("minLength", rule.operator());
        assertEquals(RuleValue.single("3"), rule.value());
        assertEquals("Too short", rule.message());
    }

    @Test
    void splitsListValuesForListOperators() {
        var rule = ValidationRuleFormat.parse("between|10, 20|out of range");
        assertEquals(RuleValue.array(List.of("10", "20")), rule.value());
    }

    @Test
    void keepsPipesInsideTheMessage() {
        assertEquals("a | b", ValidationRuleFormat.parse("==|x|a | b").message());
    }

    @Test
    void malformedInputFallsBackToNeutralRule() {
        var rule = ValidationRuleFormat.parse("garbage");
        assertEquals("==", rule.operator());
        assertEquals(RuleValue.single(""), rule.value());
        assertEquals(ValidationRule.DEFAULT_MESSAGE, rule.message());
    }

    @Test
    void formatsBackToTheCompactForm() {
        assertEquals("between|10,20|out of range", ValidationRuleFormat.format(ValidationRuleFormat.parse("between|10,20|out of range")));
        assertEquals("isEmail||Invalid", ValidationRuleFormat.format(ValidationRuleFormat.parse("isEmail||Invalid")));
    }
}
