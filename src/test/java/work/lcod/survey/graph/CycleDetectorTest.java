package work.lcod.survey.graph;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.lcod.survey.support.SurveyTestSupport.block;
import static work.lcod.survey.support.SurveyTestSupport.ring;
import static work.lcod.survey.support.SurveyTestSupport.tree;
import static work.lcod.survey.support.SurveyTestSupport.twoPageSurvey;

import java.util.List;
import org.junit.jupiter.api.Test;
import work.lcod.survey.model.NavigationRule;
import work.lcod.survey.model.NodeSpec;

class CycleDetectorTest {
    private final CycleDetector detector = new CycleDetector();

    @Test
    void reportsARingOnce() {
        assertEquals(List.of("A → B → C → A"), detector.detectCycles(ring()));
    }

    @Test
    void reportsEveryDisjointRing() {
        var tree = tree(NodeSpec.section("root").withId("root")
            .withItem(block("A", "textfield", "a").withNavigationRules(List.of(NavigationRule.defaultTo("B"))))
            .withItem(block("B", "textfield", "b").withNavigationRules(List.of(NavigationRule.defaultTo("A"))))
            .withItem(block("C", "textfield", "c").withNavigationRules(List.of(NavigationRule.of("x == \"1\"", "D"))))
            .withItem(block("D", "textfield", "d").withNavigationRules(List.of(NavigationRule.defaultTo("C")))));
        assertEquals(List.of("A → B → A", "C → D → C"), detector.detectCycles(tree));
    }

    @Test
    void selfLoopsAreCycles() {
        var tree = tree(NodeSpec.section("root").withId("root")
            .withItem(block("A", "textfield", "a").withNavigationRules(List.of(NavigationRule.of("a == \"\"", "A")))));
        assertEquals(List.of(List.of("A", "A")), detector.findCycles(tree));
    }

    @Test
    void submitAndForwardJumpsAreNotCycles() {
        var tree = tree(NodeSpec.section("root").withId("root")
            .withItem(block("A", "textfield", "a").withNavigationRules(List.of(
                NavigationRule.of("a == \"x\"", "C"),
                NavigationRule.defaultTo(NavigationRule.SUBMIT))))
            .withItem(block("B", "textfield", "b"))
            .withItem(block("C", "textfield", "c").withNavigationRules(List.of(NavigationRule.defaultTo(NavigationRule.SUBMIT)))));
        assertTrue(detector.detectCycles(tree).isEmpty());
        assertTrue(detector.detectCycles(twoPageSurvey()).isEmpty());
    }
}
