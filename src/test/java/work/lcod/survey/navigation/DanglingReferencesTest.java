package work.lcod.survey.navigation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.lcod.survey.support.SurveyTestSupport.twoPageSurvey;

import java.util.List;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;
import work.lcod.survey.model.NavigationRule;
import work.lcod.survey.model.NodePatch;

class DanglingReferencesTest {
    @Test
    void findsRulesTargetingRemovedNodes() {
        var tree = twoPageSurvey()
            .updateById("b1", NodePatch.builder().navigationRules(List.of(
                NavigationRule.of("age > \"3\"", "b3"),
                NavigationRule.defaultTo(NavigationRule.SUBMIT)
            )).build())
            .removeById("p2");
        assertEquals(List.of(new DanglingReference("b1", 0, "b3")), DanglingReferences.find(tree));
    }

    @Test
    void pruneDropsOnlyDanglingRules() {
        var tree = twoPageSurvey()
            .updateById("b1", NodePatch.builder().navigationRules(List.of(
                NavigationRule.of("age > \"3\"", "b3"),
                NavigationRule.defaultTo("b2")
            )).build())
            .removeById("b3");
        var pruned = DanglingReferences.prune(tree, LoggerFactory.getLogger(DanglingReferencesTest.class));
        assertEquals(List.of(NavigationRule.defaultTo("b2")), pruned.find("b1").orElseThrow().navigationRules());
        assertTrue(DanglingReferences.find(pruned).isEmpty());
        assertSame(pruned, DanglingReferences.prune(pruned, LoggerFactory.getLogger(DanglingReferencesTest.class)));
    }
}
