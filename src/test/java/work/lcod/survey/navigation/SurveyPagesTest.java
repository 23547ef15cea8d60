package work.lcod.survey.navigation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.lcod.survey.support.SurveyTestSupport.block;
import static work.lcod.survey.support.SurveyTestSupport.tree;
import static work.lcod.survey.support.SurveyTestSupport.twoPageSurvey;

import java.util.List;
import org.junit.jupiter.api.Test;
import work.lcod.survey.model.NodeSpec;

class SurveyPagesTest {
    @Test
    void pagesUnderTheRootAreSteps() {
        var pages = SurveyPages.of(twoPageSurvey());
        assertEquals(SurveyMode.PAGED, pages.mode());
        assertEquals(List.of("p1", "p2"), pages.pageIds());
        assertEquals(new SurveyPages.BlockPosition(1, 0), pages.positionOf("b3").orElseThrow());
        assertTrue(pages.positionOf("p1").isEmpty());
    }

    @Test
    void blocksDirectlyUnderTheRootArePageless() {
        var tree = tree(NodeSpec.section("root").withId("root")
            .withItem(block("q1", "textfield", "q1"))
            .withItem(block("q2", "textfield", "q2")));
        var pages = SurveyPages.of(tree);
        assertEquals(SurveyMode.PAGELESS, pages.mode());
        assertEquals(List.of("q1", "q2"), pages.pageIds());
    }

    @Test
    void pagelessModeFlattensPages() {
        var pages = SurveyPages.of(twoPageSurvey(), SurveyMode.PAGELESS);
        assertEquals(List.of("b1", "b2", "b3"), pages.pageIds());
    }

    @Test
    void nestedSectionsContributeTheirPagesOnce() {
        var tree = tree(NodeSpec.section("root").withId("root")
            .withItem(NodeSpec.page("One").withId("p1").withItem(block("b1", "textfield", "a")))
            .withNode(NodeSpec.section("Part 2").withId("s2")
                .withItem(NodeSpec.page("Two").withId("p2").withItem(block("b2", "textfield", "b"))))
            .withNode(NodeSpec.section("Loose").withId("s3")
                .withItem(block("b3", "textfield", "c"))));
        assertEquals(List.of("p1", "p2", "s3"), SurveyPages.of(tree).pageIds());
    }

    @Test
    void emptyPagesAreSkipped() {
        var tree = tree(NodeSpec.section("root").withId("root")
            .withItem(NodeSpec.page("Empty").withId("p0"))
            .withItem(NodeSpec.page("One").withId("p1").withItem(block("b1", "textfield", "a"))));
        assertEquals(List.of("p1"), SurveyPages.of(tree).pageIds());
    }

    @Test
    void emptySurveyHasOneEmptyPage() {
        var tree = tree(NodeSpec.section("root").withId("root"));
        var pages = SurveyPages.of(tree);
        assertEquals(1, pages.size());
        assertEquals("root", pages.page(0).id());
        assertTrue(pages.page(0).blocks().isEmpty());
    }
}
