package work.lcod.survey.graph;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.lcod.survey.support.SurveyTestSupport.block;
import static work.lcod.survey.support.SurveyTestSupport.twoPageSurvey;

import java.util.List;
import org.junit.jupiter.api.Test;
import work.lcod.survey.model.NavigationRule;
import work.lcod.survey.model.NodePatch;
import work.lcod.survey.model.NodeSpec;
import work.lcod.survey.tree.DocumentTree;

class FlowGraphBuilderTest {
    private final FlowGraphBuilder builder = new FlowGraphBuilder();

    @Test
    void createsOneNodePerDocumentNodePlusTerminals() {
        var graph = builder.build(twoPageSurvey());
        assertEquals(8, graph.nodes().size());
        assertEquals(1, graph.count(FlowNode.Kind.START));
        assertEquals(1, graph.count(FlowNode.Kind.SUBMIT));
        assertEquals(2, graph.count(FlowNode.Kind.PAGE));
        assertEquals(3, graph.count(FlowNode.Kind.BLOCK));
        assertEquals("p1", graph.node("b1").orElseThrow().containerId());
    }

    @Test
    void ruleLessBlocksGetSequentialEdges() {
        var graph = builder.build(twoPageSurvey());
        var sequential = edge(graph, "seq-b1-b2");
        assertEquals("b1", sequential.source());
        assertEquals("b2", sequential.target());
        assertFalse(sequential.conditional());
        assertEquals(FlowEdge.Kind.SEQUENTIAL, sequential.kind());
        assertEquals("p2", edge(graph, "seq-b2-p2").target());
        assertEquals(FlowNode.SUBMIT_ID, edge(graph, "seq-b3-submit-node").target());
    }

    @Test
    void startAndEntryEdgesFollowTheTree() {
        var graph = builder.build(twoPageSurvey());
        var start = edge(graph, "edge-start");
        assertEquals(FlowNode.START_ID, start.source());
        assertEquals("root", start.target());
        assertEquals(FlowGraphBuilder.BEGIN_LABEL, start.label());
        assertEquals("p1", edge(graph, "entry-root").target());
        assertEquals("b3", edge(graph, "entry-p2").target());
    }

    @Test
    void navigationRulesBecomeEdges() {
        var graph = builder.build(withRules(List.of(
            NavigationRule.of("age >= \"18\"", "p2"),
            NavigationRule.of("true", "ghost"),
            NavigationRule.defaultTo(NavigationRule.SUBMIT)
        )));
        var conditional = edge(graph, "nav-b1-0");
        assertTrue(conditional.conditional());
        assertEquals("age >= \"18\"", conditional.label());
        assertTrue(graph.edges().stream().noneMatch(edge -> edge.id().equals("nav-b1-1")));
        var fallback = edge(graph, "nav-b1-2");
        assertEquals(FlowNode.SUBMIT_ID, fallback.target());
        assertEquals(FlowGraphBuilder.DEFAULT_LABEL, fallback.label());
        assertFalse(fallback.conditional());
        assertTrue(graph.edges().stream().noneMatch(edge -> edge.id().equals("seq-b1-b2")));
        assertTrue(graph.node("b1").orElseThrow().conditional());
    }

    @Test
    void levelsRunTopToBottomFromTheStartNode() {
        var graph = builder.build(twoPageSurvey());
        var start = graph.node(FlowNode.START_ID).orElseThrow();
        assertEquals(400, start.x());
        assertEquals(100, start.y());
        assertEquals(500, graph.node("root").orElseThrow().y());
        assertTrue(graph.node("p1").orElseThrow().y() < graph.node("p2").orElseThrow().y());
        assertTrue(graph.node("p2").orElseThrow().y() < graph.node(FlowNode.SUBMIT_ID).orElseThrow().y());
    }

    @Test
    void containersDoNotOverlapAndBlocksAreStacked() {
        var graph = builder.build(withRules(List.of(NavigationRule.of("age > \"1\"", "b3"))));
        var containers = graph.nodes().stream().filter(node -> !node.isBlock()).toList();
        var padding = builder.settings().padding();
        for (int i = 0; i < containers.size(); i++) {
            for (int j = i + 1; j < containers.size(); j++) {
                assertFalse(containers.get(i).bounds().overlaps(containers.get(j).bounds(), padding),
                    containers.get(i).id() + " overlaps " + containers.get(j).id());
            }
        }
        var page = graph.node("p1").orElseThrow();
        var second = graph.node("b2").orElseThrow();
        assertEquals(page.x() + 20, second.x());
        assertEquals(page.y() + 60 + 100, second.y());
        assertEquals(280, page.height());
    }

    @Test
    void relayoutWithoutPreviousGraphIsFull() {
        assertEquals(LayoutMode.FULL, builder.relayout(null, twoPageSurvey()).mode());
    }

    @Test
    void relayoutOfAnUnchangedTreeKeepsEveryPosition() {
        var tree = twoPageSurvey();
        var first = builder.build(tree);
        var second = builder.relayout(first, tree);
        assertEquals(LayoutMode.INCREMENTAL, second.mode());
        assertEquals(first.nodes(), second.nodes());
        assertTrue(second.restackedContainers().isEmpty());
    }

    @Test
    void relayoutRestacksOnlyTheChangedContainer() {
        var tree = twoPageSurvey();
        var first = builder.build(tree);
        var grown = tree.addChild("p2", block("b4", "textarea", "comment"));
        var second = builder.relayout(first, grown);
        assertEquals(LayoutMode.INCREMENTAL, second.mode());
        assertEquals(List.of("p2"), second.restackedContainers());
        assertEquals(first.node("b1"), second.node("b1"));
        var page = second.node("p2").orElseThrow();
        assertEquals(page.y() + 60 + 100, second.node("b4").orElseThrow().y());
    }

    @Test
    void relayoutPlacesNewSectionsWithoutMovingOthers() {
        var tree = twoPageSurvey();
        var first = builder.build(tree);
        var second = builder.relayout(first, tree.addChild("root", NodeSpec.section("Annex").withId("annex")));
        assertEquals(LayoutMode.INCREMENTAL, second.mode());
        assertEquals(first.node("p1").orElseThrow().x(), second.node("p1").orElseThrow().x());
        var annex = second.node("annex").orElseThrow();
        for (var node : second.nodes()) {
            if (!node.isBlock() && !node.id().equals("annex")) {
                assertFalse(annex.bounds().overlaps(node.bounds(), builder.settings().padding()), node.id());
            }
        }
    }

    @Test
    void relayoutFallsBackToFullWhenPagesChange() {
        var tree = twoPageSurvey();
        var first = builder.build(tree);
        var more = tree.addChild("root", NodeSpec.page("Page 3").withId("p3").withItem(block("b5", "textfield", "x")));
        assertEquals(LayoutMode.FULL, builder.relayout(first, more).mode());
    }

    private static DocumentTree withRules(List<NavigationRule> rules) {
        return twoPageSurvey().updateById("b1", NodePatch.builder().navigationRules(rules).build());
    }

    private static FlowEdge edge(FlowGraph graph, String id) {
        return graph.edges().stream().filter(edge -> edge.id().equals(id)).findFirst()
            .orElseThrow(() -> new AssertionError("missing edge " + id));
    }
}
