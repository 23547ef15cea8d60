package work.lcod.survey.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.lcod.survey.support.SurveyTestSupport.resource;
import static work.lcod.survey.support.SurveyTestSupport.twoPageSurvey;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import work.lcod.survey.document.DocumentCodec;
import work.lcod.survey.navigation.DanglingTargetPolicy;
import work.lcod.survey.navigation.StepTarget;

class SurveyEngineTest {
    private final SurveyEngine engine = new SurveyEngine(
        EngineSettings.defaults(),
        Clock.fixed(Instant.parse("2026-10-17T12:00:00Z"), ZoneOffset.UTC)
    );
    private final DocumentCodec codec = new DocumentCodec();

    @Test
    void navigatesALoadedDocument() {
        var tree = codec.readJson(resource("documents/customer-survey.json")).tree();
        assertTrue(engine.nextStep(tree, "b1", Map.of("age", 16)).isSubmit());
        assertEquals(StepTarget.position(1, 0, "b3"), engine.nextStep(tree, "b1", Map.of("age", 30)));
        assertEquals("p2", engine.navigate(tree, "b1", Map.of("age", 30)).target());
        assertEquals(StepTarget.position(1, 0, "b3"), engine.nextPage(tree, 0, Map.of("age", 30)));
    }

    @Test
    void validatesFieldsByName() {
        var tree = codec.readJson(resource("documents/customer-survey.json")).tree();
        var values = Map.<String, Object>of("age", 12, "email", "jo@example.org", "email_confirm", "jo@example.com");
        assertEquals("Age must be between 18 and 99", engine.validateField(tree, "age", values).firstError().orElseThrow());
        var email = engine.validateField(tree, "email", values);
        assertTrue(email.valid());
        assertEquals("Emails differ", email.warnings().get(0).message());
        assertTrue(engine.validateField(tree, "unknown", values).valid());
    }

    @Test
    void buildsGraphsAndFindsCycles() {
        var document = codec.readJson(resource("documents/cyclic.json"));
        assertEquals(List.of("A → B → C → A"), engine.detectCycles(document.tree()));
        assertEquals(1, engine.danglingReferences(document.tree()).size());
        assertTrue(engine.pruneDanglingRules(document.tree()).find("C").orElseThrow()
            .navigationRules().stream().noneMatch(rule -> rule.target().equals("gone")));
        var graph = engine.buildGraph(twoPageSurvey());
        assertEquals(graph.nodes(), engine.relayout(graph, twoPageSurvey()).nodes());
    }

    @Test
    void inspectReportsIssues() {
        var report = engine.inspect(codec.readJson(resource("documents/cyclic.json")), null, false);
        assertEquals(InspectionReport.Status.ISSUES, report.status());
        assertEquals(1, report.status().exitCode());
        assertEquals(List.of("A → B → C → A"), report.metadata().get("cycles"));
        assertEquals("pageless", report.metadata().get("mode"));
        assertTrue(report.toPrettyJson().contains("\"status\" : \"issues\""));
    }

    @Test
    void inspectOfACleanDocumentWithValidAnswers() {
        var document = codec.readJson(resource("documents/customer-survey.json"));
        var values = Map.<String, Object>of("age", 30, "email", "jo@example.org", "email_confirm", "jo@example.org");
        var report = engine.inspect(document, values, true);
        assertEquals(InspectionReport.Status.CLEAN, report.status());
        assertEquals(List.of("p1", "p2", "s2"), report.metadata().get("pages"));
        assertTrue(report.metadata().containsKey("validation"));
        assertEquals(Instant.parse("2026-10-17T12:00:00Z"), report.startedAt());
    }

    @Test
    void settingsDriveTheDanglingPolicy() {
        var returning = new SurveyEngine(EngineSettings.builder().danglingPolicy(DanglingTargetPolicy.RETURN).build());
        var tree = codec.readJson(resource("documents/cyclic.json")).tree();
        assertEquals("gone", returning.navigate(tree, "C", Map.of("c", "done")).target());
        assertEquals("A", engine.navigate(tree, "C", Map.of("c", "again")).target());
        assertTrue(engine.nextStep(tree, "C", Map.of("c", "done")).isSubmit());
    }
}
