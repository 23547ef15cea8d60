package work.lcod.survey.support;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import org.slf4j.LoggerFactory;
import work.lcod.survey.model.NavigationRule;
import work.lcod.survey.model.NodeSpec;
import work.lcod.survey.tree.DocumentTree;

/**
 * Shared fixtures for the survey test suites.
 *
 * <p>{@link #twoPageSurvey()} is the reference document most suites use:</p>
 * <pre>
 * root (section)
 *   p1 (page): b1 age (number), b2 name (textfield)
 *   p2 (page): b3 email (email)
 * </pre>
 */
public final class SurveyTestSupport {
    private SurveyTestSupport() {}

    /** Deterministic ids: {@code gen-1}, {@code gen-2}, ... */
    public static Supplier<String> sequentialIds() {
        var counter = new AtomicInteger();
        return () -> "gen-" + counter.incrementAndGet();
    }

    public static DocumentTree tree(NodeSpec root) {
        return DocumentTree.of(root, sequentialIds(), LoggerFactory.getLogger(DocumentTree.class));
    }

    public static NodeSpec block(String id, String typeName, String fieldName) {
        return NodeSpec.block(typeName, fieldName).withId(id);
    }

    public static NodeSpec twoPageSpec() {
        return NodeSpec.section("Survey").withId("root")
            .withItem(NodeSpec.page("Page 1").withId("p1")
                .withItem(block("b1", "number", "age"))
                .withItem(block("b2", "textfield", "name")))
            .withItem(NodeSpec.page("Page 2").withId("p2")
                .withItem(block("b3", "email", "email")));
    }

    public static DocumentTree twoPageSurvey() {
        return tree(twoPageSpec());
    }

    /** Three pageless blocks wired A -> B -> C -> A. */
    public static DocumentTree ring() {
        return tree(NodeSpec.section("Ring").withId("root")
            .withItem(block("A", "textfield", "a").withNavigationRules(List.of(NavigationRule.defaultTo("B"))))
            .withItem(block("B", "textfield", "b").withNavigationRules(List.of(NavigationRule.defaultTo("C"))))
            .withItem(block("C", "textfield", "c").withNavigationRules(List.of(NavigationRule.defaultTo("A")))));
    }

    public static String resource(String name) {
        try (InputStream in = SurveyTestSupport.class.getResourceAsStream("/" + name)) {
            if (in == null) {
                throw new IllegalArgumentException("Missing test resource " + name);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        }
    }
}
