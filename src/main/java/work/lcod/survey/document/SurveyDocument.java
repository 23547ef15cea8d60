package work.lcod.survey.document;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import work.lcod.survey.tree.DocumentTree;

/**
 * Full survey document: the node tree plus the opaque localization and theme payloads that
 * ride along with it.
 */
public record SurveyDocument(DocumentTree tree, Map<String, Object> localizations, Map<String, Object> theme) {
    public SurveyDocument {
        Objects.requireNonNull(tree, "tree");
        localizations = localizations == null || localizations.isEmpty()
            ? defaultLocalizations()
            : Collections.unmodifiableMap(new LinkedHashMap<>(localizations));
        theme = theme == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(theme));
    }

    public static SurveyDocument of(DocumentTree tree) {
        return new SurveyDocument(tree, null, null);
    }

    private static Map<String, Object> defaultLocalizations() {
        return Map.of("en", Map.of());
    }
}
