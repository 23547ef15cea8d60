package work.lcod.survey.api;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.survey.condition.ConditionEvaluator;
import work.lcod.survey.document.SurveyDocument;
import work.lcod.survey.graph.CycleDetector;
import work.lcod.survey.graph.FlowEdge;
import work.lcod.survey.graph.FlowGraph;
import work.lcod.survey.graph.FlowGraphBuilder;
import work.lcod.survey.graph.FlowNode;
import work.lcod.survey.navigation.DanglingReference;
import work.lcod.survey.navigation.DanglingReferences;
import work.lcod.survey.navigation.NavigationEngine;
import work.lcod.survey.navigation.NavigationResult;
import work.lcod.survey.navigation.StepTarget;
import work.lcod.survey.navigation.SurveyNavigator;
import work.lcod.survey.navigation.SurveyPages;
import work.lcod.survey.shared.SurveyErrors;
import work.lcod.survey.tree.DocumentTree;
import work.lcod.survey.validation.FieldValidation;
import work.lcod.survey.validation.ValidationEngine;

/**
 * Entry point wiring conditions, navigation, validation and graph layout from one
 * {@link EngineSettings}. Usable by the CLI and by embedding applications.
 */
public final class SurveyEngine {
    private final EngineSettings settings;
    private final Clock clock;
    private final NavigationEngine navigation;
    private final SurveyNavigator navigator;
    private final ValidationEngine validation;
    private final FlowGraphBuilder graphBuilder;
    private final CycleDetector cycleDetector;
    private final Logger log;

    public SurveyEngine() {
        this(EngineSettings.defaults());
    }

    public SurveyEngine(EngineSettings settings) {
        this(settings, Clock.system(settings.zone()));
    }

    public SurveyEngine(EngineSettings settings, Clock clock) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.clock = Objects.requireNonNull(clock, "clock").withZone(settings.zone());
        this.log = LoggerFactory.getLogger(SurveyEngine.class);
        var conditions = new ConditionEvaluator(LoggerFactory.getLogger(ConditionEvaluator.class));
        this.navigation = new NavigationEngine(conditions, settings.danglingPolicy(), LoggerFactory.getLogger(NavigationEngine.class));
        this.navigator = new SurveyNavigator(navigation, LoggerFactory.getLogger(SurveyNavigator.class));
        this.validation = new ValidationEngine(conditions, this.clock, LoggerFactory.getLogger(ValidationEngine.class));
        this.graphBuilder = new FlowGraphBuilder(settings.layout(), LoggerFactory.getLogger(FlowGraphBuilder.class));
        this.cycleDetector = new CycleDetector(LoggerFactory.getLogger(CycleDetector.class));
    }

    public EngineSettings settings() {
        return settings;
    }

    /** First matching navigation rule of {@code nodeId}. */
    public NavigationResult navigate(DocumentTree tree, String nodeId, Map<String, ?> values) {
        return navigation.resolveNext(tree, nodeId, values);
    }

    /** Where the respondent goes after answering {@code blockId}. */
    public StepTarget nextStep(DocumentTree tree, String blockId, Map<String, ?> values) {
        return navigator.nextFromBlock(tree, blockId, values);
    }

    public StepTarget nextPage(DocumentTree tree, int pageIndex, Map<String, ?> values) {
        return navigator.nextFromPage(tree, pageIndex, values);
    }

    /** Validates the block bound to {@code fieldName}; unknown fields pass. */
    public FieldValidation validateField(DocumentTree tree, String fieldName, Map<String, ?> values) {
        return tree.blockByFieldName(fieldName)
            .map(block -> validation.validateBlock(block, values))
            .orElseGet(() -> FieldValidation.passed(fieldName));
    }

    public Map<String, FieldValidation> validateDocument(DocumentTree tree, Map<String, ?> values) {
        return validation.validateDocument(tree, values);
    }

    public FlowGraph buildGraph(DocumentTree tree) {
        return graphBuilder.build(tree);
    }

    public FlowGraph relayout(FlowGraph previous, DocumentTree tree) {
        return graphBuilder.relayout(previous, tree);
    }

    public List<String> detectCycles(DocumentTree tree) {
        return cycleDetector.detectCycles(tree);
    }

    public List<DanglingReference> danglingReferences(DocumentTree tree) {
        return DanglingReferences.find(tree);
    }

    /** Drops rules that point at deleted nodes. */
    public DocumentTree pruneDanglingRules(DocumentTree tree) {
        return DanglingReferences.prune(tree, log);
    }

    /**
     * Structural report of a document: pages, cycles, dangling rule targets and, when answers
     * are given, the validation outcome per field.
     */
    public InspectionReport inspect(SurveyDocument document, Map<String, ?> values, boolean includeGraph) {
        var startedAt = clock.instant();
        var metadata = new LinkedHashMap<String, Object>();
        try {
            var tree = document.tree();
            var pages = SurveyPages.of(tree);
            metadata.put("nodes", tree.size());
            metadata.put("mode", pages.mode().name().toLowerCase(Locale.ROOT));
            metadata.put("pages", pages.pageIds());
            metadata.put("fields", new ArrayList<>(tree.fieldNames()));

            var cycles = detectCycles(tree);
            metadata.put("cycles", cycles);
            var dangling = danglingReferences(tree).stream().map(reference -> {
                var entry = new LinkedHashMap<String, Object>();
                entry.put("source", reference.sourceId());
                entry.put("rule", reference.ruleIndex());
                entry.put("target", reference.target());
                return entry;
            }).toList();
            metadata.put("danglingTargets", dangling);

            var invalid = 0;
            if (values != null) {
                var fields = new LinkedHashMap<String, Object>();
                for (var entry : validateDocument(tree, values).entrySet()) {
                    var result = entry.getValue();
                    if (!result.valid()) {
                        invalid++;
                    }
                    fields.put(entry.getKey(), result.failures().stream().map(failure -> {
                        var item = new LinkedHashMap<String, Object>();
                        item.put("operator", failure.operator());
                        item.put("message", failure.message());
                        item.put("severity", failure.severity().wireName());
                        return item;
                    }).toList());
                }
                metadata.put("validation", fields);
            }

            var graph = buildGraph(tree);
            var graphSummary = new LinkedHashMap<String, Object>();
            graphSummary.put("nodes", graph.nodes().size());
            graphSummary.put("edges", graph.edges().size());
            graphSummary.put("navigationEdges", graph.edgesOfKind(FlowEdge.Kind.NAVIGATION).size());
            graphSummary.put("blocks", graph.count(FlowNode.Kind.BLOCK));
            metadata.put("graph", includeGraph ? graph.toMap() : graphSummary);

            var clean = cycles.isEmpty() && dangling.isEmpty() && invalid == 0;
            return clean
                ? InspectionReport.clean(metadata, startedAt, clock.instant())
                : InspectionReport.issues(metadata, startedAt, clock.instant());
        } catch (RuntimeException ex) {
            var error = SurveyErrors.normalize(ex);
            log.error("Inspection failed: {}", error.get("message"), ex);
            metadata.put("error", error);
            return InspectionReport.failure(String.valueOf(error.get("message")), metadata, startedAt, clock.instant());
        }
    }
}
