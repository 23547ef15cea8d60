package work.lcod.survey.cli;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.lcod.survey.api.EngineSettings;
import work.lcod.survey.api.EngineSettingsLoader;
import work.lcod.survey.api.LogLevel;
import work.lcod.survey.api.SurveyEngine;
import work.lcod.survey.document.DocumentCodec;

@CommandLine.Command(
    name = "survey-inspect",
    description = "Load a survey document and report pages, cycles, dangling rule targets and validation results.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true
)
final class InspectCommand implements Callable<Integer> {
    /** Read by logback.xml; must be set before the first logger is created. */
    static final String LOG_LEVEL_PROPERTY = "survey.log.level";

    private static final ObjectMapper JSON = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    @CommandLine.Option(
        names = {"-d", "--document"},
        required = true,
        description = "Survey document (.json, .yaml or .yml)."
    )
    private Path document;

    @CommandLine.Option(
        names = {"-v", "--values"},
        paramLabel = "PATH|-",
        description = "JSON object of answers keyed by field name; use '-' to read from stdin.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String values;

    @CommandLine.Option(
        names = {"-s", "--settings"},
        description = "TOML engine settings; the bundled survey-engine.toml is used when absent.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path settingsPath;

    @CommandLine.Option(
        names = "--log-level",
        description = "Log threshold (trace|debug|info|warn|error|off); overrides the settings file.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String logLevelRaw;

    @CommandLine.Option(
        names = "--graph",
        description = "Include the full positioned flow graph instead of a summary."
    )
    private boolean includeGraph;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() throws Exception {
        EngineSettings settings = settingsPath != null ? EngineSettingsLoader.load(settingsPath) : EngineSettingsLoader.bundled();
        if (logLevelRaw != null) {
            settings = settings.toBuilder().logLevel(LogLevel.from(logLevelRaw)).build();
        }
        System.setProperty(LOG_LEVEL_PROPERTY, settings.logLevel().name());

        var engine = new SurveyEngine(settings);
        var surveyDocument = new DocumentCodec().read(document);
        var answers = values == null ? null : readValues(values);
        var report = engine.inspect(surveyDocument, answers, includeGraph);
        spec.commandLine().getOut().println(report.toPrettyJson());
        return report.status().exitCode();
    }

    private Map<String, Object> readValues(String source) {
        try {
            if ("-".equals(source)) {
                try (InputStream in = System.in) {
                    return JSON.readValue(new String(in.readAllBytes(), StandardCharsets.UTF_8), MAP_TYPE);
                }
            }
            return JSON.readValue(Files.readString(Path.of(source)), MAP_TYPE);
        } catch (IOException ex) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Unable to read --values: " + ex.getMessage(), ex);
        }
    }
}
