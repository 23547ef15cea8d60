package work.lcod.survey.api;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.Map;
import java.util.function.Consumer;
import org.tomlj.Toml;
import org.tomlj.TomlInvalidTypeException;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;
import work.lcod.survey.graph.LayoutSettings;
import work.lcod.survey.navigation.DanglingTargetPolicy;
import work.lcod.survey.shared.SurveyException;

/**
 * Reads {@link EngineSettings} from TOML. Missing keys keep their defaults.
 *
 * <pre>
 * log_level = "info"
 *
 * [layout]
 * start_x = 400
 * sibling_spacing = 450
 *
 * [navigation]
 * dangling_targets = "skip"
 *
 * [validation]
 * time_zone = "Europe/Paris"
 * </pre>
 */
public final class EngineSettingsLoader {
    /** Classpath resource holding the shipped defaults. */
    public static final String BUNDLED_RESOURCE = "/survey-engine.toml";

    private EngineSettingsLoader() {}

    /** Settings shipped with the engine, or {@link EngineSettings#defaults()} when the resource is absent. */
    public static EngineSettings bundled() {
        try (InputStream in = EngineSettingsLoader.class.getResourceAsStream(BUNDLED_RESOURCE)) {
            if (in == null) {
                return EngineSettings.defaults();
            }
            return parse(new String(in.readAllBytes(), StandardCharsets.UTF_8));
        } catch (IOException ex) {
            throw new SurveyException("settings_unreadable", "Unable to read bundled settings: " + ex.getMessage(), null, ex);
        }
    }

    public static EngineSettings load(Path path) {
        try {
            return parse(Files.readString(path));
        } catch (IOException ex) {
            throw new SurveyException("settings_unreadable", "Unable to read settings " + path + ": " + ex.getMessage(), Map.of("path", path.toString()), ex);
        }
    }

    public static EngineSettings parse(String text) {
        TomlParseResult result = Toml.parse(text == null ? "" : text);
        if (result.hasErrors()) {
            throw new SurveyException("invalid_settings", "Invalid settings: " + result.errors().get(0).toString(), Map.of("errors", result.errors().size()));
        }
        var builder = EngineSettings.builder();
        try {
            var logLevel = result.getString("log_level");
            if (logLevel != null) {
                builder.logLevel(LogLevel.from(logLevel));
            }
            var layout = result.getTable("layout");
            if (layout != null) {
                builder.layout(readLayout(layout));
            }
            var navigation = result.getTable("navigation");
            if (navigation != null && navigation.getString("dangling_targets") != null) {
                builder.danglingPolicy(DanglingTargetPolicy.from(navigation.getString("dangling_targets")));
            }
            var validation = result.getTable("validation");
            if (validation != null && validation.getString("time_zone") != null) {
                builder.zone(ZoneId.of(validation.getString("time_zone")));
            }
            return builder.build();
        } catch (IllegalArgumentException | ArithmeticException | DateTimeException | TomlInvalidTypeException ex) {
            throw new SurveyException("invalid_settings", "Invalid settings: " + ex.getMessage(), null, ex);
        }
    }

    private static LayoutSettings readLayout(TomlTable table) {
        var builder = LayoutSettings.defaults().toBuilder();
        number(table, "start_x", builder::startX);
        number(table, "start_y", builder::startY);
        number(table, "sibling_spacing", builder::siblingSpacing);
        number(table, "level_spacing", builder::levelSpacing);
        number(table, "padding", builder::padding);
        number(table, "radius_step", builder::radiusStep);
        number(table, "angle_step", builder::angleStep);
        number(table, "block_height", builder::blockHeight);
        number(table, "block_spacing", builder::blockSpacing);
        var maxAttempts = table.getLong("max_attempts");
        if (maxAttempts != null) {
            builder.maxAttempts(Math.toIntExact(maxAttempts));
        }
        return builder.build();
    }

    private static void number(TomlTable table, String key, Consumer<Double> setter) {
        if (!table.contains(key)) {
            return;
        }
        var value = table.get(key);
        if (value instanceof Number number) {
            setter.accept(number.doubleValue());
        } else {
            throw new IllegalArgumentException("layout." + key + " must be a number");
        }
    }
}
