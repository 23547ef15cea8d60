package work.lcod.survey.cli;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;
import picocli.CommandLine;

/**
 * Reports the engine version from the jar manifest, or from the properties Maven packages
 * alongside the classes when the manifest carries none.
 */
final class VersionProvider implements CommandLine.IVersionProvider {
    static final String POM_PROPERTIES = "/META-INF/maven/work.lcod/lcod-survey-engine/pom.properties";

    @Override
    public String[] getVersion() throws IOException {
        String version = Main.class.getPackage().getImplementationVersion();
        if (version == null) {
            version = packagedVersion();
        }
        return new String[] { "survey-inspect " + (version != null ? version : "development") };
    }

    private static String packagedVersion() throws IOException {
        try (InputStream in = VersionProvider.class.getResourceAsStream(POM_PROPERTIES)) {
            if (in == null) {
                return null;
            }
            var properties = new Properties();
            properties.load(in);
            return properties.getProperty("version");
        }
    }
}
