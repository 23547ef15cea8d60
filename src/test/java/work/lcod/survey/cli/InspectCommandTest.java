package work.lcod.survey.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.lcod.survey.support.SurveyTestSupport.resource;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

class InspectCommandTest {
    @Test
    void printsAReportAndExitsWithItsStatus(@TempDir Path dir) throws Exception {
        var document = dir.resolve("survey.json");
        Files.writeString(document, resource("documents/customer-survey.json"));
        var values = dir.resolve("values.json");
        Files.writeString(values, "{\"age\": 30, \"email\": \"jo@example.org\", \"email_confirm\": \"jo@example.org\"}");

        var out = new StringWriter();
        int exitCode = command(out, new StringWriter()).execute("--document", document.toString(), "--values", values.toString());
        assertEquals(0, exitCode);
        assertTrue(out.toString().contains("\"status\" : \"clean\""));
    }

    @Test
    void cyclesMakeTheExitCodeNonZero(@TempDir Path dir) throws Exception {
        var document = dir.resolve("cyclic.json");
        Files.writeString(document, resource("documents/cyclic.json"));
        var out = new StringWriter();
        assertEquals(1, command(out, new StringWriter()).execute("-d", document.toString(), "--log-level", "error"));
        assertTrue(out.toString().contains("A → B → C → A"));
    }

    @Test
    void failuresArePrintedShort(@TempDir Path dir) throws Exception {
        var document = dir.resolve("broken.json");
        Files.writeString(document, "{\"theme\": {}}");
        var err = new StringWriter();
        var exitCode = command(new StringWriter(), err).execute("-d", document.toString());
        assertEquals(1, exitCode);
        assertTrue(err.toString().contains("[invalid_document]"));
    }

    @Test
    void printsTheVersion() {
        var out = new StringWriter();
        assertEquals(0, command(out, new StringWriter()).execute("--version"));
        assertTrue(out.toString().startsWith("survey-inspect "));
    }

    private static CommandLine command(StringWriter out, StringWriter err) {
        return Main.commandLine()
            .setOut(new PrintWriter(out, true))
            .setErr(new PrintWriter(err, true));
    }
}
