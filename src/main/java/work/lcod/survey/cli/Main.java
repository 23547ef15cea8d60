package work.lcod.survey.cli;

import picocli.CommandLine;

/**
 * Entry point for the {@code java -jar} distribution of {@code survey-inspect}.
 */
public final class Main {
    private Main() {}

    public static void main(String[] args) {
        System.exit(commandLine().execute(args));
    }

    /** The {@code survey-inspect} command with short error reporting. */
    static CommandLine commandLine() {
        return new CommandLine(new InspectCommand())
            .setExecutionExceptionHandler(new ShortErrorHandler());
    }
}
