package work.lcod.orbital.cli;

import picocli.CommandLine;

/**
 * {@code orbital-run} launcher.
 */
public final class Main {
    private Main() {}

    static CommandLine commandLine() {
        return new CommandLine(new OrbitalRunCommand())
            .setExecutionExceptionHandler(new ShortErrorHandler())
            .setCaseInsensitiveEnumValuesAllowed(true)
            .setUsageHelpAutoWidth(true);
    }

    public static void main(String[] args) {
        System.exit(commandLine().execute(args));
    }
}
