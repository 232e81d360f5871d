package work.lcod.orbital.cli;

import java.util.concurrent.CompletionException;
import picocli.CommandLine;
import work.lcod.orbital.api.ScenarioRunner;

/**
 * Prints one line per failure, prefixed with the runtime error code when there is one. Stack
 * traces only with {@code -Dorbital.debug=true}.
 */
final class ShortErrorHandler implements CommandLine.IExecutionExceptionHandler {
    static final String DEBUG_PROPERTY = "orbital.debug";

    @Override
    public int handleExecutionException(
        Exception ex,
        CommandLine commandLine,
        CommandLine.ParseResult parseResult
    ) {
        commandLine.getErr().println(commandLine.getColorScheme().errorText(describe(ex)));
        if (Boolean.getBoolean(DEBUG_PROPERTY)) {
            ex.printStackTrace(commandLine.getErr());
        }
        return commandLine.getCommandSpec().exitCodeOnExecutionException();
    }

    static String describe(Throwable ex) {
        var root = ex;
        while (root instanceof CompletionException && root.getCause() != null) {
            root = root.getCause();
        }
        var message = root.getMessage();
        if (message == null || message.isBlank()) {
            message = root.getClass().getSimpleName();
        }
        var code = ScenarioRunner.errorCode(root);
        return code.isPresent() ? code.get() + ": " + message : message;
    }
}
