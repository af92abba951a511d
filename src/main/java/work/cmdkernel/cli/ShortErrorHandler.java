package work.cmdkernel.cli;

import java.io.IOException;
import java.io.UncheckedIOException;
import picocli.CommandLine;
import work.cmdkernel.api.ExitCode;
import work.cmdkernel.error.ExecutionFailedException;

/**
 * Keeps CLI failures short and focused on the root cause.
 */
final class ShortErrorHandler implements CommandLine.IExecutionExceptionHandler {
    @Override
    public int handleExecutionException(
        Exception ex,
        CommandLine commandLine,
        CommandLine.ParseResult parseResult
    ) {
        Throwable root = ex;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        String message = root.getMessage();
        if (message == null || message.isBlank()) {
            message = root.getClass().getSimpleName();
        }
        commandLine.getErr().println(commandLine.getColorScheme().errorText("error: " + message));
        if (Boolean.getBoolean("cmdkernel.debug")) {
            ex.printStackTrace(commandLine.getErr());
        }
        return exitCode(ex, commandLine);
    }

    private static int exitCode(Exception ex, CommandLine commandLine) {
        if (ex instanceof ExecutionFailedException) {
            return commandLine.getCommand() instanceof CmdkernelCommand command
                ? command.settings().failureExitCode()
                : ExitCode.ERROR.code();
        }
        if (ex instanceof IOException || ex instanceof UncheckedIOException) {
            return ExitCode.IO_ERROR.code();
        }
        if (ex instanceof IllegalArgumentException || ex instanceof IllegalStateException) {
            return ExitCode.CONFIGURATION_ERROR.code();
        }
        return commandLine.getCommandSpec().exitCodeOnExecutionException();
    }
}
