package work.lcod.pipeline.cli;

import picocli.CommandLine;
import work.lcod.pipeline.shared.PipelineException;

/**
 * Prints one {@code lcod-pipeline:} line for an exception that escaped the command. Wrapped
 * exceptions are unwound to the innermost pipeline failure, whose code is appended.
 */
final class ShortErrorHandler implements CommandLine.IExecutionExceptionHandler {
    static final String PREFIX = "lcod-pipeline: ";

    @Override
    public int handleExecutionException(
        Exception ex,
        CommandLine commandLine,
        CommandLine.ParseResult parseResult
    ) {
        commandLine.getErr().println(commandLine.getColorScheme().errorText(PREFIX + describe(ex)));
        if (Boolean.getBoolean("lcod.debug")) {
            ex.printStackTrace(commandLine.getErr());
        }
        return commandLine.getCommandSpec().exitCodeOnExecutionException();
    }

    static String describe(Throwable ex) {
        Throwable focus = ex;
        for (Throwable current = ex; current != null; current = current.getCause()) {
            if (current instanceof PipelineException) {
                focus = current;
            }
        }
        String message = focus.getMessage();
        if (message == null || message.isBlank()) {
            message = focus.getClass().getSimpleName();
        }
        if (focus instanceof PipelineException pipeline) {
            return message + " [" + pipeline.code() + "]";
        }
        return message;
    }
}
