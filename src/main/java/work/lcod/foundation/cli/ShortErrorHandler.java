package work.lcod.foundation.cli;

import java.util.Locale;
import picocli.CommandLine;
import work.lcod.foundation.config.ConfigException;

/**
 * Prints a one-line diagnostic instead of a stack trace.
 *
 * <p>Exit codes: {@value #CONFIG_ERROR} when the configuration cannot be built,
 * {@value #INVALID_ARGUMENT} for malformed option values such as a bad {@code --set}.
 */
final class ShortErrorHandler implements CommandLine.IExecutionExceptionHandler {
    static final int CONFIG_ERROR = 1;
    static final int INVALID_ARGUMENT = 2;

    @Override
    public int handleExecutionException(
        Exception ex,
        CommandLine commandLine,
        CommandLine.ParseResult parseResult
    ) {
        var err = commandLine.getErr();
        err.println(commandLine.getColorScheme().errorText(describe(ex)));
        if (Boolean.getBoolean("lcod.debug")) {
            ex.printStackTrace(err);
        }
        if (ex instanceof ConfigException) {
            return CONFIG_ERROR;
        }
        if (ex instanceof IllegalArgumentException) {
            return INVALID_ARGUMENT;
        }
        return commandLine.getCommandSpec().exitCodeOnExecutionException();
    }

    static String describe(Exception ex) {
        String message = ex.getMessage();
        if (message == null || message.isBlank()) {
            message = ex.getClass().getSimpleName();
        }
        if (ex instanceof ConfigException config) {
            return "configuration error (" + config.kind().name().toLowerCase(Locale.ROOT) + "): " + message;
        }
        return message;
    }
}
