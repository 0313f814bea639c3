package work.lcod.foundation.context;

/**
 * Raised when an {@link AppContext} is built before a configuration was attached.
 */
public final class MissingConfigException extends IllegalStateException {
    public MissingConfigException() {
        super("application context requires a configuration");
    }
}
