package work.lcod.foundation.config;

import java.util.List;

/**
 * A producer of configuration entries (files, environment variables, command line overrides...).
 *
 * <p>{@link Config} calls every registered source once, in registration order, and merges the
 * returned entries in list order: later entries override earlier ones.
 */
@FunctionalInterface
public interface ConfigSource {
    /**
     * @throws ConfigException when the source cannot be read or parsed
     */
    List<ConfigEntry> entries();
}
