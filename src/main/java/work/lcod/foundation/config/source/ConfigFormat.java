package work.lcod.foundation.config.source;

import java.nio.file.Path;
import java.util.Locale;

/**
 * Document formats understood by {@link FileSource}, picked from the file extension.
 */
public enum ConfigFormat {
    TOML,
    YAML,
    JSON;

    public static ConfigFormat forPath(Path path) {
        Path fileName = path.getFileName();
        String name = fileName == null ? "" : fileName.toString().toLowerCase(Locale.ROOT);
        if (name.endsWith(".yaml") || name.endsWith(".yml")) {
            return YAML;
        }
        if (name.endsWith(".json")) {
            return JSON;
        }
        return TOML;
    }
}
