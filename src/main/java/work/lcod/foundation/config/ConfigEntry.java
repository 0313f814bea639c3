package work.lcod.foundation.config;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A single contribution from a {@link ConfigSource}: a value and the location it targets.
 *
 * <p>An empty path merges the value into the root (a whole file); a non-empty path such as
 * {@code ["database", "host"]} targets one nested location (one environment variable).
 */
public record ConfigEntry(List<String> path, Object value) {
    public ConfigEntry {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(value, "value");
        path = List.copyOf(path);
    }

    public static ConfigEntry root(Map<String, Object> table) {
        return new ConfigEntry(List.of(), table);
    }

    public static ConfigEntry atPath(List<String> path, Object value) {
        return new ConfigEntry(path, value);
    }

    public boolean isRoot() {
        return path.isEmpty();
    }

    public String dottedPath() {
        return String.join(".", path);
    }
}
