package work.lcod.foundation.config.source;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import work.lcod.foundation.config.ConfigEntry;
import work.lcod.foundation.config.ConfigSource;

/**
 * Explicit {@code dotted.key=value} assignments, typically from {@code --set} on the command line.
 * Values are coerced like environment variables.
 */
public final class OverrideSource implements ConfigSource {
    private final List<ConfigEntry> entries;

    public OverrideSource(List<String> assignments) {
        var parsed = new ArrayList<ConfigEntry>(assignments.size());
        for (String assignment : assignments) {
            parsed.add(parse(assignment));
        }
        this.entries = List.copyOf(parsed);
    }

    public static OverrideSource of(String... assignments) {
        return new OverrideSource(Arrays.asList(assignments));
    }

    static ConfigEntry parse(String assignment) {
        int eq = assignment.indexOf('=');
        if (eq <= 0) {
            throw new IllegalArgumentException("Override must look like key.path=value: " + assignment);
        }
        String key = assignment.substring(0, eq).trim();
        var path = Arrays.asList(key.split("\\.", -1));
        if (key.isEmpty() || path.stream().anyMatch(String::isEmpty)) {
            throw new IllegalArgumentException("Invalid override key: " + key);
        }
        return ConfigEntry.atPath(path, ValueCoercion.coerce(assignment.substring(eq + 1)));
    }

    @Override
    public List<ConfigEntry> entries() {
        return entries;
    }

    @Override
    public String toString() {
        return "OverrideSource" + entries;
    }
}
