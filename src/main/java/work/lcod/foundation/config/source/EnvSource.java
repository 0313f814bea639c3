package work.lcod.foundation.config.source;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.foundation.config.ConfigEntry;
import work.lcod.foundation.config.ConfigSource;

/**
 * Maps prefixed environment variables to configuration paths.
 *
 * <p>With prefix {@code APP} and separator {@code __}, {@code APP__DATABASE__HOST=localhost}
 * becomes {@code database.host = "localhost"} and {@code APP__SERVER__PORT=8080} becomes
 * {@code server.port = 8080}. Segments are lower-cased and values go through
 * {@link ValueCoercion}. Variables are emitted in name order.
 */
public final class EnvSource implements ConfigSource {
    private static final Logger LOG = LoggerFactory.getLogger(EnvSource.class);

    private final String prefix;
    private final String separator;
    private final Map<String, String> environment;

    public EnvSource(String prefix, String separator) {
        this(prefix, separator, System.getenv());
    }

    public EnvSource(String prefix, String separator, Map<String, String> environment) {
        this.prefix = Objects.requireNonNull(prefix, "prefix");
        this.separator = Objects.requireNonNull(separator, "separator");
        this.environment = Objects.requireNonNull(environment, "environment");
        if (separator.isEmpty()) {
            throw new IllegalArgumentException("separator must not be empty");
        }
    }

    @Override
    public List<ConfigEntry> entries() {
        String lead = prefix + separator;
        var entries = new ArrayList<ConfigEntry>();
        for (var variable : new TreeMap<>(environment).entrySet()) {
            String name = variable.getKey();
            if (!name.startsWith(lead)) {
                continue;
            }
            var path = toPath(name.substring(lead.length()));
            if (path.isEmpty()) {
                continue;
            }
            entries.add(ConfigEntry.atPath(path, ValueCoercion.coerce(variable.getValue())));
        }
        LOG.debug("Environment prefix {} matched {} variable(s)", lead, entries.size());
        return entries;
    }

    private List<String> toPath(String remainder) {
        if (remainder.isEmpty()) {
            return List.of();
        }
        var segments = Arrays.asList(remainder.split(Pattern.quote(separator), -1));
        if (segments.stream().anyMatch(String::isEmpty)) {
            return List.of();
        }
        return segments.stream().map(segment -> segment.toLowerCase(Locale.ROOT)).collect(Collectors.toList());
    }

    @Override
    public String toString() {
        return "EnvSource[" + prefix + separator + "*]";
    }
}
