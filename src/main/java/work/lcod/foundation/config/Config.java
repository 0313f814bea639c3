package work.lcod.foundation.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.foundation.config.source.EnvSource;
import work.lcod.foundation.config.source.FileSource;

/**
 * Assembles a configuration from ordered sources and binds it to a typed object.
 *
 * <pre>{@code
 * AppConfig config = Config.builder()
 *     .withFile(Path.of("config/default.toml"), true)
 *     .withFile(Path.of("config/local.toml"), false)
 *     .withEnv("APP", "__")
 *     .build(AppConfig.class);
 * }</pre>
 *
 * <p>Sources are merged in registration order, so later sources override earlier ones. String
 * values may reference other values with {@code ${section.key}}; see {@link ReferenceResolver}.
 * Unknown keys are ignored when binding.
 */
public final class Config {
    private static final Logger LOG = LoggerFactory.getLogger(Config.class);
    private static final ObjectMapper MAPPER = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
        .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);

    private final List<ConfigSource> sources;
    private final boolean resolveReferences;

    private Config(List<ConfigSource> sources, boolean resolveReferences) {
        this.sources = List.copyOf(sources);
        this.resolveReferences = resolveReferences;
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<ConfigSource> sources() {
        return sources;
    }

    /**
     * Merges every source in order, then resolves references unless disabled on the builder.
     */
    public ConfigTree load() {
        var tree = new ConfigTree();
        for (var source : sources) {
            var entries = source.entries();
            LOG.debug("Merging {} entries from {}", entries.size(), source);
            for (var entry : entries) {
                ConfigMerger.merge(tree, entry);
            }
        }
        if (resolveReferences) {
            ReferenceResolver.resolveReferences(tree);
        }
        return tree;
    }

    public static final class Builder {
        private final List<ConfigSource> sources = new ArrayList<>();
        private boolean resolveReferences = true;

        public Builder withFile(Path path, boolean required) {
            return withSource(new FileSource(path, required));
        }

        public Builder withEnv(String prefix, String separator) {
            return withSource(new EnvSource(prefix, separator));
        }

        public Builder withSource(ConfigSource source) {
            sources.add(Objects.requireNonNull(source, "source"));
            return this;
        }

        public Builder resolveReferences(boolean resolveReferences) {
            this.resolveReferences = resolveReferences;
            return this;
        }

        public Config toConfig() {
            return new Config(sources, resolveReferences);
        }

        /**
         * Resolved tree as a read-only map. Fails with {@link IllegalStateException} if a
         * root-level scalar replaced the document.
         */
        public Map<String, Object> buildTree() {
            var tree = toConfig().load();
            if (!tree.hasTableRoot()) {
                throw new IllegalStateException("Configuration root is not a table: " + ConfigValues.describe(tree.root()));
            }
            return ConfigValues.asTable(ConfigValues.unmodifiable(tree.root()));
        }

        /**
         * @throws ConfigException when a source fails, a reference cannot be resolved, or the
         *     tree does not fit {@code type}
         */
        public <T> T build(Class<T> type) {
            return bind(root -> MAPPER.convertValue(root, type));
        }

        public <T> T build(TypeReference<T> type) {
            return bind(root -> MAPPER.convertValue(root, type));
        }

        private <T> T bind(Function<Object, T> converter) {
            var tree = toConfig().load();
            try {
                return converter.apply(tree.root());
            } catch (IllegalArgumentException ex) {
                throw ConfigException.deserializeError(ex.getCause() != null ? ex.getCause() : ex);
            }
        }
    }
}
