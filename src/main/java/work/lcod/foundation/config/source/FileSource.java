package work.lcod.foundation.config.source;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tomlj.Toml;
import org.tomlj.TomlArray;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;
import work.lcod.foundation.config.ConfigEntry;
import work.lcod.foundation.config.ConfigException;
import work.lcod.foundation.config.ConfigSource;
import work.lcod.foundation.config.ConfigValues;

/**
 * Loads one configuration document (TOML, YAML or JSON) as a single root-level entry.
 *
 * <p>A missing optional file contributes nothing; a missing required file fails the build.
 */
public final class FileSource implements ConfigSource {
    private static final Logger LOG = LoggerFactory.getLogger(FileSource.class);
    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final TypeReference<Map<String, Object>> MAP_REF = new TypeReference<>() {};

    private final Path path;
    private final boolean required;

    public FileSource(Path path, boolean required) {
        this.path = Objects.requireNonNull(path, "path");
        this.required = required;
    }

    public Path path() {
        return path;
    }

    public boolean required() {
        return required;
    }

    @Override
    public List<ConfigEntry> entries() {
        String contents;
        try {
            contents = Files.readString(path);
        } catch (NoSuchFileException ex) {
            if (required) {
                throw ConfigException.fileNotFound(path);
            }
            LOG.debug("Optional config file {} not found, skipping", path);
            return List.of();
        } catch (IOException ex) {
            throw ConfigException.readError(path, ex);
        }
        var table = parse(contents);
        LOG.debug("Loaded {} top-level key(s) from {}", table.size(), path);
        return List.of(ConfigEntry.root(table));
    }

    private Map<String, Object> parse(String contents) {
        return switch (ConfigFormat.forPath(path)) {
            case TOML -> parseToml(contents);
            case YAML -> parseJackson(YAML_MAPPER, contents);
            case JSON -> parseJackson(JSON_MAPPER, contents);
        };
    }

    private Map<String, Object> parseToml(String contents) {
        TomlParseResult result = Toml.parse(contents);
        if (result.hasErrors()) {
            String reason = result.errors().stream()
                .map(Object::toString)
                .collect(Collectors.joining("; "));
            throw ConfigException.parseError(path, reason, null);
        }
        return fromToml(result);
    }

    private Map<String, Object> parseJackson(ObjectMapper mapper, String contents) {
        if (contents.isBlank()) {
            return new LinkedHashMap<>();
        }
        Map<String, Object> parsed;
        try {
            parsed = mapper.readValue(contents, MAP_REF);
        } catch (JsonProcessingException ex) {
            throw ConfigException.parseError(path, ex.getOriginalMessage(), ex);
        }
        if (parsed == null) {
            return new LinkedHashMap<>();
        }
        try {
            return toTable(ConfigValues.normalize(parsed));
        } catch (IllegalArgumentException ex) {
            throw ConfigException.parseError(path, ex.getMessage(), ex);
        }
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> toTable(Object value) {
        return (Map<String, Object>) value;
    }

    static Map<String, Object> fromToml(TomlTable table) {
        var map = new LinkedHashMap<String, Object>();
        for (var entry : table.toMap().entrySet()) {
            map.put(entry.getKey(), convertToml(entry.getValue()));
        }
        return map;
    }

    private static Object convertToml(Object value) {
        if (value instanceof TomlTable table) {
            return fromToml(table);
        }
        if (value instanceof TomlArray array) {
            var list = new ArrayList<Object>(array.size());
            for (int i = 0; i < array.size(); i++) {
                list.add(convertToml(array.get(i)));
            }
            return list;
        }
        return value;
    }

    @Override
    public String toString() {
        return "FileSource[" + path + (required ? "" : ", optional") + "]";
    }
}
