package work.lcod.foundation.config.source;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.lcod.foundation.config.ConfigException;

class FileSourceTest {
    private static final Path FIXTURES = Path.of("src", "test", "resources", "fixtures");

    @TempDir
    Path tempDir;

    @Test
    void loadsTomlAsSingleRootEntry() {
        var entries = new FileSource(FIXTURES.resolve("default.toml"), true).entries();

        assertEquals(1, entries.size());
        assertTrue(entries.get(0).isRoot());
        var root = (Map<?, ?>) entries.get(0).value();
        var database = (Map<?, ?>) root.get("database");
        assertEquals("localhost", database.get("host"));
        assertEquals(5432L, database.get("port"));
        var server = (Map<?, ?>) root.get("server");
        assertEquals(List.of("a.internal", "b.internal"), server.get("hosts"));
        assertInstanceOf(OffsetDateTime.class, ((Map<?, ?>) root.get("app")).get("started"));
    }

    @Test
    void keepsTomlTypes() throws Exception {
        var file = tempDir.resolve("types.toml");
        Files.writeString(file, String.join("\n",
            "text = \"value\"",
            "count = -3",
            "ratio = 1.5",
            "flag = true",
            "local_dt = 1979-05-27T07:32:00",
            "day = 1979-05-27",
            "clock = 07:32:00",
            "\"dotted.key\" = 1",
            "matrix = [[1, 2], [3]]",
            "[[servers]]",
            "name = \"alpha\"",
            "[[servers]]",
            "name = \"beta\"",
            ""
        ));

        var root = (Map<?, ?>) new FileSource(file, true).entries().get(0).value();

        assertEquals("value", root.get("text"));
        assertEquals(-3L, root.get("count"));
        assertEquals(1.5, root.get("ratio"));
        assertEquals(true, root.get("flag"));
        assertEquals(LocalDateTime.of(1979, 5, 27, 7, 32), root.get("local_dt"));
        assertEquals(LocalDate.of(1979, 5, 27), root.get("day"));
        assertEquals(LocalTime.of(7, 32), root.get("clock"));
        assertEquals(1L, root.get("dotted.key"));
        assertEquals(List.of(List.of(1L, 2L), List.of(3L)), root.get("matrix"));
        assertEquals(List.of(Map.of("name", "alpha"), Map.of("name", "beta")), root.get("servers"));
    }

    @Test
    void loadsYamlAndJson() {
        var yaml = (Map<?, ?>) new FileSource(FIXTURES.resolve("overlay.yaml"), true).entries().get(0).value();
        assertEquals(Map.of("pool", Map.of("size", 10L, "timeout", 2.5)), yaml.get("database"));
        assertEquals(Map.of("tags", List.of("blue", "green")), yaml.get("server"));

        var json = (Map<?, ?>) new FileSource(FIXTURES.resolve("service.json"), true).entries().get(0).value();
        assertEquals(3L, ((Map<?, ?>) json.get("service")).get("replicas"));
    }

    @Test
    void requiredMissingFileFails() {
        var missing = tempDir.resolve("missing.toml");
        var ex = assertThrows(ConfigException.class, () -> new FileSource(missing, true).entries());
        assertEquals(ConfigException.Kind.FILE_NOT_FOUND, ex.kind());
        assertEquals(missing.toString(), ex.detail());
    }

    @Test
    void optionalMissingFileIsSkipped() {
        var entries = new FileSource(tempDir.resolve("missing.toml"), false).entries();
        assertTrue(entries.isEmpty());
    }

    @Test
    void directoryIsReadError() {
        var ex = assertThrows(ConfigException.class, () -> new FileSource(tempDir, false).entries());
        assertEquals(ConfigException.Kind.READ_ERROR, ex.kind());
    }

    @Test
    void syntaxErrorsAreParseErrors() throws Exception {
        var toml = assertThrows(ConfigException.class, () -> new FileSource(FIXTURES.resolve("broken.toml"), true).entries());
        assertEquals(ConfigException.Kind.PARSE_ERROR, toml.kind());
        assertTrue(toml.getMessage().contains("broken.toml"), toml.getMessage());

        var yaml = tempDir.resolve("list.yaml");
        Files.writeString(yaml, "- just\n- a list\n");
        var notATable = assertThrows(ConfigException.class, () -> new FileSource(yaml, true).entries());
        assertEquals(ConfigException.Kind.PARSE_ERROR, notATable.kind());
    }

    @Test
    void emptyYamlIsEmptyTable() throws Exception {
        var yaml = tempDir.resolve("empty.yml");
        Files.writeString(yaml, "");
        var entries = new FileSource(yaml, true).entries();
        assertEquals(Map.of(), entries.get(0).value());
    }

    @Test
    void picksFormatFromExtension() {
        assertEquals(ConfigFormat.TOML, ConfigFormat.forPath(Path.of("app.toml")));
        assertEquals(ConfigFormat.TOML, ConfigFormat.forPath(Path.of("app.conf")));
        assertEquals(ConfigFormat.YAML, ConfigFormat.forPath(Path.of("APP.YML")));
        assertEquals(ConfigFormat.YAML, ConfigFormat.forPath(Path.of("app.yaml")));
        assertEquals(ConfigFormat.JSON, ConfigFormat.forPath(Path.of("app.json")));
    }
}
