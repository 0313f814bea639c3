package work.lcod.foundation.context;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import work.lcod.foundation.config.Config;
import work.lcod.foundation.config.source.OverrideSource;

class AppContextTest {
    record ServerConfig(String host, int port) {}

    record AppConfig(ServerConfig server) {}

    @Test
    void exposesAttachedConfig() {
        var config = Config.builder()
            .withFile(Path.of("src", "test", "resources", "fixtures", "absent.toml"), false)
            .withSource(OverrideSource.of("server.host=localhost", "server.port=8080"))
            .build(AppConfig.class);

        AppContext<AppConfig> ctx = AppContext.builder()
            .withConfig(config)
            .build();

        assertSame(config, ctx.config());
        assertEquals(8080, ctx.config().server().port());
    }

    @Test
    void buildingWithoutConfigFails() {
        var ex = assertThrows(MissingConfigException.class, () -> AppContext.builder().build());
        assertEquals("application context requires a configuration", ex.getMessage());
    }

    @Test
    void nullConfigCountsAsMissing() {
        assertThrows(MissingConfigException.class, () -> AppContext.builder().withConfig((String) null).build());
    }
}
