package com.wechaty.common.config;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ConfigServiceTest {

    @TempDir
    Path tempDir;
    private Path configPath;

    @BeforeEach
    void setUp() {
        configPath = tempDir.resolve("wechaty.json");
    }

    @Test
    void loadConfig_validJson_returnsConfig() throws IOException {
        String json = """
                {
                  "server": {
                    "host": "127.0.0.1",
                    "port": 5000
                  },
                  "plugins": {
                    "isolateFailures": true,
                    "disabled": ["DingDongPlugin"]
                  }
                }
                """;
        Files.writeString(configPath, json);

        WechatyConfig config = new ConfigService(configPath).loadConfig();

        assertEquals("127.0.0.1", config.getServer().getHost());
        assertEquals(5000, config.getServer().getPort());
        assertTrue(config.getServer().isEnabled());
        assertTrue(config.getPlugins().isIsolateFailures());
        assertEquals(List.of("DingDongPlugin"), config.getPlugins().getDisabled());
    }

    @Test
    void loadConfig_missingFile_returnsDefaults() {
        WechatyConfig config = new ConfigService(tempDir.resolve("nonexistent.json")).loadConfig();

        assertEquals(WechatyConfig.DEFAULT_HOST, config.getServer().getHost());
        assertEquals(WechatyConfig.DEFAULT_PORT, config.getServer().getPort());
        assertFalse(config.getPlugins().isIsolateFailures());
        assertTrue(config.getPlugins().getDisabled().isEmpty());
    }

    @Test
    void loadConfig_missingSections_filledWithDefaults() throws IOException {
        Files.writeString(configPath, "{ \"unknown\": 1 }");

        WechatyConfig config = new ConfigService(configPath).loadConfig();

        assertNotNull(config.getServer());
        assertNotNull(config.getPlugins());
    }

    @Test
    void loadConfig_malformedJson_throws() throws IOException {
        Files.writeString(configPath, "{ not json");

        ConfigService service = new ConfigService(configPath);
        assertThrows(UncheckedIOException.class, service::loadConfig);
    }

    @Test
    void loadConfig_substitutesEnvironment() throws IOException {
        String json = """
                { "server": { "host": "${BOT_HOST}", "port": ${BOT_PORT:-9000} } }
                """;
        Files.writeString(configPath, json);

        ConfigService service = new ConfigService(configPath, Duration.ofSeconds(1),
                Map.of("BOT_HOST", "10.0.0.2"));
        WechatyConfig config = service.loadConfig();

        assertEquals("10.0.0.2", config.getServer().getHost());
        assertEquals(9000, config.getServer().getPort());
    }

    @Test
    void substituteEnvVars_plainString_noChange() {
        ConfigService service = new ConfigService(configPath);
        assertEquals("hello", service.substituteEnvVars("hello"));
    }

    @Test
    void substituteEnvVars_missingWithoutDefault_becomesEmpty() {
        ConfigService service = new ConfigService(configPath, Duration.ofSeconds(1), Map.of());
        assertEquals("[]", service.substituteEnvVars("[${__UNLIKELY_VAR_XYZ}]"));
    }

    @Test
    void loadConfig_isCached() throws IOException {
        Files.writeString(configPath, "{ \"server\": { \"port\": 5000 } }");

        ConfigService service = new ConfigService(configPath);
        WechatyConfig first = service.loadConfig();
        WechatyConfig second = service.loadConfig();

        assertSame(first, second);
        assertNotSame(first, service.reloadConfig());
    }
}
