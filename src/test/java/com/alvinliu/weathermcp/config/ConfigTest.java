package com.alvinliu.weathermcp.config;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link Config}.
 */
@Tag("unit")
public class ConfigTest {

    @TempDir
    Path tempDir;

    @Test void testDefaults() throws ConfigException {
        Config config = Config.load(Map.of(), tempDir.resolve("missing.env"));
        assertNull(config.getWeather().getApiKey());
        assertFalse(config.getWeather().hasApiKey());
        assertEquals(Config.DEFAULT_BASE_URL, config.getWeather().getBaseUrl());
        assertEquals(Config.DEFAULT_TIMEOUT_SECONDS, config.getWeather().getTimeoutSeconds());
        assertFalse(config.getLogging().isMcpConsoleLog());
        assertNull(config.getEnvFilePath());
    }

    @Test void testEnvironmentOverridesEnvFile() throws IOException, ConfigException {
        Path envFile = tempDir.resolve(".env");
        Files.write(envFile, List.of(
            "# weather settings",
            "OPENWEATHER_API_KEY=from-file",
            "export OPENWEATHER_BASE_URL=\"http://localhost:8080/data/2.5/\"",
            "WEATHER_MCP_CONSOLE_LOG='true'"
        ), StandardCharsets.UTF_8);
        Config config = Config.load(Map.of("OPENWEATHER_API_KEY", "from-env"), envFile);
        assertEquals("from-env", config.getWeather().getApiKey());
        assertEquals("http://localhost:8080/data/2.5", config.getWeather().getBaseUrl());
        assertTrue(config.getLogging().isMcpConsoleLog());
        assertEquals(envFile.toString(), config.getEnvFilePath());
    }

    @Test void testEnvFileOnly() throws IOException, ConfigException {
        Path envFile = tempDir.resolve(".env");
        Files.write(envFile, List.of("OPENWEATHER_API_KEY = abc ", "OPENWEATHER_TIMEOUT_SECONDS=3"), StandardCharsets.UTF_8);
        Config config = Config.load(Map.of(), envFile);
        assertEquals("abc", config.getWeather().getApiKey());
        assertEquals(3, config.getWeather().getTimeoutSeconds());
    }

    @Test void testBadTimeout() {
        assertThrows(ConfigException.class,
            () -> Config.load(Map.of("OPENWEATHER_TIMEOUT_SECONDS", "soon"), null));
        assertThrows(ConfigException.class,
            () -> Config.load(Map.of("OPENWEATHER_TIMEOUT_SECONDS", "0"), null));
    }

    @Test void testParseEnvFile() {
        Map<String, String> values = Config.parseEnvFile(List.of(
            "", "  # comment", "A=1", "B=\"two words\"", "C='x'", "D=\"unbalanced'", "=nokey", "novalue", "E="));
        assertEquals("1", values.get("A"));
        assertEquals("two words", values.get("B"));
        assertEquals("x", values.get("C"));
        assertEquals("\"unbalanced'", values.get("D"));
        assertEquals("", values.get("E"));
        assertEquals(5, values.size());
    }
}
