package com.alvinliu.weathermcp.config;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Server configuration. Values come from the process environment first, then from a .env file.
 * A missing API key is not fatal here: each tool call reports it instead.
 */
public class Config {
    public static final String KEY_API_KEY = "OPENWEATHER_API_KEY";
    public static final String KEY_BASE_URL = "OPENWEATHER_BASE_URL";
    public static final String KEY_TIMEOUT = "OPENWEATHER_TIMEOUT_SECONDS";
    public static final String KEY_CONSOLE_LOG = "WEATHER_MCP_CONSOLE_LOG";

    public static final String DEFAULT_BASE_URL = "https://api.openweathermap.org/data/2.5";
    public static final int DEFAULT_TIMEOUT_SECONDS = 10;

    private Weather weather = new Weather();
    private Logging logging = new Logging();
    private String envFilePath;

    public Weather getWeather() { return weather; }
    public void setWeather(Weather weather) { this.weather = weather; }

    public Logging getLogging() { return logging; }
    public void setLogging(Logging logging) { this.logging = logging; }

    /** .env file that was read, or null when none existed. */
    public String getEnvFilePath() { return envFilePath; }
    public void setEnvFilePath(String envFilePath) { this.envFilePath = envFilePath; }

    public static class Weather {
        private String apiKey;
        private String baseUrl = DEFAULT_BASE_URL;
        private int timeoutSeconds = DEFAULT_TIMEOUT_SECONDS;

        public String getApiKey() { return apiKey; }
        public void setApiKey(String apiKey) { this.apiKey = apiKey; }

        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

        public int getTimeoutSeconds() { return timeoutSeconds; }
        public void setTimeoutSeconds(int timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }

        public boolean hasApiKey() { return apiKey != null && !apiKey.isBlank(); }
    }

    public static class Logging {
        private boolean mcpConsoleLog;

        public boolean isMcpConsoleLog() { return mcpConsoleLog; }
        public void setMcpConsoleLog(boolean mcpConsoleLog) { this.mcpConsoleLog = mcpConsoleLog; }
    }

    /**
     * Build config from the given environment plus an optional .env file. Environment entries win.
     *
     * @param env     process environment (usually System.getenv())
     * @param envFile .env path; ignored when null or absent
     * @throws ConfigException when the .env file exists but cannot be read, or a value is malformed
     */
    public static Config load(Map<String, String> env, Path envFile) throws ConfigException {
        Map<String, String> values = new LinkedHashMap<>();
        Config config = new Config();
        if (envFile != null && Files.isRegularFile(envFile)) {
            try {
                values.putAll(parseEnvFile(Files.readAllLines(envFile, StandardCharsets.UTF_8)));
            } catch (IOException e) {
                throw new ConfigException("Cannot read " + envFile + ": " + e.getMessage(), e);
            }
            config.setEnvFilePath(envFile.toString());
        }
        if (env != null) {
            values.putAll(env);
        }

        String apiKey = values.get(KEY_API_KEY);
        config.getWeather().setApiKey(apiKey != null ? apiKey.trim() : null);

        String baseUrl = values.get(KEY_BASE_URL);
        if (baseUrl != null && !baseUrl.isBlank()) {
            baseUrl = baseUrl.trim();
            while (baseUrl.endsWith("/")) baseUrl = baseUrl.substring(0, baseUrl.length() - 1);
            config.getWeather().setBaseUrl(baseUrl);
        }

        String timeout = values.get(KEY_TIMEOUT);
        if (timeout != null && !timeout.isBlank()) {
            int seconds;
            try {
                seconds = Integer.parseInt(timeout.trim());
            } catch (NumberFormatException e) {
                throw new ConfigException(KEY_TIMEOUT + " must be an integer, got: " + timeout, e);
            }
            if (seconds <= 0) {
                throw new ConfigException(KEY_TIMEOUT + " must be positive, got: " + seconds);
            }
            config.getWeather().setTimeoutSeconds(seconds);
        }

        String consoleLog = values.get(KEY_CONSOLE_LOG);
        config.getLogging().setMcpConsoleLog(consoleLog != null
            && ("true".equalsIgnoreCase(consoleLog.trim()) || "1".equals(consoleLog.trim())));
        return config;
    }

    /**
     * KEY=VALUE lines. Blank lines and # comments are skipped, "export " is allowed, and one pair of
     * matching quotes around the value is removed.
     */
    static Map<String, String> parseEnvFile(List<String> lines) {
        Map<String, String> out = new LinkedHashMap<>();
        for (String raw : lines) {
            String line = raw.trim();
            if (line.isEmpty() || line.startsWith("#")) continue;
            if (line.startsWith("export ")) line = line.substring("export ".length()).trim();
            int eq = line.indexOf('=');
            if (eq <= 0) continue;
            String key = line.substring(0, eq).trim();
            String value = line.substring(eq + 1).trim();
            if (value.length() >= 2) {
                char first = value.charAt(0);
                char last = value.charAt(value.length() - 1);
                if ((first == '"' || first == '\'') && first == last) {
                    value = value.substring(1, value.length() - 1);
                }
            }
            out.put(key, value);
        }
        return out;
    }
}
