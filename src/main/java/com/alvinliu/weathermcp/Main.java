package com.alvinliu.weathermcp;

import com.alvinliu.weathermcp.config.Config;
import com.alvinliu.weathermcp.config.ConfigException;
import com.alvinliu.weathermcp.log.ConsoleLog;
import com.alvinliu.weathermcp.mcp.McpServer;
import com.alvinliu.weathermcp.mcp.ProtocolEngine;
import com.alvinliu.weathermcp.mcp.ToolRegistry;
import com.alvinliu.weathermcp.weather.OpenWeatherClient;
import com.alvinliu.weathermcp.weather.WeatherTools;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Entry point. Usage: java -jar weather-mcp.jar [--env-file PATH]
 * Speaks MCP on stdin/stdout; diagnostics go to stderr.
 */
public class Main {

    public static void main(String[] args) {
        Path envFile = Paths.get(".env");
        for (int i = 0; i < args.length; i++) {
            if ("--env-file".equals(args[i]) && i + 1 < args.length) {
                envFile = Paths.get(args[++i]);
            } else {
                System.err.println("[weather_mcp] usage: weather-mcp [--env-file PATH]");
                System.exit(2);
            }
        }

        Config config;
        try {
            config = Config.load(System.getenv(), envFile);
        } catch (ConfigException e) {
            System.err.println("[weather_mcp] config: " + e.getMessage());
            System.exit(1);
            return;
        }

        ConsoleLog log = new ConsoleLog(config.getLogging().isMcpConsoleLog());
        if (config.getEnvFilePath() != null) {
            log.verbose("Loaded " + config.getEnvFilePath());
        }
        if (!config.getWeather().hasApiKey()) {
            log.info(Config.KEY_API_KEY + " is not set; weather tools will return an error until it is configured");
        }

        OpenWeatherClient client = new OpenWeatherClient(config.getWeather(),
            OpenWeatherClient.defaultHttpClient(config.getWeather()), log);
        ToolRegistry registry = WeatherTools.registry(client);
        ProtocolEngine engine = new ProtocolEngine(registry, log);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> log.verbose("Shutting down"), "weather-mcp-shutdown"));
        log.info(ProtocolEngine.SERVER_NAME + " " + ProtocolEngine.SERVER_VERSION + " ready on stdio ("
            + registry.size() + " tools)");
        try {
            new McpServer(engine, log, System.in, System.out).run();
        } catch (IOException e) {
            log.error("Transport failed", e);
            System.exit(1);
        }
    }
}
