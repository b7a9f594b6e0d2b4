package com.alvinliu.weathermcp.weather;

import com.alvinliu.weathermcp.config.Config;
import com.alvinliu.weathermcp.log.ConsoleLog;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * OpenWeatherMap REST client (api.openweathermap.org/data/2.5). One blocking GET per call, no retries.
 */
public class OpenWeatherClient implements WeatherService {
    private static final String USER_AGENT = "weather-mcp/1.0";

    private final Config.Weather config;
    private final HttpClient http;
    private final WeatherReportFormatter formatter;
    private final ConsoleLog log;

    public OpenWeatherClient(Config.Weather config, HttpClient http, ConsoleLog log) {
        this.config = config;
        this.http = http;
        this.formatter = new WeatherReportFormatter();
        this.log = log;
    }

    public static HttpClient defaultHttpClient(Config.Weather config) {
        return HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(config.getTimeoutSeconds()))
            .followRedirects(HttpClient.Redirect.NORMAL)
            .build();
    }

    @Override
    public FetchResult currentWeather(String location, WeatherOptions options) {
        FetchError precheck = precheck(location);
        if (precheck != null) return FetchResult.failure(precheck);
        WeatherOptions.Units units = options.getUnits();
        Fetched fetched = get("/weather", location.trim(), units);
        if (fetched.error != null) return FetchResult.failure(fetched.error);
        try {
            return FetchResult.success(formatter.formatCurrent(fetched.body, units));
        } catch (IllegalArgumentException | IllegalStateException e) {
            return FetchResult.failure(FetchError.malformedResponse(e.getMessage()));
        }
    }

    @Override
    public FetchResult forecast(String location, WeatherOptions options) {
        FetchError precheck = precheck(location);
        if (precheck != null) return FetchResult.failure(precheck);
        WeatherOptions.Units units = options.getUnits();
        Fetched fetched = get("/forecast", location.trim(), units);
        if (fetched.error != null) return FetchResult.failure(fetched.error);
        try {
            return FetchResult.success(formatter.formatForecast(fetched.body, units, options.getDays()));
        } catch (IllegalArgumentException | IllegalStateException e) {
            return FetchResult.failure(FetchError.malformedResponse(e.getMessage()));
        }
    }

    private FetchError precheck(String location) {
        if (!config.hasApiKey()) return FetchError.missingCredential();
        if (location == null || location.isBlank()) return FetchError.emptyLocation();
        return null;
    }

    private Fetched get(String path, String location, WeatherOptions.Units units) {
        String url = config.getBaseUrl() + path
            + "?q=" + URLEncoder.encode(location, StandardCharsets.UTF_8)
            + "&appid=" + URLEncoder.encode(config.getApiKey(), StandardCharsets.UTF_8)
            + "&units=" + units.getApiValue();
        HttpRequest request;
        try {
            request = HttpRequest.newBuilder(URI.create(url))
                .timeout(Duration.ofSeconds(config.getTimeoutSeconds()))
                .header("Accept", "application/json")
                .header("User-Agent", USER_AGENT)
                .GET()
                .build();
        } catch (IllegalArgumentException e) {
            return Fetched.failed(FetchError.networkFailure("invalid request URL: " + e.getMessage()));
        }

        log.verbose("GET " + path + " q=" + location + " units=" + units.getApiValue());
        HttpResponse<String> response;
        try {
            response = http.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            log.error("GET " + path + " failed", e);
            return Fetched.failed(FetchError.networkFailure(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Fetched.failed(FetchError.networkFailure("interrupted"));
        }

        int status = response.statusCode();
        if (status == 404) {
            return Fetched.failed(FetchError.notFound(location));
        }
        if (status != 200) {
            return Fetched.failed(FetchError.httpError(status, upstreamMessage(response.body())));
        }
        try {
            JsonElement body = JsonParser.parseString(response.body());
            if (!body.isJsonObject()) {
                return Fetched.failed(FetchError.malformedResponse("response is not a JSON object"));
            }
            return Fetched.ok(body.getAsJsonObject());
        } catch (JsonParseException e) {
            return Fetched.failed(FetchError.malformedResponse(e.getMessage()));
        }
    }

    /** OpenWeatherMap error bodies look like {"cod":401,"message":"Invalid API key..."}. */
    private static String upstreamMessage(String body) {
        if (body == null || body.isBlank()) return "";
        JsonElement e;
        try {
            e = JsonParser.parseString(body);
        } catch (JsonParseException notJson) {
            return truncate(body);
        }
        if (e.isJsonObject()) {
            JsonElement message = e.getAsJsonObject().get("message");
            if (message != null && message.isJsonPrimitive()) return message.getAsString();
        }
        return truncate(body);
    }

    private static String truncate(String s) {
        return s.length() > 200 ? s.substring(0, 200) : s;
    }

    private static final class Fetched {
        final JsonObject body;
        final FetchError error;

        private Fetched(JsonObject body, FetchError error) {
            this.body = body;
            this.error = error;
        }

        static Fetched ok(JsonObject body) { return new Fetched(body, null); }
        static Fetched failed(FetchError error) { return new Fetched(null, error); }
    }
}
