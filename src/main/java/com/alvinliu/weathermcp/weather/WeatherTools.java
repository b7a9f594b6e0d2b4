package com.alvinliu.weathermcp.weather;

import com.alvinliu.weathermcp.mcp.ToolDescriptor;
import com.alvinliu.weathermcp.mcp.ToolRegistry;
import com.alvinliu.weathermcp.mcp.ToolSchema;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

import static com.alvinliu.weathermcp.mcp.ToolSchema.prop;

/**
 * The weather tools: get_weather and get_weather_forecast. Reads tool arguments, applies defaults
 * (units=metric, days=5), rejects values outside the advertised schema, then calls the {@link WeatherService}.
 */
public class WeatherTools {
    public static final String GET_WEATHER = "get_weather";
    public static final String GET_WEATHER_FORECAST = "get_weather_forecast";

    private final WeatherService service;

    public WeatherTools(WeatherService service) {
        this.service = service;
    }

    public static ToolRegistry registry(WeatherService service) {
        return new WeatherTools(service).registerAll(ToolRegistry.builder()).build();
    }

    public ToolRegistry.Builder registerAll(ToolRegistry.Builder builder) {
        builder.register(new ToolDescriptor(
            GET_WEATHER,
            "Get current weather for a location: temperature, feels-like, conditions, humidity, wind speed and pressure.",
            ToolSchema.object()
                .property(prop("location", "string", "City name (e.g., 'London', 'New York', 'Jakarta')").required())
                .property(unitsProperty())
                .toJson()
        ), this::getWeather);
        builder.register(new ToolDescriptor(
            GET_WEATHER_FORECAST,
            "Get a daily weather forecast (up to 5 days) for a location: min/max temperature, conditions and humidity per day.",
            ToolSchema.object()
                .property(prop("location", "string", "City name (e.g., 'London', 'New York', 'Jakarta')").required())
                .property(prop("days", "number", "Number of days to forecast (1-5)")
                    .range(WeatherOptions.MIN_DAYS, WeatherOptions.MAX_DAYS)
                    .defaultValue(WeatherOptions.DEFAULT_DAYS))
                .property(unitsProperty())
                .toJson()
        ), this::getWeatherForecast);
        return builder;
    }

    private static ToolSchema.Property unitsProperty() {
        return prop("units", "string", "Temperature units (metric for Celsius, imperial for Fahrenheit, kelvin for Kelvin)")
            .enumValues("metric", "imperial", "kelvin")
            .defaultValue("metric");
    }

    FetchResult getWeather(JsonObject args) {
        String location;
        WeatherOptions.Units units;
        try {
            location = location(args);
            units = units(args);
        } catch (IllegalArgumentException e) {
            return FetchResult.failure(FetchError.invalidArgument(e.getMessage()));
        }
        return service.currentWeather(location, new WeatherOptions(units, WeatherOptions.DEFAULT_DAYS));
    }

    FetchResult getWeatherForecast(JsonObject args) {
        String location;
        WeatherOptions.Units units;
        int days;
        try {
            location = location(args);
            units = units(args);
            days = days(args);
        } catch (IllegalArgumentException e) {
            return FetchResult.failure(FetchError.invalidArgument(e.getMessage()));
        }
        return service.forecast(location, new WeatherOptions(units, days));
    }

    /** Missing location reads as "" so the service reports EMPTY_LOCATION. */
    private static String location(JsonObject args) {
        JsonElement e = args.get("location");
        if (e == null || e.isJsonNull()) return "";
        if (!e.isJsonPrimitive()) throw new IllegalArgumentException("location must be a string");
        return e.getAsString();
    }

    private static WeatherOptions.Units units(JsonObject args) {
        JsonElement e = args.get("units");
        if (e == null || e.isJsonNull()) return WeatherOptions.Units.METRIC;
        if (!e.isJsonPrimitive() || !e.getAsJsonPrimitive().isString()) {
            throw new IllegalArgumentException("units must be a string");
        }
        WeatherOptions.Units units = WeatherOptions.Units.fromArg(e.getAsString());
        if (units == null) {
            throw new IllegalArgumentException("units must be one of metric, imperial, kelvin, got '" + e.getAsString() + "'");
        }
        return units;
    }

    private static int days(JsonObject args) {
        JsonElement e = args.get("days");
        if (e == null || e.isJsonNull()) return WeatherOptions.DEFAULT_DAYS;
        if (!e.isJsonPrimitive() || !e.getAsJsonPrimitive().isNumber()) {
            throw new IllegalArgumentException("days must be a number");
        }
        double d = e.getAsDouble();
        if (d != Math.rint(d) || d < WeatherOptions.MIN_DAYS || d > WeatherOptions.MAX_DAYS) {
            throw new IllegalArgumentException("days must be a whole number between "
                + WeatherOptions.MIN_DAYS + " and " + WeatherOptions.MAX_DAYS + ", got " + e.getAsString());
        }
        return (int) d;
    }
}
