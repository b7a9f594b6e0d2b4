package com.alvinliu.weathermcp.weather;

/**
 * Weather data source behind the tools. Implementations report failures through the returned
 * {@link FetchResult} rather than by throwing.
 */
public interface WeatherService {

    FetchResult currentWeather(String location, WeatherOptions options);

    FetchResult forecast(String location, WeatherOptions options);
}
