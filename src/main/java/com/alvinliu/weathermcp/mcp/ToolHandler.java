package com.alvinliu.weathermcp.mcp;

import com.alvinliu.weathermcp.weather.FetchResult;
import com.google.gson.JsonObject;

/**
 * Runs one tool. Reads, defaults and validates its own arguments; failures come back as a FetchResult.
 */
@FunctionalInterface
public interface ToolHandler {
    FetchResult call(JsonObject arguments);
}
