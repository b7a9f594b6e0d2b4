package com.alvinliu.weathermcp.mcp;

import com.alvinliu.weathermcp.config.Config;
import com.alvinliu.weathermcp.log.ConsoleLog;
import com.alvinliu.weathermcp.weather.FetchError;
import com.alvinliu.weathermcp.weather.FetchResult;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;

import java.io.IOException;
import java.io.StringReader;
import java.util.Optional;

/**
 * MCP method dispatch over JSON-RPC 2.0: initialize, tools/list, tools/call, ping.
 * Each call to {@link #handle} is independent; the only shared state is the immutable tool registry.
 * Calls made before initialize are served as well.
 */
public class ProtocolEngine implements MessageHandler {
    public static final String PROTOCOL_VERSION = "2024-11-05";
    public static final String SERVER_NAME = "weather-server";
    public static final String SERVER_VERSION = "1.0.0";

    static final String PARSE_ERROR_LINE =
        "{\"jsonrpc\":\"2.0\",\"id\":null,\"error\":{\"code\":-32700,\"message\":\"Parse error\"}}";
    static final String INTERNAL_ERROR_LINE =
        "{\"jsonrpc\":\"2.0\",\"id\":null,\"error\":{\"code\":-32603,\"message\":\"Internal error\"}}";

    private static final TypeAdapter<JsonElement> ELEMENT_ADAPTER = JsonRpc.GSON.getAdapter(JsonElement.class);

    private final ToolRegistry registry;
    private final ConsoleLog log;

    public ProtocolEngine(ToolRegistry registry, ConsoleLog log) {
        this.registry = registry;
        this.log = log;
    }

    @Override
    public Optional<String> handle(String rawLine) {
        JsonObject message;
        try {
            message = parseObject(rawLine);
        } catch (IOException | JsonParseException | IllegalStateException e) {
            log.verbose("Parse error: " + e.getMessage());
            return Optional.of(PARSE_ERROR_LINE);
        }

        IncomingMessage incoming = IncomingMessage.from(message);
        if (incoming instanceof IncomingMessage.Notification) {
            onNotification((IncomingMessage.Notification) incoming);
            return Optional.empty();
        }
        IncomingMessage.Request request = (IncomingMessage.Request) incoming;

        JsonObject response;
        try {
            response = dispatch(request);
        } catch (RuntimeException e) {
            log.error("Handling " + request.getMethod() + " failed", e);
            response = JsonRpc.error(request.getId(), JsonRpc.INTERNAL_ERROR, "Internal error: " + detail(e));
        }
        if (response == null) {
            return Optional.empty();
        }
        return Optional.of(serialize(response, request.getId()));
    }

    /** Strict RFC 8259 parse of exactly one JSON object; anything else is a parse error. */
    private static JsonObject parseObject(String line) throws IOException {
        JsonReader reader = new JsonReader(new StringReader(line));
        reader.setLenient(false);
        JsonElement element = ELEMENT_ADAPTER.read(reader);
        if (reader.peek() != JsonToken.END_DOCUMENT) {
            throw new JsonParseException("Trailing data after JSON value");
        }
        if (element == null || !element.isJsonObject()) {
            throw new JsonParseException("Message is not a JSON object");
        }
        return element.getAsJsonObject();
    }

    private JsonObject dispatch(IncomingMessage.Request request) {
        String method = request.getMethod();
        JsonElement id = request.getId();
        if ("initialize".equals(method)) {
            return JsonRpc.result(id, initialize(request.getParams()));
        } else if ("notifications/initialized".equals(method) || "initialized".equals(method)) {
            // notification by contract, even when a client attaches an id
            return null;
        } else if ("tools/list".equals(method)) {
            JsonObject result = new JsonObject();
            result.add("tools", registry.toJson());
            return JsonRpc.result(id, result);
        } else if ("tools/call".equals(method)) {
            return callTool(id, request.getParams());
        } else if ("ping".equals(method)) {
            return JsonRpc.result(id, new JsonObject());
        }
        return JsonRpc.error(id, JsonRpc.METHOD_NOT_FOUND, "Unknown method: " + method);
    }

    private JsonObject initialize(JsonObject params) {
        JsonElement clientInfo = params.get("clientInfo");
        if (clientInfo != null && clientInfo.isJsonObject()) {
            JsonObject ci = clientInfo.getAsJsonObject();
            log.verbose("initialize from " + stringOr(ci, "name", "unknown client") + " " + stringOr(ci, "version", "")
                + ", protocol " + stringOr(params, "protocolVersion", "unspecified"));
        }
        JsonObject capabilities = new JsonObject();
        capabilities.add("tools", new JsonObject());

        JsonObject serverInfo = new JsonObject();
        serverInfo.addProperty("name", SERVER_NAME);
        serverInfo.addProperty("version", SERVER_VERSION);

        JsonObject result = new JsonObject();
        result.addProperty("protocolVersion", PROTOCOL_VERSION);
        result.add("capabilities", capabilities);
        result.add("serverInfo", serverInfo);
        return result;
    }

    private JsonObject callTool(JsonElement id, JsonObject params) {
        String name = stringOr(params, "name", "");
        JsonElement a = params.get("arguments");
        JsonObject arguments = a != null && a.isJsonObject() ? a.getAsJsonObject() : new JsonObject();

        Optional<ToolRegistry.Entry> tool = registry.find(name);
        if (tool.isEmpty()) {
            return JsonRpc.error(id, JsonRpc.METHOD_NOT_FOUND, "Unknown tool: " + name);
        }

        FetchResult result;
        try {
            result = tool.get().getHandler().call(arguments.deepCopy());
        } catch (RuntimeException e) {
            log.error("Tool " + name + " threw", e);
            return JsonRpc.error(id, JsonRpc.INTERNAL_ERROR, "Tool " + name + " failed: " + detail(e));
        }
        if (result == null) {
            return JsonRpc.error(id, JsonRpc.INTERNAL_ERROR, "Tool " + name + " returned no result");
        }
        if (!result.isSuccess()) {
            log.verbose("Tool " + name + " failed: " + result.getError());
            return JsonRpc.error(id, JsonRpc.INTERNAL_ERROR, "Tool " + name + " failed: " + describe(result.getError()));
        }
        log.verbose("Tool " + name + " ok");

        JsonObject content = new JsonObject();
        content.addProperty("type", "text");
        content.addProperty("text", result.getText());
        JsonArray contents = new JsonArray();
        contents.add(content);
        JsonObject payload = new JsonObject();
        payload.add("content", contents);
        return JsonRpc.result(id, payload);
    }

    /** Human-readable text for each failure kind. */
    static String describe(FetchError error) {
        String detail = error.getDetail();
        switch (error.getKind()) {
            case MISSING_CREDENTIAL:
                return "API key not configured; set " + Config.KEY_API_KEY;
            case EMPTY_LOCATION:
                return "No location provided";
            case INVALID_ARGUMENT:
                return "Invalid argument: " + detail;
            case NOT_FOUND:
                return "Location '" + detail + "' not found";
            case HTTP_ERROR:
                return "Weather API returned HTTP " + error.getStatus() + (detail.isEmpty() ? "" : " - " + detail);
            case NETWORK_FAILURE:
                return "Network failure: " + detail;
            case MALFORMED_RESPONSE:
                return "Unexpected weather API response: " + detail;
            default:
                throw new IllegalStateException("Unhandled fetch error kind: " + error.getKind());
        }
    }

    private void onNotification(IncomingMessage.Notification notification) {
        String method = notification.getMethod();
        if ("notifications/initialized".equals(method) || "initialized".equals(method)) {
            log.verbose("Client initialized");
        } else if ("notifications/cancelled".equals(method)) {
            log.verbose("Client cancelled request " + notification.getParams().get("requestId"));
        } else {
            log.verbose("Ignoring notification " + method);
        }
    }

    private String serialize(JsonObject response, JsonElement id) {
        try {
            return JsonRpc.toLine(response);
        } catch (RuntimeException e) {
            log.error("Serializing response failed", e);
            try {
                return JsonRpc.toLine(JsonRpc.error(id, JsonRpc.INTERNAL_ERROR, "Internal error: " + detail(e)));
            } catch (RuntimeException again) {
                log.error("Serializing error response failed", again);
                return INTERNAL_ERROR_LINE;
            }
        }
    }

    private static String stringOr(JsonObject obj, String key, String fallback) {
        JsonElement e = obj.get(key);
        if (e != null && e.isJsonPrimitive() && e.getAsJsonPrimitive().isString()) return e.getAsString();
        return fallback;
    }

    private static String detail(Throwable t) {
        return t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
    }
}
