package com.alvinliu.weathermcp.mcp;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;

/**
 * JSON-RPC 2.0 envelope builders and the error codes this server emits.
 */
public final class JsonRpc {
    public static final String VERSION = "2.0";

    public static final int PARSE_ERROR = -32700;
    public static final int METHOD_NOT_FOUND = -32601;
    public static final int INTERNAL_ERROR = -32603;

    static final Gson GSON = new GsonBuilder().serializeNulls().disableHtmlEscaping().create();

    private JsonRpc() {
    }

    public static JsonObject result(JsonElement id, JsonElement result) {
        JsonObject resp = new JsonObject();
        resp.addProperty("jsonrpc", VERSION);
        resp.add("id", id != null ? id : JsonNull.INSTANCE);
        resp.add("result", result);
        return resp;
    }

    /** One output line. Gson escapes control characters, so the text never contains a raw newline. */
    public static String toLine(JsonElement envelope) {
        return GSON.toJson(envelope);
    }

    /** id may be null (unknown); it is written as JSON null. message is stripped of control characters. */
    public static JsonObject error(JsonElement id, int code, String message) {
        JsonObject resp = new JsonObject();
        resp.addProperty("jsonrpc", VERSION);
        resp.add("id", id != null ? id : JsonNull.INSTANCE);
        JsonObject err = new JsonObject();
        err.addProperty("code", code);
        err.addProperty("message", sanitize(message));
        resp.add("error", err);
        return resp;
    }

    /**
     * Control characters and U+2028/U+2029 become spaces, so upstream text embedded in a message stays on one line.
     */
    static String sanitize(String message) {
        if (message == null) return "";
        StringBuilder sb = null;
        for (int i = 0; i < message.length(); i++) {
            char c = message.charAt(i);
            boolean bad = c < 0x20 || c == 0x7f || c == '\u2028' || c == '\u2029';
            if (bad && sb == null) {
                sb = new StringBuilder(message.length());
                sb.append(message, 0, i);
            }
            if (sb != null) sb.append(bad ? ' ' : c);
        }
        return sb != null ? sb.toString() : message;
    }
}
