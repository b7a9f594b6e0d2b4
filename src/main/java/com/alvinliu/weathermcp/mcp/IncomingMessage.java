package com.alvinliu.weathermcp.mcp;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

/**
 * A parsed client message: {@link Request} when it carries a non-null id, {@link Notification} otherwise.
 * Notifications never get a reply.
 */
public abstract class IncomingMessage {
    private final String method;
    private final JsonObject params;

    private IncomingMessage(String method, JsonObject params) {
        this.method = method;
        this.params = params;
    }

    /** Method name; empty when the message had none or it was not a string. */
    public String getMethod() { return method; }

    /** Never null; a missing or non-object params reads as {}. */
    public JsonObject getParams() { return params; }

    public static IncomingMessage from(JsonObject message) {
        String method = "";
        JsonElement m = message.get("method");
        if (m != null && m.isJsonPrimitive() && m.getAsJsonPrimitive().isString()) {
            method = m.getAsString();
        }
        JsonElement p = message.get("params");
        JsonObject params = p != null && p.isJsonObject() ? p.getAsJsonObject() : new JsonObject();
        JsonElement id = message.get("id");
        if (id == null || id.isJsonNull()) {
            return new Notification(method, params);
        }
        return new Request(id, method, params);
    }

    public static final class Request extends IncomingMessage {
        private final JsonElement id;

        Request(JsonElement id, String method, JsonObject params) {
            super(method, params);
            this.id = id;
        }

        /** Echoed unchanged in the reply. */
        public JsonElement getId() { return id; }

        @Override
        public String toString() {
            return "Request[id=" + id + ", method=" + getMethod() + "]";
        }
    }

    public static final class Notification extends IncomingMessage {
        Notification(String method, JsonObject params) {
            super(method, params);
        }

        @Override
        public String toString() {
            return "Notification[method=" + getMethod() + "]";
        }
    }
}
