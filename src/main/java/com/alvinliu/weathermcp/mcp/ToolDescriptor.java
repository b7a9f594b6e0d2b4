package com.alvinliu.weathermcp.mcp;

import com.google.gson.JsonObject;

import java.util.Objects;

/**
 * What tools/list shows for one tool.
 */
public final class ToolDescriptor {
    private final String name;
    private final String description;
    private final JsonObject inputSchema;

    public ToolDescriptor(String name, String description, JsonObject inputSchema) {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("Tool name is required");
        this.name = name;
        this.description = Objects.requireNonNullElse(description, "");
        this.inputSchema = Objects.requireNonNull(inputSchema, "inputSchema").deepCopy();
    }

    public String getName() { return name; }
    public String getDescription() { return description; }

    /** Defensive copy; the descriptor stays immutable. */
    public JsonObject getInputSchema() { return inputSchema.deepCopy(); }

    public JsonObject toJson() {
        JsonObject t = new JsonObject();
        t.addProperty("name", name);
        t.addProperty("description", description);
        t.add("inputSchema", inputSchema.deepCopy());
        return t;
    }
}
