package com.alvinliu.weathermcp.mcp;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds a tool's inputSchema: {"type":"object","properties":{...},"required":[...]}.
 * Advisory metadata for clients; nothing validates arguments against it.
 */
public class ToolSchema {
    private final Map<String, JsonObject> properties = new LinkedHashMap<>();
    private final List<String> required = new ArrayList<>();

    public static ToolSchema object() {
        return new ToolSchema();
    }

    public ToolSchema property(Property property) {
        if (properties.containsKey(property.name)) {
            throw new IllegalArgumentException("Duplicate schema property: " + property.name);
        }
        properties.put(property.name, property.toJson());
        if (property.required) required.add(property.name);
        return this;
    }

    public JsonObject toJson() {
        JsonObject schema = new JsonObject();
        schema.addProperty("type", "object");
        JsonObject props = new JsonObject();
        properties.forEach((name, p) -> props.add(name, p.deepCopy()));
        schema.add("properties", props);
        JsonArray req = new JsonArray();
        required.forEach(req::add);
        schema.add("required", req);
        return schema;
    }

    public static Property prop(String name, String type, String description) {
        return new Property(name, type, description);
    }

    /** One entry under "properties". */
    public static class Property {
        private final String name;
        private final String type;
        private final String description;
        private List<String> enumValues;
        private Object defaultValue;
        private Number minimum;
        private Number maximum;
        private boolean required;

        Property(String name, String type, String description) {
            this.name = name;
            this.type = type;
            this.description = description;
        }

        public Property required() {
            this.required = true;
            return this;
        }

        public Property enumValues(String... values) {
            this.enumValues = List.of(values);
            return this;
        }

        /** String, Number or Boolean. */
        public Property defaultValue(Object value) {
            if (!(value instanceof String || value instanceof Number || value instanceof Boolean)) {
                throw new IllegalArgumentException("Unsupported default for " + name + ": " + value);
            }
            this.defaultValue = value;
            return this;
        }

        public Property range(Number minimum, Number maximum) {
            this.minimum = minimum;
            this.maximum = maximum;
            return this;
        }

        JsonObject toJson() {
            JsonObject p = new JsonObject();
            p.addProperty("type", type);
            p.addProperty("description", description);
            if (enumValues != null) {
                JsonArray arr = new JsonArray();
                enumValues.forEach(arr::add);
                p.add("enum", arr);
            }
            if (defaultValue instanceof String) p.addProperty("default", (String) defaultValue);
            else if (defaultValue instanceof Number) p.addProperty("default", (Number) defaultValue);
            else if (defaultValue instanceof Boolean) p.addProperty("default", (Boolean) defaultValue);
            if (minimum != null) p.addProperty("minimum", minimum);
            if (maximum != null) p.addProperty("maximum", maximum);
            return p;
        }
    }
}
