package com.alvinliu.weathermcp.mcp;

import com.google.gson.JsonArray;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Tools available to clients, in registration order. Built once at startup and immutable afterwards;
 * names are unique (checked by {@link Builder#register}).
 */
public final class ToolRegistry {
    private final Map<String, Entry> byName;
    private final List<ToolDescriptor> descriptors;

    private ToolRegistry(Map<String, Entry> entries) {
        this.byName = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
        List<ToolDescriptor> list = new ArrayList<>();
        for (Entry e : entries.values()) list.add(e.descriptor);
        this.descriptors = Collections.unmodifiableList(list);
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<ToolDescriptor> descriptors() {
        return descriptors;
    }

    public Optional<Entry> find(String name) {
        return Optional.ofNullable(name != null ? byName.get(name) : null);
    }

    public int size() {
        return descriptors.size();
    }

    /** The tools/list payload array. */
    public JsonArray toJson() {
        JsonArray arr = new JsonArray();
        for (ToolDescriptor d : descriptors) arr.add(d.toJson());
        return arr;
    }

    public static final class Entry {
        private final ToolDescriptor descriptor;
        private final ToolHandler handler;

        Entry(ToolDescriptor descriptor, ToolHandler handler) {
            this.descriptor = descriptor;
            this.handler = handler;
        }

        public ToolDescriptor getDescriptor() { return descriptor; }
        public ToolHandler getHandler() { return handler; }
    }

    public static final class Builder {
        private final Map<String, Entry> entries = new LinkedHashMap<>();

        /**
         * @throws IllegalArgumentException if a tool with the same name is already registered
         */
        public Builder register(ToolDescriptor descriptor, ToolHandler handler) {
            Objects.requireNonNull(descriptor, "descriptor");
            Objects.requireNonNull(handler, "handler");
            if (entries.containsKey(descriptor.getName())) {
                throw new IllegalArgumentException("Duplicate tool name: " + descriptor.getName());
            }
            entries.put(descriptor.getName(), new Entry(descriptor, handler));
            return this;
        }

        public ToolRegistry build() {
            return new ToolRegistry(entries);
        }
    }
}
