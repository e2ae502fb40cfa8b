package io.fareway.core.tool;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Fixed catalogue of tools. Filled once at start-up and read-only afterwards, so concurrent
 * lookups need no locking.
 */
public final class ToolRegistry {
    private volatile Map<String, ToolDefinition> tools = Map.of();
    private boolean registered;

    public synchronized void register(List<ToolDefinition> definitions) {
        if (registered) {
            throw new IllegalStateException("Tools are already registered");
        }
        Map<String, ToolDefinition> byName = new LinkedHashMap<>();
        for (ToolDefinition definition : definitions) {
            if (byName.putIfAbsent(definition.name(), definition) != null) {
                throw new IllegalStateException("Duplicate tool name: " + definition.name());
            }
        }
        registered = true;
        tools = Collections.unmodifiableMap(byName);
    }

    public Optional<ToolDefinition> lookup(String name) {
        return Optional.ofNullable(name == null ? null : tools.get(name));
    }

    public List<ToolDescriptor> listAll() {
        List<ToolDescriptor> all = new ArrayList<>();
        for (ToolDefinition definition : tools.values()) {
            all.add(definition.descriptor());
        }
        return all;
    }

    public int size() {
        return tools.size();
    }
}
