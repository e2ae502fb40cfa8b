package io.fareway.core.tool;

import java.util.List;
import java.util.Optional;
import java.util.SortedMap;

/**
 * Validated arguments of one call. Values carry the canonical types produced by
 * {@link io.fareway.core.tool.schema.SchemaValidator}.
 */
public final class ToolArguments {
    private final SortedMap<String, Object> values;

    public ToolArguments(SortedMap<String, Object> values) {
        this.values = values;
    }

    public Optional<String> optionalString(String name) {
        return Optional.ofNullable((String) values.get(name));
    }

    public String string(String name) {
        return optionalString(name).orElseThrow(() -> missing(name));
    }

    public Optional<Long> optionalLong(String name) {
        return Optional.ofNullable((Long) values.get(name));
    }

    public long longValue(String name) {
        return optionalLong(name).orElseThrow(() -> missing(name));
    }

    @SuppressWarnings("unchecked")
    public List<String> stringList(String name) {
        Object value = values.get(name);
        return value == null ? List.of() : (List<String>) value;
    }

    private IllegalStateException missing(String name) {
        return new IllegalStateException("Argument '" + name + "' was not validated");
    }
}
