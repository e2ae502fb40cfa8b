package io.fareway.core.tool;

import java.util.Map;

/**
 * What a handler produces on success: the payload plus any tool-specific metadata entries.
 */
public record ToolOutput(Object data, Map<String, Object> metadata) {
    public ToolOutput {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public static ToolOutput of(Object data) {
        return new ToolOutput(data, Map.of());
    }

    public static ToolOutput of(Object data, Map<String, Object> metadata) {
        return new ToolOutput(data, metadata);
    }
}
