package io.fareway.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The envelope returned for every tool call on every transport.
 * {@code error} is set iff {@code success} is false.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ToolResult(
    boolean success,
    JsonNode data,
    String error,
    Map<String, Object> metadata
) {
    public static ToolResult success(JsonNode data, Map<String, Object> metadata) {
        return new ToolResult(true, data, null, metadata == null ? Map.of() : metadata);
    }

    public static ToolResult failure(String error, long durationMs) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("duration_ms", durationMs);
        return new ToolResult(false, null, error == null || error.isBlank() ? "Unknown error" : error, metadata);
    }

    public boolean cached() {
        return metadata != null && Boolean.TRUE.equals(metadata.get("cached"));
    }
}
