package io.fareway.core.tool;

import io.fareway.core.tool.schema.InputSchema;
import java.util.Objects;

public record ToolDefinition(
    String name,
    String description,
    InputSchema inputSchema,
    ToolHandler handler,
    CachePolicy cachePolicy
) {
    public ToolDefinition {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Tool name must not be blank");
        }
        Objects.requireNonNull(inputSchema, "inputSchema must not be null");
        Objects.requireNonNull(handler, "handler must not be null");
        description = description == null ? "" : description;
        cachePolicy = cachePolicy == null ? CachePolicy.none() : cachePolicy;
    }

    public ToolDescriptor descriptor() {
        return new ToolDescriptor(name, description, inputSchema.toJsonSchema());
    }
}
