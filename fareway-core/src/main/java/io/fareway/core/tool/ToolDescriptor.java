package io.fareway.core.tool;

import java.util.Map;

/**
 * Catalogue entry advertised by both transports.
 */
public record ToolDescriptor(String name, String description, Map<String, Object> inputSchema) {
}
