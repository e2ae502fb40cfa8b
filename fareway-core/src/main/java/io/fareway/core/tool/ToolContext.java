package io.fareway.core.tool;

import io.fareway.core.model.Deadline;

public record ToolContext(String toolName, Deadline deadline) {
}
