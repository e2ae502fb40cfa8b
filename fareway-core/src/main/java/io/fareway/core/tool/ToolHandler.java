package io.fareway.core.tool;

@FunctionalInterface
public interface ToolHandler {
    ToolOutput handle(ToolArguments arguments, ToolContext context) throws Exception;
}
