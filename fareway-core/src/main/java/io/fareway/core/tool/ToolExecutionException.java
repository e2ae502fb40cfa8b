package io.fareway.core.tool;

public final class ToolExecutionException extends Exception {
    public ToolExecutionException(String message) {
        super(message);
    }
}
