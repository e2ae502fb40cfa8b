package io.fareway.core.tool.schema;

public final class ToolArgumentException extends Exception {
    private final String field;

    public ToolArgumentException(String field, String problem) {
        super("invalid argument '" + field + "': " + problem);
        this.field = field;
    }

    public String field() {
        return field;
    }
}
