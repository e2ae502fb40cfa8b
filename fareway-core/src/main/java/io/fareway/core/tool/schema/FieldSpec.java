package io.fareway.core.tool.schema;

import java.util.List;
import java.util.Objects;

/**
 * Declaration of one input field. {@code allowedValues} is empty when the field is not an
 * enumeration; {@code format} is {@code null} or {@code "uuid"}.
 */
public record FieldSpec(
    String name,
    FieldType type,
    boolean required,
    Object defaultValue,
    List<String> allowedValues,
    String description,
    String format
) {
    public static final String UUID_FORMAT = "uuid";

    public FieldSpec {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(type, "type must not be null");
        allowedValues = allowedValues == null ? List.of() : List.copyOf(allowedValues);
        if (required && defaultValue != null) {
            throw new IllegalArgumentException("Field '" + name + "' cannot be required and have a default");
        }
    }

    public boolean enumerated() {
        return !allowedValues.isEmpty();
    }
}
