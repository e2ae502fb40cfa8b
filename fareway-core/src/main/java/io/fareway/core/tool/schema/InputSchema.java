package io.fareway.core.tool.schema;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Declarative description of a tool's arguments. {@link SchemaValidator} renders it into a
 * validator and {@link #toJsonSchema()} renders the advertised form, so both views are derived
 * from the same field list.
 */
public final class InputSchema {
    private final List<FieldSpec> fields;

    private InputSchema(List<FieldSpec> fields) {
        this.fields = List.copyOf(fields);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static InputSchema empty() {
        return new InputSchema(List.of());
    }

    public List<FieldSpec> fields() {
        return fields;
    }

    public Map<String, Object> toJsonSchema() {
        Map<String, Object> properties = new LinkedHashMap<>();
        List<String> required = new ArrayList<>();
        for (FieldSpec field : fields) {
            Map<String, Object> property = new LinkedHashMap<>();
            property.put("type", field.type().jsonType());
            if (field.type() == FieldType.STRING_ARRAY) {
                property.put("items", Map.of("type", "string"));
            }
            if (field.format() != null) {
                property.put("format", field.format());
            }
            if (field.enumerated()) {
                property.put("enum", field.allowedValues());
            }
            if (field.defaultValue() != null) {
                property.put("default", field.defaultValue());
            }
            if (field.description() != null) {
                property.put("description", field.description());
            }
            properties.put(field.name(), property);
            if (field.required()) {
                required.add(field.name());
            }
        }

        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("type", "object");
        schema.put("properties", properties);
        schema.put("required", required);
        return schema;
    }

    public static final class Builder {
        private final Map<String, FieldSpec> fields = new LinkedHashMap<>();

        public Builder requiredString(String name, String description) {
            return add(new FieldSpec(name, FieldType.STRING, true, null, List.of(), description, null));
        }

        public Builder optionalString(String name, String description) {
            return add(new FieldSpec(name, FieldType.STRING, false, null, List.of(), description, null));
        }

        public Builder requiredUuid(String name, String description) {
            return add(new FieldSpec(name, FieldType.STRING, true, null, List.of(), description, FieldSpec.UUID_FORMAT));
        }

        public Builder optionalUuid(String name, String description) {
            return add(new FieldSpec(name, FieldType.STRING, false, null, List.of(), description, FieldSpec.UUID_FORMAT));
        }

        public Builder requiredEnum(String name, String description, String... values) {
            return add(new FieldSpec(name, FieldType.STRING, true, null, List.of(values), description, null));
        }

        public Builder optionalEnum(String name, String description, String... values) {
            return add(new FieldSpec(name, FieldType.STRING, false, null, List.of(values), description, null));
        }

        public Builder optionalInteger(String name, String description) {
            return add(new FieldSpec(name, FieldType.INTEGER, false, null, List.of(), description, null));
        }

        public Builder integerWithDefault(String name, String description, long defaultValue) {
            return add(new FieldSpec(name, FieldType.INTEGER, false, defaultValue, List.of(), description, null));
        }

        public Builder optionalNumber(String name, String description) {
            return add(new FieldSpec(name, FieldType.NUMBER, false, null, List.of(), description, null));
        }

        public Builder optionalBoolean(String name, String description) {
            return add(new FieldSpec(name, FieldType.BOOLEAN, false, null, List.of(), description, null));
        }

        public Builder optionalStringArray(String name, String description) {
            return add(new FieldSpec(name, FieldType.STRING_ARRAY, false, null, List.of(), description, null));
        }

        public Builder add(FieldSpec field) {
            if (fields.putIfAbsent(field.name(), field) != null) {
                throw new IllegalArgumentException("Duplicate schema field: " + field.name());
            }
            return this;
        }

        public InputSchema build() {
            return new InputSchema(new ArrayList<>(fields.values()));
        }
    }
}
