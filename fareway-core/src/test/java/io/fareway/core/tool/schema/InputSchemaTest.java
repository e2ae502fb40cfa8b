package io.fareway.core.tool.schema;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class InputSchemaTest {

    @Test
    void shouldRenderJsonSchema() {
        InputSchema schema = InputSchema.builder()
            .requiredUuid("course_id", "UUID of the golf course")
            .optionalEnum("budget_tier", "Budget", "budget", "luxury")
            .integerWithDefault("limit", "Maximum number of results", 10)
            .optionalStringArray("amenities", "Required amenities")
            .build();

        Map<String, Object> json = schema.toJsonSchema();

        assertThat(json).containsEntry("type", "object").containsEntry("required", List.of("course_id"));
        @SuppressWarnings("unchecked")
        Map<String, Map<String, Object>> properties = (Map<String, Map<String, Object>>) json.get("properties");
        assertThat(properties).containsOnlyKeys("course_id", "budget_tier", "limit", "amenities");
        assertThat(properties.get("course_id")).containsEntry("type", "string").containsEntry("format", "uuid");
        assertThat(properties.get("budget_tier")).containsEntry("enum", List.of("budget", "luxury"));
        assertThat(properties.get("limit")).containsEntry("type", "integer").containsEntry("default", 10L);
        assertThat(properties.get("amenities")).containsEntry("type", "array").containsEntry("items", Map.of("type", "string"));
    }

    @Test
    void shouldRejectDuplicateFields() {
        assertThatThrownBy(() -> InputSchema.builder().optionalString("region", "a").optionalString("region", "b"))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldRejectRequiredFieldWithDefault() {
        assertThatThrownBy(() -> new FieldSpec("limit", FieldType.INTEGER, true, 5L, List.of(), null, null))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
