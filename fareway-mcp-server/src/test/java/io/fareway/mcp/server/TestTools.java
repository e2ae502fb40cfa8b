package io.fareway.mcp.server;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.fareway.core.cache.NoopResponseCache;
import io.fareway.core.tool.CachePolicy;
import io.fareway.core.tool.ToolDefinition;
import io.fareway.core.tool.ToolDispatcher;
import io.fareway.core.tool.ToolOutput;
import io.fareway.core.tool.ToolRegistry;
import io.fareway.core.tool.schema.InputSchema;
import java.util.List;
import java.util.Map;

final class TestTools {
    private TestTools() {
    }

    static ToolDispatcher dispatcher(ObjectMapper mapper) {
        ToolRegistry registry = new ToolRegistry();
        registry.register(List.of(
            new ToolDefinition(
                "search_courses",
                "Search for golf courses by region",
                InputSchema.builder()
                    .optionalString("region", "Region to search")
                    .integerWithDefault("limit", "Maximum number of results", 20)
                    .build(),
                (args, context) -> ToolOutput.of(List.of(
                    Map.of("name", "Old Head Golf Links", "region", args.optionalString("region").orElse("any"))
                )),
                CachePolicy.none()
            ),
            new ToolDefinition(
                "get_course_details",
                "Get details about a specific golf course",
                InputSchema.builder().requiredUuid("course_id", "UUID of the golf course").build(),
                (args, context) -> {
                    throw new IllegalStateException("Course not found: " + args.string("course_id"));
                },
                CachePolicy.none()
            )
        ));
        return new ToolDispatcher(registry, new NoopResponseCache(), mapper, 300);
    }
}
