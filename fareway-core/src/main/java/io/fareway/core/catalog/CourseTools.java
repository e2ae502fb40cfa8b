package io.fareway.core.catalog;

import io.fareway.core.store.Query;
import io.fareway.core.store.RecordStore;
import io.fareway.core.store.RecordStoreException;
import io.fareway.core.tool.CachePolicy;
import io.fareway.core.tool.ToolArguments;
import io.fareway.core.tool.ToolContext;
import io.fareway.core.tool.ToolDefinition;
import io.fareway.core.tool.ToolExecutionException;
import io.fareway.core.tool.ToolOutput;
import io.fareway.core.tool.schema.InputSchema;
import java.util.List;
import java.util.Map;

public final class CourseTools {
    static final String TABLE = "golf_courses";
    static final String PRICE = "green_fee_standard_cents";

    private static final String[] LIST_COLUMNS = {
        "id", "name", "region", "course_type", "rating", "difficulty_level",
        PRICE, "description", "location", "features", "created_at"
    };
    private static final String[] RECOMMENDED_COLUMNS = {
        "id", "name", "region", "course_type", "rating", "difficulty_level",
        PRICE, "description", "features"
    };

    private final RecordStore store;

    public CourseTools(RecordStore store) {
        this.store = store;
    }

    public List<ToolDefinition> definitions() {
        return List.of(
            new ToolDefinition(
                "search_courses",
                "Search for golf courses by region, type, and price range. Returns a list of courses with basic information.",
                InputSchema.builder()
                    .optionalString("region", "Region to search (e.g., \"Southwest Ireland\")")
                    .optionalEnum("course_type", "Course type", "links", "parkland", "resort", "heathland")
                    .optionalInteger("min_price_cents", "Minimum price in cents")
                    .optionalInteger("max_price_cents", "Maximum price in cents")
                    .integerWithDefault("limit", "Maximum number of results", 20)
                    .build(),
                this::searchCourses,
                CachePolicy.withDefaultTtl("courses:search")
            ),
            new ToolDefinition(
                "get_course_details",
                "Get comprehensive details about a specific golf course including pricing, features, and contact information.",
                InputSchema.builder()
                    .requiredUuid("course_id", "UUID of the golf course")
                    .build(),
                this::courseDetails,
                CachePolicy.withDefaultTtl("course:details")
            ),
            new ToolDefinition(
                "get_recommended_courses",
                "Get recommended courses for a region based on budget tier (budget/standard/luxury). Returns top-rated courses in price range.",
                InputSchema.builder()
                    .requiredString("region", "Target region")
                    .requiredEnum("budget_tier", "Budget category", PriceTier.wireNames())
                    .integerWithDefault("limit", "Maximum number of results", 10)
                    .build(),
                this::recommendedCourses,
                CachePolicy.withDefaultTtl("courses:recommended")
            ),
            new ToolDefinition(
                "find_course_by_name",
                "Find courses by name using fuzzy search. Useful when user mentions specific course names.",
                InputSchema.builder()
                    .requiredString("course_name", "Full or partial course name")
                    .integerWithDefault("limit", "Maximum number of results", 10)
                    .build(),
                this::findByName,
                CachePolicy.none()
            )
        );
    }

    private ToolOutput searchCourses(ToolArguments args, ToolContext context) throws RecordStoreException {
        Query.Builder query = Query.from(TABLE).columns(LIST_COLUMNS);
        args.optionalString("region").ifPresent(region -> query.containsIgnoreCase("region", region));
        args.optionalString("course_type").ifPresent(type -> query.eq("course_type", type));
        args.optionalLong("min_price_cents").ifPresent(min -> query.gte(PRICE, min));
        args.optionalLong("max_price_cents").ifPresent(max -> query.lte(PRICE, max));
        query.orderBy("rating", true).limit(ResultLimits.of(args));
        return ToolOutput.of(store.select(query.build(), context.deadline()));
    }

    private ToolOutput courseDetails(ToolArguments args, ToolContext context)
        throws RecordStoreException, ToolExecutionException {
        String id = args.string("course_id");
        Map<String, Object> course = store.selectOne(TABLE, id, context.deadline())
            .orElseThrow(() -> new ToolExecutionException("Course not found: " + id));
        return ToolOutput.of(course);
    }

    private ToolOutput recommendedCourses(ToolArguments args, ToolContext context) throws RecordStoreException {
        PriceTier tier = PriceTier.fromWire(args.string("budget_tier"));
        Query.Builder query = Query.from(TABLE)
            .columns(RECOMMENDED_COLUMNS)
            .containsIgnoreCase("region", args.string("region"));
        tier.applyTo(query, PRICE)
            .orderBy("rating", true)
            .limit(ResultLimits.of(args));
        List<Map<String, Object>> rows = store.select(query.build(), context.deadline());
        return ToolOutput.of(rows, Map.of("budget_tier", tier.wireName()));
    }

    private ToolOutput findByName(ToolArguments args, ToolContext context) throws RecordStoreException {
        Query query = Query.from(TABLE)
            .columns("id", "name", "region", "course_type", PRICE)
            .containsIgnoreCase("name", args.string("course_name"))
            .limit(ResultLimits.of(args))
            .build();
        return ToolOutput.of(store.select(query, context.deadline()));
    }
}
