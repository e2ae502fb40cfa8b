package io.fareway.core.catalog;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
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
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

public final class AccommodationTools {
    static final String TABLE = "accommodations";
    static final String PRICE = "standard_rate_cents";

    private static final TypeReference<List<Object>> JSON_LIST = new TypeReference<>() {
    };
    private static final String[] LIST_COLUMNS = {
        "id", "name", "type", "region", "rating", PRICE, "description", "amenities", "location"
    };

    private final RecordStore store;
    private final ObjectMapper mapper;

    public AccommodationTools(RecordStore store, ObjectMapper mapper) {
        this.store = store;
        this.mapper = mapper;
    }

    public List<ToolDefinition> definitions() {
        return List.of(
            new ToolDefinition(
                "search_accommodations",
                "Search for hotels and accommodations by region, amenities, and price range.",
                InputSchema.builder()
                    .optionalString("region", "Region to search")
                    .optionalUuid("near_course_id", "Find hotels near this course")
                    .optionalInteger("min_price_cents", "Minimum nightly rate in cents")
                    .optionalInteger("max_price_cents", "Maximum nightly rate in cents")
                    .optionalStringArray("amenities", "Required amenities")
                    .integerWithDefault("limit", "Maximum number of results", 20)
                    .build(),
                this::searchAccommodations,
                CachePolicy.withDefaultTtl("accommodations:search")
            ),
            new ToolDefinition(
                "get_accommodation_details",
                "Get detailed information about a specific accommodation including rooms, amenities, and rates.",
                InputSchema.builder()
                    .requiredUuid("accommodation_id", "UUID of the accommodation")
                    .build(),
                this::accommodationDetails,
                CachePolicy.withDefaultTtl("accommodation:details")
            ),
            new ToolDefinition(
                "get_golf_resorts",
                "Find golf resorts (accommodations with on-site golf courses) perfect for stay-and-play packages.",
                InputSchema.builder()
                    .optionalString("region", "Region to search")
                    .build(),
                this::golfResorts,
                CachePolicy.withDefaultTtl("resorts")
            )
        );
    }

    private ToolOutput searchAccommodations(ToolArguments args, ToolContext context)
        throws RecordStoreException, ToolExecutionException {
        Optional<String> region = args.optionalString("region");
        if (region.isEmpty() && args.optionalString("near_course_id").isPresent()) {
            region = Optional.of(courseRegion(args.string("near_course_id"), context));
        }

        Query.Builder query = Query.from(TABLE).columns(LIST_COLUMNS);
        region.ifPresent(value -> query.containsIgnoreCase("region", value));
        args.optionalLong("min_price_cents").ifPresent(min -> query.gte(PRICE, min));
        args.optionalLong("max_price_cents").ifPresent(max -> query.lte(PRICE, max));
        query.orderBy("rating", true);
        int limit = ResultLimits.of(args);
        List<String> required = args.stringList("amenities");
        if (required.isEmpty()) {
            query.limit(limit);
            return ToolOutput.of(store.select(query.build(), context.deadline()));
        }

        // Amenities are matched here, so the store must return every candidate before the limit applies.
        List<Map<String, Object>> rows = store.select(query.build(), context.deadline());
        Set<String> wanted = lowerCase(required);
        List<Map<String, Object>> matching = new ArrayList<>();
        for (Map<String, Object> row : rows) {
            if (matching.size() == limit) {
                break;
            }
            if (amenitiesOf(row).containsAll(wanted)) {
                matching.add(row);
            }
        }
        return ToolOutput.of(matching);
    }

    private ToolOutput accommodationDetails(ToolArguments args, ToolContext context)
        throws RecordStoreException, ToolExecutionException {
        String id = args.string("accommodation_id");
        Map<String, Object> accommodation = store.selectOne(TABLE, id, context.deadline())
            .orElseThrow(() -> new ToolExecutionException("Accommodation not found: " + id));
        return ToolOutput.of(accommodation);
    }

    private ToolOutput golfResorts(ToolArguments args, ToolContext context) throws RecordStoreException {
        Query.Builder query = Query.from(TABLE).eq("is_golf_resort", true);
        args.optionalString("region").ifPresent(region -> query.containsIgnoreCase("region", region));
        return ToolOutput.of(store.select(query.build(), context.deadline()));
    }

    private String courseRegion(String courseId, ToolContext context) throws RecordStoreException, ToolExecutionException {
        Map<String, Object> course = store.selectOne(CourseTools.TABLE, courseId, context.deadline())
            .orElseThrow(() -> new ToolExecutionException("Course not found: " + courseId));
        Object region = course.get("region");
        if (region == null || String.valueOf(region).isBlank()) {
            throw new ToolExecutionException("Course " + courseId + " has no region");
        }
        return String.valueOf(region);
    }

    // Amenities arrive as a JSON array from PostgREST and as JSON or comma separated text from JDBC.
    private Set<String> amenitiesOf(Map<String, Object> row) {
        Object raw = row.get("amenities");
        List<?> items;
        if (raw instanceof List<?> list) {
            items = list;
        } else if (raw instanceof String text && text.trim().startsWith("[")) {
            try {
                items = mapper.readValue(text, JSON_LIST);
            } catch (JsonProcessingException e) {
                items = List.of();
            }
        } else if (raw instanceof String text) {
            items = List.of(text.split(","));
        } else {
            items = List.of();
        }
        Set<String> amenities = new HashSet<>();
        for (Object item : items) {
            amenities.add(String.valueOf(item).trim().toLowerCase(Locale.ROOT));
        }
        return amenities;
    }

    private static Set<String> lowerCase(List<String> values) {
        Set<String> out = new HashSet<>();
        for (String value : values) {
            out.add(value.trim().toLowerCase(Locale.ROOT));
        }
        return out;
    }
}
