package io.fareway.core.catalog;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.fareway.core.cache.NoopResponseCache;
import io.fareway.core.model.ToolResult;
import io.fareway.core.store.JdbcRecordStore;
import io.fareway.core.store.SqliteFixtures;
import io.fareway.core.tool.ToolDispatcher;
import io.fareway.core.tool.ToolRegistry;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class AccommodationToolsTest {
    private static final String COURSE_ID = "0b8e3a9c-1111-4000-8000-000000000001";
    private static final String LODGE_ID = "0b8e3a9c-2222-4000-8000-000000000001";

    @TempDir
    Path tempDir;

    private ToolDispatcher dispatcher;

    @BeforeEach
    void setUp() throws Exception {
        SqliteFixtures fixtures = SqliteFixtures.create(tempDir)
            .course(COURSE_ID, "Old Head Golf Links", "Southwest Ireland", "links", 4.9, 45_000)
            .accommodation(LODGE_ID, "Old Head Lodge", "Southwest Ireland", 4.8, 40_000, "[\"Spa\", \"wifi\"]", true)
            .accommodation("0b8e3a9c-2222-4000-8000-000000000002", "Kinsale Inn", "Southwest Ireland", 4.1, 12_000, "wifi,parking", false)
            .accommodation("0b8e3a9c-2222-4000-8000-000000000003", "Fairmont St Andrews", "Fife, Scotland", 4.6, 38_000, "[\"spa\"]", true);
        JdbcRecordStore store = new JdbcRecordStore(fixtures.jdbcUrl(), Duration.ofSeconds(5), "golf_courses");
        ToolRegistry registry = new ToolRegistry();
        registry.register(new AccommodationTools(store, new ObjectMapper()).definitions());
        dispatcher = new ToolDispatcher(registry, new NoopResponseCache(), new ObjectMapper(), 300);
    }

    @Test
    void shouldUseRegionOfNearbyCourse() {
        ToolResult result = dispatcher.execute("search_accommodations", Map.of("near_course_id", COURSE_ID));

        assertThat(result.success()).isTrue();
        assertThat(names(result.data())).containsExactly("Old Head Lodge", "Kinsale Inn");
    }

    @Test
    void shouldRequireEveryAmenityIgnoringCase() {
        ToolResult result = dispatcher.execute(
            "search_accommodations",
            Map.of("region", "Ireland", "amenities", List.of("WiFi"))
        );
        ToolResult spa = dispatcher.execute(
            "search_accommodations",
            Map.of("amenities", List.of("spa", "wifi"))
        );

        assertThat(names(result.data())).containsExactly("Old Head Lodge", "Kinsale Inn");
        assertThat(names(spa.data())).containsExactly("Old Head Lodge");
        assertThat(spa.metadata()).containsEntry("count", 1);
    }

    @Test
    void shouldFindAmenityMatchRankedBelowLimit() {
        ToolResult result = dispatcher.execute(
            "search_accommodations",
            Map.of("region", "Ireland", "amenities", List.of("parking"), "limit", 1)
        );

        assertThat(result.success()).isTrue();
        assertThat(names(result.data())).containsExactly("Kinsale Inn");
    }

    @Test
    void shouldApplyLimitAfterAmenityFilter() {
        ToolResult result = dispatcher.execute(
            "search_accommodations",
            Map.of("amenities", List.of("wifi"), "limit", 1)
        );

        assertThat(names(result.data())).containsExactly("Old Head Lodge");
        assertThat(result.metadata()).containsEntry("count", 1);
    }

    @Test
    void shouldFilterByNightlyRate() {
        ToolResult result = dispatcher.execute("search_accommodations", Map.of("max_price_cents", 38_000));

        assertThat(names(result.data())).containsExactly("Fairmont St Andrews", "Kinsale Inn");
    }

    @Test
    void shouldReportUnknownNearbyCourse() {
        ToolResult result = dispatcher.execute(
            "search_accommodations",
            Map.of("near_course_id", "0b8e3a9c-1111-4000-8000-000000000099")
        );

        assertThat(result.success()).isFalse();
        assertThat(result.error()).startsWith("Course not found");
    }

    @Test
    void shouldReturnAccommodationDetails() {
        ToolResult found = dispatcher.execute("get_accommodation_details", Map.of("accommodation_id", LODGE_ID));
        ToolResult missing = dispatcher.execute(
            "get_accommodation_details",
            Map.of("accommodation_id", "0b8e3a9c-2222-4000-8000-000000000099")
        );

        assertThat(found.data().get("name").asText()).isEqualTo("Old Head Lodge");
        assertThat(missing.success()).isFalse();
        assertThat(missing.error()).startsWith("Accommodation not found");
    }

    @Test
    void shouldListGolfResortsOnly() {
        ToolResult all = dispatcher.execute("get_golf_resorts", Map.of());
        ToolResult scotland = dispatcher.execute("get_golf_resorts", Map.of("region", "scotland"));

        assertThat(names(all.data())).containsExactlyInAnyOrder("Old Head Lodge", "Fairmont St Andrews");
        assertThat(names(scotland.data())).containsExactly("Fairmont St Andrews");
    }

    private static List<String> names(JsonNode rows) {
        List<String> names = new ArrayList<>();
        for (JsonNode row : rows) {
            names.add(row.get("name").asText());
        }
        return names;
    }
}
