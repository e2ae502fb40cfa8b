package io.fareway.core.catalog;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.fareway.core.cache.InMemoryResponseCache;
import io.fareway.core.model.ToolResult;
import io.fareway.core.store.JdbcRecordStore;
import io.fareway.core.store.SqliteFixtures;
import io.fareway.core.tool.ToolDispatcher;
import io.fareway.core.tool.ToolRegistry;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class RateToolsTest {
    private static final String OPERATOR = "3d2f9a10-0000-4000-8000-000000000001";
    private static final String OTHER_OPERATOR = "3d2f9a10-0000-4000-8000-000000000002";
    private static final String COURSE = "3d2f9a10-1111-4000-8000-000000000001";
    private static final String HOTEL = "3d2f9a10-2222-4000-8000-000000000001";

    @TempDir
    Path tempDir;

    private InMemoryResponseCache cache;
    private ToolDispatcher dispatcher;

    @BeforeEach
    void setUp() throws Exception {
        SqliteFixtures fixtures = SqliteFixtures.create(tempDir)
            .rate("r1", OPERATOR, COURSE, "golf_course", 38_000, 15.0)
            .rate("r2", OPERATOR, HOTEL, "accommodation", 22_000, 10.0)
            .rate("r3", OTHER_OPERATOR, COURSE, "golf_course", 40_000, 5.0);
        JdbcRecordStore store = new JdbcRecordStore(fixtures.jdbcUrl(), Duration.ofSeconds(5), "operator_supplier_rates");
        ToolRegistry registry = new ToolRegistry();
        registry.register(new RateTools(store).definitions());
        cache = new InMemoryResponseCache();
        dispatcher = new ToolDispatcher(registry, cache, new ObjectMapper(), 300);
    }

    @Test
    void shouldListRatesForOperatorBySupplierType() {
        ToolResult any = dispatcher.execute("get_supplier_rates", Map.of("operator_id", OPERATOR, "supplier_type", "any"));
        ToolResult courses = dispatcher.execute("get_supplier_rates", Map.of("operator_id", OPERATOR, "supplier_type", "golf_course"));

        assertThat(any.metadata()).containsEntry("count", 2);
        assertThat(courses.metadata()).containsEntry("count", 1);
        assertThat(courses.data().get(0).get("supplier_id").asText()).isEqualTo(COURSE);
    }

    @Test
    void shouldCacheRatesForTenMinutes() {
        dispatcher.execute("get_operator_suppliers", Map.of("operator_id", OPERATOR));

        assertThat(cache.entries()).hasSize(1);
        String key = cache.entries().keySet().iterator().next();
        assertThat(key).startsWith("suppliers:");
        assertThat(cache.ttlOf(key)).isEqualTo(600L);
    }

    @Test
    void shouldAnswerNegotiatedRateQuestion() {
        ToolResult yes = dispatcher.execute("has_negotiated_rate", Map.of("operator_id", OPERATOR, "supplier_id", HOTEL));
        ToolResult no = dispatcher.execute("has_negotiated_rate", Map.of("operator_id", OTHER_OPERATOR, "supplier_id", HOTEL));

        assertThat(yes.data().get("has_rate").asBoolean()).isTrue();
        assertThat(yes.data().get("rate_cents").asLong()).isEqualTo(22_000L);
        assertThat(yes.data().get("discount_percentage").asDouble()).isEqualTo(10.0);
        assertThat(no.data().get("has_rate").asBoolean()).isFalse();
        assertThat(no.data().has("rate_cents")).isFalse();
        assertThat(cache.entries()).isEmpty();
    }
}
