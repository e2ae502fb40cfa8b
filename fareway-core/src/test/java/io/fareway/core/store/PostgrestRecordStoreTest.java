package io.fareway.core.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.fareway.core.model.Deadline;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.Test;

class PostgrestRecordStoreTest {

    @Test
    void shouldTranslateQueryIntoPostgrestParameters() throws Exception {
        try (MockWebServer server = new MockWebServer()) {
            server.enqueue(new MockResponse().setResponseCode(200).setBody("[{\"id\":\"c1\",\"rating\":4.9}]"));
            server.start();

            PostgrestRecordStore store = store(server);
            List<Map<String, Object>> rows = store.select(
                Query.from("golf_courses")
                    .columns("id", "rating")
                    .containsIgnoreCase("region", "Ireland")
                    .gte("green_fee_standard_cents", 15_001L)
                    .orderBy("rating", true)
                    .limit(10)
                    .build(),
                Deadline.none()
            );

            assertThat(rows).hasSize(1);
            assertThat(rows.get(0)).containsEntry("id", "c1");

            RecordedRequest request = server.takeRequest();
            HttpUrl url = request.getRequestUrl();
            assertThat(url.encodedPath()).isEqualTo("/rest/v1/golf_courses");
            assertThat(url.queryParameter("select")).isEqualTo("id,rating");
            assertThat(url.queryParameter("region")).isEqualTo("ilike.*Ireland*");
            assertThat(url.queryParameter("green_fee_standard_cents")).isEqualTo("gte.15001");
            assertThat(url.queryParameter("order")).isEqualTo("rating.desc");
            assertThat(url.queryParameter("limit")).isEqualTo("10");
            assertThat(request.getHeader("apikey")).isEqualTo("service-key");
            assertThat(request.getHeader("Authorization")).isEqualTo("Bearer service-key");
        }
    }

    @Test
    void shouldEscapeLikeMetacharactersInFragment() throws Exception {
        try (MockWebServer server = new MockWebServer()) {
            server.enqueue(new MockResponse().setResponseCode(200).setBody("[]"));
            server.start();

            store(server).select(
                Query.from("golf_courses").containsIgnoreCase("name", "a_b*c%").build(),
                Deadline.none()
            );

            HttpUrl url = server.takeRequest().getRequestUrl();
            assertThat(url.queryParameter("name")).isEqualTo("ilike.*a\\_b_c\\**");
        }
    }

    @Test
    void shouldReturnEmptyForMissingRow() throws Exception {
        try (MockWebServer server = new MockWebServer()) {
            server.enqueue(new MockResponse().setResponseCode(200).setBody("[]"));
            server.start();

            assertThat(store(server).selectOne("accommodations", "a-1", Deadline.none())).isEmpty();
            assertThat(server.takeRequest().getRequestUrl().queryParameter("id")).isEqualTo("eq.a-1");
        }
    }

    @Test
    void shouldSurfaceServerErrorMessage() throws Exception {
        try (MockWebServer server = new MockWebServer()) {
            server.enqueue(new MockResponse().setResponseCode(400).setBody("{\"message\":\"column x does not exist\"}"));
            server.start();

            assertThatThrownBy(() -> store(server).select(Query.from("golf_courses").build(), Deadline.none()))
                .isInstanceOf(RecordStoreException.class)
                .hasMessage("Database error: column x does not exist");
        }
    }

    @Test
    void shouldReportProbeFailureWithoutThrowing() throws Exception {
        try (MockWebServer server = new MockWebServer()) {
            server.enqueue(new MockResponse().setResponseCode(200).setBody("[{\"id\":\"c1\"}]"));
            server.enqueue(new MockResponse().setResponseCode(503).setBody("unavailable"));
            server.start();

            PostgrestRecordStore store = store(server);
            assertThat(store.ping()).isTrue();
            assertThat(store.ping()).isFalse();
        }
    }

    private PostgrestRecordStore store(MockWebServer server) {
        return new PostgrestRecordStore(
            new OkHttpClient(),
            new ObjectMapper(),
            server.url("/").toString(),
            "service-key",
            Duration.ofSeconds(5),
            "golf_courses"
        );
    }
}
