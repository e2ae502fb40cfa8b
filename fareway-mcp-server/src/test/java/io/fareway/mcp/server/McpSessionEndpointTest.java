package io.fareway.mcp.server;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.fareway.core.json.JsonMappers;
import io.fareway.mcp.server.security.FixedWindowRateLimiter;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class McpSessionEndpointTest {
    private final ObjectMapper mapper = JsonMappers.create();
    private final MutableClock clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
    private final McpSessionEndpoint endpoint = new McpSessionEndpoint(
        TestTools.dispatcher(mapper),
        mapper,
        new FixedWindowRateLimiter(Duration.ofMinutes(1), 2, clock),
        Duration.ofSeconds(5),
        1
    );

    @AfterEach
    void tearDown() {
        endpoint.close();
    }

    @Test
    void shouldAnswerInitialize() throws Exception {
        JsonNode reply = call("{\"jsonrpc\":\"2.0\",\"id\":\"init-1\",\"method\":\"initialize\",\"params\":{}}");

        assertThat(reply.get("jsonrpc").asText()).isEqualTo("2.0");
        assertThat(reply.get("id").asText()).isEqualTo("init-1");
        JsonNode result = reply.get("result");
        assertThat(result.get("serverInfo").get("name").asText()).isEqualTo("fareway-database-server");
        assertThat(result.get("serverInfo").get("version").asText()).isEqualTo("1.0.0");
        assertThat(result.get("capabilities").has("tools")).isTrue();
        assertThat(result.get("protocolVersion").asText()).isEqualTo(McpSessionEndpoint.PROTOCOL_VERSION);
    }

    @Test
    void shouldNotReplyToNotifications() {
        assertThat(endpoint.handleMessage("127.0.0.1", "{\"jsonrpc\":\"2.0\",\"method\":\"notifications/initialized\"}"))
            .isEmpty();
    }

    @Test
    void shouldWrapToolResultAsTextContent() throws Exception {
        JsonNode reply = call(
            "{\"jsonrpc\":\"2.0\",\"id\":7,\"method\":\"tools/call\",\"params\":{\"name\":\"search_courses\",\"arguments\":{\"region\":\"Fife\"}}}"
        );

        JsonNode result = reply.get("result");
        assertThat(result.get("isError").asBoolean()).isFalse();
        JsonNode content = result.get("content").get(0);
        assertThat(content.get("type").asText()).isEqualTo("text");
        assertThat(content.get("text").asText()).contains("\n");
        JsonNode envelope = mapper.readTree(content.get("text").asText());
        assertThat(envelope.get("data").get(0).get("region").asText()).isEqualTo("Fife");
    }

    @Test
    void shouldFlagValidationFailureAsToolError() throws Exception {
        JsonNode reply = call(
            "{\"jsonrpc\":\"2.0\",\"id\":8,\"method\":\"tools/call\",\"params\":{\"name\":\"get_course_details\",\"arguments\":{}}}"
        );

        assertThat(reply.has("error")).isFalse();
        assertThat(reply.get("result").get("isError").asBoolean()).isTrue();
        assertThat(reply.get("result").get("content").get(0).get("text").asText()).contains("course_id");
    }

    @Test
    void shouldMapProtocolErrors() throws Exception {
        assertThat(call("{not json").get("error").get("code").asInt()).isEqualTo(-32700);
        assertThat(call("{not json").get("id").isNull()).isTrue();
        assertThat(call("{\"jsonrpc\":\"2.0\",\"id\":1}").get("error").get("code").asInt()).isEqualTo(-32600);
        assertThat(call("[1,2]").get("error").get("code").asInt()).isEqualTo(-32600);
        assertThat(call("{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"resources/list\"}").get("error").get("code").asInt())
            .isEqualTo(-32601);
        assertThat(call("{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"tools/call\",\"params\":{}}").get("error").get("code").asInt())
            .isEqualTo(-32602);
    }

    @Test
    void shouldRateLimitToolCalls() throws Exception {
        String request = "{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"tools/call\",\"params\":{\"name\":\"search_courses\"}}";
        call(request);
        call(request);

        JsonNode limited = call(request);

        assertThat(limited.get("error").get("code").asInt()).isEqualTo(-32029);
        assertThat(limited.get("error").get("data").get("retry_after_seconds").asLong()).isEqualTo(60L);

        clock.advance(Duration.ofMinutes(1));
        assertThat(call(request).has("result")).isTrue();
    }

    private JsonNode call(String raw) throws Exception {
        Optional<String> reply = endpoint.handleMessage("127.0.0.1", raw);
        assertThat(reply).isPresent();
        return mapper.readTree(reply.get());
    }
}
