package io.fareway.mcp.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.fareway.core.model.Deadline;
import io.fareway.core.model.ToolResult;
import io.fareway.core.tool.ToolDescriptor;
import io.fareway.core.tool.ToolDispatcher;
import io.fareway.mcp.server.http.JsonResponses;
import io.fareway.mcp.server.security.AccessGuard;
import io.fareway.mcp.server.security.BearerTokenAuthenticator;
import io.fareway.mcp.server.security.FixedWindowRateLimiter;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.server.handlers.PathHandler;
import io.undertow.util.Methods;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BooleanSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class GatewayHttpServer implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(GatewayHttpServer.class);
    private static final TypeReference<Map<String, Object>> ARGUMENTS = new TypeReference<>() {
    };
    private static final List<String> ENDPOINTS = List.of(
        "GET /health",
        "GET /tools",
        "POST /tools/{name}",
        "GET /sse",
        "POST /messages?sessionId={id}",
        "GET /mcp (WebSocket)"
    );

    private final ServerOptions options;
    private final ToolDispatcher dispatcher;
    private final BooleanSupplier databaseProbe;
    private final ObjectMapper mapper;
    private final Clock clock;
    private final Instant startedAt;
    private final AtomicBoolean running = new AtomicBoolean(false);

    private Undertow server;
    private McpSessionEndpoint sessions;
    private McpEventStreamEndpoint streams;
    private int actualPort;

    public GatewayHttpServer(
        ServerOptions options,
        ToolDispatcher dispatcher,
        BooleanSupplier databaseProbe,
        ObjectMapper mapper,
        Clock clock
    ) {
        this.options = options;
        this.dispatcher = dispatcher;
        this.databaseProbe = databaseProbe;
        this.mapper = mapper;
        this.clock = clock;
        this.startedAt = clock.instant();
    }

    public void start() {
        if (running.getAndSet(true)) {
            return;
        }

        FixedWindowRateLimiter rateLimiter = new FixedWindowRateLimiter(
            options.rateLimit().window(),
            options.rateLimit().maxRequests(),
            clock
        );
        BearerTokenAuthenticator authenticator = new BearerTokenAuthenticator(options.apiKey());
        if (!authenticator.enabled()) {
            LOG.warn("MCP_API_KEY is not set; tool endpoints accept unauthenticated requests");
        }
        sessions = new McpSessionEndpoint(dispatcher, mapper, rateLimiter, options.requestTimeout(), options.sessionWorkers());
        streams = new McpEventStreamEndpoint(sessions);
        HttpHandler eventStream = Handlers.serverSentEvents(streams);

        PathHandler routes = Handlers.path(this::handleNotFound)
            .addExactPath("/health", this::handleHealth)
            .addExactPath("/tools", guarded(this::handleListTools, rateLimiter, authenticator))
            .addPrefixPath("/tools", guarded(this::handleToolCall, rateLimiter, authenticator))
            .addExactPath("/sse", guarded(exchange -> openEventStream(exchange, eventStream), rateLimiter, authenticator))
            .addExactPath(McpEventStreamEndpoint.MESSAGES_PATH, guarded(this::handleStreamMessage, rateLimiter, authenticator))
            .addExactPath("/mcp", guarded(Handlers.websocket(sessions), rateLimiter, authenticator));

        server = Undertow.builder()
            .addHttpListener(options.port(), options.host())
            .setHandler(routes)
            .build();
        server.start();
        actualPort = resolveBoundPort(server, options.port());
        LOG.info("Fareway gateway listening on {}:{} tools={}", options.host(), actualPort, dispatcher.registry().size());
    }

    public int port() {
        return actualPort;
    }

    @Override
    public void close() {
        if (!running.getAndSet(false)) {
            return;
        }
        if (streams != null) {
            streams.close();
        }
        if (sessions != null) {
            sessions.close();
        }
        if (server != null) {
            server.stop();
        }
        LOG.info("Fareway gateway stopped");
    }

    private HttpHandler guarded(HttpHandler next, FixedWindowRateLimiter rateLimiter, BearerTokenAuthenticator authenticator) {
        return new AccessGuard(next, rateLimiter, authenticator, mapper);
    }

    private void handleHealth(HttpServerExchange exchange) throws Exception {
        if (exchange.isInIoThread()) {
            exchange.dispatch(() -> {
                try {
                    handleHealth(exchange);
                } catch (Exception e) {
                    sendInternalError(exchange, e);
                }
            });
            return;
        }
        if (!Methods.GET.equals(exchange.getRequestMethod())) {
            sendMethodNotAllowed(exchange);
            return;
        }

        boolean connected = databaseProbe.getAsBoolean();
        Instant now = clock.instant();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", connected ? "healthy" : "degraded");
        body.put("version", ServerOptions.VERSION);
        body.put("database", connected ? "connected" : "disconnected");
        body.put("uptime_seconds", Duration.between(startedAt, now).toMillis() / 1000.0);
        body.put("timestamp", now);
        JsonResponses.send(exchange, mapper, 200, body);
    }

    private void handleListTools(HttpServerExchange exchange) throws IOException {
        if (!Methods.GET.equals(exchange.getRequestMethod())) {
            sendMethodNotAllowed(exchange);
            return;
        }
        List<ToolDescriptor> tools = dispatcher.registry().listAll();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("tools", tools);
        body.put("count", tools.size());
        JsonResponses.send(exchange, mapper, 200, body);
    }

    private void handleToolCall(HttpServerExchange exchange) throws Exception {
        if (exchange.isInIoThread()) {
            exchange.dispatch(() -> {
                try {
                    handleToolCall(exchange);
                } catch (Exception e) {
                    sendInternalError(exchange, e);
                }
            });
            return;
        }

        String toolName = exchange.getRelativePath().startsWith("/")
            ? exchange.getRelativePath().substring(1)
            : exchange.getRelativePath();
        if (toolName.isEmpty() || toolName.contains("/")) {
            handleNotFound(exchange);
            return;
        }
        if (!Methods.POST.equals(exchange.getRequestMethod())) {
            sendMethodNotAllowed(exchange);
            return;
        }
        if (dispatcher.registry().lookup(toolName).isEmpty()) {
            JsonResponses.send(exchange, mapper, 404, ToolResult.failure("Tool '" + toolName + "' not found", 0));
            return;
        }

        Map<String, Object> arguments;
        try {
            arguments = readArguments(exchange);
        } catch (JsonProcessingException e) {
            LOG.warn("Malformed request body for tool {}: {}", toolName, e.getOriginalMessage());
            JsonResponses.send(exchange, mapper, 200, ToolResult.failure("Invalid request body: expected a JSON object", 0));
            return;
        }

        ToolResult result = dispatcher.execute(toolName, arguments, Deadline.after(options.requestTimeout()));
        JsonResponses.send(exchange, mapper, 200, result);
    }

    private void openEventStream(HttpServerExchange exchange, HttpHandler eventStream) throws Exception {
        if (!Methods.GET.equals(exchange.getRequestMethod())) {
            sendMethodNotAllowed(exchange);
            return;
        }
        eventStream.handleRequest(exchange);
    }

    private void handleStreamMessage(HttpServerExchange exchange) throws Exception {
        if (exchange.isInIoThread()) {
            exchange.dispatch(() -> {
                try {
                    handleStreamMessage(exchange);
                } catch (Exception e) {
                    sendInternalError(exchange, e);
                }
            });
            return;
        }
        if (!Methods.POST.equals(exchange.getRequestMethod())) {
            sendMethodNotAllowed(exchange);
            return;
        }

        Deque<String> sessionParam = exchange.getQueryParameters().get("sessionId");
        String sessionId = sessionParam == null ? null : sessionParam.peekFirst();
        exchange.startBlocking();
        String raw = new String(exchange.getInputStream().readAllBytes(), StandardCharsets.UTF_8);
        if (!streams.deliver(sessionId, AccessGuard.callerOf(exchange), raw)) {
            JsonResponses.send(exchange, mapper, 404, Map.of("error", "No open event stream for sessionId"));
            return;
        }
        JsonResponses.send(exchange, mapper, 202, Map.of("status", "accepted"));
    }

    private Map<String, Object> readArguments(HttpServerExchange exchange) throws IOException {
        exchange.startBlocking();
        byte[] bytes = exchange.getInputStream().readAllBytes();
        if (bytes.length == 0) {
            return Map.of();
        }
        JsonNode body = mapper.readTree(bytes);
        if (body == null || body.isNull() || body.isMissingNode()) {
            return Map.of();
        }
        if (!body.isObject()) {
            throw new NotAnObjectException(body.getNodeType().toString());
        }
        return mapper.convertValue(body, ARGUMENTS);
    }

    private void handleNotFound(HttpServerExchange exchange) throws IOException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", "Not found");
        body.put("available_endpoints", ENDPOINTS);
        JsonResponses.send(exchange, mapper, 404, body);
    }

    private void sendMethodNotAllowed(HttpServerExchange exchange) throws IOException {
        JsonResponses.send(exchange, mapper, 405, Map.of("error", "Method not allowed"));
    }

    private void sendInternalError(HttpServerExchange exchange, Exception error) {
        LOG.error("Request failed path={} method={}", exchange.getRequestPath(), exchange.getRequestMethod(), error);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", "Internal server error");
        if (options.development() && error.getMessage() != null) {
            body.put("message", error.getMessage());
        }
        try {
            JsonResponses.send(exchange, mapper, 500, body);
        } catch (IOException e) {
            LOG.warn("Could not send error response: {}", e.getMessage());
        }
    }

    private static int resolveBoundPort(Undertow undertow, int fallbackPort) {
        List<Undertow.ListenerInfo> listeners = undertow.getListenerInfo();
        if (!listeners.isEmpty() && listeners.get(0).getAddress() instanceof InetSocketAddress socketAddress) {
            return socketAddress.getPort();
        }
        return fallbackPort;
    }

    private static final class NotAnObjectException extends JsonProcessingException {
        NotAnObjectException(String nodeType) {
            super("expected JSON object but got " + nodeType);
        }
    }
}
