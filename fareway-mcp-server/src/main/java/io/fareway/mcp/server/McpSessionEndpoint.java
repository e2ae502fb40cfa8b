package io.fareway.mcp.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.fareway.core.model.Deadline;
import io.fareway.core.model.ToolResult;
import io.fareway.core.tool.ToolDispatcher;
import io.fareway.mcp.server.jsonrpc.JsonRpcError;
import io.fareway.mcp.server.jsonrpc.JsonRpcResponse;
import io.fareway.mcp.server.security.FixedWindowRateLimiter;
import io.undertow.websockets.WebSocketConnectionCallback;
import io.undertow.websockets.core.AbstractReceiveListener;
import io.undertow.websockets.core.BufferedTextMessage;
import io.undertow.websockets.core.WebSocketCallback;
import io.undertow.websockets.core.WebSocketChannel;
import io.undertow.websockets.core.WebSockets;
import io.undertow.websockets.spi.WebSocketHttpExchange;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * MCP over WebSocket: one JSON-RPC 2.0 session per connection. Frames are handled on a bounded
 * worker pool so tool execution never blocks the IO threads. {@link McpEventStreamEndpoint} reuses
 * the same message handling for the event-stream transport.
 */
public final class McpSessionEndpoint implements WebSocketConnectionCallback, AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(McpSessionEndpoint.class);
    private static final TypeReference<Map<String, Object>> ARGUMENTS = new TypeReference<>() {
    };
    private static final int QUEUE_CAPACITY = 256;

    static final String PROTOCOL_VERSION = "2024-11-05";
    static final String SERVER_NAME = "fareway-database-server";

    private final ToolDispatcher dispatcher;
    private final ObjectMapper mapper;
    private final FixedWindowRateLimiter rateLimiter;
    private final Duration requestTimeout;
    private final ExecutorService executor;
    private final Map<String, WebSocketChannel> sessions = new ConcurrentHashMap<>();

    public McpSessionEndpoint(
        ToolDispatcher dispatcher,
        ObjectMapper mapper,
        FixedWindowRateLimiter rateLimiter,
        Duration requestTimeout,
        int workers
    ) {
        this.dispatcher = dispatcher;
        this.mapper = mapper;
        this.rateLimiter = rateLimiter;
        this.requestTimeout = requestTimeout;
        AtomicInteger threadIds = new AtomicInteger();
        this.executor = new ThreadPoolExecutor(
            workers,
            workers,
            60,
            TimeUnit.SECONDS,
            new ArrayBlockingQueue<>(QUEUE_CAPACITY),
            runnable -> {
                Thread thread = new Thread(runnable, "mcp-session-" + threadIds.incrementAndGet());
                thread.setDaemon(true);
                return thread;
            }
        );
    }

    @Override
    public void onConnect(WebSocketHttpExchange exchange, WebSocketChannel channel) {
        String sessionId = UUID.randomUUID().toString();
        String caller = callerOf(channel);
        sessions.put(sessionId, channel);
        LOG.info("MCP session opened session={} caller={}", sessionId, caller);

        channel.getCloseSetter().set(closed -> {
            sessions.remove(sessionId);
            LOG.info("MCP session closed session={}", sessionId);
        });
        channel.getReceiveSetter().set(new AbstractReceiveListener() {
            @Override
            protected void onFullTextMessage(WebSocketChannel wsChannel, BufferedTextMessage message) {
                submit(caller, wsChannel, message.getData());
            }
        });
        channel.resumeReceives();
    }

    private void submit(String caller, WebSocketChannel channel, String raw) {
        try {
            executor.execute(() -> handleMessage(caller, raw).ifPresent(reply -> send(channel, reply)));
        } catch (RejectedExecutionException e) {
            LOG.warn("MCP session queue full, rejecting frame from {}", caller);
            send(channel, write(JsonRpcResponse.failure(null, JsonRpcError.internalError("Server busy"))));
        }
    }

    Optional<String> handleMessage(String caller, String raw) {
        return handleMessage(caller, raw, true);
    }

    /**
     * Handles one inbound frame and returns the reply frame, if the message expects one. With
     * {@code limitToolCalls} each {@code tools/call} takes a rate-limit token from {@code caller}.
     */
    Optional<String> handleMessage(String caller, String raw, boolean limitToolCalls) {
        JsonNode request;
        try {
            request = mapper.readTree(raw);
        } catch (JsonProcessingException e) {
            return Optional.of(write(JsonRpcResponse.failure(null, JsonRpcError.parseError(e.getOriginalMessage()))));
        }
        if (request == null || !request.isObject()) {
            return Optional.of(write(JsonRpcResponse.failure(null, JsonRpcError.invalidRequest("Expected a JSON object"))));
        }

        JsonNode id = request.get("id");
        JsonNode method = request.get("method");
        if (method == null || !method.isTextual()) {
            return Optional.of(write(JsonRpcResponse.failure(id, JsonRpcError.invalidRequest("Missing method"))));
        }

        JsonRpcResponse response;
        try {
            response = dispatch(caller, id, method.asText(), request.path("params"), limitToolCalls);
        } catch (RuntimeException e) {
            LOG.error("MCP request failed method={}", method.asText(), e);
            response = JsonRpcResponse.failure(id, JsonRpcError.internalError(e.getMessage()));
        }
        if (response == null || id == null) {
            return Optional.empty();
        }
        return Optional.of(write(response));
    }

    private JsonRpcResponse dispatch(String caller, JsonNode id, String method, JsonNode params, boolean limitToolCalls) {
        return switch (method) {
            case "initialize" -> JsonRpcResponse.success(id, initializeResult());
            case "notifications/initialized" -> null;
            case "ping" -> JsonRpcResponse.success(id, Map.of());
            case "tools/list" -> JsonRpcResponse.success(id, Map.of("tools", dispatcher.registry().listAll()));
            case "tools/call" -> callTool(caller, id, params, limitToolCalls);
            default -> JsonRpcResponse.failure(id, JsonRpcError.methodNotFound(method));
        };
    }

    private Map<String, Object> initializeResult() {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("protocolVersion", PROTOCOL_VERSION);
        result.put("capabilities", Map.of("tools", Map.of()));
        result.put("serverInfo", Map.of("name", SERVER_NAME, "version", ServerOptions.VERSION));
        return result;
    }

    private JsonRpcResponse callTool(String caller, JsonNode id, JsonNode params, boolean limitToolCalls) {
        if (limitToolCalls) {
            FixedWindowRateLimiter.Decision decision = rateLimiter.tryAcquire(caller);
            if (!decision.allowed()) {
                return JsonRpcResponse.failure(id, JsonRpcError.rateLimited(decision.retryAfterSeconds()));
            }
        }

        JsonNode name = params.get("name");
        if (name == null || !name.isTextual()) {
            return JsonRpcResponse.failure(id, JsonRpcError.invalidParams("params.name must be a string"));
        }
        JsonNode arguments = params.get("arguments");
        Map<String, Object> rawArgs;
        if (arguments == null || arguments.isNull()) {
            rawArgs = Map.of();
        } else if (arguments.isObject()) {
            rawArgs = mapper.convertValue(arguments, ARGUMENTS);
        } else {
            return JsonRpcResponse.failure(id, JsonRpcError.invalidParams("params.arguments must be an object"));
        }

        ToolResult result = dispatcher.execute(name.asText(), rawArgs, Deadline.after(requestTimeout));
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("content", List.of(Map.of("type", "text", "text", pretty(result))));
        payload.put("isError", !result.success());
        return JsonRpcResponse.success(id, payload);
    }

    private String pretty(ToolResult result) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(result);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize tool result", e);
        }
    }

    private String write(JsonRpcResponse response) {
        try {
            return mapper.writeValueAsString(response);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize JSON-RPC response", e);
        }
    }

    private void send(WebSocketChannel channel, String text) {
        WebSockets.sendText(text, channel, new WebSocketCallback<Void>() {
            @Override
            public void complete(WebSocketChannel wsChannel, Void context) {
            }

            @Override
            public void onError(WebSocketChannel wsChannel, Void context, Throwable throwable) {
                LOG.warn("Failed to send MCP frame: {}", throwable.getMessage());
            }
        });
    }

    private static String callerOf(WebSocketChannel channel) {
        if (channel.getPeerAddress() instanceof InetSocketAddress address && address.getAddress() != null) {
            return address.getAddress().getHostAddress();
        }
        return "unknown";
    }

    @Override
    public void close() {
        for (WebSocketChannel channel : sessions.values()) {
            try {
                channel.close();
            } catch (IOException e) {
                LOG.debug("Error closing MCP session: {}", e.getMessage());
            }
        }
        sessions.clear();
        executor.shutdownNow();
    }
}
