package io.fareway.mcp.server;

import io.undertow.server.handlers.sse.ServerSentEventConnection;
import io.undertow.server.handlers.sse.ServerSentEventConnectionCallback;
import java.io.IOException;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * MCP over server-sent events. {@code GET /sse} opens a stream and announces, as an
 * {@code endpoint} event, the URI the client posts its JSON-RPC messages to. Replies travel back
 * on the stream as {@code message} events.
 */
public final class McpEventStreamEndpoint implements ServerSentEventConnectionCallback, AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(McpEventStreamEndpoint.class);
    private static final long KEEP_ALIVE_MILLIS = 15_000;

    static final String MESSAGES_PATH = "/messages";

    private final McpSessionEndpoint protocol;
    private final Map<String, ServerSentEventConnection> streams = new ConcurrentHashMap<>();

    public McpEventStreamEndpoint(McpSessionEndpoint protocol) {
        this.protocol = protocol;
    }

    @Override
    public void connected(ServerSentEventConnection connection, String lastEventId) {
        String sessionId = UUID.randomUUID().toString();
        streams.put(sessionId, connection);
        connection.addCloseTask(closed -> {
            streams.remove(sessionId);
            LOG.info("MCP event stream closed session={}", sessionId);
        });
        connection.setKeepAliveTime(KEEP_ALIVE_MILLIS);
        LOG.info("MCP event stream opened session={}", sessionId);
        connection.send(MESSAGES_PATH + "?sessionId=" + sessionId, "endpoint", null, callback(sessionId));
    }

    /**
     * Runs one client message for the stream {@code sessionId} and pushes any reply onto it.
     * Returns {@code false} when no such stream is open. Blocks while the tool executes.
     */
    boolean deliver(String sessionId, String caller, String raw) {
        ServerSentEventConnection connection = sessionId == null ? null : streams.get(sessionId);
        if (connection == null) {
            return false;
        }
        // Each POST already passed the access guard, which took its rate-limit token.
        Optional<String> reply = protocol.handleMessage(caller, raw, false);
        reply.ifPresent(text -> connection.send(text, "message", null, callback(sessionId)));
        return true;
    }

    private static ServerSentEventConnection.EventCallback callback(String sessionId) {
        return new ServerSentEventConnection.EventCallback() {
            @Override
            public void done(ServerSentEventConnection connection, String data, String event, String id) {
            }

            @Override
            public void failed(ServerSentEventConnection connection, String data, String event, String id, IOException e) {
                LOG.warn("Failed to send MCP event session={} event={}: {}", sessionId, event, e.getMessage());
            }
        };
    }

    @Override
    public void close() {
        for (ServerSentEventConnection connection : streams.values()) {
            try {
                connection.close();
            } catch (IOException e) {
                LOG.debug("Error closing MCP event stream: {}", e.getMessage());
            }
        }
        streams.clear();
    }
}
