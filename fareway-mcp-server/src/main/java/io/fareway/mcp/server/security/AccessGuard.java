package io.fareway.mcp.server.security;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.fareway.mcp.server.http.JsonResponses;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import java.net.InetSocketAddress;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rate limit, then bearer auth, in front of a protected handler. Also guards the WebSocket
 * handshake when wrapped around the upgrade handler.
 */
public final class AccessGuard implements HttpHandler {
    private static final Logger LOG = LoggerFactory.getLogger(AccessGuard.class);

    private final HttpHandler next;
    private final FixedWindowRateLimiter rateLimiter;
    private final BearerTokenAuthenticator authenticator;
    private final ObjectMapper mapper;

    public AccessGuard(HttpHandler next, FixedWindowRateLimiter rateLimiter, BearerTokenAuthenticator authenticator, ObjectMapper mapper) {
        this.next = next;
        this.rateLimiter = rateLimiter;
        this.authenticator = authenticator;
        this.mapper = mapper;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) throws Exception {
        String caller = callerOf(exchange);
        FixedWindowRateLimiter.Decision decision = rateLimiter.tryAcquire(caller);
        if (!decision.allowed()) {
            LOG.warn("Rate limit exceeded caller={} path={}", caller, exchange.getRequestPath());
            exchange.getResponseHeaders().put(Headers.RETRY_AFTER, String.valueOf(decision.retryAfterSeconds()));
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("error", "Too many requests from this IP, please try again later.");
            body.put("retry_after_seconds", decision.retryAfterSeconds());
            JsonResponses.send(exchange, mapper, 429, body);
            return;
        }

        switch (authenticator.authenticate(exchange.getRequestHeaders().getFirst(Headers.AUTHORIZATION))) {
            case MISSING -> JsonResponses.send(exchange, mapper, 401, Map.of("error", "Missing or invalid authorization header"));
            case REJECTED -> {
                LOG.warn("Rejected API key caller={} path={}", caller, exchange.getRequestPath());
                JsonResponses.send(exchange, mapper, 403, Map.of("error", "Invalid API key"));
            }
            case ADMITTED -> next.handleRequest(exchange);
            default -> throw new IllegalStateException("Unhandled auth outcome");
        }
    }

    public static String callerOf(HttpServerExchange exchange) {
        InetSocketAddress source = exchange.getSourceAddress();
        if (source == null || source.getAddress() == null) {
            return "unknown";
        }
        return source.getAddress().getHostAddress();
    }
}
