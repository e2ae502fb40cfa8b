package io.fareway.mcp.server;

import io.fareway.core.config.GatewayConfig;
import io.fareway.core.config.RateLimitConfig;
import java.time.Duration;

/**
 * Listener and access settings for {@link GatewayHttpServer}. An empty {@code apiKey} disables
 * authentication.
 */
public record ServerOptions(
    String host,
    int port,
    String apiKey,
    RateLimitConfig rateLimit,
    Duration requestTimeout,
    boolean development,
    int sessionWorkers
) {
    public static final String VERSION = "1.0.0";
    private static final int DEFAULT_SESSION_WORKERS = 8;

    public ServerOptions {
        host = host == null || host.isBlank() ? "0.0.0.0" : host;
        apiKey = apiKey == null ? "" : apiKey.trim();
        if (sessionWorkers < 1) {
            throw new IllegalArgumentException("sessionWorkers must be at least 1");
        }
    }

    public static ServerOptions from(GatewayConfig config) {
        return new ServerOptions(
            config.host(),
            config.port(),
            config.apiKey(),
            config.rateLimit(),
            config.requestTimeout(),
            config.development(),
            DEFAULT_SESSION_WORKERS
        );
    }
}
