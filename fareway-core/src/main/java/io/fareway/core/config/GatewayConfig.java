package io.fareway.core.config;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

public record GatewayConfig(
    int port,
    String host,
    RuntimeEnvironment environment,
    String apiKey,
    StoreConfig store,
    CacheConfig cache,
    RateLimitConfig rateLimit,
    Duration requestTimeout
) {
    public static final int MIN_API_KEY_LENGTH = 32;

    public static GatewayConfig fromEnv() {
        return fromMap(System.getenv());
    }

    /**
     * Builds the configuration from environment-style variables. Every problem is collected and
     * reported together in one {@link IllegalStateException}.
     */
    public static GatewayConfig fromMap(Map<String, String> env) {
        Reader reader = new Reader(env);

        int port = reader.intValue("FAREWAY_PORT", 8081, 0, 65_535);
        String host = reader.string("FAREWAY_HOST", "0.0.0.0");
        RuntimeEnvironment environment = reader.environment("FAREWAY_ENV", RuntimeEnvironment.DEVELOPMENT);

        String apiKey = reader.string("MCP_API_KEY", "");
        if (!apiKey.isEmpty() && apiKey.length() < MIN_API_KEY_LENGTH) {
            reader.problem("MCP_API_KEY must be at least " + MIN_API_KEY_LENGTH + " characters");
        }

        Duration storeTimeout = Duration.ofSeconds(reader.intValue("FAREWAY_STORE_TIMEOUT_SECONDS", 5, 1, 300));
        StoreConfig store = reader.store(storeTimeout);

        String redisUrl = reader.string("REDIS_URL", "");
        if (!redisUrl.isEmpty() && !reader.validUri(redisUrl, "redis", "rediss")) {
            reader.problem("REDIS_URL must be a redis:// or rediss:// URL");
        }
        CacheConfig cache = new CacheConfig(
            reader.bool("ENABLE_CACHE", true),
            redisUrl,
            reader.intValue("CACHE_TTL_SECONDS", 300, 1, 86_400),
            Duration.ofSeconds(reader.intValue("CACHE_TIMEOUT_SECONDS", 2, 1, 60))
        );

        RateLimitConfig rateLimit = new RateLimitConfig(
            Duration.ofMillis(reader.intValue("RATE_LIMIT_WINDOW_MS", 60_000, 1, Integer.MAX_VALUE)),
            reader.intValue("RATE_LIMIT_MAX_REQUESTS", 100, 1, Integer.MAX_VALUE)
        );
        Duration requestTimeout = Duration.ofSeconds(reader.intValue("FAREWAY_REQUEST_TIMEOUT_SECONDS", 15, 1, 600));

        reader.failOnProblems();
        return new GatewayConfig(port, host, environment, apiKey, store, cache, rateLimit, requestTimeout);
    }

    public boolean authEnabled() {
        return apiKey != null && !apiKey.isBlank();
    }

    public boolean development() {
        return environment == RuntimeEnvironment.DEVELOPMENT;
    }

    private static final class Reader {
        private final Map<String, String> env;
        private final List<String> problems = new ArrayList<>();

        private Reader(Map<String, String> env) {
            this.env = env;
        }

        String string(String key, String fallback) {
            String value = env.get(key);
            return value == null || value.isBlank() ? fallback : value.trim();
        }

        int intValue(String key, int fallback, int min, int max) {
            String value = env.get(key);
            if (value == null || value.isBlank()) {
                return fallback;
            }
            try {
                int parsed = Integer.parseInt(value.trim());
                if (parsed < min || parsed > max) {
                    problem(key + " must be between " + min + " and " + max);
                    return fallback;
                }
                return parsed;
            } catch (NumberFormatException e) {
                problem(key + " must be a number");
                return fallback;
            }
        }

        boolean bool(String key, boolean fallback) {
            String value = string(key, "");
            if (value.isEmpty()) {
                return fallback;
            }
            return switch (value.toLowerCase(Locale.ROOT)) {
                case "true", "1", "yes" -> true;
                case "false", "0", "no" -> false;
                default -> {
                    problem(key + " must be true or false");
                    yield fallback;
                }
            };
        }

        RuntimeEnvironment environment(String key, RuntimeEnvironment fallback) {
            String value = string(key, "");
            if (value.isEmpty()) {
                return fallback;
            }
            try {
                return RuntimeEnvironment.valueOf(value.toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                problem(key + " must be one of development, production, test");
                return fallback;
            }
        }

        StoreConfig store(Duration timeout) {
            String supabaseUrl = string("SUPABASE_URL", "");
            String jdbcUrl = string("FAREWAY_JDBC_URL", "");
            if (!supabaseUrl.isEmpty()) {
                if (!validUri(supabaseUrl, "http", "https")) {
                    problem("SUPABASE_URL must be an http(s) URL");
                }
                String serviceKey = string("SUPABASE_SERVICE_KEY", "");
                if (serviceKey.isEmpty()) {
                    problem("SUPABASE_SERVICE_KEY is required with SUPABASE_URL");
                }
                return new StoreConfig(StoreConfig.Backend.POSTGREST, supabaseUrl, serviceKey, timeout);
            }
            if (!jdbcUrl.isEmpty()) {
                if (!jdbcUrl.startsWith("jdbc:")) {
                    problem("FAREWAY_JDBC_URL must start with jdbc:");
                }
                return new StoreConfig(StoreConfig.Backend.JDBC, jdbcUrl, "", timeout);
            }
            problem("either SUPABASE_URL or FAREWAY_JDBC_URL must be set");
            return new StoreConfig(StoreConfig.Backend.JDBC, "", "", timeout);
        }

        boolean validUri(String raw, String... schemes) {
            try {
                URI uri = URI.create(raw);
                if (uri.getHost() == null) {
                    return false;
                }
                for (String scheme : schemes) {
                    if (scheme.equalsIgnoreCase(uri.getScheme())) {
                        return true;
                    }
                }
                return false;
            } catch (IllegalArgumentException e) {
                return false;
            }
        }

        void problem(String message) {
            problems.add(message);
        }

        void failOnProblems() {
            if (!problems.isEmpty()) {
                throw new IllegalStateException("Invalid environment configuration: " + String.join("; ", problems));
            }
        }
    }
}
