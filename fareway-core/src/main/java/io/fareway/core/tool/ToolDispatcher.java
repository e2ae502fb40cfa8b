package io.fareway.core.tool;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.fareway.core.cache.ResponseCache;
import io.fareway.core.model.Deadline;
import io.fareway.core.model.ToolResult;
import io.fareway.core.tool.schema.SchemaValidator;
import io.fareway.core.tool.schema.ToolArgumentException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Validates, caches, and runs tool calls. Every path, including unknown tools, invalid input and
 * handler failures, ends in a {@link ToolResult}; nothing thrown by a handler escapes.
 */
public final class ToolDispatcher {
    private static final Logger LOG = LoggerFactory.getLogger(ToolDispatcher.class);

    private final ToolRegistry registry;
    private final ResponseCache cache;
    private final ObjectMapper mapper;
    private final long defaultTtlSeconds;

    public ToolDispatcher(ToolRegistry registry, ResponseCache cache, ObjectMapper mapper, long defaultTtlSeconds) {
        this.registry = registry;
        this.cache = cache;
        this.mapper = mapper;
        this.defaultTtlSeconds = defaultTtlSeconds;
    }

    public ToolRegistry registry() {
        return registry;
    }

    public ToolResult execute(String toolName, Map<String, Object> rawArgs) {
        return execute(toolName, rawArgs, Deadline.none());
    }

    public ToolResult execute(String toolName, Map<String, Object> rawArgs, Deadline deadline) {
        long startedAt = System.nanoTime();
        Set<String> argKeys = rawArgs == null ? Set.of() : rawArgs.keySet();

        Optional<ToolDefinition> found = registry.lookup(toolName);
        if (found.isEmpty()) {
            return fail(toolName, "unknown tool: " + toolName, argKeys, startedAt);
        }
        ToolDefinition tool = found.get();

        SortedMap<String, Object> validated;
        try {
            validated = SchemaValidator.validate(tool.inputSchema(), rawArgs);
        } catch (ToolArgumentException e) {
            return fail(toolName, e.getMessage(), argKeys, startedAt);
        }

        String cacheKey = cacheKey(tool, validated);
        if (cacheKey != null) {
            Optional<CachedOutput> hit = readCache(cacheKey);
            if (hit.isPresent()) {
                JsonNode data = hit.get().data();
                Map<String, Object> metadata = baseMetadata(data);
                metadata.putAll(hit.get().metadata());
                metadata.put("cached", true);
                metadata.put("duration_ms", elapsedMillis(startedAt));
                LOG.info("Tool execution tool={} success=true cached=true duration_ms={}", toolName, metadata.get("duration_ms"));
                return ToolResult.success(data, metadata);
            }
        }

        if (deadline.isExpired()) {
            return fail(toolName, "deadline exceeded before executing " + toolName, argKeys, startedAt);
        }

        ToolOutput output;
        try {
            output = tool.handler().handle(new ToolArguments(validated), new ToolContext(toolName, deadline));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return fail(toolName, "execution interrupted", argKeys, startedAt);
        } catch (Exception e) {
            return fail(toolName, messageOf(e), argKeys, startedAt);
        }

        JsonNode data;
        String entry;
        try {
            data = mapper.readTree(mapper.writeValueAsString(output.data()));
            entry = mapper.writeValueAsString(new CachedOutput(data, output.metadata()));
        } catch (JsonProcessingException e) {
            return fail(toolName, "could not serialize result: " + e.getOriginalMessage(), argKeys, startedAt);
        }

        if (cacheKey != null) {
            writeCache(cacheKey, entry, tool.cachePolicy().ttlOr(defaultTtlSeconds));
        }

        Map<String, Object> metadata = baseMetadata(data);
        metadata.putAll(output.metadata());
        metadata.put("duration_ms", elapsedMillis(startedAt));
        LOG.info("Tool execution tool={} success=true cached=false duration_ms={}", toolName, metadata.get("duration_ms"));
        return ToolResult.success(data, metadata);
    }

    String cacheKey(ToolDefinition tool, SortedMap<String, Object> validated) {
        if (!tool.cachePolicy().enabled() || !cache.enabled()) {
            return null;
        }
        try {
            return tool.cachePolicy().keyPrefix() + ":" + mapper.writeValueAsString(validated);
        } catch (JsonProcessingException e) {
            LOG.warn("Could not build cache key for {}: {}", tool.name(), e.getOriginalMessage());
            return null;
        }
    }

    private Optional<CachedOutput> readCache(String key) {
        try {
            Optional<String> raw = cache.get(key);
            if (raw.isEmpty()) {
                return Optional.empty();
            }
            CachedOutput entry = mapper.readValue(raw.get(), CachedOutput.class);
            if (entry.data() == null || entry.data().isNull()) {
                LOG.warn("Ignoring cache entry {} without data", key);
                return Optional.empty();
            }
            return Optional.of(entry);
        } catch (JsonProcessingException | RuntimeException e) {
            LOG.warn("Ignoring unreadable cache entry {}: {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    private void writeCache(String key, String value, long ttlSeconds) {
        try {
            cache.set(key, value, ttlSeconds);
        } catch (RuntimeException e) {
            LOG.warn("Cache write failed for {}: {}", key, e.getMessage());
        }
    }

    private Map<String, Object> baseMetadata(JsonNode data) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        if (data != null && data.isArray()) {
            metadata.put("count", data.size());
        }
        return metadata;
    }

    private ToolResult fail(String toolName, String message, Set<String> argKeys, long startedAt) {
        long duration = elapsedMillis(startedAt);
        LOG.warn("Tool execution tool={} success=false duration_ms={} args_keys={} error={}", toolName, duration, argKeys, message);
        return ToolResult.failure(message, duration);
    }

    private static String messageOf(Exception e) {
        String message = e.getMessage();
        return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
    }

    // Cached alongside the payload so a hit reports the same tool metadata as the original run.
    record CachedOutput(JsonNode data, Map<String, Object> metadata) {
        CachedOutput {
            metadata = metadata == null ? Map.of() : metadata;
        }
    }

    private static long elapsedMillis(long startedAt) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedAt);
    }
}
