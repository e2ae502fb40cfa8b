package io.fareway.core.store;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.fareway.core.model.Deadline;
import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import okhttp3.Call;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link RecordStore} backed by a PostgREST endpoint (Supabase {@code /rest/v1}).
 */
public final class PostgrestRecordStore implements RecordStore {
    private static final Logger LOG = LoggerFactory.getLogger(PostgrestRecordStore.class);
    private static final TypeReference<List<Map<String, Object>>> ROWS = new TypeReference<>() {
    };

    private final OkHttpClient client;
    private final ObjectMapper mapper;
    private final HttpUrl restBase;
    private final String serviceKey;
    private final Duration timeout;
    private final String probeTable;

    public PostgrestRecordStore(
        OkHttpClient client,
        ObjectMapper mapper,
        String baseUrl,
        String serviceKey,
        Duration timeout,
        String probeTable
    ) {
        HttpUrl parsed = HttpUrl.parse(normalizeBaseUrl(baseUrl) + "/rest/v1");
        if (parsed == null) {
            throw new IllegalArgumentException("Invalid store URL: " + baseUrl);
        }
        this.client = client;
        this.mapper = mapper;
        this.restBase = parsed;
        this.serviceKey = serviceKey == null ? "" : serviceKey;
        this.timeout = timeout;
        this.probeTable = probeTable;
        LOG.info("Initializing PostgREST store client url={}", restBase);
    }

    @Override
    public List<Map<String, Object>> select(Query query, Deadline deadline) throws RecordStoreException {
        HttpUrl.Builder url = restBase.newBuilder().addPathSegment(query.table());
        url.addQueryParameter("select", query.columns().isEmpty() ? "*" : String.join(",", query.columns()));
        for (Filter filter : query.filters()) {
            url.addQueryParameter(filter.field(), operator(filter.op()) + "." + encodeValue(filter));
        }
        if (query.orderBy() != null) {
            url.addQueryParameter("order", query.orderBy() + (query.descending() ? ".desc" : ".asc"));
        }
        if (query.limit() != null) {
            url.addQueryParameter("limit", String.valueOf(query.limit()));
        }
        return execute(url.build(), deadline);
    }

    @Override
    public Optional<Map<String, Object>> selectOne(String table, String id, Deadline deadline) throws RecordStoreException {
        List<Map<String, Object>> rows = select(Query.from(table).eq("id", id).limit(2).build(), deadline);
        if (rows.size() > 1) {
            throw new RecordStoreException("Database error: multiple rows in " + table + " for id " + id);
        }
        return rows.stream().findFirst();
    }

    @Override
    public boolean ping() {
        try {
            select(Query.from(probeTable).columns("id").limit(1).build(), Deadline.none());
            LOG.info("Database connection successful");
            return true;
        } catch (RecordStoreException e) {
            LOG.error("Database connection test failed: {}", e.getMessage());
            return false;
        }
    }

    private List<Map<String, Object>> execute(HttpUrl url, Deadline deadline) throws RecordStoreException {
        if (deadline.isExpired()) {
            throw new RecordStoreException("Database error: deadline exceeded before query");
        }
        Request request = new Request.Builder()
            .url(url)
            .get()
            .header("apikey", serviceKey)
            .header("Authorization", "Bearer " + serviceKey)
            .header("Accept", "application/json")
            .header("x-application", "fareway-database-mcp")
            .build();

        Call call = client.newCall(request);
        call.timeout().timeout(deadline.cap(timeout).toMillis(), TimeUnit.MILLISECONDS);
        try (Response response = call.execute()) {
            String raw = response.body() == null ? "" : response.body().string();
            if (!response.isSuccessful()) {
                throw new RecordStoreException("Database error: " + errorMessage(response.code(), raw));
            }
            if (raw.isBlank()) {
                return List.of();
            }
            return mapper.readValue(raw, ROWS);
        } catch (IOException e) {
            throw new RecordStoreException("Database error: " + e.getMessage(), e);
        }
    }

    private String errorMessage(int status, String raw) {
        try {
            JsonNode body = mapper.readTree(raw);
            String message = body.path("message").asText("");
            if (!message.isBlank()) {
                return message;
            }
        } catch (IOException ignored) {
            // non-JSON error bodies fall through to the status line
        }
        return "HTTP " + status;
    }

    private static String operator(FilterOp op) {
        return op.name().toLowerCase(Locale.ROOT);
    }

    private static String encodeValue(Filter filter) {
        String value = String.valueOf(filter.value());
        if (filter.op() == FilterOp.ILIKE) {
            // PostgREST reads every '*' as '%' and has no escape for it, so a literal asterisk
            // degrades to a single-character wildcard. Backslash escapes pass through to Postgres.
            return value.replace('*', '_').replace('%', '*');
        }
        return value;
    }

    private static String normalizeBaseUrl(String value) {
        String raw = value == null ? "" : value.trim();
        if (raw.endsWith("/")) {
            return raw.substring(0, raw.length() - 1);
        }
        return raw;
    }
}
