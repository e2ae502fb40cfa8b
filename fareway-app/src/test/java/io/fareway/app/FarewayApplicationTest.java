package io.fareway.app;

import static org.assertj.core.api.Assertions.assertThat;

import io.fareway.core.cache.NoopResponseCache;
import io.fareway.core.cache.ResponseCache;
import io.fareway.core.config.CacheConfig;
import io.fareway.core.config.StoreConfig;
import io.fareway.core.json.JsonMappers;
import io.fareway.core.store.JdbcRecordStore;
import io.fareway.core.store.PostgrestRecordStore;
import java.time.Duration;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.Test;

class FarewayApplicationTest {

    @Test
    void shouldBuildStoreForConfiguredBackend() {
        OkHttpClient client = new OkHttpClient();

        assertThat(FarewayApplication.buildStore(
            new StoreConfig(StoreConfig.Backend.JDBC, "jdbc:sqlite:fareway.db", "", Duration.ofSeconds(5)),
            client,
            JsonMappers.create()
        )).isInstanceOf(JdbcRecordStore.class);
        assertThat(FarewayApplication.buildStore(
            new StoreConfig(StoreConfig.Backend.POSTGREST, "https://project.supabase.co", "key", Duration.ofSeconds(5)),
            client,
            JsonMappers.create()
        )).isInstanceOf(PostgrestRecordStore.class);
    }

    @Test
    void shouldFallBackToNoopCacheWithoutRedisUrl() {
        ResponseCache cache = FarewayApplication.buildCache(new CacheConfig(true, "", 300, Duration.ofSeconds(2)));

        assertThat(cache).isInstanceOf(NoopResponseCache.class);
        assertThat(cache.enabled()).isFalse();
    }
}
