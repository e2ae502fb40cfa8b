package io.fareway.core.cache;

import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import redis.clients.jedis.Jedis;
import redis.clients.jedis.JedisPool;
import redis.clients.jedis.JedisPoolConfig;
import redis.clients.jedis.exceptions.JedisException;
import redis.clients.jedis.params.ScanParams;
import redis.clients.jedis.resps.ScanResult;

public final class RedisResponseCache implements ResponseCache {
    private static final Logger LOG = LoggerFactory.getLogger(RedisResponseCache.class);
    private static final int SCAN_BATCH = 200;

    private final JedisPool pool;

    public RedisResponseCache(String redisUrl, Duration timeout) {
        JedisPoolConfig config = new JedisPoolConfig();
        config.setMaxTotal(16);
        config.setMaxWait(timeout);
        this.pool = new JedisPool(config, URI.create(redisUrl), (int) timeout.toMillis());
        LOG.info("Redis cache configured at {}:{}", URI.create(redisUrl).getHost(), URI.create(redisUrl).getPort());
    }

    RedisResponseCache(JedisPool pool) {
        this.pool = pool;
    }

    @Override
    public Optional<String> get(String key) {
        try (Jedis jedis = pool.getResource()) {
            return Optional.ofNullable(jedis.get(key));
        } catch (JedisException e) {
            LOG.warn("Cache get failed key={}: {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void set(String key, String value, long ttlSeconds) {
        try (Jedis jedis = pool.getResource()) {
            jedis.setex(key, ttlSeconds, value);
        } catch (JedisException e) {
            LOG.warn("Cache set failed key={}: {}", key, e.getMessage());
        }
    }

    @Override
    public void clearByPrefix(String prefix) {
        ScanParams params = new ScanParams().match(prefix + "*").count(SCAN_BATCH);
        int removed = 0;
        try (Jedis jedis = pool.getResource()) {
            String cursor = ScanParams.SCAN_POINTER_START;
            do {
                ScanResult<String> page = jedis.scan(cursor, params);
                List<String> keys = page.getResult();
                if (!keys.isEmpty()) {
                    removed += (int) jedis.del(keys.toArray(new String[0]));
                }
                cursor = page.getCursor();
            } while (!ScanParams.SCAN_POINTER_START.equals(cursor));
            LOG.info("Cache cleared prefix={} count={}", prefix, removed);
        } catch (JedisException e) {
            LOG.warn("Cache clear failed prefix={}: {}", prefix, e.getMessage());
        }
    }

    @Override
    public boolean enabled() {
        return true;
    }

    @Override
    public void close() {
        pool.close();
        LOG.info("Redis connection closed");
    }
}
