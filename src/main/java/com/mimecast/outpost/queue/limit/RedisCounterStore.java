package com.mimecast.outpost.queue.limit;

import com.mimecast.outpost.config.BasicConfig;
import com.mimecast.outpost.store.QueueStorageException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import redis.clients.jedis.Jedis;
import redis.clients.jedis.JedisPool;
import redis.clients.jedis.JedisPoolConfig;

import java.util.List;
import java.util.OptionalLong;

/**
 * Counter store backed by Redis, shared by every node of a cluster.
 *
 * <p>Rate windows and conditional increments run as Lua scripts so each check is atomic.
 * <p>Configuration keys: {@code host}, {@code port}, {@code prefix}.
 */
public class RedisCounterStore implements CounterStore, AutoCloseable {
    private static final Logger log = LogManager.getLogger(RedisCounterStore.class);

    // Returns -1 when allowed, else seconds until the window expires.
    private static final String RATE_SCRIPT =
            "local c = tonumber(redis.call('GET', KEYS[1]) or '0')\n" +
            "if c >= tonumber(ARGV[1]) then\n" +
            "  local ttl = redis.call('TTL', KEYS[1])\n" +
            "  if ttl < 1 then ttl = 1 end\n" +
            "  return ttl\n" +
            "end\n" +
            "c = redis.call('INCR', KEYS[1])\n" +
            "if c == 1 then redis.call('EXPIRE', KEYS[1], ARGV[2]) end\n" +
            "return -1";

    // Returns 1 when added, 0 when the ceiling would be exceeded. Zeroed counters are deleted.
    private static final String TRY_ADD_SCRIPT =
            "local v = redis.call('INCRBY', KEYS[1], ARGV[1])\n" +
            "local added = 1\n" +
            "if v > tonumber(ARGV[2]) then\n" +
            "  v = redis.call('DECRBY', KEYS[1], ARGV[1])\n" +
            "  added = 0\n" +
            "end\n" +
            "if v == 0 then redis.call('DEL', KEYS[1]) end\n" +
            "return added";

    // Returns the new value. Zeroed counters are deleted.
    private static final String ADD_SCRIPT =
            "local v = redis.call('INCRBY', KEYS[1], ARGV[1])\n" +
            "if v == 0 then redis.call('DEL', KEYS[1]) end\n" +
            "return v";

    private final String host;
    private final int port;
    private final String prefix;
    private JedisPool jedisPool;

    /**
     * Constructs a new RedisCounterStore instance.
     *
     * @param redisConfig Redis configuration.
     */
    public RedisCounterStore(BasicConfig redisConfig) {
        this.host = redisConfig.getStringProperty("host", "localhost");
        this.port = Math.toIntExact(redisConfig.getLongProperty("port", 6379L));
        this.prefix = redisConfig.getStringProperty("prefix", "outpost:counter:");
    }

    /**
     * Initialize the Redis connection pool.
     *
     * @return Self.
     */
    public RedisCounterStore initialize() {
        try {
            JedisPoolConfig poolConfig = new JedisPoolConfig();
            poolConfig.setMaxTotal(10);
            poolConfig.setMaxIdle(5);
            poolConfig.setMinIdle(1);
            poolConfig.setTestOnBorrow(true);

            this.jedisPool = new JedisPool(poolConfig, host, port);

            try (Jedis jedis = jedisPool.getResource()) {
                jedis.ping();
            }

            log.info("Redis counter store initialized: host={}, port={}, prefix={}", host, port, prefix);
            return this;
        } catch (Exception e) {
            log.error("Failed to initialize Redis counter store: {}", e.getMessage(), e);
            throw new QueueStorageException("Failed to initialize Redis counter store", e);
        }
    }

    @Override
    public OptionalLong tryRate(String key, Rate rate, long now) {
        try (Jedis jedis = jedisPool.getResource()) {
            Object result = jedis.eval(RATE_SCRIPT, List.of(prefix + key),
                    List.of(String.valueOf(rate.getRequests()), String.valueOf(Math.max(1, rate.getPeriod().getSeconds()))));
            long wait = ((Number) result).longValue();
            return wait < 0 ? OptionalLong.empty() : OptionalLong.of(wait);
        } catch (Exception e) {
            log.error("Failed to check rate for key {}: {}", key, e.getMessage(), e);
            throw new QueueStorageException("Failed to check rate", e);
        }
    }

    @Override
    public boolean tryAdd(String key, long delta, long ceiling) {
        try (Jedis jedis = jedisPool.getResource()) {
            Object result = jedis.eval(TRY_ADD_SCRIPT, List.of(prefix + key),
                    List.of(String.valueOf(delta), String.valueOf(ceiling)));
            return ((Number) result).longValue() == 1L;
        } catch (Exception e) {
            log.error("Failed to add to counter {}: {}", key, e.getMessage(), e);
            throw new QueueStorageException("Failed to add to counter", e);
        }
    }

    @Override
    public long get(String key) {
        try (Jedis jedis = jedisPool.getResource()) {
            String value = jedis.get(prefix + key);
            return value != null ? Long.parseLong(value) : 0L;
        } catch (Exception e) {
            log.error("Failed to read counter {}: {}", key, e.getMessage(), e);
            throw new QueueStorageException("Failed to read counter", e);
        }
    }

    @Override
    public void add(String key, long delta) {
        try (Jedis jedis = jedisPool.getResource()) {
            jedis.eval(ADD_SCRIPT, List.of(prefix + key), List.of(String.valueOf(delta)));
        } catch (Exception e) {
            log.error("Failed to add to counter {}: {}", key, e.getMessage(), e);
            throw new QueueStorageException("Failed to add to counter", e);
        }
    }

    /**
     * Close the connection pool.
     */
    @Override
    public void close() {
        if (jedisPool != null && !jedisPool.isClosed()) {
            jedisPool.close();
            log.info("Redis counter store closed");
        }
    }
}
