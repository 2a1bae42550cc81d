package com.mimecast.outpost.queue.limit;

import com.mimecast.outpost.config.BasicConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledIfEnvironmentVariable;

import java.time.Duration;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

/**
 * Test class for RedisCounterStore.
 * <p>These tests require a Redis instance running on localhost:6379.
 * <p>Tests are only run if REDIS_TEST_ENABLED environment variable is set.
 */
@EnabledIfEnvironmentVariable(named = "REDIS_TEST_ENABLED", matches = "true")
class RedisCounterStoreTest {

    private RedisCounterStore store;

    @BeforeEach
    void setUp() {
        // Unique prefix keeps runs apart.
        String prefix = "outpost:test:" + UUID.randomUUID() + ":";
        store = new RedisCounterStore(new BasicConfig(Map.<String, Object>of("prefix", prefix)));
        try {
            store.initialize();
        } catch (Exception e) {
            assumeTrue(false, "Redis not available: " + e.getMessage());
        }
    }

    @AfterEach
    void tearDown() {
        if (store != null) {
            store.close();
        }
    }

    @Test
    void testRate() {
        Rate rate = new Rate(1, Duration.ofSeconds(30));
        assertTrue(store.tryRate("rate", rate, 0).isEmpty());
        assertTrue(store.tryRate("rate", rate, 0).isPresent());
    }

    @Test
    void testTryAdd() {
        assertTrue(store.tryAdd("quota", 800, 1000));
        assertFalse(store.tryAdd("quota", 300, 1000));
        assertEquals(800, store.get("quota"));

        store.add("quota", -800);
        assertEquals(0, store.get("quota"));
    }
}
