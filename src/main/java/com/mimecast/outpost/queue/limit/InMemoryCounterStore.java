package com.mimecast.outpost.queue.limit;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Map;
import java.util.OptionalLong;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Counter store held in process memory.
 *
 * <p>Rates use fixed windows that open on the first request.
 * <br>Elapsed windows are purged at most once a minute, counters are dropped when they return to zero.
 * <p>Counters are lost on restart, use {@link RedisCounterStore} to share them between nodes.
 */
public class InMemoryCounterStore implements CounterStore {
    private static final Logger log = LogManager.getLogger(InMemoryCounterStore.class);

    /**
     * Seconds between purges of elapsed rate windows.
     */
    static final long PURGE_INTERVAL = 60L;

    private final Map<String, Window> windows = new ConcurrentHashMap<>();
    private final Map<String, Long> counters = new ConcurrentHashMap<>();
    private volatile long nextPurge = Long.MIN_VALUE;

    @Override
    public OptionalLong tryRate(String key, Rate rate, long now) {
        if (now >= nextPurge) {
            nextPurge = now + PURGE_INTERVAL;
            purge(now);
        }

        long period = Math.max(1, rate.getPeriod().getSeconds());
        long[] wait = {-1};
        windows.compute(key, (k, window) -> {
            if (window == null || now >= window.end) {
                return new Window(now + period, 1);
            }
            if (window.count >= rate.getRequests()) {
                wait[0] = Math.max(1, window.end - now);
                return window;
            }
            return new Window(window.end, window.count + 1);
        });
        return wait[0] < 0 ? OptionalLong.empty() : OptionalLong.of(wait[0]);
    }

    @Override
    public boolean tryAdd(String key, long delta, long ceiling) {
        boolean[] added = {false};
        counters.compute(key, (k, current) -> {
            long value = current != null ? current : 0L;
            if (value + delta > ceiling) {
                return current;
            }
            added[0] = true;
            return nonZero(value + delta);
        });
        return added[0];
    }

    @Override
    public long get(String key) {
        Long counter = counters.get(key);
        return counter != null ? counter : 0L;
    }

    @Override
    public void add(String key, long delta) {
        counters.compute(key, (k, current) -> nonZero((current != null ? current : 0L) + delta));
    }

    /**
     * Removes rate windows that have elapsed.
     *
     * @param now Current time.
     * @return Number of windows removed.
     */
    public int purge(long now) {
        int before = windows.size();
        windows.values().removeIf(window -> now >= window.end);
        int removed = Math.max(0, before - windows.size());
        if (removed > 0) {
            log.debug("Purged {} elapsed rate windows", removed);
        }
        return removed;
    }

    /**
     * Gets the number of keys held.
     *
     * @return Count of rate windows and counters.
     */
    public int size() {
        return windows.size() + counters.size();
    }

    /**
     * Clears all counters.
     */
    public void clear() {
        windows.clear();
        counters.clear();
    }

    private static Long nonZero(long value) {
        return value == 0 ? null : value;
    }

    private static final class Window {
        private final long end;
        private final long count;

        private Window(long end, long count) {
            this.end = end;
            this.count = count;
        }
    }
}
