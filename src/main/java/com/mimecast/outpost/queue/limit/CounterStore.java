package com.mimecast.outpost.queue.limit;

import java.util.OptionalLong;

/**
 * Shared counters backing rate limiters and quotas.
 *
 * <p>Implementations must make {@link #tryRate} and {@link #tryAdd} atomic
 * so concurrent workers never overshoot a limit.
 */
public interface CounterStore {

    /**
     * Counts one request against a rate.
     *
     * @param key  Counter key.
     * @param rate Rate.
     * @param now  Current time in seconds.
     * @return OptionalLong of seconds until the window refills, empty if the request is allowed.
     */
    OptionalLong tryRate(String key, Rate rate, long now);

    /**
     * Adds to a counter unless the result would exceed the ceiling.
     *
     * @param key     Counter key.
     * @param delta   Amount to add.
     * @param ceiling Maximum value allowed after adding.
     * @return Boolean, false if nothing was added.
     */
    boolean tryAdd(String key, long delta, long ceiling);

    /**
     * Gets a counter value.
     *
     * @param key Counter key.
     * @return Value, 0 if unknown.
     */
    long get(String key);

    /**
     * Adds to a counter unconditionally.
     * <p>Negative deltas release reservations.
     *
     * @param key   Counter key.
     * @param delta Amount to add.
     */
    void add(String key, long delta);
}
