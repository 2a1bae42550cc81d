package com.mimecast.outpost.metrics;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

/**
 * Global access to the meter registry used by queue components.
 */
public final class MetricsRegistry {
    private static volatile MeterRegistry registry = new SimpleMeterRegistry();

    /**
     * Private constructor for utility class.
     */
    private MetricsRegistry() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Register the meter registry.
     * <p>Exporting registries are injected here by the embedding application.
     *
     * @param meterRegistry Meter registry.
     */
    public static void register(MeterRegistry meterRegistry) {
        registry = meterRegistry;
    }

    /**
     * Get the meter registry.
     *
     * @return MeterRegistry.
     */
    public static MeterRegistry getRegistry() {
        return registry;
    }
}
