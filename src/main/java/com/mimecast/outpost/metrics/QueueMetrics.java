package com.mimecast.outpost.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Queue related Micrometer metrics.
 *
 * <p>Counters for delivery outcomes, DSNs, throttling and dispatch plus a gauge of active workers per virtual queue.
 * <p>Metric failures are logged and never affect delivery.
 */
public final class QueueMetrics {
    private static final Logger log = LogManager.getLogger(QueueMetrics.class);

    /**
     * Private constructor for utility class.
     */
    private QueueMetrics() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Increment the delivery counter.
     *
     * @param outcome Outcome such as completed, temporary or permanent.
     */
    public static void incrementDelivery(String outcome) {
        increment("queue.delivery.attempts", "Number of recipient delivery attempts by outcome", "outcome", outcome);
    }

    /**
     * Increment the DSN counter.
     *
     * @param type DSN type such as success, delay or failure.
     */
    public static void incrementDsn(String type) {
        increment("queue.dsn.sent", "Number of delivery status notifications by type", "type", type);
    }

    /**
     * Increment the double bounce counter.
     * <p>Called when a bounce itself could not be delivered.
     */
    public static void incrementDoubleBounce() {
        increment("queue.dsn.double.bounce", "Number of undeliverable bounces", null, null);
    }

    /**
     * Increment the throttle deferral counter.
     *
     * @param direction Inbound or outbound.
     * @param reason    Rate or concurrency.
     */
    public static void incrementThrottled(String direction, String reason) {
        try {
            Counter.builder("queue.throttle.deferred")
                    .description("Number of operations deferred by rate or concurrency limiters")
                    .tag("direction", direction)
                    .tag("reason", reason)
                    .register(MetricsRegistry.getRegistry())
                    .increment();
        } catch (Exception e) {
            log.warn("Failed to increment throttle counter: {}", e.getMessage());
        }
    }

    /**
     * Increment the quota rejection counter.
     */
    public static void incrementQuotaRejection() {
        increment("queue.quota.rejected", "Number of messages rejected by quotas", null, null);
    }

    /**
     * Increment the dispatcher rejection counter.
     *
     * @param queue Virtual queue name.
     */
    public static void incrementDispatchRejection(String queue) {
        increment("queue.dispatch.rejected", "Number of tasks refused by a saturated virtual queue", "queue", queue);
    }

    /**
     * Register the active worker gauge of a virtual queue.
     *
     * @param queue    Virtual queue name.
     * @param executor Worker pool.
     */
    public static void registerWorkerGauge(String queue, ThreadPoolExecutor executor) {
        try {
            Gauge.builder("queue.workers.active", executor, ThreadPoolExecutor::getActiveCount)
                    .description("Number of busy workers per virtual queue")
                    .tag("queue", queue)
                    .register(MetricsRegistry.getRegistry());
        } catch (Exception e) {
            log.warn("Failed to register worker gauge for queue {}: {}", queue, e.getMessage());
        }
    }

    private static void increment(String name, String description, String tag, String value) {
        try {
            MeterRegistry registry = MetricsRegistry.getRegistry();
            Counter.Builder builder = Counter.builder(name).description(description);
            if (tag != null) {
                builder.tag(tag, value);
            }
            builder.register(registry).increment();
        } catch (Exception e) {
            log.warn("Failed to increment {} counter: {}", name, e.getMessage());
        }
    }
}
