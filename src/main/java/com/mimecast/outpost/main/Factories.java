package com.mimecast.outpost.main;

import com.mimecast.outpost.config.BasicConfig;
import com.mimecast.outpost.queue.DeliveryError;
import com.mimecast.outpost.queue.ErrorDetails;
import com.mimecast.outpost.queue.Status;
import com.mimecast.outpost.queue.delivery.DeliveryTransport;
import com.mimecast.outpost.queue.limit.CounterStore;
import com.mimecast.outpost.queue.limit.InMemoryCounterStore;
import com.mimecast.outpost.queue.limit.RedisCounterStore;
import com.mimecast.outpost.store.InMemoryQueueStore;
import com.mimecast.outpost.store.QueueStore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.concurrent.Callable;

/**
 * Factories for pluggable components.
 *
 * <p>This is a factories container for the queue collaborators.
 * <p>Defaults are used unless a callable is injected.
 */
public class Factories {
    private static final Logger log = LogManager.getLogger(Factories.class);

    /**
     * Private constructor.
     */
    private Factories() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Queue store.
     * <p>Holds messages, queue events and content blobs.
     */
    private static Callable<QueueStore> queueStore;

    /**
     * Counter store.
     * <p>Holds rate limiter windows and quota usage.
     */
    private static Callable<CounterStore> counterStore;

    /**
     * Delivery transport.
     * <p>Performs the actual delivery attempt.
     */
    private static Callable<DeliveryTransport> transport;

    /**
     * Sets QueueStore callable.
     *
     * @param callable QueueStore callable.
     */
    public static void setQueueStore(Callable<QueueStore> callable) {
        queueStore = callable;
    }

    /**
     * Gets QueueStore instance.
     *
     * @return QueueStore instance, in memory by default.
     */
    public static QueueStore getQueueStore() {
        if (queueStore != null) {
            try {
                return queueStore.call();
            } catch (Exception e) {
                log.error("Error calling queue store: {}", e.getMessage());
            }
        }

        return new InMemoryQueueStore();
    }

    /**
     * Sets CounterStore callable.
     *
     * @param callable CounterStore callable.
     */
    public static void setCounterStore(Callable<CounterStore> callable) {
        counterStore = callable;
    }

    /**
     * Gets CounterStore instance.
     * <p>Uses Redis when {@code queue.counter.redis.enabled} is set, in memory otherwise.
     *
     * @return CounterStore instance.
     */
    public static CounterStore getCounterStore() {
        if (counterStore != null) {
            try {
                return counterStore.call();
            } catch (Exception e) {
                log.error("Error calling counter store: {}", e.getMessage());
            }
        }

        BasicConfig redis = Config.getQueue().getSection("queue").getSection("counter").getSection("redis");
        if (redis.getBooleanProperty("enabled", false)) {
            return new RedisCounterStore(redis).initialize();
        }
        return new InMemoryCounterStore();
    }

    /**
     * Sets DeliveryTransport callable.
     *
     * @param callable DeliveryTransport callable.
     */
    public static void setTransport(Callable<DeliveryTransport> callable) {
        transport = callable;
    }

    /**
     * Gets DeliveryTransport instance.
     * <p>Without an injected transport every attempt fails temporarily.
     *
     * @return DeliveryTransport instance.
     */
    public static DeliveryTransport getTransport() {
        if (transport != null) {
            try {
                return transport.call();
            } catch (Exception e) {
                log.error("Error calling delivery transport: {}", e.getMessage());
            }
        }

        return (message, rcpt, plan) -> Status.temporaryFailure(
                new ErrorDetails("localhost", DeliveryError.io("No delivery transport configured")));
    }
}
