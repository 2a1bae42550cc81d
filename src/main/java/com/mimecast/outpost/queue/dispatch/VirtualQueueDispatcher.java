package com.mimecast.outpost.queue.dispatch;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.mimecast.outpost.metrics.QueueMetrics;
import com.mimecast.outpost.queue.QueueName;
import com.mimecast.outpost.queue.strategy.VirtualQueue;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Runs delivery tasks on one bounded worker pool per virtual queue.
 *
 * <p>A saturated pool refuses work instead of blocking, other pools are unaffected.
 * <p>Unknown queue names run on the default pool.
 */
public class VirtualQueueDispatcher {
    private static final Logger log = LogManager.getLogger(VirtualQueueDispatcher.class);

    private final Map<QueueName, ThreadPoolExecutor> pools = new LinkedHashMap<>();

    /**
     * Constructs a new VirtualQueueDispatcher instance.
     *
     * @param queues Virtual queues by name, a default pool is added when missing.
     */
    public VirtualQueueDispatcher(Map<QueueName, VirtualQueue> queues) {
        for (Map.Entry<QueueName, VirtualQueue> entry : queues.entrySet()) {
            pools.put(entry.getKey(), createPool(entry.getKey(), entry.getValue().getThreads()));
        }
        if (!pools.containsKey(QueueName.DEFAULT)) {
            pools.put(QueueName.DEFAULT, createPool(QueueName.DEFAULT, VirtualQueue.DEFAULT.getThreads()));
        }
        log.info("Virtual queue dispatcher started: queues={}", pools.keySet());
    }

    /**
     * Submits a task to the pool of a virtual queue.
     *
     * @param queue Virtual queue name.
     * @param task  Task.
     * @return Boolean, false if the pool is saturated or shut down.
     */
    public boolean dispatch(QueueName queue, Runnable task) {
        ThreadPoolExecutor pool = getPool(queue);
        try {
            pool.execute(task);
            return true;
        } catch (RejectedExecutionException e) {
            QueueMetrics.incrementDispatchRejection(queue.asString());
            log.debug("Virtual queue saturated: queue={} active={} waiting={}", queue, pool.getActiveCount(), pool.getQueue().size());
            return false;
        }
    }

    /**
     * Checks if a pool can take more work.
     *
     * @param queue Virtual queue name.
     * @return Boolean.
     */
    public boolean hasCapacity(QueueName queue) {
        ThreadPoolExecutor pool = getPool(queue);
        return !pool.isShutdown() && pool.getQueue().remainingCapacity() > 0;
    }

    /**
     * Gets the number of busy workers of a pool.
     *
     * @param queue Virtual queue name.
     * @return Count.
     */
    public int getActiveCount(QueueName queue) {
        return getPool(queue).getActiveCount();
    }

    public Map<QueueName, ThreadPoolExecutor> getPools() {
        return Collections.unmodifiableMap(pools);
    }

    /**
     * Stops accepting work and waits for running tasks.
     *
     * @param timeoutSeconds Maximum wait per pool.
     */
    public void shutdown(long timeoutSeconds) {
        pools.values().forEach(ThreadPoolExecutor::shutdown);
        for (Map.Entry<QueueName, ThreadPoolExecutor> entry : pools.entrySet()) {
            try {
                if (!entry.getValue().awaitTermination(timeoutSeconds, TimeUnit.SECONDS)) {
                    log.warn("Virtual queue did not drain in time: queue={}", entry.getKey());
                    entry.getValue().shutdownNow();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                entry.getValue().shutdownNow();
            }
        }
        log.info("Virtual queue dispatcher stopped");
    }

    private ThreadPoolExecutor getPool(QueueName queue) {
        ThreadPoolExecutor pool = pools.get(queue);
        return pool != null ? pool : pools.get(QueueName.DEFAULT);
    }

    private static ThreadPoolExecutor createPool(QueueName name, int threads) {
        ThreadPoolExecutor pool = new ThreadPoolExecutor(threads, threads, 60L, TimeUnit.SECONDS,
                new ArrayBlockingQueue<>(threads),
                new ThreadFactoryBuilder().setNameFormat("queue-" + name.asString() + "-%d").setDaemon(true).build(),
                new ThreadPoolExecutor.AbortPolicy());
        QueueMetrics.registerWorkerGauge(name.asString(), pool);
        return pool;
    }
}
