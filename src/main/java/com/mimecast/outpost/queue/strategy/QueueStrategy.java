package com.mimecast.outpost.queue.strategy;

import com.google.common.collect.ImmutableList;
import com.mimecast.outpost.queue.QueueName;

import java.util.List;

/**
 * Schedule strategy: retry and notification intervals, expiry and target virtual queue.
 *
 * <p>Retry and notify intervals are never empty.
 */
public final class QueueStrategy {

    /**
     * Retry interval used when none is configured.
     */
    public static final long DEFAULT_RETRY = 3600L;

    /**
     * Notification interval used when none is configured, far enough to never fire.
     */
    public static final long DEFAULT_NOTIFY = 10_000L * 86_400L;

    /**
     * Built-in strategy used when the catalog has no default entry.
     */
    public static final QueueStrategy DEFAULT = new QueueStrategy(
            List.of(120L, 300L, 600L, 900L, 1800L, 3600L, 7200L),
            List.of(86_400L, 259_200L),
            QueueExpiry.ttl(432_000L),
            QueueName.DEFAULT);

    private final ImmutableList<Long> retry;
    private final ImmutableList<Long> notify;
    private final QueueExpiry expiry;
    private final QueueName virtualQueue;

    /**
     * Constructs a new QueueStrategy instance.
     *
     * @param retry        Retry intervals in seconds, defaulted when empty.
     * @param notify       Notification intervals in seconds, defaulted when empty.
     * @param expiry       Expiry policy.
     * @param virtualQueue Virtual queue name.
     */
    public QueueStrategy(List<Long> retry, List<Long> notify, QueueExpiry expiry, QueueName virtualQueue) {
        this.retry = retry == null || retry.isEmpty() ? ImmutableList.of(DEFAULT_RETRY) : ImmutableList.copyOf(retry);
        this.notify = notify == null || notify.isEmpty() ? ImmutableList.of(DEFAULT_NOTIFY) : ImmutableList.copyOf(notify);
        this.expiry = expiry != null ? expiry : QueueExpiry.ttl(QueueExpiry.DEFAULT_TTL);
        this.virtualQueue = virtualQueue != null ? virtualQueue : QueueName.DEFAULT;
    }

    public List<Long> getRetry() {
        return retry;
    }

    public List<Long> getNotify() {
        return notify;
    }

    /**
     * Gets the retry interval for a given attempt, the last one repeating once exhausted.
     *
     * @param attempt Attempts made so far.
     * @return Seconds.
     */
    public long getRetryInterval(int attempt) {
        return retry.get(Math.min(Math.max(attempt, 0), retry.size() - 1));
    }

    public QueueExpiry getExpiry() {
        return expiry;
    }

    public QueueName getVirtualQueue() {
        return virtualQueue;
    }

    @Override
    public String toString() {
        return "QueueStrategy{retry=" + retry + ", notify=" + notify + ", expiry=" + expiry
                + ", queue=" + virtualQueue + "}";
    }
}
