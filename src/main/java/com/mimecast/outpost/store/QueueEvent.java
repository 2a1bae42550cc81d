package com.mimecast.outpost.store;

import com.mimecast.outpost.queue.QueueName;

import java.util.Comparator;
import java.util.Objects;

/**
 * Scheduled wake-up of a message on a virtual queue.
 *
 * <p>Events sort by due time, then queue id, then queue name.
 */
public final class QueueEvent implements Comparable<QueueEvent> {

    private static final Comparator<QueueEvent> ORDER = Comparator
            .comparingLong(QueueEvent::getDue)
            .thenComparingLong(QueueEvent::getQueueId)
            .thenComparing(QueueEvent::getQueue);

    private final long due;
    private final long queueId;
    private final QueueName queue;

    /**
     * Constructs a new QueueEvent instance.
     *
     * @param due     Due time in seconds.
     * @param queueId Message id.
     * @param queue   Virtual queue.
     */
    public QueueEvent(long due, long queueId, QueueName queue) {
        this.due = due;
        this.queueId = queueId;
        this.queue = Objects.requireNonNull(queue);
    }

    public long getDue() {
        return due;
    }

    public long getQueueId() {
        return queueId;
    }

    public QueueName getQueue() {
        return queue;
    }

    @Override
    public int compareTo(QueueEvent other) {
        return ORDER.compare(this, other);
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof QueueEvent)) {
            return false;
        }
        QueueEvent other = (QueueEvent) obj;
        return due == other.due && queueId == other.queueId && queue.equals(other.queue);
    }

    @Override
    public int hashCode() {
        return Objects.hash(due, queueId, queue);
    }

    @Override
    public String toString() {
        return "QueueEvent{due=" + due + ", uid=" + queueId + ", queue=" + queue + "}";
    }
}
