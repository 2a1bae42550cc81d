package com.mimecast.outpost.queue.strategy;

/**
 * Virtual queue, a named worker pool with its own concurrency budget.
 */
public final class VirtualQueue {

    /**
     * Built-in pool used when the catalog has no entry for a queue.
     */
    public static final VirtualQueue DEFAULT = new VirtualQueue(25);

    private final int threads;

    /**
     * Constructs a new VirtualQueue instance.
     *
     * @param threads Worker count, at least 1.
     */
    public VirtualQueue(int threads) {
        this.threads = Math.max(1, threads);
    }

    public int getThreads() {
        return threads;
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof VirtualQueue && threads == ((VirtualQueue) obj).threads;
    }

    @Override
    public int hashCode() {
        return threads;
    }

    @Override
    public String toString() {
        return "VirtualQueue{threads=" + threads + "}";
    }
}
