package com.mimecast.outpost.queue.dispatch;

/**
 * Outcome of a worker run, tells the housekeeper when the message may be picked up again.
 */
public final class WorkerResult {

    /**
     * Result type.
     */
    public enum Type {
        COMPLETED,
        LOCKED
    }

    private static final WorkerResult COMPLETED = new WorkerResult(Type.COMPLETED, 0L);

    private final Type type;
    private final long until;

    private WorkerResult(Type type, long until) {
        this.type = type;
        this.until = until;
    }

    /**
     * The message was processed, its events reflect what is due next.
     *
     * @return WorkerResult.
     */
    public static WorkerResult completed() {
        return COMPLETED;
    }

    /**
     * The message must not be picked up before a time.
     *
     * @param until Time in seconds.
     * @return WorkerResult.
     */
    public static WorkerResult locked(long until) {
        return new WorkerResult(Type.LOCKED, until);
    }

    public Type getType() {
        return type;
    }

    public long getUntil() {
        return until;
    }

    @Override
    public String toString() {
        return type == Type.LOCKED ? "Locked(" + until + ")" : type.name();
    }
}
