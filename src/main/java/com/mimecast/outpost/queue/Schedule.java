package com.mimecast.outpost.queue;

import java.io.Serial;
import java.io.Serializable;

/**
 * Attempt counter and due time, in seconds since epoch, for retries and notifications.
 */
public final class Schedule implements Serializable {
    @Serial
    private static final long serialVersionUID = 1L;

    /**
     * Due time meaning never.
     */
    public static final long NEVER = Long.MAX_VALUE;

    private int attempt;
    private long due;

    /**
     * Constructs a new Schedule instance.
     *
     * @param attempt Attempts made so far.
     * @param due     Due time.
     */
    public Schedule(int attempt, long due) {
        this.attempt = attempt;
        this.due = due;
    }

    /**
     * Schedule due immediately.
     *
     * @param now Current time.
     * @return Schedule.
     */
    public static Schedule now(long now) {
        return new Schedule(0, now);
    }

    /**
     * Schedule due at a later time.
     *
     * @param due Due time.
     * @return Schedule.
     */
    public static Schedule later(long due) {
        return new Schedule(0, due);
    }

    public int getAttempt() {
        return attempt;
    }

    public long getDue() {
        return due;
    }

    /**
     * Sets the due time.
     *
     * @param due Due time.
     * @return Self.
     */
    public Schedule setDue(long due) {
        this.due = due;
        return this;
    }

    /**
     * Increments the attempt counter.
     *
     * @return Self.
     */
    public Schedule incrementAttempt() {
        this.attempt++;
        return this;
    }

    @Override
    public String toString() {
        return "Schedule{attempt=" + attempt + ", due=" + (due == NEVER ? "never" : String.valueOf(due)) + "}";
    }
}
