package com.mimecast.outpost.queue.strategy;

import java.io.Serial;
import java.io.Serializable;
import java.util.Objects;

/**
 * Recipient expiry policy: either a time to live or an attempt cap, never both.
 */
public final class QueueExpiry implements Serializable {
    @Serial
    private static final long serialVersionUID = 1L;

    /**
     * Default time to live of 3 days.
     */
    public static final long DEFAULT_TTL = 259_200L;

    /**
     * Expiry kind.
     */
    public enum Kind {
        TTL,
        ATTEMPTS
    }

    private final Kind kind;
    private final long value;

    private QueueExpiry(Kind kind, long value) {
        this.kind = kind;
        this.value = value;
    }

    /**
     * Expire a fixed time after the message was created.
     *
     * @param seconds Time to live in seconds.
     * @return QueueExpiry.
     */
    public static QueueExpiry ttl(long seconds) {
        return new QueueExpiry(Kind.TTL, seconds);
    }

    /**
     * Expire once this many delivery attempts were made.
     *
     * @param count Attempt cap.
     * @return QueueExpiry.
     */
    public static QueueExpiry attempts(long count) {
        return new QueueExpiry(Kind.ATTEMPTS, count);
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isTtl() {
        return kind == Kind.TTL;
    }

    /**
     * Gets the time to live in seconds or the attempt cap, depending on kind.
     *
     * @return Long.
     */
    public long getValue() {
        return value;
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof QueueExpiry && kind == ((QueueExpiry) obj).kind && value == ((QueueExpiry) obj).value;
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, value);
    }

    @Override
    public String toString() {
        return kind == Kind.TTL ? "ttl(" + value + "s)" : "attempts(" + value + ")";
    }
}
