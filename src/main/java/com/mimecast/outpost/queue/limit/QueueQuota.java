package com.mimecast.outpost.queue.limit;

import com.mimecast.outpost.expr.Expression;

import java.util.OptionalLong;

/**
 * Configured queue quota: ceilings on total size and message count per key.
 */
public final class QueueQuota {

    private final String id;
    private final Expression match;
    private final int keys;
    private final Long size;
    private final Long messages;

    /**
     * Constructs a new QueueQuota instance.
     *
     * @param id       Quota id.
     * @param match    Condition, the quota only applies when it holds.
     * @param keys     Dimension bits.
     * @param size     Size ceiling in bytes, may be null.
     * @param messages Message count ceiling, may be null.
     */
    public QueueQuota(String id, Expression match, int keys, Long size, Long messages) {
        this.id = id;
        this.match = match != null ? match : Expression.EMPTY;
        this.keys = keys;
        this.size = size;
        this.messages = messages;
    }

    public String getId() {
        return id;
    }

    public Expression getMatch() {
        return match;
    }

    public int getKeys() {
        return keys;
    }

    public boolean hasKey(int mask) {
        return (keys & mask) != 0;
    }

    public OptionalLong getSize() {
        return size != null ? OptionalLong.of(size) : OptionalLong.empty();
    }

    public OptionalLong getMessages() {
        return messages != null ? OptionalLong.of(messages) : OptionalLong.empty();
    }

    @Override
    public String toString() {
        return "QueueQuota{" + id + ", keys=" + Integer.toBinaryString(keys) + ", size=" + size
                + ", messages=" + messages + "}";
    }
}
