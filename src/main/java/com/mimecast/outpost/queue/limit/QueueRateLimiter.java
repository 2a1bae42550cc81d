package com.mimecast.outpost.queue.limit;

import com.mimecast.outpost.expr.Expression;

import java.util.Optional;
import java.util.OptionalInt;

/**
 * Configured rate and concurrency limiter.
 */
public final class QueueRateLimiter {

    private final String id;
    private final Expression match;
    private final int keys;
    private final Rate rate;
    private final Integer concurrency;

    /**
     * Constructs a new QueueRateLimiter instance.
     *
     * @param id          Limiter id.
     * @param match       Condition, empty to always apply.
     * @param keys        Dimension bits.
     * @param rate        Rate, may be null.
     * @param concurrency Concurrency cap, may be null.
     */
    public QueueRateLimiter(String id, Expression match, int keys, Rate rate, Integer concurrency) {
        this.id = id;
        this.match = match != null ? match : Expression.EMPTY;
        this.keys = keys;
        this.rate = rate;
        this.concurrency = concurrency;
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

    public Optional<Rate> getRate() {
        return Optional.ofNullable(rate);
    }

    public OptionalInt getConcurrency() {
        return concurrency != null ? OptionalInt.of(concurrency) : OptionalInt.empty();
    }

    @Override
    public String toString() {
        return "QueueRateLimiter{" + id + ", keys=" + Integer.toBinaryString(keys) + ", rate=" + rate
                + ", concurrency=" + concurrency + "}";
    }
}
