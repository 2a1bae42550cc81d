package com.mimecast.outpost.queue.limit;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Caps the number of simultaneous operations sharing a key.
 */
public class ConcurrencyLimiter {

    private final int max;
    private final AtomicInteger active = new AtomicInteger();
    private final Consumer<ConcurrencyLimiter> onIdle;

    /**
     * Constructs a new ConcurrencyLimiter instance.
     *
     * @param max Maximum simultaneous operations.
     */
    public ConcurrencyLimiter(int max) {
        this(max, limiter -> {
        });
    }

    /**
     * Constructs a new ConcurrencyLimiter instance.
     *
     * @param max    Maximum simultaneous operations.
     * @param onIdle Called when the last slot is released.
     */
    public ConcurrencyLimiter(int max, Consumer<ConcurrencyLimiter> onIdle) {
        this.max = max;
        this.onIdle = onIdle;
    }

    /**
     * Tries to take a slot.
     *
     * @return Optional of InFlight, empty when all slots are taken.
     */
    public Optional<InFlight> tryAcquire() {
        while (true) {
            int current = active.get();
            if (current >= max) {
                return Optional.empty();
            }
            if (active.compareAndSet(current, current + 1)) {
                return Optional.of(new InFlight(this));
            }
        }
    }

    public int getActive() {
        return active.get();
    }

    public int getMax() {
        return max;
    }

    /**
     * Checks if no slot is taken.
     *
     * @return Boolean.
     */
    public boolean isIdle() {
        return active.get() == 0;
    }

    /**
     * Slot held for the duration of one operation.
     * <p>Closing it more than once releases the slot only once.
     */
    public static final class InFlight implements AutoCloseable {
        private final ConcurrencyLimiter limiter;
        private final AtomicBoolean released = new AtomicBoolean();

        private InFlight(ConcurrencyLimiter limiter) {
            this.limiter = limiter;
        }

        @Override
        public void close() {
            if (released.compareAndSet(false, true) && limiter.active.decrementAndGet() == 0) {
                limiter.onIdle.accept(limiter);
            }
        }
    }
}
