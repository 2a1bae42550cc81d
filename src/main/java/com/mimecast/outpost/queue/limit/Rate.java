package com.mimecast.outpost.queue.limit;

import com.mimecast.outpost.config.Durations;

import java.time.Duration;
import java.util.Optional;

/**
 * Request rate: a number of requests per period.
 */
public final class Rate {

    private final long requests;
    private final Duration period;

    /**
     * Constructs a new Rate instance.
     *
     * @param requests Requests allowed per period.
     * @param period   Period.
     */
    public Rate(long requests, Duration period) {
        this.requests = requests;
        this.period = period;
    }

    /**
     * Parses a rate such as {@code 10/1m}.
     *
     * @param value Value.
     * @return Optional of Rate, empty if malformed.
     */
    public static Optional<Rate> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        int slash = value.indexOf('/');
        if (slash <= 0) {
            return Optional.empty();
        }
        try {
            long requests = Long.parseLong(value.substring(0, slash).trim());
            Optional<Duration> period = Durations.parse(value.substring(slash + 1).trim());
            if (requests <= 0 || period.isEmpty() || period.get().isZero()) {
                return Optional.empty();
            }
            return Optional.of(new Rate(requests, period.get()));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    public long getRequests() {
        return requests;
    }

    public Duration getPeriod() {
        return period;
    }

    @Override
    public String toString() {
        return requests + "/" + period.getSeconds() + "s";
    }
}
