package com.mimecast.outpost.config;

import org.apache.commons.lang3.StringUtils;

import java.time.Duration;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Duration value parser.
 *
 * <p>Accepts {@code <n>ms}, {@code <n>s}, {@code <n>m}, {@code <n>h}, {@code <n>d} and {@code <n>w}.
 * <p>A bare number is read as seconds.
 */
public final class Durations {

    private static final Pattern PATTERN = Pattern.compile("^(\\d+)\\s*(ms|s|m|h|d|w)?$", Pattern.CASE_INSENSITIVE);

    /**
     * Private constructor for utility class.
     */
    private Durations() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Parses a configuration value into a duration.
     *
     * @param value String or Number.
     * @return Optional of Duration, empty if the value is not a valid duration.
     */
    public static Optional<Duration> parse(Object value) {
        if (value instanceof Number) {
            long seconds = ((Number) value).longValue();
            return seconds >= 0 ? Optional.of(Duration.ofSeconds(seconds)) : Optional.empty();
        }
        if (!(value instanceof String) || StringUtils.isBlank((String) value)) {
            return Optional.empty();
        }

        Matcher matcher = PATTERN.matcher(((String) value).trim());
        if (!matcher.matches()) {
            return Optional.empty();
        }

        long amount = Long.parseLong(matcher.group(1));
        String unit = matcher.group(2) != null ? matcher.group(2).toLowerCase() : "s";
        switch (unit) {
            case "ms":
                return Optional.of(Duration.ofMillis(amount));
            case "m":
                return Optional.of(Duration.ofMinutes(amount));
            case "h":
                return Optional.of(Duration.ofHours(amount));
            case "d":
                return Optional.of(Duration.ofDays(amount));
            case "w":
                return Optional.of(Duration.ofDays(amount * 7));
            default:
                return Optional.of(Duration.ofSeconds(amount));
        }
    }
}
