package com.mimecast.outpost.queue.strategy;

import java.util.Optional;

/**
 * Enforcement level of a transport security mechanism.
 */
public enum RequireOptional {
    OPTIONAL,
    REQUIRE,
    DISABLE;

    /**
     * Parses a configuration value.
     *
     * @param value Value.
     * @return Optional of RequireOptional, empty for unknown values.
     */
    public static Optional<RequireOptional> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        switch (value.trim().toLowerCase()) {
            case "optional":
                return Optional.of(OPTIONAL);
            case "require":
            case "required":
                return Optional.of(REQUIRE);
            case "disable":
            case "disabled":
            case "none":
            case "false":
                return Optional.of(DISABLE);
            default:
                return Optional.empty();
        }
    }
}
