package com.mimecast.outpost.queue.strategy;

import java.util.Optional;

/**
 * Address families to resolve for MX hosts and their order.
 */
public enum IpLookupStrategy {
    IPV4_ONLY("ipv4_only"),
    IPV6_ONLY("ipv6_only"),
    IPV4_THEN_IPV6("ipv4_then_ipv6"),
    IPV6_THEN_IPV4("ipv6_then_ipv4");

    private final String id;

    IpLookupStrategy(String id) {
        this.id = id;
    }

    public String getId() {
        return id;
    }

    /**
     * Parses a configuration value, dashes and underscores are interchangeable.
     *
     * @param value Value.
     * @return Optional of IpLookupStrategy.
     */
    public static Optional<IpLookupStrategy> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase().replace('-', '_');
        for (IpLookupStrategy strategy : values()) {
            if (strategy.id.equals(normalized)) {
                return Optional.of(strategy);
            }
        }
        return Optional.empty();
    }
}
