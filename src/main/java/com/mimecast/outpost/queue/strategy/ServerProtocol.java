package com.mimecast.outpost.queue.strategy;

import java.util.Optional;

/**
 * Relay host protocol.
 */
public enum ServerProtocol {
    SMTP,
    LMTP;

    /**
     * Parses a configuration value.
     *
     * @param value Value.
     * @return Optional of ServerProtocol.
     */
    public static Optional<ServerProtocol> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        switch (value.trim().toLowerCase()) {
            case "smtp":
                return Optional.of(SMTP);
            case "lmtp":
                return Optional.of(LMTP);
            default:
                return Optional.empty();
        }
    }
}
