package com.mimecast.outpost.config;

/**
 * Configuration error.
 *
 * <p>Recorded against a single configuration key while loading; the entry it refers to is dropped
 * or defaulted, the rest of the configuration keeps loading.
 * <p>Parse errors describe malformed values, build errors describe values that are well formed
 * but not usable in their context.
 */
public class ConfigError {

    /**
     * Error kind.
     */
    public enum Kind {
        PARSE,
        BUILD
    }

    private final Kind kind;
    private final String key;
    private final String message;

    /**
     * Constructs a new ConfigError instance.
     *
     * @param kind    Error kind.
     * @param key     Configuration key.
     * @param message Error description.
     */
    public ConfigError(Kind kind, String key, String message) {
        this.kind = kind;
        this.key = key;
        this.message = message;
    }

    public Kind getKind() {
        return kind;
    }

    public String getKey() {
        return key;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return kind.name().toLowerCase() + " error at " + key + ": " + message;
    }
}
