package com.mimecast.outpost.expr;

/**
 * Functions that need data from outside the expression.
 */
public interface ExpressionFunctions {

    /**
     * Checks if a domain is handled locally.
     *
     * @param directory Directory name, {@code *} for any.
     * @param domain    Domain.
     * @return Boolean.
     */
    boolean isLocalDomain(String directory, String domain);

    /**
     * Gets a configuration value by dotted key.
     *
     * @param key Key.
     * @return Value, empty string if missing.
     */
    String configGet(String key);
}
