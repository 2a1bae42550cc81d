package com.mimecast.outpost.queue.strategy;

import java.util.Objects;

/**
 * Relay authentication credentials.
 */
public final class Credentials {

    private final String username;
    private final String secret;

    /**
     * Constructs a new Credentials instance.
     *
     * @param username Username.
     * @param secret   Secret.
     */
    public Credentials(String username, String secret) {
        this.username = Objects.requireNonNull(username);
        this.secret = Objects.requireNonNull(secret);
    }

    public String getUsername() {
        return username;
    }

    public String getSecret() {
        return secret;
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof Credentials
                && username.equals(((Credentials) obj).username)
                && secret.equals(((Credentials) obj).secret);
    }

    @Override
    public int hashCode() {
        return Objects.hash(username, secret);
    }

    @Override
    public String toString() {
        return "Credentials{username=" + username + "}";
    }
}
