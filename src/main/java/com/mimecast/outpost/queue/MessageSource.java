package com.mimecast.outpost.queue;

/**
 * How a message entered the queue.
 */
public enum MessageSource {
    AUTHENTICATED("authenticated"),
    UNAUTHENTICATED("unauthenticated"),
    DSN("dsn"),
    REPORT("report"),
    AUTOGENERATED("autogenerated");

    private final String id;

    MessageSource(String id) {
        this.id = id;
    }

    /**
     * Gets the identifier exposed to expressions as {@code source}.
     *
     * @return String.
     */
    public String getId() {
        return id;
    }
}
