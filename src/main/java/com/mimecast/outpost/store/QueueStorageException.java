package com.mimecast.outpost.store;

/**
 * Storage or counter backend failure.
 *
 * <p>Callers leave queue state untouched and retry later.
 */
public class QueueStorageException extends RuntimeException {

    /**
     * Constructs a new QueueStorageException instance.
     *
     * @param message Message.
     */
    public QueueStorageException(String message) {
        super(message);
    }

    /**
     * Constructs a new QueueStorageException instance.
     *
     * @param message Message.
     * @param cause   Cause.
     */
    public QueueStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
