package com.mimecast.outpost.queue;

import java.io.Serial;
import java.io.Serializable;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Optional;

/**
 * Virtual queue name.
 *
 * <p>A fixed 8 byte identifier, NUL padded, holding 1 to 8 significant bytes.
 * <p>Used as the key of virtual queues and stored as is next to queue events.
 */
public final class QueueName implements Comparable<QueueName>, Serializable {
    @Serial
    private static final long serialVersionUID = 1L;

    /**
     * Length in bytes.
     */
    public static final int LENGTH = 8;

    /**
     * Implicit queue that always exists.
     */
    public static final QueueName DEFAULT = new QueueName("default".getBytes(StandardCharsets.UTF_8));

    private final byte[] bytes;

    private QueueName(byte[] name) {
        this.bytes = Arrays.copyOf(name, LENGTH);
    }

    /**
     * Creates a queue name from a string.
     *
     * @param name Name, 1 to 8 bytes once UTF-8 encoded.
     * @return Optional of QueueName, empty if the name is empty or too long.
     */
    public static Optional<QueueName> of(String name) {
        if (name == null) {
            return Optional.empty();
        }
        byte[] encoded = name.getBytes(StandardCharsets.UTF_8);
        if (encoded.length < 1 || encoded.length > LENGTH) {
            return Optional.empty();
        }
        return Optional.of(new QueueName(encoded));
    }

    /**
     * Creates a queue name from its raw 8 byte representation.
     *
     * @param raw Raw bytes.
     * @return Optional of QueueName, empty if the input is not exactly 8 bytes.
     */
    public static Optional<QueueName> fromBytes(byte[] raw) {
        if (raw == null || raw.length != LENGTH) {
            return Optional.empty();
        }
        return Optional.of(new QueueName(raw));
    }

    /**
     * Gets the name with trailing NUL bytes removed.
     *
     * @return String.
     */
    public String asString() {
        int end = LENGTH;
        while (end > 0 && bytes[end - 1] == 0) {
            end--;
        }
        return new String(bytes, 0, end, StandardCharsets.UTF_8);
    }

    /**
     * Gets a copy of the raw bytes.
     *
     * @return Byte array of length 8.
     */
    public byte[] toBytes() {
        return Arrays.copyOf(bytes, LENGTH);
    }

    public boolean isDefault() {
        return this.equals(DEFAULT);
    }

    @Override
    public int compareTo(QueueName other) {
        return Arrays.compareUnsigned(bytes, other.bytes);
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof QueueName && Arrays.equals(bytes, ((QueueName) obj).bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return asString();
    }
}
