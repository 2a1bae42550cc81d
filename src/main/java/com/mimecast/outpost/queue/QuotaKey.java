package com.mimecast.outpost.queue;

import java.io.Serial;
import java.io.Serializable;
import java.util.Objects;

/**
 * Quota reservation held by a queued message.
 *
 * <p>The id ties the reservation to what it was taken for:
 * <ul>
 *     <li>0 for sender quotas</li>
 *     <li>recipient index + 1 for recipient quotas</li>
 *     <li>(recipient index + 1) shifted left 32 bits for recipient domain quotas</li>
 * </ul>
 */
public final class QuotaKey implements Serializable {
    @Serial
    private static final long serialVersionUID = 1L;

    /**
     * Counter kind.
     */
    public enum Kind {
        COUNT,
        SIZE
    }

    private final String key;
    private final long id;
    private final Kind kind;

    /**
     * Constructs a new QuotaKey instance.
     *
     * @param key  Counter key.
     * @param id   Reservation id.
     * @param kind Counter kind.
     */
    public QuotaKey(String key, long id, Kind kind) {
        this.key = key;
        this.id = id;
        this.kind = kind;
    }

    public String getKey() {
        return key;
    }

    public long getId() {
        return id;
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * Gets the counter delta this reservation added.
     *
     * @param size Message size.
     * @return Delta.
     */
    public long getDelta(long size) {
        return kind == Kind.SIZE ? size : 1;
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof QuotaKey
                && key.equals(((QuotaKey) obj).key)
                && id == ((QuotaKey) obj).id
                && kind == ((QuotaKey) obj).kind;
    }

    @Override
    public int hashCode() {
        return Objects.hash(key, id, kind);
    }

    @Override
    public String toString() {
        return kind + ":" + key + "#" + id;
    }
}
