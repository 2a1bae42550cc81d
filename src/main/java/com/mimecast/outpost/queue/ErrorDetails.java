package com.mimecast.outpost.queue;

import java.io.Serial;
import java.io.Serializable;
import java.util.Objects;

/**
 * Failure payload: the entity involved (host, domain or {@code localhost}) and the error.
 */
public final class ErrorDetails implements Serializable {
    @Serial
    private static final long serialVersionUID = 1L;

    private final String entity;
    private final DeliveryError error;

    /**
     * Constructs a new ErrorDetails instance.
     *
     * @param entity Host or domain the error relates to.
     * @param error  Delivery error.
     */
    public ErrorDetails(String entity, DeliveryError error) {
        this.entity = entity != null ? entity : "localhost";
        this.error = Objects.requireNonNull(error);
    }

    public String getEntity() {
        return entity;
    }

    public DeliveryError getError() {
        return error;
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof ErrorDetails
                && entity.equals(((ErrorDetails) obj).entity)
                && error.equals(((ErrorDetails) obj).error);
    }

    @Override
    public int hashCode() {
        return Objects.hash(entity, error);
    }

    @Override
    public String toString() {
        return entity + ": " + error;
    }
}
