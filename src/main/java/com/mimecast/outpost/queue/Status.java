package com.mimecast.outpost.queue;

import java.io.Serial;
import java.io.Serializable;
import java.util.Objects;
import java.util.Optional;

/**
 * Delivery status of a recipient.
 *
 * <p>Exactly one of scheduled, temporary failure, permanent failure or completed.
 * <p>Instances are immutable; transitions build new instances.
 *
 * @param <T> Success payload type.
 * @param <E> Failure payload type.
 */
public final class Status<T, E> implements Serializable {
    @Serial
    private static final long serialVersionUID = 1L;

    /**
     * Status type.
     */
    public enum Type {
        SCHEDULED,
        TEMPORARY_FAILURE,
        PERMANENT_FAILURE,
        COMPLETED
    }

    private final Type type;
    private final T response;
    private final E error;

    private Status(Type type, T response, E error) {
        this.type = type;
        this.response = response;
        this.error = error;
    }

    public static <T, E> Status<T, E> scheduled() {
        return new Status<>(Type.SCHEDULED, null, null);
    }

    public static <T, E> Status<T, E> completed(T response) {
        return new Status<>(Type.COMPLETED, Objects.requireNonNull(response), null);
    }

    public static <T, E> Status<T, E> temporaryFailure(E error) {
        return new Status<>(Type.TEMPORARY_FAILURE, null, Objects.requireNonNull(error));
    }

    public static <T, E> Status<T, E> permanentFailure(E error) {
        return new Status<>(Type.PERMANENT_FAILURE, null, Objects.requireNonNull(error));
    }

    public Type getType() {
        return type;
    }

    /**
     * Gets the success payload.
     *
     * @return Optional of response, present only when completed.
     */
    public Optional<T> getResponse() {
        return Optional.ofNullable(response);
    }

    /**
     * Gets the failure payload.
     *
     * @return Optional of error, present only for failures.
     */
    public Optional<E> getError() {
        return Optional.ofNullable(error);
    }

    /**
     * Collapses a temporary failure into a permanent one.
     * <p>Used when a recipient expires. Other states are returned unchanged.
     *
     * @return Status.
     */
    public Status<T, E> intoPermanent() {
        if (type == Type.TEMPORARY_FAILURE) {
            return new Status<>(Type.PERMANENT_FAILURE, null, error);
        }
        return this;
    }

    /**
     * Turns a permanent failure back into a temporary one.
     * <p>Used for administrative retries. Other states are returned unchanged.
     *
     * @return Status.
     */
    public Status<T, E> intoTemporary() {
        if (type == Type.PERMANENT_FAILURE) {
            return new Status<>(Type.TEMPORARY_FAILURE, null, error);
        }
        return this;
    }

    public boolean isScheduled() {
        return type == Type.SCHEDULED;
    }

    public boolean isTemporary() {
        return type == Type.TEMPORARY_FAILURE;
    }

    public boolean isPermanent() {
        return type == Type.PERMANENT_FAILURE;
    }

    public boolean isCompleted() {
        return type == Type.COMPLETED;
    }

    /**
     * Still owes a delivery attempt.
     *
     * @return True if scheduled or temporarily failed.
     */
    public boolean isPending() {
        return type == Type.SCHEDULED || type == Type.TEMPORARY_FAILURE;
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof Status)) {
            return false;
        }
        Status<?, ?> other = (Status<?, ?>) obj;
        return type == other.type && Objects.equals(response, other.response) && Objects.equals(error, other.error);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, response, error);
    }

    @Override
    public String toString() {
        switch (type) {
            case COMPLETED:
                return "Completed(" + response + ")";
            case TEMPORARY_FAILURE:
                return "TemporaryFailure(" + error + ")";
            case PERMANENT_FAILURE:
                return "PermanentFailure(" + error + ")";
            default:
                return "Scheduled";
        }
    }
}
