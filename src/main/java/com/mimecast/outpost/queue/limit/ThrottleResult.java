package com.mimecast.outpost.queue.limit;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of a limiter or quota check.
 *
 * <p>An admitted result may hold concurrency slots; call {@link #release()} once the
 * operation it guarded has finished.
 */
public final class ThrottleResult {

    /**
     * Result type.
     */
    public enum Type {
        ADMIT,
        DEFERRED,
        REJECTED
    }

    /**
     * What limited the operation.
     */
    public enum Reason {
        RATE,
        CONCURRENCY,
        QUOTA
    }

    private final Type type;
    private final Reason reason;
    private final long retryAt;
    private final String limiterId;
    private final List<ConcurrencyLimiter.InFlight> inFlight;

    private ThrottleResult(Type type, Reason reason, long retryAt, String limiterId, List<ConcurrencyLimiter.InFlight> inFlight) {
        this.type = type;
        this.reason = reason;
        this.retryAt = retryAt;
        this.limiterId = limiterId;
        this.inFlight = inFlight;
    }

    /**
     * Admitted.
     *
     * @param inFlight Concurrency slots taken.
     * @return ThrottleResult.
     */
    public static ThrottleResult admit(List<ConcurrencyLimiter.InFlight> inFlight) {
        return new ThrottleResult(Type.ADMIT, null, 0L, null, List.copyOf(inFlight));
    }

    /**
     * Deferred by a rate limit.
     *
     * @param limiterId Limiter id.
     * @param retryAt   Time the window refills.
     * @return ThrottleResult.
     */
    public static ThrottleResult rateLimited(String limiterId, long retryAt) {
        return new ThrottleResult(Type.DEFERRED, Reason.RATE, retryAt, limiterId, List.of());
    }

    /**
     * Deferred by a concurrency limit.
     *
     * @param limiterId Limiter id.
     * @return ThrottleResult.
     */
    public static ThrottleResult concurrencyLimited(String limiterId) {
        return new ThrottleResult(Type.DEFERRED, Reason.CONCURRENCY, 0L, limiterId, List.of());
    }

    /**
     * Rejected by a quota.
     *
     * @param quotaId Quota id.
     * @return ThrottleResult.
     */
    public static ThrottleResult quotaExceeded(String quotaId) {
        return new ThrottleResult(Type.REJECTED, Reason.QUOTA, 0L, quotaId, List.of());
    }

    public Type getType() {
        return type;
    }

    public boolean isAdmitted() {
        return type == Type.ADMIT;
    }

    public boolean isDeferred() {
        return type == Type.DEFERRED;
    }

    public boolean isRejected() {
        return type == Type.REJECTED;
    }

    public Optional<Reason> getReason() {
        return Optional.ofNullable(reason);
    }

    /**
     * Gets the time a rate limited operation may be retried.
     *
     * @return Time in seconds, 0 unless rate limited.
     */
    public long getRetryAt() {
        return retryAt;
    }

    public Optional<String> getLimiterId() {
        return Optional.ofNullable(limiterId);
    }

    public List<ConcurrencyLimiter.InFlight> getInFlight() {
        return inFlight;
    }

    /**
     * Releases the concurrency slots held.
     */
    public void release() {
        inFlight.forEach(ConcurrencyLimiter.InFlight::close);
    }

    @Override
    public String toString() {
        switch (type) {
            case ADMIT:
                return "Admit";
            case DEFERRED:
                return "Deferred(" + reason + ", " + limiterId + (reason == Reason.RATE ? ", retryAt=" + retryAt : "") + ")";
            default:
                return "Rejected(" + reason + ", " + limiterId + ")";
        }
    }
}
