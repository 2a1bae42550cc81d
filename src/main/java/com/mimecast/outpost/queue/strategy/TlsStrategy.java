package com.mimecast.outpost.queue.strategy;

import java.time.Duration;

/**
 * Transport security strategy.
 *
 * <p>TLS is required when any of STARTTLS, DANE or MTA-STS requires it.
 */
public final class TlsStrategy {

    /**
     * Built-in strategy, everything opportunistic.
     */
    public static final TlsStrategy DEFAULT = new TlsStrategy(RequireOptional.OPTIONAL, RequireOptional.OPTIONAL,
            RequireOptional.OPTIONAL, false, Duration.ofMinutes(3), Duration.ofMinutes(5));

    private final RequireOptional dane;
    private final RequireOptional mtaSts;
    private final RequireOptional startTls;
    private final boolean allowInvalidCerts;
    private final Duration timeoutTls;
    private final Duration timeoutMtaSts;

    /**
     * Constructs a new TlsStrategy instance.
     *
     * @param dane              DANE level.
     * @param mtaSts            MTA-STS level.
     * @param startTls          STARTTLS level.
     * @param allowInvalidCerts Accept invalid certificates.
     * @param timeoutTls        TLS handshake timeout.
     * @param timeoutMtaSts     MTA-STS policy fetch timeout.
     */
    public TlsStrategy(RequireOptional dane, RequireOptional mtaSts, RequireOptional startTls,
                       boolean allowInvalidCerts, Duration timeoutTls, Duration timeoutMtaSts) {
        this.dane = dane;
        this.mtaSts = mtaSts;
        this.startTls = startTls;
        this.allowInvalidCerts = allowInvalidCerts;
        this.timeoutTls = timeoutTls;
        this.timeoutMtaSts = timeoutMtaSts;
    }

    public RequireOptional getDane() {
        return dane;
    }

    public RequireOptional getMtaSts() {
        return mtaSts;
    }

    public RequireOptional getStartTls() {
        return startTls;
    }

    public boolean isAllowInvalidCerts() {
        return allowInvalidCerts;
    }

    public Duration getTimeoutTls() {
        return timeoutTls;
    }

    public Duration getTimeoutMtaSts() {
        return timeoutMtaSts;
    }

    public boolean tryDane() {
        return dane != RequireOptional.DISABLE;
    }

    public boolean tryStartTls() {
        return startTls != RequireOptional.DISABLE;
    }

    public boolean tryMtaSts() {
        return mtaSts != RequireOptional.DISABLE;
    }

    public boolean isDaneRequired() {
        return dane == RequireOptional.REQUIRE;
    }

    public boolean isMtaStsRequired() {
        return mtaSts == RequireOptional.REQUIRE;
    }

    /**
     * Checks if the connection must be encrypted.
     *
     * @return Boolean.
     */
    public boolean isTlsRequired() {
        return startTls == RequireOptional.REQUIRE || isDaneRequired() || isMtaStsRequired();
    }

    @Override
    public String toString() {
        return "TlsStrategy{dane=" + dane + ", mtaSts=" + mtaSts + ", startTls=" + startTls
                + ", allowInvalidCerts=" + allowInvalidCerts + "}";
    }
}
