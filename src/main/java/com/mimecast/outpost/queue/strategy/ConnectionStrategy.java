package com.mimecast.outpost.queue.strategy;

import com.google.common.collect.ImmutableList;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Outbound connection strategy: source address pools, EHLO host name and per phase timeouts.
 */
public final class ConnectionStrategy {

    private static final Duration FIVE_MINUTES = Duration.ofMinutes(5);

    /**
     * Built-in strategy.
     */
    public static final ConnectionStrategy DEFAULT = new ConnectionStrategy(List.of(), List.of(), null,
            FIVE_MINUTES, FIVE_MINUTES, FIVE_MINUTES, FIVE_MINUTES, FIVE_MINUTES, Duration.ofMinutes(10));

    private final ImmutableList<IpAndHost> sourceIpv4;
    private final ImmutableList<IpAndHost> sourceIpv6;
    private final String ehloHostname;
    private final Duration timeoutConnect;
    private final Duration timeoutGreeting;
    private final Duration timeoutEhlo;
    private final Duration timeoutMail;
    private final Duration timeoutRcpt;
    private final Duration timeoutData;

    /**
     * Constructs a new ConnectionStrategy instance.
     *
     * @param sourceIpv4      IPv4 source pool.
     * @param sourceIpv6      IPv6 source pool.
     * @param ehloHostname    Fallback EHLO host name, may be null.
     * @param timeoutConnect  Connect timeout.
     * @param timeoutGreeting Greeting timeout.
     * @param timeoutEhlo     EHLO timeout.
     * @param timeoutMail     MAIL FROM timeout.
     * @param timeoutRcpt     RCPT TO timeout.
     * @param timeoutData     DATA timeout.
     */
    public ConnectionStrategy(List<IpAndHost> sourceIpv4, List<IpAndHost> sourceIpv6, String ehloHostname,
                              Duration timeoutConnect, Duration timeoutGreeting, Duration timeoutEhlo,
                              Duration timeoutMail, Duration timeoutRcpt, Duration timeoutData) {
        this.sourceIpv4 = ImmutableList.copyOf(sourceIpv4);
        this.sourceIpv6 = ImmutableList.copyOf(sourceIpv6);
        this.ehloHostname = ehloHostname;
        this.timeoutConnect = timeoutConnect;
        this.timeoutGreeting = timeoutGreeting;
        this.timeoutEhlo = timeoutEhlo;
        this.timeoutMail = timeoutMail;
        this.timeoutRcpt = timeoutRcpt;
        this.timeoutData = timeoutData;
    }

    public List<IpAndHost> getSourceIpv4() {
        return sourceIpv4;
    }

    public List<IpAndHost> getSourceIpv6() {
        return sourceIpv6;
    }

    public Optional<String> getEhloHostname() {
        return Optional.ofNullable(ehloHostname);
    }

    public Duration getTimeoutConnect() {
        return timeoutConnect;
    }

    public Duration getTimeoutGreeting() {
        return timeoutGreeting;
    }

    public Duration getTimeoutEhlo() {
        return timeoutEhlo;
    }

    public Duration getTimeoutMail() {
        return timeoutMail;
    }

    public Duration getTimeoutRcpt() {
        return timeoutRcpt;
    }

    public Duration getTimeoutData() {
        return timeoutData;
    }

    @Override
    public String toString() {
        return "ConnectionStrategy{ipv4=" + sourceIpv4 + ", ipv6=" + sourceIpv6 + ", ehlo=" + ehloHostname + "}";
    }
}
