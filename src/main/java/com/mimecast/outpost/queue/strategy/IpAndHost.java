package com.mimecast.outpost.queue.strategy;

import java.net.InetAddress;
import java.util.Objects;
import java.util.Optional;

/**
 * Source address with an optional EHLO host name bound to it.
 */
public final class IpAndHost {

    private final InetAddress ip;
    private final String host;

    /**
     * Constructs a new IpAndHost instance.
     *
     * @param ip   Source address.
     * @param host EHLO host name, null to use the strategy default.
     */
    public IpAndHost(InetAddress ip, String host) {
        this.ip = Objects.requireNonNull(ip);
        this.host = host;
    }

    public InetAddress getIp() {
        return ip;
    }

    public Optional<String> getHost() {
        return Optional.ofNullable(host);
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof IpAndHost && ip.equals(((IpAndHost) obj).ip) && Objects.equals(host, ((IpAndHost) obj).host);
    }

    @Override
    public int hashCode() {
        return Objects.hash(ip, host);
    }

    @Override
    public String toString() {
        return ip.getHostAddress() + (host != null ? " (" + host + ")" : "");
    }
}
