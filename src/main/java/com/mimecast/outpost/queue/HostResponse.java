package com.mimecast.outpost.queue;

import java.io.Serial;
import java.io.Serializable;
import java.util.Objects;

/**
 * Successful delivery response: the host that accepted the recipient and its reply.
 */
public final class HostResponse implements Serializable {
    @Serial
    private static final long serialVersionUID = 1L;

    private final String hostname;
    private final SmtpResponse response;

    /**
     * Constructs a new HostResponse instance.
     *
     * @param hostname Remote host name.
     * @param response SMTP reply.
     */
    public HostResponse(String hostname, SmtpResponse response) {
        this.hostname = hostname;
        this.response = response;
    }

    public String getHostname() {
        return hostname;
    }

    public SmtpResponse getResponse() {
        return response;
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof HostResponse
                && Objects.equals(hostname, ((HostResponse) obj).hostname)
                && Objects.equals(response, ((HostResponse) obj).response);
    }

    @Override
    public int hashCode() {
        return Objects.hash(hostname, response);
    }

    @Override
    public String toString() {
        return hostname + ": " + response;
    }
}
