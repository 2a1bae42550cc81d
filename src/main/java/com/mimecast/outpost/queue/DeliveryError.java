package com.mimecast.outpost.queue;

import java.io.Serial;
import java.io.Serializable;
import java.util.Objects;

/**
 * Reason a delivery attempt failed.
 *
 * <p>Classification into temporary or permanent is done by the transport, this only records what happened.
 */
public final class DeliveryError implements Serializable {
    @Serial
    private static final long serialVersionUID = 1L;

    /**
     * Error type.
     */
    public enum Type {
        DNS_ERROR("dns"),
        CONNECTION_ERROR("connection"),
        TLS_ERROR("tls"),
        DANE_ERROR("dane"),
        MTA_STS_ERROR("mta-sts"),
        RATE_LIMITED("rate"),
        CONCURRENCY_LIMITED("concurrency"),
        IO("io"),
        UNEXPECTED_RESPONSE("unexpected-reply");

        private final String id;

        Type(String id) {
            this.id = id;
        }

        /**
         * Gets the short identifier exposed to expressions as {@code last_error}.
         *
         * @return String.
         */
        public String getId() {
            return id;
        }
    }

    private final Type type;
    private final String details;
    private final String command;
    private final SmtpResponse response;

    private DeliveryError(Type type, String details, String command, SmtpResponse response) {
        this.type = type;
        this.details = details != null ? details : "";
        this.command = command != null ? command : "";
        this.response = response;
    }

    public static DeliveryError dns(String details) {
        return new DeliveryError(Type.DNS_ERROR, details, null, null);
    }

    public static DeliveryError connection(String details) {
        return new DeliveryError(Type.CONNECTION_ERROR, details, null, null);
    }

    public static DeliveryError tls(String details) {
        return new DeliveryError(Type.TLS_ERROR, details, null, null);
    }

    public static DeliveryError dane(String details) {
        return new DeliveryError(Type.DANE_ERROR, details, null, null);
    }

    public static DeliveryError mtaSts(String details) {
        return new DeliveryError(Type.MTA_STS_ERROR, details, null, null);
    }

    public static DeliveryError rateLimited() {
        return new DeliveryError(Type.RATE_LIMITED, null, null, null);
    }

    public static DeliveryError concurrencyLimited() {
        return new DeliveryError(Type.CONCURRENCY_LIMITED, null, null, null);
    }

    public static DeliveryError io(String details) {
        return new DeliveryError(Type.IO, details, null, null);
    }

    /**
     * Remote server rejected a command.
     *
     * @param command  SMTP command, empty when the whole transaction was rejected.
     * @param response SMTP reply.
     * @return DeliveryError.
     */
    public static DeliveryError unexpectedResponse(String command, SmtpResponse response) {
        return new DeliveryError(Type.UNEXPECTED_RESPONSE, null, command, Objects.requireNonNull(response));
    }

    public Type getType() {
        return type;
    }

    public String getDetails() {
        return details;
    }

    public String getCommand() {
        return command;
    }

    /**
     * Gets the SMTP reply, only set for unexpected responses.
     *
     * @return SmtpResponse or null.
     */
    public SmtpResponse getResponse() {
        return response;
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof DeliveryError)) {
            return false;
        }
        DeliveryError other = (DeliveryError) obj;
        return type == other.type && details.equals(other.details) && command.equals(other.command)
                && Objects.equals(response, other.response);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, details, command, response);
    }

    @Override
    public String toString() {
        switch (type) {
            case UNEXPECTED_RESPONSE:
                return "Unexpected response" + (command.isEmpty() ? "" : " for " + command) + ": " + response;
            case RATE_LIMITED:
                return "Rate limited";
            case CONCURRENCY_LIMITED:
                return "Concurrency limited";
            default:
                return type.getId() + ": " + details;
        }
    }
}
