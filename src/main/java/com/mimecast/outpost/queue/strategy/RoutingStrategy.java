package com.mimecast.outpost.queue.strategy;

import java.util.Objects;
import java.util.Optional;

/**
 * Routing strategy.
 *
 * <p>One of:
 * <ul>
 *     <li>{@link Local} delivers without network egress.</li>
 *     <li>{@link Mx} resolves MX records of the recipient domain.</li>
 *     <li>{@link Relay} sends all matching traffic through one smart host.</li>
 * </ul>
 */
public abstract class RoutingStrategy {

    /**
     * Routing type.
     */
    public enum Type {
        LOCAL,
        MX,
        RELAY
    }

    /**
     * Built-in local routing.
     */
    public static final RoutingStrategy LOCAL = new Local();

    /**
     * Built-in MX routing.
     */
    public static final RoutingStrategy MX = new Mx(5, 2, IpLookupStrategy.IPV4_THEN_IPV6);

    public abstract Type getType();

    /**
     * Local delivery.
     */
    public static final class Local extends RoutingStrategy {

        @Override
        public Type getType() {
            return Type.LOCAL;
        }

        @Override
        public boolean equals(Object obj) {
            return obj instanceof Local;
        }

        @Override
        public int hashCode() {
            return Type.LOCAL.hashCode();
        }

        @Override
        public String toString() {
            return "Local";
        }
    }

    /**
     * MX based delivery.
     */
    public static final class Mx extends RoutingStrategy {
        private final int maxMx;
        private final int maxMultihomed;
        private final IpLookupStrategy ipLookup;

        /**
         * Constructs a new Mx instance.
         *
         * @param maxMx         Maximum MX hosts to try.
         * @param maxMultihomed Maximum addresses to try per host.
         * @param ipLookup      Address lookup strategy.
         */
        public Mx(int maxMx, int maxMultihomed, IpLookupStrategy ipLookup) {
            this.maxMx = maxMx;
            this.maxMultihomed = maxMultihomed;
            this.ipLookup = ipLookup;
        }

        @Override
        public Type getType() {
            return Type.MX;
        }

        public int getMaxMx() {
            return maxMx;
        }

        public int getMaxMultihomed() {
            return maxMultihomed;
        }

        public IpLookupStrategy getIpLookup() {
            return ipLookup;
        }

        @Override
        public boolean equals(Object obj) {
            return obj instanceof Mx
                    && maxMx == ((Mx) obj).maxMx
                    && maxMultihomed == ((Mx) obj).maxMultihomed
                    && ipLookup == ((Mx) obj).ipLookup;
        }

        @Override
        public int hashCode() {
            return Objects.hash(maxMx, maxMultihomed, ipLookup);
        }

        @Override
        public String toString() {
            return "Mx{maxMx=" + maxMx + ", maxMultihomed=" + maxMultihomed + ", ipLookup=" + ipLookup + "}";
        }
    }

    /**
     * Smart host relay.
     */
    public static final class Relay extends RoutingStrategy {
        private final String address;
        private final int port;
        private final ServerProtocol protocol;
        private final Credentials auth;
        private final boolean tlsImplicit;
        private final boolean allowInvalidCerts;

        /**
         * Constructs a new Relay instance.
         *
         * @param address           Host name or address.
         * @param port              Port.
         * @param protocol          Protocol.
         * @param auth              Credentials, null when not authenticating.
         * @param tlsImplicit       Implicit TLS.
         * @param allowInvalidCerts Accept invalid certificates.
         */
        public Relay(String address, int port, ServerProtocol protocol, Credentials auth,
                     boolean tlsImplicit, boolean allowInvalidCerts) {
            this.address = Objects.requireNonNull(address);
            this.port = port;
            this.protocol = protocol;
            this.auth = auth;
            this.tlsImplicit = tlsImplicit;
            this.allowInvalidCerts = allowInvalidCerts;
        }

        @Override
        public Type getType() {
            return Type.RELAY;
        }

        public String getAddress() {
            return address;
        }

        public int getPort() {
            return port;
        }

        public ServerProtocol getProtocol() {
            return protocol;
        }

        public Optional<Credentials> getAuth() {
            return Optional.ofNullable(auth);
        }

        public boolean isTlsImplicit() {
            return tlsImplicit;
        }

        public boolean isAllowInvalidCerts() {
            return allowInvalidCerts;
        }

        @Override
        public boolean equals(Object obj) {
            if (!(obj instanceof Relay)) {
                return false;
            }
            Relay other = (Relay) obj;
            return address.equals(other.address) && port == other.port && protocol == other.protocol
                    && Objects.equals(auth, other.auth) && tlsImplicit == other.tlsImplicit
                    && allowInvalidCerts == other.allowInvalidCerts;
        }

        @Override
        public int hashCode() {
            return Objects.hash(address, port, protocol, auth, tlsImplicit, allowInvalidCerts);
        }

        // Credentials stay out of logs.
        @Override
        public String toString() {
            return "Relay{" + protocol + "://" + address + ":" + port + ", tlsImplicit=" + tlsImplicit
                    + ", allowInvalidCerts=" + allowInvalidCerts + "}";
        }
    }
}
