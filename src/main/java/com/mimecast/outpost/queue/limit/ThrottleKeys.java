package com.mimecast.outpost.queue.limit;

import com.mimecast.outpost.expr.Variable;

import java.util.OptionalInt;

/**
 * Dimension bits used to build limiter and quota keys.
 */
public final class ThrottleKeys {

    public static final int RCPT = 1;
    public static final int RCPT_DOMAIN = 1 << 1;
    public static final int SENDER = 1 << 2;
    public static final int SENDER_DOMAIN = 1 << 3;
    public static final int AUTHENTICATED_AS = 1 << 4;
    public static final int LISTENER = 1 << 5;
    public static final int MX = 1 << 6;
    public static final int REMOTE_IP = 1 << 7;
    public static final int LOCAL_IP = 1 << 8;
    public static final int HELO_DOMAIN = 1 << 9;

    /**
     * Dimensions allowed for inbound limiters.
     */
    public static final int INBOUND = LISTENER | REMOTE_IP | LOCAL_IP | AUTHENTICATED_AS | HELO_DOMAIN
            | RCPT | RCPT_DOMAIN | SENDER | SENDER_DOMAIN;

    /**
     * Dimensions allowed for outbound limiters.
     */
    public static final int OUTBOUND = RCPT_DOMAIN | SENDER | SENDER_DOMAIN | MX | REMOTE_IP | LOCAL_IP;

    /**
     * Dimensions allowed for quotas.
     */
    public static final int QUOTA = RCPT | RCPT_DOMAIN | SENDER | SENDER_DOMAIN;

    // Order in which dimensions are hashed.
    private static final int[] ORDER = {RCPT, RCPT_DOMAIN, SENDER, SENDER_DOMAIN, HELO_DOMAIN, AUTHENTICATED_AS,
            LISTENER, MX, REMOTE_IP, LOCAL_IP};

    /**
     * Private constructor.
     */
    private ThrottleKeys() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Parses a dimension name.
     *
     * @param name Name such as {@code rcpt_domain}.
     * @return OptionalInt of the bit, empty if unknown.
     */
    public static OptionalInt parse(String name) {
        switch (name == null ? "" : name.trim().toLowerCase()) {
            case "rcpt":
                return OptionalInt.of(RCPT);
            case "rcpt_domain":
                return OptionalInt.of(RCPT_DOMAIN);
            case "sender":
                return OptionalInt.of(SENDER);
            case "sender_domain":
                return OptionalInt.of(SENDER_DOMAIN);
            case "authenticated_as":
                return OptionalInt.of(AUTHENTICATED_AS);
            case "listener":
                return OptionalInt.of(LISTENER);
            case "mx":
                return OptionalInt.of(MX);
            case "remote_ip":
                return OptionalInt.of(REMOTE_IP);
            case "local_ip":
                return OptionalInt.of(LOCAL_IP);
            case "helo_domain":
                return OptionalInt.of(HELO_DOMAIN);
            default:
                return OptionalInt.empty();
        }
    }

    /**
     * Gets the dimension bits in hashing order.
     *
     * @return Array of bits.
     */
    static int[] order() {
        return ORDER.clone();
    }

    /**
     * Gets the expression variable of a dimension.
     *
     * @param bit Dimension bit.
     * @return Variable.
     */
    public static Variable toVariable(int bit) {
        switch (bit) {
            case RCPT:
                return Variable.RCPT;
            case RCPT_DOMAIN:
                return Variable.RCPT_DOMAIN;
            case SENDER:
                return Variable.SENDER;
            case SENDER_DOMAIN:
                return Variable.SENDER_DOMAIN;
            case AUTHENTICATED_AS:
                return Variable.AUTHENTICATED_AS;
            case LISTENER:
                return Variable.LISTENER;
            case MX:
                return Variable.MX;
            case REMOTE_IP:
                return Variable.REMOTE_IP;
            case LOCAL_IP:
                return Variable.LOCAL_IP;
            case HELO_DOMAIN:
                return Variable.HELO_DOMAIN;
            default:
                throw new IllegalArgumentException("Unknown throttle key " + bit);
        }
    }
}
