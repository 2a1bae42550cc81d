package com.mimecast.outpost.queue;

/**
 * Recipient flag bits.
 *
 * <p>The low bits carry the RFC 3461 NOTIFY parameter given at RCPT TO.
 * <p>{@link #DSN_SENT} records that no further notification is owed for the recipient.
 */
public final class RecipientFlags {

    public static final long NOTIFY_SUCCESS = 1L;
    public static final long NOTIFY_FAILURE = 1L << 1;
    public static final long NOTIFY_DELAY = 1L << 2;
    public static final long NOTIFY_NEVER = 1L << 3;
    public static final long DSN_SENT = 1L << 32;

    /**
     * Flags applied when the client gave no NOTIFY parameter.
     */
    public static final long DEFAULT_NOTIFY = NOTIFY_FAILURE | NOTIFY_DELAY;

    /**
     * Private constructor.
     */
    private RecipientFlags() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Parses a NOTIFY parameter value such as {@code SUCCESS,FAILURE} or {@code NEVER}.
     *
     * @param value Parameter value.
     * @return Flag bits.
     */
    public static long parseNotify(String value) {
        if (value == null || value.isBlank()) {
            return DEFAULT_NOTIFY;
        }

        long flags = 0;
        for (String part : value.split(",")) {
            switch (part.trim().toUpperCase()) {
                case "SUCCESS":
                    flags |= NOTIFY_SUCCESS;
                    break;
                case "FAILURE":
                    flags |= NOTIFY_FAILURE;
                    break;
                case "DELAY":
                    flags |= NOTIFY_DELAY;
                    break;
                case "NEVER":
                    flags |= NOTIFY_NEVER;
                    break;
                default:
                    break;
            }
        }
        return flags;
    }
}
