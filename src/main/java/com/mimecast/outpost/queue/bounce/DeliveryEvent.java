package com.mimecast.outpost.queue.bounce;

import org.apache.logging.log4j.message.StringMapMessage;

import java.util.List;
import java.util.Objects;

/**
 * Delivery telemetry event.
 */
public final class DeliveryEvent {

    /**
     * Event type.
     */
    public enum Type {
        DSN_SUCCESS("dsn-success"),
        DSN_TEMP_FAIL("dsn-temp-fail"),
        DSN_PERM_FAIL("dsn-perm-fail"),
        DOUBLE_BOUNCE("double-bounce");

        private final String id;

        Type(String id) {
            this.id = id;
        }

        public String getId() {
            return id;
        }
    }

    private final Type type;
    private final long queueId;
    private final List<String> to;
    private String hostname = "";
    private String details = "";
    private int code;
    private long nextRetry = -1;
    private long expires = -1;
    private int total = -1;

    /**
     * Constructs a new DeliveryEvent instance.
     *
     * @param type    Event type.
     * @param queueId Message id.
     * @param to      Recipients, or DSN texts for double bounces.
     */
    public DeliveryEvent(Type type, long queueId, List<String> to) {
        this.type = type;
        this.queueId = queueId;
        this.to = List.copyOf(to);
    }

    public Type getType() {
        return type;
    }

    public long getQueueId() {
        return queueId;
    }

    public List<String> getTo() {
        return to;
    }

    public String getHostname() {
        return hostname;
    }

    public DeliveryEvent setHostname(String hostname) {
        this.hostname = Objects.requireNonNullElse(hostname, "");
        return this;
    }

    public String getDetails() {
        return details;
    }

    public DeliveryEvent setDetails(String details) {
        this.details = Objects.requireNonNullElse(details, "");
        return this;
    }

    public int getCode() {
        return code;
    }

    public DeliveryEvent setCode(int code) {
        this.code = code;
        return this;
    }

    public long getNextRetry() {
        return nextRetry;
    }

    public DeliveryEvent setNextRetry(long nextRetry) {
        this.nextRetry = nextRetry;
        return this;
    }

    public long getExpires() {
        return expires;
    }

    public DeliveryEvent setExpires(long expires) {
        this.expires = expires;
        return this;
    }

    public int getTotal() {
        return total;
    }

    public DeliveryEvent setTotal(int total) {
        this.total = total;
        return this;
    }

    /**
     * Converts to a structured log message.
     * <p>Unset fields are left out.
     *
     * @return StringMapMessage.
     */
    public StringMapMessage toMapMessage() {
        StringMapMessage map = new StringMapMessage()
                .with("event", type.getId())
                .with("uid", String.valueOf(queueId))
                .with("to", String.join(", ", to));
        if (!hostname.isEmpty()) {
            map.with("hostname", hostname);
        }
        if (code > 0) {
            map.with("code", String.valueOf(code));
        }
        if (!details.isEmpty()) {
            map.with("details", details);
        }
        if (nextRetry >= 0) {
            map.with("nextRetry", String.valueOf(nextRetry));
        }
        if (expires >= 0) {
            map.with("expires", String.valueOf(expires));
        }
        if (total >= 0) {
            map.with("total", String.valueOf(total));
        }
        return map;
    }

    @Override
    public String toString() {
        return "DeliveryEvent{" + type.getId() + ", uid=" + queueId + ", to=" + to + "}";
    }
}
