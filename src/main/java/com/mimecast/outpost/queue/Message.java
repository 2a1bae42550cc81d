package com.mimecast.outpost.queue;

import java.io.Serial;
import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Queued message.
 *
 * <p>Owns its recipients. An empty return path marks a delivery status notification,
 * which never produces a further notification.
 */
public class Message implements Serializable {
    @Serial
    private static final long serialVersionUID = 1L;

    private final long queueId;
    private final String returnPath;
    private final String returnPathLcase;
    private final String returnPathDomain;
    private final List<Recipient> recipients = new ArrayList<>();
    private final long created;
    private String envId;
    private String blobHash = "";
    private long size;
    private int priority;
    private MessageSource source = MessageSource.UNAUTHENTICATED;
    private final List<QuotaKey> quotaKeys = new ArrayList<>();
    private String receivedFromIp = "";
    private String receivedViaIp = "";
    private String listener = "";
    private String heloDomain = "";
    private String authenticatedAs = "";

    /**
     * Constructs a new Message instance.
     *
     * @param queueId    Queue id.
     * @param returnPath Return path, empty for notifications.
     * @param created    Creation time in seconds since epoch.
     */
    public Message(long queueId, String returnPath, long created) {
        this.queueId = queueId;
        this.returnPath = returnPath != null ? returnPath : "";
        this.returnPathLcase = this.returnPath.toLowerCase(Locale.ROOT);
        int at = returnPathLcase.lastIndexOf('@');
        this.returnPathDomain = at >= 0 ? returnPathLcase.substring(at + 1) : "";
        this.created = created;
    }

    public long getQueueId() {
        return queueId;
    }

    public String getReturnPath() {
        return returnPath;
    }

    public String getReturnPathLcase() {
        return returnPathLcase;
    }

    public String getReturnPathDomain() {
        return returnPathDomain;
    }

    /**
     * Checks if this is a notification, which has a null return path.
     *
     * @return Boolean.
     */
    public boolean isBounce() {
        return returnPath.isEmpty();
    }

    public List<Recipient> getRecipients() {
        return recipients;
    }

    /**
     * Adds a recipient.
     *
     * @param recipient Recipient.
     * @return Self.
     */
    public Message addRecipient(Recipient recipient) {
        recipients.add(recipient);
        return this;
    }

    public long getCreated() {
        return created;
    }

    public Optional<String> getEnvId() {
        return Optional.ofNullable(envId);
    }

    public Message setEnvId(String envId) {
        this.envId = envId;
        return this;
    }

    public String getBlobHash() {
        return blobHash;
    }

    public Message setBlobHash(String blobHash) {
        this.blobHash = blobHash;
        return this;
    }

    public long getSize() {
        return size;
    }

    public Message setSize(long size) {
        this.size = size;
        return this;
    }

    public int getPriority() {
        return priority;
    }

    public Message setPriority(int priority) {
        this.priority = priority;
        return this;
    }

    public MessageSource getSource() {
        return source;
    }

    public Message setSource(MessageSource source) {
        this.source = source;
        return this;
    }

    public List<QuotaKey> getQuotaKeys() {
        return quotaKeys;
    }

    public String getReceivedFromIp() {
        return receivedFromIp;
    }

    public Message setReceivedFromIp(String receivedFromIp) {
        this.receivedFromIp = receivedFromIp;
        return this;
    }

    public String getReceivedViaIp() {
        return receivedViaIp;
    }

    public Message setReceivedViaIp(String receivedViaIp) {
        this.receivedViaIp = receivedViaIp;
        return this;
    }

    public String getListener() {
        return listener;
    }

    public Message setListener(String listener) {
        this.listener = listener;
        return this;
    }

    public String getHeloDomain() {
        return heloDomain;
    }

    public Message setHeloDomain(String heloDomain) {
        this.heloDomain = heloDomain;
        return this;
    }

    public String getAuthenticatedAs() {
        return authenticatedAs;
    }

    public Message setAuthenticatedAs(String authenticatedAs) {
        this.authenticatedAs = authenticatedAs;
        return this;
    }

    /**
     * Checks if any recipient still waits for delivery.
     *
     * @return Boolean.
     */
    public boolean hasPending() {
        return recipients.stream().anyMatch(Recipient::isPending);
    }

    /**
     * Gets the earliest retry, notification or expiry time of pending recipients.
     *
     * @param queue Virtual queue filter, null for all.
     * @return OptionalLong, empty when nothing is pending.
     */
    public OptionalLong nextEvent(QueueName queue) {
        long next = Long.MAX_VALUE;
        boolean found = false;
        for (Recipient rcpt : pending(queue)) {
            next = Math.min(next, earliest(rcpt));
            found = true;
        }
        return found ? OptionalLong.of(next) : OptionalLong.empty();
    }

    /**
     * Gets the earliest retry time of pending recipients.
     *
     * @param queue Virtual queue filter, null for all.
     * @return OptionalLong.
     */
    public OptionalLong nextDeliveryEvent(QueueName queue) {
        return pending(queue).stream().mapToLong(r -> r.getRetry().getDue()).min();
    }

    /**
     * Gets the earliest notification time of pending recipients that asked for delay notifications.
     *
     * @param queue Virtual queue filter, null for all.
     * @return OptionalLong.
     */
    public OptionalLong nextDsn(QueueName queue) {
        return pending(queue).stream()
                .filter(Recipient::isDelayNotified)
                .mapToLong(r -> r.getNotify().getDue())
                .min();
    }

    /**
     * Gets the latest expiration time of pending recipients with time based expiry.
     *
     * @param queue Virtual queue filter, null for all.
     * @return OptionalLong.
     */
    public OptionalLong expires(QueueName queue) {
        return pending(queue).stream()
                .map(r -> r.expirationTime(created))
                .filter(OptionalLong::isPresent)
                .mapToLong(OptionalLong::getAsLong)
                .max();
    }

    /**
     * Gets the earliest event time of pending recipients grouped by virtual queue.
     *
     * @return Map of queue name to due time.
     */
    public Map<QueueName, Long> nextEvents() {
        Map<QueueName, Long> events = new LinkedHashMap<>();
        for (Recipient rcpt : recipients) {
            if (rcpt.isPending()) {
                events.merge(rcpt.getQueue(), earliest(rcpt), Math::min);
            }
        }
        return Collections.unmodifiableMap(events);
    }

    // Notification times only count for recipients a delay report can be written for.
    private long earliest(Recipient rcpt) {
        long event = rcpt.getRetry().getDue();
        if (rcpt.isDelayNotified()) {
            event = Math.min(event, rcpt.getNotify().getDue());
        }
        OptionalLong expires = rcpt.expirationTime(created);
        if (expires.isPresent()) {
            event = Math.min(event, expires.getAsLong());
        }
        return event;
    }

    private List<Recipient> pending(QueueName queue) {
        List<Recipient> list = new ArrayList<>();
        for (Recipient rcpt : recipients) {
            if (rcpt.isPending() && (queue == null || queue.equals(rcpt.getQueue()))) {
                list.add(rcpt);
            }
        }
        return list;
    }

    @Override
    public String toString() {
        return "Message{id=" + queueId + ", from=<" + returnPath + ">, recipients=" + recipients.size() + "}";
    }
}
