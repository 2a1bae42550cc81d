package com.mimecast.outpost.queue;

import com.mimecast.outpost.queue.strategy.QueueExpiry;

import java.io.Serial;
import java.io.Serializable;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Queued message recipient.
 *
 * <p>Holds the delivery status, the retry and notification schedules and the flags of one recipient.
 * <p>Flags can only be added, {@link RecipientFlags#DSN_SENT} once set stays set.
 */
public class Recipient implements Serializable {
    @Serial
    private static final long serialVersionUID = 1L;

    private final String address;
    private final String addressLcase;
    private String orcpt;
    private Status<HostResponse, ErrorDetails> status = Status.scheduled();
    private Schedule retry;
    private Schedule notify;
    private QueueExpiry expiry = QueueExpiry.ttl(QueueExpiry.DEFAULT_TTL);
    private QueueName queue = QueueName.DEFAULT;
    private long flags;

    /**
     * Constructs a new Recipient instance, scheduled for immediate delivery.
     *
     * @param address Recipient address.
     * @param flags   Initial flags.
     * @param now     Current time.
     */
    public Recipient(String address, long flags, long now) {
        this.address = Objects.requireNonNull(address);
        this.addressLcase = address.toLowerCase(Locale.ROOT);
        this.flags = flags;
        this.retry = Schedule.now(now);
        this.notify = Schedule.now(now);
    }

    public String getAddress() {
        return address;
    }

    public String getAddressLcase() {
        return addressLcase;
    }

    /**
     * Gets the domain part of the lower case address.
     *
     * @return String, empty if the address has no domain.
     */
    public String getDomain() {
        int at = addressLcase.lastIndexOf('@');
        return at >= 0 ? addressLcase.substring(at + 1) : "";
    }

    public Optional<String> getOrcpt() {
        return Optional.ofNullable(orcpt);
    }

    public Recipient setOrcpt(String orcpt) {
        this.orcpt = orcpt;
        return this;
    }

    public Status<HostResponse, ErrorDetails> getStatus() {
        return status;
    }

    /**
     * Sets the delivery status.
     *
     * @param status Status.
     * @return Self.
     */
    public Recipient setStatus(Status<HostResponse, ErrorDetails> status) {
        this.status = Objects.requireNonNull(status);
        return this;
    }

    public Schedule getRetry() {
        return retry;
    }

    public Recipient setRetry(Schedule retry) {
        this.retry = Objects.requireNonNull(retry);
        return this;
    }

    public Schedule getNotify() {
        return notify;
    }

    public Recipient setNotify(Schedule notify) {
        this.notify = Objects.requireNonNull(notify);
        return this;
    }

    public QueueExpiry getExpiry() {
        return expiry;
    }

    public Recipient setExpiry(QueueExpiry expiry) {
        this.expiry = Objects.requireNonNull(expiry);
        return this;
    }

    public QueueName getQueue() {
        return queue;
    }

    public Recipient setQueue(QueueName queue) {
        this.queue = Objects.requireNonNull(queue);
        return this;
    }

    public long getFlags() {
        return flags;
    }

    /**
     * Checks if any of the given flags is set.
     *
     * @param mask Flag bits.
     * @return Boolean.
     */
    public boolean hasFlag(long mask) {
        return (flags & mask) != 0;
    }

    /**
     * Adds flags, existing flags are kept.
     *
     * @param mask Flag bits.
     * @return Self.
     */
    public Recipient addFlags(long mask) {
        this.flags |= mask;
        return this;
    }

    /**
     * Checks if delay notifications were requested for this recipient.
     *
     * @return Boolean.
     */
    public boolean isDelayNotified() {
        return hasFlag(RecipientFlags.NOTIFY_DELAY) && !hasFlag(RecipientFlags.NOTIFY_NEVER);
    }

    /**
     * Checks if the recipient still waits for delivery.
     *
     * @return Boolean.
     */
    public boolean isPending() {
        return status.isPending();
    }

    /**
     * Gets the absolute expiration time.
     *
     * @param created Message creation time.
     * @return OptionalLong, empty for attempt based expiry.
     */
    public OptionalLong expirationTime(long created) {
        return expiry.isTtl() ? OptionalLong.of(created + expiry.getValue()) : OptionalLong.empty();
    }

    /**
     * Checks if the recipient expired.
     *
     * @param created Message creation time.
     * @param now     Current time.
     * @return Boolean.
     */
    public boolean isExpired(long created, long now) {
        if (expiry.isTtl()) {
            return created + expiry.getValue() <= now;
        }
        return retry.getAttempt() >= expiry.getValue();
    }

    @Override
    public String toString() {
        return "Recipient{" + address + ", " + status + ", retry=" + retry + ", notify=" + notify
                + ", queue=" + queue + ", flags=" + Long.toHexString(flags) + "}";
    }
}
