package com.mimecast.outpost.queue.limit;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Quotas grouped by scope: sender, recipient domain or recipient.
 */
public final class QueueQuotas {

    /**
     * No quotas.
     */
    public static final QueueQuotas EMPTY = new QueueQuotas(List.of(), List.of(), List.of());

    private final ImmutableList<QueueQuota> sender;
    private final ImmutableList<QueueQuota> rcptDomain;
    private final ImmutableList<QueueQuota> rcpt;

    public QueueQuotas(List<QueueQuota> sender, List<QueueQuota> rcptDomain, List<QueueQuota> rcpt) {
        this.sender = ImmutableList.copyOf(sender);
        this.rcptDomain = ImmutableList.copyOf(rcptDomain);
        this.rcpt = ImmutableList.copyOf(rcpt);
    }

    public List<QueueQuota> getSender() {
        return sender;
    }

    public List<QueueQuota> getRcptDomain() {
        return rcptDomain;
    }

    public List<QueueQuota> getRcpt() {
        return rcpt;
    }

    public boolean isEmpty() {
        return sender.isEmpty() && rcptDomain.isEmpty() && rcpt.isEmpty();
    }
}
