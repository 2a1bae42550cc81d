package com.mimecast.outpost.queue.limit;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Limiters grouped by what they key on: sender, recipient or remote host.
 */
public final class QueueRateLimiters {

    /**
     * No limiters.
     */
    public static final QueueRateLimiters EMPTY = new QueueRateLimiters(List.of(), List.of(), List.of());

    private final ImmutableList<QueueRateLimiter> sender;
    private final ImmutableList<QueueRateLimiter> rcpt;
    private final ImmutableList<QueueRateLimiter> remote;

    public QueueRateLimiters(List<QueueRateLimiter> sender, List<QueueRateLimiter> rcpt, List<QueueRateLimiter> remote) {
        this.sender = ImmutableList.copyOf(sender);
        this.rcpt = ImmutableList.copyOf(rcpt);
        this.remote = ImmutableList.copyOf(remote);
    }

    public List<QueueRateLimiter> getSender() {
        return sender;
    }

    public List<QueueRateLimiter> getRcpt() {
        return rcpt;
    }

    public List<QueueRateLimiter> getRemote() {
        return remote;
    }

    public boolean isEmpty() {
        return sender.isEmpty() && rcpt.isEmpty() && remote.isEmpty();
    }
}
