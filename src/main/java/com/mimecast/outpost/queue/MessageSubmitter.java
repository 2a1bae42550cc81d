package com.mimecast.outpost.queue;

/**
 * Places system generated messages on the queue.
 */
public interface MessageSubmitter {

    /**
     * Reserves an id for a new message.
     *
     * @return Queue id.
     */
    long nextQueueId();

    /**
     * Queues a message without inbound limiter or quota checks.
     *
     * @param message Message with its recipients.
     * @param content Raw message content.
     * @param now     Current time.
     */
    void submit(Message message, byte[] content, long now);
}
