package com.mimecast.outpost.store;

import com.mimecast.outpost.queue.Message;

import java.util.List;
import java.util.Optional;

/**
 * Storage contract of the delivery queue.
 * <p>Holds message content, message metadata and the queue event index.
 * <p>Content is keyed by hash and shared by messages with identical content, it is kept until
 * every {@link Batch#putBlob} has been matched by a {@link Batch#clearBlob}.
 * <p>All methods throw {@link QueueStorageException} on backend failure.
 */
public interface QueueStore {

    /**
     * Reserves a contiguous range of message ids.
     *
     * @param count Number of ids.
     * @return First id of the range.
     */
    long assignDocumentIds(int count);

    /**
     * Applies a batch atomically.
     *
     * @param batch Batch.
     */
    void write(Batch batch);

    /**
     * Reads a range of message content.
     *
     * @param hash Content hash.
     * @param from Start offset, inclusive.
     * @param to   End offset, exclusive, clamped to the content length.
     * @return Optional of bytes, empty if the content is unknown.
     */
    Optional<byte[]> getBlob(String hash, int from, int to);

    /**
     * Reads message metadata.
     *
     * @param queueId Message id.
     * @return Optional of Message, a private copy the caller may modify.
     */
    Optional<Message> readMessage(long queueId);

    /**
     * Lists queue events due up to a time, earliest first.
     *
     * @param until Inclusive upper bound.
     * @param limit Maximum events returned.
     * @return List of QueueEvent.
     */
    List<QueueEvent> nextEvents(long until, int limit);

    /**
     * Gets the due time of the earliest event.
     *
     * @return Optional of due time, empty if the queue is empty.
     */
    Optional<Long> nextDue();
}
