package com.mimecast.outpost.store;

import com.mimecast.outpost.queue.Message;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered set of store mutations applied atomically by {@link QueueStore#write(Batch)}.
 */
public class Batch {

    /**
     * Operation type.
     */
    public enum Type {
        PUT_BLOB,
        CLEAR_BLOB,
        SET_MESSAGE,
        CLEAR_MESSAGE,
        SET_EVENT,
        CLEAR_EVENT
    }

    /**
     * Single mutation.
     */
    public static final class Operation {
        private final Type type;
        private final String blobHash;
        private final byte[] blob;
        private final Message message;
        private final long queueId;
        private final QueueEvent event;

        private Operation(Type type, String blobHash, byte[] blob, Message message, long queueId, QueueEvent event) {
            this.type = type;
            this.blobHash = blobHash;
            this.blob = blob;
            this.message = message;
            this.queueId = queueId;
            this.event = event;
        }

        public Type getType() {
            return type;
        }

        public String getBlobHash() {
            return blobHash;
        }

        public byte[] getBlob() {
            return blob;
        }

        public Message getMessage() {
            return message;
        }

        public long getQueueId() {
            return queueId;
        }

        public QueueEvent getEvent() {
            return event;
        }
    }

    private final List<Operation> operations = new ArrayList<>();

    /**
     * Stores message content, or adds a reference if the same content is already stored.
     *
     * @param hash    Content hash.
     * @param content Content.
     * @return Self.
     */
    public Batch putBlob(String hash, byte[] content) {
        operations.add(new Operation(Type.PUT_BLOB, hash, content, null, 0L, null));
        return this;
    }

    /**
     * Releases one reference to message content.
     * <p>The content is removed once no message references it.
     *
     * @param hash Content hash.
     * @return Self.
     */
    public Batch clearBlob(String hash) {
        operations.add(new Operation(Type.CLEAR_BLOB, hash, null, null, 0L, null));
        return this;
    }

    /**
     * Stores message metadata, replacing any previous version.
     *
     * @param message Message.
     * @return Self.
     */
    public Batch setMessage(Message message) {
        operations.add(new Operation(Type.SET_MESSAGE, null, null, message, message.getQueueId(), null));
        return this;
    }

    /**
     * Removes message metadata.
     *
     * @param queueId Message id.
     * @return Self.
     */
    public Batch clearMessage(long queueId) {
        operations.add(new Operation(Type.CLEAR_MESSAGE, null, null, null, queueId, null));
        return this;
    }

    /**
     * Adds a queue event.
     *
     * @param event Event.
     * @return Self.
     */
    public Batch setEvent(QueueEvent event) {
        operations.add(new Operation(Type.SET_EVENT, null, null, null, event.getQueueId(), event));
        return this;
    }

    /**
     * Removes a queue event.
     *
     * @param event Event.
     * @return Self.
     */
    public Batch clearEvent(QueueEvent event) {
        operations.add(new Operation(Type.CLEAR_EVENT, null, null, null, event.getQueueId(), event));
        return this;
    }

    public List<Operation> getOperations() {
        return Collections.unmodifiableList(operations);
    }

    public boolean isEmpty() {
        return operations.isEmpty();
    }

    public int size() {
        return operations.size();
    }
}
