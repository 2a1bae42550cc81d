package com.mimecast.outpost.store;

import com.mimecast.outpost.queue.Message;
import org.apache.commons.lang3.SerializationUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory implementation of QueueStore for tests and single node deployments.
 * <p>This implementation does not persist data and is lost on application restart.
 * <p>Messages are stored and returned as serialized copies so callers never share state.
 */
public class InMemoryQueueStore implements QueueStore {
    private static final Logger log = LogManager.getLogger(InMemoryQueueStore.class);

    private final AtomicLong ids = new AtomicLong(1);
    private final Map<String, byte[]> blobs = new HashMap<>();
    private final Map<String, Integer> blobLinks = new HashMap<>();
    private final Map<Long, Message> messages = new HashMap<>();
    private final TreeSet<QueueEvent> events = new TreeSet<>();

    @Override
    public long assignDocumentIds(int count) {
        return ids.getAndAdd(Math.max(1, count));
    }

    @Override
    public synchronized void write(Batch batch) {
        for (Batch.Operation op : batch.getOperations()) {
            switch (op.getType()) {
                case PUT_BLOB:
                    blobs.computeIfAbsent(op.getBlobHash(), k -> op.getBlob().clone());
                    blobLinks.merge(op.getBlobHash(), 1, Integer::sum);
                    break;
                case CLEAR_BLOB:
                    if (blobLinks.merge(op.getBlobHash(), -1, Integer::sum) <= 0) {
                        blobLinks.remove(op.getBlobHash());
                        blobs.remove(op.getBlobHash());
                    }
                    break;
                case SET_MESSAGE:
                    messages.put(op.getQueueId(), SerializationUtils.clone(op.getMessage()));
                    break;
                case CLEAR_MESSAGE:
                    messages.remove(op.getQueueId());
                    break;
                case SET_EVENT:
                    events.add(op.getEvent());
                    break;
                case CLEAR_EVENT:
                    events.remove(op.getEvent());
                    break;
                default:
                    throw new QueueStorageException("Unsupported operation " + op.getType());
            }
        }
        log.trace("Applied batch of {} operations", batch.size());
    }

    @Override
    public synchronized Optional<byte[]> getBlob(String hash, int from, int to) {
        byte[] blob = blobs.get(hash);
        if (blob == null) {
            return Optional.empty();
        }
        int start = Math.min(Math.max(0, from), blob.length);
        int end = Math.min(Math.max(start, to), blob.length);
        return Optional.of(Arrays.copyOfRange(blob, start, end));
    }

    @Override
    public synchronized Optional<Message> readMessage(long queueId) {
        Message message = messages.get(queueId);
        return message != null ? Optional.of(SerializationUtils.clone(message)) : Optional.empty();
    }

    @Override
    public synchronized List<QueueEvent> nextEvents(long until, int limit) {
        List<QueueEvent> due = new ArrayList<>();
        for (QueueEvent event : events) {
            if (event.getDue() > until || due.size() >= limit) {
                break;
            }
            due.add(event);
        }
        return due;
    }

    @Override
    public synchronized Optional<Long> nextDue() {
        return events.isEmpty() ? Optional.empty() : Optional.of(events.first().getDue());
    }

    /**
     * Gets the number of stored messages.
     *
     * @return Count.
     */
    public synchronized int messageCount() {
        return messages.size();
    }

    /**
     * Gets the number of stored blobs.
     *
     * @return Count.
     */
    public synchronized int blobCount() {
        return blobs.size();
    }

    /**
     * Take a snapshot of all queue events.
     *
     * @return List of QueueEvent.
     */
    public synchronized List<QueueEvent> snapshotEvents() {
        return new ArrayList<>(events);
    }
}
