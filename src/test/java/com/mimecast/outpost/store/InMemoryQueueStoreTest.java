package com.mimecast.outpost.store;

import com.mimecast.outpost.queue.Message;
import com.mimecast.outpost.queue.QueueName;
import com.mimecast.outpost.queue.Recipient;
import com.mimecast.outpost.queue.RecipientFlags;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryQueueStoreTest {

    private static final QueueName BULK = QueueName.of("bulk").orElseThrow();

    @Test
    void testAssignDocumentIds() {
        InMemoryQueueStore store = new InMemoryQueueStore();
        long first = store.assignDocumentIds(3);
        assertEquals(first + 3, store.assignDocumentIds(1));
        assertEquals(first + 4, store.assignDocumentIds(0));
    }

    @Test
    void testBatchWriteAndClear() {
        InMemoryQueueStore store = new InMemoryQueueStore();
        Message message = new Message(7, "sender@example.org", 100)
                .setBlobHash("abc")
                .addRecipient(new Recipient("user@example.com", RecipientFlags.DEFAULT_NOTIFY, 100));

        store.write(new Batch()
                .putBlob("abc", "Hello world".getBytes(StandardCharsets.UTF_8))
                .setMessage(message)
                .setEvent(new QueueEvent(200, 7, QueueName.DEFAULT))
                .setEvent(new QueueEvent(150, 7, BULK)));

        assertEquals(1, store.messageCount());
        assertEquals(1, store.blobCount());
        assertEquals(Optional.of(150L), store.nextDue());
        assertEquals("user@example.com", store.readMessage(7).orElseThrow().getRecipients().get(0).getAddress());

        store.write(new Batch()
                .clearEvent(new QueueEvent(200, 7, QueueName.DEFAULT))
                .clearEvent(new QueueEvent(150, 7, BULK))
                .clearMessage(7)
                .clearBlob("abc"));

        assertEquals(0, store.messageCount());
        assertEquals(0, store.blobCount());
        assertTrue(store.readMessage(7).isEmpty());
        assertTrue(store.nextDue().isEmpty());
    }

    @Test
    void testMessagesAreCopied() {
        InMemoryQueueStore store = new InMemoryQueueStore();
        Message message = new Message(1, "sender@example.org", 100);
        store.write(new Batch().setMessage(message));

        message.addRecipient(new Recipient("late@example.com", 0L, 100));
        Message read = store.readMessage(1).orElseThrow();
        assertTrue(read.getRecipients().isEmpty());

        read.addRecipient(new Recipient("other@example.com", 0L, 100));
        assertTrue(store.readMessage(1).orElseThrow().getRecipients().isEmpty());
    }

    @Test
    void testNextEventsOrderedAndLimited() {
        InMemoryQueueStore store = new InMemoryQueueStore();
        store.write(new Batch()
                .setEvent(new QueueEvent(300, 3, QueueName.DEFAULT))
                .setEvent(new QueueEvent(100, 2, QueueName.DEFAULT))
                .setEvent(new QueueEvent(100, 1, BULK))
                .setEvent(new QueueEvent(500, 4, QueueName.DEFAULT)));

        List<QueueEvent> due = store.nextEvents(300, 10);
        assertEquals(3, due.size());
        assertEquals(100, due.get(0).getDue());
        assertEquals(100, due.get(1).getDue());
        assertEquals(new QueueEvent(300, 3, QueueName.DEFAULT), due.get(2));

        assertEquals(2, store.nextEvents(1000, 2).size());
        assertTrue(store.nextEvents(99, 10).isEmpty());

        // Re-adding the same event does not duplicate it.
        store.write(new Batch().setEvent(new QueueEvent(300, 3, QueueName.DEFAULT)));
        assertEquals(4, store.snapshotEvents().size());
    }

    @Test
    void testSharedBlobKeptWhileReferenced() {
        InMemoryQueueStore store = new InMemoryQueueStore();
        byte[] content = "Hello world".getBytes(StandardCharsets.UTF_8);
        store.write(new Batch().putBlob("shared", content));
        store.write(new Batch().putBlob("shared", content));
        assertEquals(1, store.blobCount());

        store.write(new Batch().clearBlob("shared"));
        assertEquals(1, store.blobCount());
        assertArrayEquals(content, store.getBlob("shared", 0, 100).orElseThrow());

        store.write(new Batch().clearBlob("shared"));
        assertEquals(0, store.blobCount());
        assertTrue(store.getBlob("shared", 0, 100).isEmpty());

        // Clearing unknown content is harmless.
        store.write(new Batch().clearBlob("shared"));
        store.write(new Batch().putBlob("shared", content));
        assertEquals(1, store.blobCount());
    }

    @Test
    void testGetBlobRange() {
        InMemoryQueueStore store = new InMemoryQueueStore();
        store.write(new Batch().putBlob("hash", "Hello world".getBytes(StandardCharsets.UTF_8)));

        assertEquals("Hello", new String(store.getBlob("hash", 0, 5).orElseThrow(), StandardCharsets.UTF_8));
        assertEquals("world", new String(store.getBlob("hash", 6, 100).orElseThrow(), StandardCharsets.UTF_8));
        assertEquals(0, store.getBlob("hash", 20, 30).orElseThrow().length);
        assertTrue(store.getBlob("missing", 0, 5).isEmpty());
    }
}
