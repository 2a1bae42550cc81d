package com.mimecast.outpost.main;

import com.mimecast.outpost.queue.DeliveryError;
import com.mimecast.outpost.queue.ErrorDetails;
import com.mimecast.outpost.queue.HostResponse;
import com.mimecast.outpost.queue.Message;
import com.mimecast.outpost.queue.Recipient;
import com.mimecast.outpost.queue.Status;
import com.mimecast.outpost.queue.limit.InMemoryCounterStore;
import com.mimecast.outpost.store.InMemoryQueueStore;
import com.mimecast.outpost.store.QueueStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FactoriesTest {

    @AfterEach
    void tearDown() {
        Factories.setQueueStore(null);
        Factories.setCounterStore(null);
        Factories.setTransport(null);
    }

    @Test
    void testDefaults() {
        assertTrue(Factories.getQueueStore() instanceof InMemoryQueueStore);
        assertTrue(Factories.getCounterStore() instanceof InMemoryCounterStore);

        Status<HostResponse, ErrorDetails> status = Factories.getTransport()
                .deliver(new Message(1, "sender@example.org", 0), new Recipient("user@example.com", 0L, 0), null);
        assertTrue(status.isTemporary());
        assertEquals(DeliveryError.Type.IO, status.getError().orElseThrow().getError().getType());
    }

    @Test
    void testInjected() {
        QueueStore store = new InMemoryQueueStore();
        Factories.setQueueStore(() -> store);
        assertSame(store, Factories.getQueueStore());
    }

    @Test
    void testFailingCallableFallsBack() {
        Factories.setQueueStore(() -> {
            throw new IllegalStateException("Unavailable");
        });
        assertTrue(Factories.getQueueStore() instanceof InMemoryQueueStore);
    }
}
