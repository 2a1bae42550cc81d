package com.mimecast.outpost.queue.dispatch;

import com.mimecast.outpost.queue.QueueName;
import com.mimecast.outpost.queue.strategy.VirtualQueue;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class VirtualQueueDispatcherTest {

    private static final QueueName BULK = QueueName.of("bulk").orElseThrow();
    private static final QueueName PRIORITY = QueueName.of("priority").orElseThrow();

    private VirtualQueueDispatcher dispatcher;
    private final CountDownLatch release = new CountDownLatch(1);

    @BeforeEach
    void setUp() {
        Map<QueueName, VirtualQueue> queues = new LinkedHashMap<>();
        queues.put(BULK, new VirtualQueue(1));
        queues.put(PRIORITY, new VirtualQueue(2));
        dispatcher = new VirtualQueueDispatcher(queues);
    }

    @AfterEach
    void tearDown() {
        release.countDown();
        dispatcher.shutdown(5);
    }

    private Runnable blocking(CountDownLatch started) {
        return () -> {
            started.countDown();
            try {
                release.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        };
    }

    @Test
    void testDefaultPoolAdded() {
        assertEquals(3, dispatcher.getPools().size());
        assertTrue(dispatcher.getPools().containsKey(QueueName.DEFAULT));
        assertEquals(25, dispatcher.getPools().get(QueueName.DEFAULT).getMaximumPoolSize());
        assertEquals(1, dispatcher.getPools().get(BULK).getMaximumPoolSize());
    }

    @Test
    void testSaturatedQueueDoesNotBlockOthers() throws InterruptedException {
        CountDownLatch started = new CountDownLatch(1);
        assertTrue(dispatcher.dispatch(BULK, blocking(started)));
        assertTrue(started.await(5, TimeUnit.SECONDS));

        // One waiting slot per thread.
        assertTrue(dispatcher.dispatch(BULK, blocking(new CountDownLatch(1))));
        assertFalse(dispatcher.hasCapacity(BULK));
        assertFalse(dispatcher.dispatch(BULK, () -> {
        }));
        assertEquals(1, dispatcher.getActiveCount(BULK));

        CountDownLatch ran = new CountDownLatch(1);
        assertTrue(dispatcher.hasCapacity(PRIORITY));
        assertTrue(dispatcher.dispatch(PRIORITY, ran::countDown));
        assertTrue(ran.await(5, TimeUnit.SECONDS));
    }

    @Test
    void testUnknownQueueUsesDefault() throws InterruptedException {
        CountDownLatch ran = new CountDownLatch(1);
        assertTrue(dispatcher.dispatch(QueueName.of("other").orElseThrow(), ran::countDown));
        assertTrue(ran.await(5, TimeUnit.SECONDS));
    }

    @Test
    void testShutdownRefusesWork() {
        release.countDown();
        dispatcher.shutdown(5);
        assertFalse(dispatcher.dispatch(PRIORITY, () -> {
        }));
        assertFalse(dispatcher.hasCapacity(PRIORITY));
    }
}
