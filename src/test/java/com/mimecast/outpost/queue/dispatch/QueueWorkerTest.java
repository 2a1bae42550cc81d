package com.mimecast.outpost.queue.dispatch;

import com.mimecast.outpost.config.BasicConfig;
import com.mimecast.outpost.config.ConfigFoundation;
import com.mimecast.outpost.config.queue.QueueConfigLoader;
import com.mimecast.outpost.config.queue.StrategyCatalog;
import com.mimecast.outpost.expr.DefaultPolicyResolver;
import com.mimecast.outpost.queue.DeliveryError;
import com.mimecast.outpost.queue.ErrorDetails;
import com.mimecast.outpost.queue.HostResponse;
import com.mimecast.outpost.queue.Message;
import com.mimecast.outpost.queue.MessageSubmitter;
import com.mimecast.outpost.queue.QueueEnvelope;
import com.mimecast.outpost.queue.QueueName;
import com.mimecast.outpost.queue.Recipient;
import com.mimecast.outpost.queue.RecipientFlags;
import com.mimecast.outpost.queue.SmtpResponse;
import com.mimecast.outpost.queue.Status;
import com.mimecast.outpost.queue.bounce.DsnBuilder;
import com.mimecast.outpost.queue.bounce.DsnSender;
import com.mimecast.outpost.queue.delivery.DeliveryStateMachine;
import com.mimecast.outpost.queue.delivery.StrategyResolver;
import com.mimecast.outpost.queue.limit.InMemoryCounterStore;
import com.mimecast.outpost.queue.limit.ThrottleGuard;
import com.mimecast.outpost.queue.limit.ThrottleResult;
import com.mimecast.outpost.store.Batch;
import com.mimecast.outpost.store.InMemoryQueueStore;
import com.mimecast.outpost.store.QueueEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;

class QueueWorkerTest {

    private static final long NOW = 1_700_000_000L;

    private static final String CONFIG = "{" +
            "queue: {" +
            "  schedule: {remote: {retry: ['1m', '5m'], notify: ['1d'], expire: '2d'}}," +
            "  limiter: {outbound: {mx: {key: ['mx'], concurrency: 1}}}" +
            "}," +
            "report: {domain: 'example.org'}" +
            "}";

    private static final HostResponse OK = new HostResponse("mx.example.com", new SmtpResponse(250, new int[]{2, 0, 0}, "OK"));
    private static final ErrorDetails BUSY = new ErrorDetails("mx.example.com",
            DeliveryError.unexpectedResponse("MAIL FROM", new SmtpResponse(421, new int[]{4, 7, 0}, "Busy")));
    private static final ErrorDetails UNKNOWN = new ErrorDetails("mx.example.com",
            DeliveryError.unexpectedResponse("RCPT TO", new SmtpResponse(550, new int[]{5, 1, 1}, "Unknown user")));

    private InMemoryQueueStore store;
    private StrategyResolver strategies;
    private ThrottleGuard guard;
    private QueueWorker worker;
    private final List<Message> dsns = new ArrayList<>();
    private final AtomicInteger attempts = new AtomicInteger();
    private Function<Recipient, Status<HostResponse, ErrorDetails>> outcome = rcpt -> Status.completed(OK);

    @BeforeEach
    void setUp() {
        BasicConfig config = new BasicConfig(ConfigFoundation.parse(CONFIG));
        StrategyCatalog catalog = QueueConfigLoader.load(config);
        DefaultPolicyResolver resolver = new DefaultPolicyResolver(config);

        store = new InMemoryQueueStore();
        strategies = new StrategyResolver(catalog, resolver);
        guard = new ThrottleGuard(catalog, resolver, new InMemoryCounterStore());

        MessageSubmitter submitter = new MessageSubmitter() {
            @Override
            public long nextQueueId() {
                return store.assignDocumentIds(1);
            }

            @Override
            public void submit(Message message, byte[] content, long now) {
                dsns.add(message);
            }
        };

        DsnSender dsnSender = new DsnSender(new DsnBuilder(strategies, store), submitter, strategies);
        worker = new QueueWorker(store, strategies, guard, (message, rcpt, plan) -> {
            attempts.incrementAndGet();
            return outcome.apply(rcpt);
        }, dsnSender);
    }

    private QueueEvent queue(Message message) {
        byte[] content = "Subject: Test\r\n\r\nBody\r\n".getBytes(StandardCharsets.UTF_8);
        message.setBlobHash("blob-" + message.getQueueId()).setSize(content.length);
        for (Recipient rcpt : message.getRecipients()) {
            DeliveryStateMachine.admit(rcpt, strategies.schedule(message, rcpt, message.getCreated()), message.getCreated());
        }
        Batch batch = new Batch().putBlob(message.getBlobHash(), content).setMessage(message);
        message.nextEvents().forEach((queue, due) -> batch.setEvent(new QueueEvent(due, message.getQueueId(), queue)));
        store.write(batch);
        return store.snapshotEvents().get(0);
    }

    private static Message message(long id, long created, String... rcpts) {
        Message message = new Message(id, "sender@example.org", created);
        for (String rcpt : rcpts) {
            message.addRecipient(new Recipient(rcpt, RecipientFlags.DEFAULT_NOTIFY, created));
        }
        return message;
    }

    @Test
    void testDelivered() {
        QueueEvent event = queue(message(1, NOW, "user@example.com"));

        assertEquals(WorkerResult.Type.COMPLETED, worker.process(event, NOW).getType());
        assertEquals(1, attempts.get());
        assertEquals(0, store.messageCount());
        assertEquals(0, store.blobCount());
        assertTrue(store.snapshotEvents().isEmpty());
        assertTrue(dsns.isEmpty());
    }

    @Test
    void testTemporaryFailureReschedules() {
        outcome = rcpt -> Status.temporaryFailure(BUSY);
        QueueEvent event = queue(message(1, NOW, "user@example.com"));

        assertEquals(WorkerResult.Type.COMPLETED, worker.process(event, NOW).getType());

        Message stored = store.readMessage(1).orElseThrow();
        Recipient rcpt = stored.getRecipients().get(0);
        assertTrue(rcpt.getStatus().isTemporary());
        assertEquals(NOW + 60, rcpt.getRetry().getDue());
        assertEquals(List.of(new QueueEvent(NOW + 60, 1, QueueName.DEFAULT)), store.snapshotEvents());

        // Nothing due yet.
        worker.process(store.snapshotEvents().get(0), NOW + 30);
        assertEquals(1, attempts.get());

        worker.process(store.snapshotEvents().get(0), NOW + 60);
        assertEquals(2, attempts.get());
        assertEquals(NOW + 60 + 300, store.readMessage(1).orElseThrow().getRecipients().get(0).getRetry().getDue());
    }

    @Test
    void testPermanentFailureQueuesDsn() {
        outcome = rcpt -> Status.permanentFailure(UNKNOWN);
        QueueEvent event = queue(message(1, NOW, "nobody@example.com"));

        worker.process(event, NOW);

        assertEquals(0, store.messageCount());
        assertEquals(1, dsns.size());
        assertEquals("sender@example.org", dsns.get(0).getRecipients().get(0).getAddress());
    }

    @Test
    void testPartialDelivery() {
        outcome = rcpt -> rcpt.getAddress().startsWith("slow") ? Status.temporaryFailure(BUSY) : Status.completed(OK);
        QueueEvent event = queue(message(1, NOW, "fast@example.com", "slow@example.net"));

        worker.process(event, NOW);

        Message stored = store.readMessage(1).orElseThrow();
        assertTrue(stored.getRecipients().get(0).getStatus().isCompleted());
        assertTrue(stored.getRecipients().get(1).getStatus().isTemporary());
        assertEquals(1, store.blobCount());
        assertEquals(NOW + 60, store.snapshotEvents().get(0).getDue());
    }

    @Test
    void testTransportExceptionIsTemporary() {
        outcome = rcpt -> {
            throw new IllegalStateException("socket closed");
        };
        QueueEvent event = queue(message(1, NOW, "user@example.com"));

        assertEquals(WorkerResult.Type.COMPLETED, worker.process(event, NOW).getType());

        ErrorDetails error = store.readMessage(1).orElseThrow().getRecipients().get(0).getStatus().getError().orElseThrow();
        assertEquals(DeliveryError.Type.IO, error.getError().getType());
        assertEquals("socket closed", error.getError().getDetails());
    }

    @Test
    void testConcurrencyLimitLocksMessage() {
        Message message = message(1, NOW, "user@example.com");
        QueueEvent event = queue(message);

        ThrottleResult held = guard.checkOutbound(
                QueueEnvelope.of(message, message.getRecipients().get(0), "example.com", "", "", NOW), NOW);
        assertTrue(held.isAdmitted());

        WorkerResult result = worker.process(event, NOW);
        assertEquals(WorkerResult.Type.LOCKED, result.getType());
        assertEquals(NOW + QueueWorker.CONCURRENCY_LOCK, result.getUntil());
        assertEquals(0, attempts.get());

        Recipient rcpt = store.readMessage(1).orElseThrow().getRecipients().get(0);
        assertEquals(NOW, rcpt.getRetry().getDue());
        assertEquals(0, rcpt.getRetry().getAttempt());
        assertEquals(DeliveryError.Type.CONCURRENCY_LIMITED, rcpt.getStatus().getError().orElseThrow().getError().getType());

        held.release();
        assertEquals(WorkerResult.Type.COMPLETED, worker.process(store.snapshotEvents().get(0), NOW + 15).getType());
        assertEquals(1, attempts.get());
        assertEquals(0, store.messageCount());
    }

    @Test
    void testExpiredRecipientIsNotAttempted() {
        long created = NOW - 3 * 86400;
        QueueEvent event = queue(message(1, created, "user@example.com"));

        worker.process(event, NOW);

        assertEquals(0, attempts.get());
        assertEquals(0, store.messageCount());
        assertEquals(1, dsns.size());
    }

    @Test
    void testMissingMessageDropsEvent() {
        QueueEvent event = new QueueEvent(NOW, 99, QueueName.DEFAULT);
        store.write(new Batch().setEvent(event));

        assertEquals(WorkerResult.Type.COMPLETED, worker.process(event, NOW).getType());
        assertTrue(store.snapshotEvents().isEmpty());
    }
}
