package com.mimecast.outpost.queue.dispatch;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.mimecast.outpost.config.queue.StrategyCatalog;
import com.mimecast.outpost.expr.PolicyResolver;
import com.mimecast.outpost.queue.Message;
import com.mimecast.outpost.queue.MessageSubmitter;
import com.mimecast.outpost.queue.QueueName;
import com.mimecast.outpost.queue.Recipient;
import com.mimecast.outpost.queue.bounce.DsnBuilder;
import com.mimecast.outpost.queue.bounce.DsnSender;
import com.mimecast.outpost.queue.bounce.DsnSigner;
import com.mimecast.outpost.queue.delivery.DeliveryStateMachine;
import com.mimecast.outpost.queue.delivery.DeliveryTransport;
import com.mimecast.outpost.queue.delivery.StrategyResolver;
import com.mimecast.outpost.queue.limit.CounterStore;
import com.mimecast.outpost.queue.limit.ThrottleGuard;
import com.mimecast.outpost.queue.limit.ThrottleResult;
import com.mimecast.outpost.store.Batch;
import com.mimecast.outpost.store.QueueEvent;
import com.mimecast.outpost.store.QueueStorageException;
import com.mimecast.outpost.store.QueueStore;
import org.apache.commons.codec.digest.DigestUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

/**
 * Delivery queue housekeeper.
 * <p>Admits new messages and, on a fixed schedule, hands due queue events to the workers
 * of their virtual queue.
 * <p>Messages being processed, or locked after hitting a concurrency limit, are kept on hold
 * and skipped until released.
 */
public class QueueManager implements MessageSubmitter {
    private static final Logger log = LogManager.getLogger(QueueManager.class);

    // On hold marker for messages being processed.
    private static final long IN_FLIGHT = -1L;

    private final QueueStore store;
    private final StrategyResolver strategies;
    private final ThrottleGuard guard;
    private final VirtualQueueDispatcher dispatcher;
    private final DsnSender dsnSender;
    private final QueueWorker worker;
    private final Map<Long, Long> onHold = new ConcurrentHashMap<>();

    private LongSupplier clock = () -> Instant.now().getEpochSecond();
    private int maxEventsPerTick = 100;
    private volatile ScheduledExecutorService scheduler;

    /**
     * Constructs a new QueueManager instance.
     *
     * @param catalog   Strategy catalog.
     * @param resolver  Policy resolver.
     * @param store     Queue store.
     * @param counters  Counter store for limiters and quotas.
     * @param transport Delivery transport.
     */
    public QueueManager(StrategyCatalog catalog, PolicyResolver resolver, QueueStore store,
                        CounterStore counters, DeliveryTransport transport) {
        this.store = store;
        this.strategies = new StrategyResolver(catalog, resolver);
        this.guard = new ThrottleGuard(catalog, resolver, counters);
        this.dispatcher = new VirtualQueueDispatcher(catalog.getVirtualQueues());
        this.dsnSender = new DsnSender(new DsnBuilder(strategies, store), this, strategies);
        this.worker = new QueueWorker(store, strategies, guard, transport, dsnSender);
    }

    /**
     * Sets the time source.
     *
     * @param clock Supplier of seconds since epoch.
     * @return Self.
     */
    public QueueManager setClock(LongSupplier clock) {
        this.clock = clock;
        return this;
    }

    /**
     * Sets the DSN signer.
     *
     * @param signer DsnSigner.
     * @return Self.
     */
    public QueueManager setSigner(DsnSigner signer) {
        dsnSender.setSigner(signer);
        return this;
    }

    /**
     * Sets the maximum number of events read per tick.
     *
     * @param maxEventsPerTick Limit.
     * @return Self.
     */
    public QueueManager setMaxEventsPerTick(int maxEventsPerTick) {
        this.maxEventsPerTick = Math.max(1, maxEventsPerTick);
        return this;
    }

    public ThrottleGuard getGuard() {
        return guard;
    }

    public VirtualQueueDispatcher getDispatcher() {
        return dispatcher;
    }

    /**
     * Starts the housekeeper.
     *
     * @param initialDelaySeconds Delay before the first tick.
     * @param periodSeconds       Seconds between ticks.
     */
    public synchronized void start(long initialDelaySeconds, long periodSeconds) {
        if (scheduler != null) {
            return;
        }

        scheduler = Executors.newSingleThreadScheduledExecutor(
                new ThreadFactoryBuilder().setNameFormat("queue-housekeeper-%d").setDaemon(true).build());

        Runnable task = () -> {
            try {
                tick();
            } catch (Exception e) {
                log.error("Queue housekeeper error: {}", e.getMessage(), e);
            }
        };

        scheduler.scheduleAtFixedRate(task, initialDelaySeconds, periodSeconds, TimeUnit.SECONDS);
        log.info("Queue housekeeper scheduled: initialDelaySeconds={}, periodSeconds={}, maxEventsPerTick={}",
                initialDelaySeconds, periodSeconds, maxEventsPerTick);
    }

    /**
     * Stops the housekeeper and drains the workers.
     *
     * @param timeoutSeconds Maximum wait per virtual queue.
     */
    public synchronized void shutdown(long timeoutSeconds) {
        if (scheduler != null) {
            scheduler.shutdown();
            scheduler = null;
            log.info("Queue housekeeper stopped");
        }
        dispatcher.shutdown(timeoutSeconds);
    }

    /**
     * Dispatches due events.
     * <p>Events of a saturated virtual queue wait for the next tick, other queues carry on.
     * <p>Storage failures are logged and leave the events in place.
     *
     * @return Number of events dispatched.
     */
    public int tick() {
        long now = clock.getAsLong();
        List<QueueEvent> events;
        try {
            events = store.nextEvents(now, maxEventsPerTick);
        } catch (QueueStorageException e) {
            log.error("Failed to read queue events: {}", e.getMessage(), e);
            return 0;
        }

        onHold.entrySet().removeIf(entry -> entry.getValue() != IN_FLIGHT && entry.getValue() <= now);

        int dispatched = 0;
        Set<QueueName> saturated = new HashSet<>();
        for (QueueEvent event : events) {
            if (saturated.contains(event.getQueue()) || onHold.putIfAbsent(event.getQueueId(), IN_FLIGHT) != null) {
                continue;
            }

            if (!dispatcher.dispatch(event.getQueue(), () -> runWorker(event))) {
                onHold.remove(event.getQueueId());
                saturated.add(event.getQueue());
                continue;
            }
            dispatched++;
        }

        if (dispatched > 0 || !saturated.isEmpty()) {
            log.debug("Queue tick: due={} dispatched={} saturated={} onHold={}", events.size(), dispatched, saturated, onHold.size());
        }
        return dispatched;
    }

    /**
     * Admits a message into the queue.
     * <p>Checks inbound limiters, reserves quota, then stores content, message and events.
     *
     * @param message Message with its recipients.
     * @param content Raw message content.
     * @return ThrottleResult, admitted when the message was queued.
     */
    public ThrottleResult queueMessage(Message message, byte[] content) {
        long now = clock.getAsLong();
        prepare(message, content);

        ThrottleResult inbound = guard.checkInbound(message, now);
        if (!inbound.isAdmitted()) {
            log.info("Message deferred by inbound limiter: uid={} {}", message.getQueueId(), inbound);
            return inbound;
        }

        try {
            ThrottleResult quota = guard.reserveQuota(message, now);
            if (!quota.isAdmitted()) {
                return quota;
            }

            try {
                submit(message, content, now);
            } catch (QueueStorageException e) {
                guard.releaseAll(message);
                throw e;
            }
            return quota;
        } finally {
            inbound.release();
        }
    }

    @Override
    public long nextQueueId() {
        return store.assignDocumentIds(1);
    }

    @Override
    public void submit(Message message, byte[] content, long now) {
        prepare(message, content);
        for (Recipient rcpt : message.getRecipients()) {
            DeliveryStateMachine.admit(rcpt, strategies.schedule(message, rcpt, now), now);
        }

        Batch batch = new Batch()
                .putBlob(message.getBlobHash(), content)
                .setMessage(message);
        message.nextEvents().forEach((queue, due) -> batch.setEvent(new QueueEvent(due, message.getQueueId(), queue)));
        store.write(batch);

        log.info("Message queued: uid={} from=<{}> recipients={} size={} source={}",
                message.getQueueId(), message.getReturnPath(), message.getRecipients().size(),
                message.getSize(), message.getSource().getId());
    }

    /**
     * Makes every undelivered recipient of a message due now.
     *
     * @param queueId Message id.
     * @return Boolean, false if the message is unknown.
     */
    public boolean retryNow(long queueId) {
        long now = clock.getAsLong();
        Optional<Message> stored = store.readMessage(queueId);
        if (stored.isEmpty()) {
            return false;
        }

        Message message = stored.get();
        Map<QueueName, Long> previous = message.nextEvents();
        int retried = 0;
        for (Recipient rcpt : message.getRecipients()) {
            if (DeliveryStateMachine.retryNow(rcpt, now)) {
                retried++;
            }
        }

        Batch batch = new Batch().setMessage(message);
        previous.forEach((queue, due) -> batch.clearEvent(new QueueEvent(due, queueId, queue)));
        message.nextEvents().forEach((queue, due) -> batch.setEvent(new QueueEvent(due, queueId, queue)));
        store.write(batch);
        onHold.computeIfPresent(queueId, (id, until) -> until == IN_FLIGHT ? until : null);

        log.info("Retry requested: uid={} recipients={}", queueId, retried);
        return true;
    }

    /**
     * Removes a message from the queue and returns its quota.
     *
     * @param queueId Message id.
     * @return Boolean, false if the message is unknown.
     */
    public boolean remove(long queueId) {
        Optional<Message> stored = store.readMessage(queueId);
        if (stored.isEmpty()) {
            return false;
        }

        Message message = stored.get();
        Batch batch = new Batch();
        message.nextEvents().forEach((queue, due) -> batch.clearEvent(new QueueEvent(due, queueId, queue)));
        batch.clearMessage(queueId).clearBlob(message.getBlobHash());
        store.write(batch);
        guard.releaseAll(message);

        log.info("Message removed: uid={}", queueId);
        return true;
    }

    /**
     * Gets the number of messages on hold.
     *
     * @return Count.
     */
    public int getOnHoldCount() {
        return onHold.size();
    }

    private void runWorker(QueueEvent event) {
        try {
            WorkerResult result = worker.process(event, clock.getAsLong());
            if (result.getType() == WorkerResult.Type.LOCKED) {
                onHold.put(event.getQueueId(), result.getUntil());
            } else {
                onHold.remove(event.getQueueId());
            }
        } catch (QueueStorageException e) {
            onHold.remove(event.getQueueId());
            log.error("Queue storage error, will retry: uid={} error={}", event.getQueueId(), e.getMessage(), e);
        } catch (Exception e) {
            onHold.remove(event.getQueueId());
            log.error("Queue worker error: uid={} error={}", event.getQueueId(), e.getMessage(), e);
        }
    }

    private static void prepare(Message message, byte[] content) {
        if (message.getBlobHash().isEmpty()) {
            message.setBlobHash(DigestUtils.sha256Hex(content));
        }
        if (message.getSize() == 0) {
            message.setSize(content.length);
        }
    }
}
