package com.mimecast.outpost.queue.dispatch;

import com.mimecast.outpost.queue.DeliveryError;
import com.mimecast.outpost.queue.ErrorDetails;
import com.mimecast.outpost.queue.HostResponse;
import com.mimecast.outpost.queue.Message;
import com.mimecast.outpost.queue.QueueEnvelope;
import com.mimecast.outpost.queue.QueueName;
import com.mimecast.outpost.queue.Recipient;
import com.mimecast.outpost.queue.Status;
import com.mimecast.outpost.queue.bounce.DsnSender;
import com.mimecast.outpost.queue.delivery.DeliveryPlan;
import com.mimecast.outpost.queue.delivery.DeliveryStateMachine;
import com.mimecast.outpost.queue.delivery.DeliveryTransport;
import com.mimecast.outpost.queue.delivery.StrategyResolver;
import com.mimecast.outpost.queue.limit.ThrottleGuard;
import com.mimecast.outpost.queue.limit.ThrottleResult;
import com.mimecast.outpost.queue.strategy.ConnectionStrategy;
import com.mimecast.outpost.queue.strategy.IpAndHost;
import com.mimecast.outpost.queue.strategy.RoutingStrategy;
import com.mimecast.outpost.store.Batch;
import com.mimecast.outpost.store.QueueEvent;
import com.mimecast.outpost.store.QueueStore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.net.InetAddress;
import java.util.Map;
import java.util.Optional;

/**
 * Runs one delivery round of one message on one virtual queue.
 *
 * <p>For each due recipient of the queue: resolve strategies, check outbound limiters,
 * attempt delivery and apply the outcome. Then expire, report, release quota and save.
 */
public class QueueWorker {
    private static final Logger log = LogManager.getLogger(QueueWorker.class);

    /**
     * Seconds a message waits after hitting a concurrency limit.
     */
    static final long CONCURRENCY_LOCK = 15L;

    private final QueueStore store;
    private final StrategyResolver strategies;
    private final ThrottleGuard guard;
    private final DeliveryTransport transport;
    private final DsnSender dsnSender;

    /**
     * Constructs a new QueueWorker instance.
     *
     * @param store      Queue store.
     * @param strategies Strategy resolver.
     * @param guard      Throttle guard.
     * @param transport  Delivery transport.
     * @param dsnSender  DSN sender.
     */
    public QueueWorker(QueueStore store, StrategyResolver strategies, ThrottleGuard guard,
                       DeliveryTransport transport, DsnSender dsnSender) {
        this.store = store;
        this.strategies = strategies;
        this.guard = guard;
        this.transport = transport;
        this.dsnSender = dsnSender;
    }

    /**
     * Processes a queue event.
     *
     * @param event Queue event.
     * @param now   Current time.
     * @return WorkerResult.
     */
    public WorkerResult process(QueueEvent event, long now) {
        Optional<Message> stored = store.readMessage(event.getQueueId());
        if (stored.isEmpty()) {
            log.warn("Message not found, dropping event: {}", event);
            store.write(new Batch().clearEvent(event));
            return WorkerResult.completed();
        }

        Message message = stored.get();
        Map<QueueName, Long> previous = message.nextEvents();
        boolean concurrencyLimited = false;

        for (Recipient rcpt : message.getRecipients()) {
            if (!rcpt.isPending() || !rcpt.getQueue().equals(event.getQueue()) || rcpt.getRetry().getDue() > now
                    || rcpt.isExpired(message.getCreated(), now)) {
                continue;
            }
            concurrencyLimited |= attempt(message, rcpt, now);
        }

        DeliveryStateMachine.applyExpiry(message, now);
        dsnSender.sendDsn(message, now);
        guard.releaseQuota(message);

        Batch batch = new Batch();
        previous.forEach((queue, due) -> batch.clearEvent(new QueueEvent(due, message.getQueueId(), queue)));
        if (previous.isEmpty()) {
            batch.clearEvent(event);
        }
        if (message.hasPending()) {
            batch.setMessage(message);
            message.nextEvents().forEach((queue, due) -> batch.setEvent(new QueueEvent(due, message.getQueueId(), queue)));
            log.debug("Message rescheduled: uid={} next={}", message.getQueueId(), message.nextEvents());
        } else {
            guard.releaseAll(message);
            batch.clearMessage(message.getQueueId()).clearBlob(message.getBlobHash());
            log.info("Message delivery finished: uid={} recipients={}", message.getQueueId(), message.getRecipients().size());
        }
        store.write(batch);

        return concurrencyLimited ? WorkerResult.locked(now + CONCURRENCY_LOCK) : WorkerResult.completed();
    }

    // Returns true when the attempt was held back by a concurrency limit.
    private boolean attempt(Message message, Recipient rcpt, long now) {
        DeliveryPlan plan = strategies.plan(message, rcpt, now);
        QueueEnvelope envelope = QueueEnvelope.of(message, rcpt, remoteHost(plan.getRouting(), rcpt), "",
                sourceIp(plan.getConnection()), now);

        ThrottleResult throttle = guard.checkOutbound(envelope, now);
        if (!throttle.isAdmitted()) {
            DeliveryStateMachine.onThrottled(rcpt, throttle, now);
            return throttle.getReason().orElse(null) == ThrottleResult.Reason.CONCURRENCY;
        }

        Status<HostResponse, ErrorDetails> status;
        try {
            status = transport.deliver(message, rcpt, plan);
        } catch (RuntimeException e) {
            log.error("Delivery transport error: uid={} rcpt={} error={}", message.getQueueId(), rcpt.getAddress(), e.getMessage(), e);
            status = Status.temporaryFailure(new ErrorDetails("localhost", DeliveryError.io(String.valueOf(e.getMessage()))));
        } finally {
            throttle.release();
        }

        if (status.isCompleted()) {
            DeliveryStateMachine.onSuccess(rcpt, status.getResponse().orElseThrow());
        } else if (status.isPermanent()) {
            DeliveryStateMachine.onPermanentFailure(rcpt, status.getError().orElseThrow());
        } else if (status.isTemporary()) {
            DeliveryStateMachine.onTemporaryFailure(rcpt, status.getError().orElseThrow(), plan.getSchedule(), now);
        } else {
            log.warn("Transport returned no outcome: uid={} rcpt={}", message.getQueueId(), rcpt.getAddress());
            DeliveryStateMachine.onTemporaryFailure(rcpt, new ErrorDetails("localhost", DeliveryError.io("No delivery outcome")),
                    plan.getSchedule(), now);
        }
        return false;
    }

    private static String remoteHost(RoutingStrategy routing, Recipient rcpt) {
        if (routing instanceof RoutingStrategy.Relay) {
            return ((RoutingStrategy.Relay) routing).getAddress();
        } else if (routing instanceof RoutingStrategy.Local) {
            return "localhost";
        }
        return rcpt.getDomain();
    }

    private static String sourceIp(ConnectionStrategy connection) {
        return connection.getSourceIpv4().stream()
                .findFirst()
                .or(() -> connection.getSourceIpv6().stream().findFirst())
                .map(IpAndHost::getIp)
                .map(InetAddress::getHostAddress)
                .orElse("");
    }
}
