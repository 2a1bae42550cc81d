package com.mimecast.outpost.queue.bounce;

import com.mimecast.outpost.metrics.QueueMetrics;
import com.mimecast.outpost.queue.ErrorDetails;
import com.mimecast.outpost.queue.HostResponse;
import com.mimecast.outpost.queue.Message;
import com.mimecast.outpost.queue.MessageSource;
import com.mimecast.outpost.queue.MessageSubmitter;
import com.mimecast.outpost.queue.QueueEnvelope;
import com.mimecast.outpost.queue.Recipient;
import com.mimecast.outpost.queue.RecipientFlags;
import com.mimecast.outpost.queue.Schedule;
import com.mimecast.outpost.queue.Status;
import com.mimecast.outpost.queue.delivery.StrategyResolver;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Emits delivery events and queues DSN messages.
 *
 * <p>Messages with an empty return path are bounces themselves; their failures are logged
 * as double bounces and never answered with another DSN.
 */
public class DsnSender {
    private static final Logger log = LogManager.getLogger(DsnSender.class);
    private static final Logger deliveryLog = LogManager.getLogger("com.mimecast.outpost.delivery");

    /**
     * Seconds past expiry at which a bounce notification is looked at again.
     */
    static final long DOUBLE_BOUNCE_GRACE = 10L;

    private final DsnBuilder builder;
    private final MessageSubmitter submitter;
    private final StrategyResolver strategies;
    private DsnSigner signer = DsnSigner.NONE;

    /**
     * Constructs a new DsnSender instance.
     *
     * @param builder    DSN builder.
     * @param submitter  Queue for generated messages.
     * @param strategies Strategy resolver.
     */
    public DsnSender(DsnBuilder builder, MessageSubmitter submitter, StrategyResolver strategies) {
        this.builder = builder;
        this.submitter = submitter;
        this.strategies = strategies;
    }

    /**
     * Sets the DSN signer.
     *
     * @param signer DsnSigner.
     * @return Self.
     */
    public DsnSender setSigner(DsnSigner signer) {
        this.signer = signer;
        return this;
    }

    /**
     * Reports on a message after a delivery round.
     *
     * @param message Message, flags and notify schedules are updated.
     * @param now     Current time.
     * @return List of DeliveryEvent emitted.
     */
    public List<DeliveryEvent> sendDsn(Message message, long now) {
        List<DeliveryEvent> events = logDsn(message, now);

        if (!message.getReturnPath().isEmpty()) {
            Optional<byte[]> dsn = builder.build(message, now);
            if (dsn.isPresent()) {
                Message dsnMessage = new Message(submitter.nextQueueId(), "", now)
                        .setSource(MessageSource.DSN)
                        .addRecipient(new Recipient(message.getReturnPath(), 0L, now));

                byte[] content = sign(message, dsn.get(), now);
                submitter.submit(dsnMessage, content, now);
                log.info("Queued DSN: uid={} dsnUid={} to=<{}>", message.getQueueId(), dsnMessage.getQueueId(), message.getReturnPath());
            }
        } else {
            handleDoubleBounce(message, now).ifPresent(events::add);
        }

        return events;
    }

    /**
     * Emits one event per recipient that has not been reported yet.
     *
     * @param message Message.
     * @param now     Current time.
     * @return List of DeliveryEvent.
     */
    public List<DeliveryEvent> logDsn(Message message, long now) {
        List<DeliveryEvent> events = new ArrayList<>();
        for (Recipient rcpt : message.getRecipients()) {
            if (rcpt.hasFlag(RecipientFlags.DSN_SENT)) {
                continue;
            }

            Status<HostResponse, ErrorDetails> status = rcpt.getStatus();
            boolean notifyDue = rcpt.getNotify().getDue() <= now;
            DeliveryEvent event;
            if (status.isCompleted()) {
                HostResponse response = status.getResponse().orElseThrow();
                event = new DeliveryEvent(DeliveryEvent.Type.DSN_SUCCESS, message.getQueueId(), List.of(rcpt.getAddress()))
                        .setHostname(response.getHostname())
                        .setCode(response.getResponse().getCode())
                        .setDetails(response.getResponse().getMessage());
            } else if (status.isTemporary() && notifyDue) {
                ErrorDetails details = status.getError().orElseThrow();
                event = new DeliveryEvent(DeliveryEvent.Type.DSN_TEMP_FAIL, message.getQueueId(), List.of(rcpt.getAddress()))
                        .setHostname(details.getEntity())
                        .setDetails(details.getError().toString())
                        .setNextRetry(rcpt.getRetry().getDue())
                        .setExpires(rcpt.expirationTime(message.getCreated()).orElse(-1))
                        .setTotal(rcpt.getRetry().getAttempt());
            } else if (status.isPermanent()) {
                ErrorDetails details = status.getError().orElseThrow();
                event = new DeliveryEvent(DeliveryEvent.Type.DSN_PERM_FAIL, message.getQueueId(), List.of(rcpt.getAddress()))
                        .setHostname(details.getEntity())
                        .setDetails(details.getError().toString())
                        .setTotal(rcpt.getRetry().getAttempt());
            } else if (status.isScheduled() && notifyDue) {
                event = new DeliveryEvent(DeliveryEvent.Type.DSN_TEMP_FAIL, message.getQueueId(), List.of(rcpt.getAddress()))
                        .setDetails("Concurrency limited")
                        .setNextRetry(rcpt.getRetry().getDue())
                        .setExpires(rcpt.expirationTime(message.getCreated()).orElse(-1))
                        .setTotal(rcpt.getRetry().getAttempt());
            } else {
                continue;
            }

            deliveryLog.info(event.toMapMessage());
            events.add(event);
        }
        return events;
    }

    /**
     * Marks failures of a bounce as reported and pushes due notifications past expiry.
     * <p>Running it again on the same message reports nothing new.
     *
     * @param message Message with an empty return path.
     * @param now     Current time.
     * @return Optional of the double bounce event, empty if nothing new failed.
     */
    Optional<DeliveryEvent> handleDoubleBounce(Message message, long now) {
        List<String> failed = new ArrayList<>();
        for (Recipient rcpt : message.getRecipients()) {
            if (!rcpt.hasFlag(RecipientFlags.DSN_SENT | RecipientFlags.NOTIFY_NEVER) && rcpt.getStatus().isPermanent()) {
                rcpt.addFlags(RecipientFlags.DSN_SENT);
                StringBuilder txt = new StringBuilder();
                DsnBuilder.writeText(rcpt.getStatus().getError().orElseThrow(), rcpt.getAddress(), txt);
                failed.add(txt.toString().trim());
            }

            if (rcpt.getNotify().getDue() <= now) {
                OptionalLong expires = rcpt.expirationTime(message.getCreated());
                rcpt.getNotify().setDue(expires.isPresent() ? expires.getAsLong() + DOUBLE_BOUNCE_GRACE : Schedule.NEVER);
            }
        }

        if (failed.isEmpty()) {
            return Optional.empty();
        }

        DeliveryEvent event = new DeliveryEvent(DeliveryEvent.Type.DOUBLE_BOUNCE, message.getQueueId(), failed);
        deliveryLog.warn(event.toMapMessage());
        QueueMetrics.incrementDoubleBounce();
        return Optional.of(event);
    }

    private byte[] sign(Message message, byte[] dsn, long now) {
        List<String> signers = strategies.getResolver()
                .resolveList(strategies.getCatalog().getDsn().getSign(), QueueEnvelope.of(message, now));
        if (signers.isEmpty()) {
            return dsn;
        }

        List<String> headers = signer.sign(signers, dsn);
        if (headers.isEmpty()) {
            return dsn;
        }

        ByteArrayOutputStream stream = new ByteArrayOutputStream();
        for (String header : headers) {
            stream.writeBytes((header + "\r\n").getBytes(StandardCharsets.UTF_8));
        }
        stream.writeBytes(dsn);
        log.debug("Signed DSN: uid={} signers={}", message.getQueueId(), signers);
        return stream.toByteArray();
    }
}
