package com.mimecast.outpost.queue.delivery;

import com.mimecast.outpost.metrics.QueueMetrics;
import com.mimecast.outpost.queue.DeliveryError;
import com.mimecast.outpost.queue.ErrorDetails;
import com.mimecast.outpost.queue.HostResponse;
import com.mimecast.outpost.queue.Message;
import com.mimecast.outpost.queue.Recipient;
import com.mimecast.outpost.queue.Schedule;
import com.mimecast.outpost.queue.Status;
import com.mimecast.outpost.queue.limit.ThrottleResult;
import com.mimecast.outpost.queue.strategy.QueueStrategy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;

/**
 * Recipient status transitions.
 *
 * <p>Transitions:
 * <ul>
 *     <li>Scheduled or TemporaryFailure to Completed, TemporaryFailure or PermanentFailure after an attempt</li>
 *     <li>TemporaryFailure to PermanentFailure only on expiry</li>
 *     <li>PermanentFailure to TemporaryFailure only by administrative retry</li>
 * </ul>
 * <p>Retry and notify due times never move backwards except by administrative retry.
 */
public final class DeliveryStateMachine {
    private static final Logger log = LogManager.getLogger(DeliveryStateMachine.class);

    static final String EXPIRED_UNATTEMPTED = "Message expired without any delivery attempts made.";

    /**
     * Private constructor.
     */
    private DeliveryStateMachine() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Prepares a recipient entering the queue.
     * <p>Assigns virtual queue and expiry, makes delivery due now and the first notification
     * due after the first notify interval.
     *
     * @param recipient Recipient.
     * @param strategy  Schedule strategy.
     * @param now       Current time.
     */
    public static void admit(Recipient recipient, QueueStrategy strategy, long now) {
        recipient.setQueue(strategy.getVirtualQueue())
                .setExpiry(strategy.getExpiry())
                .setRetry(Schedule.now(now))
                .setNotify(Schedule.later(plus(now, strategy.getNotify().get(0))))
                .setStatus(Status.scheduled());
    }

    /**
     * Records a successful delivery.
     *
     * @param recipient Recipient.
     * @param response  Remote host response.
     */
    public static void onSuccess(Recipient recipient, HostResponse response) {
        recipient.setStatus(Status.completed(response));
        QueueMetrics.incrementDelivery("completed");
        log.debug("Delivered: rcpt={} response={}", recipient.getAddress(), response);
    }

    /**
     * Records a permanent failure.
     *
     * @param recipient Recipient.
     * @param details   Error details.
     */
    public static void onPermanentFailure(Recipient recipient, ErrorDetails details) {
        recipient.setStatus(Status.permanentFailure(details));
        QueueMetrics.incrementDelivery("permanent");
        log.debug("Permanent failure: rcpt={} error={}", recipient.getAddress(), details);
    }

    /**
     * Records a temporary failure and schedules the next attempt.
     * <p>The retry interval is picked by attempt number, clamped to the last interval.
     * <p>Notification times are left alone, they advance when a delay DSN is produced.
     *
     * @param recipient Recipient.
     * @param details   Error details.
     * @param strategy  Schedule strategy.
     * @param now       Current time.
     */
    public static void onTemporaryFailure(Recipient recipient, ErrorDetails details, QueueStrategy strategy, long now) {
        Schedule retry = recipient.getRetry();
        long due = plus(now, strategy.getRetryInterval(retry.getAttempt()));
        retry.setDue(Math.max(retry.getDue(), due)).incrementAttempt();
        recipient.setStatus(Status.temporaryFailure(details));
        QueueMetrics.incrementDelivery("temporary");
        log.debug("Temporary failure: rcpt={} attempt={} nextRetry={} error={}",
                recipient.getAddress(), retry.getAttempt(), retry.getDue(), details);
    }

    /**
     * Records an attempt deferred by an outbound limiter.
     * <p>Rate limits move the retry to the time the window refills, concurrency limits keep it.
     * <p>The attempt counter is not incremented.
     *
     * @param recipient Recipient.
     * @param result    Deferred throttle result.
     * @param now       Current time.
     */
    public static void onThrottled(Recipient recipient, ThrottleResult result, long now) {
        if (result.getReason().orElse(null) == ThrottleResult.Reason.RATE) {
            Schedule retry = recipient.getRetry();
            retry.setDue(Math.max(retry.getDue(), Math.max(now, result.getRetryAt())));
            recipient.setStatus(Status.temporaryFailure(new ErrorDetails("localhost", DeliveryError.rateLimited())));
        } else {
            recipient.setStatus(Status.temporaryFailure(new ErrorDetails("localhost", DeliveryError.concurrencyLimited())));
        }
        log.debug("Throttled: rcpt={} {}", recipient.getAddress(), result);
    }

    /**
     * Fails pending recipients that reached their expiry.
     * <p>A temporary failure keeps its last error, a recipient never attempted gets an expiry error.
     *
     * @param message Message.
     * @param now     Current time.
     * @return Number of recipients expired.
     */
    public static int applyExpiry(Message message, long now) {
        int expired = 0;
        for (Recipient rcpt : message.getRecipients()) {
            if (!rcpt.isPending() || !rcpt.isExpired(message.getCreated(), now)) {
                continue;
            }
            if (rcpt.getStatus().isTemporary()) {
                rcpt.setStatus(rcpt.getStatus().intoPermanent());
            } else {
                rcpt.setStatus(Status.permanentFailure(new ErrorDetails(rcpt.getDomain(), DeliveryError.io(EXPIRED_UNATTEMPTED))));
            }
            expired++;
            QueueMetrics.incrementDelivery("expired");
            log.info("Recipient expired: uid={} rcpt={} attempts={}",
                    message.getQueueId(), rcpt.getAddress(), rcpt.getRetry().getAttempt());
        }
        return expired;
    }

    /**
     * Administrative retry.
     * <p>Permanent failures become temporary and the next attempt is due now.
     * DSN flags are left untouched.
     *
     * @param recipient Recipient.
     * @param now       Current time.
     * @return Boolean, true if the recipient is pending afterwards.
     */
    public static boolean retryNow(Recipient recipient, long now) {
        if (recipient.getStatus().isCompleted()) {
            return false;
        }
        recipient.setStatus(recipient.getStatus().intoTemporary());
        recipient.getRetry().setDue(now);
        return true;
    }

    /**
     * Moves the notification schedule to the next notify interval.
     * <p>Once the intervals are exhausted no further notification is due.
     *
     * @param recipient Recipient.
     * @param notify    Notify intervals.
     * @param now       Current time.
     */
    public static void advanceNotify(Recipient recipient, List<Long> notify, long now) {
        Schedule schedule = recipient.getNotify();
        int next = schedule.getAttempt() + 1;
        if (next < notify.size()) {
            schedule.incrementAttempt();
            schedule.setDue(Math.max(schedule.getDue(), plus(now, notify.get(next))));
        } else {
            schedule.setDue(Schedule.NEVER);
        }
    }

    // Saturating addition so large intervals mean never.
    static long plus(long time, long seconds) {
        long sum = time + seconds;
        return ((time ^ sum) & (seconds ^ sum)) < 0 ? Schedule.NEVER : sum;
    }
}
