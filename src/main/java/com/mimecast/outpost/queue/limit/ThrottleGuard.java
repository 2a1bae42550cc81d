package com.mimecast.outpost.queue.limit;

import com.mimecast.outpost.config.queue.StrategyCatalog;
import com.mimecast.outpost.expr.PolicyResolver;
import com.mimecast.outpost.expr.Values;
import com.mimecast.outpost.expr.VariableResolver;
import com.mimecast.outpost.metrics.QueueMetrics;
import com.mimecast.outpost.queue.Message;
import com.mimecast.outpost.queue.QueueEnvelope;
import com.mimecast.outpost.queue.QuotaKey;
import com.mimecast.outpost.queue.Recipient;
import org.apache.commons.codec.digest.DigestUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Applies rate limiters, concurrency limiters and quotas to queued messages.
 *
 * <p>Counters live in a {@link CounterStore}; concurrency slots are tracked per process.
 * <p>Limiter keys are SHA-256 hashes of the selected dimension values, the limiter id and its limits.
 */
public class ThrottleGuard {
    private static final Logger log = LogManager.getLogger(ThrottleGuard.class);

    private final StrategyCatalog catalog;
    private final PolicyResolver resolver;
    private final CounterStore store;
    private final Map<String, ConcurrencyLimiter> concurrency = new ConcurrentHashMap<>();

    /**
     * Constructs a new ThrottleGuard instance.
     *
     * @param catalog  Strategy catalog.
     * @param resolver Policy resolver.
     * @param store    Counter store.
     */
    public ThrottleGuard(StrategyCatalog catalog, PolicyResolver resolver, CounterStore store) {
        this.catalog = catalog;
        this.resolver = resolver;
        this.store = store;
    }

    /**
     * Checks inbound limiters for a message about to be queued.
     * <p>Recipient limiters keyed by domain only are checked once per domain.
     *
     * @param message Message.
     * @param now     Current time.
     * @return ThrottleResult, release it once the message is queued.
     */
    public ThrottleResult checkInbound(Message message, long now) {
        QueueRateLimiters limiters = catalog.getInboundLimiters();
        List<ConcurrencyLimiter.InFlight> taken = new ArrayList<>();
        QueueEnvelope envelope = QueueEnvelope.of(message, now);

        Optional<ThrottleResult> denied = checkAll(limiters.getSender(), envelope, now, taken);
        if (denied.isEmpty()) {
            denied = checkAll(limiters.getRemote(), envelope, now, taken);
        }
        for (Iterator<QueueRateLimiter> it = limiters.getRcpt().iterator(); denied.isEmpty() && it.hasNext(); ) {
            QueueRateLimiter limiter = it.next();
            boolean perDomain = limiter.hasKey(ThrottleKeys.RCPT_DOMAIN) && !limiter.hasKey(ThrottleKeys.RCPT);
            Set<String> domains = new HashSet<>();
            for (Recipient rcpt : message.getRecipients()) {
                if (perDomain && !domains.add(rcpt.getDomain())) {
                    continue;
                }
                denied = check(limiter, QueueEnvelope.of(message, rcpt, now), now, taken);
                if (denied.isPresent()) {
                    break;
                }
            }
        }

        return finish("inbound", message, denied, taken);
    }

    /**
     * Checks outbound limiters before a delivery attempt.
     *
     * @param envelope Recipient and remote host scope.
     * @param now      Current time.
     * @return ThrottleResult, release it once the attempt is over.
     */
    public ThrottleResult checkOutbound(QueueEnvelope envelope, long now) {
        QueueRateLimiters limiters = catalog.getOutboundLimiters();
        List<ConcurrencyLimiter.InFlight> taken = new ArrayList<>();

        Optional<ThrottleResult> denied = checkAll(limiters.getSender(), envelope, now, taken);
        if (denied.isEmpty()) {
            denied = checkAll(limiters.getRcpt(), envelope, now, taken);
        }
        if (denied.isEmpty()) {
            denied = checkAll(limiters.getRemote(), envelope, now, taken);
        }

        return finish("outbound", envelope.getMessage(), denied, taken);
    }

    /**
     * Reserves quota for a message.
     * <p>Sender quotas first, then recipient domain quotas once per domain, then recipient quotas.
     * <p>On rejection everything reserved by this call is returned.
     *
     * @param message Message, reserved keys are added to it.
     * @param now     Current time.
     * @return ThrottleResult, admitted or rejected.
     */
    public ThrottleResult reserveQuota(Message message, long now) {
        QueueQuotas quotas = catalog.getQuotas();
        List<QuotaKey> reserved = new ArrayList<>();

        Optional<String> exceeded = Optional.empty();
        QueueEnvelope envelope = QueueEnvelope.of(message, now);
        for (QueueQuota quota : quotas.getSender()) {
            exceeded = reserve(quota, envelope, 0L, message.getSize(), reserved);
            if (exceeded.isPresent()) {
                break;
            }
        }

        for (Iterator<QueueQuota> it = quotas.getRcptDomain().iterator(); exceeded.isEmpty() && it.hasNext(); ) {
            QueueQuota quota = it.next();
            Set<String> domains = new HashSet<>();
            List<Recipient> recipients = message.getRecipients();
            for (int i = 0; i < recipients.size() && exceeded.isEmpty(); i++) {
                Recipient rcpt = recipients.get(i);
                if (domains.add(rcpt.getDomain())) {
                    exceeded = reserve(quota, QueueEnvelope.of(message, rcpt, now), domainId(i), message.getSize(), reserved);
                }
            }
        }

        for (Iterator<QueueQuota> it = quotas.getRcpt().iterator(); exceeded.isEmpty() && it.hasNext(); ) {
            QueueQuota quota = it.next();
            List<Recipient> recipients = message.getRecipients();
            for (int i = 0; i < recipients.size() && exceeded.isEmpty(); i++) {
                exceeded = reserve(quota, QueueEnvelope.of(message, recipients.get(i), now), i + 1L, message.getSize(), reserved);
            }
        }

        if (exceeded.isPresent()) {
            for (QuotaKey key : reserved) {
                store.add(key.getKey(), -key.getDelta(message.getSize()));
            }
            QueueMetrics.incrementQuotaRejection();
            log.info("Quota exceeded: uid={} quota={}", message.getQueueId(), exceeded.get());
            return ThrottleResult.quotaExceeded(exceeded.get());
        }

        message.getQuotaKeys().addAll(reserved);
        return ThrottleResult.admit(List.of());
    }

    /**
     * Returns the reservations of recipients that reached a final state.
     * <p>Domain reservations are returned once every recipient of that domain is final.
     *
     * @param message Message.
     */
    public void releaseQuota(Message message) {
        if (message.getQuotaKeys().isEmpty()) {
            return;
        }
        List<Recipient> recipients = message.getRecipients();
        Set<Long> releasable = new HashSet<>();
        Set<String> domains = new HashSet<>();
        for (int i = 0; i < recipients.size(); i++) {
            Recipient rcpt = recipients.get(i);
            if (!rcpt.isPending()) {
                releasable.add(i + 1L);
            }
            if (domains.add(rcpt.getDomain())) {
                String domain = rcpt.getDomain();
                boolean domainFinal = recipients.stream()
                        .filter(r -> r.getDomain().equals(domain))
                        .noneMatch(Recipient::isPending);
                if (domainFinal) {
                    releasable.add(domainId(i));
                }
            }
        }

        for (Iterator<QuotaKey> it = message.getQuotaKeys().iterator(); it.hasNext(); ) {
            QuotaKey key = it.next();
            if (key.getId() != 0L && releasable.contains(key.getId())) {
                store.add(key.getKey(), -key.getDelta(message.getSize()));
                it.remove();
                log.debug("Released quota: uid={} id={} kind={}", message.getQueueId(), key.getId(), key.getKind());
            }
        }
    }

    /**
     * Returns every reservation held by a message.
     * <p>Used when the message leaves the queue.
     *
     * @param message Message.
     */
    public void releaseAll(Message message) {
        for (QuotaKey key : message.getQuotaKeys()) {
            store.add(key.getKey(), -key.getDelta(message.getSize()));
        }
        if (!message.getQuotaKeys().isEmpty()) {
            log.debug("Released all quota: uid={} keys={}", message.getQueueId(), message.getQuotaKeys().size());
        }
        message.getQuotaKeys().clear();
    }

    /**
     * Gets the number of concurrency slots currently taken across all limiters.
     *
     * @return Count.
     */
    public int getInFlightCount() {
        return concurrency.values().stream().mapToInt(ConcurrencyLimiter::getActive).sum();
    }

    /**
     * Gets the number of keys with slots in use.
     *
     * @return Count.
     */
    public int getConcurrencyKeyCount() {
        return concurrency.size();
    }

    /**
     * Builds the counter key of a limiter or quota.
     *
     * @param id       Limiter or quota id.
     * @param keys     Dimension bits.
     * @param envelope Variable values.
     * @param limits   Limits description.
     * @return Hex encoded SHA-256.
     */
    static String key(String id, int keys, VariableResolver envelope, String limits) {
        StringBuilder sb = new StringBuilder(id).append('\0');
        for (int bit : ThrottleKeys.order()) {
            if ((keys & bit) != 0) {
                String value = Values.toString(envelope.resolve(ThrottleKeys.toVariable(bit)));
                if (value.isEmpty() && (bit == ThrottleKeys.SENDER || bit == ThrottleKeys.SENDER_DOMAIN)) {
                    value = "<>";
                }
                sb.append(value);
            }
            sb.append('\0');
        }
        sb.append(limits);
        return DigestUtils.sha256Hex(sb.toString());
    }

    private static long domainId(int index) {
        return (index + 1L) << 32;
    }

    private Optional<ThrottleResult> checkAll(List<QueueRateLimiter> limiters, QueueEnvelope envelope, long now,
                                              List<ConcurrencyLimiter.InFlight> taken) {
        for (QueueRateLimiter limiter : limiters) {
            Optional<ThrottleResult> denied = check(limiter, envelope, now, taken);
            if (denied.isPresent()) {
                return denied;
            }
        }
        return Optional.empty();
    }

    private Optional<ThrottleResult> check(QueueRateLimiter limiter, QueueEnvelope envelope, long now,
                                           List<ConcurrencyLimiter.InFlight> taken) {
        if (!limiter.getMatch().isEmpty() && !resolver.test(limiter.getMatch(), envelope)) {
            return Optional.empty();
        }

        String limits = limiter.getRate().map(Rate::toString).orElse("") + ";" +
                (limiter.getConcurrency().isPresent() ? limiter.getConcurrency().getAsInt() : "");
        String key = key(limiter.getId(), limiter.getKeys(), envelope, limits);

        if (limiter.getConcurrency().isPresent()) {
            Optional<ConcurrencyLimiter.InFlight> slot = acquire(key, limiter.getConcurrency().getAsInt());
            if (slot.isEmpty()) {
                return Optional.of(ThrottleResult.concurrencyLimited(limiter.getId()));
            }
            taken.add(slot.get());
        }

        if (limiter.getRate().isPresent()) {
            OptionalLong wait = store.tryRate("rate:" + key, limiter.getRate().get(), now);
            if (wait.isPresent()) {
                return Optional.of(ThrottleResult.rateLimited(limiter.getId(), now + wait.getAsLong()));
            }
        }
        return Optional.empty();
    }

    // Slots are only taken under the map lock so an idle limiter can be dropped safely.
    private Optional<ConcurrencyLimiter.InFlight> acquire(String key, int max) {
        List<ConcurrencyLimiter.InFlight> slot = new ArrayList<>(1);
        concurrency.compute(key, (k, current) -> {
            ConcurrencyLimiter limiter = current != null ? current : new ConcurrencyLimiter(max, idle -> evict(k, idle));
            limiter.tryAcquire().ifPresent(slot::add);
            return limiter.isIdle() ? null : limiter;
        });
        return slot.stream().findFirst();
    }

    private void evict(String key, ConcurrencyLimiter limiter) {
        concurrency.computeIfPresent(key, (k, current) -> current == limiter && current.isIdle() ? null : current);
    }

    private Optional<String> reserve(QueueQuota quota, QueueEnvelope envelope, long id, long size, List<QuotaKey> reserved) {
        if (!quota.getMatch().isEmpty() && !resolver.test(quota.getMatch(), envelope)) {
            return Optional.empty();
        }

        String limits = (quota.getSize().isPresent() ? quota.getSize().getAsLong() : "") + ";" +
                (quota.getMessages().isPresent() ? quota.getMessages().getAsLong() : "");
        String key = key(quota.getId(), quota.getKeys(), envelope, limits);

        if (quota.getSize().isPresent()) {
            String sizeKey = "quota:size:" + key;
            if (!store.tryAdd(sizeKey, size, quota.getSize().getAsLong())) {
                return Optional.of(quota.getId());
            }
            reserved.add(new QuotaKey(sizeKey, id, QuotaKey.Kind.SIZE));
        }
        if (quota.getMessages().isPresent()) {
            String countKey = "quota:count:" + key;
            if (!store.tryAdd(countKey, 1L, quota.getMessages().getAsLong())) {
                return Optional.of(quota.getId());
            }
            reserved.add(new QuotaKey(countKey, id, QuotaKey.Kind.COUNT));
        }
        return Optional.empty();
    }

    private ThrottleResult finish(String direction, Message message, Optional<ThrottleResult> denied,
                                  List<ConcurrencyLimiter.InFlight> taken) {
        if (denied.isPresent()) {
            taken.forEach(ConcurrencyLimiter.InFlight::close);
            ThrottleResult result = denied.get();
            QueueMetrics.incrementThrottled(direction, result.getReason().map(Enum::name).orElse("").toLowerCase());
            log.debug("Throttled {}: uid={} {}", direction, message.getQueueId(), result);
            return result;
        }
        return ThrottleResult.admit(taken);
    }
}
