package com.mimecast.outpost.queue.limit;

import com.mimecast.outpost.config.BasicConfig;
import com.mimecast.outpost.config.ConfigFoundation;
import com.mimecast.outpost.config.queue.QueueConfigLoader;
import com.mimecast.outpost.config.queue.StrategyCatalog;
import com.mimecast.outpost.expr.DefaultPolicyResolver;
import com.mimecast.outpost.queue.HostResponse;
import com.mimecast.outpost.queue.Message;
import com.mimecast.outpost.queue.QueueEnvelope;
import com.mimecast.outpost.queue.Recipient;
import com.mimecast.outpost.queue.RecipientFlags;
import com.mimecast.outpost.queue.SmtpResponse;
import com.mimecast.outpost.queue.Status;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ThrottleGuardTest {

    private static final long NOW = 1_000_000L;

    private static ThrottleGuard guard(String json) {
        BasicConfig config = new BasicConfig(ConfigFoundation.parse(json));
        StrategyCatalog catalog = QueueConfigLoader.load(config);
        assertTrue(catalog.getErrors().isEmpty(), catalog.getErrors().toString());
        return new ThrottleGuard(catalog, new DefaultPolicyResolver(config), new InMemoryCounterStore());
    }

    private static Message message(long id, String sender, long size, String... rcpts) {
        Message message = new Message(id, sender, NOW).setSize(size);
        for (String rcpt : rcpts) {
            message.addRecipient(new Recipient(rcpt, RecipientFlags.DEFAULT_NOTIFY, NOW));
        }
        return message;
    }

    @Test
    void testSizeQuota() {
        ThrottleGuard guard = guard("{queue: {quota: {size: {key: ['sender'], size: 1000}}}}");

        Message large = message(1, "sender@example.com", 1200, "rcpt@example.net");
        ThrottleResult rejected = guard.reserveQuota(large, NOW);
        assertTrue(rejected.isRejected());
        assertEquals(ThrottleResult.Reason.QUOTA, rejected.getReason().orElseThrow());
        assertEquals("size", rejected.getLimiterId().orElseThrow());
        assertTrue(large.getQuotaKeys().isEmpty());

        Message small = message(2, "sender@example.com", 800, "rcpt@example.net");
        assertTrue(guard.reserveQuota(small, NOW).isAdmitted());
        assertEquals(1, small.getQuotaKeys().size());

        Message more = message(3, "sender@example.com", 300, "rcpt@example.net");
        assertTrue(guard.reserveQuota(more, NOW).isRejected());

        // Other senders have their own counter.
        assertTrue(guard.reserveQuota(message(4, "other@example.com", 300, "rcpt@example.net"), NOW).isAdmitted());

        guard.releaseAll(small);
        assertTrue(small.getQuotaKeys().isEmpty());
        assertTrue(guard.reserveQuota(more, NOW).isAdmitted());
    }

    @Test
    void testQuotaRollback() {
        ThrottleGuard guard = guard("{queue: {quota: {" +
                "sender: {key: ['sender'], size: 1000}," +
                "domain: {key: ['rcpt_domain'], messages: 1}" +
                "}}}");

        assertTrue(guard.reserveQuota(message(1, "s@example.com", 500, "a@x.com"), NOW).isAdmitted());

        Message rejected = message(2, "s@example.com", 500, "b@x.com");
        ThrottleResult result = guard.reserveQuota(rejected, NOW);
        assertTrue(result.isRejected());
        assertEquals("domain", result.getLimiterId().orElseThrow());
        assertTrue(rejected.getQuotaKeys().isEmpty());

        // Sender reservation of the rejected message was returned.
        assertTrue(guard.reserveQuota(message(3, "s@example.com", 500, "c@y.com"), NOW).isAdmitted());
    }

    @Test
    void testDomainQuotaCountedOncePerDomain() {
        ThrottleGuard guard = guard("{queue: {quota: {domain: {key: ['rcpt_domain'], messages: 2}}}}");

        Message first = message(1, "s@example.com", 10, "a@x.com", "b@X.com", "c@y.com");
        assertTrue(guard.reserveQuota(first, NOW).isAdmitted());
        assertEquals(2, first.getQuotaKeys().size());

        assertTrue(guard.reserveQuota(message(2, "s@example.com", 10, "d@x.com"), NOW).isAdmitted());
        assertTrue(guard.reserveQuota(message(3, "s@example.com", 10, "e@x.com"), NOW).isRejected());
        assertTrue(guard.reserveQuota(message(4, "s@example.com", 10, "f@y.com"), NOW).isAdmitted());
    }

    @Test
    void testReleaseQuotaOfFinalRecipients() {
        ThrottleGuard guard = guard("{queue: {quota: {rcpt: {key: ['rcpt'], messages: 1}}}}");

        Message message = message(1, "s@example.com", 10, "a@x.com", "b@x.com");
        assertTrue(guard.reserveQuota(message, NOW).isAdmitted());
        assertEquals(2, message.getQuotaKeys().size());

        message.getRecipients().get(0).setStatus(Status.completed(
                new HostResponse("mx.x.com", new SmtpResponse(250, new int[]{2, 0, 0}, "OK"))));
        guard.releaseQuota(message);
        assertEquals(1, message.getQuotaKeys().size());

        assertTrue(guard.reserveQuota(message(2, "s@example.com", 10, "a@x.com"), NOW).isAdmitted());
        assertTrue(guard.reserveQuota(message(3, "s@example.com", 10, "b@x.com"), NOW).isRejected());
    }

    @Test
    void testInboundRate() {
        ThrottleGuard guard = guard("{queue: {limiter: {inbound: {sender: {key: ['sender'], rate: '2/1m'}}}}}");

        Message message = message(1, "s@example.com", 10, "a@x.com");
        assertTrue(guard.checkInbound(message, NOW).isAdmitted());
        assertTrue(guard.checkInbound(message, NOW + 1).isAdmitted());

        ThrottleResult deferred = guard.checkInbound(message, NOW + 2);
        assertTrue(deferred.isDeferred());
        assertEquals(ThrottleResult.Reason.RATE, deferred.getReason().orElseThrow());
        assertEquals(NOW + 60, deferred.getRetryAt());

        assertTrue(guard.checkInbound(message(2, "other@example.com", 10, "a@x.com"), NOW + 2).isAdmitted());
        assertTrue(guard.checkInbound(message, NOW + 60).isAdmitted());
    }

    @Test
    void testInboundConcurrency() {
        ThrottleGuard guard = guard("{queue: {limiter: {inbound: {ip: {key: ['remote_ip'], concurrency: 1}}}}}");

        Message message = message(1, "s@example.com", 10, "a@x.com").setReceivedFromIp("192.0.2.1");
        ThrottleResult first = guard.checkInbound(message, NOW);
        assertTrue(first.isAdmitted());
        assertEquals(1, guard.getInFlightCount());

        ThrottleResult second = guard.checkInbound(message, NOW);
        assertTrue(second.isDeferred());
        assertEquals(ThrottleResult.Reason.CONCURRENCY, second.getReason().orElseThrow());
        assertEquals("ip", second.getLimiterId().orElseThrow());

        Message otherIp = message(2, "s@example.com", 10, "a@x.com").setReceivedFromIp("192.0.2.2");
        ThrottleResult other = guard.checkInbound(otherIp, NOW);
        assertTrue(other.isAdmitted());
        assertEquals(2, guard.getConcurrencyKeyCount());
        other.release();
        assertEquals(1, guard.getConcurrencyKeyCount());

        first.release();
        first.release();
        assertEquals(0, guard.getInFlightCount());
        assertEquals(0, guard.getConcurrencyKeyCount());
        assertTrue(guard.checkInbound(message, NOW).isAdmitted());
    }

    @Test
    void testIdleConcurrencyKeysDropped() {
        ThrottleGuard guard = guard("{queue: {limiter: {inbound: {ip: {key: ['remote_ip'], concurrency: 2}}}}}");

        for (int i = 1; i <= 50; i++) {
            Message message = message(i, "s@example.com", 10, "a@x.com").setReceivedFromIp("192.0.2." + i);
            ThrottleResult result = guard.checkInbound(message, NOW);
            assertTrue(result.isAdmitted());
            result.release();
        }
        assertEquals(0, guard.getConcurrencyKeyCount());

        Message message = message(100, "s@example.com", 10, "a@x.com").setReceivedFromIp("192.0.2.100");
        ThrottleResult first = guard.checkInbound(message, NOW);
        ThrottleResult second = guard.checkInbound(message, NOW);
        assertTrue(guard.checkInbound(message, NOW).isDeferred());
        first.release();

        // The limiter is kept while a slot is still held.
        assertEquals(1, guard.getConcurrencyKeyCount());
        assertTrue(guard.checkInbound(message, NOW).isAdmitted());
        second.release();
    }

    @Test
    void testDeniedReleasesTakenSlots() {
        ThrottleGuard guard = guard("{queue: {limiter: {inbound: {" +
                "sender: {key: ['sender'], concurrency: 5}," +
                "rcpt: {key: ['rcpt'], rate: '1/1h'}" +
                "}}}}");

        Message message = message(1, "s@example.com", 10, "a@x.com");
        guard.checkInbound(message, NOW).release();

        ThrottleResult denied = guard.checkInbound(message, NOW);
        assertTrue(denied.isDeferred());
        assertEquals("rcpt", denied.getLimiterId().orElseThrow());
        assertEquals(0, guard.getInFlightCount());
    }

    @Test
    void testOutboundMatch() {
        ThrottleGuard guard = guard("{queue: {limiter: {outbound: {" +
                "mx: {match: \"rcpt_domain == 'x.com'\", key: ['mx'], concurrency: 1}" +
                "}}}}");

        Message message = message(1, "s@example.com", 10, "a@x.com", "b@y.com");
        Recipient x = message.getRecipients().get(0);
        Recipient y = message.getRecipients().get(1);

        ThrottleResult held = guard.checkOutbound(QueueEnvelope.of(message, x, "mx.example.net", "198.51.100.1", "", NOW), NOW);
        assertTrue(held.isAdmitted());
        assertTrue(guard.checkOutbound(QueueEnvelope.of(message, x, "mx.example.net", "198.51.100.1", "", NOW), NOW).isDeferred());

        // Limiter does not apply to y.com.
        assertTrue(guard.checkOutbound(QueueEnvelope.of(message, y, "mx.example.net", "198.51.100.1", "", NOW), NOW).isAdmitted());

        held.release();
        assertTrue(guard.checkOutbound(QueueEnvelope.of(message, x, "mx.example.net", "198.51.100.1", "", NOW), NOW).isAdmitted());
    }

    @Test
    void testKeyIncludesLimits() {
        QueueEnvelope envelope = QueueEnvelope.of(message(1, "s@example.com", 10, "a@x.com"), NOW);

        String a = ThrottleGuard.key("id", ThrottleKeys.SENDER, envelope, "1/60s;");
        String b = ThrottleGuard.key("id", ThrottleKeys.SENDER, envelope, "2/60s;");
        assertNotEquals(a, b);
        assertEquals(a, ThrottleGuard.key("id", ThrottleKeys.SENDER, envelope, "1/60s;"));
        assertEquals(64, a.length());
    }
}
