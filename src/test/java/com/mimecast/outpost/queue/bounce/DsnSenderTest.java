package com.mimecast.outpost.queue.bounce;

import com.mimecast.outpost.config.BasicConfig;
import com.mimecast.outpost.config.ConfigFoundation;
import com.mimecast.outpost.config.queue.QueueConfigLoader;
import com.mimecast.outpost.expr.DefaultPolicyResolver;
import com.mimecast.outpost.queue.DeliveryError;
import com.mimecast.outpost.queue.ErrorDetails;
import com.mimecast.outpost.queue.HostResponse;
import com.mimecast.outpost.queue.Message;
import com.mimecast.outpost.queue.MessageSource;
import com.mimecast.outpost.queue.MessageSubmitter;
import com.mimecast.outpost.queue.Recipient;
import com.mimecast.outpost.queue.RecipientFlags;
import com.mimecast.outpost.queue.SmtpResponse;
import com.mimecast.outpost.queue.Status;
import com.mimecast.outpost.queue.delivery.StrategyResolver;
import com.mimecast.outpost.queue.strategy.QueueExpiry;
import com.mimecast.outpost.store.InMemoryQueueStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DsnSenderTest {

    private static final long NOW = 1_700_000_000L;

    private final List<Message> submitted = new ArrayList<>();
    private final List<byte[]> contents = new ArrayList<>();
    private DsnSender sender;

    @BeforeEach
    void setUp() {
        BasicConfig config = new BasicConfig(ConfigFoundation.parse("{report: {domain: 'example.org'}}"));
        StrategyResolver strategies = new StrategyResolver(QueueConfigLoader.load(config), new DefaultPolicyResolver(config));

        MessageSubmitter submitter = new MessageSubmitter() {
            private long id = 1000;

            @Override
            public long nextQueueId() {
                return id++;
            }

            @Override
            public void submit(Message message, byte[] content, long now) {
                submitted.add(message);
                contents.add(content);
            }
        };

        sender = new DsnSender(new DsnBuilder(strategies, new InMemoryQueueStore()), submitter, strategies);
    }

    private static Recipient rejected(String address) {
        return new Recipient(address, RecipientFlags.DEFAULT_NOTIFY, NOW).setStatus(Status.permanentFailure(
                new ErrorDetails("mx.example.com", DeliveryError.unexpectedResponse("RCPT TO",
                        new SmtpResponse(550, new int[]{5, 1, 1}, "No such user")))));
    }

    @Test
    void testFailureQueuesDsn() {
        Message message = new Message(1, "sender@example.org", NOW).addRecipient(rejected("bad@example.com"));

        List<DeliveryEvent> events = sender.sendDsn(message, NOW);
        assertEquals(1, events.size());
        assertEquals(DeliveryEvent.Type.DSN_PERM_FAIL, events.get(0).getType());
        assertEquals(List.of("bad@example.com"), events.get(0).getTo());
        assertEquals("mx.example.com", events.get(0).getHostname());

        assertEquals(1, submitted.size());
        Message dsn = submitted.get(0);
        assertEquals(1000, dsn.getQueueId());
        assertEquals("", dsn.getReturnPath());
        assertTrue(dsn.isBounce());
        assertEquals(MessageSource.DSN, dsn.getSource());
        assertEquals(1, dsn.getRecipients().size());
        assertEquals("sender@example.org", dsn.getRecipients().get(0).getAddress());
        assertEquals(0L, dsn.getRecipients().get(0).getFlags());
        assertTrue(new String(contents.get(0), StandardCharsets.UTF_8).contains("Subject: Failed to deliver message"));

        // Reported once only.
        assertTrue(sender.sendDsn(message, NOW + 60).isEmpty());
        assertEquals(1, submitted.size());
    }

    @Test
    void testDoubleBounce() {
        Recipient rcpt = rejected("postmaster@example.com").setExpiry(QueueExpiry.ttl(3600));
        Message bounce = new Message(2, "", NOW).addRecipient(rcpt);

        List<DeliveryEvent> events = sender.sendDsn(bounce, NOW);
        assertEquals(2, events.size());
        assertEquals(DeliveryEvent.Type.DSN_PERM_FAIL, events.get(0).getType());
        DeliveryEvent doubleBounce = events.get(1);
        assertEquals(DeliveryEvent.Type.DOUBLE_BOUNCE, doubleBounce.getType());
        assertEquals(List.of("<postmaster@example.com> (host 'mx.example.com' rejected command 'RCPT TO' with code 550 (5.1.1) 'No such user')"),
                doubleBounce.getTo());

        assertTrue(submitted.isEmpty());
        assertTrue(rcpt.hasFlag(RecipientFlags.DSN_SENT));
        assertEquals(NOW + 3600 + DsnSender.DOUBLE_BOUNCE_GRACE, rcpt.getNotify().getDue());

        assertTrue(sender.sendDsn(bounce, NOW + 10).isEmpty());
        assertTrue(sender.handleDoubleBounce(bounce, NOW + 20).isEmpty());
    }

    @Test
    void testLogDsn() {
        Recipient ok = new Recipient("ok@example.com", RecipientFlags.DEFAULT_NOTIFY, NOW).setStatus(Status.completed(
                new HostResponse("mx.example.com", new SmtpResponse(250, new int[]{2, 0, 0}, "Queued as 1234"))));
        Recipient waiting = new Recipient("wait@example.com", RecipientFlags.DEFAULT_NOTIFY, NOW);
        Recipient later = new Recipient("later@example.com", RecipientFlags.DEFAULT_NOTIFY, NOW).setStatus(Status.temporaryFailure(
                new ErrorDetails("mx.example.com", DeliveryError.connection("Connection refused"))));
        later.getNotify().setDue(NOW + 86400);

        Message message = new Message(3, "sender@example.org", NOW).addRecipient(ok).addRecipient(waiting).addRecipient(later);
        List<DeliveryEvent> events = sender.logDsn(message, NOW);

        assertEquals(2, events.size());
        assertEquals(DeliveryEvent.Type.DSN_SUCCESS, events.get(0).getType());
        assertEquals(250, events.get(0).getCode());
        assertEquals("Queued as 1234", events.get(0).getDetails());
        assertEquals(DeliveryEvent.Type.DSN_TEMP_FAIL, events.get(1).getType());
        assertEquals(List.of("wait@example.com"), events.get(1).getTo());
        assertEquals("Concurrency limited", events.get(1).getDetails());

        assertEquals("dsn-success", events.get(0).toMapMessage().get("event"));
        assertEquals("3", events.get(0).toMapMessage().get("uid"));
        assertNull(events.get(1).toMapMessage().get("hostname"));

        // Logging alone changes nothing.
        assertFalse(ok.hasFlag(RecipientFlags.DSN_SENT));
    }

    @Test
    void testSignedDsn() {
        List<List<String>> calls = new ArrayList<>();
        sender.setSigner((signers, bytes) -> {
            calls.add(signers);
            return List.of("DKIM-Signature: v=1; s=" + String.join(",", signers));
        });

        Message message = new Message(4, "sender@example.org", NOW).addRecipient(rejected("bad@example.com"));
        sender.sendDsn(message, NOW);

        assertEquals(List.of(List.of("rsa-example.org", "ed25519-example.org")), calls);
        assertTrue(new String(contents.get(0), StandardCharsets.UTF_8)
                .startsWith("DKIM-Signature: v=1; s=rsa-example.org,ed25519-example.org\r\nFrom: "));
    }

    @Test
    void testUnsignedByDefault() {
        Message message = new Message(5, "sender@example.org", NOW).addRecipient(rejected("bad@example.com"));
        sender.sendDsn(message, NOW);
        assertTrue(new String(contents.get(0), StandardCharsets.UTF_8).startsWith("From: "));
    }
}
