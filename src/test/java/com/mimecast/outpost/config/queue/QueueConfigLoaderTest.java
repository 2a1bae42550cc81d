package com.mimecast.outpost.config.queue;

import com.mimecast.outpost.config.BasicConfig;
import com.mimecast.outpost.config.ConfigError;
import com.mimecast.outpost.config.ConfigFoundation;
import com.mimecast.outpost.queue.QueueName;
import com.mimecast.outpost.queue.limit.QueueQuota;
import com.mimecast.outpost.queue.limit.QueueRateLimiter;
import com.mimecast.outpost.queue.strategy.ConnectionStrategy;
import com.mimecast.outpost.queue.strategy.Credentials;
import com.mimecast.outpost.queue.strategy.QueueExpiry;
import com.mimecast.outpost.queue.strategy.QueueStrategy;
import com.mimecast.outpost.queue.strategy.RequireOptional;
import com.mimecast.outpost.queue.strategy.RoutingStrategy;
import com.mimecast.outpost.queue.strategy.ServerProtocol;
import com.mimecast.outpost.queue.strategy.TlsStrategy;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class QueueConfigLoaderTest {

    private static StrategyCatalog catalog;

    @BeforeAll
    static void before() throws IOException {
        catalog = QueueConfigLoader.load(new BasicConfig(ConfigFoundation.readFile(Paths.get("src/test/resources/cfg/queue.json5"))));
    }

    private static StrategyCatalog load(String json) {
        return QueueConfigLoader.load(new BasicConfig(ConfigFoundation.parse(json)));
    }

    private static List<String> errorKeys(StrategyCatalog catalog) {
        return catalog.getErrors().stream().map(ConfigError::getKey).collect(Collectors.toList());
    }

    @Test
    void testFixtureLoadsWithoutErrors() {
        assertTrue(catalog.getErrors().isEmpty(), catalog.getErrors().toString());
    }

    @Test
    void testVirtualQueues() {
        assertEquals(2, catalog.getVirtualQueue(QueueName.of("bulk").orElseThrow()).getThreads());
        assertEquals(4, catalog.getVirtualQueue(QueueName.of("priority").orElseThrow()).getThreads());
        assertEquals(25, catalog.getVirtualQueue(QueueName.DEFAULT).getThreads());
    }

    @Test
    void testSchedules() {
        QueueStrategy remote = catalog.getQueueStrategyOrDefault("remote");
        assertEquals(List.of(120L, 300L, 600L, 1800L, 3600L), remote.getRetry());
        assertEquals(List.of(86400L, 259200L), remote.getNotify());
        assertEquals(QueueExpiry.ttl(432000L), remote.getExpiry());
        assertEquals("bulk", remote.getVirtualQueue().asString());

        QueueStrategy fast = catalog.getQueueStrategyOrDefault("fast");
        assertEquals(List.of(60L, 120L), fast.getRetry());
        assertEquals(QueueExpiry.attempts(3), fast.getExpiry());
        assertEquals(List.of(QueueStrategy.DEFAULT_NOTIFY), fast.getNotify());

        assertSame(QueueStrategy.DEFAULT, catalog.getQueueStrategyOrDefault("unknown"));
    }

    @Test
    void testRoutes() {
        RoutingStrategy.Relay relay = (RoutingStrategy.Relay) catalog.getRoutingStrategyOrDefault("smarthost");
        assertEquals("relay.example.net", relay.getAddress());
        assertEquals(587, relay.getPort());
        assertEquals(ServerProtocol.SMTP, relay.getProtocol());
        assertFalse(relay.isTlsImplicit());
        assertEquals(new Credentials("outpost", "s3cret"), relay.getAuth().orElseThrow());

        RoutingStrategy.Mx mx = (RoutingStrategy.Mx) catalog.getRoutingStrategyOrDefault("mx");
        assertEquals(3, mx.getMaxMx());
        assertEquals(1, mx.getMaxMultihomed());

        assertSame(RoutingStrategy.LOCAL, catalog.getRoutingStrategyOrDefault("local"));
    }

    @Test
    void testConnectionAndTls() {
        ConnectionStrategy connection = catalog.getConnectionStrategyOrDefault("outbound");
        assertEquals(1, connection.getSourceIpv4().size());
        assertEquals(1, connection.getSourceIpv6().size());
        assertEquals("out1.example.org", connection.getSourceIpv4().get(0).getHost().orElseThrow());
        assertEquals("mx.example.org", connection.getEhloHostname().orElseThrow());
        assertEquals(Duration.ofMinutes(2), connection.getTimeoutConnect());
        assertEquals(Duration.ofMinutes(10), connection.getTimeoutData());

        TlsStrategy strict = catalog.getTlsStrategyOrDefault("strict");
        assertTrue(strict.isDaneRequired());
        assertTrue(strict.isTlsRequired());
        assertEquals(Duration.ofSeconds(30), strict.getTimeoutTls());
        assertSame(TlsStrategy.DEFAULT, catalog.getTlsStrategyOrDefault("default"));
    }

    @Test
    void testLimiterClassification() {
        assertEquals(List.of("per-sender"), ids(catalog.getInboundLimiters().getSender()));
        assertEquals(List.of("per-ip"), ids(catalog.getInboundLimiters().getRemote()));
        assertTrue(catalog.getInboundLimiters().getRcpt().isEmpty());

        assertEquals(List.of("per-domain"), ids(catalog.getOutboundLimiters().getRcpt()));
        assertEquals(List.of("per-mx"), ids(catalog.getOutboundLimiters().getRemote()));
        assertTrue(catalog.getOutboundLimiters().getSender().isEmpty());
    }

    @Test
    void testQuotaClassification() {
        assertEquals(List.of("sender-size"), catalog.getQuotas().getSender().stream().map(QueueQuota::getId).collect(Collectors.toList()));
        assertEquals(List.of("domain-count"), catalog.getQuotas().getRcptDomain().stream().map(QueueQuota::getId).collect(Collectors.toList()));
        assertTrue(catalog.getQuotas().getRcpt().isEmpty());
    }

    @Test
    void testDefaults() {
        StrategyCatalog defaults = load("{}");
        assertTrue(defaults.getErrors().isEmpty());
        assertSame(StrategyCatalog.DEFAULT_ROUTE, defaults.getRoute());
        assertSame(StrategyCatalog.DEFAULT_SCHEDULE, defaults.getSchedule());
        assertSame(DsnConfig.DEFAULT.getFromAddress(), defaults.getDsn().getFromAddress());
        assertSame(DsnConfig.DEFAULT.getSubmitter(), defaults.getDsn().getSubmitter());
        assertTrue(defaults.getInboundLimiters().isEmpty());
        assertSame(QueueStrategy.DEFAULT, defaults.getQueueStrategyOrDefault("remote"));
    }

    @Test
    void testEmptyRetryAndNotifyAreDefaulted() {
        StrategyCatalog loaded = load("{queue: {schedule: {empty: {retry: [], notify: []}}}}");
        QueueStrategy empty = loaded.getQueueStrategyOrDefault("empty");
        assertEquals(List.of(QueueStrategy.DEFAULT_RETRY), empty.getRetry());
        assertEquals(List.of(QueueStrategy.DEFAULT_NOTIFY), empty.getNotify());
        assertTrue(errorKeys(loaded).contains("queue.schedule.empty.retry"));
    }

    @Test
    void testScheduleErrors() {
        StrategyCatalog loaded = load("{queue: {schedule: {" +
                "both: {retry: ['1m'], expire: '1d', 'max-attempts': 3}," +
                "long: {retry: ['1m'], 'queue-name': 'waytoolongname'}," +
                "missing: {retry: ['1m'], 'queue-name': 'nothere'}," +
                "bad: {retry: ['1m', 'soon']}" +
                "}}}");

        List<String> keys = errorKeys(loaded);
        assertTrue(keys.contains("queue.schedule.both.expire"));
        assertTrue(keys.contains("queue.schedule.long.queue-name"));
        assertTrue(keys.contains("queue.schedule.missing.queue-name"));
        assertTrue(keys.contains("queue.schedule.bad.retry"));

        assertSame(QueueStrategy.DEFAULT, loaded.getQueueStrategyOrDefault("both"));
        assertEquals(List.of(60L), loaded.getQueueStrategyOrDefault("bad").getRetry());
        assertTrue(loaded.getErrors().stream().allMatch(e -> e.getKind() == ConfigError.Kind.PARSE));
    }

    @Test
    void testRouteErrors() {
        StrategyCatalog loaded = load("{queue: {route: {" +
                "a: {type: 'carrier-pigeon'}," +
                "b: {type: 'relay'}," +
                "c: {type: 'relay', address: 'x', port: 70000}," +
                "d: {}" +
                "}}}");

        List<String> keys = errorKeys(loaded);
        assertEquals(List.of("queue.route.a.type", "queue.route.b.address", "queue.route.c.port", "queue.route.d.type"), keys);
        assertTrue(loaded.getRoutingStrategies().isEmpty());
    }

    @Test
    void testRelayCredentials() {
        StrategyCatalog loaded = load("{queue: {route: {" +
                "both: {type: 'relay', address: 'relay.example.com', auth: {username: 'u', secret: 's'}}," +
                "user: {type: 'relay', address: 'relay.example.com', auth: {username: 'u'}}," +
                "secret: {type: 'relay', address: 'relay.example.com', auth: {secret: 's'}}" +
                "}}}");

        RoutingStrategy.Relay both = (RoutingStrategy.Relay) loaded.getRoutingStrategyOrDefault("both");
        assertTrue(both.isTlsImplicit());
        assertEquals(25, both.getPort());
        assertEquals("u", both.getAuth().orElseThrow().getUsername());
        assertEquals("s", both.getAuth().orElseThrow().getSecret());

        assertTrue(((RoutingStrategy.Relay) loaded.getRoutingStrategyOrDefault("user")).getAuth().isEmpty());
        assertTrue(((RoutingStrategy.Relay) loaded.getRoutingStrategyOrDefault("secret")).getAuth().isEmpty());
    }

    @Test
    void testDaneAloneRequiresTls() {
        StrategyCatalog loaded = load("{queue: {tls: {dane: {dane: 'require', 'mta-sts': 'optional', starttls: 'optional'}}}}");
        TlsStrategy tls = loaded.getTlsStrategyOrDefault("dane");
        assertEquals(RequireOptional.REQUIRE, tls.getDane());
        assertEquals(RequireOptional.OPTIONAL, tls.getMtaSts());
        assertEquals(RequireOptional.OPTIONAL, tls.getStartTls());
        assertTrue(tls.isTlsRequired());

        assertFalse(TlsStrategy.DEFAULT.isTlsRequired());
    }

    @Test
    void testLimiterErrors() {
        StrategyCatalog loaded = load("{queue: {limiter: {outbound: {" +
                "norate: {key: ['mx']}," +
                "badrate: {key: ['mx'], rate: 'fast'}," +
                "badkey: {key: ['colour'], rate: '1/1s'}," +
                "wrongctx: {key: ['rcpt'], rate: '1/1s'}," +
                "disabled: {enable: false}," +
                "badexpr: {match: 'listener ==', rate: '1/1s'}" +
                "}}}}");

        List<String> keys = errorKeys(loaded);
        assertTrue(keys.contains("queue.limiter.outbound.norate"));
        assertTrue(keys.contains("queue.limiter.outbound.badrate.rate"));
        assertTrue(keys.contains("queue.limiter.outbound.badkey.key"));
        assertTrue(keys.contains("queue.limiter.outbound.wrongctx.key"));
        assertTrue(keys.contains("queue.limiter.outbound.badexpr.match"));
        assertFalse(keys.stream().anyMatch(k -> k.contains("disabled")));

        assertTrue(loaded.getErrors().stream()
                .anyMatch(e -> e.getKind() == ConfigError.Kind.BUILD && e.getKey().equals("queue.limiter.outbound.wrongctx.key")));

        // Entries with key errors are kept without the offending key.
        List<String> kept = ids(loaded.getOutboundLimiters().getSender());
        assertTrue(kept.contains("badkey"));
        assertTrue(kept.contains("wrongctx"));
        assertEquals(2, kept.size());
    }

    @Test
    void testInboundRcptLimiter() {
        StrategyCatalog loaded = load("{queue: {limiter: {inbound: {" +
                "rcpt: {key: ['rcpt_domain'], rate: '10/1m'}," +
                "matched: {match: \"rcpt == 'a@b.com'\", concurrency: 1}" +
                "}}}}");
        assertEquals(List.of("rcpt", "matched"), ids(loaded.getInboundLimiters().getRcpt()));
    }

    @Test
    void testQuotaErrors() {
        StrategyCatalog loaded = load("{queue: {quota: {" +
                "empty: {key: ['sender']}," +
                "zero: {key: ['sender'], size: 0, messages: 0}," +
                "ok: {key: ['rcpt'], messages: 10}" +
                "}}}");

        List<String> keys = errorKeys(loaded);
        assertEquals(List.of("queue.quota.empty", "queue.quota.zero"), keys);
        assertEquals(1, loaded.getQuotas().getRcpt().size());
    }

    @Test
    void testBadIfBlockKeepsDefault() {
        StrategyCatalog loaded = load("{queue: {strategy: {route: \"rcpt_domain ==\"}}}");
        assertEquals(List.of(StrategyCatalog.ROUTE_KEY), errorKeys(loaded));
        assertSame(StrategyCatalog.DEFAULT_ROUTE, loaded.getRoute());
    }

    @Test
    void testInvalidVirtualQueue() {
        StrategyCatalog loaded = load("{queue: {virtual: {verylongname: {}, zero: {'threads-per-node': 0}}}}");
        assertEquals(List.of("queue.virtual.verylongname", "queue.virtual.zero.threads-per-node"), errorKeys(loaded));
        assertEquals(1, loaded.getVirtualQueue(QueueName.of("zero").orElseThrow()).getThreads());
    }

    @Test
    void testVirtualQueueThreadsClamped() {
        StrategyCatalog loaded = load("{queue: {virtual: {huge: {'threads-per-node': 10000000000}}}}");
        assertEquals(List.of("queue.virtual.huge.threads-per-node"), errorKeys(loaded));
        assertEquals(QueueConfigLoader.MAX_THREADS_PER_NODE,
                loaded.getVirtualQueue(QueueName.of("huge").orElseThrow()).getThreads());
    }

    private static List<String> ids(List<QueueRateLimiter> limiters) {
        return limiters.stream().map(QueueRateLimiter::getId).collect(Collectors.toList());
    }
}
