package com.mimecast.outpost.config.queue;

import com.google.common.net.InetAddresses;
import com.mimecast.outpost.config.BasicConfig;
import com.mimecast.outpost.config.ConfigError;
import com.mimecast.outpost.config.Durations;
import com.mimecast.outpost.expr.Expression;
import com.mimecast.outpost.expr.ExpressionException;
import com.mimecast.outpost.expr.IfBlock;
import com.mimecast.outpost.expr.Variable;
import com.mimecast.outpost.expr.VariableContext;
import com.mimecast.outpost.queue.QueueName;
import com.mimecast.outpost.queue.limit.QueueQuota;
import com.mimecast.outpost.queue.limit.QueueQuotas;
import com.mimecast.outpost.queue.limit.QueueRateLimiter;
import com.mimecast.outpost.queue.limit.QueueRateLimiters;
import com.mimecast.outpost.queue.limit.Rate;
import com.mimecast.outpost.queue.limit.ThrottleKeys;
import com.mimecast.outpost.queue.strategy.ConnectionStrategy;
import com.mimecast.outpost.queue.strategy.Credentials;
import com.mimecast.outpost.queue.strategy.IpAndHost;
import com.mimecast.outpost.queue.strategy.IpLookupStrategy;
import com.mimecast.outpost.queue.strategy.QueueExpiry;
import com.mimecast.outpost.queue.strategy.QueueStrategy;
import com.mimecast.outpost.queue.strategy.RequireOptional;
import com.mimecast.outpost.queue.strategy.RoutingStrategy;
import com.mimecast.outpost.queue.strategy.ServerProtocol;
import com.mimecast.outpost.queue.strategy.TlsStrategy;
import com.mimecast.outpost.queue.strategy.VirtualQueue;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.net.Inet4Address;
import java.net.InetAddress;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Builds the strategy catalog from the {@code queue} and {@code report} configuration sections.
 *
 * <p>Never throws on bad entries: each problem is recorded as a {@link ConfigError}
 * and only the offending entry is dropped or defaulted.
 */
public class QueueConfigLoader {
    private static final Logger log = LogManager.getLogger(QueueConfigLoader.class);

    /**
     * Upper bound of worker threads per virtual queue.
     */
    public static final int MAX_THREADS_PER_NODE = 1024;

    private final BasicConfig root;
    private final StrategyCatalog.Builder catalog = new StrategyCatalog.Builder();
    private final Set<QueueName> virtualNames = new HashSet<>();

    /**
     * Constructs a new QueueConfigLoader instance.
     *
     * @param root Root configuration.
     */
    private QueueConfigLoader(BasicConfig root) {
        this.root = root;
    }

    /**
     * Loads the catalog.
     *
     * @param root Root configuration holding {@code queue} and {@code report}.
     * @return StrategyCatalog with any errors attached.
     */
    public static StrategyCatalog load(BasicConfig root) {
        QueueConfigLoader loader = new QueueConfigLoader(root);
        StrategyCatalog result = loader.load();
        for (ConfigError error : result.getErrors()) {
            log.warn("Queue configuration {}", error);
        }
        log.info("Loaded queue catalog: schedules={} routes={} connections={} tls={} virtual={} errors={}",
                result.getQueueStrategies().size(), result.getRoutingStrategies().size(),
                result.getConnectionStrategies().size(), result.getTlsStrategies().size(),
                result.getVirtualQueues().size(), result.getErrors().size());
        return result;
    }

    private StrategyCatalog load() {
        BasicConfig queue = root.getSection("queue");
        BasicConfig strategy = queue.getSection("strategy");
        BasicConfig report = root.getSection("report");
        BasicConfig dsn = report.getSection("dsn");

        catalog.route = ifBlock(strategy, "route", StrategyCatalog.ROUTE_KEY, VariableContext.RECIPIENT, catalog.route);
        catalog.schedule = ifBlock(strategy, "schedule", StrategyCatalog.SCHEDULE_KEY, VariableContext.RECIPIENT, catalog.schedule);
        catalog.connection = ifBlock(strategy, "connection", StrategyCatalog.CONNECTION_KEY, VariableContext.HOST, catalog.connection);
        catalog.tls = ifBlock(strategy, "tls", StrategyCatalog.TLS_KEY, VariableContext.HOST, catalog.tls);
        catalog.dsn = new DsnConfig(
                ifBlock(dsn, "from-name", DsnConfig.FROM_NAME_KEY, VariableContext.SENDER, DsnConfig.DEFAULT.getFromName()),
                ifBlock(dsn, "from-address", DsnConfig.FROM_ADDRESS_KEY, VariableContext.SENDER, DsnConfig.DEFAULT.getFromAddress()),
                ifBlock(dsn, "sign", DsnConfig.SIGN_KEY, VariableContext.SENDER, DsnConfig.DEFAULT.getSign()),
                ifBlock(report, "submitter", DsnConfig.SUBMITTER_KEY, VariableContext.SENDER, DsnConfig.DEFAULT.getSubmitter()));

        parseVirtualQueues(queue.getSection("virtual"));
        parseQueueStrategies(queue.getSection("schedule"));
        parseRoutes(queue.getSection("route"));
        parseTls(queue.getSection("tls"));
        parseConnections(queue.getSection("connection"), queue.getSection("source-ip"));

        BasicConfig limiter = queue.getSection("limiter");
        catalog.inboundLimiters = classifyInbound(
                parseLimiters(limiter.getSection("inbound"), "queue.limiter.inbound", VariableContext.INBOUND, ThrottleKeys.INBOUND));
        catalog.outboundLimiters = classifyOutbound(
                parseLimiters(limiter.getSection("outbound"), "queue.limiter.outbound", VariableContext.HOST, ThrottleKeys.OUTBOUND));
        catalog.quotas = parseQuotas(queue.getSection("quota"));

        return catalog.build();
    }

    private IfBlock ifBlock(BasicConfig section, String name, String key, VariableContext context, IfBlock fallback) {
        if (!section.hasProperty(name)) {
            return fallback;
        }
        try {
            return IfBlock.parse(key, section.getProperty(name), context);
        } catch (ExpressionException e) {
            parseError(key, e.getMessage());
            return fallback;
        }
    }

    private void parseVirtualQueues(BasicConfig section) {
        for (String id : section.getKeys()) {
            String key = "queue.virtual." + id;
            Optional<QueueName> name = QueueName.of(id);
            if (name.isEmpty()) {
                parseError(key, "Invalid virtual queue name: '" + id + "'. Must be 1-8 bytes long.");
                continue;
            }
            BasicConfig entry = section.getSection(id);
            long threads = entry.getLongProperty("threads-per-node", 1L);
            if (threads < 1) {
                parseError(key + ".threads-per-node", "Must be at least 1.");
                threads = 1;
            } else if (threads > MAX_THREADS_PER_NODE) {
                parseError(key + ".threads-per-node", "Must be at most " + MAX_THREADS_PER_NODE + ".");
                threads = MAX_THREADS_PER_NODE;
            }
            catalog.virtualQueues.put(name.get(), new VirtualQueue(Math.toIntExact(threads)));
            virtualNames.add(name.get());
        }
    }

    private void parseQueueStrategies(BasicConfig section) {
        for (String id : section.getKeys()) {
            String key = "queue.schedule." + id;
            BasicConfig entry = section.getSection(id);

            QueueName virtualQueue = QueueName.DEFAULT;
            String queueName = entry.getStringProperty("queue-name");
            if (queueName != null) {
                Optional<QueueName> parsed = QueueName.of(queueName.trim());
                if (parsed.isEmpty()) {
                    parseError(key + ".queue-name", "Queue name '" + queueName + "' is too long. Maximum length is 8 bytes.");
                    continue;
                }
                virtualQueue = parsed.get();
            }
            if (!virtualQueue.isDefault() && !virtualNames.contains(virtualQueue)) {
                parseError(key + ".queue-name", "Virtual queue '" + virtualQueue + "' does not exist.");
                continue;
            }

            List<Long> retry = durations(entry, "retry", key);
            List<Long> notify = durations(entry, "notify", key);
            if (retry.isEmpty()) {
                parseError(key + ".retry", "At least one 'retry' duration must be specified.");
            }

            boolean hasExpire = entry.hasProperty("expire");
            boolean hasAttempts = entry.hasProperty("max-attempts");
            QueueExpiry expiry;
            if (hasExpire && hasAttempts) {
                parseError(key + ".expire", "Cannot specify both 'expire' and 'max-attempts'.");
                continue;
            } else if (hasExpire) {
                Optional<Duration> expire = duration(entry, "expire", key);
                if (expire.isEmpty()) {
                    continue;
                }
                expiry = QueueExpiry.ttl(expire.get().getSeconds());
            } else if (hasAttempts) {
                Long attempts = entry.getLongProperty("max-attempts", null);
                if (attempts == null || attempts < 1) {
                    parseError(key + ".max-attempts", "Invalid attempt count: " + entry.getProperty("max-attempts"));
                    continue;
                }
                expiry = QueueExpiry.attempts(attempts);
            } else {
                expiry = QueueExpiry.ttl(QueueExpiry.DEFAULT_TTL);
            }

            catalog.queueStrategies.put(id, new QueueStrategy(retry, notify, expiry, virtualQueue));
        }
    }

    private void parseRoutes(BasicConfig section) {
        for (String id : section.getKeys()) {
            String key = "queue.route." + id;
            BasicConfig entry = section.getSection(id);
            String type = StringUtils.trimToEmpty(entry.getStringProperty("type"));

            switch (type) {
                case "local":
                    catalog.routingStrategies.put(id, RoutingStrategy.LOCAL);
                    break;
                case "mx":
                    BasicConfig limits = entry.getSection("limits");
                    String lookup = entry.getStringProperty("ip-lookup");
                    IpLookupStrategy ipLookup = IpLookupStrategy.IPV4_THEN_IPV6;
                    if (lookup != null) {
                        Optional<IpLookupStrategy> parsed = IpLookupStrategy.parse(lookup);
                        if (parsed.isPresent()) {
                            ipLookup = parsed.get();
                        } else {
                            parseError(key + ".ip-lookup", "Invalid IP lookup strategy: '" + lookup + "'.");
                        }
                    }
                    catalog.routingStrategies.put(id, new RoutingStrategy.Mx(
                            limits.getLongProperty("mx", 5L).intValue(),
                            limits.getLongProperty("multihomed", 2L).intValue(),
                            ipLookup));
                    break;
                case "relay":
                    parseRelay(id, key, entry).ifPresent(relay -> catalog.routingStrategies.put(id, relay));
                    break;
                case "":
                    parseError(key + ".type", "Missing route type.");
                    break;
                default:
                    parseError(key + ".type", "Invalid route type: '" + type + "'. Expected 'relay', 'local', or 'mx'.");
                    break;
            }
        }
    }

    private Optional<RoutingStrategy> parseRelay(String id, String key, BasicConfig entry) {
        String address = entry.getStringProperty("address");
        if (StringUtils.isBlank(address)) {
            parseError(key + ".address", "Missing relay address.");
            return Optional.empty();
        }

        long port = entry.getLongProperty("port", 25L);
        if (port < 1 || port > 65535) {
            parseError(key + ".port", "Invalid port: " + entry.getProperty("port"));
            return Optional.empty();
        }

        ServerProtocol protocol = ServerProtocol.SMTP;
        String protocolValue = entry.getStringProperty("protocol");
        if (protocolValue != null) {
            Optional<ServerProtocol> parsed = ServerProtocol.parse(protocolValue);
            if (parsed.isEmpty()) {
                parseError(key + ".protocol", "Invalid protocol: '" + protocolValue + "'.");
                return Optional.empty();
            }
            protocol = parsed.get();
        }

        BasicConfig auth = entry.getSection("auth");
        String username = auth.getStringProperty("username");
        String secret = auth.getStringProperty("secret");
        Credentials credentials = username != null && secret != null ? new Credentials(username, secret) : null;

        BasicConfig tls = entry.getSection("tls");
        log.debug("Relay route {} -> {}:{}", id, address, port);
        return Optional.of(new RoutingStrategy.Relay(address.trim(), (int) port, protocol, credentials,
                tls.getBooleanProperty("implicit", true),
                tls.getBooleanProperty("allow-invalid-certs", false)));
    }

    private void parseTls(BasicConfig section) {
        for (String id : section.getKeys()) {
            String key = "queue.tls." + id;
            BasicConfig entry = section.getSection(id);
            BasicConfig timeout = entry.getSection("timeout");

            catalog.tlsStrategies.put(id, new TlsStrategy(
                    requireOptional(entry, "dane", key),
                    requireOptional(entry, "mta-sts", key),
                    requireOptional(entry, "starttls", key),
                    entry.getBooleanProperty("allow-invalid-certs", false),
                    duration(timeout, "tls", key + ".timeout").orElse(TlsStrategy.DEFAULT.getTimeoutTls()),
                    duration(timeout, "mta-sts", key + ".timeout").orElse(TlsStrategy.DEFAULT.getTimeoutMtaSts())));
        }
    }

    private RequireOptional requireOptional(BasicConfig entry, String name, String key) {
        String value = entry.getStringProperty(name);
        if (value == null) {
            return RequireOptional.OPTIONAL;
        }
        Optional<RequireOptional> parsed = RequireOptional.parse(value);
        if (parsed.isEmpty()) {
            parseError(key + "." + name, "Invalid TLS option value '" + value + "'.");
            return RequireOptional.OPTIONAL;
        }
        return parsed.get();
    }

    private void parseConnections(BasicConfig section, BasicConfig sourceIps) {
        ConnectionStrategy defaults = ConnectionStrategy.DEFAULT;
        for (String id : section.getKeys()) {
            String key = "queue.connection." + id;
            BasicConfig entry = section.getSection(id);
            BasicConfig timeout = entry.getSection("timeout");

            List<IpAndHost> ipv4 = new ArrayList<>();
            List<IpAndHost> ipv6 = new ArrayList<>();
            for (Object value : entry.getListProperty("source-ips")) {
                String ip = String.valueOf(value).trim();
                InetAddress address;
                try {
                    address = InetAddresses.forString(ip);
                } catch (IllegalArgumentException e) {
                    parseError(key + ".source-ips", "Invalid IP address: '" + ip + "'.");
                    continue;
                }
                String host = sourceIps.getSection(ip).getStringProperty("ehlo-hostname");
                if (address instanceof Inet4Address) {
                    ipv4.add(new IpAndHost(address, host));
                } else {
                    ipv6.add(new IpAndHost(address, host));
                }
            }

            String timeoutKey = key + ".timeout";
            catalog.connectionStrategies.put(id, new ConnectionStrategy(ipv4, ipv6,
                    entry.getStringProperty("ehlo-hostname"),
                    duration(timeout, "connect", timeoutKey).orElse(defaults.getTimeoutConnect()),
                    duration(timeout, "greeting", timeoutKey).orElse(defaults.getTimeoutGreeting()),
                    duration(timeout, "ehlo", timeoutKey).orElse(defaults.getTimeoutEhlo()),
                    duration(timeout, "mail-from", timeoutKey).orElse(defaults.getTimeoutMail()),
                    duration(timeout, "rcpt-to", timeoutKey).orElse(defaults.getTimeoutRcpt()),
                    duration(timeout, "data", timeoutKey).orElse(defaults.getTimeoutData())));
        }
    }

    private List<QueueRateLimiter> parseLimiters(BasicConfig section, String prefix, VariableContext context, int allowed) {
        List<QueueRateLimiter> limiters = new ArrayList<>();
        for (String id : section.getKeys()) {
            String key = prefix + "." + id;
            BasicConfig entry = section.getSection(id);
            if (!entry.getBooleanProperty("enable", true)) {
                continue;
            }

            int keys = parseKeys(entry, key, allowed);

            Expression match = Expression.EMPTY;
            if (entry.hasProperty("match")) {
                Optional<Expression> parsed = expression(entry, "match", key, context);
                if (parsed.isEmpty()) {
                    continue;
                }
                match = parsed.get();
            }

            Rate rate = null;
            if (entry.hasProperty("rate")) {
                String value = entry.getStringProperty("rate");
                Optional<Rate> parsed = Rate.parse(value);
                if (parsed.isEmpty()) {
                    parseError(key + ".rate", "Invalid rate '" + value + "'. Expected '<count>/<duration>'.");
                    continue;
                }
                rate = parsed.get();
            }

            Integer concurrency = null;
            if (entry.hasProperty("concurrency")) {
                Long value = entry.getLongProperty("concurrency", null);
                if (value == null || value < 1) {
                    parseError(key + ".concurrency", "Invalid concurrency: " + entry.getProperty("concurrency"));
                    continue;
                }
                concurrency = value.intValue();
            }

            if (rate == null && concurrency == null) {
                parseError(key, "Rate limiter needs a 'rate' and/or 'concurrency' property.");
                continue;
            }

            limiters.add(new QueueRateLimiter(id, match, keys, rate, concurrency));
        }
        return limiters;
    }

    private QueueRateLimiters classifyInbound(List<QueueRateLimiter> limiters) {
        List<QueueRateLimiter> sender = new ArrayList<>();
        List<QueueRateLimiter> rcpt = new ArrayList<>();
        List<QueueRateLimiter> remote = new ArrayList<>();
        for (QueueRateLimiter limiter : limiters) {
            if (limiter.hasKey(ThrottleKeys.RCPT | ThrottleKeys.RCPT_DOMAIN)
                    || limiter.getMatch().references(Variable.RCPT, Variable.RCPT_DOMAIN)) {
                rcpt.add(limiter);
            } else if (limiter.hasKey(ThrottleKeys.SENDER | ThrottleKeys.SENDER_DOMAIN
                    | ThrottleKeys.HELO_DOMAIN | ThrottleKeys.AUTHENTICATED_AS)
                    || limiter.getMatch().references(Variable.SENDER, Variable.SENDER_DOMAIN,
                    Variable.HELO_DOMAIN, Variable.AUTHENTICATED_AS)) {
                sender.add(limiter);
            } else {
                remote.add(limiter);
            }
        }
        return new QueueRateLimiters(sender, rcpt, remote);
    }

    private QueueRateLimiters classifyOutbound(List<QueueRateLimiter> limiters) {
        List<QueueRateLimiter> sender = new ArrayList<>();
        List<QueueRateLimiter> rcpt = new ArrayList<>();
        List<QueueRateLimiter> remote = new ArrayList<>();
        for (QueueRateLimiter limiter : limiters) {
            if (limiter.hasKey(ThrottleKeys.MX | ThrottleKeys.REMOTE_IP | ThrottleKeys.LOCAL_IP)
                    || limiter.getMatch().references(Variable.MX, Variable.REMOTE_IP, Variable.LOCAL_IP)) {
                remote.add(limiter);
            } else if (limiter.hasKey(ThrottleKeys.RCPT_DOMAIN)
                    || limiter.getMatch().references(Variable.RCPT_DOMAIN)) {
                rcpt.add(limiter);
            } else {
                sender.add(limiter);
            }
        }
        return new QueueRateLimiters(sender, rcpt, remote);
    }

    private QueueQuotas parseQuotas(BasicConfig section) {
        List<QueueQuota> sender = new ArrayList<>();
        List<QueueQuota> rcptDomain = new ArrayList<>();
        List<QueueQuota> rcpt = new ArrayList<>();

        for (String id : section.getKeys()) {
            String key = "queue.quota." + id;
            BasicConfig entry = section.getSection(id);
            if (!entry.getBooleanProperty("enable", true)) {
                continue;
            }

            int keys = parseKeys(entry, key, ThrottleKeys.QUOTA);

            Expression match = Expression.EMPTY;
            if (entry.hasProperty("match")) {
                Optional<Expression> parsed = expression(entry, "match", key, VariableContext.HOST);
                if (parsed.isEmpty()) {
                    continue;
                }
                match = parsed.get();
            }

            Long size = positive(entry.getLongProperty("size", null));
            Long messages = positive(entry.getLongProperty("messages", null));
            if (size == null && messages == null) {
                parseError(key, "Queue quota needs to define a valid 'size' and/or 'messages' property.");
                continue;
            }

            QueueQuota quota = new QueueQuota(id, match, keys, size, messages);
            if (quota.hasKey(ThrottleKeys.RCPT) || match.references(Variable.RCPT)) {
                rcpt.add(quota);
            } else if (quota.hasKey(ThrottleKeys.RCPT_DOMAIN) || match.references(Variable.RCPT_DOMAIN)) {
                rcptDomain.add(quota);
            } else {
                sender.add(quota);
            }
        }

        return new QueueQuotas(sender, rcptDomain, rcpt);
    }

    private int parseKeys(BasicConfig entry, String key, int allowed) {
        int keys = 0;
        for (Object value : entry.getListProperty("key")) {
            String name = String.valueOf(value);
            OptionalInt bit = ThrottleKeys.parse(name);
            if (bit.isEmpty()) {
                parseError(key + ".key", "Invalid throttle key '" + name + "'.");
            } else if ((bit.getAsInt() & allowed) == 0) {
                buildError(key + ".key", "Key '" + name + "' is not available in this context.");
            } else {
                keys |= bit.getAsInt();
            }
        }
        return keys;
    }

    private Optional<Expression> expression(BasicConfig entry, String name, String key, VariableContext context) {
        String value = entry.getStringProperty(name);
        if (StringUtils.isBlank(value)) {
            return Optional.of(Expression.EMPTY);
        }
        try {
            return Optional.of(Expression.parse(value, context));
        } catch (ExpressionException e) {
            parseError(key + "." + name, e.getMessage());
            return Optional.empty();
        }
    }

    private List<Long> durations(BasicConfig entry, String name, String key) {
        List<Long> list = new ArrayList<>();
        for (Object value : entry.getListProperty(name)) {
            Optional<Duration> duration = Durations.parse(value);
            if (duration.isPresent()) {
                list.add(duration.get().getSeconds());
            } else {
                parseError(key + "." + name, "Invalid duration '" + value + "'.");
            }
        }
        return list;
    }

    private Optional<Duration> duration(BasicConfig entry, String name, String key) {
        if (!entry.hasProperty(name)) {
            return Optional.empty();
        }
        Optional<Duration> duration = Durations.parse(entry.getProperty(name));
        if (duration.isEmpty()) {
            parseError(key + "." + name, "Invalid duration '" + entry.getProperty(name) + "'.");
        }
        return duration;
    }

    private static Long positive(Long value) {
        return value != null && value > 0 ? value : null;
    }

    private void parseError(String key, String message) {
        catalog.errors.add(new ConfigError(ConfigError.Kind.PARSE, key, message));
    }

    private void buildError(String key, String message) {
        catalog.errors.add(new ConfigError(ConfigError.Kind.BUILD, key, message));
    }
}
