package com.mimecast.outpost.config.queue;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.mimecast.outpost.config.ConfigError;
import com.mimecast.outpost.expr.IfBlock;
import com.mimecast.outpost.queue.QueueName;
import com.mimecast.outpost.queue.limit.QueueQuotas;
import com.mimecast.outpost.queue.limit.QueueRateLimiters;
import com.mimecast.outpost.queue.strategy.ConnectionStrategy;
import com.mimecast.outpost.queue.strategy.QueueStrategy;
import com.mimecast.outpost.queue.strategy.RoutingStrategy;
import com.mimecast.outpost.queue.strategy.TlsStrategy;
import com.mimecast.outpost.queue.strategy.VirtualQueue;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Map;

/**
 * Immutable catalog of queue strategies built from configuration.
 *
 * <p>Lookups never fail: unknown names fall back to the {@code default} entry,
 * then to the built-in defaults.
 * <p>Safe to share between workers without locking.
 */
public final class StrategyCatalog {
    private static final Logger log = LogManager.getLogger(StrategyCatalog.class);

    public static final String DEFAULT = "default";

    public static final String ROUTE_KEY = "queue.strategy.route";
    public static final String SCHEDULE_KEY = "queue.strategy.schedule";
    public static final String CONNECTION_KEY = "queue.strategy.connection";
    public static final String TLS_KEY = "queue.strategy.tls";

    /**
     * Built-in route selection.
     */
    public static final IfBlock DEFAULT_ROUTE = IfBlock.of(ROUTE_KEY,
            List.<String[]>of(new String[]{"is_local_domain('*', rcpt_domain)", "'local'"}),
            "'mx'");

    /**
     * Built-in schedule selection.
     */
    public static final IfBlock DEFAULT_SCHEDULE = IfBlock.of(SCHEDULE_KEY,
            List.of(new String[]{"is_local_domain('*', rcpt_domain)", "'local'"},
                    new String[]{"source == 'dsn'", "'dsn'"},
                    new String[]{"source == 'report'", "'report'"}),
            "'remote'");

    /**
     * Built-in connection selection.
     */
    public static final IfBlock DEFAULT_CONNECTION = IfBlock.of(CONNECTION_KEY, List.of(), "'default'");

    /**
     * Built-in TLS selection.
     */
    public static final IfBlock DEFAULT_TLS = IfBlock.of(TLS_KEY,
            List.<String[]>of(new String[]{"retry_num > 0 && last_error == 'tls'", "'invalid-tls'"}),
            "'default'");

    private final IfBlock route;
    private final IfBlock schedule;
    private final IfBlock connection;
    private final IfBlock tls;
    private final DsnConfig dsn;
    private final QueueRateLimiters inboundLimiters;
    private final QueueRateLimiters outboundLimiters;
    private final QueueQuotas quotas;
    private final ImmutableMap<String, QueueStrategy> queueStrategies;
    private final ImmutableMap<String, RoutingStrategy> routingStrategies;
    private final ImmutableMap<String, ConnectionStrategy> connectionStrategies;
    private final ImmutableMap<String, TlsStrategy> tlsStrategies;
    private final ImmutableMap<QueueName, VirtualQueue> virtualQueues;
    private final ImmutableList<ConfigError> errors;

    StrategyCatalog(Builder builder) {
        this.route = builder.route;
        this.schedule = builder.schedule;
        this.connection = builder.connection;
        this.tls = builder.tls;
        this.dsn = builder.dsn;
        this.inboundLimiters = builder.inboundLimiters;
        this.outboundLimiters = builder.outboundLimiters;
        this.quotas = builder.quotas;
        this.queueStrategies = builder.queueStrategies.build();
        this.routingStrategies = builder.routingStrategies.build();
        this.connectionStrategies = builder.connectionStrategies.build();
        this.tlsStrategies = builder.tlsStrategies.build();
        this.virtualQueues = builder.virtualQueues.build();
        this.errors = builder.errors.build();
    }

    /**
     * Catalog with built-in defaults only.
     *
     * @return StrategyCatalog.
     */
    public static StrategyCatalog defaults() {
        return new Builder().build();
    }

    public IfBlock getRoute() {
        return route;
    }

    public IfBlock getSchedule() {
        return schedule;
    }

    public IfBlock getConnection() {
        return connection;
    }

    public IfBlock getTls() {
        return tls;
    }

    public DsnConfig getDsn() {
        return dsn;
    }

    public QueueRateLimiters getInboundLimiters() {
        return inboundLimiters;
    }

    public QueueRateLimiters getOutboundLimiters() {
        return outboundLimiters;
    }

    public QueueQuotas getQuotas() {
        return quotas;
    }

    public Map<String, QueueStrategy> getQueueStrategies() {
        return queueStrategies;
    }

    public Map<String, RoutingStrategy> getRoutingStrategies() {
        return routingStrategies;
    }

    public Map<String, ConnectionStrategy> getConnectionStrategies() {
        return connectionStrategies;
    }

    public Map<String, TlsStrategy> getTlsStrategies() {
        return tlsStrategies;
    }

    public Map<QueueName, VirtualQueue> getVirtualQueues() {
        return virtualQueues;
    }

    /**
     * Gets the errors found while loading.
     *
     * @return List of ConfigError.
     */
    public List<ConfigError> getErrors() {
        return errors;
    }

    /**
     * Gets a schedule strategy.
     *
     * @param name Strategy name, may be null.
     * @return QueueStrategy.
     */
    public QueueStrategy getQueueStrategyOrDefault(String name) {
        return lookup(queueStrategies, name, QueueStrategy.DEFAULT, "Queue strategy");
    }

    /**
     * Gets a routing strategy.
     * <p>The names {@code local} and {@code mx} resolve to built-in routes when not configured.
     *
     * @param name Strategy name, may be null.
     * @return RoutingStrategy.
     */
    public RoutingStrategy getRoutingStrategyOrDefault(String name) {
        if (name != null && !routingStrategies.containsKey(name)) {
            if ("local".equals(name)) {
                return RoutingStrategy.LOCAL;
            } else if ("mx".equals(name)) {
                return RoutingStrategy.MX;
            }
        }
        return lookup(routingStrategies, name, RoutingStrategy.MX, "Routing strategy");
    }

    /**
     * Gets a connection strategy.
     *
     * @param name Strategy name, may be null.
     * @return ConnectionStrategy.
     */
    public ConnectionStrategy getConnectionStrategyOrDefault(String name) {
        return lookup(connectionStrategies, name, ConnectionStrategy.DEFAULT, "Connection strategy");
    }

    /**
     * Gets a TLS strategy.
     *
     * @param name Strategy name, may be null.
     * @return TlsStrategy.
     */
    public TlsStrategy getTlsStrategyOrDefault(String name) {
        return lookup(tlsStrategies, name, TlsStrategy.DEFAULT, "TLS strategy");
    }

    /**
     * Gets a virtual queue.
     *
     * @param name Queue name.
     * @return VirtualQueue.
     */
    public VirtualQueue getVirtualQueue(QueueName name) {
        VirtualQueue queue = virtualQueues.get(name);
        if (queue == null) {
            if (!QueueName.DEFAULT.equals(name)) {
                log.debug("Virtual queue not found: {}", name);
            }
            return virtualQueues.getOrDefault(QueueName.DEFAULT, VirtualQueue.DEFAULT);
        }
        return queue;
    }

    private static <T> T lookup(Map<String, T> map, String name, T builtIn, String kind) {
        if (name != null) {
            T value = map.get(name);
            if (value != null) {
                return value;
            }
            if (!DEFAULT.equals(name)) {
                log.debug("{} not found: {}", kind, name);
            }
        }
        return map.getOrDefault(DEFAULT, builtIn);
    }

    /**
     * Mutable catalog builder used while loading.
     */
    static final class Builder {
        IfBlock route = DEFAULT_ROUTE;
        IfBlock schedule = DEFAULT_SCHEDULE;
        IfBlock connection = DEFAULT_CONNECTION;
        IfBlock tls = DEFAULT_TLS;
        DsnConfig dsn = DsnConfig.DEFAULT;
        QueueRateLimiters inboundLimiters = QueueRateLimiters.EMPTY;
        QueueRateLimiters outboundLimiters = QueueRateLimiters.EMPTY;
        QueueQuotas quotas = QueueQuotas.EMPTY;
        final ImmutableMap.Builder<String, QueueStrategy> queueStrategies = ImmutableMap.builder();
        final ImmutableMap.Builder<String, RoutingStrategy> routingStrategies = ImmutableMap.builder();
        final ImmutableMap.Builder<String, ConnectionStrategy> connectionStrategies = ImmutableMap.builder();
        final ImmutableMap.Builder<String, TlsStrategy> tlsStrategies = ImmutableMap.builder();
        final ImmutableMap.Builder<QueueName, VirtualQueue> virtualQueues = ImmutableMap.builder();
        final ImmutableList.Builder<ConfigError> errors = ImmutableList.builder();

        StrategyCatalog build() {
            return new StrategyCatalog(this);
        }
    }
}
