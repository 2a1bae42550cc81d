package com.mimecast.outpost.queue.delivery;

import com.mimecast.outpost.config.queue.StrategyCatalog;
import com.mimecast.outpost.expr.PolicyResolver;
import com.mimecast.outpost.queue.Message;
import com.mimecast.outpost.queue.QueueEnvelope;
import com.mimecast.outpost.queue.Recipient;
import com.mimecast.outpost.queue.strategy.QueueStrategy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Selects the strategies that apply to a recipient.
 */
public class StrategyResolver {
    private static final Logger log = LogManager.getLogger(StrategyResolver.class);

    private final StrategyCatalog catalog;
    private final PolicyResolver resolver;

    /**
     * Constructs a new StrategyResolver instance.
     *
     * @param catalog  Strategy catalog.
     * @param resolver Policy resolver.
     */
    public StrategyResolver(StrategyCatalog catalog, PolicyResolver resolver) {
        this.catalog = catalog;
        this.resolver = resolver;
    }

    public StrategyCatalog getCatalog() {
        return catalog;
    }

    public PolicyResolver getResolver() {
        return resolver;
    }

    /**
     * Resolves the schedule strategy of a recipient.
     *
     * @param message   Message.
     * @param recipient Recipient.
     * @param now       Current time.
     * @return QueueStrategy.
     */
    public QueueStrategy schedule(Message message, Recipient recipient, long now) {
        QueueEnvelope envelope = QueueEnvelope.of(message, recipient, now);
        String name = resolver.resolve(catalog.getSchedule(), envelope).orElse(StrategyCatalog.DEFAULT);
        return catalog.getQueueStrategyOrDefault(name);
    }

    /**
     * Resolves every strategy needed for a delivery attempt.
     *
     * @param message   Message.
     * @param recipient Recipient.
     * @param now       Current time.
     * @return DeliveryPlan.
     */
    public DeliveryPlan plan(Message message, Recipient recipient, long now) {
        QueueEnvelope envelope = QueueEnvelope.of(message, recipient, now);
        String schedule = resolver.resolve(catalog.getSchedule(), envelope).orElse(StrategyCatalog.DEFAULT);
        String route = resolver.resolve(catalog.getRoute(), envelope).orElse(StrategyCatalog.DEFAULT);
        String connection = resolver.resolve(catalog.getConnection(), envelope).orElse(StrategyCatalog.DEFAULT);
        String tls = resolver.resolve(catalog.getTls(), envelope).orElse(StrategyCatalog.DEFAULT);
        log.trace("Resolved strategies: uid={} rcpt={} schedule={} route={} connection={} tls={}",
                message.getQueueId(), recipient.getAddress(), schedule, route, connection, tls);

        return new DeliveryPlan(
                catalog.getQueueStrategyOrDefault(schedule),
                catalog.getRoutingStrategyOrDefault(route),
                catalog.getConnectionStrategyOrDefault(connection),
                catalog.getTlsStrategyOrDefault(tls));
    }
}
