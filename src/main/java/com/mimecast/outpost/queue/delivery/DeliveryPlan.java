package com.mimecast.outpost.queue.delivery;

import com.mimecast.outpost.queue.strategy.ConnectionStrategy;
import com.mimecast.outpost.queue.strategy.QueueStrategy;
import com.mimecast.outpost.queue.strategy.RoutingStrategy;
import com.mimecast.outpost.queue.strategy.TlsStrategy;

/**
 * Strategies resolved for one delivery attempt of one recipient.
 */
public final class DeliveryPlan {

    private final QueueStrategy schedule;
    private final RoutingStrategy routing;
    private final ConnectionStrategy connection;
    private final TlsStrategy tls;

    /**
     * Constructs a new DeliveryPlan instance.
     *
     * @param schedule   Schedule strategy.
     * @param routing    Routing strategy.
     * @param connection Connection strategy.
     * @param tls        TLS strategy.
     */
    public DeliveryPlan(QueueStrategy schedule, RoutingStrategy routing, ConnectionStrategy connection, TlsStrategy tls) {
        this.schedule = schedule;
        this.routing = routing;
        this.connection = connection;
        this.tls = tls;
    }

    public QueueStrategy getSchedule() {
        return schedule;
    }

    public RoutingStrategy getRouting() {
        return routing;
    }

    public ConnectionStrategy getConnection() {
        return connection;
    }

    public TlsStrategy getTls() {
        return tls;
    }

    @Override
    public String toString() {
        return "DeliveryPlan{routing=" + routing + ", connection=" + connection + ", tls=" + tls + "}";
    }
}
