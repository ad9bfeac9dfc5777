package com.amqptools.consumer;

import java.util.Objects;

/**
 * Where to consume from: an optional queue name, and optionally an exchange and
 * routing key to bind it with.
 */
public final class QueueSpec {
    private final String name;
    private final String exchangeName;
    private final String routingKey;
    private final boolean declare;

    public QueueSpec(String name, String exchangeName, String routingKey, boolean declare) {
        this.name = name;
        this.exchangeName = exchangeName;
        this.routingKey = routingKey;
        this.declare = declare;
    }

    public String getName() {
        return name;
    }

    public String getExchangeName() {
        return exchangeName;
    }

    public String getRoutingKey() {
        return routingKey;
    }

    public boolean isDeclare() {
        return declare;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof QueueSpec)) return false;
        QueueSpec that = (QueueSpec) o;
        return declare == that.declare &&
               Objects.equals(name, that.name) &&
               Objects.equals(exchangeName, that.exchangeName) &&
               Objects.equals(routingKey, that.routingKey);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, exchangeName, routingKey, declare);
    }

    @Override
    public String toString() {
        return "QueueSpec{name=" + name + ", exchange=" + exchangeName +
               ", routingKey=" + routingKey + ", declare=" + declare + '}';
    }
}
