package com.xing.warren;

import java.util.Objects;

/**
 * The queue to consume from and how it is bound to its exchange.
 */
public class Queue {
    private final String name;
    private final String routingKey;
    private final Exchange exchange;
    private final boolean durable;

    private Queue(String name, String routingKey, Exchange exchange, boolean durable) {
        this.name = name;
        this.routingKey = routingKey;
        this.exchange = exchange;
        this.durable = durable;
    }

    public String getName() {
        return name;
    }

    /** Binding key, the queue name unless configured otherwise. */
    public String getRoutingKey() {
        return routingKey;
    }

    public Exchange getExchange() {
        return exchange;
    }

    public String getExchangeName() {
        return exchange.getName();
    }

    public boolean isDurable() {
        return durable;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, routingKey, exchange, durable);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        final Queue other = (Queue) obj;
        return Objects.equals(this.name, other.name)
            && Objects.equals(this.routingKey, other.routingKey)
            && Objects.equals(this.exchange, other.exchange)
            && this.durable == other.durable;
    }

    @Override
    public String toString() {
        return "Queue{" +
            "name='" + name + '\'' +
            ", routingKey='" + routingKey + '\'' +
            ", exchange=" + exchange.getName() +
            ", durable=" + durable +
            '}';
    }

    public static class Builder {
        private String name;
        private String routingKey;
        private Exchange exchange;
        private boolean durable = true;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder routingKey(String routingKey) {
            this.routingKey = routingKey;
            return this;
        }

        public Builder exchange(Exchange exchange) {
            this.exchange = exchange;
            return this;
        }

        public Builder exchange(String exchangeName) {
            return exchange(Exchange.builder().name(exchangeName).build());
        }

        public Builder durable(boolean durable) {
            this.durable = durable;
            return this;
        }

        public Queue build() {
            if (name == null || name.isEmpty()) {
                throw new IllegalStateException("No name given for the queue.");
            }
            if (exchange == null) {
                throw new IllegalStateException("No exchange given for queue " + name);
            }
            return new Queue(name, routingKey != null ? routingKey : name, exchange, durable);
        }
    }
}
