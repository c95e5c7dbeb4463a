package com.xing.warren;

import java.util.Objects;

/**
 * AMQP exchange the consumed queue is bound to.
 */
public class Exchange {

    public static final String DEFAULT_TYPE = "topic";

    private final String name;
    private final String type;
    private final boolean durable;

    private Exchange(String name, String type, boolean durable) {
        this.name = name;
        this.type = type;
        this.durable = durable;
    }

    public String getName() {
        return name;
    }

    public String getType() {
        return type;
    }

    public boolean isDurable() {
        return durable;
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type, durable);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        final Exchange other = (Exchange) obj;
        return Objects.equals(this.name, other.name)
            && Objects.equals(this.type, other.type)
            && this.durable == other.durable;
    }

    @Override
    public String toString() {
        return "Exchange{" +
            "name='" + name + '\'' +
            ", type=" + type +
            ", durable=" + durable +
            '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {

        private String name;
        private String type = DEFAULT_TYPE;
        private boolean durable = true;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder type(String type) {
            this.type = type;
            return this;
        }

        public Builder durable(boolean durable) {
            this.durable = durable;
            return this;
        }

        public Exchange build() {
            if (name == null || name.isEmpty()) {
                throw new IllegalStateException("No name given for the exchange.");
            }
            if (type == null || type.isEmpty()) {
                throw new IllegalStateException("No type given for exchange " + name);
            }
            return new Exchange(name, type, durable);
        }
    }
}
