package com.xing.warren;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * Topology and policy of one consumer. Built either programmatically through {@link #builder()} or
 * from environment variables through {@link #fromEnvironment(Map)}.
 */
public class ConsumerConfiguration {

    static final String ENV_SERVERS = "WARREN_SERVERS";
    static final String ENV_EXCHANGE = "WARREN_EXCHANGE";
    static final String ENV_EXCHANGE_TYPE = "WARREN_EXCHANGE_TYPE";
    static final String ENV_QUEUE = "WARREN_QUEUE";
    static final String ENV_DURABLE_EXCHANGE = "WARREN_DURABLE_EXCHANGE";
    static final String ENV_DURABLE_QUEUE = "WARREN_DURABLE_QUEUE";
    static final String ENV_ROUTING_KEY = "WARREN_ROUTING_KEY";
    static final String ENV_CHECK_TX_ID = "WARREN_CHECK_TX_ID";
    static final String ENV_NACK_REQUEUE = "WARREN_NACK_REQUEUE";
    static final String ENV_RECONNECT_DELAY = "WARREN_RECONNECT_DELAY_SECONDS";
    static final String ENV_MAX_BACKOFF = "WARREN_MAX_BACKOFF_SECONDS";
    static final String ENV_QUARANTINE_QUEUE = "WARREN_QUARANTINE_QUEUE";

    private static final String DEFAULT_USERNAME = "guest";
    private static final String DEFAULT_PASSWORD = "guest";
    private static final String DEFAULT_VHOST = "/";
    private static final String DEFAULT_CONNECTION_NAME = "warren-consumer";
    private static final long DEFAULT_RECONNECT_DELAY_MILLIS = TimeUnit.SECONDS.toMillis(3);

    private final List<Endpoint> endpoints;
    private final Queue queue;
    private final boolean checkTxId;
    private final boolean nackRequeue;
    private final long reconnectDelayMillis;
    private final long maxBackoffMillis;
    private final String quarantineQueue;
    private final String connectionName;

    private ConsumerConfiguration(Builder builder) {
        this.endpoints = Collections.unmodifiableList(new ArrayList<>(builder.endpoints));
        this.queue = builder.queue;
        this.checkTxId = builder.checkTxId;
        this.nackRequeue = builder.nackRequeue;
        this.reconnectDelayMillis = builder.reconnectDelayMillis;
        this.maxBackoffMillis = builder.maxBackoffMillis;
        this.quarantineQueue = builder.quarantineQueue;
        this.connectionName = builder.connectionName;
    }

    public List<Endpoint> getEndpoints() {
        return endpoints;
    }

    public Queue getQueue() {
        return queue;
    }

    public Exchange getExchange() {
        return queue.getExchange();
    }

    /** Whether deliveries without a {@code tx_id} header are rejected before processing. */
    public boolean isCheckTxId() {
        return checkTxId;
    }

    /** The requeue flag sent with every nack of a retryable or unexpected failure. */
    public boolean isNackRequeue() {
        return nackRequeue;
    }

    /** Pause after an unexpected connection close before the reconnect backoff starts. */
    public long getReconnectDelayMillis() {
        return reconnectDelayMillis;
    }

    /** Ceiling for the linear reconnect backoff, {@code 0} for none. */
    public long getMaxBackoffMillis() {
        return maxBackoffMillis;
    }

    public String getQuarantineQueue() {
        return quarantineQueue;
    }

    public String getConnectionName() {
        return connectionName;
    }

    @Override
    public String toString() {
        return "ConsumerConfiguration{" +
            "endpoints=" + endpoints +
            ", queue=" + queue +
            ", checkTxId=" + checkTxId +
            ", nackRequeue=" + nackRequeue +
            ", reconnectDelayMillis=" + reconnectDelayMillis +
            ", maxBackoffMillis=" + maxBackoffMillis +
            ", quarantineQueue=" + quarantineQueue +
            '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static ConsumerConfiguration fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    /**
     * Reads the configuration from {@code WARREN_*} variables. {@code WARREN_SERVERS} (comma
     * separated broker urls), {@code WARREN_EXCHANGE} and {@code WARREN_QUEUE} are required.
     */
    public static ConsumerConfiguration fromEnvironment(Map<String, String> env) {
        String servers = required(env, ENV_SERVERS);
        List<String> urls = Arrays.stream(servers.split(","))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .collect(Collectors.toList());

        if (urls.isEmpty()) {
            throw new IllegalArgumentException("Environment variable " + ENV_SERVERS + " lists no broker");
        }

        Exchange exchange = Exchange.builder()
            .name(required(env, ENV_EXCHANGE))
            .type(env.getOrDefault(ENV_EXCHANGE_TYPE, Exchange.DEFAULT_TYPE))
            .durable(parseBoolean(env, ENV_DURABLE_EXCHANGE, true))
            .build();

        Queue queue = Queue.builder()
            .name(required(env, ENV_QUEUE))
            .routingKey(env.get(ENV_ROUTING_KEY))
            .exchange(exchange)
            .durable(parseBoolean(env, ENV_DURABLE_QUEUE, true))
            .build();

        Builder builder = builder()
            .queue(queue)
            .checkTxId(parseBoolean(env, ENV_CHECK_TX_ID, true))
            .nackRequeue(parseBoolean(env, ENV_NACK_REQUEUE, true))
            .quarantineQueue(env.get(ENV_QUARANTINE_QUEUE));
        for (String url : urls) {
            builder.addBroker(url);
        }
        if (env.containsKey(ENV_RECONNECT_DELAY)) {
            builder.reconnectDelay(parseLong(env, ENV_RECONNECT_DELAY), TimeUnit.SECONDS);
        }
        if (env.containsKey(ENV_MAX_BACKOFF)) {
            builder.maxBackoff(parseLong(env, ENV_MAX_BACKOFF), TimeUnit.SECONDS);
        }
        return builder.build();
    }

    private static String required(Map<String, String> env, String name) {
        String value = env.get(name);
        if (value == null || value.trim().isEmpty()) {
            throw new IllegalArgumentException("Missing environment variable " + name);
        }
        return value.trim();
    }

    private static boolean parseBoolean(Map<String, String> env, String name, boolean defaultValue) {
        String value = env.get(name);
        if (value == null) {
            return defaultValue;
        }
        if ("true".equalsIgnoreCase(value.trim())) {
            return true;
        }
        if ("false".equalsIgnoreCase(value.trim())) {
            return false;
        }
        throw new IllegalArgumentException("Environment variable " + name + " must be true or false, got " + value);
    }

    private static long parseLong(Map<String, String> env, String name) {
        String value = env.get(name);
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Environment variable " + name + " must be a number, got " + value, e);
        }
    }

    public static class Builder {

        private final List<Endpoint> endpoints = new ArrayList<>();
        private Queue queue;
        private boolean checkTxId = true;
        private boolean nackRequeue = true;
        private long reconnectDelayMillis = DEFAULT_RECONNECT_DELAY_MILLIS;
        private long maxBackoffMillis = 0;
        private String quarantineQueue;
        private String connectionName = DEFAULT_CONNECTION_NAME;

        public Builder addBroker(Endpoint endpoint) {
            endpoints.add(endpoint);
            return this;
        }

        public Builder addBroker(String url) {
            return addBroker(Endpoint.of(url));
        }

        public Builder addBroker(URI amqpUri) {
            return addBroker(Endpoint.of(amqpUri));
        }

        public Builder addBroker(String host, int port, String username, String password, String virtualHost) {
            // the virtual host has to start with a / or the URI constructor rejects it
            if (virtualHost != null && !virtualHost.startsWith("/")) {
                virtualHost = "/" + virtualHost;
            }
            try {
                return addBroker(new URI("amqp", username + ":" + password, host, port, virtualHost, null, null));
            } catch (URISyntaxException e) {
                throw new IllegalArgumentException("Invalid broker address " + host + ":" + port, e);
            }
        }

        public Builder addBroker(String host, int port) {
            return addBroker(host, port, DEFAULT_USERNAME, DEFAULT_PASSWORD, DEFAULT_VHOST);
        }

        public Builder queue(Queue queue) {
            this.queue = queue;
            return this;
        }

        public Builder queue(Queue.Builder builder) {
            return queue(builder.build());
        }

        public Builder checkTxId(boolean checkTxId) {
            this.checkTxId = checkTxId;
            return this;
        }

        public Builder nackRequeue(boolean nackRequeue) {
            this.nackRequeue = nackRequeue;
            return this;
        }

        public Builder reconnectDelay(long delay, TimeUnit unit) {
            if (delay < 0) {
                throw new IllegalArgumentException("Reconnect delay must not be negative: " + delay);
            }
            this.reconnectDelayMillis = unit.toMillis(delay);
            return this;
        }

        public Builder maxBackoff(long maxBackoff, TimeUnit unit) {
            if (maxBackoff < 0) {
                throw new IllegalArgumentException("Maximum backoff must not be negative: " + maxBackoff);
            }
            this.maxBackoffMillis = unit.toMillis(maxBackoff);
            return this;
        }

        public Builder quarantineQueue(String quarantineQueue) {
            this.quarantineQueue = quarantineQueue;
            return this;
        }

        public Builder connectionName(String connectionName) {
            this.connectionName = connectionName;
            return this;
        }

        public ConsumerConfiguration build() {
            if (queue == null) {
                throw new IllegalStateException("No queue configured.");
            }
            if (endpoints.isEmpty()) {
                throw new IllegalStateException("No broker configured.");
            }
            return new ConsumerConfiguration(this);
        }
    }
}
