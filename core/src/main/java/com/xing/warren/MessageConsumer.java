package com.xing.warren;

import com.xing.warren.amqp.ChannelManager;
import com.xing.warren.amqp.ChannelState;
import com.xing.warren.amqp.ConnectionManager;
import com.xing.warren.amqp.ConnectionState;
import com.xing.warren.amqp.ConsumerLoop;
import com.xing.warren.util.EventLoop;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Consumes one queue until stopped, surviving broker restarts and network failures. Create
 * instances through {@link #builder()}.
 */
public class MessageConsumer {

    private static final Logger log = LoggerFactory.getLogger(MessageConsumer.class);

    private final ConsumerConfiguration configuration;
    private final ConnectionManager connectionManager;
    private final ChannelManager channelManager;
    private final ConsumerLoop consumerLoop;
    private final EventLoop loop;
    private final List<AutoCloseable> ownedResources;
    private final CompletableFuture<Void> stopped = new CompletableFuture<>();

    private volatile LifecycleState state = LifecycleState.UNINITIALIZED;

    MessageConsumer(ConsumerConfiguration configuration,
                    ConnectionManager connectionManager,
                    ChannelManager channelManager,
                    ConsumerLoop consumerLoop,
                    EventLoop loop,
                    List<AutoCloseable> ownedResources) {
        this.configuration = configuration;
        this.connectionManager = connectionManager;
        this.channelManager = channelManager;
        this.consumerLoop = consumerLoop;
        this.loop = loop;
        this.ownedResources = new ArrayList<>(ownedResources);
        connectionManager.getTermination().whenComplete((ignored, error) -> terminated());
    }

    public static ConsumerBuilder builder() {
        return new ConsumerBuilder();
    }

    /**
     * Connects to the first broker and starts consuming. Returns immediately; connection failures
     * are retried in the background.
     */
    public synchronized void start() {
        if (state == LifecycleState.STOPPING || state == LifecycleState.STOPPED) {
            throw new IllegalStateException("Cannot restart a stopped consumer. Construct a new one.");
        }
        if (state == LifecycleState.STARTED) {
            log.debug("Ignoring call to start() for an already started consumer.", new Throwable());
            return;
        }
        log.info("Starting consumer queue={} endpoints={}", configuration.getQueue().getName(),
            configuration.getEndpoints());
        state = LifecycleState.STARTED;
        loop.execute(connectionManager::connect);
    }

    /** Starts the consumer and blocks until it has been stopped. */
    public void run() throws InterruptedException {
        start();
        try {
            stopped.get();
        } catch (ExecutionException e) {
            throw new IllegalStateException("Consumer terminated abnormally", e.getCause());
        }
    }

    /**
     * Stops consuming: the subscription is cancelled, then channel and connection are closed. A
     * pending reconnect is abandoned. Returns immediately, see {@link #awaitTermination}.
     */
    public synchronized void stop() {
        if (state == LifecycleState.STOPPING || state == LifecycleState.STOPPED) {
            log.debug("Ignoring call to stop() for an already stopped consumer.", new Throwable());
            return;
        }
        if (state == LifecycleState.UNINITIALIZED) {
            state = LifecycleState.STOPPING;
            loop.execute(connectionManager::shutdown);
            return;
        }
        log.info("Stopping consumer queue={}", configuration.getQueue().getName());
        state = LifecycleState.STOPPING;
        loop.execute(this::shutdown);
    }

    private void shutdown() {
        connectionManager.requestShutdown();
        if (consumerLoop.stopConsuming()) {
            return;
        }
        if (channelManager.getState() == ChannelState.OPEN) {
            channelManager.close();
        } else {
            connectionManager.shutdown();
        }
    }

    private void terminated() {
        state = LifecycleState.STOPPED;
        for (AutoCloseable resource : ownedResources) {
            try {
                resource.close();
            } catch (Exception e) {
                log.warn("Failed to close {}", resource, e);
            }
        }
        log.info("Consumer stopped queue={}", configuration.getQueue().getName());
        stopped.complete(null);
    }

    /** @return {@code false} if the consumer did not stop within the timeout */
    public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
        try {
            stopped.get(timeout, unit);
            return true;
        } catch (TimeoutException e) {
            return false;
        } catch (ExecutionException e) {
            throw new IllegalStateException("Consumer terminated abnormally", e.getCause());
        }
    }

    public LifecycleState getState() {
        return state;
    }

    public ConnectionState getConnectionState() {
        return connectionManager.getState();
    }

    public ChannelState getChannelState() {
        return channelManager.getState();
    }

    public boolean isConsuming() {
        return consumerLoop.isConsuming();
    }

    public int getRetryCount() {
        return connectionManager.getRetryCount();
    }

    public ConsumerConfiguration getConfiguration() {
        return configuration;
    }
}
