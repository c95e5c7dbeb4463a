package com.xing.warren;

import com.rabbitmq.client.ConnectionFactory;
import com.xing.warren.amqp.AmqpQuarantinePublisher;
import com.xing.warren.amqp.ChannelManager;
import com.xing.warren.amqp.ConnectionManager;
import com.xing.warren.amqp.ConsumerLoop;
import com.xing.warren.dispatch.ExceptionClassifier;
import com.xing.warren.dispatch.MessageDispatcher;
import com.xing.warren.util.Backoff;
import com.xing.warren.util.EventLoop;
import com.xing.warren.util.ScheduledEventLoop;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Assembles a {@link MessageConsumer}. Configuration and processor are required. */
public class ConsumerBuilder {

    private static final Logger log = LoggerFactory.getLogger(ConsumerBuilder.class);

    private ConsumerConfiguration configuration;
    private MessageProcessor processor;
    private QuarantinePublisher quarantinePublisher;
    private ExceptionClassifier classifier = ExceptionClassifier.DEFAULT;
    private ConnectionFactory connectionFactory;
    private EventLoop eventLoop;
    private Backoff backoff;

    ConsumerBuilder() {
    }

    public ConsumerBuilder configuration(ConsumerConfiguration configuration) {
        this.configuration = configuration;
        return this;
    }

    public ConsumerBuilder processor(MessageProcessor processor) {
        this.processor = processor;
        return this;
    }

    /** Adapts the public method {@code methodName} of {@code target}, see {@link ReflectiveMessageProcessor}. */
    public ConsumerBuilder processor(Object target, String methodName) {
        return processor(new ReflectiveMessageProcessor(target, methodName));
    }

    public ConsumerBuilder quarantinePublisher(QuarantinePublisher quarantinePublisher) {
        this.quarantinePublisher = quarantinePublisher;
        return this;
    }

    public ConsumerBuilder classifier(ExceptionClassifier classifier) {
        this.classifier = classifier;
        return this;
    }

    public ConsumerBuilder connectionFactory(ConnectionFactory connectionFactory) {
        this.connectionFactory = connectionFactory;
        return this;
    }

    /** Loop to run on. A loop supplied here is not shut down with the consumer. */
    public ConsumerBuilder eventLoop(EventLoop eventLoop) {
        this.eventLoop = eventLoop;
        return this;
    }

    /** Replaces the linear one second reconnect backoff. */
    public ConsumerBuilder backoff(Backoff backoff) {
        this.backoff = backoff;
        return this;
    }

    public MessageConsumer build() {
        if (configuration == null) {
            throw new IllegalStateException("No consumer configuration given.");
        }
        if (processor == null) {
            throw new IllegalStateException("No message processor given.");
        }
        if (classifier == null) {
            throw new IllegalStateException("No exception classifier given.");
        }
        List<AutoCloseable> owned = new ArrayList<>();
        QuarantinePublisher publisher = quarantinePublisher;
        if (publisher == null) {
            if (configuration.getQuarantineQueue() == null) {
                throw new IllegalStateException("No quarantine publisher and no quarantine queue given.");
            }
            AmqpQuarantinePublisher amqpPublisher = new AmqpQuarantinePublisher(
                configuration.getEndpoints(), configuration.getQuarantineQueue());
            log.info("Quarantining to queue {}", configuration.getQuarantineQueue());
            owned.add(amqpPublisher);
            publisher = amqpPublisher;
        }
        EventLoop loop = eventLoop;
        if (loop == null) {
            final EventLoop ownLoop = new ScheduledEventLoop();
            owned.add(ownLoop::shutdown);
            loop = ownLoop;
        }
        Backoff reconnectBackoff = backoff != null ? backoff : Backoff.DEFAULT;
        reconnectBackoff = reconnectBackoff.withCeiling(configuration.getMaxBackoffMillis(), TimeUnit.MILLISECONDS);

        ConnectionManager connectionManager = new ConnectionManager(
            connectionFactory != null ? connectionFactory : new ConnectionFactory(),
            configuration.getEndpoints(),
            loop,
            reconnectBackoff,
            configuration.getReconnectDelayMillis(),
            configuration.getConnectionName());
        ChannelManager channelManager = new ChannelManager(connectionManager, configuration.getQueue(), loop);
        MessageDispatcher dispatcher = new MessageDispatcher(configuration, processor, publisher, classifier);
        ConsumerLoop consumerLoop = new ConsumerLoop(channelManager, dispatcher, configuration.getQueue().getName(), loop);

        connectionManager.setListener(channelManager);
        channelManager.setListener(consumerLoop);
        return new MessageConsumer(configuration, connectionManager, channelManager, consumerLoop, loop, owned);
    }
}
