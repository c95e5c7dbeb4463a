package com.xing.warren.amqp;

import static java.util.Objects.requireNonNull;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.AlreadyClosedException;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import com.rabbitmq.client.MessageProperties;
import com.xing.warren.Endpoint;
import com.xing.warren.PublishException;
import com.xing.warren.QuarantinePublisher;
import java.io.IOException;
import java.net.URISyntaxException;
import java.security.GeneralSecurityException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Moves quarantined messages to a durable queue on the default exchange. Messages are persistent
 * and published with confirms; a publish returns only after the broker confirmed it. A message the
 * broker returns as unroutable, e.g. because the queue was deleted, counts as a failed publish.
 *
 * <p>Uses its own connection, opened on first use against the first reachable endpoint.
 */
public class AmqpQuarantinePublisher implements QuarantinePublisher, AutoCloseable {

  private static final Logger log = LoggerFactory.getLogger(AmqpQuarantinePublisher.class);

  static final long CONFIRM_TIMEOUT_MILLIS = TimeUnit.SECONDS.toMillis(5);

  private final List<Endpoint> endpoints;
  private final String queueName;
  private final ConnectionFactory connectionFactory;

  private Connection connection;
  private Channel channel;
  // set by the connection thread, which delivers basic.return before the confirm
  private volatile String returnedReason;

  public AmqpQuarantinePublisher(
      List<Endpoint> endpoints, String queueName, ConnectionFactory connectionFactory) {
    requireNonNull(endpoints, "endpoints");
    if (endpoints.isEmpty()) {
      throw new IllegalArgumentException("At least one broker endpoint must be configured.");
    }
    this.endpoints = Collections.unmodifiableList(new ArrayList<>(endpoints));
    this.queueName = requireNonNull(queueName, "queueName");
    this.connectionFactory = requireNonNull(connectionFactory, "connectionFactory");
  }

  public AmqpQuarantinePublisher(List<Endpoint> endpoints, String queueName) {
    this(endpoints, queueName, new ConnectionFactory());
  }

  @Override
  public synchronized void publish(byte[] body, Map<String, Object> headers)
      throws PublishException {
    try {
      Channel ch = channel();
      AMQP.BasicProperties properties =
          MessageProperties.PERSISTENT_BASIC
              .builder()
              .headers(new HashMap<>(headers))
              .build();
      returnedReason = null;
      ch.basicPublish("", queueName, true, properties, body);
      ch.waitForConfirmsOrDie(CONFIRM_TIMEOUT_MILLIS);
      if (returnedReason != null) {
        throw new PublishException(
            "Quarantine queue " + queueName + " did not accept the message: " + returnedReason);
      }
      log.info("Quarantined message queue={} tx_id={}", queueName, headers.get("tx_id"));
    } catch (IOException | TimeoutException | AlreadyClosedException e) {
      close();
      throw new PublishException("Publishing to quarantine queue " + queueName + " failed", e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      close();
      throw new PublishException("Interrupted waiting for quarantine confirm", e);
    }
  }

  private Channel channel() throws IOException, PublishException {
    if (channel != null && channel.isOpen()) {
      return channel;
    }
    close();
    connection = connect();
    channel = connection.createChannel();
    if (channel == null) {
      throw new IOException("No channel available for quarantine publishing");
    }
    channel.confirmSelect();
    channel.addReturnListener(
        (replyCode, replyText, exchange, routingKey, properties, body) -> {
          log.warn(
              "Quarantined message returned queue={} reply_code={} reply_text={}",
              routingKey,
              replyCode,
              replyText);
          returnedReason = replyCode + " " + replyText;
        });
    channel.queueDeclare(queueName, true, false, false, null);
    return channel;
  }

  private Connection connect() throws PublishException {
    PublishException failure = new PublishException("No broker reachable for quarantine queue " + queueName);
    for (Endpoint endpoint : endpoints) {
      try {
        connectionFactory.setUri(endpoint.getUri());
        Connection opened = connectionFactory.newConnection("warren-quarantine");
        log.info("Quarantine publisher connected endpoint={}", endpoint);
        return opened;
      } catch (IOException
          | TimeoutException
          | GeneralSecurityException
          | URISyntaxException e) {
        log.warn("Quarantine publisher could not connect endpoint={}", endpoint, e);
        failure.addSuppressed(e);
      }
    }
    throw failure;
  }

  @Override
  public synchronized void close() {
    Connection closing = connection;
    connection = null;
    channel = null;
    if (closing == null) {
      return;
    }
    try {
      closing.close();
    } catch (IOException | AlreadyClosedException e) {
      log.debug("Closing quarantine connection failed", e);
      closing.abort();
    }
  }
}
