package com.xing.warren.dispatch;

import static java.util.Objects.requireNonNull;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.AlreadyClosedException;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Delivery;
import com.xing.warren.ConsumerConfiguration;
import com.xing.warren.MalformedMessageException;
import com.xing.warren.MessageProcessor;
import com.xing.warren.PublishException;
import com.xing.warren.QuarantinePublisher;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the processor for a delivery and answers the broker with exactly one ack, nack or reject.
 *
 * <ul>
 *   <li>{@link Outcome#ACCEPTED}: ack
 *   <li>{@link Outcome#RETRYABLE}, {@link Outcome#UNEXPECTED}: nack, requeue flag as configured
 *   <li>{@link Outcome#QUARANTINABLE}: publish to quarantine, then reject; reject with requeue if
 *       the publish fails
 *   <li>{@link Outcome#MALFORMED}: reject without requeue, the processor is not invoked
 * </ul>
 */
public class MessageDispatcher {

  public static final String TX_ID_HEADER = "tx_id";

  private static final Logger log = LoggerFactory.getLogger(MessageDispatcher.class);

  private final MessageProcessor processor;
  private final QuarantinePublisher quarantinePublisher;
  private final ExceptionClassifier classifier;
  private final String queueName;
  private final boolean checkTxId;
  private final boolean nackRequeue;

  public MessageDispatcher(
      ConsumerConfiguration configuration,
      MessageProcessor processor,
      QuarantinePublisher quarantinePublisher,
      ExceptionClassifier classifier) {
    this(
        processor,
        quarantinePublisher,
        classifier,
        configuration.getQueue().getName(),
        configuration.isCheckTxId(),
        configuration.isNackRequeue());
  }

  public MessageDispatcher(
      MessageProcessor processor,
      QuarantinePublisher quarantinePublisher,
      ExceptionClassifier classifier,
      String queueName,
      boolean checkTxId,
      boolean nackRequeue) {
    this.processor = requireNonNull(processor, "processor");
    this.quarantinePublisher = requireNonNull(quarantinePublisher, "quarantinePublisher");
    this.classifier = requireNonNull(classifier, "classifier");
    this.queueName = queueName;
    this.checkTxId = checkTxId;
    this.nackRequeue = nackRequeue;
  }

  /**
   * Reads the {@code tx_id} header.
   *
   * @throws MalformedMessageException if there are no headers or no {@code tx_id}
   */
  static String txId(AMQP.BasicProperties properties) {
    Map<String, Object> headers = properties != null ? properties.getHeaders() : null;
    if (headers == null) {
      throw new MalformedMessageException("no headers");
    }
    Object txId = headers.get(TX_ID_HEADER);
    if (txId == null) {
      throw new MalformedMessageException("no tx_id");
    }
    return txId.toString();
  }

  private static String decode(byte[] body) throws CharacterCodingException {
    return StandardCharsets.UTF_8
        .newDecoder()
        .onMalformedInput(CodingErrorAction.REPORT)
        .onUnmappableCharacter(CodingErrorAction.REPORT)
        .decode(ByteBuffer.wrap(body))
        .toString();
  }

  public Outcome dispatch(Channel channel, Delivery delivery) {
    final long deliveryTag = delivery.getEnvelope().getDeliveryTag();
    final AMQP.BasicProperties properties = delivery.getProperties();

    String txId = null;
    if (checkTxId) {
      try {
        txId = txId(properties);
      } catch (MalformedMessageException e) {
        reject(channel, deliveryTag, false);
        log.error(
            "Bad message properties - {} delivery_tag={} action=rejected",
            e.getMessage(),
            deliveryTag);
        return Outcome.MALFORMED;
      }
      log.info(
          "Received message queue={} delivery_tag={} app_id={} tx_id={}",
          queueName,
          deliveryTag,
          properties.getAppId(),
          txId);
    } else {
      log.debug("check_tx_id is false. Not checking tx_id delivery_tag={}", deliveryTag);
    }

    Throwable failure = null;
    try {
      processor.process(decode(delivery.getBody()), txId);
    } catch (Exception e) {
      if (e instanceof InterruptedException) {
        Thread.currentThread().interrupt();
      }
      failure = e;
    } catch (Error e) {
      failure = e;
    }

    final Outcome outcome = failure == null ? Outcome.ACCEPTED : classifier.classify(failure);
    switch (outcome) {
      case ACCEPTED:
        ack(channel, deliveryTag);
        log.info("Message accepted delivery_tag={} tx_id={} action=ack", deliveryTag, txId);
        break;
      case RETRYABLE:
        nack(channel, deliveryTag);
        log.error(
            "Failed to process delivery_tag={} tx_id={} action=nack", deliveryTag, txId, failure);
        break;
      case UNEXPECTED:
        nack(channel, deliveryTag);
        log.error(
            "Unexpected exception occurred, failed to process delivery_tag={} tx_id={} action=nack",
            deliveryTag,
            txId,
            failure);
        break;
      case QUARANTINABLE:
        quarantine(channel, delivery, txId, failure);
        break;
      case MALFORMED:
        reject(channel, deliveryTag, false);
        log.error(
            "Malformed message delivery_tag={} tx_id={} action=rejected", deliveryTag, txId, failure);
        break;
      default:
        throw new IllegalStateException("Unknown outcome " + outcome);
    }
    return outcome;
  }

  private void quarantine(Channel channel, Delivery delivery, String txId, Throwable cause) {
    final long deliveryTag = delivery.getEnvelope().getDeliveryTag();
    Map<String, Object> headers = new HashMap<>();
    if (txId != null) {
      headers.put(TX_ID_HEADER, txId);
    }
    try {
      quarantinePublisher.publish(delivery.getBody(), headers);
    } catch (PublishException | RuntimeException | Error e) {
      log.error(
          "Unable to publish message to quarantine queue. Rejecting message and requeuing. delivery_tag={} tx_id={} action=requeued",
          deliveryTag,
          txId,
          e);
      reject(channel, deliveryTag, true);
      return;
    }
    reject(channel, deliveryTag, false);
    log.error(
        "Quarantinable error occurred delivery_tag={} tx_id={} action=quarantined",
        deliveryTag,
        txId,
        cause);
  }

  private void ack(Channel channel, long deliveryTag) {
    log.debug("Acknowledging message delivery_tag={}", deliveryTag);
    try {
      channel.basicAck(deliveryTag, false);
    } catch (IOException | AlreadyClosedException e) {
      log.error("Could not ACK message delivery_tag={}", deliveryTag, e);
    }
  }

  private void nack(Channel channel, long deliveryTag) {
    log.debug("Nacking message delivery_tag={} requeue={}", deliveryTag, nackRequeue);
    try {
      channel.basicNack(deliveryTag, false, nackRequeue);
    } catch (IOException | AlreadyClosedException e) {
      log.error("Could not NACK message delivery_tag={}", deliveryTag, e);
    }
  }

  private void reject(Channel channel, long deliveryTag, boolean requeue) {
    log.debug("Rejecting message delivery_tag={} requeue={}", deliveryTag, requeue);
    try {
      channel.basicReject(deliveryTag, requeue);
    } catch (IOException | AlreadyClosedException e) {
      log.error("Could not REJECT message delivery_tag={}", deliveryTag, e);
    }
  }
}
