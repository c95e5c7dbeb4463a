package com.xing.warren.amqp;

import static java.util.Objects.requireNonNull;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.AlreadyClosedException;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.DefaultConsumer;
import com.rabbitmq.client.Delivery;
import com.rabbitmq.client.Envelope;
import com.xing.warren.dispatch.MessageDispatcher;
import com.xing.warren.util.EventLoop;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Subscribes to the queue once the channel is ready and hands every delivery to the {@link
 * MessageDispatcher}. At most one unacknowledged delivery is outstanding at any time.
 */
public class ConsumerLoop implements ChannelManager.Listener {

  public static final int PREFETCH_COUNT = 1;

  private static final Logger log = LoggerFactory.getLogger(ConsumerLoop.class);

  private final ChannelManager channelManager;
  private final MessageDispatcher dispatcher;
  private final String queueName;
  private final EventLoop loop;

  private Channel channel;
  private volatile String consumerTag;

  public ConsumerLoop(
      ChannelManager channelManager,
      MessageDispatcher dispatcher,
      String queueName,
      EventLoop loop) {
    this.channelManager = requireNonNull(channelManager, "channelManager");
    this.dispatcher = requireNonNull(dispatcher, "dispatcher");
    this.queueName = requireNonNull(queueName, "queueName");
    this.loop = requireNonNull(loop, "loop");
  }

  @Override
  public void channelReady(Channel channel) {
    startConsuming(channel);
  }

  @Override
  public void channelLost() {
    if (consumerTag != null) {
      log.info("Subscription ended with its channel consumer_tag={}", consumerTag);
    }
    channel = null;
    consumerTag = null;
  }

  void startConsuming(Channel ch) {
    log.info("Issuing consumer related RPC commands");
    channel = ch;
    try {
      ch.basicQos(PREFETCH_COUNT);
      consumerTag = ch.basicConsume(queueName, false, new DispatchingConsumer(ch));
    } catch (IOException | AlreadyClosedException e) {
      log.error("Could not start consuming queue={}", queueName, e);
      channelManager.close();
      return;
    }
    log.info("Consuming queue={} consumer_tag={}", queueName, consumerTag);
  }

  /**
   * Cancels the subscription. The channel is closed once the broker confirmed the cancel.
   *
   * @return {@code false} if there was no active subscription
   */
  public boolean stopConsuming() {
    if (channel == null || consumerTag == null) {
      return false;
    }
    log.info("Sending a Basic.Cancel RPC command to RabbitMQ consumer_tag={}", consumerTag);
    try {
      channel.basicCancel(consumerTag);
    } catch (IOException | AlreadyClosedException e) {
      log.warn("Basic.Cancel failed consumer_tag={}, closing channel", consumerTag, e);
      channelManager.close();
    }
    return true;
  }

  public boolean isConsuming() {
    return consumerTag != null;
  }

  public String getConsumerTag() {
    return consumerTag;
  }

  void onDelivery(Channel from, Delivery delivery) {
    long deliveryTag = delivery.getEnvelope().getDeliveryTag();
    if (from != channel || !from.isOpen()) {
      log.warn("Skipping delivery from a closed channel delivery_tag={}", deliveryTag);
      return;
    }
    dispatcher.dispatch(from, delivery);
  }

  void onCancelled(String tag) {
    log.info("Consumer was cancelled remotely, shutting down consumer_tag={}", tag);
    consumerTag = null;
    channelManager.close();
  }

  void onCancelOk(String tag) {
    log.info("RabbitMQ acknowledged the cancellation of the consumer consumer_tag={}", tag);
    consumerTag = null;
    channelManager.close();
  }

  private class DispatchingConsumer extends DefaultConsumer {

    DispatchingConsumer(Channel channel) {
      super(channel);
    }

    @Override
    public void handleDelivery(
        String tag, Envelope envelope, AMQP.BasicProperties properties, byte[] body) {
      Delivery delivery = new Delivery(envelope, properties, body);
      Channel from = getChannel();
      loop.execute(() -> onDelivery(from, delivery));
    }

    @Override
    public void handleCancel(String tag) {
      loop.execute(() -> onCancelled(tag));
    }

    @Override
    public void handleCancelOk(String tag) {
      loop.execute(() -> onCancelOk(tag));
    }
  }
}
