package com.xing.warren.amqp;

import static java.util.Objects.requireNonNull;

import com.rabbitmq.client.AlreadyClosedException;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ShutdownSignalException;
import com.xing.warren.Exchange;
import com.xing.warren.Queue;
import com.xing.warren.util.EventLoop;
import java.io.IOException;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Opens the consumer channel on a fresh connection and declares the topology: exchange, queue,
 * binding. Each step starts only after the broker confirmed the previous one.
 *
 * <p>A failing step or any close of the channel not requested through {@link #close()} closes the
 * whole connection, so the {@link ConnectionManager} reconnects from scratch. A declaration the
 * broker refuses, e.g. because the exchange exists with another type, surfaces the same way.
 */
public class ChannelManager implements ConnectionManager.Listener {

  /** Told about the channel being ready for consuming and going away. */
  public interface Listener {

    void channelReady(Channel channel);

    void channelLost();
  }

  private static final Logger log = LoggerFactory.getLogger(ChannelManager.class);

  private static final Listener NO_LISTENER =
      new Listener() {
        @Override
        public void channelReady(Channel channel) {}

        @Override
        public void channelLost() {}
      };

  private final ConnectionManager connectionManager;
  private final Queue queue;
  private final EventLoop loop;

  private Listener listener = NO_LISTENER;
  private volatile ChannelState state = ChannelState.UNOPENED;
  private Channel channel;

  public ChannelManager(ConnectionManager connectionManager, Queue queue, EventLoop loop) {
    this.connectionManager = requireNonNull(connectionManager, "connectionManager");
    this.queue = requireNonNull(queue, "queue");
    this.loop = requireNonNull(loop, "loop");
  }

  public void setListener(Listener listener) {
    this.listener = requireNonNull(listener, "listener");
  }

  @Override
  public void connectionOpened(Connection connection) {
    openChannel(connection);
  }

  @Override
  public void connectionLost() {
    if (channel != null || state != ChannelState.UNOPENED) {
      log.debug("Connection gone, invalidating channel state={}", state);
      state = ChannelState.CLOSED;
    }
    channel = null;
    listener.channelLost();
  }

  void openChannel(Connection connection) {
    log.info("Creating a new channel");
    state = ChannelState.OPENING;
    final Channel opened;
    try {
      opened = connection.createChannel();
      if (opened == null) {
        throw new IOException("No channel number available on " + connection);
      }
    } catch (IOException | AlreadyClosedException e) {
      fail("channel open", e);
      return;
    }
    channel = opened;
    state = ChannelState.OPEN;
    log.info("Channel opened channel={}", opened.getChannelNumber());
    log.info("Adding channel close callback");
    opened.addShutdownListener(cause -> loop.execute(() -> onChannelClosed(opened, cause)));

    try {
      declareExchange(opened);
      declareQueue(opened);
      bindQueue(opened);
    } catch (IOException | AlreadyClosedException e) {
      fail("topology declaration", e);
      return;
    }

    if (connectionManager.isShutdownRequested()) {
      log.info("Shutdown requested while setting up the channel, closing it");
      close();
      return;
    }
    listener.channelReady(opened);
  }

  private void declareExchange(Channel ch) throws IOException {
    Exchange exchange = queue.getExchange();
    log.info(
        "Declaring exchange name={} type={} durable={}",
        exchange.getName(),
        exchange.getType(),
        exchange.isDurable());
    ch.exchangeDeclare(exchange.getName(), exchange.getType(), exchange.isDurable());
    log.info("Exchange declared");
  }

  private void declareQueue(Channel ch) throws IOException {
    log.info("Declaring queue name={} durable={}", queue.getName(), queue.isDurable());
    ch.queueDeclare(queue.getName(), queue.isDurable(), false, false, null);
  }

  private void bindQueue(Channel ch) throws IOException {
    log.info(
        "Binding to rabbit exchange={} queue={} routing_key={}",
        queue.getExchangeName(),
        queue.getName(),
        queue.getRoutingKey());
    ch.queueBind(queue.getName(), queue.getExchangeName(), queue.getRoutingKey());
    log.info("Queue bound");
  }

  private void fail(String step, Exception error) {
    log.error("Channel setup failed at {}, closing connection", step, error);
    state = ChannelState.CLOSED;
    channel = null;
    connectionManager.closeConnection();
  }

  void onChannelClosed(Channel closed, ShutdownSignalException cause) {
    if (closed != channel || state == ChannelState.CLOSED) {
      log.debug("Ignoring close of stale channel {}", closed);
      return;
    }
    if (state == ChannelState.CLOSING) {
      log.info("Channel closed channel={}", closed.getChannelNumber());
    } else {
      log.warn(
          "Channel was closed channel={} reason={}",
          closed.getChannelNumber(),
          cause != null ? cause.getReason() : null);
    }
    channelGone();
  }

  private void channelGone() {
    state = ChannelState.CLOSED;
    channel = null;
    listener.channelLost();
    connectionManager.closeConnection();
  }

  /** Closes the channel cleanly. The connection is closed once the broker confirmed. */
  public void close() {
    if (channel == null || state != ChannelState.OPEN) {
      log.info("Channel is not open state={}", state);
      return;
    }
    log.info("Closing the channel");
    state = ChannelState.CLOSING;
    try {
      channel.close();
    } catch (AlreadyClosedException e) {
      log.debug("Channel {} already closed", channel);
    } catch (IOException | TimeoutException e) {
      log.warn("Clean close of channel failed", e);
      channelGone();
    }
  }

  public ChannelState getState() {
    return state;
  }

  public Channel getChannel() {
    return channel;
  }
}
