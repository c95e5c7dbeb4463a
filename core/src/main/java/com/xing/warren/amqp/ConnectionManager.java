package com.xing.warren.amqp;

import static java.util.Objects.requireNonNull;

import com.rabbitmq.client.AlreadyClosedException;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import com.rabbitmq.client.ShutdownSignalException;
import com.xing.warren.Endpoint;
import com.xing.warren.util.Backoff;
import com.xing.warren.util.EventLoop;
import java.io.IOException;
import java.net.URISyntaxException;
import java.security.GeneralSecurityException;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the broker connection. Connection failures are never fatal: every failed attempt is
 * followed by a linear backoff and an attempt against the next endpoint, every unexpected close by
 * a short pause and a reconnect. Only {@link #shutdown()} ends the cycle.
 *
 * <p>All methods except the getters must be called on the event loop.
 */
public class ConnectionManager {

  /** Told about the connection becoming usable and going away. */
  public interface Listener {

    void connectionOpened(Connection connection);

    void connectionLost();
  }

  private static final Logger log = LoggerFactory.getLogger(ConnectionManager.class);

  private static final Listener NO_LISTENER =
      new Listener() {
        @Override
        public void connectionOpened(Connection connection) {}

        @Override
        public void connectionLost() {}
      };

  private final ConnectionFactory connectionFactory;
  private final EndpointRotator rotator;
  private final EventLoop loop;
  private final Backoff backoff;
  private final long reconnectDelayMillis;
  private final String connectionName;
  private final CompletableFuture<Void> terminated = new CompletableFuture<>();

  private Listener listener = NO_LISTENER;
  private volatile ConnectionState state = ConnectionState.DISCONNECTED;
  private volatile int retryCount = 1;
  private volatile boolean shutdownRequested;
  private Connection connection;
  private Endpoint endpoint;
  private Future<?> pendingReconnect;

  public ConnectionManager(
      ConnectionFactory connectionFactory,
      List<Endpoint> endpoints,
      EventLoop loop,
      Backoff backoff,
      long reconnectDelayMillis,
      String connectionName) {
    this.connectionFactory = requireNonNull(connectionFactory, "connectionFactory");
    this.rotator = new EndpointRotator(endpoints, this::getRetryCount);
    this.loop = requireNonNull(loop, "loop");
    this.backoff = requireNonNull(backoff, "backoff");
    this.reconnectDelayMillis = reconnectDelayMillis;
    this.connectionName = connectionName;
    // reconnection is handled here, the client must not recover on its own
    connectionFactory.setAutomaticRecoveryEnabled(false);
    connectionFactory.setTopologyRecoveryEnabled(false);
  }

  public void setListener(Listener listener) {
    this.listener = requireNonNull(listener, "listener");
  }

  public void connect() {
    if (shutdownRequested) {
      log.info("Shutdown requested, not connecting");
      terminate();
      return;
    }
    state = ConnectionState.CONNECTING;
    endpoint = rotator.next();
    log.info("Connecting endpoint={} attempt={}", endpoint, retryCount);

    final Connection opened;
    try {
      connectionFactory.setUri(endpoint.getUri());
      opened = connectionFactory.newConnection(connectionName);
    } catch (IOException
        | TimeoutException
        | GeneralSecurityException
        | URISyntaxException e) {
      onOpenError(e);
      return;
    }
    onOpen(opened);
  }

  private void onOpen(Connection opened) {
    log.info("Connection opened endpoint={}", endpoint);
    connection = opened;
    retryCount = 1;
    state = ConnectionState.OPEN;
    opened.addShutdownListener(cause -> loop.execute(() -> onClosed(opened, cause)));
    if (shutdownRequested) {
      closeConnection();
      return;
    }
    listener.connectionOpened(opened);
  }

  private void onOpenError(Exception error) {
    log.error("Connection open failed endpoint={} attempt={}", endpoint, retryCount, error);
    reconnect();
  }

  void onClosed(Connection closed, ShutdownSignalException cause) {
    if (closed != connection) {
      log.debug("Ignoring close of stale connection {}", closed);
      return;
    }
    connection = null;
    listener.connectionLost();
    if (shutdownRequested) {
      log.warn("Connection closed, stopping consumer reason={}", reason(cause));
      terminate();
    } else {
      log.warn(
          "Connection closed, reopening in {} ms reason={}", reconnectDelayMillis, reason(cause));
      state = ConnectionState.CONNECTING;
      pendingReconnect =
          loop.schedule(this::reconnect, reconnectDelayMillis, TimeUnit.MILLISECONDS);
    }
  }

  /** Waits out the backoff for the current retry count, then connects to the next endpoint. */
  void reconnect() {
    long delay = backoff.delayInMillis(retryCount);
    log.info("Sleeping before reconnect no_of_millis={} attempt={}", delay, retryCount);
    retryCount++;
    state = ConnectionState.CONNECTING;
    pendingReconnect = loop.schedule(this::connectAfterBackoff, delay, TimeUnit.MILLISECONDS);
  }

  private void connectAfterBackoff() {
    pendingReconnect = null;
    log.info("Reconnecting is_closing={}", shutdownRequested);
    if (shutdownRequested) {
      log.info("Connection is closing, cannot reconnect");
      terminate();
    } else {
      connect();
    }
  }

  /** Tears the connection down. Unless shutdown was requested a reconnect follows. */
  public void closeConnection() {
    if (connection == null
        || state == ConnectionState.CLOSING
        || state == ConnectionState.CLOSED) {
      log.info("Connection is closing or already closed state={}", state);
      return;
    }
    log.info("Closing connection state={}", state);
    state = ConnectionState.CLOSING;
    final Connection closing = connection;
    try {
      closing.close();
    } catch (AlreadyClosedException e) {
      log.debug("Connection {} already closed", closing);
    } catch (IOException e) {
      log.warn("Clean close of connection {} failed, aborting it", closing, e);
      closing.abort();
    }
  }

  /** Marks the shutdown as deliberate; no reconnect will be attempted from now on. */
  public void requestShutdown() {
    shutdownRequested = true;
    if (pendingReconnect != null) {
      pendingReconnect.cancel(false);
      pendingReconnect = null;
    }
  }

  /** Requests shutdown and closes the connection, or terminates at once if there is none. */
  public void shutdown() {
    requestShutdown();
    if (connection == null) {
      terminate();
    } else {
      closeConnection();
    }
  }

  private void terminate() {
    if (terminated.isDone()) {
      return;
    }
    state = ConnectionState.CLOSED;
    connection = null;
    log.info("Connection closed, consumer stopped");
    terminated.complete(null);
  }

  private static Object reason(ShutdownSignalException cause) {
    if (cause == null) {
      return null;
    }
    return cause.getReason() != null ? cause.getReason() : cause.getMessage();
  }

  public ConnectionState getState() {
    return state;
  }

  public int getRetryCount() {
    return retryCount;
  }

  public boolean isShutdownRequested() {
    return shutdownRequested;
  }

  public CompletionStage<Void> getTermination() {
    return terminated;
  }

  public EndpointRotator getRotator() {
    return rotator;
  }
}
