package com.xing.warren.spring;

import com.xing.warren.LifecycleState;
import com.xing.warren.MessageConsumer;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

/**
 * Starts the consumer with the application context and stops it before the context closes. A
 * stopped consumer cannot be restarted, so a context restart after {@link #stop()} leaves it
 * stopped.
 */
public class WarrenConsumerLifecycle implements SmartLifecycle {

  private static final Logger log = LoggerFactory.getLogger(WarrenConsumerLifecycle.class);

  private final MessageConsumer consumer;
  private final boolean autoStartup;
  private final Duration shutdownTimeout;

  public WarrenConsumerLifecycle(
      MessageConsumer consumer, boolean autoStartup, Duration shutdownTimeout) {
    this.consumer = consumer;
    this.autoStartup = autoStartup;
    this.shutdownTimeout = shutdownTimeout;
  }

  @Override
  public void start() {
    LifecycleState state = consumer.getState();
    if (state == LifecycleState.STOPPING || state == LifecycleState.STOPPED) {
      log.warn("Not restarting consumer state={}, a stopped consumer cannot be started again", state);
      return;
    }
    consumer.start();
  }

  @Override
  public void stop() {
    consumer.stop();
    try {
      if (!consumer.awaitTermination(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
        log.warn("Consumer did not stop within {}", shutdownTimeout);
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.warn("Interrupted while waiting for the consumer to stop");
    }
  }

  @Override
  public boolean isRunning() {
    return consumer.getState().isRunning();
  }

  @Override
  public boolean isAutoStartup() {
    return autoStartup;
  }

  public MessageConsumer getConsumer() {
    return consumer;
  }
}
