package com.xing.warren.spring;

import com.xing.warren.ConsumerConfiguration;
import com.xing.warren.Exchange;
import com.xing.warren.Queue;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.springframework.boot.context.properties.ConfigurationProperties;

/** {@code warren.*} properties, the Spring counterpart of the {@code WARREN_*} variables. */
@ConfigurationProperties(prefix = "warren")
public class WarrenProperties {

  /** Broker urls, tried in order. Defaults to a local broker. */
  private List<String> servers = new ArrayList<>();

  private String exchange;

  private String exchangeType = Exchange.DEFAULT_TYPE;

  private boolean durableExchange = true;

  private String queue;

  private boolean durableQueue = true;

  /** Binding key, defaults to the queue name. */
  private String routingKey;

  /** Reject deliveries without a tx_id header. */
  private boolean checkTxId = true;

  private boolean nackRequeue = true;

  /** Pause after an unexpected connection loss before reconnecting. */
  private Duration reconnectDelay = Duration.ofSeconds(3);

  /** Ceiling of the reconnect backoff, zero for none. */
  private Duration maxBackoff = Duration.ZERO;

  private String quarantineQueue;

  private String connectionName = "warren-consumer";

  /** Start consuming with the application context. */
  private boolean autoStartup = true;

  /** How long a context shutdown waits for the consumer to close its connection. */
  private Duration shutdownTimeout = Duration.ofSeconds(10);

  ConsumerConfiguration toConfiguration() {
    if (exchange == null || queue == null) {
      throw new IllegalStateException("warren.exchange and warren.queue must be set");
    }
    ConsumerConfiguration.Builder builder =
        ConsumerConfiguration.builder()
            .queue(
                Queue.builder()
                    .name(queue)
                    .routingKey(routingKey)
                    .durable(durableQueue)
                    .exchange(
                        Exchange.builder()
                            .name(exchange)
                            .type(exchangeType)
                            .durable(durableExchange)
                            .build()))
            .checkTxId(checkTxId)
            .nackRequeue(nackRequeue)
            .reconnectDelay(reconnectDelay.toMillis(), TimeUnit.MILLISECONDS)
            .maxBackoff(maxBackoff.toMillis(), TimeUnit.MILLISECONDS)
            .quarantineQueue(quarantineQueue)
            .connectionName(connectionName);
    servers.forEach(builder::addBroker);
    return builder.build();
  }

  public List<String> getServers() {
    return servers;
  }

  public void setServers(List<String> servers) {
    this.servers = servers;
  }

  public String getExchange() {
    return exchange;
  }

  public void setExchange(String exchange) {
    this.exchange = exchange;
  }

  public String getExchangeType() {
    return exchangeType;
  }

  public void setExchangeType(String exchangeType) {
    this.exchangeType = exchangeType;
  }

  public boolean isDurableExchange() {
    return durableExchange;
  }

  public void setDurableExchange(boolean durableExchange) {
    this.durableExchange = durableExchange;
  }

  public String getQueue() {
    return queue;
  }

  public void setQueue(String queue) {
    this.queue = queue;
  }

  public boolean isDurableQueue() {
    return durableQueue;
  }

  public void setDurableQueue(boolean durableQueue) {
    this.durableQueue = durableQueue;
  }

  public String getRoutingKey() {
    return routingKey;
  }

  public void setRoutingKey(String routingKey) {
    this.routingKey = routingKey;
  }

  public boolean isCheckTxId() {
    return checkTxId;
  }

  public void setCheckTxId(boolean checkTxId) {
    this.checkTxId = checkTxId;
  }

  public boolean isNackRequeue() {
    return nackRequeue;
  }

  public void setNackRequeue(boolean nackRequeue) {
    this.nackRequeue = nackRequeue;
  }

  public Duration getReconnectDelay() {
    return reconnectDelay;
  }

  public void setReconnectDelay(Duration reconnectDelay) {
    this.reconnectDelay = reconnectDelay;
  }

  public Duration getMaxBackoff() {
    return maxBackoff;
  }

  public void setMaxBackoff(Duration maxBackoff) {
    this.maxBackoff = maxBackoff;
  }

  public String getQuarantineQueue() {
    return quarantineQueue;
  }

  public void setQuarantineQueue(String quarantineQueue) {
    this.quarantineQueue = quarantineQueue;
  }

  public String getConnectionName() {
    return connectionName;
  }

  public void setConnectionName(String connectionName) {
    this.connectionName = connectionName;
  }

  public boolean isAutoStartup() {
    return autoStartup;
  }

  public void setAutoStartup(boolean autoStartup) {
    this.autoStartup = autoStartup;
  }

  public Duration getShutdownTimeout() {
    return shutdownTimeout;
  }

  public void setShutdownTimeout(Duration shutdownTimeout) {
    this.shutdownTimeout = shutdownTimeout;
  }
}
