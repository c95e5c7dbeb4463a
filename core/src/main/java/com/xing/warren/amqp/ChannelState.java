package com.xing.warren.amqp;

/** Lifecycle of the consumer channel. Only meaningful while its connection is open. */
public enum ChannelState {
  UNOPENED,
  OPENING,
  OPEN,
  CLOSING,
  CLOSED;

  public boolean isOpen() {
    return this == OPEN;
  }
}
