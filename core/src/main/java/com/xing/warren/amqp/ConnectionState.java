package com.xing.warren.amqp;

public enum ConnectionState {
  DISCONNECTED,
  CONNECTING,
  OPEN,
  CLOSING,
  CLOSED;

  public boolean isOpen() {
    return this == OPEN;
  }
}
