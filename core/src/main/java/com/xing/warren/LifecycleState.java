package com.xing.warren;

/** Lifecycle of a {@link MessageConsumer}. A consumer moves forward only. */
public enum LifecycleState {
  UNINITIALIZED,
  STARTED,
  STOPPING,
  STOPPED;

  public boolean isRunning() {
    return this == STARTED;
  }
}
