package com.xing.warren.util;

import java.util.concurrent.TimeUnit;

/** Delay before a reconnect, as a function of the number of the failed attempt. */
@FunctionalInterface
public interface Backoff {

  Backoff DEFAULT = linear(1, TimeUnit.SECONDS);

  static Backoff linear(long delay, TimeUnit unit) {
    return attempt -> attempt * unit.toMillis(delay);
  }

  static Backoff fixed(long delay, TimeUnit unit) {
    return attempt -> unit.toMillis(delay);
  }

  long delayInMillis(int attempt);

  /** Caps the delay at {@code max}; a non-positive value leaves the policy uncapped. */
  default Backoff withCeiling(long max, TimeUnit unit) {
    long maxMillis = unit.toMillis(max);
    if (maxMillis <= 0) {
      return this;
    }
    return attempt -> Math.min(delayInMillis(attempt), maxMillis);
  }
}
