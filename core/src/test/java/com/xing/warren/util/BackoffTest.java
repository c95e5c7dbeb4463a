package com.xing.warren.util;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class BackoffTest {

  @Test
  void defaultGrowsOneSecondPerAttempt() {
    assertEquals(1000, Backoff.DEFAULT.delayInMillis(1));
    assertEquals(2000, Backoff.DEFAULT.delayInMillis(2));
    assertEquals(7000, Backoff.DEFAULT.delayInMillis(7));
  }

  @Test
  void ceilingCapsDelay() {
    Backoff capped = Backoff.DEFAULT.withCeiling(5, TimeUnit.SECONDS);
    assertEquals(3000, capped.delayInMillis(3));
    assertEquals(5000, capped.delayInMillis(5));
    assertEquals(5000, capped.delayInMillis(60));
  }

  @Test
  void zeroCeilingLeavesDelayUncapped() {
    Backoff uncapped = Backoff.DEFAULT.withCeiling(0, TimeUnit.SECONDS);
    assertEquals(100_000, uncapped.delayInMillis(100));
  }

  @Test
  void fixedIgnoresAttempt() {
    Backoff fixed = Backoff.fixed(250, TimeUnit.MILLISECONDS);
    assertEquals(250, fixed.delayInMillis(1));
    assertEquals(250, fixed.delayInMillis(42));
  }
}
