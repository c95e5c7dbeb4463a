package com.xing.warren.util;

import java.util.concurrent.Executor;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Serial executor every broker callback and state transition of a consumer runs on. Tasks run one
 * at a time in submission order; delayed tasks are scheduled, never slept on.
 */
public interface EventLoop extends Executor {

  Future<?> schedule(Runnable task, long delay, TimeUnit unit);

  void shutdown();
}
