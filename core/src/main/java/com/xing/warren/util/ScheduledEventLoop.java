package com.xing.warren.util;

import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** {@link EventLoop} backed by a single daemon thread. */
public class ScheduledEventLoop implements EventLoop {

  private static final Logger log = LoggerFactory.getLogger(ScheduledEventLoop.class);

  private static final AtomicInteger loopNumber = new AtomicInteger(1);

  private final ScheduledExecutorService executor;

  public ScheduledEventLoop() {
    this("warren-loop-" + loopNumber.getAndIncrement());
  }

  public ScheduledEventLoop(String threadName) {
    ThreadFactory threadFactory =
        r -> {
          Thread thread = new Thread(r, threadName);
          thread.setDaemon(true);
          return thread;
        };
    ScheduledThreadPoolExecutor scheduler = new ScheduledThreadPoolExecutor(1, threadFactory);
    scheduler.setRemoveOnCancelPolicy(true);
    this.executor = scheduler;
  }

  @Override
  public void execute(Runnable task) {
    executor.execute(guarded(task));
  }

  @Override
  public Future<?> schedule(Runnable task, long delay, TimeUnit unit) {
    return executor.schedule(guarded(task), delay, unit);
  }

  @Override
  public void shutdown() {
    executor.shutdown();
  }

  public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
    return executor.awaitTermination(timeout, unit);
  }

  // scheduled tasks report failures only through their future, which nobody reads
  private static Runnable guarded(Runnable task) {
    return () -> {
      try {
        task.run();
      } catch (RuntimeException | Error e) {
        log.error("Event loop task {} failed", task, e);
      }
    };
  }
}
