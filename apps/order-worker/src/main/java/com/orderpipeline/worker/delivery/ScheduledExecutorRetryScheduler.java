package com.orderpipeline.worker.delivery;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

public class ScheduledExecutorRetryScheduler implements RetryScheduler, SmartLifecycle, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(ScheduledExecutorRetryScheduler.class);

  static final String THREAD_NAME = "order-retry-scheduler";

  private final ScheduledExecutorService scheduler;
  private final Duration drainTimeout;
  private final AtomicInteger pending = new AtomicInteger();
  private final AtomicBoolean stopped = new AtomicBoolean(false);

  public ScheduledExecutorRetryScheduler(Duration drainTimeout) {
    this.drainTimeout = Objects.requireNonNull(drainTimeout, "drainTimeout must not be null");
    this.scheduler =
        Executors.newSingleThreadScheduledExecutor(
            new ThreadFactory() {
              @Override
              public Thread newThread(Runnable runnable) {
                return new Thread(runnable, THREAD_NAME);
              }
            });
  }

  @Override
  public void schedule(Duration delay, Runnable task) {
    Objects.requireNonNull(task, "task must not be null");
    long delayMillis = delay == null ? 0L : Math.max(0L, delay.toMillis());
    pending.incrementAndGet();
    try {
      scheduler.schedule(() -> runTask(task), delayMillis, TimeUnit.MILLISECONDS);
    } catch (RejectedExecutionException ex) {
      pending.decrementAndGet();
      log.warn("Retry scheduler stopped, retry publish abandoned delay_ms={}", delayMillis);
    }
  }

  int pending() {
    return pending.get();
  }

  @Override
  public void start() {}

  @Override
  public void stop() {
    if (!stopped.compareAndSet(false, true)) {
      return;
    }
    scheduler.shutdown();
    try {
      if (scheduler.awaitTermination(Math.max(0L, drainTimeout.toMillis()), TimeUnit.MILLISECONDS)) {
        log.info("Retry scheduler drained");
        return;
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
    }
    List<Runnable> abandoned = scheduler.shutdownNow();
    pending.addAndGet(-abandoned.size());
    log.warn(
        "Retry scheduler stopped with pending retries abandoned abandoned_count={} drain_timeout_ms={}",
        abandoned.size(),
        drainTimeout.toMillis());
  }

  @Override
  public boolean isRunning() {
    return !stopped.get();
  }

  // Highest phase, so the bean must depend on the producer it publishes through.
  @Override
  public int getPhase() {
    return Integer.MAX_VALUE;
  }

  @Override
  public void close() {
    stop();
  }

  private void runTask(Runnable task) {
    try {
      task.run();
    } catch (RuntimeException ex) {
      log.error("Scheduled retry publish failed", ex);
    } finally {
      pending.decrementAndGet();
    }
  }
}
