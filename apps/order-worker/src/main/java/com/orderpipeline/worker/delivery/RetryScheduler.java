package com.orderpipeline.worker.delivery;

import java.time.Duration;

public interface RetryScheduler {
  void schedule(Duration delay, Runnable task);
}
