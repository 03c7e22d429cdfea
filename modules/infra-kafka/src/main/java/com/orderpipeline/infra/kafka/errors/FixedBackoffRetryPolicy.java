package com.orderpipeline.infra.kafka.errors;

import java.time.Duration;
import java.util.Objects;

public class FixedBackoffRetryPolicy implements RetryPolicy {
  private final int maxRetries;
  private final Duration backoff;

  public FixedBackoffRetryPolicy(int maxRetries, Duration backoff) {
    this.maxRetries = Math.max(0, maxRetries);
    this.backoff = Objects.requireNonNull(backoff, "backoff must not be null");
  }

  @Override
  public int maxRetries() {
    return maxRetries;
  }

  @Override
  public Duration backoffForRetry(int retryNumber) {
    return backoff;
  }
}
