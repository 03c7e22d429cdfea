package com.orderpipeline.infra.kafka.errors;

import java.time.Duration;
import java.util.Objects;

public class ExponentialBackoffRetryPolicy implements RetryPolicy {
  private final int maxRetries;
  private final Duration initialBackoff;
  private final Duration maxBackoff;
  private final double multiplier;

  public ExponentialBackoffRetryPolicy(
      int maxRetries, Duration initialBackoff, Duration maxBackoff, double multiplier) {
    this.maxRetries = Math.max(0, maxRetries);
    this.initialBackoff = Objects.requireNonNull(initialBackoff, "initialBackoff must not be null");
    this.maxBackoff = Objects.requireNonNull(maxBackoff, "maxBackoff must not be null");
    this.multiplier = Math.max(1.0d, multiplier);
  }

  @Override
  public int maxRetries() {
    return maxRetries;
  }

  @Override
  public Duration backoffForRetry(int retryNumber) {
    long initialMillis = Math.max(0L, initialBackoff.toMillis());
    long maxMillis = Math.max(initialMillis, maxBackoff.toMillis());
    if (initialMillis == 0L) {
      return Duration.ZERO;
    }

    int exponent = Math.max(0, retryNumber - 1);
    double scaled = initialMillis * Math.pow(multiplier, exponent);
    long bounded = (long) Math.min(maxMillis, scaled);
    return Duration.ofMillis(Math.max(0L, bounded));
  }
}
