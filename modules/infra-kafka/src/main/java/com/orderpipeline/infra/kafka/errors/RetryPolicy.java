package com.orderpipeline.infra.kafka.errors;

import java.time.Duration;

public interface RetryPolicy {
  int maxRetries();

  Duration backoffForRetry(int retryNumber);

  default boolean isRetryable(Exception exception) {
    return true;
  }
}
