package com.orderpipeline.domain.orders;

import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

public class InMemoryRetryLedger implements RetryLedger {
  private final ConcurrentMap<String, Integer> attemptsByOrderId = new ConcurrentHashMap<>();

  @Override
  public int attempts(String orderId) {
    return attemptsByOrderId.getOrDefault(requireOrderId(orderId), 0);
  }

  @Override
  public void record(String orderId, int attempts) {
    if (attempts < 0) {
      throw new IllegalArgumentException("attempts must be >= 0");
    }
    attemptsByOrderId.put(requireOrderId(orderId), attempts);
  }

  @Override
  public void clear(String orderId) {
    attemptsByOrderId.remove(requireOrderId(orderId));
  }

  @Override
  public FailureRegistration registerFailure(String orderId, int maxRetries) {
    FailureRegistration[] outcome = new FailureRegistration[1];
    attemptsByOrderId.compute(
        requireOrderId(orderId),
        (key, current) -> {
          int previous = current == null ? 0 : current;
          if (previous < maxRetries) {
            outcome[0] = FailureRegistration.retry(previous);
            return previous + 1;
          }
          outcome[0] = FailureRegistration.exhausted(previous);
          return current;
        });
    return outcome[0];
  }

  int size() {
    return attemptsByOrderId.size();
  }

  private static String requireOrderId(String orderId) {
    return Objects.requireNonNull(orderId, "orderId must not be null");
  }
}
